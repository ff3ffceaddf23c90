package ru.oparin.stickers.model.dto.scene;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Позы, полученные из темы серии")
public class SceneBreakdownResponse {

    @Schema(description = "Описания поз, по одному на сцену")
    private List<String> scenes;

    private String character;

    private String theme;
}
