package ru.oparin.stickers.model.dto.scene;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Запрос на разбивку темы серии на позы")
public class SceneBreakdownRequest {

    @NotBlank(message = "Не указано описание персонажа")
    @Schema(description = "Описание персонажа", example = "white cat with round glasses")
    private String character;

    @NotBlank(message = "Не указана тема")
    @Schema(description = "Тема серии", example = "monday at the office")
    private String theme;
}
