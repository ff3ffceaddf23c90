package ru.oparin.stickers.model.dto.generation;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Указание сохранить результат пакета как серию. Владелец и описание персонажа задаются только вместе.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Параметры сохранения серии")
public class PersistenceDirective {

    @NotNull(message = "Не указан владелец серии")
    @Schema(description = "Идентификатор владельца", example = "7")
    private Long ownerId;

    @NotBlank(message = "Не указано описание персонажа")
    @Schema(description = "Описание персонажа", example = "white cat with round glasses")
    private String character;
}
