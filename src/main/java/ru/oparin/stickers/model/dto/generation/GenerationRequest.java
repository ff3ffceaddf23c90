package ru.oparin.stickers.model.dto.generation;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.stickers.model.enums.GenerationMode;

import java.util.List;

/**
 * Запрос на пакетную генерацию стикеров.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Запрос на пакетную генерацию стикеров с единым персонажем")
public class GenerationRequest {

    @Schema(description = "Идентификатор обученной модели стиля (lora_models.id)", example = "42")
    @JsonAlias("id")
    private Long modelId;

    @Builder.Default
    @Schema(description = "Режим генерации: text2img, img2img, preview, batch", example = "text2img")
    private GenerationMode mode = GenerationMode.TEXT_TO_IMAGE;

    @Schema(description = "Промпты поз/сцен. Обязательны для text2img/preview/batch, в img2img опциональны по элементам",
            example = "[\"sitting and smiling\"]")
    private List<String> prompts;

    @Schema(description = "Исходные изображения (data URL base64) для img2img")
    private List<String> images;

    @Schema(description = "Тема серии", example = "cafe")
    private String theme;

    @Schema(description = "Вариант стиля: pencil или pen", example = "pen")
    private String style;

    @Builder.Default
    @Schema(description = "Только черно-белый рисунок", example = "true")
    @JsonAlias("monochromeOnly")
    private boolean monochrome = true;

    @Schema(description = "Названия элементов (эмоций), выровненные по индексам промптов")
    @JsonAlias("emotionNames")
    private List<String> titles;

    @Valid
    @Schema(description = "Параметры сохранения серии. Если не указаны, результат не сохраняется")
    private PersistenceDirective persistence;
}
