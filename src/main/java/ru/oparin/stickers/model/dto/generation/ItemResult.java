package ru.oparin.stickers.model.dto.generation;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Результат обработки одного элемента пакета. Индекс совпадает с индексом во входном списке.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Результат генерации одного элемента")
public class ItemResult {

    @Schema(description = "Индекс элемента во входном списке", example = "0")
    private int index;

    @Schema(description = "Исходный промпт элемента")
    private String prompt;

    @Schema(description = "Успешно ли сгенерирован элемент")
    private boolean success;

    @Schema(description = "URL итогового изображения от сервиса синтеза")
    private String generatedUrl;

    @Schema(description = "Канонический PNG (data URL) на белом фоне. Отсутствует, если нормализация не удалась")
    private String normalizedImage;

    @Schema(description = "Причина ошибки для неуспешного элемента")
    private String error;

    public static ItemResult success(GenerationItem item, String generatedUrl, String normalizedImage) {
        return ItemResult.builder()
                .index(item.getIndex())
                .prompt(item.getPrompt())
                .success(true)
                .generatedUrl(generatedUrl)
                .normalizedImage(normalizedImage)
                .build();
    }

    public static ItemResult failure(GenerationItem item, String reason) {
        return ItemResult.builder()
                .index(item.getIndex())
                .prompt(item.getPrompt())
                .success(false)
                .error(reason)
                .build();
    }

    /**
     * Элемент успешен и имеет нормализованное изображение для сохранения.
     */
    public boolean isStorable() {
        return success && normalizedImage != null;
    }
}
