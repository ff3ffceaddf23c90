package ru.oparin.stickers.model.dto.generation;

import lombok.Value;

/**
 * Один элемент пакета: индекс и промпт и/или исходное изображение.
 */
@Value
public class GenerationItem {
    int index;
    String prompt;
    String sourceImage;

    public boolean hasPrompt() {
        return prompt != null && !prompt.isBlank();
    }
}
