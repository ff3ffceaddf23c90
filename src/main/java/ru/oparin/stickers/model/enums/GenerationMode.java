package ru.oparin.stickers.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.RequiredArgsConstructor;

/**
 * Режимы пакетной генерации.
 * PREVIEW и BATCH являются вариантами text-to-image.
 */
@RequiredArgsConstructor
public enum GenerationMode {

    /**
     * Генерация по тексту в два прохода (синтез и уточнение).
     */
    TEXT_TO_IMAGE("text2img"),

    /**
     * Перерисовка загруженных изображений за один проход.
     */
    IMAGE_TO_IMAGE("img2img"),

    /**
     * Быстрый text-to-image без прохода уточнения.
     */
    PREVIEW("preview"),

    /**
     * Text-to-image с учетом темы серии в промпте.
     */
    BATCH("batch");

    private final String code;

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Найти режим по коду запроса или имени константы.
     *
     * @param value код режима (text2img, img2img, preview, batch)
     * @return режим или TEXT_TO_IMAGE, если значение пустое
     * @throws IllegalArgumentException если режим неизвестен
     */
    @JsonCreator
    public static GenerationMode fromCode(String value) {
        if (value == null || value.isBlank()) {
            return TEXT_TO_IMAGE;
        }
        for (GenerationMode mode : values()) {
            if (mode.code.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Неизвестный режим генерации: " + value);
    }

    public boolean isTextToImage() {
        return this != IMAGE_TO_IMAGE;
    }

    public boolean isPreview() {
        return this == PREVIEW;
    }

    public boolean isBatch() {
        return this == BATCH;
    }
}
