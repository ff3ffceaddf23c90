package ru.oparin.stickers.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Варианты стиля рисунка и их префиксы промпта.
 */
@Getter
@RequiredArgsConstructor
public enum SketchStyle {

    PENCIL("pencil", "soft pencil sketch, light graphite strokes, gentle pencil shading, delicate line art, "
            + "thin sketchy lines, subtle pencil texture, hand-drawn with soft strokes, loose pencil drawing, "
            + "light sketchy style, faint outlines"),

    PEN("pen", "VERY BOLD thick black marker pen, EXTREMELY STRONG ink outlines, HEAVY black borders, "
            + "THICK chunky pen strokes, bold cartoon style, SOLID black lines, confident bold ink drawing, "
            + "thick marker technique, HEAVY pen pressure, STRONG contrast, clean bold style");

    /**
     * Префикс для text-to-image, если стиль не выбран.
     */
    public static final String DEFAULT_TEXT_PREFIX = "hand-drawn sketch with marker pen strokes, pencil texture, "
            + "rough line art style, thick uneven marker lines, casual pencil shading, sketchy stroke-based drawing";

    /**
     * Префикс для image-to-image, если стиль не выбран.
     */
    public static final String DEFAULT_IMAGE_PREFIX = "rough doodle sketch, messy hand-drawn lines, sketchy unpolished style";

    private final String code;
    private final String promptPrefix;

    /**
     * Найти стиль по коду.
     *
     * @param code код стиля (pencil, pen)
     * @return стиль или null, если код пустой
     * @throws IllegalArgumentException если стиль неизвестен
     */
    public static SketchStyle fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (SketchStyle style : values()) {
            if (style.code.equalsIgnoreCase(code)) {
                return style;
            }
        }
        throw new IllegalArgumentException("Неизвестный стиль: " + code);
    }
}
