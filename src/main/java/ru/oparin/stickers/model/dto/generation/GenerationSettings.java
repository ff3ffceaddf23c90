package ru.oparin.stickers.model.dto.generation;

import lombok.Builder;
import lombok.Value;
import ru.oparin.stickers.model.enums.GenerationMode;
import ru.oparin.stickers.model.enums.SketchStyle;

/**
 * Общие для всех элементов пакета параметры генерации, уже проверенные и разрешенные.
 */
@Value
@Builder
public class GenerationSettings {
    String modelReference;
    GenerationMode mode;
    SketchStyle style;
    String theme;
    boolean monochrome;
}
