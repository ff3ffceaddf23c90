package ru.oparin.stickers.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.stickers.model.dto.generation.GenerationItem;
import ru.oparin.stickers.model.enums.GenerationMode;
import ru.oparin.stickers.model.enums.SketchStyle;

/**
 * Сборка итогового промпта генерации.
 * <p>
 * Промпт состоит из переведенного описания позы, контекста темы, префикса стиля,
 * фиксированного блока визуальных ограничений и цветового режима. Блок ограничений
 * одинаков для всех элементов пакета, поэтому персонаж получается узнаваемым на всех стикерах.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromptCompiler {

    static final String OUTLINE_CONSTRAINTS = "strong black outlines, bold black borders, "
            + "thick black contour lines, clear black edges";

    static final String MONOCHROME_CLAUSE = "black and white only, grayscale shading, NO colors, "
            + "monochrome line art, pencil hatching for shadows, simple gray tones, NO blush, NO blushing";

    static final String COLOR_CLAUSE = "colorful, vibrant colors, soft pastel tones";

    static final String TEXT_BODY_CONSTRAINTS = "chibi proportions with slightly bigger head, compact body, "
            + "very short stubby limbs, small arms and legs, NO tall body, NO long limbs, "
            + "asymmetric wonky proportions, crooked uneven features, lopsided asymmetric face, "
            + "simple flat dash eyes (- -) or simple dot eyes (• •), NO round eyes, NO circular pupils, "
            + "NO eyeballs, NO shiny eyes";

    static final String IMAGE_BODY_CONSTRAINTS = "chibi proportions with slightly bigger head, compact body, "
            + "very short stubby limbs, small arms and legs, NO tall body, NO long limbs, "
            + "with small simple flat eyes (NO sparkling or shining eyes, NO round pupils), "
            + "asymmetric crooked face shape, wonky irregular proportions, imperfect shapes, casual drawing";

    static final String TAIL_CONSTRAINT = "absolutely NO long tail, short stubby tail only or no tail";

    static final String TEXT_FINISH = "imperfect hand-drawn shapes, loose strokes, white background";

    static final String IMAGE_FINISH = "loose strokes, white background";

    private final TranslationCache translationCache;

    /**
     * Собрать промпт для элемента пакета. Описание позы и тема переводятся через кэш переводов.
     *
     * @param item       элемент пакета
     * @param mode       режим генерации
     * @param style      стиль рисунка или null
     * @param theme      тема серии или null
     * @param monochrome только черно-белая гамма
     * @return итоговый промпт
     */
    public Mono<String> compile(GenerationItem item, GenerationMode mode, SketchStyle style,
                                String theme, boolean monochrome) {
        if (!item.hasPrompt()) {
            return Mono.just(compose(null, null, mode, style, monochrome));
        }
        boolean withTheme = appliesTheme(mode, theme);
        Mono<String> subject = translationCache.translate(item.getPrompt());
        Mono<String> themeContext = withTheme ? translationCache.translate(theme) : Mono.just("");

        return subject.zipWith(themeContext)
                .map(pair -> compose(pair.getT1(), withTheme ? pair.getT2() : null, mode, style, monochrome))
                .doOnNext(prompt -> log.debug("Промпт для элемента {}: {}", item.getIndex(), prompt));
    }

    /**
     * Детерминированная сборка промпта из уже переведенных частей.
     *
     * @param subject    описание позы или null (только для image-to-image)
     * @param theme      контекст темы или null
     * @param mode       режим генерации
     * @param style      стиль рисунка или null
     * @param monochrome только черно-белая гамма
     * @return итоговый промпт
     */
    public String compose(String subject, String theme, GenerationMode mode, SketchStyle style, boolean monochrome) {
        boolean textToImage = mode.isTextToImage();
        StringBuilder prompt = new StringBuilder();

        if (subject != null && !subject.isBlank()) {
            prompt.append(subject);
            if (theme != null && !theme.isBlank()) {
                prompt.append(", in context of ").append(theme);
            }
            prompt.append(", ");
        }

        prompt.append(stylePrefix(style, textToImage)).append(", ")
                .append(OUTLINE_CONSTRAINTS).append(", ")
                .append(monochrome ? MONOCHROME_CLAUSE : COLOR_CLAUSE).append(", ");

        if (textToImage) {
            prompt.append(TEXT_BODY_CONSTRAINTS).append(", ")
                    .append(TAIL_CONSTRAINT).append(", ")
                    .append(TEXT_FINISH);
        } else {
            prompt.append(IMAGE_BODY_CONSTRAINTS).append(", ")
                    .append(TAIL_CONSTRAINT).append(", ")
                    .append(IMAGE_FINISH);
        }
        return prompt.toString();
    }

    /**
     * В text-to-image тема добавляется только в пакетном режиме,
     * в image-to-image добавляется всегда, если задана.
     */
    boolean appliesTheme(GenerationMode mode, String theme) {
        if (theme == null || theme.isBlank()) {
            return false;
        }
        return mode.isTextToImage() ? mode.isBatch() : true;
    }

    private String stylePrefix(SketchStyle style, boolean textToImage) {
        if (style != null) {
            return style.getPromptPrefix();
        }
        return textToImage ? SketchStyle.DEFAULT_TEXT_PREFIX : SketchStyle.DEFAULT_IMAGE_PREFIX;
    }
}
