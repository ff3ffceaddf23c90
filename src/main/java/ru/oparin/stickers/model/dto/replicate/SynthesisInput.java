package ru.oparin.stickers.model.dto.replicate;

import lombok.Builder;
import lombok.Value;

/**
 * Переменная часть вызова синтеза: промпт, опциональное исходное изображение и сила влияния промпта.
 */
@Value
@Builder
public class SynthesisInput {
    String prompt;
    String image;
    Double promptStrength;

    public static SynthesisInput textOnly(String prompt) {
        return SynthesisInput.builder().prompt(prompt).build();
    }

    public static SynthesisInput withImage(String prompt, String image, double promptStrength) {
        return SynthesisInput.builder()
                .prompt(prompt)
                .image(image)
                .promptStrength(promptStrength)
                .build();
    }
}
