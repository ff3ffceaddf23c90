package ru.oparin.stickers.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Закрытая таксономия категорий серий стикеров.
 */
@Getter
@RequiredArgsConstructor
public enum CategoryTag {
    CUTE("cute", "cute, lovely characters"),
    DAILY("daily", "everyday life, staying home, resting, slacking off"),
    WORK("work", "office, job, commuting, work tasks"),
    LOVE("love", "romance, love, couples, flirting"),
    FUNNY("funny", "funny, humor, gags"),
    ANIMAL("animal", "animal characters (cat, dog, rabbit, etc.)"),
    FOOD("food", "food, eating, cooking"),
    SEASONAL("seasonal", "seasons and holidays (Christmas, New Year, summer, winter)");

    /**
     * Категория по умолчанию при любой ошибке классификации.
     */
    public static final CategoryTag DEFAULT = DAILY;

    private final String slug;
    private final String hint;

    public static Optional<CategoryTag> fromSlug(String slug) {
        if (slug == null) {
            return Optional.empty();
        }
        for (CategoryTag tag : values()) {
            if (tag.slug.equals(slug.trim())) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }
}
