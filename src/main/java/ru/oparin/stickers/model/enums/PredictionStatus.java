package ru.oparin.stickers.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Статусы предсказания Replicate.
 */
public enum PredictionStatus {
    STARTING,
    PROCESSING,
    SUCCEEDED,
    FAILED,
    CANCELED;

    /**
     * Преобразовать строку из ответа API в статус.
     *
     * @param value строковое значение статуса
     * @return статус или null, если значение не распознано
     */
    @JsonCreator
    public static PredictionStatus fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            return PredictionStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELED;
    }
}
