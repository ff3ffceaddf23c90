package ru.oparin.stickers.model.enums;

/**
 * Состояние обработки одного элемента пакета в движке синтеза.
 */
public enum ItemStage {
    PENDING,
    STAGE1_DONE,
    STAGE2_DONE,
    STAGE1_FAILED,
    STAGE2_FAILED
}
