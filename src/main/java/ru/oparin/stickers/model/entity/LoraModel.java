package ru.oparin.stickers.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Entity для таблицы lora_models.
 * Обученная модель персонажа и ссылка на нее в сервисе синтеза.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(value = "lora_models", schema = "stickers")
public class LoraModel {

    @Id
    private Long id;

    /** Владелец модели */
    @Column("user_id")
    private Long userId;

    private String name;

    /**
     * Ссылка на модель в Replicate: "owner/name" или "owner/name:version".
     */
    @Column("replicate_model_name")
    private String replicateModelName;

    private String status;
}
