package ru.oparin.stickers.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Сущность сцены (одного стикера) внутри серии.
 */
@Table(value = "emoticon_scenes", schema = "stickers")
@Getter
@Setter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmoticonScene {

    @Id
    private Long id;

    @Column("series_id")
    private Long seriesId;

    /**
     * Индекс элемента в пакете генерации, с нуля.
     */
    @Column("scene_number")
    private Integer sceneNumber;

    private String title;

    /** Промпт в формате "персонаж - название" */
    @Column("prompt")
    private String prompt;

    @Builder.Default
    private String narrative = "";

    @Column("image_url")
    private String imageUrl;

    @Column("metadata")
    private String metadataJson;

    @CreatedDate
    @Column("created_at")
    private LocalDateTime createdAt;
}
