package ru.oparin.stickers.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;
import ru.oparin.stickers.util.JsonUtils;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Сущность серии стикеров.
 * Создается один раз на пакет генерации и больше не изменяется.
 */
@Table(value = "emoticon_series", schema = "stickers")
@Getter
@Setter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmoticonSeries {

    @Id
    private Long id;

    /**
     * Идентификатор владельца серии.
     */
    @Column("user_id")
    private Long userId;

    /**
     * Название серии в формате "персонаж - тема|Sketch".
     */
    private String title;

    /**
     * Описание персонажа, общее для всех сцен серии.
     */
    @Column("character_description")
    private String characterDescription;

    private String theme;

    /**
     * Количество успешно сгенерированных сцен пакета.
     */
    @Column("num_scenes")
    private Integer sceneCount;

    /**
     * Категории серии, JSON массив slug-ов.
     */
    @Column("categories")
    private String categoriesJson;

    /**
     * Произвольные метаданные генерации, JSON объект.
     */
    @Column("metadata")
    private String metadataJson;

    @Builder.Default
    @Column("is_public")
    private Boolean isPublic = false;

    @CreatedDate
    @Column("created_at")
    private LocalDateTime createdAt;

    @Transient
    public List<String> getCategories() {
        return JsonUtils.parseJsonToList(categoriesJson);
    }
}
