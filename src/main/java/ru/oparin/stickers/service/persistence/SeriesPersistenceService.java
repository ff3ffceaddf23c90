package ru.oparin.stickers.service.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.stickers.config.properties.GenerationProperties;
import ru.oparin.stickers.model.dto.generation.BatchResult;
import ru.oparin.stickers.model.dto.generation.ItemResult;
import ru.oparin.stickers.model.dto.generation.PersistenceDirective;
import ru.oparin.stickers.model.entity.EmoticonScene;
import ru.oparin.stickers.model.entity.EmoticonSeries;
import ru.oparin.stickers.model.enums.CategoryTag;
import ru.oparin.stickers.model.enums.SketchStyle;
import ru.oparin.stickers.service.CategoryClassifier;
import ru.oparin.stickers.service.ImageNormalizationService;
import ru.oparin.stickers.service.storage.StorageService;
import ru.oparin.stickers.util.JsonUtils;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Сохранение результата пакета в виде серии стикеров.
 * <p>
 * Три независимых шага без общей транзакции:
 * <ol>
 *   <li>создание записи серии (при ошибке сохранение прекращается, возвращается пустой результат);</li>
 *   <li>параллельная загрузка изображений в хранилище (ошибка загрузки пропускает только этот элемент);</li>
 *   <li>одна пакетная вставка сцен (при ошибке серия и загруженные файлы остаются без сцен).</li>
 * </ol>
 * Серия без сцен и файлы без записей в БД считаются допустимым итогом и не откатываются.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeriesPersistenceService {

    static final String DEFAULT_THEME = "Custom Sketch";
    static final String TITLE_FALLBACK_THEME = "Sketch";
    static final String GENERATION_METHOD = "pro_flux_lora";
    static final String CREATED_FROM = "pro";

    private final CategoryClassifier categoryClassifier;
    private final EmoticonSceneService emoticonSceneService;
    private final StorageService storageService;
    private final ImageNormalizationService normalizationService;
    private final GenerationProperties generationProperties;

    /**
     * Сохранить серию.
     *
     * @param batchResult результат пакета
     * @param directive   владелец и описание персонажа
     * @param theme       тема серии или null
     * @param style       код стиля или null
     * @param monochrome  черно-белый режим
     * @param titles      названия сцен по индексам или null
     * @return идентификатор серии или пустой Mono, если серию создать не удалось
     */
    public Mono<Long> persist(BatchResult batchResult, PersistenceDirective directive, String theme,
                              String style, boolean monochrome, List<String> titles) {
        log.info("Сохранение серии для пользователя {}: успешных элементов {}",
                directive.getOwnerId(), batchResult.getSuccessCount());

        return categoryClassifier.classify(theme, directive.getCharacter())
                .map(categories -> buildSeries(batchResult, directive, theme, style, monochrome, categories))
                .flatMap(emoticonSceneService::createSeries)
                .onErrorResume(error -> {
                    log.error("Не удалось создать серию для пользователя {}, сохранение прервано",
                            directive.getOwnerId(), error);
                    return Mono.empty();
                })
                .flatMap(series -> uploadScenes(series, batchResult, directive, style, monochrome, titles)
                        .flatMap(scenes -> insertScenes(series.getId(), scenes))
                        .thenReturn(series.getId()));
    }

    /**
     * Параллельная загрузка изображений. Порядок завершения не важен, список собирается без общей мутабельной коллекции.
     */
    private Mono<List<EmoticonScene>> uploadScenes(EmoticonSeries series, BatchResult batchResult,
                                                   PersistenceDirective directive, String style,
                                                   boolean monochrome, List<String> titles) {
        List<ItemResult> storable = batchResult.getResults().stream()
                .filter(ItemResult::isStorable)
                .collect(Collectors.toList());
        log.info("Загрузка {} изображений серии {}", storable.size(), series.getId());

        return Flux.fromIterable(storable)
                .index()
                .flatMap(entry -> uploadScene(series.getId(), entry.getT2(), entry.getT1().intValue(),
                        directive, style, monochrome, titles))
                .collectList()
                .map(scenes -> {
                    scenes.sort(Comparator.comparing(EmoticonScene::getSceneNumber));
                    return scenes;
                });
    }

    private Mono<EmoticonScene> uploadScene(Long seriesId, ItemResult item, int position,
                                            PersistenceDirective directive, String style, boolean monochrome,
                                            List<String> titles) {
        String path = String.format("%s/%d/scene_%d.png", generationProperties.getStoragePrefix(), seriesId, item.getIndex());
        return Mono.fromCallable(() -> normalizationService.decodeDataUrl(item.getNormalizedImage()))
                .flatMap(bytes -> storageService.upload(path, bytes, MediaType.IMAGE_PNG_VALUE))
                .map(imageUrl -> buildScene(seriesId, item, position, imageUrl, directive, style, monochrome, titles))
                .onErrorResume(error -> {
                    log.warn("Не удалось загрузить изображение {} серии {}, сцена пропущена: {}",
                            item.getIndex(), seriesId, error.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Long> insertScenes(Long seriesId, List<EmoticonScene> scenes) {
        return emoticonSceneService.insertAll(scenes)
                .onErrorResume(error -> {
                    log.error("Не удалось вставить {} сцен серии {}, файлы остаются без записей",
                            scenes.size(), seriesId, error);
                    return Mono.just(0L);
                });
    }

    private EmoticonSeries buildSeries(BatchResult batchResult, PersistenceDirective directive, String theme,
                                       String style, boolean monochrome, Set<CategoryTag> categories) {
        boolean hasTheme = theme != null && !theme.isBlank();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("style", styleOrDefault(style));
        metadata.put("generation_method", GENERATION_METHOD);
        metadata.put("created_from", CREATED_FROM);
        metadata.put("monochromeOnly", monochrome);

        return EmoticonSeries.builder()
                .userId(directive.getOwnerId())
                .title(directive.getCharacter() + " - " + (hasTheme ? theme : TITLE_FALLBACK_THEME))
                .characterDescription(directive.getCharacter())
                .theme(hasTheme ? theme : DEFAULT_THEME)
                .sceneCount(batchResult.getSuccessCount())
                .categoriesJson(JsonUtils.convertListToJson(categories.stream()
                        .map(CategoryTag::getSlug)
                        .collect(Collectors.toList())))
                .metadataJson(JsonUtils.convertMapToJson(metadata))
                .isPublic(false)
                .build();
    }

    private EmoticonScene buildScene(Long seriesId, ItemResult item, int position, String imageUrl,
                                     PersistenceDirective directive, String style, boolean monochrome,
                                     List<String> titles) {
        String title = sceneTitle(item, position, titles);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("original_style", styleOrDefault(style));
        metadata.put("monochromeOnly", monochrome);

        return EmoticonScene.builder()
                .seriesId(seriesId)
                .sceneNumber(item.getIndex())
                .title(title)
                .prompt(directive.getCharacter() + " - " + title)
                .narrative("")
                .imageUrl(imageUrl)
                .metadataJson(JsonUtils.convertMapToJson(metadata))
                .build();
    }

    private String styleOrDefault(String style) {
        return style != null && !style.isBlank() ? style : SketchStyle.PEN.getCode();
    }

    /**
     * Название сцены: titles[i], иначе промпт элемента, иначе "Scene n",
     * где n - номер среди сохраняемых элементов, начиная с 1.
     */
    String sceneTitle(ItemResult item, int position, List<String> titles) {
        int index = item.getIndex();
        if (titles != null && index < titles.size() && titles.get(index) != null && !titles.get(index).isBlank()) {
            return titles.get(index);
        }
        if (item.getPrompt() != null && !item.getPrompt().isBlank()) {
            return item.getPrompt();
        }
        return "Scene " + (position + 1);
    }
}
