package ru.oparin.stickers.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.stickers.exception.GenerationValidationException;
import ru.oparin.stickers.model.dto.generation.BatchResult;
import ru.oparin.stickers.model.dto.generation.GenerationItem;
import ru.oparin.stickers.model.dto.generation.GenerationRequest;
import ru.oparin.stickers.model.dto.generation.GenerationSettings;
import ru.oparin.stickers.model.dto.generation.ItemResult;
import ru.oparin.stickers.model.dto.generation.PersistenceDirective;
import ru.oparin.stickers.model.enums.GenerationMode;
import ru.oparin.stickers.model.enums.SketchStyle;
import ru.oparin.stickers.service.persistence.SeriesPersistenceService;
import ru.oparin.stickers.service.synthesis.TwoStageSynthesisEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * Пакетная генерация стикеров.
 * <p>
 * Элементы обрабатываются строго по одному в порядке индексов: квота сервиса синтеза
 * общая для обоих проходов. Ошибка элемента записывается в его результат, пакет продолжается.
 * После обработки всех элементов, если запрошено, результат сохраняется как серия.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchGenerationService {

    private final LoraModelResolver loraModelResolver;
    private final TwoStageSynthesisEngine synthesisEngine;
    private final ImagePostProcessor postProcessor;
    private final SeriesPersistenceService seriesPersistenceService;

    /**
     * Сгенерировать пакет.
     *
     * @param request запрос на генерацию
     * @return результаты по всем элементам в исходном порядке
     * @throws GenerationValidationException если запрос некорректен для выбранного режима
     */
    public Mono<BatchResult> generate(GenerationRequest request) {
        return Mono.defer(() -> {
            GenerationMode mode = request.getMode() != null ? request.getMode() : GenerationMode.TEXT_TO_IMAGE;
            SketchStyle style = validate(request, mode);

            return loraModelResolver.resolve(request.getModelId())
                    .flatMap(modelReference -> {
                        GenerationSettings settings = GenerationSettings.builder()
                                .modelReference(modelReference)
                                .mode(mode)
                                .style(style)
                                .theme(request.getTheme())
                                .monochrome(request.isMonochrome())
                                .build();
                        List<GenerationItem> items = buildItems(request, mode);
                        log.info("Старт пакета: {} элементов, режим {}, стиль {}, тема '{}'",
                                items.size(), mode.getCode(), style, request.getTheme());

                        return Flux.fromIterable(items)
                                .concatMap(item -> processItem(item, settings))
                                .collectList()
                                .map(results -> BatchResult.of(mode, results));
                    })
                    .doOnNext(result -> log.info("Пакет завершен: успешно {}/{}", result.getSuccessCount(), result.getTotal()))
                    .flatMap(result -> persistIfRequested(request, result));
        });
    }

    private Mono<ItemResult> processItem(GenerationItem item, GenerationSettings settings) {
        return synthesisEngine.synthesize(item, settings)
                .flatMap(imageUrl -> postProcessor.normalize(imageUrl)
                        .map(normalized -> ItemResult.success(item, imageUrl, normalized))
                        .defaultIfEmpty(ItemResult.success(item, imageUrl, null)))
                .switchIfEmpty(Mono.fromSupplier(() -> ItemResult.failure(item, "Сервис синтеза не вернул изображение")))
                .onErrorResume(error -> Mono.just(ItemResult.failure(item, failureReason(error))))
                .doOnNext(result -> {
                    if (result.isSuccess()) {
                        log.info("Элемент {} готов: {}", item.getIndex(), result.getGeneratedUrl());
                    } else {
                        log.warn("Элемент {} не сгенерирован: {}", item.getIndex(), result.getError());
                    }
                });
    }

    private String failureReason(Throwable error) {
        return error.getMessage() != null && !error.getMessage().isBlank()
                ? error.getMessage()
                : error.getClass().getSimpleName();
    }

    private Mono<BatchResult> persistIfRequested(GenerationRequest request, BatchResult result) {
        PersistenceDirective directive = request.getPersistence();
        if (directive == null) {
            return Mono.just(result);
        }
        if (result.getSuccessCount() == 0) {
            log.warn("Нет успешных элементов, серия не сохраняется");
            return Mono.just(result);
        }
        return seriesPersistenceService.persist(result, directive, request.getTheme(), request.getStyle(),
                        request.isMonochrome(), request.getTitles())
                .map(seriesId -> result.toBuilder().savedSeriesId(seriesId).build())
                .defaultIfEmpty(result)
                .onErrorResume(error -> {
                    log.error("Ошибка сохранения серии, результат возвращается без нее", error);
                    return Mono.just(result);
                });
    }

    /**
     * Проверить запрос для выбранного режима.
     *
     * @return выбранный стиль или null
     */
    SketchStyle validate(GenerationRequest request, GenerationMode mode) {
        if (mode.isTextToImage()) {
            requireNonBlankItems(request.getPrompts(),
                    "Для режима " + mode.getCode() + " нужен непустой список prompts");
        } else {
            requireNonBlankItems(request.getImages(), "Для режима img2img нужен непустой список images");
        }

        PersistenceDirective directive = request.getPersistence();
        if (directive != null && (directive.getOwnerId() == null
                || directive.getCharacter() == null || directive.getCharacter().isBlank())) {
            throw new GenerationValidationException("Для сохранения серии нужны владелец и описание персонажа");
        }

        try {
            return SketchStyle.fromCode(request.getStyle());
        } catch (IllegalArgumentException e) {
            throw new GenerationValidationException(e.getMessage());
        }
    }

    private void requireNonBlankItems(List<String> values, String message) {
        if (values == null || values.isEmpty()) {
            throw new GenerationValidationException(message);
        }
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null || values.get(i).isBlank()) {
                throw new GenerationValidationException(message + ": элемент " + i + " пустой");
            }
        }
    }

    private List<GenerationItem> buildItems(GenerationRequest request, GenerationMode mode) {
        List<GenerationItem> items = new ArrayList<>();
        if (mode.isTextToImage()) {
            List<String> prompts = request.getPrompts();
            for (int i = 0; i < prompts.size(); i++) {
                items.add(new GenerationItem(i, prompts.get(i), null));
            }
        } else {
            List<String> images = request.getImages();
            List<String> prompts = request.getPrompts();
            for (int i = 0; i < images.size(); i++) {
                String prompt = prompts != null && i < prompts.size() ? prompts.get(i) : null;
                items.add(new GenerationItem(i, prompt, images.get(i)));
            }
        }
        return items;
    }
}
