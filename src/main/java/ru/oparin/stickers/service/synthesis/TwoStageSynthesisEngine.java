package ru.oparin.stickers.service.synthesis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import ru.oparin.stickers.config.properties.GenerationProperties;
import ru.oparin.stickers.exception.SynthesisException;
import ru.oparin.stickers.model.dto.generation.GenerationItem;
import ru.oparin.stickers.model.dto.generation.GenerationSettings;
import ru.oparin.stickers.model.dto.replicate.SynthesisInput;
import ru.oparin.stickers.model.enums.GenerationMode;
import ru.oparin.stickers.model.enums.ItemStage;
import ru.oparin.stickers.service.ImageNormalizationService;
import ru.oparin.stickers.service.PromptCompiler;

import java.time.Duration;

/**
 * Синтез одного элемента пакета.
 * <p>
 * text-to-image: первый проход по промпту, затем уточнение с тем же промптом поверх результата
 * первого прохода с низкой силой влияния, чтобы сохранить позу. В режиме превью уточнение пропускается.
 * image-to-image: один проход по исходному изображению с белым фоном.
 * Если фон залить не удалось, изображение отправляется без изменений.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TwoStageSynthesisEngine {

    private final ImageSynthesisClient synthesisClient;
    private final SynthesisRateLimiter rateLimiter;
    private final PromptCompiler promptCompiler;
    private final ImageNormalizationService normalizationService;
    private final GenerationProperties generationProperties;

    /**
     * Синтезировать изображение для элемента.
     *
     * @param item     элемент пакета
     * @param settings параметры пакета
     * @return ссылка на итоговое изображение
     */
    public Mono<String> synthesize(GenerationItem item, GenerationSettings settings) {
        GenerationMode mode = settings.getMode();
        Duration itemGap = generationProperties.getItemDelay(mode.isPreview());
        return mode.isTextToImage()
                ? textToImage(item, settings, itemGap)
                : imageToImage(item, settings, itemGap);
    }

    private Mono<String> textToImage(GenerationItem item, GenerationSettings settings, Duration itemGap) {
        return compilePrompt(item, settings)
                .flatMap(prompt -> rateLimiter.throttle(itemGap,
                                () -> synthesisClient.synthesize(settings.getModelReference(), SynthesisInput.textOnly(prompt)))
                        .doOnNext(url -> logStage(item, ItemStage.STAGE1_DONE, url))
                        .onErrorMap(error -> stageFailure(item, ItemStage.STAGE1_FAILED, error))
                        .flatMap(stage1Url -> settings.getMode().isPreview()
                                ? Mono.just(stage1Url)
                                : refine(item, settings, prompt, stage1Url)));
    }

    /**
     * Второй проход. Результат первого прохода не подставляется вместо неудавшегося уточнения.
     */
    private Mono<String> refine(GenerationItem item, GenerationSettings settings, String prompt, String stage1Url) {
        SynthesisInput input = SynthesisInput.withImage(prompt, stage1Url,
                generationProperties.getRefinementPromptStrength());
        return rateLimiter.throttle(generationProperties.getRefinementDelay(),
                        () -> synthesisClient.synthesize(settings.getModelReference(), input))
                .doOnNext(url -> logStage(item, ItemStage.STAGE2_DONE, url))
                .onErrorMap(error -> stageFailure(item, ItemStage.STAGE2_FAILED, error));
    }

    private Mono<String> imageToImage(GenerationItem item, GenerationSettings settings, Duration itemGap) {
        Mono<String> flattened = Mono.fromCallable(() -> normalizationService.flattenToWhite(item.getSourceImage()))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(error -> {
                    log.warn("Элемент {}: не удалось залить фон исходного изображения, отправляем как есть: {}",
                            item.getIndex(), error.getMessage());
                    return Mono.just(item.getSourceImage());
                });

        return flattened.zipWith(compilePrompt(item, settings))
                .flatMap(pair -> {
                    SynthesisInput input = SynthesisInput.withImage(pair.getT2(), pair.getT1(),
                            generationProperties.getImageToImagePromptStrength());
                    return rateLimiter.throttle(itemGap,
                            () -> synthesisClient.synthesize(settings.getModelReference(), input));
                })
                .doOnNext(url -> logStage(item, ItemStage.STAGE1_DONE, url))
                .onErrorMap(error -> stageFailure(item, ItemStage.STAGE1_FAILED, error));
    }

    private Mono<String> compilePrompt(GenerationItem item, GenerationSettings settings) {
        logStage(item, ItemStage.PENDING, null);
        return promptCompiler.compile(item, settings.getMode(), settings.getStyle(),
                settings.getTheme(), settings.isMonochrome());
    }

    private void logStage(GenerationItem item, ItemStage stage, String url) {
        if (url == null) {
            log.debug("Элемент {}: {}", item.getIndex(), stage);
        } else {
            log.info("Элемент {}: {} -> {}", item.getIndex(), stage, url);
        }
    }

    private Throwable stageFailure(GenerationItem item, ItemStage stage, Throwable error) {
        log.warn("Элемент {}: {} ({})", item.getIndex(), stage, error.getMessage());
        if (error instanceof SynthesisException synthesisError) {
            return synthesisError;
        }
        return new SynthesisException(error.getMessage(), HttpStatus.BAD_GATEWAY, error);
    }
}
