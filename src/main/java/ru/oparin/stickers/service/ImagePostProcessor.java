package ru.oparin.stickers.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import ru.oparin.stickers.config.properties.GenerationProperties;

import java.time.Duration;

/**
 * Постобработка результата синтеза: скачивание и приведение к каноническому квадрату.
 * Ошибка постобработки не делает элемент неуспешным, результат просто остается без нормализованного изображения.
 */
@Slf4j
@Service
public class ImagePostProcessor {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final WebClient.Builder webClientBuilder;
    private final ImageNormalizationService normalizationService;
    private final GenerationProperties generationProperties;

    public ImagePostProcessor(WebClient.Builder webClientBuilder,
                              ImageNormalizationService normalizationService,
                              GenerationProperties generationProperties) {
        this.webClientBuilder = webClientBuilder;
        this.normalizationService = normalizationService;
        this.generationProperties = generationProperties;
    }

    /**
     * Скачать изображение и привести его к каноническому размеру.
     *
     * @param imageUrl ссылка на результат синтеза
     * @return PNG data URL или пустой Mono при любой ошибке
     */
    public Mono<String> normalize(String imageUrl) {
        int size = generationProperties.getCanonicalSize();
        return webClientBuilder.build()
                .get()
                .uri(imageUrl)
                .accept(MediaType.IMAGE_PNG, MediaType.IMAGE_JPEG, MediaType.parseMediaType("image/*"))
                .retrieve()
                .bodyToMono(byte[].class)
                .timeout(TIMEOUT)
                .flatMap(bytes -> Mono.fromCallable(() -> normalizationService.toCanonicalPng(bytes, size))
                        .subscribeOn(Schedulers.boundedElastic()))
                .map(normalizationService::toDataUrl)
                .doOnNext(dataUrl -> log.debug("Изображение {} нормализовано до {}x{}", imageUrl, size, size))
                .onErrorResume(error -> {
                    log.warn("Не удалось нормализовать изображение {}: {}", imageUrl, error.getMessage());
                    return Mono.empty();
                });
    }
}
