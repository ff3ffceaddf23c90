package ru.oparin.stickers.service;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Перевод описаний на английский для генерации с кэшированием по точному совпадению текста.
 * Кэш живет все время работы процесса и не очищается.
 */
@Slf4j
@Service
public class TranslationCache {

    private static final String INSTRUCTION = """
            Translate this character description to English for AI image generation.
            Keep it concise and clear. Only output the English translation, nothing else.

            Text: %s
            English:""";

    private final Cache<String, String> cache;
    private final LanguageModelClient languageModelClient;

    public TranslationCache(@Qualifier("translationCache") Cache<String, String> cache,
                            LanguageModelClient languageModelClient) {
        this.cache = cache;
        this.languageModelClient = languageModelClient;
    }

    /**
     * Перевести текст. При ошибке языкового сервиса возвращается исходный текст.
     *
     * @param text исходный текст
     * @return перевод из кэша, новый перевод или исходный текст
     */
    public Mono<String> translate(String text) {
        if (text == null || text.isBlank()) {
            return Mono.justOrEmpty(text);
        }
        return Mono.defer(() -> {
            String cached = cache.getIfPresent(text);
            if (cached != null) {
                log.debug("Перевод найден в кэше: '{}'", text);
                return Mono.just(cached);
            }
            return languageModelClient.complete(String.format(INSTRUCTION, text))
                    .doOnNext(translation -> {
                        cache.put(text, translation);
                        log.info("Перевод: '{}' -> '{}'", text, translation);
                    })
                    .onErrorResume(error -> {
                        log.warn("Не удалось перевести '{}', используем исходный текст: {}", text, error.getMessage());
                        return Mono.just(text);
                    })
                    .defaultIfEmpty(text);
        });
    }
}
