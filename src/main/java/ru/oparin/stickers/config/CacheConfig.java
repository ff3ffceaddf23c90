package ru.oparin.stickers.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурация кеширования для приложения.
 */
@Configuration
public class CacheConfig {

    /**
     * Кеш переводов текста для генерации (ключ: исходный текст, значение: перевод).
     * Без ограничения размера и без TTL: словарь описаний персонажей и тем небольшой
     * и живет все время работы процесса.
     */
    @Bean
    public Cache<String, String> translationCache() {
        return Caffeine.newBuilder().build();
    }
}
