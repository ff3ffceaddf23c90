package ru.oparin.stickers.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.r2dbc.config.EnableR2dbcAuditing;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

@Configuration
@EnableR2dbcAuditing
@EnableR2dbcRepositories(basePackages = "ru.oparin.stickers.repository")
public class DatabaseConfig {

    /**
     * Обертка для Mono с retry логикой при потере связи с БД.
     * Повторяет только транзиентные ошибки соединения, ошибки данных пробрасываются сразу.
     */
    public static <T> Mono<T> withRetry(Mono<T> mono) {
        return mono.retryWhen(Retry.backoff(3, Duration.ofSeconds(1))
                .maxBackoff(Duration.ofSeconds(5))
                .jitter(0.1)
                .filter(DatabaseConfig::isTransient));
    }

    private static boolean isTransient(Throwable error) {
        return error instanceof io.r2dbc.spi.R2dbcTransientException
                || error instanceof org.springframework.dao.TransientDataAccessException;
    }
}
