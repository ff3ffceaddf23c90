package ru.oparin.stickers.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Часы и планировщик ожиданий rate limit для пайплайна генерации.
 */
@Configuration
public class GenerationConfig {

    @Bean
    public Clock generationClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Scheduler rateLimitScheduler() {
        return Schedulers.parallel();
    }
}
