package ru.oparin.stickers.service.synthesis;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Единая точка соблюдения квоты сервиса синтеза.
 * <p>
 * Вызовы выполняются строго по одному в порядке подписки, даже если их запрашивают
 * несколько пакетов одновременно. Перед каждым вызовом выдерживается пауза
 * от завершения предыдущего. Состояние общее для процесса.
 */
@Slf4j
@Component
public class SynthesisRateLimiter {

    private final Clock clock;
    private final Scheduler scheduler;
    private final AtomicReference<Instant> lastCompletion = new AtomicReference<>();

    /**
     * Сигнал освобождения очереди последним поставленным в нее вызовом.
     */
    private final AtomicReference<Mono<Void>> tail = new AtomicReference<>(Mono.empty());

    public SynthesisRateLimiter(@Qualifier("generationClock") Clock clock,
                                @Qualifier("rateLimitScheduler") Scheduler scheduler) {
        this.clock = clock;
        this.scheduler = scheduler;
    }

    /**
     * Выполнить вызов после завершения всех ранее поставленных в очередь
     * и не раньше, чем через gap после завершения предыдущего.
     *
     * @param gap  минимальная пауза после предыдущего вызова
     * @param call вызов сервиса синтеза
     * @return результат вызова
     */
    public <T> Mono<T> throttle(Duration gap, Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            Sinks.Empty<Void> turn = Sinks.empty();
            Mono<Void> previous = tail.getAndSet(turn.asMono());
            AtomicBoolean started = new AtomicBoolean();

            return previous
                    .then(Mono.defer(() -> awaitGap(gap)))
                    .then(Mono.defer(() -> {
                        started.set(true);
                        return Mono.defer(call)
                                .doOnTerminate(this::recordCompletion)
                                .doOnCancel(this::recordCompletion);
                    }))
                    .doFinally(signal -> {
                        if (started.get()) {
                            turn.tryEmitEmpty();
                        } else {
                            // отмена до начала вызова: очередь освобождается вместе с предыдущим
                            previous.doFinally(s -> turn.tryEmitEmpty()).subscribe();
                        }
                    });
        });
    }

    private Mono<Void> awaitGap(Duration gap) {
        Duration wait = remainingWait(gap);
        if (wait.isZero() || wait.isNegative()) {
            return Mono.empty();
        }
        log.info("Ожидание {} мс перед вызовом сервиса синтеза", wait.toMillis());
        return Mono.delay(wait, scheduler).then();
    }

    private void recordCompletion() {
        lastCompletion.set(clock.instant());
    }

    /**
     * Сколько еще нужно подождать до следующего вызова.
     */
    Duration remainingWait(Duration gap) {
        Instant last = lastCompletion.get();
        if (last == null) {
            return Duration.ZERO;
        }
        return Duration.between(clock.instant(), last.plus(gap));
    }
}
