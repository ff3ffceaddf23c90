package ru.oparin.stickers.service.synthesis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SynthesisRateLimiterTest {

    private static final Duration GAP = Duration.ofSeconds(15);

    private VirtualTimeScheduler scheduler;
    private SynthesisRateLimiter rateLimiter;
    private final List<String> completed = new ArrayList<>();

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        rateLimiter = new SynthesisRateLimiter(new VirtualTimeClock(scheduler), scheduler);
    }

    @Test
    @DisplayName("Первый вызов выполняется сразу")
    void firstCallIsImmediate() {
        rateLimiter.throttle(GAP, () -> Mono.just("first")).subscribe(completed::add);

        assertThat(completed).containsExactly("first");
    }

    @Test
    @DisplayName("Следующий вызов ждет паузу от завершения предыдущего")
    void nextCallWaitsForGap() {
        rateLimiter.throttle(GAP, () -> Mono.just("first")).subscribe(completed::add);
        rateLimiter.throttle(GAP, () -> Mono.just("second")).subscribe(completed::add);

        scheduler.advanceTimeBy(Duration.ofSeconds(14));
        assertThat(completed).containsExactly("first");

        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertThat(completed).containsExactly("first", "second");
    }

    @Test
    @DisplayName("Уже прошедшее время засчитывается в паузу")
    void elapsedTimeCountsTowardsGap() {
        rateLimiter.throttle(GAP, () -> Mono.just("first")).subscribe(completed::add);
        Mono<String> second = rateLimiter.throttle(GAP, () -> Mono.just("second"));

        scheduler.advanceTimeBy(Duration.ofSeconds(10));
        second.subscribe(completed::add);
        assertThat(completed).containsExactly("first");

        scheduler.advanceTimeBy(Duration.ofSeconds(5));
        assertThat(completed).containsExactly("first", "second");
    }

    @Test
    @DisplayName("Неуспешный вызов тоже считается обращением к сервису")
    void failedCallAlsoStartsGap() {
        List<Throwable> errors = new ArrayList<>();
        rateLimiter.<String>throttle(GAP, () -> Mono.error(new IllegalStateException("boom")))
                .subscribe(completed::add, errors::add);
        rateLimiter.throttle(Duration.ofSeconds(2), () -> Mono.just("preview")).subscribe(completed::add);

        assertThat(errors).hasSize(1);
        assertThat(completed).isEmpty();

        scheduler.advanceTimeBy(Duration.ofSeconds(2));
        assertThat(completed).containsExactly("preview");
    }

    @Test
    @DisplayName("Пауза отсчитывается от завершения вызова, а не от его начала")
    void gapStartsAtCompletion() {
        rateLimiter.throttle(GAP, () -> Mono.delay(Duration.ofSeconds(20), scheduler).thenReturn("slow"))
                .subscribe(completed::add);
        scheduler.advanceTimeBy(Duration.ofSeconds(20));
        assertThat(completed).containsExactly("slow");

        rateLimiter.throttle(GAP, () -> Mono.just("next")).subscribe(completed::add);
        assertThat(rateLimiter.remainingWait(GAP)).isEqualTo(GAP);

        scheduler.advanceTimeBy(GAP);
        assertThat(completed).containsExactly("slow", "next");
    }

    @Test
    @DisplayName("Вызов, запрошенный во время выполнения другого, ждет его завершения и паузы")
    void overlappingCallsRunOneAtATime() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        Sinks.One<String> firstResult = Sinks.one();

        rateLimiter.throttle(GAP, () -> track(inFlight, maxInFlight, firstResult.asMono()))
                .subscribe(completed::add);
        rateLimiter.throttle(GAP, () -> track(inFlight, maxInFlight, Mono.just("second")))
                .subscribe(completed::add);

        scheduler.advanceTimeBy(Duration.ofSeconds(30));
        assertThat(inFlight.get()).isEqualTo(1);
        assertThat(completed).isEmpty();

        firstResult.tryEmitValue("first");
        assertThat(completed).containsExactly("first");

        scheduler.advanceTimeBy(Duration.ofSeconds(14));
        assertThat(completed).containsExactly("first");

        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertThat(completed).containsExactly("first", "second");
        assertThat(maxInFlight.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Отмена ожидающего вызова не пропускает следующий раньше текущего")
    void cancelledWaiterKeepsQueueOrder() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        Sinks.One<String> firstResult = Sinks.one();

        rateLimiter.throttle(GAP, () -> track(inFlight, maxInFlight, firstResult.asMono()))
                .subscribe(completed::add);
        rateLimiter.throttle(GAP, () -> track(inFlight, maxInFlight, Mono.just("cancelled")))
                .subscribe(completed::add)
                .dispose();
        rateLimiter.throttle(GAP, () -> track(inFlight, maxInFlight, Mono.just("third")))
                .subscribe(completed::add);

        assertThat(inFlight.get()).isEqualTo(1);

        firstResult.tryEmitValue("first");
        scheduler.advanceTimeBy(GAP);

        assertThat(completed).containsExactly("first", "third");
        assertThat(maxInFlight.get()).isEqualTo(1);
    }

    private static Mono<String> track(AtomicInteger inFlight, AtomicInteger maxInFlight, Mono<String> call) {
        return Mono.defer(() -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            return call.doFinally(signal -> inFlight.decrementAndGet());
        });
    }
}
