package com.kubelab.api.infrastructure.async;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.kubelab.observability.CorrelationContext;
import com.kubelab.observability.CorrelationContextHolder;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.context.request.async.DeferredResult;

@DisplayName("LatencySimulator")
class LatencySimulatorTest {

    private ScheduledExecutorService scheduler;
    private LatencySimulator simulator;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(2);
        simulator = new LatencySimulator(scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
        CorrelationContextHolder.clear();
    }

    private static Object awaitResult(DeferredResult<?> result) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!result.hasResult() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertThat(result.hasResult()).as("result set within 5s").isTrue();
        return result.getResult();
    }

    @Test
    @DisplayName("completes with the body only after the delay")
    void completesAfterDelay() throws Exception {
        long start = System.nanoTime();

        DeferredResult<String> result = simulator.after(Duration.ofMillis(50), () -> "done");

        assertThat(result.hasResult()).isFalse();
        assertThat(awaitResult(result)).isEqualTo("done");
        assertThat(Duration.ofNanos(System.nanoTime() - start))
                .isGreaterThanOrEqualTo(Duration.ofMillis(50));
    }

    @Test
    @DisplayName("runs the steps one after the other")
    void runsStepsSequentially() throws Exception {
        long start = System.nanoTime();

        DeferredResult<String> result = simulator.after(
                List.of(Duration.ofMillis(30), Duration.ofMillis(20)), () -> "traced");

        assertThat(awaitResult(result)).isEqualTo("traced");
        assertThat(Duration.ofNanos(System.nanoTime() - start))
                .isGreaterThanOrEqualTo(Duration.ofMillis(50));
    }

    @Test
    @DisplayName("produces the body exactly once")
    void producesBodyOnce() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        DeferredResult<Integer> result = simulator.after(Duration.ofMillis(5), calls::incrementAndGet);

        assertThat(awaitResult(result)).isEqualTo(1);
        Thread.sleep(20);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("completes immediately without steps")
    void completesWithoutSteps() {
        DeferredResult<String> result = simulator.after(List.of(), () -> "now");

        assertThat(result.getResult()).isEqualTo("now");
    }

    @Test
    @DisplayName("turns a failing body into an error result")
    void failingBodyBecomesErrorResult() throws Exception {
        DeferredResult<String> result = simulator.after(Duration.ofMillis(5), () -> {
            throw new IllegalStateException("body failed");
        });

        assertThat(awaitResult(result)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("carries the correlation context to the scheduler thread")
    void carriesCorrelationContext() throws Exception {
        CorrelationContextHolder.set(CorrelationContext.of("corr-async"));

        DeferredResult<String> result = simulator.after(Duration.ofMillis(5), () ->
                CorrelationContextHolder.get().map(CorrelationContext::correlationId).orElse("none"));

        assertThat(awaitResult(result)).isEqualTo("corr-async");
    }

    @Test
    @DisplayName("sets the async timeout beyond the total delay")
    void timeoutCoversDelay() {
        assertThat(LatencySimulator.asyncTimeout(List.of(Duration.ofSeconds(30))))
                .isEqualTo(Duration.ofSeconds(40));
        assertThat(LatencySimulator.asyncTimeout(List.of(Duration.ofMillis(50), Duration.ofMillis(20))))
                .isEqualTo(Duration.ofMillis(70).plus(LatencySimulator.TIMEOUT_GRACE));
        assertThat(LatencySimulator.asyncTimeout(List.of())).isEqualTo(LatencySimulator.TIMEOUT_GRACE);
    }

    @Test
    @DisplayName("rejects negative delays")
    void rejectsNegativeDelay() {
        assertThatThrownBy(() -> simulator.after(Duration.ofMillis(-1), () -> "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
