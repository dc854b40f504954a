package com.kubelab.api.infrastructure.async;

import com.kubelab.observability.CorrelationContextHolder;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.async.DeferredResult;

/**
 * Serves artificial delays without holding a request thread.
 *
 * <p>A delayed response is a {@link DeferredResult} completed from a scheduler once every step
 * has elapsed, one after the other. If the async request ends first (timeout, client
 * disconnect) the pending step is cancelled and the body is never produced.
 */
@Component
public class LatencySimulator {

    private static final Logger log = LoggerFactory.getLogger(LatencySimulator.class);

    /** Added to the total delay to form the async request timeout. */
    static final Duration TIMEOUT_GRACE = Duration.ofSeconds(10);

    private final ScheduledExecutorService scheduler;

    public LatencySimulator(@Qualifier("latencyScheduler") ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Completes with {@code body} after {@code delay}.
     */
    public <T> DeferredResult<T> after(Duration delay, Supplier<T> body) {
        return after(List.of(delay), body);
    }

    /**
     * Completes with {@code body} after each of {@code steps} has elapsed in turn.
     *
     * @throws IllegalArgumentException if a step is negative
     */
    public <T> DeferredResult<T> after(List<Duration> steps, Supplier<T> body) {
        for (Duration step : steps) {
            if (step.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative: " + step);
            }
        }
        Duration timeout = asyncTimeout(steps);
        DeferredResult<T> result = new DeferredResult<>(timeout.toMillis());
        AtomicReference<ScheduledFuture<?>> pending = new AtomicReference<>();

        result.onTimeout(() -> {
            log.warn("Delayed response timed out after {}", timeout);
            cancel(pending);
        });
        result.onError(error -> {
            log.debug("Delayed response aborted: {}", error.toString());
            cancel(pending);
        });
        result.onCompletion(() -> cancel(pending));

        if (steps.isEmpty()) {
            complete(result, body);
        } else {
            scheduleStep(new ArrayList<>(steps), 0, result, pending, body);
        }
        return result;
    }

    static Duration asyncTimeout(List<Duration> steps) {
        return steps.stream().reduce(Duration.ZERO, Duration::plus).plus(TIMEOUT_GRACE);
    }

    private <T> void scheduleStep(
            List<Duration> steps,
            int index,
            DeferredResult<T> result,
            AtomicReference<ScheduledFuture<?>> pending,
            Supplier<T> body) {
        if (result.isSetOrExpired()) {
            return;
        }
        Runnable next = index + 1 < steps.size()
                ? () -> scheduleStep(steps, index + 1, result, pending, body)
                : () -> complete(result, body);
        pending.set(scheduler.schedule(
                CorrelationContextHolder.wrap(next), steps.get(index).toNanos(), TimeUnit.NANOSECONDS));
    }

    private static <T> void complete(DeferredResult<T> result, Supplier<T> body) {
        if (result.isSetOrExpired()) {
            return;
        }
        try {
            result.setResult(body.get());
        } catch (RuntimeException e) {
            log.error("Delayed response body failed", e);
            result.setErrorResult(e);
        }
    }

    private static void cancel(AtomicReference<ScheduledFuture<?>> pending) {
        ScheduledFuture<?> future = pending.get();
        if (future != null && !future.isDone()) {
            future.cancel(false);
        }
    }
}
