package com.kubelab.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * When a correlation context is set, the MDC keys are populated so that every log statement
 * on this thread includes them. When cleared, the keys are removed.
 * <p>
 * Work handed to another thread (for example a scheduler completing an async response) does
 * not inherit the context; wrap it with {@link #wrap(Runnable)} on the submitting thread.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // Utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @param context the correlation context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's correlation context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Binds the authenticated user to the current context. No-op when no context is set.
     *
     * @param userId the authenticated username
     */
    public static void bindUser(String userId) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(current.withUserId(userId));
        }
    }

    /**
     * Clears the correlation context and removes the MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
    }

    /**
     * Executes a {@link Runnable} with the given correlation context set, then restores
     * the previous context (or clears if there was none).
     *
     * @param context  the correlation context for the duration of the runnable
     * @param runnable the work to execute
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /**
     * Captures the current context and returns a runnable that runs {@code task} under it.
     * Returns {@code task} unchanged when no context is set.
     */
    public static Runnable wrap(Runnable task) {
        CorrelationContext captured = CONTEXT.get();
        if (captured == null) {
            return task;
        }
        return () -> runWithContext(captured, task);
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_USER_ID, ctx.userId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
