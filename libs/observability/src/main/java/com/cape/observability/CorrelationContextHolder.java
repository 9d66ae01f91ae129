package com.cape.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Per-thread home of the current {@link CorrelationContext}, mirrored into the SLF4J MDC.
 * <p>
 * The MDC always holds exactly {@link CorrelationContext#mdcEntries()} of the current context, so
 * a context without a route leaves no stale route from an earlier request behind. The context is
 * not inherited by other threads.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CURRENT = new ThreadLocal<>();

    private CorrelationContextHolder() {
    }

    /**
     * Makes {@code context} current on this thread and replaces the MDC entries.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CURRENT.set(context);
        removeMdcKeys();
        context.mdcEntries().forEach(MDC::put);
    }

    /**
     * Returns the current thread's correlation context, if any.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * Drops the current context and its MDC entries.
     */
    public static void clear() {
        CURRENT.remove();
        removeMdcKeys();
    }

    private static void removeMdcKeys() {
        CorrelationContext.MDC_KEYS.forEach(MDC::remove);
    }
}
