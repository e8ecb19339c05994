package com.questrail.conformance.api;

/**
 * EventHookup
 * -----------------------------------------------------------------------------
 * Knows how to attach a raiser to, and detach it from, a live event source.
 *
 * <p>The test manager keeps one hookup per (event, target type) pair and calls
 * {@link #detach} before {@link #attach}, so implementations need not guard
 * against a raiser being attached twice. For static or adapter-scoped events
 * the target may be {@code null}.</p>
 */
public interface EventHookup
{
    void attach(Object target, EventRaiser raiser);

    /**
     * Detaches a raiser. Detaching a raiser that was never attached is a no-op.
     */
    void detach(Object target, EventRaiser raiser);
}
