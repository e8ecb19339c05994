package com.questrail.conformance.api;

/**
 * Callback handed to an {@link EventHookup}; invoking it records one occurrence
 * of the subscribed event with the given actual arguments.
 */
@FunctionalInterface
public interface EventRaiser
{
    void raise(Object... arguments);
}
