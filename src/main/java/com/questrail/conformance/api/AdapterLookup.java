package com.questrail.conformance.api;

/**
 * Resolves the singleton adapter instance registered for a type.
 */
@FunctionalInterface
public interface AdapterLookup
{
    /**
     * @throws IllegalStateException if no adapter is registered for the type
     */
    <T> T getAdapter(Class<T> adapterType);
}
