package com.questrail.conformance.core;

import com.questrail.conformance.api.AdapterLookup;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Map-backed {@link AdapterLookup} with one instance per registered type.
 */
public final class SimpleAdapterLookup implements AdapterLookup
{
    private final Map<Class<?>, Object> adapters;

    private SimpleAdapterLookup(Map<Class<?>, Object> adapters) {
        this.adapters = Map.copyOf(adapters);
    }

    public static SimpleAdapterLookup empty() {
        return new SimpleAdapterLookup(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public <T> T getAdapter(Class<T> adapterType) {
        Objects.requireNonNull(adapterType, "adapterType");
        Object adapter = adapters.get(adapterType);
        if (adapter == null) {
            throw new IllegalStateException("No adapter registered for type " + adapterType.getName());
        }
        return adapterType.cast(adapter);
    }

    public static final class Builder {
        private final Map<Class<?>, Object> adapters = new LinkedHashMap<>();

        /**
         * Registers an adapter instance under the given type, replacing any
         * earlier registration.
         */
        public <T> Builder withAdapter(Class<T> adapterType, T adapter) {
            Objects.requireNonNull(adapterType, "adapterType");
            Objects.requireNonNull(adapter, "adapter");
            adapters.put(adapterType, adapterType.cast(adapter));
            return this;
        }

        public SimpleAdapterLookup build() {
            return new SimpleAdapterLookup(adapters);
        }
    }
}
