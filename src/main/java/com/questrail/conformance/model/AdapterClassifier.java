package com.questrail.conformance.model;

import com.questrail.conformance.api.TestAdapter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * AdapterClassifier
 * -----------------------------------------------------------------------------
 * Decides whether a type is a test adapter: the type itself, or any interface or
 * base class it transitively extends or implements, carries {@link TestAdapter}.
 *
 * <h2>Caching</h2>
 * Classification is computed once per type and memoized process-wide. The memo
 * and the recursive classification are guarded by a single lock, so concurrent
 * callers (descriptor construction happens on producer threads too) always see
 * one consistent answer. {@link #reset()} clears the memo; test runners call it
 * between runs when adapter types are reloaded.
 */
public final class AdapterClassifier
{
    private static final Object lock = new Object();
    private static final Map<Class<?>, Boolean> adapterTypes = new HashMap<>();

    private AdapterClassifier() {
    }

    public static boolean isAdapter(Class<?> type) {
        Objects.requireNonNull(type, "type");
        synchronized (lock) {
            return classifyLocked(type);
        }
    }

    public static void reset() {
        synchronized (lock) {
            adapterTypes.clear();
        }
    }

    private static boolean classifyLocked(Class<?> type) {
        Boolean cached = adapterTypes.get(type);
        if (cached != null) {
            return cached;
        }

        boolean adapter = type.isAnnotationPresent(TestAdapter.class);
        if (!adapter) {
            for (Class<?> intf : type.getInterfaces()) {
                if (classifyLocked(intf)) {
                    adapter = true;
                    break;
                }
            }
        }
        if (!adapter && type.getSuperclass() != null) {
            adapter = classifyLocked(type.getSuperclass());
        }

        adapterTypes.put(type, adapter);
        return adapter;
    }
}
