package com.questrail.conformance.core;

import com.questrail.conformance.api.TestManager;
import com.questrail.conformance.api.Variable;
import com.questrail.conformance.util.Values;

import java.util.Objects;

/**
 * Assertion helpers used from checkers to compare observed values and to bind
 * variables on first sight.
 *
 * <p>All helpers report through {@link TestManager#assertTrue}, so inside a
 * matching attempt a mismatch rejects the candidate pattern and outside one it
 * is a test failure.</p>
 */
public final class Bindings
{
    private Bindings() {
    }

    /**
     * Asserts that two values are equal. Arrays are compared element-wise.
     */
    public static <T> void assertAreEqual(TestManager manager, T expected, T actual, String context) {
        Objects.requireNonNull(manager, "manager");
        manager.assertTrue(Objects.deepEquals(expected, actual),
                String.format("expected '%s', actual '%s' (%s)",
                        Values.describe(expected), Values.describe(actual), context));
    }

    /**
     * Binds the variable to {@code actual} if it is unbound, otherwise asserts
     * that its value equals {@code actual}.
     */
    public static <T> void assertBind(TestManager manager, Variable<T> variable, T actual, String context) {
        Objects.requireNonNull(variable, "variable");
        if (variable.isBound()) {
            assertAreEqual(manager, variable.get(), actual,
                    context + "; expected value originates from previous binding");
        } else {
            variable.set(actual);
        }
    }

    /**
     * Asserts equality of two bound variables, or binds the unbound one to the
     * other's value. Does nothing when neither is bound.
     */
    public static <T> void assertBind(TestManager manager, Variable<T> v1, Variable<T> v2, String context) {
        Objects.requireNonNull(v1, "v1");
        Objects.requireNonNull(v2, "v2");
        if (v1.isBound() && v2.isBound()) {
            assertAreEqual(manager, v1.get(), v2.get(), context + "; values originate from previous binding");
        } else if (v1.isBound()) {
            v2.set(v1.get());
        } else if (v2.isBound()) {
            v1.set(v2.get());
        }
    }

    public static void assertNotNull(TestManager manager, Object actual, String context) {
        Objects.requireNonNull(manager, "manager");
        manager.assertTrue(actual != null, String.format("expected non-null value (%s)", context));
    }
}
