package com.questrail.conformance.api;

/**
 * Variable
 * -----------------------------------------------------------------------------
 * A named, typed cell that a test binds at most once, usually from inside a
 * checker while an observation is being matched.
 *
 * <h2>Transactional binding</h2>
 * A binding made while a transaction is active is visible immediately to the
 * rest of the matching attempt. If the attempt is rolled back the variable
 * returns to the unbound state; if it is committed the binding becomes
 * permanent and is reported as a comment.
 *
 * @param <T> the value type, fixed at creation
 */
public interface Variable<T>
{
    String name();

    Class<T> type();

    boolean isBound();

    /**
     * @throws VariableNotBoundException if the variable is not bound
     */
    T get();

    /**
     * Binds the variable.
     *
     * @throws IllegalArgumentException if the value is not an instance of {@link #type()}
     * @throws IllegalStateException    if the variable is already bound
     */
    void set(T value);
}
