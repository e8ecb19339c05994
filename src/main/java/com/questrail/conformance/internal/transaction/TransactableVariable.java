package com.questrail.conformance.internal.transaction;

import com.questrail.conformance.api.Variable;
import com.questrail.conformance.api.VariableNotBoundException;
import com.questrail.conformance.util.Values;

import java.util.Objects;

/**
 * {@link Variable} whose bindings participate in the owning manager's
 * transactions.
 *
 * <p>Inside a transaction a binding is recorded in the log and takes effect at
 * once for the rest of the attempt; a rollback returns the variable to unbound.
 * Outside a transaction a binding is permanent and unrecorded.</p>
 */
public final class TransactableVariable<T> implements Variable<T>
{
    private final String name;
    private final Class<T> type;
    private final TransactionLog log;

    private boolean bound;
    private T value;

    public TransactableVariable(String name, Class<T> type, TransactionLog log) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.log = Objects.requireNonNull(log, "log");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Class<T> type() {
        return type;
    }

    @Override
    public boolean isBound() {
        return bound;
    }

    @Override
    public T get() {
        if (!bound) {
            throw new VariableNotBoundException(name);
        }
        return value;
    }

    @Override
    public void set(T value) {
        if (!Values.fits(type, value)) {
            throw new IllegalArgumentException(String.format(
                    "Variable '%s' of type %s cannot hold %s", name, type.getName(), Values.describe(value)));
        }
        if (bound) {
            throw new IllegalStateException(String.format("Variable '%s' is already bound", name));
        }
        if (log.isActive()) {
            log.recordBinding(this, value);
        }
        this.value = value;
        this.bound = true;
    }

    void unbind() {
        this.bound = false;
        this.value = null;
    }

    @Override
    public String toString() {
        return name + "=" + (bound ? Values.describe(value) : "<unbound>");
    }
}
