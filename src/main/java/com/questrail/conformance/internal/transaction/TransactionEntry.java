package com.questrail.conformance.internal.transaction;

import com.questrail.conformance.util.Values;

import java.util.Objects;

/**
 * One side-effecting call recorded while a transaction was active.
 *
 * @param kind        what was called
 * @param condition   the evaluated condition for asserts and assumptions, {@code true} otherwise
 * @param description the description passed by the caller
 * @param variable    the bound variable, for {@link Kind#VARIABLE_BOUND} only
 * @param value       the bound value, for {@link Kind#VARIABLE_BOUND} only
 */
public record TransactionEntry(
        Kind kind,
        boolean condition,
        String description,
        TransactableVariable<?> variable,
        Object value
) {
    public enum Kind {
        ASSERT,
        ASSUME,
        CHECKPOINT,
        COMMENT,
        VARIABLE_BOUND
    }

    public TransactionEntry {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(description, "description");
        if ((kind == Kind.VARIABLE_BOUND) != (variable != null)) {
            throw new IllegalArgumentException("variable must be given exactly for VARIABLE_BOUND entries");
        }
    }

    static TransactionEntry assertion(boolean condition, String description) {
        return new TransactionEntry(Kind.ASSERT, condition, description, null, null);
    }

    static TransactionEntry assumption(boolean condition, String description) {
        return new TransactionEntry(Kind.ASSUME, condition, description, null, null);
    }

    static TransactionEntry checkpoint(String description) {
        return new TransactionEntry(Kind.CHECKPOINT, true, description, null, null);
    }

    static TransactionEntry comment(String description) {
        return new TransactionEntry(Kind.COMMENT, true, description, null, null);
    }

    static TransactionEntry binding(TransactableVariable<?> variable, Object value) {
        return new TransactionEntry(Kind.VARIABLE_BOUND, true, bindingDescription(variable, value), variable, value);
    }

    static String bindingDescription(TransactableVariable<?> variable, Object value) {
        return String.format("bound variable %s to value: %s", variable.name(), Values.describe(value));
    }

    /**
     * Renders the entry as one diagnosis line, without prefix or line break.
     */
    public String render() {
        return switch (kind) {
            case ASSERT -> "assert " + (condition ? "succeeded: " : "failed: ") + description;
            case ASSUME -> "assume " + (condition ? "succeeded: " : "failed: ") + description;
            case CHECKPOINT -> "checkpoint: " + description;
            case COMMENT -> "comment: " + description;
            case VARIABLE_BOUND -> description;
        };
    }
}
