package com.questrail.conformance.api;

/**
 * Raised when the value of an unbound {@link Variable} is read.
 */
public final class VariableNotBoundException extends IllegalStateException
{
    public VariableNotBoundException(String variableName) {
        super("Variable '" + variableName + "' is not bound");
    }
}
