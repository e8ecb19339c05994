package com.questrail.conformance.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * MemberDescriptor
 * -----------------------------------------------------------------------------
 * The explicit shape of an observable member: an event, a method, or a
 * constructor of a type under test.
 *
 * <p>A descriptor is built once, when the member is registered, and is the only
 * thing the oracle ever inspects about a member. Calling-convention resolution
 * and identity matching read these fields; nothing downstream introspects live
 * classes.</p>
 *
 * <h2>Observed types</h2>
 * The values carried by an observation of this member, in order:
 * <ul>
 *   <li>for an event, the event's parameters</li>
 *   <li>for a method, its output parameters in declaration order followed by
 *       its return type when that is not {@code void}</li>
 *   <li>for a constructor, its output parameters</li>
 * </ul>
 *
 * <h2>Equality</h2>
 * Two descriptors are equal when they denote the same member: same kind,
 * declaring type, name and parameter types.
 */
public final class MemberDescriptor
{
    public enum Kind {
        EVENT,
        METHOD,
        CONSTRUCTOR
    }

    private final Kind kind;
    private final Class<?> declaringType;
    private final String name;
    private final boolean staticMember;
    private final boolean adapterScoped;
    private final List<Class<?>> parameterTypes;
    private final List<Class<?>> outputParameterTypes;
    private final Class<?> returnType;
    private final List<Class<?>> observedTypes;

    private MemberDescriptor(Builder b) {
        this.kind = b.kind;
        this.declaringType = b.declaringType;
        this.name = b.name;
        this.staticMember = b.staticMember;
        this.adapterScoped = AdapterClassifier.isAdapter(b.declaringType);
        this.parameterTypes = List.copyOf(b.parameterTypes);
        this.outputParameterTypes = List.copyOf(b.outputParameterTypes);
        this.returnType = b.returnType;

        List<Class<?>> observed = new ArrayList<>();
        if (kind == Kind.EVENT) {
            observed.addAll(parameterTypes);
        } else {
            observed.addAll(outputParameterTypes);
            if (returnType != void.class) {
                observed.add(returnType);
            }
        }
        this.observedTypes = Collections.unmodifiableList(observed);
    }

    public static Builder event(Class<?> declaringType, String name) {
        return new Builder(Kind.EVENT, declaringType, name);
    }

    public static Builder method(Class<?> declaringType, String name) {
        return new Builder(Kind.METHOD, declaringType, name);
    }

    public static Builder constructor(Class<?> declaringType) {
        return new Builder(Kind.CONSTRUCTOR, declaringType, "<init>");
    }

    public Kind kind() {
        return kind;
    }

    public Class<?> declaringType() {
        return declaringType;
    }

    public String name() {
        return name;
    }

    public boolean isStatic() {
        return staticMember;
    }

    /**
     * Whether the declaring type is classified as a test adapter.
     */
    public boolean isAdapterScoped() {
        return adapterScoped;
    }

    /**
     * An instance member of a non-adapter type needs a target instance; static
     * members and adapter members do not.
     */
    public boolean requiresTarget() {
        return !staticMember && !adapterScoped;
    }

    public List<Class<?>> parameterTypes() {
        return parameterTypes;
    }

    public List<Class<?>> outputParameterTypes() {
        return outputParameterTypes;
    }

    /**
     * The return type, {@code void.class} for events, constructors and void methods.
     */
    public Class<?> returnType() {
        return returnType;
    }

    public List<Class<?>> observedTypes() {
        return observedTypes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemberDescriptor that)) return false;
        return kind == that.kind
                && declaringType.equals(that.declaringType)
                && name.equals(that.name)
                && parameterTypes.equals(that.parameterTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, declaringType, name, parameterTypes);
    }

    @Override
    public String toString() {
        String params = parameterTypes.stream()
                .map(Class::getSimpleName)
                .collect(Collectors.joining(", ", "(", ")"));
        return declaringType.getSimpleName() + "." + name + params;
    }

    public static final class Builder {
        private final Kind kind;
        private final Class<?> declaringType;
        private final String name;
        private boolean staticMember;
        private final List<Class<?>> parameterTypes = new ArrayList<>();
        private final List<Class<?>> outputParameterTypes = new ArrayList<>();
        private Class<?> returnType = void.class;

        private Builder(Kind kind, Class<?> declaringType, String name) {
            this.kind = kind;
            this.declaringType = Objects.requireNonNull(declaringType, "declaringType");
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder withStatic(boolean staticMember) {
            this.staticMember = staticMember;
            return this;
        }

        public Builder withParameters(Class<?>... types) {
            parameterTypes.addAll(requireTypes(types));
            return this;
        }

        /**
         * Adds parameters that also carry a value back to the caller. They are
         * part of the member's signature and, in declaration order, of the
         * values observed when the member returns.
         */
        public Builder withOutputParameters(Class<?>... types) {
            List<Class<?>> outputs = requireTypes(types);
            parameterTypes.addAll(outputs);
            outputParameterTypes.addAll(outputs);
            return this;
        }

        public Builder withReturnType(Class<?> returnType) {
            this.returnType = Objects.requireNonNull(returnType, "returnType");
            return this;
        }

        public MemberDescriptor build() {
            if (kind != Kind.METHOD && returnType != void.class) {
                throw new IllegalStateException(kind + " " + name + " cannot declare a return type");
            }
            if (kind == Kind.EVENT && !outputParameterTypes.isEmpty()) {
                throw new IllegalStateException("Event " + name + " cannot declare output parameters");
            }
            if (kind == Kind.CONSTRUCTOR && staticMember) {
                throw new IllegalStateException("Constructors cannot be static");
            }
            return new MemberDescriptor(this);
        }

        private static List<Class<?>> requireTypes(Class<?>[] types) {
            Objects.requireNonNull(types, "types");
            for (int i = 0; i < types.length; i++) {
                Objects.requireNonNull(types[i], "type at index " + i);
            }
            return Arrays.asList(types);
        }
    }
}
