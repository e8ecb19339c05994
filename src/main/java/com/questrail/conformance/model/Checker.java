package com.questrail.conformance.model;

import com.questrail.conformance.util.Values;

import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Checker
 * -----------------------------------------------------------------------------
 * A caller-supplied callable run against an observation's values to perform
 * further assertions and variable bindings.
 *
 * <p>A checker declares the types of the parameters it accepts. The oracle
 * compares that shape with the observed member's shape to decide how the checker
 * is invoked (see {@code CallingConventionResolver}):</p>
 * <ul>
 *   <li>parameters matching the observed values: the values are passed directly</li>
 *   <li>the declaring type followed by the observed values: the target instance
 *       is prepended</li>
 *   <li>exactly one {@code Object} parameter: the checker receives an
 *       {@code Object[]} (use {@link #ofArray})</li>
 * </ul>
 */
public final class Checker
{
    /**
     * The untyped body every checker is reduced to. It receives exactly as many
     * arguments as the checker declares parameters.
     */
    @FunctionalInterface
    public interface Body {
        void check(Object[] arguments);
    }

    @FunctionalInterface
    public interface Consumer3<A, B, C> {
        void accept(A a, B b, C c);
    }

    private final List<Class<?>> parameterTypes;
    private final Body body;

    private Checker(List<Class<?>> parameterTypes, Body body) {
        this.parameterTypes = List.copyOf(parameterTypes);
        this.body = Objects.requireNonNull(body, "body");
    }

    public static Checker of(List<Class<?>> parameterTypes, Body body) {
        Objects.requireNonNull(parameterTypes, "parameterTypes");
        return new Checker(parameterTypes, body);
    }

    /**
     * A checker taking no values, for members that carry none.
     */
    public static Checker of(Runnable body) {
        Objects.requireNonNull(body, "body");
        return new Checker(List.of(), args -> body.run());
    }

    public static <A> Checker of(Class<A> a, Consumer<A> body) {
        Objects.requireNonNull(body, "body");
        return new Checker(List.of(a), args -> body.accept(cast(a, args[0])));
    }

    public static <A, B> Checker of(Class<A> a, Class<B> b, BiConsumer<A, B> body) {
        Objects.requireNonNull(body, "body");
        return new Checker(List.of(a, b), args -> body.accept(cast(a, args[0]), cast(b, args[1])));
    }

    public static <A, B, C> Checker of(Class<A> a, Class<B> b, Class<C> c, Consumer3<A, B, C> body) {
        Objects.requireNonNull(body, "body");
        return new Checker(List.of(a, b, c),
                args -> body.accept(cast(a, args[0]), cast(b, args[1]), cast(c, args[2])));
    }

    /**
     * A checker with a single untyped parameter; it receives the observed values
     * as an array, preceded by the target instance when the member requires one.
     */
    public static Checker ofArray(Consumer<Object[]> body) {
        Objects.requireNonNull(body, "body");
        return new Checker(List.of(Object.class), args -> body.accept((Object[]) args[0]));
    }

    public List<Class<?>> parameterTypes() {
        return parameterTypes;
    }

    public void invoke(Object[] arguments) {
        if (arguments.length != parameterTypes.size()) {
            throw new IllegalArgumentException("Checker expects " + parameterTypes.size()
                    + " argument(s), got " + arguments.length);
        }
        body.check(arguments);
    }

    @Override
    public String toString() {
        return parameterTypes.stream()
                .map(Class::getSimpleName)
                .collect(Collectors.joining(", ", "checker(", ")"));
    }

    @SuppressWarnings("unchecked")
    private static <T> T cast(Class<T> type, Object value) {
        return (T) Values.box(type).cast(value);
    }
}
