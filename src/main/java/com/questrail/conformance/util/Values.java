package com.questrail.conformance.util;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Small value helpers shared by descriptors, checkers and diagnostics.
 */
public final class Values
{
    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            char.class, Character.class,
            short.class, Short.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class,
            void.class, Void.class
    );

    private static final Map<Class<?>, Object> DEFAULTS = Map.of(
            Boolean.class, Boolean.FALSE,
            Byte.class, (byte) 0,
            Character.class, '\0',
            Short.class, (short) 0,
            Integer.class, 0,
            Long.class, 0L,
            Float.class, 0f,
            Double.class, 0d,
            String.class, ""
    );

    private Values() {
    }

    /**
     * Returns the wrapper class for a primitive type, or the type itself.
     */
    public static Class<?> box(Class<?> type) {
        Objects.requireNonNull(type, "type");
        return type.isPrimitive() ? WRAPPERS.get(type) : type;
    }

    /**
     * Two declared types are considered the same if they are equal once
     * primitives are replaced by their wrappers.
     */
    public static boolean sameType(Class<?> a, Class<?> b) {
        return box(a).equals(box(b));
    }

    /**
     * Returns whether a value may be held by a slot of the given declared type.
     * {@code null} fits any reference type but no primitive.
     */
    public static boolean fits(Class<?> type, Object value) {
        if (value == null) {
            return !type.isPrimitive();
        }
        return box(type).isInstance(value);
    }

    /**
     * The default value of a type: zero for numeric types and their wrappers,
     * {@code false}, {@code '\0'}, the empty string, otherwise {@code null}.
     */
    public static <T> T defaultValue(Class<T> type) {
        Objects.requireNonNull(type, "type");
        @SuppressWarnings("unchecked")
        T value = (T) DEFAULTS.get(box(type));
        return value;
    }

    /**
     * Renders a value for diagnostics. Strings are quoted, arrays are expanded.
     */
    public static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return "\"" + s + "\"";
        }
        if (value instanceof Character c) {
            return "'" + c + "'";
        }
        if (value.getClass().isArray()) {
            if (value instanceof Object[] array) {
                return Arrays.deepToString(array);
            }
            return primitiveArrayToString(value);
        }
        return value.toString();
    }

    /**
     * Renders an argument list as {@code (a, b, c)}.
     */
    public static String describeArguments(Iterable<?> arguments) {
        StringBuilder b = new StringBuilder("(");
        boolean first = true;
        for (Object argument : arguments) {
            if (!first) {
                b.append(", ");
            }
            b.append(describe(argument));
            first = false;
        }
        return b.append(')').toString();
    }

    private static String primitiveArrayToString(Object array) {
        if (array instanceof int[] a) return Arrays.toString(a);
        if (array instanceof long[] a) return Arrays.toString(a);
        if (array instanceof byte[] a) return Arrays.toString(a);
        if (array instanceof short[] a) return Arrays.toString(a);
        if (array instanceof char[] a) return Arrays.toString(a);
        if (array instanceof boolean[] a) return Arrays.toString(a);
        if (array instanceof float[] a) return Arrays.toString(a);
        if (array instanceof double[] a) return Arrays.toString(a);
        return array.toString();
    }
}
