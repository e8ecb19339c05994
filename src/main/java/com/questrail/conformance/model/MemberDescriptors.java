package com.questrail.conformance.model;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Resolves {@link MemberDescriptor}s from reflection metadata.
 *
 * <p>Resolution happens once, at registration time; every lookup that cannot be
 * resolved fails immediately with an {@link IllegalStateException}.</p>
 *
 * <h2>Events</h2>
 * Java has no first-class events. An event named {@code fileCreated} on type
 * {@code T} is the JavaBeans listener pair {@code addFileCreatedListener(L)} /
 * {@code removeFileCreatedListener(L)} declared by {@code T}, where {@code L} is
 * a functional interface whose single abstract method's parameters are the
 * event's parameters.
 */
public final class MemberDescriptors
{
    private MemberDescriptors() {
    }

    /**
     * Resolves a public, protected, package-private or private method declared
     * by the type or inherited from one of its superclasses or interfaces.
     */
    public static MemberDescriptor method(Class<?> type, String name, Class<?>... parameterTypes) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        return method(findMethod(type, name, parameterTypes));
    }

    public static MemberDescriptor method(Method method) {
        Objects.requireNonNull(method, "method");
        return MemberDescriptor.method(method.getDeclaringClass(), method.getName())
                .withStatic(Modifier.isStatic(method.getModifiers()))
                .withParameters(method.getParameterTypes())
                .withReturnType(method.getReturnType())
                .build();
    }

    public static MemberDescriptor constructor(Class<?> type, Class<?>... parameterTypes) {
        Objects.requireNonNull(type, "type");
        Constructor<?> constructor;
        try {
            constructor = type.getDeclaredConstructor(parameterTypes);
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException(
                    String.format("Cannot resolve constructor for type '%s'", type.getName()), e);
        }
        return MemberDescriptor.constructor(type)
                .withParameters(constructor.getParameterTypes())
                .build();
    }

    public static MemberDescriptor event(Class<?> type, String name) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        Method add = listenerMethod(type, "add", name);
        Class<?> listenerType = add.getParameterTypes()[0];
        Method handler = singleAbstractMethod(listenerType, name, type);
        return MemberDescriptor.event(type, name)
                .withStatic(Modifier.isStatic(add.getModifiers()))
                .withParameters(handler.getParameterTypes())
                .build();
    }

    /**
     * Finds {@code prefix + Name + "Listener"} taking exactly one interface-typed
     * parameter, for example {@code addFileCreatedListener}.
     */
    public static Method listenerMethod(Class<?> type, String prefix, String eventName) {
        String methodName = prefix + capitalize(eventName) + "Listener";
        for (Method candidate : type.getMethods()) {
            if (candidate.getName().equals(methodName)
                    && candidate.getParameterCount() == 1
                    && candidate.getParameterTypes()[0].isInterface()) {
                return candidate;
            }
        }
        throw new IllegalStateException(
                String.format("Cannot resolve event '%s' for type '%s'", eventName, type.getName()));
    }

    /**
     * Returns the single abstract method of a listener interface.
     */
    public static Method singleAbstractMethod(Class<?> listenerType, String eventName, Class<?> type) {
        List<Method> abstractMethods = new ArrayList<>();
        for (Method m : listenerType.getMethods()) {
            if (Modifier.isAbstract(m.getModifiers()) && !isObjectMethod(m)) {
                abstractMethods.add(m);
            }
        }
        if (abstractMethods.size() != 1) {
            throw new IllegalStateException(String.format(
                    "Cannot resolve event '%s' for type '%s': listener %s must have exactly one abstract method",
                    eventName, type.getName(), listenerType.getName()));
        }
        return abstractMethods.get(0);
    }

    private static Method findMethod(Class<?> type, String name, Class<?>[] parameterTypes) {
        try {
            return type.getMethod(name, parameterTypes);
        } catch (NoSuchMethodException ignored) {
            // fall through to non-public members
        }
        for (Class<?> c = type; c != null; c = c.getSuperclass()) {
            try {
                return c.getDeclaredMethod(name, parameterTypes);
            } catch (NoSuchMethodException ignored) {
                // keep walking up
            }
        }
        throw new IllegalStateException(String.format("Cannot resolve method '%s%s' in type '%s'",
                name, Arrays.toString(parameterTypes), type.getName()));
    }

    private static boolean isObjectMethod(Method m) {
        try {
            Object.class.getMethod(m.getName(), m.getParameterTypes());
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    private static String capitalize(String s) {
        if (s.isEmpty()) {
            return s;
        }
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
