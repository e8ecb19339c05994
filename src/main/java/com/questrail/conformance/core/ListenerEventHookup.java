package com.questrail.conformance.core;

import com.questrail.conformance.api.EventHookup;
import com.questrail.conformance.api.EventRaiser;
import com.questrail.conformance.model.MemberDescriptor;
import com.questrail.conformance.model.MemberDescriptors;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Proxy;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * ListenerEventHookup
 * -----------------------------------------------------------------------------
 * {@link EventHookup} for JavaBeans-style events, where the event {@code name}
 * is exposed as {@code addNameListener(L)} / {@code removeNameListener(L)}.
 *
 * <p>Attaching creates a dynamic proxy of the listener interface {@code L} whose
 * single abstract method forwards its arguments to the raiser. The proxy is
 * remembered per raiser so that detaching removes the exact listener instance
 * that was added.</p>
 *
 * <p>Instance events are attached to the subscription target. Adapter-scoped
 * events, which are subscribed without a target, are attached to the adapter
 * instance given at construction; static events need no instance.</p>
 */
public final class ListenerEventHookup implements EventHookup
{
    private final MemberDescriptor event;
    private final Object adapter;
    private final Method addMethod;
    private final Method removeMethod;
    private final Class<?> listenerType;
    private final Method handlerMethod;

    private final Object lock = new Object();
    private final Map<EventRaiser, Object> listeners = new IdentityHashMap<>();

    private ListenerEventHookup(MemberDescriptor event, Object adapter) {
        this.event = Objects.requireNonNull(event, "event");
        if (event.kind() != MemberDescriptor.Kind.EVENT) {
            throw new IllegalArgumentException(event + " is not an event");
        }
        this.adapter = adapter;
        this.addMethod = MemberDescriptors.listenerMethod(event.declaringType(), "add", event.name());
        this.removeMethod = MemberDescriptors.listenerMethod(event.declaringType(), "remove", event.name());
        this.listenerType = addMethod.getParameterTypes()[0];
        this.handlerMethod = MemberDescriptors.singleAbstractMethod(listenerType, event.name(), event.declaringType());
        addMethod.setAccessible(true);
        removeMethod.setAccessible(true);
    }

    /**
     * A hookup for a static event or an event of the subscription target.
     */
    public static ListenerEventHookup forEvent(MemberDescriptor event) {
        return new ListenerEventHookup(event, null);
    }

    /**
     * A hookup for an adapter-scoped event raised by the given adapter.
     */
    public static ListenerEventHookup forAdapterEvent(MemberDescriptor event, Object adapter) {
        Objects.requireNonNull(adapter, "adapter");
        if (!event.declaringType().isInstance(adapter)) {
            throw new IllegalArgumentException(adapter + " does not declare " + event);
        }
        return new ListenerEventHookup(event, adapter);
    }

    @Override
    public void attach(Object target, EventRaiser raiser) {
        Objects.requireNonNull(raiser, "raiser");
        Object listener;
        synchronized (lock) {
            listener = listeners.computeIfAbsent(raiser, this::newListener);
        }
        invoke(addMethod, source(target), listener);
    }

    @Override
    public void detach(Object target, EventRaiser raiser) {
        Objects.requireNonNull(raiser, "raiser");
        Object listener;
        synchronized (lock) {
            listener = listeners.remove(raiser);
        }
        if (listener != null) {
            invoke(removeMethod, source(target), listener);
        }
    }

    private Object source(Object target) {
        if (Modifier.isStatic(addMethod.getModifiers())) {
            return null;
        }
        Object source = target != null ? target : adapter;
        if (source == null) {
            throw new IllegalStateException("No instance to attach " + event + " to");
        }
        return source;
    }

    private Object newListener(EventRaiser raiser) {
        InvocationHandler handler = (proxy, method, args) -> {
            if (method.equals(handlerMethod)) {
                raiser.raise(args == null ? new Object[0] : args);
                return null;
            }
            switch (method.getName()) {
                case "equals":
                    return proxy == args[0];
                case "hashCode":
                    return System.identityHashCode(proxy);
                case "toString":
                    return "listener for " + event;
                default:
                    throw new UnsupportedOperationException(method.toString());
            }
        };
        return Proxy.newProxyInstance(listenerType.getClassLoader(), new Class<?>[]{listenerType}, handler);
    }

    private static void invoke(Method method, Object source, Object listener) {
        try {
            method.invoke(source, listener);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot access " + method, e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(method + " failed", cause);
        }
    }
}
