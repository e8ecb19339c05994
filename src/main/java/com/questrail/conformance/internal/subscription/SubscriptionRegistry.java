package com.questrail.conformance.internal.subscription;

import com.questrail.conformance.api.EventHookup;
import com.questrail.conformance.api.EventRaiser;
import com.questrail.conformance.model.MemberDescriptor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SubscriptionRegistry
 * -----------------------------------------------------------------------------
 * The (event, target type) to handler map owned by one test manager.
 *
 * <p>Each key keeps one {@link EventRaiser} per target instance together with
 * the {@link EventHookup} that last attached it. Subscribing again for a known
 * target reuses its raiser, detaches it through the hookup that attached it and
 * attaches it through the new one, so a source never holds more than one
 * listener per subscription.</p>
 *
 * <p>Static and adapter-scoped events are keyed by their declaring type and
 * subscribed with a {@code null} target.</p>
 */
public final class SubscriptionRegistry
{
    /**
     * Receives the occurrences of subscribed events.
     */
    @FunctionalInterface
    public interface Sink {
        void onEvent(MemberDescriptor event, Object target, Object[] arguments);
    }

    private record Key(MemberDescriptor event, Class<?> targetType) {
    }

    private static final class Attachment {
        private final Object target;
        private final EventRaiser raiser;
        private EventHookup hookup;

        private Attachment(Object target, EventRaiser raiser) {
            this.target = target;
            this.raiser = raiser;
        }

        private void detach() {
            hookup.detach(target, raiser);
        }
    }

    private static final class Subscription {
        private final Map<Object, Attachment> targeted = new IdentityHashMap<>();
        private Attachment untargeted;
    }

    private final Object lock = new Object();
    private final Map<Key, Subscription> subscriptions = new HashMap<>();
    private final Sink sink;

    public SubscriptionRegistry(Sink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Binds the event on the target to the sink.
     *
     * @param event  an event descriptor
     * @param target the instance raising the event, or {@code null} for static
     *               and adapter-scoped events
     * @param hookup how to attach to the live source
     */
    public void subscribe(MemberDescriptor event, Object target, EventHookup hookup) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(hookup, "hookup");
        if (event.kind() != MemberDescriptor.Kind.EVENT) {
            throw new IllegalArgumentException(event + " is not an event");
        }
        if (event.requiresTarget() && target == null) {
            throw new IllegalArgumentException(event + " requires a target instance");
        }

        Object effectiveTarget = event.requiresTarget() ? target : null;
        Class<?> targetType = effectiveTarget == null ? event.declaringType() : effectiveTarget.getClass();

        Attachment attachment;
        EventHookup previous;
        synchronized (lock) {
            Subscription subscription = subscriptions.computeIfAbsent(
                    new Key(event, targetType), k -> new Subscription());
            attachment = attachmentFor(subscription, event, effectiveTarget);
            previous = attachment.hookup;
            attachment.hookup = hookup;
        }

        (previous != null ? previous : hookup).detach(effectiveTarget, attachment.raiser);
        hookup.attach(effectiveTarget, attachment.raiser);
    }

    /**
     * Detaches every raiser from its source and forgets all subscriptions.
     *
     * <p>A failing detach does not stop the others; the first failure is
     * rethrown after every attachment has been visited, with later ones added
     * as suppressed.</p>
     */
    public void clear() {
        List<Attachment> attachments = new ArrayList<>();
        synchronized (lock) {
            for (Subscription subscription : subscriptions.values()) {
                attachments.addAll(subscription.targeted.values());
                if (subscription.untargeted != null) {
                    attachments.add(subscription.untargeted);
                }
            }
            subscriptions.clear();
        }

        RuntimeException failure = null;
        for (Attachment attachment : attachments) {
            try {
                attachment.detach();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    public int size() {
        synchronized (lock) {
            return subscriptions.size();
        }
    }

    private Attachment attachmentFor(Subscription subscription, MemberDescriptor event, Object target) {
        if (target == null) {
            if (subscription.untargeted == null) {
                subscription.untargeted = new Attachment(null, arguments -> sink.onEvent(event, null, arguments));
            }
            return subscription.untargeted;
        }
        return subscription.targeted.computeIfAbsent(target,
                t -> new Attachment(t, arguments -> sink.onEvent(event, t, arguments)));
    }
}
