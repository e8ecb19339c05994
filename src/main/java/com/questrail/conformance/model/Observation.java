package com.questrail.conformance.model;

import com.questrail.conformance.util.Values;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Observation
 * -----------------------------------------------------------------------------
 * A timestamped record that a specific event fired or a specific method
 * returned, together with its actual arguments.
 *
 * <h2>Role in the architecture</h2>
 * Observations are produced by adapter-side code on arbitrary threads and
 * handed to the test manager, which queues them until an expectation consumes
 * them. They are the <em>only</em> way information about the system under test
 * enters the oracle.
 *
 * <h2>Design constraints</h2>
 * <ul>
 *   <li>Observations are immutable</li>
 *   <li>Identity is the pair (member, target); the target is {@code null} for
 *       static and adapter-scoped members</li>
 *   <li>Arguments follow {@link MemberDescriptor#observedTypes()} in order</li>
 * </ul>
 */
public sealed interface Observation permits AvailableEvent, AvailableReturn
{
    MemberDescriptor member();

    /**
     * The instance the member belongs to, or {@code null}.
     */
    Object target();

    List<Object> arguments();

    /**
     * Time at which the observation was captured.
     */
    Instant timestamp();

    /**
     * Returns a fresh copy of the arguments, for checker invocation.
     */
    default Object[] argumentArray() {
        return arguments().toArray();
    }

    /**
     * Convenience base class holding the common fields.
     */
    abstract class Base {
        private final MemberDescriptor member;
        private final Object target;
        private final List<Object> arguments;
        private final Instant timestamp;

        protected Base(MemberDescriptor member, Object target, Object[] arguments, Instant timestamp) {
            this.member = Objects.requireNonNull(member, "member");
            this.target = target;
            Objects.requireNonNull(arguments, "arguments");
            this.arguments = Collections.unmodifiableList(Arrays.asList(arguments.clone()));
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");

            List<Class<?>> observed = member.observedTypes();
            if (observed.size() != arguments.length) {
                throw new IllegalArgumentException(String.format(
                        "%s carries %d value(s), got %d", member, observed.size(), arguments.length));
            }
            for (int i = 0; i < arguments.length; i++) {
                if (!Values.fits(observed.get(i), arguments[i])) {
                    throw new IllegalArgumentException(String.format(
                            "%s: value %s at position %d is not a %s",
                            member, Values.describe(arguments[i]), i, observed.get(i).getName()));
                }
            }
            if (member.requiresTarget() && target == null) {
                throw new IllegalArgumentException(member + " requires a target instance");
            }
            if (!member.requiresTarget() && target != null) {
                throw new IllegalArgumentException(member + " is static or adapter-scoped and takes no target");
            }
        }

        public MemberDescriptor member() {
            return member;
        }

        public Object target() {
            return target;
        }

        public List<Object> arguments() {
            return arguments;
        }

        public Instant timestamp() {
            return timestamp;
        }

        protected String describe(String kind) {
            StringBuilder b = new StringBuilder(kind).append(' ')
                    .append(member.declaringType().getSimpleName()).append('.').append(member.name())
                    .append(Values.describeArguments(arguments));
            if (target != null) {
                b.append(" on ").append(target);
            }
            return b.toString();
        }
    }
}
