package com.questrail.conformance.expect;

import com.questrail.conformance.convention.CheckerInvoker;
import com.questrail.conformance.model.Checker;
import com.questrail.conformance.model.MemberDescriptor;
import com.questrail.conformance.model.Observation;

import java.util.Objects;
import java.util.Optional;

/**
 * ExpectedObservation
 * -----------------------------------------------------------------------------
 * A declarative pattern an {@link Observation} is matched against: an identity
 * filter plus an optional checker.
 *
 * <h2>Identity</h2>
 * An observation is eligible for this pattern when it concerns the same member
 * and, unless the pattern leaves the target open ({@code null}), the very same
 * target instance.
 *
 * <h2>Checker binding</h2>
 * The checker is bound to the member when the pattern is created, so an
 * incompatible checker shape fails at construction rather than while matching.
 * Patterns are immutable; the oracle never modifies them.
 *
 * @param <O> the kind of observation this pattern applies to
 */
public abstract class ExpectedObservation<O extends Observation>
{
    private final MemberDescriptor member;
    private final Object target;
    private final CheckerInvoker checker;

    protected ExpectedObservation(MemberDescriptor member, Object target, Checker checker) {
        this.member = Objects.requireNonNull(member, "member");
        this.target = target;
        this.checker = checker == null ? null : CheckerInvoker.bind(member, checker);
    }

    public MemberDescriptor member() {
        return member;
    }

    /**
     * The expected target, or {@code null} if any target is accepted.
     */
    public Object target() {
        return target;
    }

    public Optional<CheckerInvoker> checker() {
        return Optional.ofNullable(checker);
    }

    public boolean matchesIdentity(O observation) {
        return member.equals(observation.member())
                && (target == null || target == observation.target());
    }

    /**
     * Runs the checker, if any, against the observation's target and values.
     */
    public void check(O observation) {
        if (checker != null) {
            checker.invoke(observation.target(), observation.argumentArray());
        }
    }

    protected String describe(String kind) {
        StringBuilder b = new StringBuilder(kind).append(' ').append(member);
        if (target != null) {
            b.append(" on ").append(target);
        }
        if (checker != null) {
            b.append(" with ").append(checker.checker());
        }
        return b.toString();
    }
}
