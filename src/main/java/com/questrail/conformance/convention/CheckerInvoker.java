package com.questrail.conformance.convention;

import com.questrail.conformance.model.Checker;
import com.questrail.conformance.model.MemberDescriptor;

import java.util.Objects;

/**
 * CheckerInvoker
 * -----------------------------------------------------------------------------
 * A checker bound to a member under its resolved calling convention.
 *
 * <p>Binding resolves the convention once and selects one variant of this
 * closed union; invoking never re-examines shapes. Every variant exposes the
 * same capability: invoke with a target and the observed values.</p>
 */
public sealed interface CheckerInvoker
        permits CheckerInvoker.ParametersDirect,
                CheckerInvoker.TargetAndParametersDirect,
                CheckerInvoker.ParametersArray,
                CheckerInvoker.TargetAndParametersArray
{
    void invoke(Object target, Object[] values);

    CallingConvention convention();

    Checker checker();

    /**
     * @throws IllegalArgumentException if the checker's shape is incompatible with the member
     */
    static CheckerInvoker bind(MemberDescriptor member, Checker checker) {
        Objects.requireNonNull(member, "member");
        Objects.requireNonNull(checker, "checker");

        CallingConvention convention = CallingConventionResolver.resolve(member, checker.parameterTypes());
        return switch (convention) {
            case PARAMETERS_DIRECT -> new ParametersDirect(checker);
            case TARGET_AND_PARAMETERS_DIRECT -> new TargetAndParametersDirect(checker);
            case PARAMETERS_ARRAY -> new ParametersArray(checker);
            case TARGET_AND_PARAMETERS_ARRAY -> new TargetAndParametersArray(checker);
            case INVALID -> throw new IllegalArgumentException(String.format(
                    "%s is incompatible with %s, which carries %s%s",
                    checker, member, member.observedTypes(),
                    member.requiresTarget() ? " on a target" : ""));
        };
    }

    private static Object[] prepend(Object target, Object[] values) {
        Object[] withTarget = new Object[values.length + 1];
        withTarget[0] = target;
        System.arraycopy(values, 0, withTarget, 1, values.length);
        return withTarget;
    }

    record ParametersDirect(Checker checker) implements CheckerInvoker {
        @Override
        public void invoke(Object target, Object[] values) {
            checker.invoke(values);
        }

        @Override
        public CallingConvention convention() {
            return CallingConvention.PARAMETERS_DIRECT;
        }
    }

    record TargetAndParametersDirect(Checker checker) implements CheckerInvoker {
        @Override
        public void invoke(Object target, Object[] values) {
            checker.invoke(prepend(target, values));
        }

        @Override
        public CallingConvention convention() {
            return CallingConvention.TARGET_AND_PARAMETERS_DIRECT;
        }
    }

    record ParametersArray(Checker checker) implements CheckerInvoker {
        @Override
        public void invoke(Object target, Object[] values) {
            checker.invoke(new Object[]{values});
        }

        @Override
        public CallingConvention convention() {
            return CallingConvention.PARAMETERS_ARRAY;
        }
    }

    record TargetAndParametersArray(Checker checker) implements CheckerInvoker {
        @Override
        public void invoke(Object target, Object[] values) {
            checker.invoke(new Object[]{prepend(target, values)});
        }

        @Override
        public CallingConvention convention() {
            return CallingConvention.TARGET_AND_PARAMETERS_ARRAY;
        }
    }
}
