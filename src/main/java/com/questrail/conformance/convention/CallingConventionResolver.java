package com.questrail.conformance.convention;

import com.questrail.conformance.model.MemberDescriptor;
import com.questrail.conformance.util.Values;

import java.util.List;
import java.util.Objects;

/**
 * CallingConventionResolver
 * -----------------------------------------------------------------------------
 * Decides how a checker with the given parameter types may be invoked against
 * observations of a member.
 *
 * <h2>Rules</h2>
 * <ol>
 *   <li>Exactly one {@code Object} parameter: {@link CallingConvention#PARAMETERS_ARRAY},
 *       or {@link CallingConvention#TARGET_AND_PARAMETERS_ARRAY} when the member
 *       requires a target.</li>
 *   <li>As many parameters as observed values: {@link CallingConvention#PARAMETERS_DIRECT}
 *       if the types match pairwise.</li>
 *   <li>One more parameter than observed values: the first must be the member's
 *       declaring type and the member must require a target;
 *       {@link CallingConvention#TARGET_AND_PARAMETERS_DIRECT} if the remaining
 *       types match pairwise.</li>
 *   <li>Anything else is {@link CallingConvention#INVALID}.</li>
 * </ol>
 *
 * Types match when they are equal after primitives are replaced by their
 * wrappers. This is a pure function with no state.
 */
public final class CallingConventionResolver
{
    private CallingConventionResolver() {
    }

    public static CallingConvention resolve(MemberDescriptor member, List<Class<?>> checkerParameterTypes) {
        Objects.requireNonNull(member, "member");
        Objects.requireNonNull(checkerParameterTypes, "checkerParameterTypes");

        if (checkerParameterTypes.size() == 1 && checkerParameterTypes.get(0) == Object.class) {
            return member.requiresTarget()
                    ? CallingConvention.TARGET_AND_PARAMETERS_ARRAY
                    : CallingConvention.PARAMETERS_ARRAY;
        }

        List<Class<?>> outputs = member.observedTypes();
        int offset;
        CallingConvention convention;

        if (checkerParameterTypes.size() == outputs.size()) {
            offset = 0;
            convention = CallingConvention.PARAMETERS_DIRECT;
        } else if (checkerParameterTypes.size() == outputs.size() + 1) {
            if (!member.requiresTarget() || checkerParameterTypes.get(0) != member.declaringType()) {
                return CallingConvention.INVALID;
            }
            offset = 1;
            convention = CallingConvention.TARGET_AND_PARAMETERS_DIRECT;
        } else {
            return CallingConvention.INVALID;
        }

        for (int i = 0; i < outputs.size(); i++) {
            if (!Values.sameType(outputs.get(i), checkerParameterTypes.get(offset + i))) {
                return CallingConvention.INVALID;
            }
        }
        return convention;
    }
}
