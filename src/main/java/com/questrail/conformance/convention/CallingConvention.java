package com.questrail.conformance.convention;

/**
 * How a checker is invoked against an observation.
 */
public enum CallingConvention
{
    /** The checker's shape is incompatible with the member. */
    INVALID,

    /** The observed values are passed as the checker's parameters. */
    PARAMETERS_DIRECT,

    /** The target instance, then the observed values, are passed as parameters. */
    TARGET_AND_PARAMETERS_DIRECT,

    /** The checker's single untyped parameter receives the observed values as an array. */
    PARAMETERS_ARRAY,

    /** The checker's single untyped parameter receives the target followed by the observed values. */
    TARGET_AND_PARAMETERS_ARRAY
}
