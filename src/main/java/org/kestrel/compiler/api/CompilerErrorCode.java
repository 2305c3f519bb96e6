package org.kestrel.compiler.api;

/**
 * Stable, testable classification of the errors raised during semantic analysis.
 * This decouples test logic from the exact wording of messages.
 */
public enum CompilerErrorCode {
    // region Type Errors
    /** No coercion rule converts the value to the requested type. */
    TYPE_MISMATCH,
    /** A compile-time-known number does not fit the destination type. */
    VALUE_DOES_NOT_FIT,
    /** Peer-type resolution found no common type. */
    INCOMPATIBLE_PEER_TYPES,
    /** An operation was applied to operands of an unsupported type. */
    INVALID_OPERANDS,
    /** Field or member access that the type does not support. */
    INVALID_FIELD_ACCESS,
    // endregion

    // region Control Flow Errors
    /** Two switch cases cover the same value. */
    DUPLICATE_SWITCH_VALUE,
    /** A switch neither covers every value nor has an else prong. */
    NON_EXHAUSTIVE_SWITCH,
    /** A switch has an else prong although every value is covered. */
    UNREACHABLE_ELSE_PRONG,
    /** The switch target type cannot be switched on. */
    INVALID_SWITCH_TARGET,
    /** The callee is not a function. */
    NOT_CALLABLE,
    /** Argument count does not match the callee signature. */
    WRONG_ARGUMENT_COUNT,
    /** Compile-time evaluation took more backward branches than allowed. */
    BRANCH_QUOTA_EXCEEDED,
    /** Compile-time evaluation nested deeper than the analysis thread's stack allows. */
    EVALUATION_TOO_DEEP,
    // endregion

    // region Compile-Time Evaluation Errors
    /** A value required at compile time is only known at run time. */
    NOT_COMPTIME_KNOWN,
    /** A compile-time-known null optional was unwrapped. */
    UNWRAP_NULL,
    /** A compile-time-known error was unwrapped as a payload. */
    UNWRAP_ERROR,
    /** An undefined value was used where it causes undefined behavior. */
    UNDEFINED_VALUE,
    /** Compile-time arithmetic overflowed or divided by zero. */
    ARITHMETIC_FAULT,
    /** A user-requested compile error. */
    USER_COMPILE_ERROR,
    // endregion

    // region Declaration Errors
    /** An import could not be resolved. */
    IMPORT_FAILED,
    /** A declaration refers back to itself while being analyzed. */
    DEPENDENCY_LOOP,
    /** A referenced declaration failed analysis. */
    DEPENDENCY_FAILURE,
    // endregion

    // region General Errors
    /** The operation is recognized but not supported yet. */
    NOT_IMPLEMENTED,
    /** Any other error. */
    UNCLASSIFIED
    // endregion
}
