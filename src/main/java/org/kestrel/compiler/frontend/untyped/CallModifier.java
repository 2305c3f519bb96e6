package org.kestrel.compiler.frontend.untyped;

/**
 * How a call site asks to be lowered.
 */
public enum CallModifier {
    AUTO,
    COMPILE_TIME,
    ALWAYS_INLINE,
    NEVER_INLINE;

    /**
     * @param tag A call opcode.
     * @return The modifier the opcode implies.
     */
    public static CallModifier forTag(Tag tag) {
        return switch (tag) {
            case CALL -> AUTO;
            case CALL_COMPILE_TIME -> COMPILE_TIME;
            case CALL_ALWAYS_INLINE -> ALWAYS_INLINE;
            case CALL_NEVER_INLINE -> NEVER_INLINE;
            default -> throw new IllegalArgumentException("not a call opcode: " + tag);
        };
    }
}
