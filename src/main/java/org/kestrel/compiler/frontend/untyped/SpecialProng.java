package org.kestrel.compiler.frontend.untyped;

/**
 * The catch-all prong of a switch, if any.
 */
public enum SpecialProng {
    NONE,
    /** {@code else => ...} */
    ELSE,
    /** {@code _ => ...}, only valid for non-exhaustive enums. */
    UNDERSCORE
}
