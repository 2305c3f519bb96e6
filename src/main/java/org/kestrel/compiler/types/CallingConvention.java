package org.kestrel.compiler.types;

import java.util.Optional;

public enum CallingConvention {
    UNSPECIFIED("Unspecified"),
    C("C"),
    NAKED("Naked"),
    INLINE("Inline"),
    STDCALL("Stdcall");

    private final String sourceName;

    CallingConvention(String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * @param name The name as written in source, e.g. {@code "Naked"}.
     * @return The calling convention, or empty if the name is unknown.
     */
    public static Optional<CallingConvention> fromSourceName(String name) {
        for (CallingConvention cc : values()) {
            if (cc.sourceName.equals(name)) {
                return Optional.of(cc);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return sourceName;
    }
}
