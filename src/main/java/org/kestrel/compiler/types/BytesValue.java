package org.kestrel.compiler.types;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * The contents of a string literal as raw bytes. Elements past the end read as the zero sentinel.
 */
public record BytesValue(byte[] bytes) implements Value {

    public BytesValue {
        bytes = bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    /**
     * @return The unsigned byte at {@code index}.
     */
    public int byteAt(int index) {
        return Byte.toUnsignedInt(bytes[index]);
    }

    public String text() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BytesValue other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "\"" + text().replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }
}
