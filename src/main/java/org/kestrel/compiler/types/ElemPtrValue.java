package org.kestrel.compiler.types;

/**
 * A compile-time-known pointer to one element of a compile-time-known array.
 *
 * @param arrayPtr A pointer value whose pointee is the array.
 * @param index    The element index.
 */
public record ElemPtrValue(Value arrayPtr, long index) implements Value {

    @Override
    public String toString() {
        return "&" + arrayPtr + "[" + index + "]";
    }
}
