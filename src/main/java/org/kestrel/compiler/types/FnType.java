package org.kestrel.compiler.types;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A function type.
 *
 * @param paramTypes The fixed parameter types.
 * @param returnType The return type.
 * @param cc         The calling convention.
 * @param varArgs    Whether arguments past the fixed parameters are accepted.
 */
public record FnType(List<Type> paramTypes, Type returnType, CallingConvention cc, boolean varArgs) implements Type {

    public FnType {
        paramTypes = List.copyOf(paramTypes);
    }

    @Override
    public TypeKind kind() {
        return TypeKind.FN;
    }

    @Override
    public String toString() {
        String params = paramTypes.stream().map(Type::toString).collect(Collectors.joining(", "));
        if (varArgs) {
            params = params.isEmpty() ? "..." : params + ", ...";
        }
        String callconv = cc == CallingConvention.UNSPECIFIED ? "" : " callconv(." + cc + ")";
        return "fn(" + params + ")" + callconv + " " + returnType;
    }
}
