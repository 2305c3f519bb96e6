package org.kestrel.compiler.frontend.semantics.coercion;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.api.SemanticException;
import org.kestrel.compiler.frontend.semantics.Sema;
import org.kestrel.compiler.ir.IrInst;
import org.kestrel.compiler.types.ErrorUnionType;
import org.kestrel.compiler.types.FloatType;
import org.kestrel.compiler.types.IntType;
import org.kestrel.compiler.types.OptionalType;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.Type;
import org.kestrel.compiler.types.TypeKind;

import java.util.List;

/**
 * Computes the common type of a set of values by pairwise reduction.
 */
public final class PeerTypeResolver {

    private final Sema sema;

    public PeerTypeResolver(Sema sema) {
        this.sema = sema;
    }

    /**
     * @return {@code noreturn} for no instructions, otherwise the type every instruction coerces to.
     */
    public Type resolve(List<IrInst> insts) throws SemanticException {
        if (insts.isEmpty()) {
            return SimpleType.NO_RETURN;
        }
        Type chosenType = insts.get(0).type();
        for (int i = 1; i < insts.size(); i++) {
            IrInst next = insts.get(i);
            Type nextType = next.type();
            Type merged = merge(chosenType, nextType);
            if (merged == null) {
                throw sema.fail(next.source(), CompilerErrorCode.INCOMPATIBLE_PEER_TYPES,
                        "incompatible types: '%s' and '%s'", chosenType, nextType);
            }
            chosenType = merged;
        }
        return chosenType;
    }

    /**
     * @return The common type of the pair, or {@code null} if there is none.
     */
    private static Type merge(Type chosen, Type next) {
        if (next.equals(chosen) || next == SimpleType.NO_RETURN || next == SimpleType.UNDEFINED) {
            return chosen;
        }
        if (chosen == SimpleType.NO_RETURN || chosen == SimpleType.UNDEFINED) {
            return next;
        }
        if (chosen instanceof IntType c && next instanceof IntType n && c.signedness() == n.signedness()) {
            return n.bits() > c.bits() ? next : chosen;
        }
        if (chosen instanceof FloatType c && next instanceof FloatType n) {
            return n.bits() > c.bits() ? next : chosen;
        }
        if (isLiteral(chosen) && isConcreteOrLiteralPromotion(chosen, next)) {
            return next;
        }
        if (isLiteral(next) && isConcreteOrLiteralPromotion(next, chosen)) {
            return chosen;
        }
        if (chosen == SimpleType.NULL) {
            return next instanceof OptionalType ? next : new OptionalType(next);
        }
        if (next == SimpleType.NULL) {
            return chosen instanceof OptionalType ? chosen : new OptionalType(chosen);
        }
        if (chosen instanceof OptionalType o && merge(o.child(), next) == o.child()) {
            return chosen;
        }
        if (next instanceof OptionalType o && merge(o.child(), chosen) == o.child()) {
            return next;
        }
        if (chosen instanceof ErrorUnionType u && absorbs(u, next)) {
            return chosen;
        }
        if (next instanceof ErrorUnionType u && absorbs(u, chosen)) {
            return next;
        }
        return null;
    }

    /**
     * @return {@code true} if {@code peer} is the union's error set or merges into its payload unchanged.
     */
    private static boolean absorbs(ErrorUnionType union, Type peer) {
        if (peer.equals(union.errorSet())) {
            return true;
        }
        return !(peer instanceof ErrorUnionType) && merge(union.payload(), peer) == union.payload();
    }

    private static boolean isLiteral(Type type) {
        return type == SimpleType.COMPTIME_INT || type == SimpleType.COMPTIME_FLOAT;
    }

    /**
     * @return {@code true} if a literal of type {@code literal} takes on the peer type {@code other}.
     */
    private static boolean isConcreteOrLiteralPromotion(Type literal, Type other) {
        if (other.kind() == TypeKind.FLOAT) {
            return true;
        }
        if (literal == SimpleType.COMPTIME_INT) {
            return other.kind() == TypeKind.INT || other == SimpleType.COMPTIME_FLOAT;
        }
        return false;
    }
}
