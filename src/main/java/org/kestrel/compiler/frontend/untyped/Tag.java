package org.kestrel.compiler.frontend.untyped;

/**
 * Opcodes of the untyped instruction stream.
 * <p>
 * The comment on each group names the {@link InstData} variant its instructions carry.
 */
public enum Tag {
    // region constants
    /** {@link InstData.Int} */
    INT,
    /** {@link InstData.Float} */
    FLOAT,
    /** {@link InstData.Str} */
    STR,
    /** {@link InstData.Str} */
    ENUM_LITERAL,
    /** {@link InstData.Node} */
    VOID_VALUE,
    // endregion

    // region type construction
    /** {@link InstData.IntType} */
    INT_TYPE,
    /** {@link InstData.UnNode} */
    OPTIONAL_TYPE,
    /** {@link InstData.Bin}: length, element type. */
    ARRAY_TYPE,
    /** {@link InstData.PlNode}: {@link UntypedCode.ArrayTypeSentinel}. */
    ARRAY_TYPE_SENTINEL,
    /** {@link InstData.PtrTypeSimple} */
    PTR_TYPE_SIMPLE,
    /** {@link InstData.Bin}: error set, payload. */
    ERROR_UNION_TYPE,
    /** {@link InstData.PlNode}: error names. */
    ERROR_SET,
    /** {@link InstData.Str} */
    ERROR_VALUE,
    /** {@link InstData.Bin} */
    MERGE_ERROR_SETS,
    /** {@link InstData.PlNode}: {@link UntypedCode.FnTypePayload} without calling convention. */
    FN_TYPE,
    /** {@link InstData.PlNode}: {@link UntypedCode.FnTypePayload}. */
    FN_TYPE_CC,
    /** {@link InstData.ParamType} */
    PARAM_TYPE,
    /** {@link InstData.UnNode} */
    TYPEOF,
    /** {@link InstData.PlNode}: operand list. */
    TYPEOF_PEER,
    // endregion

    // region declarations
    /** {@link InstData.Str} */
    DECL_REF,
    /** {@link InstData.Str} */
    DECL_VAL,
    /** {@link InstData.Str} */
    IMPORT,
    // endregion

    // region control flow
    /** {@link InstData.PlNode}: body. */
    BLOCK,
    /** {@link InstData.PlNode}: body. */
    BLOCK_COMPTIME,
    /** {@link InstData.PlNode}: body. */
    BLOCK_FLAT,
    /** {@link InstData.PlNode}: body. */
    BLOCK_COMPTIME_FLAT,
    /** {@link InstData.Break} */
    BREAK,
    /** {@link InstData.Break} without operand. */
    BREAK_VOID,
    /** {@link InstData.PlNode}: body. */
    LOOP,
    /** {@link InstData.PlNode}: {@link UntypedCode.CondBrPayload}. */
    CONDBR,
    /** {@link InstData.PlNode}: {@link UntypedCode.SwitchBrPayload}. */
    SWITCHBR,
    /** {@link InstData.PlNode}: {@link UntypedCode.SwitchBrPayload} whose target is a pointer. */
    SWITCHBR_REF,
    /** {@link InstData.PlNode}: {@link UntypedCode.CallPayload}. */
    CALL,
    CALL_COMPILE_TIME,
    CALL_ALWAYS_INLINE,
    CALL_NEVER_INLINE,
    /** {@link InstData.UnNode}; operand {@link Ref#NONE} returns void. */
    RET,
    // endregion

    // region arithmetic and bits, all Bin except BIT_NOT
    ADD,
    ADDWRAP,
    SUB,
    SUBWRAP,
    MUL,
    MULWRAP,
    DIV,
    MOD_REM,
    BIT_AND,
    BIT_OR,
    XOR,
    BIT_NOT,
    SHL,
    SHR,
    // endregion

    // region comparison and logic, all Bin except BOOL_NOT
    CMP_LT,
    CMP_LTE,
    CMP_EQ,
    CMP_GTE,
    CMP_GT,
    CMP_NEQ,
    BOOL_NOT,
    BOOL_AND,
    BOOL_OR,
    // endregion

    // region casts, Bin: destination type, operand
    AS,
    INTCAST,
    FLOATCAST,
    BITCAST,
    // endregion

    // region optionals and errors, UnNode
    IS_NULL,
    IS_NON_NULL,
    IS_ERR,
    OPTIONAL_PAYLOAD_SAFE,
    OPTIONAL_PAYLOAD_UNSAFE,
    ERR_UNION_PAYLOAD_SAFE,
    ERR_UNION_PAYLOAD_UNSAFE,
    ERR_UNION_CODE,
    ENSURE_ERR_PAYLOAD_VOID,
    // endregion

    // region memory
    /** {@link InstData.UnNode}: element type. */
    ALLOC,
    /** {@link InstData.UnNode}: element type. */
    ALLOC_MUT,
    /** {@link InstData.Bin}: pointer, value. */
    STORE,
    /** {@link InstData.UnNode} */
    REF,
    /** {@link InstData.UnNode} */
    DEREF,
    /** {@link InstData.StrOp} */
    FIELD_PTR,
    /** {@link InstData.StrOp} */
    FIELD_VAL,
    /** {@link InstData.Bin}: array pointer, index. */
    ELEM_PTR,
    /** {@link InstData.Bin}: array pointer, index. */
    ELEM_VAL,
    // endregion

    // region results and debugging
    /** {@link InstData.UnNode} */
    ENSURE_RESULT_USED,
    /** {@link InstData.UnNode} */
    ENSURE_RESULT_NON_ERROR,
    /** {@link InstData.UnNode}: message string. */
    COMPILE_ERROR,
    /** {@link InstData.PlNode}: operand list. */
    COMPILE_LOG,
    /** {@link InstData.Node} */
    BREAKPOINT,
    /** {@link InstData.Node} */
    UNREACHABLE_SAFE,
    /** {@link InstData.Node} */
    UNREACHABLE_UNSAFE,
    /** {@link InstData.UnNode} */
    SET_EVAL_BRANCH_QUOTA;
    // endregion

    /**
     * @return {@code true} for the call opcodes.
     */
    public boolean isCall() {
        return this == CALL || this == CALL_COMPILE_TIME || this == CALL_ALWAYS_INLINE || this == CALL_NEVER_INLINE;
    }
}
