package org.kestrel.compiler.ir;

/**
 * Opcodes of the typed IR.
 */
public enum IrTag {
    CONSTANT,
    ARG,
    ALLOC,
    BREAKPOINT,
    UNREACH,
    RETVOID,
    RET,

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
    NOT,
    SHL,
    SHR,

    CMP_LT,
    CMP_LTE,
    CMP_EQ,
    CMP_GTE,
    CMP_GT,
    CMP_NEQ,
    BOOL_AND,
    BOOL_OR,

    IS_NULL,
    IS_NON_NULL,
    IS_ERR,
    IS_NON_ERR,
    OPTIONAL_PAYLOAD,
    WRAP_OPTIONAL,
    UNWRAP_ERRUNION_PAYLOAD,
    UNWRAP_ERRUNION_ERR,
    WRAP_ERRUNION_PAYLOAD,
    WRAP_ERRUNION_ERR,

    BITCAST,
    INTCAST,
    FLOATCAST,

    REF,
    LOAD,
    STORE,
    ELEM_PTR,

    BLOCK,
    BR,
    BR_BLOCK_FLAT,
    BR_VOID,
    CONDBR,
    LOOP,
    SWITCHBR,
    CALL
}
