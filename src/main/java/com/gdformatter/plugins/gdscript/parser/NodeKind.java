package com.gdformatter.plugins.gdscript.parser;

/**
 * Kind tags of parse tree nodes.
 */
public enum NodeKind {
    FILE,

    // class scope statements
    PASS_STMT,
    EXTENDS_STMT,
    CLASSNAME_STMT,
    CLASSNAME_EXTENDS_STMT,
    CLASS_VAR_STMT,
    CONST_STMT,
    SIGNAL_STMT,
    ENUM_STMT,
    CLASS_DEF,
    FUNC_DEF,
    STATIC_FUNC_DEF,

    // function scope statements
    FUNC_VAR_STMT,
    BREAK_STMT,
    CONTINUE_STMT,
    RETURN_STMT,
    EXPR_STMT,
    IF_STMT,
    WHILE_STMT,
    FOR_STMT,
    MATCH_STMT,
    MATCH_BRANCH,

    // statement parts
    FUNC_HEADER,
    PARAMETERS,
    PARAMETER,
    TYPE,
    ENUM_BODY,
    ENUM_ELEMENT,
    IF_BRANCH,
    ELIF_BRANCH,
    ELSE_BRANCH,
    PATTERN_LIST,
    PATTERN_BINDING,
    PATTERN_REST,

    // expressions
    NAME,
    LITERAL,
    GET_NODE,
    ARRAY,
    DICT,
    DICT_ENTRY_COLON,
    DICT_ENTRY_EQ,
    PAREN,
    CALL,
    ARGUMENTS,
    SUBSCRIPT,
    ATTRIBUTE,
    UNARY,
    BINARY,
    TERNARY,
    AWAIT,
    ASSIGNMENT;

    public boolean isStatement() {
        return ordinal() >= PASS_STMT.ordinal() && ordinal() <= MATCH_BRANCH.ordinal();
    }
}
