package dev.roshin.complexityscanner.analysis.ast;

/**
 * Closed set of syntax node kinds the analyzer distinguishes.
 * Frontends map anything they cannot classify to {@link #OTHER}.
 */
public enum NodeKind {
    /**
     * Root of a translation unit or a namespace/package container
     */
    CONTAINER,

    /**
     * Type declaration (class, interface, record, enum)
     */
    TYPE,

    /**
     * Function, method, constructor or closure declaration
     */
    FUNCTION,

    BLOCK,

    /**
     * if / else-if statement
     */
    IF,

    /**
     * switch statement or switch expression
     */
    SWITCH,

    /**
     * Single case arm of a switch
     */
    CASE,

    /**
     * Counted and range/for-each loops
     */
    FOR,

    WHILE,

    DO_WHILE,

    /**
     * Ternary conditional expression: cond ? a : b
     */
    CONDITIONAL,

    RETURN,

    EXPRESSION,

    OTHER
}
