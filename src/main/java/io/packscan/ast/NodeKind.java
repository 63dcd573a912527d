package io.packscan.ast;

/**
 * Variant tags of the tree node model. Rules are dispatched on these.
 */
public enum NodeKind {
    MODULE,
    NUMBER,
    STRING,
    DICTIONARY,
    VARIABLE,
    ATTRIBUTE,
    COMPARE,
    FUNCTION_DEF,
    CALL,
    ARGUMENTS,
    IMPORT,
    BINARY_OP,
    PRINT
}
