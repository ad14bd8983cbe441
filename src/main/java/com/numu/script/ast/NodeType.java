package com.numu.script.ast;

public enum NodeType {
    NUMBER,
    BOOLEAN,
    STRING,
    VARIABLE,
    BINARY_OP,
    UNARY_OP,
    FUNCTION,
    MATRIX,
    TENSOR,
    ASSIGNMENT,
    BLOCK,
    IF,
    WHILE,
    FOR,
    RETURN
}
