package org.stl.parser;

/**
 * STL 公式文本的词法单元类型。
 */
public enum TokenType {
    NUMBER,
    IDENTIFIER,

    // 逻辑
    AND,
    OR,
    NOT,
    IMPLIES,
    IFF,

    // 时序
    ALWAYS,
    EVENTUALLY,
    NEXT,
    UNTIL,
    WEAK_UNTIL,

    // 比较
    LT,
    LE,
    GT,
    GE,
    EQ,
    NEQ,

    // 算术
    PLUS,
    MINUS,
    STAR,
    SLASH,

    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,
    PIPE,

    EOF
}
