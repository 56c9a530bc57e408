package com.transpyle.compiler.lexer;

/**
 * Python 子集词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    FSTRING_LITERAL,        // f"..."
    BYTES_LITERAL,          // b"..."

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 ===
    KW_FALSE, KW_NONE, KW_TRUE,
    KW_AND, KW_OR, KW_NOT, KW_IN, KW_IS,
    KW_IF, KW_ELIF, KW_ELSE, KW_WHILE, KW_FOR,
    KW_BREAK, KW_CONTINUE, KW_PASS, KW_RETURN,
    KW_DEF, KW_CLASS, KW_LAMBDA, KW_YIELD,
    KW_IMPORT, KW_FROM, KW_AS,
    KW_TRY, KW_EXCEPT, KW_FINALLY, KW_RAISE, KW_WITH,
    KW_GLOBAL, KW_NONLOCAL, KW_DEL, KW_ASSERT,
    KW_ASYNC, KW_AWAIT,

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    STAR,           // *
    SLASH,          // /
    DOUBLE_SLASH,   // //
    PERCENT,        // %
    DOUBLE_STAR,    // **
    AT,             // @

    // === 操作符 - 位运算 ===
    AMPER,          // &
    PIPE,           // |
    CARET,          // ^
    TILDE,          // ~
    LSHIFT,         // <<
    RSHIFT,         // >>

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 操作符 - 赋值 ===
    ASSIGN,                 // =
    PLUS_ASSIGN,            // +=
    MINUS_ASSIGN,           // -=
    STAR_ASSIGN,            // *=
    SLASH_ASSIGN,           // /=
    DOUBLE_SLASH_ASSIGN,    // //=
    PERCENT_ASSIGN,         // %=
    DOUBLE_STAR_ASSIGN,     // **=
    AT_ASSIGN,              // @=
    AMPER_ASSIGN,           // &=
    PIPE_ASSIGN,            // |=
    CARET_ASSIGN,           // ^=
    LSHIFT_ASSIGN,          // <<=
    RSHIFT_ASSIGN,          // >>=
    WALRUS,                 // :=

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    LBRACKET,       // [
    RBRACKET,       // ]
    LBRACE,         // {
    RBRACE,         // }
    COMMA,          // ,
    COLON,          // :
    SEMICOLON,      // ;
    DOT,            // .
    ELLIPSIS,       // ...
    ARROW,          // ->

    // === 缩进 ===
    NEWLINE,
    INDENT,
    DEDENT,

    // === 特殊 ===
    EOF,
    ERROR;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为增量赋值操作符（+= 等）
     */
    public boolean isAugmentedAssignOp() {
        switch (this) {
            case PLUS_ASSIGN:
            case MINUS_ASSIGN:
            case STAR_ASSIGN:
            case SLASH_ASSIGN:
            case DOUBLE_SLASH_ASSIGN:
            case PERCENT_ASSIGN:
            case DOUBLE_STAR_ASSIGN:
            case AT_ASSIGN:
            case AMPER_ASSIGN:
            case PIPE_ASSIGN:
            case CARET_ASSIGN:
            case LSHIFT_ASSIGN:
            case RSHIFT_ASSIGN:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为字符串类字面量（可相邻拼接）
     */
    public boolean isStringLike() {
        return this == STRING_LITERAL || this == FSTRING_LITERAL || this == BYTES_LITERAL;
    }
}
