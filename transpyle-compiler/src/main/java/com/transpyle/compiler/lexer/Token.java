package com.transpyle.compiler.lexer;

/**
 * 词法单元。
 *
 * <p>literal 按类型携带解析后的值：INT_LITERAL 为 Long（超出 long 范围时为 BigInteger），
 * FLOAT_LITERAL 为 Double（超出 double 范围时为 BigDecimal），字符串类为解码后的 String，
 * ERROR 为错误描述，其余为 null。</p>
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;

    public Token(TokenType type, String lexeme, Object literal, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() {
        return type;
    }

    /** 源码原文 */
    public String getLexeme() {
        return lexeme;
    }

    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        String text = literal != null ? lexeme + " = " + literal : lexeme;
        return type + "[" + text + "] " + line + ":" + column;
    }
}
