package com.transpyle.compiler.ast.expr;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;

/**
 * 字面量
 *
 * <p>INT 的值为 {@link Long}，FLOAT 为 {@link Double}，STRING/FSTRING/BYTES 为解码后的
 * {@link String}，BOOLEAN 为 {@link Boolean}，NONE 与 ELLIPSIS 为 null。</p>
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    public boolean isString() {
        return kind == LiteralKind.STRING || kind == LiteralKind.FSTRING || kind == LiteralKind.BYTES;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    @Override
    public String toString() {
        return "Literal(" + kind + ", " + value + ")";
    }

    public enum LiteralKind {
        INT,
        FLOAT,
        STRING,
        FSTRING,
        BYTES,
        BOOLEAN,
        NONE,
        ELLIPSIS
    }
}
