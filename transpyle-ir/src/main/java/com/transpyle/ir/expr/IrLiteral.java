package com.transpyle.ir.expr;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 字面量：整数、浮点数、字符串与布尔值
 */
public final class IrLiteral extends IrExpr {
    private final Kind kind;
    private final Object value;

    private IrLiteral(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static IrLiteral ofInt(long value) {
        return new IrLiteral(Kind.INT, value);
    }

    /** 超出 long 范围的整数，按原值输出 */
    public static IrLiteral ofInt(BigInteger value) {
        return new IrLiteral(Kind.INT, value);
    }

    public static IrLiteral ofDouble(double value) {
        return new IrLiteral(Kind.DOUBLE, value);
    }

    /** 超出 double 范围的浮点数 */
    public static IrLiteral ofDouble(BigDecimal value) {
        return new IrLiteral(Kind.DOUBLE, value);
    }

    public static IrLiteral ofString(String value) {
        return new IrLiteral(Kind.STRING, value);
    }

    public static IrLiteral ofBoolean(boolean value) {
        return new IrLiteral(Kind.BOOLEAN, value);
    }

    public Kind getKind() {
        return kind;
    }

    public Object getValue() {
        return value;
    }

    public boolean isNumeric() {
        return kind == Kind.INT || kind == Kind.DOUBLE;
    }

    @Override
    public TypeTag getTypeTag() {
        switch (kind) {
            case INT: return TypeTag.INT;
            case DOUBLE: return TypeTag.DOUBLE;
            case STRING: return TypeTag.STRING;
            default: return TypeTag.BOOL;
        }
    }

    @Override
    public boolean containsStringLiteral() {
        return kind == Kind.STRING;
    }

    @Override
    public <R, C> R accept(IrExprVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    public enum Kind {
        INT,
        DOUBLE,
        STRING,
        BOOLEAN
    }
}
