package com.transpyle.ir.inst;

import com.transpyle.ir.expr.IrExpr;

/**
 * 打印语句的一个参数
 */
public final class IrPrintPart {
    private final IrExpr value;
    private final boolean literalString;

    public IrPrintPart(IrExpr value, boolean literalString) {
        this.value = value;
        this.literalString = literalString;
    }

    /**
     * 按表达式中是否含字符串字面量决定分类
     */
    public static IrPrintPart of(IrExpr value) {
        return new IrPrintPart(value, value.containsStringLiteral());
    }

    public IrExpr getValue() {
        return value;
    }

    public boolean isLiteralString() {
        return literalString;
    }
}
