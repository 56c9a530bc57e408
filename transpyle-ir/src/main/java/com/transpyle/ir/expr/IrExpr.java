package com.transpyle.ir.expr;

/**
 * IR 表达式节点。表达式以树形式保存，由各后端按目标语言渲染。
 */
public abstract class IrExpr {

    public abstract TypeTag getTypeTag();

    public abstract <R, C> R accept(IrExprVisitor<R, C> visitor, C context);

    /**
     * 表达式树中是否含有字符串字面量
     */
    public boolean containsStringLiteral() {
        return false;
    }

    @Override
    public String toString() {
        return IrExprPrinter.NEUTRAL.print(this);
    }
}
