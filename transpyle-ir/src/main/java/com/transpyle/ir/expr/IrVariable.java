package com.transpyle.ir.expr;

/**
 * 变量引用
 */
public final class IrVariable extends IrExpr {
    private final String name;

    public IrVariable(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public TypeTag getTypeTag() {
        return TypeTag.VAR;
    }

    @Override
    public <R, C> R accept(IrExprVisitor<R, C> visitor, C context) {
        return visitor.visitVariable(this, context);
    }
}
