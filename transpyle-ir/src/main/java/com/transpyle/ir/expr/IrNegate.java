package com.transpyle.ir.expr;

/**
 * 一元负号
 */
public final class IrNegate extends IrExpr {
    private final IrExpr operand;

    public IrNegate(IrExpr operand) {
        this.operand = operand;
    }

    public IrExpr getOperand() {
        return operand;
    }

    /**
     * 数值字面量取负保留其类型，其余为 AUTO
     */
    @Override
    public TypeTag getTypeTag() {
        if (operand instanceof IrLiteral && ((IrLiteral) operand).isNumeric()) {
            return operand.getTypeTag();
        }
        return TypeTag.AUTO;
    }

    @Override
    public boolean containsStringLiteral() {
        return operand.containsStringLiteral();
    }

    @Override
    public <R, C> R accept(IrExprVisitor<R, C> visitor, C context) {
        return visitor.visitNegate(this, context);
    }
}
