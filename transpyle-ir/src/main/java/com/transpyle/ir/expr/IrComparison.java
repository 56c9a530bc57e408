package com.transpyle.ir.expr;

/**
 * 比较表达式，仅用于条件位置
 */
public final class IrComparison extends IrExpr {
    private final IrExpr left;
    private final Operator operator;
    private final IrExpr right;

    public IrComparison(IrExpr left, Operator operator, IrExpr right) {
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public IrExpr getLeft() {
        return left;
    }

    public Operator getOperator() {
        return operator;
    }

    public IrExpr getRight() {
        return right;
    }

    @Override
    public TypeTag getTypeTag() {
        return TypeTag.BOOL;
    }

    @Override
    public boolean containsStringLiteral() {
        return left.containsStringLiteral() || right.containsStringLiteral();
    }

    @Override
    public <R, C> R accept(IrExprVisitor<R, C> visitor, C context) {
        return visitor.visitComparison(this, context);
    }

    public enum Operator {
        EQ("=="),
        NE("!="),
        GT(">"),
        LT("<"),
        GE(">="),
        LE("<=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }
}
