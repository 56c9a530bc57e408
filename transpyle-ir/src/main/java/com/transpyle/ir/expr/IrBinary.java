package com.transpyle.ir.expr;

/**
 * 二元算术表达式
 */
public final class IrBinary extends IrExpr {
    private final IrExpr left;
    private final Operator operator;
    private final IrExpr right;

    public IrBinary(IrExpr left, Operator operator, IrExpr right) {
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
        return TypeTag.AUTO;
    }

    @Override
    public boolean containsStringLiteral() {
        return left.containsStringLiteral() || right.containsStringLiteral();
    }

    @Override
    public <R, C> R accept(IrExprVisitor<R, C> visitor, C context) {
        return visitor.visitBinary(this, context);
    }

    /**
     * 算术运算符。三个目标语言中符号与优先级一致。
     */
    public enum Operator {
        ADD("+", 1),
        SUB("-", 1),
        MUL("*", 2),
        DIV("/", 2),
        MOD("%", 2);

        private final String symbol;
        private final int precedence;

        Operator(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String getSymbol() {
            return symbol;
        }

        public int getPrecedence() {
            return precedence;
        }
    }
}
