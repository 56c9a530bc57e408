package com.transpyle.compiler.ast.expr;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 比较表达式，支持链式比较：{@code a < b <= c}
 *
 * <p>{@code operators.size() == comparators.size()}，第 i 个运算符连接第 i-1 与第 i 个操作数。</p>
 */
public class CompareExpr extends Expression {
    private final Expression left;
    private final List<CompareOp> operators;
    private final List<Expression> comparators;

    public CompareExpr(SourceLocation location, Expression left,
                       List<CompareOp> operators, List<Expression> comparators) {
        super(location);
        this.left = left;
        this.operators = operators;
        this.comparators = comparators;
    }

    public Expression getLeft() {
        return left;
    }

    public List<CompareOp> getOperators() {
        return operators;
    }

    public List<Expression> getComparators() {
        return comparators;
    }

    public boolean isChained() {
        return operators.size() > 1;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCompareExpr(this, context);
    }

    /**
     * 比较运算符
     */
    public enum CompareOp {
        EQ("=="),
        NE("!="),
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">="),
        IN("in"),
        NOT_IN("not in"),
        IS("is"),
        IS_NOT("is not");

        private final String symbol;

        CompareOp(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }
}
