package com.transpyle.compiler.ast.expr;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;

/**
 * yield / yield from 表达式
 */
public class YieldExpr extends Expression {
    private final Expression value;  // 可选
    private final boolean from;

    public YieldExpr(SourceLocation location, Expression value, boolean from) {
        super(location);
        this.value = value;
        this.from = from;
    }

    public Expression getValue() {
        return value;
    }

    public boolean isFrom() {
        return from;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitYieldExpr(this, context);
    }
}
