package com.transpyle.compiler.ast.stmt;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.transpyle.compiler.ast.expr.Expression;

/**
 * 增量赋值语句：{@code x += 1}
 */
public class AugAssignStmt extends Statement {
    private final Expression target;
    private final BinaryOp operator;
    private final Expression value;

    public AugAssignStmt(SourceLocation location, Expression target, BinaryOp operator, Expression value) {
        super(location);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAugAssignStmt(this, context);
    }
}
