package com.transpyle.compiler.ast.stmt;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 赋值语句：{@code a = b = value}
 */
public class AssignStmt extends Statement {
    private final List<Expression> targets;  // 链式赋值时按源码顺序
    private final Expression value;

    public AssignStmt(SourceLocation location, List<Expression> targets, Expression value) {
        super(location);
        this.targets = targets;
        this.value = value;
    }

    public List<Expression> getTargets() {
        return targets;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }
}
