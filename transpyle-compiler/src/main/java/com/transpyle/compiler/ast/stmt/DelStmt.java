package com.transpyle.compiler.ast.stmt;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.expr.Expression;

import java.util.List;

/**
 * del 语句
 */
public class DelStmt extends Statement {
    private final List<Expression> targets;

    public DelStmt(SourceLocation location, List<Expression> targets) {
        super(location);
        this.targets = targets;
    }

    public List<Expression> getTargets() {
        return targets;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDelStmt(this, context);
    }
}
