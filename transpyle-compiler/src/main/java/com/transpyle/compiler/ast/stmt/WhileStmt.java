package com.transpyle.compiler.ast.stmt;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.expr.Expression;

/**
 * While 语句
 */
public class WhileStmt extends Statement {
    private final Expression condition;
    private final Block body;
    private final Block elseBranch;  // 可选：while ... else

    public WhileStmt(SourceLocation location, Expression condition, Block body, Block elseBranch) {
        super(location);
        this.condition = condition;
        this.body = body;
        this.elseBranch = elseBranch;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getBody() {
        return body;
    }

    public Block getElseBranch() {
        return elseBranch;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhileStmt(this, context);
    }
}
