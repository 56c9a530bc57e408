package com.transpyle.compiler.ast.stmt;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.expr.Expression;

/**
 * Raise 语句：{@code raise exc from cause}
 */
public class RaiseStmt extends Statement {
    private final Expression exception;  // 可选（裸 raise）
    private final Expression cause;      // 可选

    public RaiseStmt(SourceLocation location, Expression exception, Expression cause) {
        super(location);
        this.exception = exception;
        this.cause = cause;
    }

    public Expression getException() {
        return exception;
    }

    public Expression getCause() {
        return cause;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRaiseStmt(this, context);
    }
}
