package com.transpyle.compiler.ast.stmt;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.expr.Expression;

/**
 * For 语句：{@code for target in iterable:}
 */
public class ForStmt extends Statement {
    private final Expression target;  // 名称或元组（解构）
    private final Expression iterable;
    private final Block body;
    private final Block elseBranch;  // 可选
    private final boolean async;

    public ForStmt(SourceLocation location, Expression target, Expression iterable,
                   Block body, Block elseBranch, boolean async) {
        super(location);
        this.target = target;
        this.iterable = iterable;
        this.body = body;
        this.elseBranch = elseBranch;
        this.async = async;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIterable() {
        return iterable;
    }

    public Block getBody() {
        return body;
    }

    public Block getElseBranch() {
        return elseBranch;
    }

    public boolean isAsync() {
        return async;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
