package com.transpyle.compiler.ast.stmt;

import com.transpyle.compiler.ast.AstNode;
import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.expr.Expression;

/**
 * except 子句：{@code except Type as name:}
 */
public class ExceptClause extends AstNode {
    private final Expression exceptionType;  // 可选（裸 except）
    private final String name;               // 可选
    private final Block body;

    public ExceptClause(SourceLocation location, Expression exceptionType, String name, Block body) {
        super(location);
        this.exceptionType = exceptionType;
        this.name = name;
        this.body = body;
    }

    public Expression getExceptionType() {
        return exceptionType;
    }

    public String getName() {
        return name;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExceptClause(this, context);
    }
}
