package com.transpyle.compiler.ast.expr;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.decl.Parameter;

import java.util.List;

/**
 * Lambda 表达式：{@code lambda x, y: x + y}
 */
public class LambdaExpr extends Expression {
    private final List<Parameter> params;
    private final Expression body;

    public LambdaExpr(SourceLocation location, List<Parameter> params, Expression body) {
        super(location);
        this.params = params;
        this.body = body;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLambdaExpr(this, context);
    }
}
