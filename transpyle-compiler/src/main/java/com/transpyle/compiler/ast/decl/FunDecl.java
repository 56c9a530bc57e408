package com.transpyle.compiler.ast.decl;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.expr.Expression;
import com.transpyle.compiler.ast.stmt.Block;

import java.util.List;

/**
 * 函数定义：{@code def name(params) -> ret:}
 */
public class FunDecl extends Declaration {
    private final List<Expression> decorators;
    private final List<Parameter> params;
    private final Expression returnType;  // 可选
    private final Block body;
    private final boolean async;

    public FunDecl(SourceLocation location, String name, List<Expression> decorators,
                   List<Parameter> params, Expression returnType, Block body, boolean async) {
        super(location, name);
        this.decorators = decorators;
        this.params = params;
        this.returnType = returnType;
        this.body = body;
        this.async = async;
    }

    public List<Expression> getDecorators() {
        return decorators;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public Expression getReturnType() {
        return returnType;
    }

    public Block getBody() {
        return body;
    }

    public boolean isAsync() {
        return async;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunDecl(this, context);
    }
}
