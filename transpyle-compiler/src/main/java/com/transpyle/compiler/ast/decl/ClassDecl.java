package com.transpyle.compiler.ast.decl;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.expr.CallExpr;
import com.transpyle.compiler.ast.expr.Expression;
import com.transpyle.compiler.ast.stmt.Block;

import java.util.List;

/**
 * 类定义：{@code class Name(Base, metaclass=M):}
 */
public class ClassDecl extends Declaration {
    private final List<Expression> decorators;
    private final List<CallExpr.Argument> bases;
    private final Block body;

    public ClassDecl(SourceLocation location, String name, List<Expression> decorators,
                     List<CallExpr.Argument> bases, Block body) {
        super(location, name);
        this.decorators = decorators;
        this.bases = bases;
        this.body = body;
    }

    public List<Expression> getDecorators() {
        return decorators;
    }

    public List<CallExpr.Argument> getBases() {
        return bases;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitClassDecl(this, context);
    }
}
