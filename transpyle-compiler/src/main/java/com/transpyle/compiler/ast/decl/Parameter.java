package com.transpyle.compiler.ast.decl;

import com.transpyle.compiler.ast.AstNode;
import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.expr.Expression;

/**
 * 函数 / lambda 参数
 */
public class Parameter extends AstNode {
    private final String name;
    private final Expression annotation;    // 可选
    private final Expression defaultValue;  // 可选
    private final ParameterKind kind;

    public Parameter(SourceLocation location, String name, Expression annotation,
                     Expression defaultValue, ParameterKind kind) {
        super(location);
        this.name = name;
        this.annotation = annotation;
        this.defaultValue = defaultValue;
        this.kind = kind;
    }

    public String getName() {
        return name;
    }

    public Expression getAnnotation() {
        return annotation;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public ParameterKind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }

    public enum ParameterKind {
        NORMAL,        // x, x=1
        VAR_POSITIONAL,  // *args
        VAR_KEYWORD,     // **kwargs
        KEYWORD_MARKER,  // 单独的 *
        POSITIONAL_MARKER  // 单独的 /
    }
}
