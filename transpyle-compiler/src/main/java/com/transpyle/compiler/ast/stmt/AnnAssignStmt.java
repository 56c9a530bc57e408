package com.transpyle.compiler.ast.stmt;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.expr.Expression;

/**
 * 带类型注解的赋值：{@code x: int = 1}
 */
public class AnnAssignStmt extends Statement {
    private final Expression target;
    private final Expression annotation;
    private final Expression value;  // 可选

    public AnnAssignStmt(SourceLocation location, Expression target, Expression annotation, Expression value) {
        super(location);
        this.target = target;
        this.annotation = annotation;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getAnnotation() {
        return annotation;
    }

    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAnnAssignStmt(this, context);
    }
}
