package com.transpyle.compiler.ast.expr;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 推导式与生成器表达式
 */
public class ComprehensionExpr extends Expression {
    private final ComprehensionKind kind;
    private final Expression element;       // dict 推导时为 key
    private final Expression valueElement;  // 仅 dict 推导
    private final List<Generator> generators;

    public ComprehensionExpr(SourceLocation location, ComprehensionKind kind, Expression element,
                             Expression valueElement, List<Generator> generators) {
        super(location);
        this.kind = kind;
        this.element = element;
        this.valueElement = valueElement;
        this.generators = generators;
    }

    public ComprehensionKind getKind() {
        return kind;
    }

    public Expression getElement() {
        return element;
    }

    public Expression getValueElement() {
        return valueElement;
    }

    public List<Generator> getGenerators() {
        return generators;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitComprehensionExpr(this, context);
    }

    public enum ComprehensionKind {
        LIST,
        SET,
        DICT,
        GENERATOR
    }

    /**
     * {@code for target in iterable if cond...}
     */
    public static final class Generator {
        private final Expression target;
        private final Expression iterable;
        private final List<Expression> conditions;
        private final boolean async;

        public Generator(Expression target, Expression iterable, List<Expression> conditions, boolean async) {
            this.target = target;
            this.iterable = iterable;
            this.conditions = conditions;
            this.async = async;
        }

        public Expression getTarget() {
            return target;
        }

        public Expression getIterable() {
            return iterable;
        }

        public List<Expression> getConditions() {
            return conditions;
        }

        public boolean isAsync() {
            return async;
        }
    }
}
