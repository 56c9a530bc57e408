package com.transpyle.compiler.ast.expr;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 列表、元组与集合字面量
 */
public class CollectionLiteral extends Expression {
    private final CollectionKind kind;
    private final List<Expression> elements;

    public CollectionLiteral(SourceLocation location, CollectionKind kind, List<Expression> elements) {
        super(location);
        this.kind = kind;
        this.elements = elements;
    }

    public CollectionKind getKind() {
        return kind;
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCollectionLiteral(this, context);
    }

    public enum CollectionKind {
        LIST,
        TUPLE,
        SET
    }
}
