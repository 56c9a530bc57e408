package com.transpyle.compiler.ast.expr;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 字典字面量。{@code **other} 展开项的 key 为 null。
 */
public class DictLiteral extends Expression {
    private final List<Expression> keys;
    private final List<Expression> values;

    public DictLiteral(SourceLocation location, List<Expression> keys, List<Expression> values) {
        super(location);
        this.keys = keys;
        this.values = values;
    }

    public List<Expression> getKeys() {
        return keys;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDictLiteral(this, context);
    }
}
