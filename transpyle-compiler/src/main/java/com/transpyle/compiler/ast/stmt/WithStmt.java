package com.transpyle.compiler.ast.stmt;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.expr.Expression;

import java.util.List;

/**
 * With 语句
 */
public class WithStmt extends Statement {
    private final List<Item> items;
    private final Block body;
    private final boolean async;

    public WithStmt(SourceLocation location, List<Item> items, Block body, boolean async) {
        super(location);
        this.items = items;
        this.body = body;
        this.async = async;
    }

    public List<Item> getItems() {
        return items;
    }

    public Block getBody() {
        return body;
    }

    public boolean isAsync() {
        return async;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWithStmt(this, context);
    }

    /**
     * with 项：{@code context as target}
     */
    public static final class Item {
        private final Expression context;
        private final Expression target;  // 可选

        public Item(Expression context, Expression target) {
            this.context = context;
            this.target = target;
        }

        public Expression getContext() {
            return context;
        }

        public Expression getTarget() {
            return target;
        }
    }
}
