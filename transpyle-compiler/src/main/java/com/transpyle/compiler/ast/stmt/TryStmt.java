package com.transpyle.compiler.ast.stmt;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;

import java.util.List;

/**
 * Try 语句
 */
public class TryStmt extends Statement {
    private final Block body;
    private final List<ExceptClause> handlers;
    private final Block elseBranch;     // 可选
    private final Block finallyBlock;   // 可选

    public TryStmt(SourceLocation location, Block body, List<ExceptClause> handlers,
                   Block elseBranch, Block finallyBlock) {
        super(location);
        this.body = body;
        this.handlers = handlers;
        this.elseBranch = elseBranch;
        this.finallyBlock = finallyBlock;
    }

    public Block getBody() {
        return body;
    }

    public List<ExceptClause> getHandlers() {
        return handlers;
    }

    public Block getElseBranch() {
        return elseBranch;
    }

    public Block getFinallyBlock() {
        return finallyBlock;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTryStmt(this, context);
    }
}
