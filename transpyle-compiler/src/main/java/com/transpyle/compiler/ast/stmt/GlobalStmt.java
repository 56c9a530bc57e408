package com.transpyle.compiler.ast.stmt;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;

import java.util.List;

/**
 * global / nonlocal 声明
 */
public class GlobalStmt extends Statement {
    private final List<String> names;
    private final boolean nonlocal;

    public GlobalStmt(SourceLocation location, List<String> names, boolean nonlocal) {
        super(location);
        this.names = names;
        this.nonlocal = nonlocal;
    }

    public List<String> getNames() {
        return names;
    }

    public boolean isNonlocal() {
        return nonlocal;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGlobalStmt(this, context);
    }
}
