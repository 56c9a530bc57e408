package com.transpyle.compiler.ast.decl;

import com.transpyle.compiler.ast.AstNode;
import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 程序根节点（一个源文件对应一个 Program）
 */
public class Program extends AstNode {
    private final List<Statement> statements;

    public Program(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = statements;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
