package com.transpyle.compiler.ast.expr;

import com.transpyle.compiler.ast.AstNode;
import com.transpyle.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
