package com.transpyle.compiler.ast.stmt;

import com.transpyle.compiler.ast.AstNode;
import com.transpyle.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
