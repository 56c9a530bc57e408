package com.transpyle.compiler.ast.decl;

import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.stmt.Statement;

/**
 * 声明基类。Python 中声明可以出现在任意语句位置，因此继承自 Statement。
 */
public abstract class Declaration extends Statement {
    protected final String name;

    protected Declaration(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
