package com.transpyle.compiler.ast.expr;

import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * 函数调用
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Argument> args;

    public CallExpr(SourceLocation location, Expression callee, List<Argument> args) {
        super(location);
        this.callee = callee;
        this.args = args;
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Argument> getArgs() {
        return args;
    }

    /**
     * 被调用者为简单名称时返回该名称，否则返回 null
     */
    public String getCalleeName() {
        return callee instanceof Identifier ? ((Identifier) callee).getName() : null;
    }

    public List<Argument> getPositionalArgs() {
        List<Argument> result = new ArrayList<>();
        for (Argument arg : args) {
            if (arg.getKind() == ArgumentKind.POSITIONAL || arg.getKind() == ArgumentKind.STAR) {
                result.add(arg);
            }
        }
        return result;
    }

    public boolean hasKeywordArgs() {
        for (Argument arg : args) {
            if (arg.getKind() == ArgumentKind.KEYWORD || arg.getKind() == ArgumentKind.DOUBLE_STAR) {
                return true;
            }
        }
        return false;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }

    public enum ArgumentKind {
        POSITIONAL,   // f(x)
        KEYWORD,      // f(name=x)
        STAR,         // f(*xs)
        DOUBLE_STAR   // f(**kw)
    }

    /**
     * 调用参数
     */
    public static final class Argument {
        private final String name;  // 仅 KEYWORD
        private final Expression value;
        private final ArgumentKind kind;

        public Argument(String name, Expression value, ArgumentKind kind) {
            this.name = name;
            this.value = value;
            this.kind = kind;
        }

        public static Argument positional(Expression value) {
            return new Argument(null, value, ArgumentKind.POSITIONAL);
        }

        public String getName() {
            return name;
        }

        public Expression getValue() {
            return value;
        }

        public ArgumentKind getKind() {
            return kind;
        }
    }
}
