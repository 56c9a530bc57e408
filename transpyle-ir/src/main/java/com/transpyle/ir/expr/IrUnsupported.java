package com.transpyle.ir.expr;

/**
 * 不支持的源表达式。渲染为其回退字面量，原因保留以便诊断。
 */
public final class IrUnsupported extends IrExpr {
    private final String reason;
    private final IrLiteral fallback;

    public IrUnsupported(String reason, IrLiteral fallback) {
        this.reason = reason;
        this.fallback = fallback;
    }

    public String getReason() {
        return reason;
    }

    public IrLiteral getFallback() {
        return fallback;
    }

    @Override
    public TypeTag getTypeTag() {
        return fallback.getTypeTag();
    }

    @Override
    public <R, C> R accept(IrExprVisitor<R, C> visitor, C context) {
        return visitor.visitUnsupported(this, context);
    }
}
