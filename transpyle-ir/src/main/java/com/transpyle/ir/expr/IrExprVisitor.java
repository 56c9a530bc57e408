package com.transpyle.ir.expr;

/**
 * IR 表达式访问者。所有方法均为抽象，新增节点类型时每个消费者都必须处理。
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface IrExprVisitor<R, C> {

    R visitLiteral(IrLiteral node, C context);

    R visitVariable(IrVariable node, C context);

    R visitBinary(IrBinary node, C context);

    R visitNegate(IrNegate node, C context);

    R visitComparison(IrComparison node, C context);

    R visitUnsupported(IrUnsupported node, C context);
}
