package com.transpyle.ir.inst;

/**
 * IR 指令访问者，6 个 visit 方法，均为抽象。
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface InstructionVisitor<R, C> {

    R visitAssign(IrAssign node, C context);

    R visitPrint(IrPrint node, C context);

    R visitIf(IrIf node, C context);

    R visitWhile(IrWhile node, C context);

    R visitFor(IrFor node, C context);

    R visitComment(IrComment node, C context);
}
