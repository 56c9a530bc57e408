package com.transpyle.ir.inst;

/**
 * IR 指令节点。指令集合是封闭的，通过 {@link InstructionVisitor} 分派。
 */
public abstract class Instruction {

    public abstract <R, C> R accept(InstructionVisitor<R, C> visitor, C context);
}
