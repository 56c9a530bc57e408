package com.transpyle.ir.inst;

/**
 * 注释。源码无法解析时整个程序只包含一条错误注释。
 */
public final class IrComment extends Instruction {
    private final String text;

    public IrComment(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public <R, C> R accept(InstructionVisitor<R, C> visitor, C context) {
        return visitor.visitComment(this, context);
    }
}
