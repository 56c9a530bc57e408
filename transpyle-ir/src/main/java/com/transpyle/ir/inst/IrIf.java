package com.transpyle.ir.inst;

import com.transpyle.ir.expr.IrExpr;

import java.util.Collections;
import java.util.List;

/**
 * 条件分支。无 else 时 elseBlock 为空列表。
 */
public final class IrIf extends Instruction {
    private final IrExpr condition;
    private final List<Instruction> thenBlock;
    private final List<Instruction> elseBlock;

    public IrIf(IrExpr condition, List<Instruction> thenBlock, List<Instruction> elseBlock) {
        this.condition = condition;
        this.thenBlock = Collections.unmodifiableList(thenBlock);
        this.elseBlock = Collections.unmodifiableList(elseBlock);
    }

    public IrExpr getCondition() {
        return condition;
    }

    public List<Instruction> getThenBlock() {
        return thenBlock;
    }

    public List<Instruction> getElseBlock() {
        return elseBlock;
    }

    public boolean hasElse() {
        return !elseBlock.isEmpty();
    }

    @Override
    public <R, C> R accept(InstructionVisitor<R, C> visitor, C context) {
        return visitor.visitIf(this, context);
    }
}
