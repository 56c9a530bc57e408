package com.transpyle.ir.inst;

import com.transpyle.ir.expr.IrExpr;

import java.util.Collections;
import java.util.List;

/**
 * While 循环
 */
public final class IrWhile extends Instruction {
    private final IrExpr condition;
    private final List<Instruction> body;

    public IrWhile(IrExpr condition, List<Instruction> body) {
        this.condition = condition;
        this.body = Collections.unmodifiableList(body);
    }

    public IrExpr getCondition() {
        return condition;
    }

    public List<Instruction> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(InstructionVisitor<R, C> visitor, C context) {
        return visitor.visitWhile(this, context);
    }
}
