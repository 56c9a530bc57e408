package com.transpyle.ir.inst;

import com.transpyle.ir.expr.IrExpr;

import java.util.Collections;
import java.util.List;

/**
 * 计数循环：{@code 0 <= loopVariable < limit}，循环变量总是整型
 */
public final class IrFor extends Instruction {
    private final String loopVariable;
    private final IrExpr limit;
    private final List<Instruction> body;

    public IrFor(String loopVariable, IrExpr limit, List<Instruction> body) {
        this.loopVariable = loopVariable;
        this.limit = limit;
        this.body = Collections.unmodifiableList(body);
    }

    public String getLoopVariable() {
        return loopVariable;
    }

    public IrExpr getLimit() {
        return limit;
    }

    public List<Instruction> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(InstructionVisitor<R, C> visitor, C context) {
        return visitor.visitFor(this, context);
    }
}
