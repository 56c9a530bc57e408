package com.transpyle.ir.inst;

import java.util.Collections;
import java.util.List;

/**
 * 打印一行，参数间以单个空格分隔
 */
public final class IrPrint extends Instruction {
    private final List<IrPrintPart> parts;

    public IrPrint(List<IrPrintPart> parts) {
        this.parts = Collections.unmodifiableList(parts);
    }

    public List<IrPrintPart> getParts() {
        return parts;
    }

    @Override
    public <R, C> R accept(InstructionVisitor<R, C> visitor, C context) {
        return visitor.visitPrint(this, context);
    }
}
