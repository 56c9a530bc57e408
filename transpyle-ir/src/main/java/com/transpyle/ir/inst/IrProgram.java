package com.transpyle.ir.inst;

import java.util.Collections;
import java.util.List;

/**
 * IR 根节点：顶层指令序列
 */
public final class IrProgram {
    private final List<Instruction> instructions;

    public IrProgram(List<Instruction> instructions) {
        this.instructions = Collections.unmodifiableList(instructions);
    }

    /**
     * 解析失败时的程序：仅一条错误注释
     */
    public static IrProgram ofError(String message) {
        return new IrProgram(Collections.<Instruction>singletonList(new IrComment("Error: " + message)));
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public int size() {
        return instructions.size();
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }
}
