package com.transpyle.ir.inst;

import com.transpyle.ir.expr.IrExpr;
import com.transpyle.ir.expr.TypeTag;

/**
 * 对名称赋值。是否为声明由后端根据声明作用域决定。
 */
public final class IrAssign extends Instruction {
    private final String name;
    private final IrExpr value;

    public IrAssign(String name, IrExpr value) {
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public IrExpr getValue() {
        return value;
    }

    public TypeTag getTypeTag() {
        return value.getTypeTag();
    }

    @Override
    public <R, C> R accept(InstructionVisitor<R, C> visitor, C context) {
        return visitor.visitAssign(this, context);
    }
}
