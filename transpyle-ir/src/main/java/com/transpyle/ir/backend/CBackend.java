package com.transpyle.ir.backend;

import com.transpyle.ir.expr.IrExprPrinter;
import com.transpyle.ir.expr.IrVariable;
import com.transpyle.ir.expr.TypeTag;
import com.transpyle.ir.inst.IrPrintPart;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * C 后端：printf 输出，布尔值写作 1 / 0
 */
public class CBackend extends Backend {

    public CBackend() {
        super(new IrExprPrinter("1", "0"));
    }

    @Override
    public TargetLanguage getTarget() {
        return TargetLanguage.C;
    }

    @Override
    public List<String> header(String indentUnit) {
        return Arrays.asList("#include <stdio.h>", "", "int main() {");
    }

    @Override
    public List<String> footer(String indentUnit) {
        return Arrays.asList(indentUnit + "return 0;", "}");
    }

    @Override
    public int bodyDepth() {
        return 1;
    }

    @Override
    protected String stringType() {
        return "char*";
    }

    @Override
    protected String boolType() {
        return "int";
    }

    @Override
    public String printStatement(List<IrPrintPart> parts, DeclarationScope scope) {
        if (parts.isEmpty()) {
            return "printf(\"\\n\");";
        }
        List<String> placeholders = new ArrayList<>();
        StringBuilder args = new StringBuilder();
        for (IrPrintPart part : parts) {
            placeholders.add(placeholder(part, scope));
            args.append(", ").append(render(part.getValue()));
        }
        return "printf(\"" + String.join(" ", placeholders) + "\\n\"" + args + ");";
    }

    /**
     * 字符串部分与字符串变量用 %s，double 用 %f，其余 %d
     */
    private static String placeholder(IrPrintPart part, DeclarationScope scope) {
        if (part.isLiteralString()) {
            return "%s";
        }
        TypeTag type = part.getValue().getTypeTag();
        if (part.getValue() instanceof IrVariable) {
            TypeTag declared = scope.lookup(((IrVariable) part.getValue()).getName());
            if (declared != null) {
                type = declared;
            }
        }
        switch (type) {
            case STRING:
                return "%s";
            case DOUBLE:
                return "%f";
            default:
                return "%d";
        }
    }
}
