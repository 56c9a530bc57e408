package com.transpyle.ir.backend;

import com.transpyle.ir.expr.IrExprPrinter;
import com.transpyle.ir.inst.IrPrintPart;

import java.util.Arrays;
import java.util.List;

/**
 * C++ 后端：cout 流输出
 */
public class CppBackend extends Backend {

    public CppBackend() {
        super(new IrExprPrinter("true", "false"));
    }

    @Override
    public TargetLanguage getTarget() {
        return TargetLanguage.CPP;
    }

    @Override
    public List<String> header(String indentUnit) {
        return Arrays.asList("#include <iostream>", "using namespace std;", "", "int main() {");
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
        return "string";
    }

    @Override
    protected String boolType() {
        return "bool";
    }

    @Override
    public String printStatement(List<IrPrintPart> parts, DeclarationScope scope) {
        StringBuilder sb = new StringBuilder("cout");
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                sb.append(" << \" \"");
            }
            sb.append(" << ").append(render(parts.get(i).getValue()));
        }
        return sb.append(" << endl;").toString();
    }
}
