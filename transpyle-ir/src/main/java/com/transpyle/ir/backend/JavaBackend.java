package com.transpyle.ir.backend;

import com.transpyle.ir.expr.IrBinary;
import com.transpyle.ir.expr.IrExprPrinter;
import com.transpyle.ir.inst.IrPrintPart;

import java.util.Arrays;
import java.util.List;

/**
 * Java 后端：主体位于 Main.main 中，使用 System.out.println 字符串拼接输出
 */
public class JavaBackend extends Backend {

    public JavaBackend() {
        super(new IrExprPrinter("true", "false"));
    }

    @Override
    public TargetLanguage getTarget() {
        return TargetLanguage.JAVA;
    }

    @Override
    public List<String> header(String indentUnit) {
        return Arrays.asList("public class Main {", indentUnit + "public static void main(String[] args) {");
    }

    @Override
    public List<String> footer(String indentUnit) {
        return Arrays.asList(indentUnit + "}", "}");
    }

    @Override
    public int bodyDepth() {
        return 2;
    }

    @Override
    protected String stringType() {
        return "String";
    }

    @Override
    protected String boolType() {
        return "boolean";
    }

    /**
     * 多个部分拼接时算术部分加括号，避免被字符串拼接吞并
     */
    @Override
    public String printStatement(List<IrPrintPart> parts, DeclarationScope scope) {
        StringBuilder sb = new StringBuilder("System.out.println(");
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                sb.append(" + \" \" + ");
            }
            String text = render(parts.get(i).getValue());
            if (parts.size() > 1 && parts.get(i).getValue() instanceof IrBinary) {
                text = "(" + text + ")";
            }
            sb.append(text);
        }
        return sb.append(");").toString();
    }
}
