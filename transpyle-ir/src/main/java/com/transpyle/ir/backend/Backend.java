package com.transpyle.ir.backend;

import com.transpyle.ir.expr.IrExpr;
import com.transpyle.ir.expr.IrExprPrinter;
import com.transpyle.ir.expr.TypeTag;
import com.transpyle.ir.inst.IrPrintPart;

import java.util.List;

/**
 * 目标语言后端：程序外壳、类型名、打印语句与表达式渲染。
 * 与目标无关的遍历逻辑在 {@link CodeGenerator} 中。
 */
public abstract class Backend {

    private final IrExprPrinter printer;

    protected Backend(IrExprPrinter printer) {
        this.printer = printer;
    }

    public static Backend forTarget(TargetLanguage target) {
        switch (target) {
            case C:
                return new CBackend();
            case CPP:
                return new CppBackend();
            case JAVA:
                return new JavaBackend();
            default:
                throw new UnsupportedTargetException(target.getName());
        }
    }

    public abstract TargetLanguage getTarget();

    /**
     * 程序开头的行，indentUnit 为单层缩进
     */
    public abstract List<String> header(String indentUnit);

    public abstract List<String> footer(String indentUnit);

    /**
     * 程序主体语句的缩进层级
     */
    public abstract int bodyDepth();

    /**
     * 渲染完整的打印语句（含分号）
     */
    public abstract String printStatement(List<IrPrintPart> parts, DeclarationScope scope);

    protected abstract String stringType();

    protected abstract String boolType();

    public String render(IrExpr expr) {
        return printer.print(expr);
    }

    /**
     * 声明变量时使用的类型名。var / auto 无法推断，按 int 处理。
     */
    public String declarationType(TypeTag tag) {
        switch (tag) {
            case DOUBLE:
                return "double";
            case STRING:
                return stringType();
            case BOOL:
                return boolType();
            default:
                return "int";
        }
    }

    public String forHeader(String variable, String limit) {
        return "for(int " + variable + "=0; " + variable + "<" + limit + "; " + variable + "++) {";
    }

    public String comment(String text) {
        return "// " + text.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
    }
}
