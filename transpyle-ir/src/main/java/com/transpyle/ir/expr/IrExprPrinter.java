package com.transpyle.ir.expr;

import java.math.BigDecimal;

/**
 * 将 IR 表达式树渲染为 C 系语法文本。
 *
 * <p>只在树结构需要时插入括号：左操作数优先级更低时、右操作数优先级不高于父节点时。
 * 布尔字面量的写法随目标语言不同，由构造参数给出。</p>
 */
public class IrExprPrinter implements IrExprVisitor<String, Void> {

    /** 与目标无关的渲染，用于 toString 与 IR 导出 */
    public static final IrExprPrinter NEUTRAL = new IrExprPrinter("true", "false");

    private static final int PREC_COMPARISON = 0;
    private static final int PREC_UNARY = 3;
    private static final int PREC_ATOM = 4;

    private final String trueText;
    private final String falseText;

    public IrExprPrinter(String trueText, String falseText) {
        this.trueText = trueText;
        this.falseText = falseText;
    }

    public String print(IrExpr expr) {
        return expr.accept(this, null);
    }

    @Override
    public String visitLiteral(IrLiteral node, Void context) {
        switch (node.getKind()) {
            case INT:
                return node.getValue().toString();
            case DOUBLE:
                if (node.getValue() instanceof Double) {
                    return Double.toString((Double) node.getValue());
                }
                return ((BigDecimal) node.getValue()).toString();
            case STRING:
                return quote((String) node.getValue());
            default:
                return (Boolean) node.getValue() ? trueText : falseText;
        }
    }

    @Override
    public String visitVariable(IrVariable node, Void context) {
        return node.getName();
    }

    @Override
    public String visitBinary(IrBinary node, Void context) {
        int prec = node.getOperator().getPrecedence();
        String left = print(node.getLeft());
        if (precedence(node.getLeft()) < prec) {
            left = "(" + left + ")";
        }
        String right = print(node.getRight());
        if (precedence(node.getRight()) <= prec) {
            right = "(" + right + ")";
        }
        return left + " " + node.getOperator().getSymbol() + " " + right;
    }

    @Override
    public String visitNegate(IrNegate node, Void context) {
        String operand = print(node.getOperand());
        if (precedence(node.getOperand()) <= PREC_UNARY) {
            operand = "(" + operand + ")";
        }
        return "-" + operand;
    }

    @Override
    public String visitComparison(IrComparison node, Void context) {
        String left = print(node.getLeft());
        if (precedence(node.getLeft()) == PREC_COMPARISON) {
            left = "(" + left + ")";
        }
        String right = print(node.getRight());
        if (precedence(node.getRight()) == PREC_COMPARISON) {
            right = "(" + right + ")";
        }
        return left + " " + node.getOperator().getSymbol() + " " + right;
    }

    @Override
    public String visitUnsupported(IrUnsupported node, Void context) {
        return print(node.getFallback());
    }

    private static int precedence(IrExpr expr) {
        if (expr instanceof IrBinary) {
            return ((IrBinary) expr).getOperator().getPrecedence();
        }
        if (expr instanceof IrComparison) {
            return PREC_COMPARISON;
        }
        if (expr instanceof IrNegate) {
            return PREC_UNARY;
        }
        if (expr instanceof IrLiteral && ((IrLiteral) expr).isNumeric()
                && ((Number) ((IrLiteral) expr).getValue()).doubleValue() < 0) {
            return PREC_UNARY;  // 负数字面量按一元表达式处理
        }
        return PREC_ATOM;
    }

    /**
     * 转义为双引号字符串字面量
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                case '\r': sb.append("\\r"); break;
                default: sb.append(c); break;
            }
        }
        return sb.append('"').toString();
    }
}
