package com.transpyle.ir.lowering;

import com.transpyle.compiler.ast.AstNode;
import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.expr.*;
import com.transpyle.ir.expr.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.logging.Logger;

/**
 * 源表达式 → IR 表达式。
 *
 * <p>支持字面量、名称、四则运算与取模、一元正负号；其余表达式降级为
 * {@link IrUnsupported}，值位置回退为 {@code 0}，条件位置回退为 {@code true}。</p>
 */
public class ExpressionLowering implements AstVisitor<IrExpr, Void> {

    private static final Logger LOG = Logger.getLogger(ExpressionLowering.class.getName());

    /**
     * 值位置的表达式
     */
    public IrExpr lowerExpr(Expression expr) {
        IrExpr result = expr.accept(this, null);
        if (result == null) {
            return unsupported(expr, describe(expr), IrLiteral.ofInt(0));
        }
        return result;
    }

    /**
     * 条件位置的表达式。比较只取第一个运算符与第一个比较对象。
     */
    public IrExpr lowerCondition(Expression expr) {
        if (!(expr instanceof CompareExpr)) {
            return unsupported(expr, "non-comparison condition", IrLiteral.ofBoolean(true));
        }
        CompareExpr compare = (CompareExpr) expr;
        IrExpr left = lowerExpr(compare.getLeft());
        IrExpr right = lowerExpr(compare.getComparators().get(0));
        return new IrComparison(left, comparisonOperator(compare.getOperators().get(0)), right);
    }

    // ============ 支持的表达式 ============

    @Override
    public IrExpr visitLiteral(Literal node, Void ctx) {
        switch (node.getKind()) {
            case INT:
                if (node.getValue() instanceof BigInteger) {
                    return IrLiteral.ofInt((BigInteger) node.getValue());
                }
                return IrLiteral.ofInt((Long) node.getValue());
            case FLOAT:
                if (node.getValue() instanceof BigDecimal) {
                    return IrLiteral.ofDouble((BigDecimal) node.getValue());
                }
                return IrLiteral.ofDouble((Double) node.getValue());
            case STRING:
                return IrLiteral.ofString((String) node.getValue());
            case BOOLEAN:
                return IrLiteral.ofBoolean((Boolean) node.getValue());
            default:
                return null;
        }
    }

    @Override
    public IrExpr visitIdentifier(Identifier node, Void ctx) {
        return new IrVariable(node.getName());
    }

    @Override
    public IrExpr visitBinaryExpr(BinaryExpr node, Void ctx) {
        if (node.getOperator().isLogical()) {
            return null;
        }
        return new IrBinary(lowerExpr(node.getLeft()), arithmeticOperator(node.getOperator()),
                lowerExpr(node.getRight()));
    }

    @Override
    public IrExpr visitUnaryExpr(UnaryExpr node, Void ctx) {
        switch (node.getOperator()) {
            case NEG:
                return new IrNegate(lowerExpr(node.getOperand()));
            case POS:
                return lowerExpr(node.getOperand());
            default:
                return null;
        }
    }

    // ============ 运算符映射 ============

    /**
     * 无法映射的算术 / 位运算符回退为加法
     */
    static IrBinary.Operator arithmeticOperator(BinaryExpr.BinaryOp op) {
        switch (op) {
            case SUB: return IrBinary.Operator.SUB;
            case MUL: return IrBinary.Operator.MUL;
            case DIV: return IrBinary.Operator.DIV;
            case MOD: return IrBinary.Operator.MOD;
            case ADD: return IrBinary.Operator.ADD;
            default:
                LOG.fine(() -> "Operator '" + op.getSymbol() + "' has no direct equivalent, using '+'");
                return IrBinary.Operator.ADD;
        }
    }

    /**
     * in / not in / is / is not 回退为相等比较
     */
    static IrComparison.Operator comparisonOperator(CompareExpr.CompareOp op) {
        switch (op) {
            case NE: return IrComparison.Operator.NE;
            case GT: return IrComparison.Operator.GT;
            case LT: return IrComparison.Operator.LT;
            case GE: return IrComparison.Operator.GE;
            case LE: return IrComparison.Operator.LE;
            case EQ: return IrComparison.Operator.EQ;
            default:
                LOG.fine(() -> "Comparison '" + op.getSymbol() + "' has no direct equivalent, using '=='");
                return IrComparison.Operator.EQ;
        }
    }

    // ============ 不支持的表达式 ============

    private static IrUnsupported unsupported(AstNode node, String reason, IrLiteral fallback) {
        LOG.fine(() -> String.format("[%s] Unsupported %s, rendering %s",
                node.getLocation(), reason, IrExprPrinter.NEUTRAL.print(fallback)));
        return new IrUnsupported(reason, fallback);
    }

    private static String describe(Expression expr) {
        if (expr instanceof Literal) {
            switch (((Literal) expr).getKind()) {
                case FSTRING: return "f-string literal";
                case BYTES: return "bytes literal";
                case NONE: return "None literal";
                default: return "ellipsis literal";
            }
        }
        if (expr instanceof BinaryExpr) {
            return "boolean operator '" + ((BinaryExpr) expr).getOperator().getSymbol() + "'";
        }
        if (expr instanceof UnaryExpr) {
            return "unary operator " + ((UnaryExpr) expr).getOperator().name().toLowerCase();
        }
        if (expr instanceof CallExpr) {
            String callee = ((CallExpr) expr).getCalleeName();
            return callee != null ? "call to '" + callee + "'" : "call expression";
        }
        if (expr instanceof CompareExpr) return "comparison in value position";
        if (expr instanceof MemberExpr) return "attribute access";
        if (expr instanceof IndexExpr) return "subscript";
        if (expr instanceof CollectionLiteral) {
            return ((CollectionLiteral) expr).getKind().name().toLowerCase() + " display";
        }
        if (expr instanceof DictLiteral) return "dict display";
        if (expr instanceof ComprehensionExpr) return "comprehension";
        if (expr instanceof ConditionalExpr) return "conditional expression";
        if (expr instanceof LambdaExpr) return "lambda";
        return "expression " + expr.getClass().getSimpleName();
    }
}
