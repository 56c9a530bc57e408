package com.transpyle.ir.lowering;

import com.transpyle.compiler.ast.AstNode;
import com.transpyle.compiler.ast.AstVisitor;
import com.transpyle.compiler.ast.decl.FunDecl;
import com.transpyle.compiler.ast.decl.ImportDecl;
import com.transpyle.compiler.ast.decl.Program;
import com.transpyle.compiler.ast.expr.*;
import com.transpyle.compiler.ast.expr.CallExpr.Argument;
import com.transpyle.compiler.ast.stmt.*;
import com.transpyle.ir.expr.IrExpr;
import com.transpyle.ir.expr.IrLiteral;
import com.transpyle.ir.expr.IrUnsupported;
import com.transpyle.ir.inst.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * AST → IR 降级（语句遍历）。
 *
 * <p>上下文为当前输出块，访问方法向其追加零到多条指令。返回 {@code TRUE}
 * 表示语句已处理（包括有意跳过），返回 null 的语句类型被丢弃并记录日志。</p>
 */
public class AstToIrLowering implements AstVisitor<Boolean, List<Instruction>> {

    private static final Logger LOG = Logger.getLogger(AstToIrLowering.class.getName());

    private static final long DEFAULT_LOOP_LIMIT = 10;

    private final ExpressionLowering expressions = new ExpressionLowering();

    // ========== 公共入口 ==========

    public IrProgram lower(Program program) {
        List<Instruction> out = new ArrayList<>();
        lowerBlock(program.getStatements(), out);
        return new IrProgram(out);
    }

    /**
     * 把语句序列降级并追加到 out
     */
    public void lowerBlock(List<Statement> statements, List<Instruction> out) {
        for (Statement stmt : statements) {
            Boolean handled = stmt.accept(this, out);
            if (handled == null) {
                dropped(stmt, stmt.getClass().getSimpleName());
            }
        }
    }

    private List<Instruction> lowerBlock(Block block) {
        List<Instruction> out = new ArrayList<>();
        if (block != null) {
            lowerBlock(block.getStatements(), out);
        }
        return out;
    }

    // ========== 跳过的声明 ==========

    @Override
    public Boolean visitFunDecl(FunDecl node, List<Instruction> out) {
        LOG.fine(() -> "Skipping function definition '" + node.getName() + "'");
        return Boolean.TRUE;
    }

    @Override
    public Boolean visitImportDecl(ImportDecl node, List<Instruction> out) {
        LOG.fine("Skipping import");
        return Boolean.TRUE;
    }

    // ========== 赋值与打印 ==========

    /**
     * 只取第一个目标；目标不是简单名称时整条语句被丢弃
     */
    @Override
    public Boolean visitAssignStmt(AssignStmt node, List<Instruction> out) {
        Expression target = node.getTargets().get(0);
        if (!(target instanceof Identifier)) {
            dropped(node, "assignment to " + target.getClass().getSimpleName());
            return Boolean.TRUE;
        }
        String name = ((Identifier) target).getName();
        out.add(new IrAssign(name, expressions.lowerExpr(node.getValue())));
        return Boolean.TRUE;
    }

    @Override
    public Boolean visitExpressionStmt(ExpressionStmt node, List<Instruction> out) {
        Expression expr = node.getExpression();
        if (!(expr instanceof CallExpr) || !"print".equals(((CallExpr) expr).getCalleeName())) {
            dropped(node, "expression statement");
            return Boolean.TRUE;
        }
        List<IrPrintPart> parts = new ArrayList<>();
        for (Argument arg : ((CallExpr) expr).getArgs()) {
            switch (arg.getKind()) {
                case POSITIONAL:
                    parts.add(IrPrintPart.of(expressions.lowerExpr(arg.getValue())));
                    break;
                case STAR:
                    parts.add(IrPrintPart.of(new IrUnsupported("starred print argument", IrLiteral.ofInt(0))));
                    break;
                default:
                    // sep= / end= 等关键字参数不影响输出
                    break;
            }
        }
        out.add(new IrPrint(parts));
        return Boolean.TRUE;
    }

    // ========== 控制流 ==========

    @Override
    public Boolean visitIfStmt(IfStmt node, List<Instruction> out) {
        if (isMainGuard(node.getCondition())) {
            lowerBlock(node.getThenBranch().getStatements(), out);
            return Boolean.TRUE;
        }
        IrExpr condition = expressions.lowerCondition(node.getCondition());
        List<Instruction> thenBlock = lowerBlock(node.getThenBranch());
        List<Instruction> elseBlock = node.hasElse()
                ? lowerBlock(node.getElseBranch())
                : Collections.<Instruction>emptyList();
        out.add(new IrIf(condition, thenBlock, elseBlock));
        return Boolean.TRUE;
    }

    @Override
    public Boolean visitWhileStmt(WhileStmt node, List<Instruction> out) {
        IrExpr condition = expressions.lowerCondition(node.getCondition());
        out.add(new IrWhile(condition, lowerBlock(node.getBody())));
        return Boolean.TRUE;
    }

    @Override
    public Boolean visitForStmt(ForStmt node, List<Instruction> out) {
        if (node.isAsync()) {
            dropped(node, "async for loop");
            return Boolean.TRUE;
        }
        if (!(node.getTarget() instanceof Identifier)) {
            dropped(node, "for loop with " + node.getTarget().getClass().getSimpleName() + " target");
            return Boolean.TRUE;
        }
        String variable = ((Identifier) node.getTarget()).getName();
        out.add(new IrFor(variable, loopLimit(node.getIterable()), lowerBlock(node.getBody())));
        return Boolean.TRUE;
    }

    /**
     * 仅识别单参数 range(limit)
     */
    private IrExpr loopLimit(Expression iterable) {
        if (iterable instanceof CallExpr) {
            CallExpr call = (CallExpr) iterable;
            if ("range".equals(call.getCalleeName()) && call.getArgs().size() == 1
                    && call.getArgs().get(0).getKind() == CallExpr.ArgumentKind.POSITIONAL) {
                return expressions.lowerExpr(call.getArgs().get(0).getValue());
            }
        }
        LOG.fine(() -> "[" + iterable.getLocation() + "] Unsupported loop iterable, using limit "
                + DEFAULT_LOOP_LIMIT);
        return new IrUnsupported("loop iterable is not range(limit)", IrLiteral.ofInt(DEFAULT_LOOP_LIMIT));
    }

    /**
     * {@code __name__ == "__main__"}
     */
    static boolean isMainGuard(Expression condition) {
        if (!(condition instanceof CompareExpr)) {
            return false;
        }
        CompareExpr compare = (CompareExpr) condition;
        if (compare.isChained() || compare.getOperators().get(0) != CompareExpr.CompareOp.EQ) {
            return false;
        }
        if (!(compare.getLeft() instanceof Identifier)
                || !"__name__".equals(((Identifier) compare.getLeft()).getName())) {
            return false;
        }
        Expression right = compare.getComparators().get(0);
        return right instanceof Literal
                && ((Literal) right).getKind() == Literal.LiteralKind.STRING
                && "__main__".equals(((Literal) right).getValue());
    }

    private static void dropped(AstNode node, String what) {
        LOG.fine(() -> "[" + node.getLocation() + "] Dropping unsupported " + what);
    }
}
