package com.transpyle.compiler.ast;

import com.transpyle.compiler.ast.decl.*;
import com.transpyle.compiler.ast.expr.*;
import com.transpyle.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitProgram(Program node, C ctx) { return null; }

    default R visitImportDecl(ImportDecl node, C ctx) { return null; }

    default R visitFunDecl(FunDecl node, C ctx) { return null; }

    default R visitClassDecl(ClassDecl node, C ctx) { return null; }

    default R visitParameter(Parameter node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    default R visitAssignStmt(AssignStmt node, C ctx) { return null; }

    default R visitAugAssignStmt(AugAssignStmt node, C ctx) { return null; }

    default R visitAnnAssignStmt(AnnAssignStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitWhileStmt(WhileStmt node, C ctx) { return null; }

    default R visitForStmt(ForStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    default R visitRaiseStmt(RaiseStmt node, C ctx) { return null; }

    default R visitPassStmt(PassStmt node, C ctx) { return null; }

    default R visitBreakStmt(BreakStmt node, C ctx) { return null; }

    default R visitContinueStmt(ContinueStmt node, C ctx) { return null; }

    default R visitGlobalStmt(GlobalStmt node, C ctx) { return null; }

    default R visitDelStmt(DelStmt node, C ctx) { return null; }

    default R visitAssertStmt(AssertStmt node, C ctx) { return null; }

    default R visitTryStmt(TryStmt node, C ctx) { return null; }

    default R visitExceptClause(ExceptClause node, C ctx) { return null; }

    default R visitWithStmt(WithStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitCompareExpr(CompareExpr node, C ctx) { return null; }

    default R visitConditionalExpr(ConditionalExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitMemberExpr(MemberExpr node, C ctx) { return null; }

    default R visitIndexExpr(IndexExpr node, C ctx) { return null; }

    default R visitSliceExpr(SliceExpr node, C ctx) { return null; }

    default R visitCollectionLiteral(CollectionLiteral node, C ctx) { return null; }

    default R visitDictLiteral(DictLiteral node, C ctx) { return null; }

    default R visitComprehensionExpr(ComprehensionExpr node, C ctx) { return null; }

    default R visitLambdaExpr(LambdaExpr node, C ctx) { return null; }

    default R visitStarredExpr(StarredExpr node, C ctx) { return null; }

    default R visitYieldExpr(YieldExpr node, C ctx) { return null; }

    default R visitNamedExpr(NamedExpr node, C ctx) { return null; }
}
