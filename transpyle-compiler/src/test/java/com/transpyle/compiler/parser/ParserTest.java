package com.transpyle.compiler.parser;

import com.transpyle.compiler.ast.decl.*;
import com.transpyle.compiler.ast.expr.*;
import com.transpyle.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.transpyle.compiler.ast.expr.CompareExpr.CompareOp;
import com.transpyle.compiler.ast.stmt.*;
import com.transpyle.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Program parse(String source) {
        Lexer lexer = new Lexer(source, "<test>");
        Parser parser = new Parser(lexer, "<test>");
        return parser.parse();
    }

    private Statement single(String source) {
        List<Statement> statements = parse(source).getStatements();
        assertEquals(1, statements.size(), "Expected single statement from: " + source);
        return statements.get(0);
    }

    private Expression expr(String source) {
        Statement stmt = single(source);
        assertTrue(stmt instanceof ExpressionStmt);
        return ((ExpressionStmt) stmt).getExpression();
    }

    // ============ 赋值 ============

    @Nested
    @DisplayName("赋值语句")
    class AssignmentTests {

        @Test
        @DisplayName("简单赋值")
        void testSimpleAssign() {
            AssignStmt assign = (AssignStmt) single("x = 5\n");
            assertEquals(1, assign.getTargets().size());
            assertEquals("x", ((Identifier) assign.getTargets().get(0)).getName());
            assertEquals(5L, ((Literal) assign.getValue()).getValue());
        }

        @Test
        @DisplayName("链式赋值保留所有目标")
        void testChainedAssign() {
            AssignStmt assign = (AssignStmt) single("a = b = 1");
            assertEquals(2, assign.getTargets().size());
            assertEquals("a", ((Identifier) assign.getTargets().get(0)).getName());
            assertEquals("b", ((Identifier) assign.getTargets().get(1)).getName());
        }

        @Test
        @DisplayName("元组解构目标")
        void testTupleTarget() {
            AssignStmt assign = (AssignStmt) single("a, b = 1, 2");
            assertTrue(assign.getTargets().get(0) instanceof CollectionLiteral);
            assertTrue(assign.getValue() instanceof CollectionLiteral);
        }

        @Test
        @DisplayName("增量赋值与注解赋值")
        void testAugAndAnnAssign() {
            AugAssignStmt aug = (AugAssignStmt) single("x += 2");
            assertEquals(BinaryOp.ADD, aug.getOperator());

            AnnAssignStmt ann = (AnnAssignStmt) single("y: int = 3");
            assertEquals("int", ((Identifier) ann.getAnnotation()).getName());
            assertTrue(ann.hasValue());
        }

        @Test
        @DisplayName("给字面量赋值是语法错误")
        void testAssignToLiteral() {
            ParseException e = assertThrows(ParseException.class, () -> parse("1 = x"));
            assertThat(e.getMessage()).startsWith("Cannot assign to literal");
        }

        @Test
        @DisplayName("分号分隔多条简单语句")
        void testSemicolons() {
            List<Statement> statements = parse("a = 1; b = 2;\n").getStatements();
            assertEquals(2, statements.size());
        }
    }

    // ============ 控制流 ============

    @Nested
    @DisplayName("控制流")
    class ControlFlowTests {

        @Test
        @DisplayName("if / elif / else 嵌套为 else 块中的 IfStmt")
        void testElifChain() {
            IfStmt stmt = (IfStmt) single("if x > 1:\n    a = 1\nelif x > 0:\n    a = 2\nelse:\n    a = 3\n");
            assertEquals(1, stmt.getThenBranch().getStatements().size());
            assertTrue(stmt.hasElse());
            Statement nested = stmt.getElseBranch().getStatements().get(0);
            assertTrue(nested instanceof IfStmt);
            assertTrue(((IfStmt) nested).hasElse());
        }

        @Test
        @DisplayName("单行语句块")
        void testInlineSuite() {
            IfStmt stmt = (IfStmt) single("if x: y = 1; z = 2\n");
            assertEquals(2, stmt.getThenBranch().getStatements().size());
        }

        @Test
        @DisplayName("while 循环")
        void testWhile() {
            WhileStmt stmt = (WhileStmt) single("while i < 10:\n    i += 1\n");
            assertTrue(stmt.getCondition() instanceof CompareExpr);
            assertEquals(1, stmt.getBody().getStatements().size());
        }

        @Test
        @DisplayName("for 循环目标与可迭代对象")
        void testFor() {
            ForStmt stmt = (ForStmt) single("for i in range(5):\n    print(i)\n");
            assertEquals("i", ((Identifier) stmt.getTarget()).getName());
            CallExpr range = (CallExpr) stmt.getIterable();
            assertEquals("range", range.getCalleeName());
            assertEquals(1, range.getArgs().size());
        }

        @Test
        @DisplayName("for 解构目标")
        void testForTupleTarget() {
            ForStmt stmt = (ForStmt) single("for k, v in items:\n    pass\n");
            assertTrue(stmt.getTarget() instanceof CollectionLiteral);
        }

        @Test
        @DisplayName("缺少缩进块报错")
        void testMissingIndent() {
            ParseException e = assertThrows(ParseException.class, () -> parse("if x:\nprint(1)\n"));
            assertThat(e.getMessage()).contains("Expected an indented block");
        }

        @Test
        @DisplayName("意外缩进报错")
        void testUnexpectedIndent() {
            assertThrows(ParseException.class, () -> parse("x = 1\n    y = 2\n"));
        }

        @Test
        @DisplayName("try / except / finally")
        void testTry() {
            TryStmt stmt = (TryStmt) single("try:\n    a()\nexcept ValueError as e:\n    pass\nfinally:\n    b()\n");
            assertEquals(1, stmt.getHandlers().size());
            assertEquals("e", stmt.getHandlers().get(0).getName());
            assertNotNull(stmt.getFinallyBlock());
        }
    }

    // ============ 声明 ============

    @Nested
    @DisplayName("声明")
    class DeclarationTests {

        @Test
        @DisplayName("函数定义与参数")
        void testFunDecl() {
            FunDecl fun = (FunDecl) single("def add(a, b: int = 1, *rest, **kw) -> int:\n    return a + b\n");
            assertEquals("add", fun.getName());
            assertEquals(4, fun.getParams().size());
            assertEquals(Parameter.ParameterKind.VAR_POSITIONAL, fun.getParams().get(2).getKind());
            assertNotNull(fun.getReturnType());
        }

        @Test
        @DisplayName("带装饰器的类定义")
        void testDecoratedClass() {
            ClassDecl cls = (ClassDecl) single("@dataclass\nclass Point(Base):\n    x: int = 0\n");
            assertEquals("Point", cls.getName());
            assertEquals(1, cls.getDecorators().size());
            assertEquals(1, cls.getBases().size());
        }

        @Test
        @DisplayName("import 与 from import")
        void testImports() {
            ImportDecl plain = (ImportDecl) single("import os.path as p");
            assertFalse(plain.isFromImport());
            assertEquals("os.path", plain.getNames().get(0).getName());
            assertEquals("p", plain.getNames().get(0).getAsName());

            ImportDecl from = (ImportDecl) single("from ..pkg import (a, b as c,)");
            assertEquals(2, from.getLevel());
            assertEquals("pkg", from.getModule());
            assertEquals(2, from.getNames().size());
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testPrecedence() {
            BinaryExpr add = (BinaryExpr) expr("1 + 2 * 3");
            assertEquals(BinaryOp.ADD, add.getOperator());
            assertEquals(BinaryOp.MUL, ((BinaryExpr) add.getRight()).getOperator());
        }

        @Test
        @DisplayName("减法左结合")
        void testLeftAssociative() {
            BinaryExpr sub = (BinaryExpr) expr("a - b - c");
            assertTrue(sub.getLeft() instanceof BinaryExpr);
            assertTrue(sub.getRight() instanceof Identifier);
        }

        @Test
        @DisplayName("幂运算右结合且绑定紧于一元负号")
        void testPower() {
            UnaryExpr neg = (UnaryExpr) expr("-2 ** 2");
            assertEquals(UnaryExpr.UnaryOp.NEG, neg.getOperator());
            assertEquals(BinaryOp.POW, ((BinaryExpr) neg.getOperand()).getOperator());

            BinaryExpr pow = (BinaryExpr) expr("a ** b ** c");
            assertTrue(pow.getRight() instanceof BinaryExpr);
        }

        @Test
        @DisplayName("链式比较与 not in / is not")
        void testComparisons() {
            CompareExpr chain = (CompareExpr) expr("a < b <= c");
            assertTrue(chain.isChained());
            assertThat(chain.getOperators()).containsExactly(CompareOp.LT, CompareOp.LE);

            CompareExpr notIn = (CompareExpr) expr("x not in ys");
            assertThat(notIn.getOperators()).containsExactly(CompareOp.NOT_IN);

            CompareExpr isNot = (CompareExpr) expr("x is not None");
            assertThat(isNot.getOperators()).containsExactly(CompareOp.IS_NOT);
        }

        @Test
        @DisplayName("逻辑运算与 not")
        void testLogical() {
            BinaryExpr or = (BinaryExpr) expr("a and b or not c");
            assertEquals(BinaryOp.OR, or.getOperator());
            assertEquals(BinaryOp.AND, ((BinaryExpr) or.getLeft()).getOperator());
            assertEquals(UnaryExpr.UnaryOp.NOT, ((UnaryExpr) or.getRight()).getOperator());
        }

        @Test
        @DisplayName("相邻字符串拼接")
        void testStringConcatenation() {
            Literal lit = (Literal) expr("'ab' \"cd\"");
            assertEquals("abcd", lit.getValue());
            assertEquals(Literal.LiteralKind.STRING, lit.getKind());
        }

        @Test
        @DisplayName("调用参数种类")
        void testCallArguments() {
            CallExpr call = (CallExpr) expr("print('a', b, *c, sep='-', **d)");
            assertEquals("print", call.getCalleeName());
            assertEquals(5, call.getArgs().size());
            assertEquals(3, call.getPositionalArgs().size());
            assertTrue(call.hasKeywordArgs());
        }

        @Test
        @DisplayName("括号、元组、列表、字典与集合")
        void testDisplays() {
            assertTrue(expr("(1 + 2)") instanceof BinaryExpr);
            assertEquals(CollectionLiteral.CollectionKind.TUPLE, ((CollectionLiteral) expr("(1,)")).getKind());
            assertEquals(CollectionLiteral.CollectionKind.LIST, ((CollectionLiteral) expr("[1, 2]")).getKind());
            assertEquals(CollectionLiteral.CollectionKind.SET, ((CollectionLiteral) expr("{1, 2}")).getKind());
            assertEquals(2, ((DictLiteral) expr("{'a': 1, **m}")).getKeys().size());
            assertEquals(0, ((DictLiteral) expr("{}")).getKeys().size());
        }

        @Test
        @DisplayName("推导式与生成器参数")
        void testComprehensions() {
            ComprehensionExpr list = (ComprehensionExpr) expr("[x * 2 for x in xs if x]");
            assertEquals(ComprehensionExpr.ComprehensionKind.LIST, list.getKind());
            assertEquals(1, list.getGenerators().get(0).getConditions().size());

            ComprehensionExpr dict = (ComprehensionExpr) expr("{k: v for k, v in items}");
            assertEquals(ComprehensionExpr.ComprehensionKind.DICT, dict.getKind());

            CallExpr call = (CallExpr) expr("sum(x for x in xs)");
            assertTrue(call.getArgs().get(0).getValue() instanceof ComprehensionExpr);
        }

        @Test
        @DisplayName("条件表达式、lambda 与海象赋值")
        void testMisc() {
            assertTrue(expr("a if c else b") instanceof ConditionalExpr);
            assertTrue(expr("lambda x, y=1: x + y") instanceof LambdaExpr);
            assertTrue(expr("(n := 10)") instanceof NamedExpr);
        }

        @Test
        @DisplayName("下标、切片与属性访问")
        void testPostfix() {
            IndexExpr slice = (IndexExpr) expr("xs[1:2]");
            assertTrue(slice.getIndex() instanceof SliceExpr);
            MemberExpr member = (MemberExpr) expr("obj.attr");
            assertEquals("attr", member.getMember());
        }
    }

    // ============ 错误 ============

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("缺少表达式")
        void testMissingExpression() {
            ParseException e = assertThrows(ParseException.class, () -> parse("x = \n"));
            assertThat(e.getMessage()).startsWith("Expected expression at line 1");
        }

        @Test
        @DisplayName("未闭合括号")
        void testUnclosedParen() {
            assertThrows(ParseException.class, () -> parse("print(1, 2\n"));
        }

        @Test
        @DisplayName("词法错误以 ParseException 抛出")
        void testLexerErrorSurfaces() {
            ParseException e = assertThrows(ParseException.class, () -> parse("x = 'abc\n"));
            assertThat(e.getMessage()).startsWith("unterminated string literal");
        }

        @Test
        @DisplayName("缺少冒号附带期望信息")
        void testMissingColon() {
            ParseException e = assertThrows(ParseException.class, () -> parse("if x\n    pass\n"));
            assertEquals("COLON", e.getExpected());
        }
    }
}
