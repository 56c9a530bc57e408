package com.transpyle.ir.lowering;

import com.transpyle.compiler.lexer.Lexer;
import com.transpyle.compiler.parser.Parser;
import com.transpyle.ir.expr.IrUnsupported;
import com.transpyle.ir.expr.TypeTag;
import com.transpyle.ir.inst.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 语句降级测试
 */
class AstToIrLoweringTest {

    private List<Instruction> lower(String source) {
        Parser parser = new Parser(new Lexer(source, "<test>"));
        return new AstToIrLowering().lower(parser.parse()).getInstructions();
    }

    @Nested
    @DisplayName("赋值")
    class AssignTests {

        @Test
        @DisplayName("简单赋值携带类型标签")
        void testAssign() {
            List<Instruction> ir = lower("x = 5\ny = 'a'\nz = x * 2\n");
            assertEquals(3, ir.size());
            IrAssign x = (IrAssign) ir.get(0);
            assertEquals("x", x.getName());
            assertEquals(TypeTag.INT, x.getTypeTag());
            assertEquals(TypeTag.STRING, ((IrAssign) ir.get(1)).getTypeTag());
            assertEquals(TypeTag.AUTO, ((IrAssign) ir.get(2)).getTypeTag());
        }

        @Test
        @DisplayName("链式赋值只保留第一个目标")
        void testChainedAssign() {
            List<Instruction> ir = lower("a = b = 1\n");
            assertEquals(1, ir.size());
            assertEquals("a", ((IrAssign) ir.get(0)).getName());
        }

        @Test
        @DisplayName("非名称目标的赋值被丢弃")
        void testUnsupportedTargets() {
            assertTrue(lower("a, b = 1, 2\n").isEmpty());
            assertTrue(lower("obj.x = 1\n").isEmpty());
            assertTrue(lower("xs[0] = 1\n").isEmpty());
        }

        @Test
        @DisplayName("增量赋值不产生 IR")
        void testAugAssignDropped() {
            assertTrue(lower("x += 1\n").isEmpty());
        }
    }

    @Nested
    @DisplayName("打印")
    class PrintTests {

        @Test
        @DisplayName("参数分类为字符串部分与表达式部分")
        void testParts() {
            IrPrint print = (IrPrint) lower("print('a', b, 'x' + c)\n").get(0);
            List<IrPrintPart> parts = print.getParts();
            assertEquals(3, parts.size());
            assertTrue(parts.get(0).isLiteralString());
            assertFalse(parts.get(1).isLiteralString());
            assertTrue(parts.get(2).isLiteralString());
        }

        @Test
        @DisplayName("关键字参数被忽略，星号参数不支持")
        void testKeywordAndStarArgs() {
            IrPrint print = (IrPrint) lower("print(a, *rest, sep='-', end='')\n").get(0);
            assertEquals(2, print.getParts().size());
            assertTrue(print.getParts().get(1).getValue() instanceof IrUnsupported);
        }

        @Test
        @DisplayName("其他调用语句被丢弃")
        void testOtherCallsDropped() {
            assertTrue(lower("foo(1)\nlen(x)\n").isEmpty());
        }
    }

    @Nested
    @DisplayName("控制流")
    class ControlFlowTests {

        @Test
        @DisplayName("elif 链成为 else 块中的嵌套 If")
        void testElif() {
            IrIf outer = (IrIf) lower("if x > 1:\n    a = 1\nelif x > 0:\n    a = 2\n").get(0);
            assertEquals(1, outer.getElseBlock().size());
            IrIf inner = (IrIf) outer.getElseBlock().get(0);
            assertFalse(inner.hasElse());
        }

        @Test
        @DisplayName("while 的 else 子句被忽略")
        void testWhile() {
            IrWhile loop = (IrWhile) lower("while i < 3:\n    i = i + 1\nelse:\n    print(i)\n").get(0);
            assertEquals("i < 3", loop.getCondition().toString());
            assertEquals(1, loop.getBody().size());
        }

        @Test
        @DisplayName("range 循环")
        void testForRange() {
            IrFor loop = (IrFor) lower("for i in range(n + 1):\n    print(i)\n").get(0);
            assertEquals("i", loop.getLoopVariable());
            assertEquals("n + 1", loop.getLimit().toString());
            assertEquals(1, loop.getBody().size());
        }

        @Test
        @DisplayName("非 range 可迭代对象回退为上限 10")
        void testForFallbackLimit() {
            for (String source : new String[]{"for i in xs:\n    pass\n", "for i in range(1, 5):\n    pass\n"}) {
                IrFor loop = (IrFor) lower(source).get(0);
                assertTrue(loop.getLimit() instanceof IrUnsupported, source);
                assertEquals("10", loop.getLimit().toString());
            }
        }

        @Test
        @DisplayName("解构循环目标被丢弃")
        void testForTupleTargetDropped() {
            assertTrue(lower("for k, v in items:\n    print(k)\n").isEmpty());
        }
    }

    @Nested
    @DisplayName("入口守卫与跳过的语句")
    class GuardTests {

        @Test
        @DisplayName("入口守卫展开到当前块并丢弃 else")
        void testMainGuard() {
            List<Instruction> ir = lower("if __name__ == '__main__':\n    x = 1\n    print(x)\nelse:\n    y = 2\n");
            assertEquals(2, ir.size());
            assertTrue(ir.get(0) instanceof IrAssign);
            assertTrue(ir.get(1) instanceof IrPrint);
        }

        @Test
        @DisplayName("嵌套位置的入口守卫同样展开")
        void testNestedGuard() {
            IrWhile loop = (IrWhile) lower("while x < 1:\n    if __name__ == \"__main__\":\n        x = 2\n").get(0);
            assertTrue(loop.getBody().get(0) instanceof IrAssign);
        }

        @Test
        @DisplayName("操作数顺序相反时不视为守卫")
        void testReversedGuard() {
            assertTrue(lower("if '__main__' == __name__:\n    x = 1\n").get(0) instanceof IrIf);
        }

        @Test
        @DisplayName("函数、类、导入及其他语句不产生 IR")
        void testSkipped() {
            String source = "import os\nfrom a import b\ndef f(x):\n    return x\nclass C:\n    pass\n"
                    + "try:\n    pass\nexcept E:\n    pass\nwith open(p) as fh:\n    pass\npass\n";
            assertThat(lower(source)).isEmpty();
        }
    }
}
