package com.transpyle.ir;

import com.transpyle.ir.backend.GeneratorConfig;
import com.transpyle.ir.backend.ScopingMode;
import com.transpyle.ir.backend.TargetLanguage;
import com.transpyle.ir.backend.UnsupportedTargetException;
import com.transpyle.ir.inst.IrComment;
import com.transpyle.ir.inst.IrProgram;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 端到端转译测试
 */
class TranspilerTest {

    private final Transpiler transpiler = new Transpiler();

    private static long count(String text, String needle) {
        long n = 0;
        int idx = text.indexOf(needle);
        while (idx >= 0) {
            n++;
            idx = text.indexOf(needle, idx + needle.length());
        }
        return n;
    }

    @Nested
    @DisplayName("完整输出")
    class FullOutputTests {

        private static final String SOURCE = "x = 5\nprint(\"a\", x)\n";

        @Test
        @DisplayName("C")
        void testC() {
            assertEquals("#include <stdio.h>\n"
                            + "\n"
                            + "int main() {\n"
                            + "    int x = 5;\n"
                            + "    printf(\"%s %d\\n\", \"a\", x);\n"
                            + "    return 0;\n"
                            + "}",
                    transpiler.translate(SOURCE, TargetLanguage.C));
        }

        @Test
        @DisplayName("C++")
        void testCpp() {
            assertEquals("#include <iostream>\n"
                            + "using namespace std;\n"
                            + "\n"
                            + "int main() {\n"
                            + "    int x = 5;\n"
                            + "    cout << \"a\" << \" \" << x << endl;\n"
                            + "    return 0;\n"
                            + "}",
                    transpiler.translate(SOURCE, TargetLanguage.CPP));
        }

        @Test
        @DisplayName("Java")
        void testJava() {
            assertEquals("public class Main {\n"
                            + "    public static void main(String[] args) {\n"
                            + "        int x = 5;\n"
                            + "        System.out.println(\"a\" + \" \" + x);\n"
                            + "    }\n"
                            + "}",
                    transpiler.translate(SOURCE, TargetLanguage.JAVA));
        }

        @Test
        @DisplayName("控制流嵌套")
        void testNestedControlFlow() {
            String source = "n = 0\n"
                    + "for i in range(3):\n"
                    + "    if i > 1:\n"
                    + "        print(\"big\", i)\n"
                    + "    else:\n"
                    + "        n = n + i\n"
                    + "while n < 10:\n"
                    + "    n = n * 2\n";
            assertEquals("#include <stdio.h>\n"
                            + "\n"
                            + "int main() {\n"
                            + "    int n = 0;\n"
                            + "    for(int i=0; i<3; i++) {\n"
                            + "        if (i > 1) {\n"
                            + "            printf(\"%s %d\\n\", \"big\", i);\n"
                            + "        } else {\n"
                            + "            n = n + i;\n"
                            + "        }\n"
                            + "    }\n"
                            + "    while (n < 10) {\n"
                            + "        n = n * 2;\n"
                            + "    }\n"
                            + "    return 0;\n"
                            + "}",
                    transpiler.translate(source, TargetLanguage.C));
        }
    }

    @Nested
    @DisplayName("转译性质")
    class PropertyTests {

        @Test
        @DisplayName("赋值与打印一一对应，定义与导入被跳过")
        void testStatementCount() {
            String source = "import os\n"
                    + "a = 1\n"
                    + "def f():\n"
                    + "    return 1\n"
                    + "b = 'x'\n"
                    + "print(a)\n"
                    + "print(b, a)\n";
            IrProgram program = transpiler.parse(source);
            assertEquals(4, program.size());
            for (TargetLanguage target : TargetLanguage.values()) {
                String out = transpiler.translate(source, target);
                assertThat(count(out, ";")).isGreaterThanOrEqualTo(4);
                assertThat(out).doesNotContain("import").doesNotContain("def ");
            }
        }

        @Test
        @DisplayName("重复赋值不重复声明")
        void testNoRedeclaration() {
            String source = "x = 1\nx = 2\nx = x + 1\n";
            for (TargetLanguage target : TargetLanguage.values()) {
                String out = transpiler.translate(source, target);
                assertEquals(1, count(out, "int x"), target.getName());
                assertThat(out).contains("x = 2;").contains("x = x + 1;");
            }
        }

        @Test
        @DisplayName("range 循环：头部含上界，循环体内不重新声明循环变量")
        void testRangeLoop() {
            String source = "for x in range(5):\n    x = 3\n    print(x)\n";
            for (TargetLanguage target : TargetLanguage.values()) {
                String out = transpiler.translate(source, target);
                assertThat(out).contains("x<5");
                assertEquals(1, count(out, "int x"), target.getName());
                assertThat(out).contains(" x = 3;");
            }
        }

        @Test
        @DisplayName("三种目标的打印形式")
        void testPrintForms() {
            String source = "b = 2\nprint(\"a\", b)\n";
            assertThat(transpiler.translate(source, TargetLanguage.C)).contains("printf(\"%s %d\\n\", \"a\", b);");
            assertThat(transpiler.translate(source, TargetLanguage.CPP))
                    .contains("cout << \"a\" << \" \" << b << endl;");
            assertThat(transpiler.translate(source, TargetLanguage.JAVA))
                    .contains("System.out.println(\"a\" + \" \" + b);");
        }

        @Test
        @DisplayName("主入口守卫与不加守卫的语句等价")
        void testMainGuard() {
            String guarded = "if __name__ == \"__main__\":\n    x = 1\n    print(x)\n";
            String plain = "x = 1\nprint(x)\n";
            for (TargetLanguage target : TargetLanguage.values()) {
                assertEquals(transpiler.translate(plain, target), transpiler.translate(guarded, target));
            }
        }

        @Test
        @DisplayName("语法错误：只有一条错误注释")
        void testMalformedInput() {
            List<String> broken = Arrays.asList("x = (1 +\n", "if x\n    y = 1\n", "  x = 1\n", "5 = x\n");
            for (String source : broken) {
                IrProgram program = transpiler.parse(source);
                assertEquals(1, program.size(), source);
                assertThat(program.getInstructions().get(0)).isInstanceOf(IrComment.class);
                assertThat(((IrComment) program.getInstructions().get(0)).getText()).startsWith("Error: ");
                for (TargetLanguage target : TargetLanguage.values()) {
                    String out = transpiler.translate(source, target);
                    assertEquals(1, count(out, "// Error: "), target.getName());
                    assertThat(out).endsWith("}");
                }
            }
        }

        @Test
        @DisplayName("超出 long / double 范围的数字照常转译")
        void testOutOfRangeNumbers() {
            String source = "x = 99999999999999999999\na = 1e400\nprint(x, -x)\n";
            IrProgram program = transpiler.parse(source);
            assertEquals(3, program.size());
            String out = transpiler.translate(source, TargetLanguage.C);
            assertThat(out).doesNotContain("// Error")
                    .contains("    int x = 99999999999999999999;")
                    .contains("    double a = 1E+400;")
                    .contains("printf(\"%d %d\\n\", x, -x);");
        }

        @Test
        @DisplayName("同一源码重复转译结果一致")
        void testIdempotent() {
            String source = "a = 1.5\nif a > 1:\n    print(\"big\")\n";
            for (TargetLanguage target : TargetLanguage.values()) {
                assertEquals(transpiler.translate(source, target), transpiler.translate(source, target));
            }
        }
    }

    @Nested
    @DisplayName("目标选择与配置")
    class TargetAndConfigTests {

        @Test
        @DisplayName("按名称选择目标，忽略大小写")
        void testTargetByName() {
            assertEquals(transpiler.translate("x = 1\n", TargetLanguage.CPP), transpiler.translate("x = 1\n", " CPP "));
        }

        @Test
        @DisplayName("未知目标抛出异常")
        void testUnknownTarget() {
            UnsupportedTargetException e = assertThrows(UnsupportedTargetException.class,
                    () -> transpiler.translate("x = 1\n", "rust"));
            assertEquals("rust", e.getRequested());
            assertThat(e.getMessage()).contains("'rust'").contains("c, cpp, java");
            assertThrows(UnsupportedTargetException.class, () -> transpiler.translate("x = 1\n", (String) null));
        }

        @Test
        @DisplayName("FLAT 模式与自定义缩进")
        void testConfig() {
            GeneratorConfig config = new GeneratorConfig();
            config.setScopingMode(ScopingMode.FLAT);
            config.setIndentSize(2);
            String source = "if a == 1:\n    y = 2\ny = 3\n";
            String out = new Transpiler(config).translate(source, TargetLanguage.C);
            assertThat(out).contains("\n  if (a == 1) {\n    int y = 2;\n  }\n  y = 3;\n  return 0;");
            assertThat(new Transpiler().translate(source, TargetLanguage.C)).contains("\n    int y = 3;");
        }

        @Test
        @DisplayName("转译文件")
        void testTranslateFile(@TempDir File dir) throws IOException {
            File file = new File(dir, "hello.py");
            Files.write(file.toPath(), "print(\"hi\")\n".getBytes(StandardCharsets.UTF_8));
            assertThat(new Transpiler().translateFile(file, TargetLanguage.JAVA))
                    .contains("System.out.println(\"hi\");");
        }
    }
}
