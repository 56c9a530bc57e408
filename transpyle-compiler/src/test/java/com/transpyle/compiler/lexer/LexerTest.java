package com.transpyle.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        return new Lexer(source, "<test>").scanTokens();
    }

    /** 扫描源码，返回 token 类型序列（不含 EOF） */
    private List<TokenType> types(String source) {
        return scan(source).stream()
                .map(Token::getType)
                .filter(t -> t != TokenType.EOF)
                .collect(Collectors.toList());
    }

    /** 扫描源码，返回非 EOF 非 NEWLINE 的 token 列表 */
    private List<Token> tokens(String source) {
        return scan(source).stream()
                .filter(t -> t.getType() != TokenType.EOF && t.getType() != TokenType.NEWLINE)
                .collect(Collectors.toList());
    }

    /** 断言单个 token 的类型和字面量 */
    private void assertSingleToken(String source, TokenType expectedType, Object expectedLiteral) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expectedType, toks.get(0).getType());
        assertEquals(expectedLiteral, toks.get(0).getLiteral());
    }

    private Token firstError(String source) {
        return scan(source).stream()
                .filter(t -> t.getType() == TokenType.ERROR)
                .findFirst()
                .orElseThrow(() -> new AssertionError("Expected ERROR token from: " + source));
    }

    // ================================================================
    // 缩进
    // ================================================================

    @Nested
    @DisplayName("缩进与换行")
    class IndentationTests {

        @Test
        @DisplayName("缩进块产生 INDENT / DEDENT")
        void testIndentDedent() {
            List<TokenType> types = types("if x:\n    y = 1\nz = 2\n");
            assertEquals(java.util.Arrays.asList(
                    TokenType.KW_IF, TokenType.IDENTIFIER, TokenType.COLON, TokenType.NEWLINE,
                    TokenType.INDENT, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.INT_LITERAL, TokenType.NEWLINE,
                    TokenType.DEDENT, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.INT_LITERAL, TokenType.NEWLINE
            ), types);
        }

        @Test
        @DisplayName("文件末尾补齐 NEWLINE 与所有 DEDENT")
        void testDedentAtEof() {
            List<TokenType> types = types("if a:\n    if b:\n        c");
            long dedents = types.stream().filter(t -> t == TokenType.DEDENT).count();
            assertEquals(2, dedents);
            assertEquals(TokenType.NEWLINE, types.get(types.size() - 3));
        }

        @Test
        @DisplayName("空行与注释行不产生 token")
        void testBlankAndCommentLines() {
            List<TokenType> types = types("x = 1\n\n   # comment\n\ny = 2\n");
            assertFalse(types.contains(TokenType.INDENT));
            assertEquals(8, types.size());
        }

        @Test
        @DisplayName("括号内换行被忽略")
        void testImplicitLineJoin() {
            List<TokenType> types = types("print(1,\n      2)\n");
            assertEquals(1, types.stream().filter(t -> t == TokenType.NEWLINE).count());
            assertFalse(types.contains(TokenType.INDENT));
        }

        @Test
        @DisplayName("反斜杠续行")
        void testBackslashContinuation() {
            List<TokenType> types = types("x = 1 + \\\n    2\n");
            assertEquals(1, types.stream().filter(t -> t == TokenType.NEWLINE).count());
        }

        @Test
        @DisplayName("不一致的反缩进报错")
        void testInconsistentDedent() {
            Token error = firstError("if x:\n        a\n    b\n");
            assertEquals("unindent does not match any outer indentation level", error.getLiteral());
        }

        @Test
        @DisplayName("空源码只有 EOF")
        void testEmptySource() {
            List<Token> all = scan("");
            assertEquals(1, all.size());
            assertEquals(TokenType.EOF, all.get(0).getType());
        }
    }

    // ================================================================
    // 字面量
    // ================================================================

    @Nested
    @DisplayName("数字字面量")
    class NumberTests {

        @Test
        @DisplayName("整数与进制前缀")
        void testIntegers() {
            assertSingleToken("42", TokenType.INT_LITERAL, 42L);
            assertSingleToken("1_000", TokenType.INT_LITERAL, 1000L);
            assertSingleToken("0xFF", TokenType.INT_LITERAL, 255L);
            assertSingleToken("0o17", TokenType.INT_LITERAL, 15L);
            assertSingleToken("0b101", TokenType.INT_LITERAL, 5L);
            assertSingleToken("0", TokenType.INT_LITERAL, 0L);
        }

        @Test
        @DisplayName("浮点数")
        void testFloats() {
            assertSingleToken("3.14", TokenType.FLOAT_LITERAL, 3.14);
            assertSingleToken(".5", TokenType.FLOAT_LITERAL, 0.5);
            assertSingleToken("1e3", TokenType.FLOAT_LITERAL, 1000.0);
            assertSingleToken("2.5E-1", TokenType.FLOAT_LITERAL, 0.25);
        }

        @Test
        @DisplayName("超出 long / double 范围的字面量保留精确值")
        void testOutOfRangeNumbers() {
            assertSingleToken("9223372036854775807", TokenType.INT_LITERAL, Long.MAX_VALUE);
            assertSingleToken("99999999999999999999", TokenType.INT_LITERAL,
                    new BigInteger("99999999999999999999"));
            assertSingleToken("0xFFFF_FFFF_FFFF_FFFF", TokenType.INT_LITERAL, new BigInteger("FFFFFFFFFFFFFFFF", 16));
            assertSingleToken("1e400", TokenType.FLOAT_LITERAL, new BigDecimal("1e400"));
        }

        @Test
        @DisplayName("非法数字字面量")
        void testInvalidNumbers() {
            assertEquals("leading zeros in decimal integer literals are not permitted",
                    firstError("007").getLiteral());
            assertEquals("complex literals are not supported", firstError("3j").getLiteral());
            assertEquals("invalid hexadecimal literal", firstError("0x").getLiteral());
        }
    }

    @Nested
    @DisplayName("字符串字面量")
    class StringTests {

        @Test
        @DisplayName("单双引号与转义")
        void testEscapes() {
            assertSingleToken("'hi'", TokenType.STRING_LITERAL, "hi");
            assertSingleToken("\"a\\tb\\n\"", TokenType.STRING_LITERAL, "a\tb\n");
            assertSingleToken("'it\\'s'", TokenType.STRING_LITERAL, "it's");
            assertSingleToken("'\\x41\\u00e9'", TokenType.STRING_LITERAL, "A\u00e9");
            assertSingleToken("'\\101'", TokenType.STRING_LITERAL, "A");
        }

        @Test
        @DisplayName("原始字符串保留反斜杠")
        void testRawString() {
            assertSingleToken("r'a\\nb'", TokenType.STRING_LITERAL, "a\\nb");
        }

        @Test
        @DisplayName("三引号字符串可跨行")
        void testTripleQuoted() {
            List<Token> toks = tokens("\"\"\"line1\nline2\"\"\"\nx\n");
            assertEquals(TokenType.STRING_LITERAL, toks.get(0).getType());
            assertEquals("line1\nline2", toks.get(0).getLiteral());
            assertEquals(3, toks.get(1).getLine());
        }

        @Test
        @DisplayName("前缀决定字符串种类")
        void testPrefixes() {
            assertSingleToken("f'{x}'", TokenType.FSTRING_LITERAL, "{x}");
            assertSingleToken("b'raw'", TokenType.BYTES_LITERAL, "raw");
            assertSingleToken("Rb'\\d'", TokenType.BYTES_LITERAL, "\\d");
        }

        @Test
        @DisplayName("未闭合字符串报错")
        void testUnterminated() {
            assertEquals("unterminated string literal", firstError("'abc\n").getLiteral());
            assertEquals("unterminated triple-quoted string literal", firstError("'''abc").getLiteral());
        }
    }

    // ================================================================
    // 关键词与操作符
    // ================================================================

    @Nested
    @DisplayName("关键词与操作符")
    class OperatorTests {

        @Test
        @DisplayName("关键词识别")
        void testKeywords() {
            List<Token> toks = tokens("if elif else while for in not and or True False None");
            for (Token tok : toks) {
                assertTrue(tok.getType().isKeyword(), tok.toString());
            }
            assertEquals(TokenType.IDENTIFIER, tokens("print").get(0).getType());
        }

        @Test
        @DisplayName("多字符操作符")
        void testMultiCharOperators() {
            assertEquals(java.util.Arrays.asList(
                    TokenType.DOUBLE_SLASH, TokenType.DOUBLE_STAR, TokenType.LSHIFT_ASSIGN,
                    TokenType.NE, TokenType.GE, TokenType.WALRUS, TokenType.ARROW, TokenType.ELLIPSIS),
                    tokens("// ** <<= != >= := -> ...").stream().map(Token::getType).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("增量赋值操作符")
        void testAugmentedAssign() {
            for (Token tok : tokens("+= -= *= /= //= %= **= &= |= ^= >>=")) {
                assertTrue(tok.getType().isAugmentedAssignOp(), tok.toString());
            }
        }

        @Test
        @DisplayName("非法字符报错")
        void testInvalidCharacter() {
            assertEquals("invalid character '$'", firstError("x = $").getLiteral());
            assertEquals("invalid syntax: unexpected '!'", firstError("!x").getLiteral());
        }

        @Test
        @DisplayName("token 位置信息")
        void testPositions() {
            List<Token> toks = tokens("x = 1\nyy = 2\n");
            Token yy = toks.get(3);
            assertEquals("yy", yy.getLexeme());
            assertEquals(2, yy.getLine());
            assertEquals(1, yy.getColumn());
        }
    }

    @Test
    @DisplayName("nextToken 到达末尾后重复返回 EOF")
    void testNextTokenRepeatsEof() {
        Lexer lexer = new Lexer("x");
        assertEquals(TokenType.IDENTIFIER, lexer.nextToken().getType());
        assertEquals(TokenType.NEWLINE, lexer.nextToken().getType());
        assertEquals(TokenType.EOF, lexer.nextToken().getType());
        assertEquals(TokenType.EOF, lexer.nextToken().getType());
    }
}
