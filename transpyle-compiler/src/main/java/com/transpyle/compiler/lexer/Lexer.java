package com.transpyle.compiler.lexer;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Python 子集词法分析器
 *
 * <p>按越位规则生成 NEWLINE / INDENT / DEDENT：空行与纯注释行忽略，
 * 括号内不产生换行和缩进，反斜杠续行。词法错误生成 ERROR token，由语法分析器报告。</p>
 */
public class Lexer {
    private static final Logger LOG = Logger.getLogger(Lexer.class.getName());

    private static final int TAB_SIZE = 8;

    private String source;  // non-final: 扫描完成后可释放
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Integer> indents = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int tokenLine = 1;
    private int tokenColumn = 1;

    private int parenDepth = 0;
    private boolean atLineStart = true;
    private boolean scanned = false;
    private int cursor = 0;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 常量
        map.put("False", TokenType.KW_FALSE);
        map.put("None", TokenType.KW_NONE);
        map.put("True", TokenType.KW_TRUE);

        // 逻辑与成员
        map.put("and", TokenType.KW_AND);
        map.put("or", TokenType.KW_OR);
        map.put("not", TokenType.KW_NOT);
        map.put("in", TokenType.KW_IN);
        map.put("is", TokenType.KW_IS);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("elif", TokenType.KW_ELIF);
        map.put("else", TokenType.KW_ELSE);
        map.put("while", TokenType.KW_WHILE);
        map.put("for", TokenType.KW_FOR);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);
        map.put("pass", TokenType.KW_PASS);
        map.put("return", TokenType.KW_RETURN);

        // 声明
        map.put("def", TokenType.KW_DEF);
        map.put("class", TokenType.KW_CLASS);
        map.put("lambda", TokenType.KW_LAMBDA);
        map.put("yield", TokenType.KW_YIELD);
        map.put("import", TokenType.KW_IMPORT);
        map.put("from", TokenType.KW_FROM);
        map.put("as", TokenType.KW_AS);

        // 异常与上下文
        map.put("try", TokenType.KW_TRY);
        map.put("except", TokenType.KW_EXCEPT);
        map.put("finally", TokenType.KW_FINALLY);
        map.put("raise", TokenType.KW_RAISE);
        map.put("with", TokenType.KW_WITH);

        // 其他
        map.put("global", TokenType.KW_GLOBAL);
        map.put("nonlocal", TokenType.KW_NONLOCAL);
        map.put("del", TokenType.KW_DEL);
        map.put("assert", TokenType.KW_ASSERT);
        map.put("async", TokenType.KW_ASYNC);
        map.put("await", TokenType.KW_AWAIT);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /** 释放源码字符串引用（扫描完成后调用） */
    public void releaseSource() {
        if (scanned) {
            source = null;
        }
    }

    /**
     * 获取下一个 Token（流式接口）。到达末尾后重复返回 EOF。
     */
    public Token nextToken() {
        if (!scanned) {
            scanTokens();
        }
        Token token = tokens.get(cursor);
        if (cursor < tokens.size() - 1) {
            cursor++;
        }
        return token;
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        if (scanned) {
            return tokens;
        }
        indents.add(0);

        while (!isAtEnd()) {
            if (atLineStart && parenDepth == 0) {
                if (!indentation()) {
                    continue;
                }
                if (isAtEnd()) break;
            }
            markTokenStart();
            scanToken();
        }

        // 文件末尾补齐 NEWLINE 与 DEDENT
        markTokenStart();
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).getType() != TokenType.NEWLINE) {
            addToken(TokenType.NEWLINE);
        }
        while (indents.size() > 1) {
            indents.remove(indents.size() - 1);
            addToken(TokenType.DEDENT);
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, column));
        scanned = true;
        return tokens;
    }

    /**
     * 处理行首缩进。
     *
     * @return 空行（已整行消费）返回 false，逻辑行开始返回 true
     */
    private boolean indentation() {
        int width = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ') {
                width++;
                advance();
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
                advance();
            } else if (c == '\f') {
                width = 0;
                advance();
            } else if (c == '\r') {
                advance();
            } else {
                break;
            }
        }
        if (isAtEnd()) return true;

        if (peek() == '#') {
            while (peek() != '\n' && !isAtEnd()) advance();
            if (isAtEnd()) return true;
        }
        if (peek() == '\n') {
            advance();
            newLine();
            return false;
        }

        atLineStart = false;
        markTokenStart();
        int top = indents.get(indents.size() - 1);
        if (width > top) {
            indents.add(width);
            addToken(TokenType.INDENT);
        } else if (width < top) {
            while (width < indents.get(indents.size() - 1)) {
                indents.remove(indents.size() - 1);
                addToken(TokenType.DEDENT);
            }
            if (width != indents.get(indents.size() - 1)) {
                error("unindent does not match any outer indentation level");
            }
        }
        return true;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 空白与注释
            case ' ':
            case '\t':
            case '\r':
            case '\f':
                break;
            case '#':
                while (peek() != '\n' && !isAtEnd()) advance();
                break;

            // 续行
            case '\\':
                match('\r');
                if (match('\n')) {
                    newLine();
                } else {
                    error("unexpected character after line continuation character");
                }
                break;

            case '\n':
                if (parenDepth == 0) {
                    addToken(TokenType.NEWLINE);
                    atLineStart = true;
                }
                newLine();
                break;

            // 括号
            case '(': parenDepth++; addToken(TokenType.LPAREN); break;
            case '[': parenDepth++; addToken(TokenType.LBRACKET); break;
            case '{': parenDepth++; addToken(TokenType.LBRACE); break;
            case ')': closeParen(); addToken(TokenType.RPAREN); break;
            case ']': closeParen(); addToken(TokenType.RBRACKET); break;
            case '}': closeParen(); addToken(TokenType.RBRACE); break;

            // 单字符 Token
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '~': addToken(TokenType.TILDE); break;

            // 可能是多字符的 Token
            case ':':
                addToken(match('=') ? TokenType.WALRUS : TokenType.COLON);
                break;

            case '.':
                if (isDigit(peek())) {
                    number();
                } else if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    addToken(TokenType.ELLIPSIS);
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case '+':
                addToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);
                break;

            case '-':
                if (match('=')) addToken(TokenType.MINUS_ASSIGN);
                else if (match('>')) addToken(TokenType.ARROW);
                else addToken(TokenType.MINUS);
                break;

            case '*':
                if (match('*')) {
                    addToken(match('=') ? TokenType.DOUBLE_STAR_ASSIGN : TokenType.DOUBLE_STAR);
                } else {
                    addToken(match('=') ? TokenType.STAR_ASSIGN : TokenType.STAR);
                }
                break;

            case '/':
                if (match('/')) {
                    addToken(match('=') ? TokenType.DOUBLE_SLASH_ASSIGN : TokenType.DOUBLE_SLASH);
                } else {
                    addToken(match('=') ? TokenType.SLASH_ASSIGN : TokenType.SLASH);
                }
                break;

            case '%':
                addToken(match('=') ? TokenType.PERCENT_ASSIGN : TokenType.PERCENT);
                break;

            case '@':
                addToken(match('=') ? TokenType.AT_ASSIGN : TokenType.AT);
                break;

            case '&':
                addToken(match('=') ? TokenType.AMPER_ASSIGN : TokenType.AMPER);
                break;

            case '|':
                addToken(match('=') ? TokenType.PIPE_ASSIGN : TokenType.PIPE);
                break;

            case '^':
                addToken(match('=') ? TokenType.CARET_ASSIGN : TokenType.CARET);
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                if (match('=')) {
                    addToken(TokenType.NE);
                } else {
                    error("invalid syntax: unexpected '!'");
                }
                break;

            case '<':
                if (match('<')) {
                    addToken(match('=') ? TokenType.LSHIFT_ASSIGN : TokenType.LSHIFT);
                } else {
                    addToken(match('=') ? TokenType.LE : TokenType.LT);
                }
                break;

            case '>':
                if (match('>')) {
                    addToken(match('=') ? TokenType.RSHIFT_ASSIGN : TokenType.RSHIFT);
                } else {
                    addToken(match('=') ? TokenType.GE : TokenType.GT);
                }
                break;

            // 字符串
            case '"':
            case '\'':
                string(c, "");
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("invalid character '" + c + "'");
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int distance) {
        if (current + distance >= source.length()) return '\0';
        return source.charAt(current + distance);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private void closeParen() {
        if (parenDepth > 0) {
            parenDepth--;
        }
    }

    private void markTokenStart() {
        start = current;
        tokenLine = line;
        tokenColumn = column;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) ||
               (c >= 'a' && c <= 'f') ||
               (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c) || Character.isDigit(c);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, tokenLine, tokenColumn));
    }

    // === 标识符与关键词 ===

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        if ((peek() == '"' || peek() == '\'') && isStringPrefix(text)) {
            string(advance(), text.toLowerCase());
            return;
        }
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private static boolean isStringPrefix(String text) {
        switch (text.toLowerCase()) {
            case "r":
            case "u":
            case "b":
            case "f":
            case "br":
            case "rb":
            case "fr":
            case "rf":
                return true;
            default:
                return false;
        }
    }

    // === 字符串 ===

    private void string(char quote, String prefix) {
        boolean raw = prefix.indexOf('r') >= 0;
        boolean triple = false;
        if (peek() == quote && peekNext() == quote) {
            advance();
            advance();
            triple = true;
        }

        StringBuilder sb = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                error(triple ? "unterminated triple-quoted string literal" : "unterminated string literal");
                return;
            }
            char c = peek();
            if (c == quote) {
                if (!triple) {
                    advance();
                    break;
                }
                if (peekNext() == quote && peekAt(2) == quote) {
                    advance();
                    advance();
                    advance();
                    break;
                }
                sb.append(advance());
                continue;
            }
            if (c == '\n') {
                if (!triple) {
                    error("unterminated string literal");
                    return;
                }
                advance();
                newLine();
                sb.append('\n');
                continue;
            }
            if (c == '\\') {
                advance();
                if (isAtEnd()) continue;
                if (raw) {
                    char escaped = advance();
                    sb.append('\\').append(escaped);
                    if (escaped == '\n') newLine();
                    continue;
                }
                if (!escape(sb)) {
                    return;
                }
                continue;
            }
            sb.append(advance());
        }

        TokenType type = TokenType.STRING_LITERAL;
        if (prefix.indexOf('f') >= 0) {
            type = TokenType.FSTRING_LITERAL;
        } else if (prefix.indexOf('b') >= 0) {
            type = TokenType.BYTES_LITERAL;
        }
        addToken(type, sb.toString());
    }

    /**
     * 解码反斜杠之后的转义序列
     *
     * @return 转义非法时返回 false（已报告错误）
     */
    private boolean escape(StringBuilder sb) {
        char e = advance();
        switch (e) {
            case '\n': newLine(); return true;  // 字符串内续行
            case 'n': sb.append('\n'); return true;
            case 't': sb.append('\t'); return true;
            case 'r': sb.append('\r'); return true;
            case '\\': sb.append('\\'); return true;
            case '\'': sb.append('\''); return true;
            case '"': sb.append('"'); return true;
            case 'a': sb.append('\u0007'); return true;
            case 'b': sb.append('\b'); return true;
            case 'f': sb.append('\f'); return true;
            case 'v': sb.append('\u000B'); return true;
            case 'x': return hexEscape(sb, 2, "\\xXX");
            case 'u': return hexEscape(sb, 4, "\\uXXXX");
            case 'U': return hexEscape(sb, 8, "\\UXXXXXXXX");
            default:
                if (e >= '0' && e <= '7') {
                    int value = e - '0';
                    for (int i = 0; i < 2 && peek() >= '0' && peek() <= '7'; i++) {
                        value = value * 8 + (advance() - '0');
                    }
                    sb.append((char) value);
                    return true;
                }
                // 未知转义原样保留
                sb.append('\\').append(e);
                return true;
        }
    }

    private boolean hexEscape(StringBuilder sb, int digits, String form) {
        int value = 0;
        for (int i = 0; i < digits; i++) {
            if (!isHexDigit(peek())) {
                error("truncated " + form + " escape");
                return false;
            }
            value = value * 16 + Character.digit(advance(), 16);
        }
        if (!Character.isValidCodePoint(value)) {
            error("illegal Unicode character in " + form + " escape");
            return false;
        }
        sb.appendCodePoint(value);
        return true;
    }

    // === 数字 ===

    private void number() {
        char first = source.charAt(start);
        if (first == '0') {
            char radix = peek();
            if (radix == 'x' || radix == 'X') { radixNumber(16, "hexadecimal"); return; }
            if (radix == 'o' || radix == 'O') { radixNumber(8, "octal"); return; }
            if (radix == 'b' || radix == 'B') { radixNumber(2, "binary"); return; }
        }

        boolean isFloat = first == '.';
        advanceDigits();
        if (!isFloat && peek() == '.' && !isAlpha(peekNext()) && peekNext() != '.') {
            advance(); // 消费 .
            advanceDigits();
            isFloat = true;
        }

        // 指数部分
        if (peek() == 'e' || peek() == 'E') {
            char next = peekNext();
            if (isDigit(next) || ((next == '+' || next == '-') && isDigit(peekAt(2)))) {
                advance();
                if (peek() == '+' || peek() == '-') advance();
                advanceDigits();
                isFloat = true;
            }
        }

        if (peek() == 'j' || peek() == 'J') {
            advance();
            error("complex literals are not supported");
            return;
        }

        String text = source.substring(start, current).replace("_", "");
        if (isFloat) {
            double value = Double.parseDouble(text);
            // 超出 double 范围时保留精确值
            addToken(TokenType.FLOAT_LITERAL, Double.isInfinite(value) ? new BigDecimal(text) : (Object) value);
            return;
        }

        if (text.length() > 1 && text.charAt(0) == '0' && !text.chars().allMatch(ch -> ch == '0')) {
            error("leading zeros in decimal integer literals are not permitted");
            return;
        }
        parseAndAddInt(text, 10);
    }

    private void radixNumber(int radix, String description) {
        advance(); // 消费进制标记
        while (Character.digit(peek(), radix) >= 0 || peek() == '_') advance();

        String text = source.substring(start + 2, current).replace("_", "");
        if (text.isEmpty() || isAlphaNumeric(peek())) {
            error("invalid " + description + " literal");
            return;
        }
        parseAndAddInt(text, radix);
    }

    private void advanceDigits() {
        while (isDigit(peek()) || (peek() == '_' && isDigit(peekNext()))) advance();
    }

    /**
     * 整数字面量的值为 Long，超出 long 范围时为 BigInteger
     */
    private void parseAndAddInt(String text, int radix) {
        BigInteger value = new BigInteger(text, radix);
        addToken(TokenType.INT_LITERAL, value.bitLength() < 64 ? (Object) value.longValue() : value);
    }

    private void error(String message) {
        LOG.fine(() -> String.format("[%s:%d:%d] Lexer error: %s", fileName, tokenLine, tokenColumn, message));
        addToken(TokenType.ERROR, message);
    }
}
