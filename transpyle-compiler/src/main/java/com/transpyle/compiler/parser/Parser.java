package com.transpyle.compiler.parser;

import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.decl.Program;
import com.transpyle.compiler.ast.expr.Expression;
import com.transpyle.compiler.ast.stmt.Block;
import com.transpyle.compiler.ast.stmt.Statement;
import com.transpyle.compiler.lexer.Lexer;
import com.transpyle.compiler.lexer.Token;
import com.transpyle.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.transpyle.compiler.lexer.TokenType.*;

/**
 * Python 子集语法分析器（递归下降）
 *
 * <p>语句由 {@link StmtParser} 处理，表达式由 {@link ExprParser} 处理。
 * 词法错误（ERROR token）在成为当前 token 时立即以 {@link ParseException} 抛出。</p>
 */
@SuppressWarnings("this-escape")
public class Parser {

    final Lexer lexer;
    final String fileName;
    Token current;
    Token previous;
    private Token nextToken;  // 用于 lookahead 的缓冲

    // === Helper 实例 ===
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer, String fileName) {
        this.lexer = lexer;
        this.fileName = fileName;
        advance();  // 读取第一个 token
    }

    public Parser(Lexer lexer) {
        this(lexer, lexer.getFileName());
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (nextToken != null) {
            current = nextToken;
            nextToken = null;
        } else {
            current = lexer.nextToken();
        }
        if (current.getType() == ERROR) {
            throw new ParseException(String.valueOf(current.getLiteral()), current);
        }
        return previous;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        if (nextToken == null) {
            nextToken = lexer.nextToken();
        }
        return nextToken;
    }

    /**
     * 向前看一个 token（不消费当前）
     */
    boolean checkAhead(TokenType type) {
        return peek().getType() == type;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配任一类型，则前进
     */
    boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (match(type)) return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return locationOf(current);
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return locationOf(previous);
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn());
    }

    /**
     * 是否到达文件末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    /**
     * 跳过空逻辑行
     */
    void skipNewlines() {
        while (match(NEWLINE)) {
            // 跳过
        }
    }

    // ============ 程序解析 ============

    /**
     * 解析整个模块
     */
    public Program parse() {
        SourceLocation loc = location();
        List<Statement> statements = new ArrayList<Statement>();
        while (!isAtEnd()) {
            if (match(NEWLINE)) continue;
            statements.addAll(parseStatementLine());
        }
        lexer.releaseSource(); // 解析完成，释放源码字符串
        return new Program(loc, statements);
    }

    // ============ 语句解析委托 ============

    List<Statement> parseStatementLine() { return stmtParser.parseStatementLine(); }
    Block parseSuite() { return stmtParser.parseSuite(); }

    // ============ 表达式解析委托 ============

    Expression parseTest() { return exprParser.parseTest(); }
    Expression parseNamedExpression() { return exprParser.parseNamedExpression(); }
    Expression parseTestListStarExpr() { return exprParser.parseTestListStarExpr(); }
    Expression parseTargetList() { return exprParser.parseTargetList(); }
}
