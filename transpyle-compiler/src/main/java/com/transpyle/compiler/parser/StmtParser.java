package com.transpyle.compiler.parser;

import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.decl.ClassDecl;
import com.transpyle.compiler.ast.decl.FunDecl;
import com.transpyle.compiler.ast.decl.ImportDecl;
import com.transpyle.compiler.ast.decl.Parameter;
import com.transpyle.compiler.ast.expr.*;
import com.transpyle.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.transpyle.compiler.ast.stmt.*;
import com.transpyle.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.transpyle.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析一个逻辑行：复合语句，或以分号分隔的若干简单语句
     */
    List<Statement> parseStatementLine() {
        if (parser.check(INDENT)) {
            throw new ParseException("Unexpected indent", parser.current);
        }
        if (isCompoundStart()) {
            return Collections.singletonList(parseCompoundStatement());
        }
        return parseSimpleStatements();
    }

    /**
     * 解析语句块：换行后的缩进块，或同一行上的简单语句
     */
    Block parseSuite() {
        SourceLocation loc = parser.location();
        if (!parser.match(NEWLINE)) {
            return new Block(loc, parseSimpleStatements());
        }
        parser.skipNewlines();
        parser.expect(INDENT, "Expected an indented block");
        List<Statement> statements = new ArrayList<Statement>();
        while (!parser.check(DEDENT) && !parser.isAtEnd()) {
            if (parser.match(NEWLINE)) continue;
            statements.addAll(parseStatementLine());
        }
        parser.match(DEDENT);
        return new Block(loc, statements);
    }

    private boolean isCompoundStart() {
        return parser.checkAny(KW_IF, KW_WHILE, KW_FOR, KW_DEF, KW_CLASS, KW_TRY, KW_WITH, AT)
                || (parser.check(KW_ASYNC) && (parser.checkAhead(KW_DEF)
                        || parser.checkAhead(KW_FOR) || parser.checkAhead(KW_WITH)));
    }

    // ============ 复合语句 ============

    private Statement parseCompoundStatement() {
        switch (parser.current.getType()) {
            case KW_IF:
                return parseIfStmt();
            case KW_WHILE:
                return parseWhileStmt();
            case KW_FOR:
                return parseForStmt(false, parser.location());
            case KW_DEF:
                return parseFunDecl(Collections.<Expression>emptyList(), false, parser.location());
            case KW_CLASS:
                return parseClassDecl(Collections.<Expression>emptyList(), parser.location());
            case KW_TRY:
                return parseTryStmt();
            case KW_WITH:
                return parseWithStmt(false, parser.location());
            case AT:
                return parseDecorated();
            case KW_ASYNC:
                return parseAsyncStmt(Collections.<Expression>emptyList());
            default:
                throw new ParseException("Expected statement", parser.current);
        }
    }

    /**
     * if / elif / else。elif 解析为 else 块中的嵌套 IfStmt。
     */
    private IfStmt parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.advance();  // if 或 elif
        Expression condition = parser.parseNamedExpression();
        parser.expect(COLON, "Expected ':' after if condition");
        Block thenBranch = parser.parseSuite();

        Block elseBranch = null;
        if (parser.check(KW_ELIF)) {
            SourceLocation elifLoc = parser.location();
            IfStmt elif = parseIfStmt();
            elseBranch = new Block(elifLoc, Collections.<Statement>singletonList(elif));
        } else if (parser.match(KW_ELSE)) {
            parser.expect(COLON, "Expected ':' after 'else'");
            elseBranch = parser.parseSuite();
        }
        return new IfStmt(loc, condition, thenBranch, elseBranch);
    }

    private WhileStmt parseWhileStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_WHILE, "Expected 'while'");
        Expression condition = parser.parseNamedExpression();
        parser.expect(COLON, "Expected ':' after while condition");
        Block body = parser.parseSuite();
        Block elseBranch = parseOptionalElse();
        return new WhileStmt(loc, condition, body, elseBranch);
    }

    private ForStmt parseForStmt(boolean async, SourceLocation loc) {
        parser.expect(KW_FOR, "Expected 'for'");
        Expression target = parser.parseTargetList();
        checkAssignable(target, parser.previous);
        parser.expect(KW_IN, "Expected 'in' in for statement");
        Expression iterable = parser.parseTestListStarExpr();
        parser.expect(COLON, "Expected ':' after for clause");
        Block body = parser.parseSuite();
        Block elseBranch = parseOptionalElse();
        return new ForStmt(loc, target, iterable, body, elseBranch, async);
    }

    private Block parseOptionalElse() {
        if (parser.match(KW_ELSE)) {
            parser.expect(COLON, "Expected ':' after 'else'");
            return parser.parseSuite();
        }
        return null;
    }

    private Statement parseDecorated() {
        SourceLocation loc = parser.location();
        List<Expression> decorators = new ArrayList<Expression>();
        while (parser.match(AT)) {
            decorators.add(parser.parseNamedExpression());
            parser.expect(NEWLINE, "Expected newline after decorator");
            parser.skipNewlines();
        }
        if (parser.check(KW_DEF)) {
            return parseFunDecl(decorators, false, loc);
        }
        if (parser.check(KW_CLASS)) {
            return parseClassDecl(decorators, loc);
        }
        if (parser.check(KW_ASYNC) && parser.checkAhead(KW_DEF)) {
            return parseAsyncStmt(decorators);
        }
        throw new ParseException("Expected function or class definition after decorator", parser.current);
    }

    private Statement parseAsyncStmt(List<Expression> decorators) {
        SourceLocation loc = parser.location();
        parser.expect(KW_ASYNC, "Expected 'async'");
        if (parser.check(KW_DEF)) {
            return parseFunDecl(decorators, true, loc);
        }
        if (parser.check(KW_FOR)) {
            return parseForStmt(true, loc);
        }
        if (parser.check(KW_WITH)) {
            return parseWithStmt(true, loc);
        }
        throw new ParseException("Expected 'def', 'for' or 'with' after 'async'", parser.current);
    }

    private FunDecl parseFunDecl(List<Expression> decorators, boolean async, SourceLocation loc) {
        parser.expect(KW_DEF, "Expected 'def'");
        String name = parser.expect(IDENTIFIER, "Expected function name").getLexeme();
        parser.expect(LPAREN, "Expected '(' after function name");
        List<Parameter> params = parser.exprParser.parseParameters(RPAREN, true);
        parser.expect(RPAREN, "Expected ')' after parameters");
        Expression returnType = null;
        if (parser.match(ARROW)) {
            returnType = parser.parseTest();
        }
        parser.expect(COLON, "Expected ':' after function signature");
        Block body = parser.parseSuite();
        return new FunDecl(loc, name, decorators, params, returnType, body, async);
    }

    private ClassDecl parseClassDecl(List<Expression> decorators, SourceLocation loc) {
        parser.expect(KW_CLASS, "Expected 'class'");
        String name = parser.expect(IDENTIFIER, "Expected class name").getLexeme();
        List<CallExpr.Argument> bases = Collections.emptyList();
        if (parser.match(LPAREN)) {
            bases = parser.exprParser.parseArguments();
        }
        parser.expect(COLON, "Expected ':' after class header");
        Block body = parser.parseSuite();
        return new ClassDecl(loc, name, decorators, bases, body);
    }

    private TryStmt parseTryStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_TRY, "Expected 'try'");
        parser.expect(COLON, "Expected ':' after 'try'");
        Block body = parser.parseSuite();

        List<ExceptClause> handlers = new ArrayList<ExceptClause>();
        while (parser.check(KW_EXCEPT)) {
            SourceLocation handlerLoc = parser.location();
            parser.advance();
            parser.match(STAR);  // except* (异常组)
            Expression type = null;
            String name = null;
            if (!parser.check(COLON)) {
                type = parser.parseTest();
                if (parser.match(COMMA)) {
                    List<Expression> types = new ArrayList<Expression>();
                    types.add(type);
                    do {
                        types.add(parser.parseTest());
                    } while (parser.match(COMMA));
                    type = new CollectionLiteral(type.getLocation(), CollectionLiteral.CollectionKind.TUPLE, types);
                }
                if (parser.match(KW_AS)) {
                    name = parser.expect(IDENTIFIER, "Expected name after 'as'").getLexeme();
                }
            }
            parser.expect(COLON, "Expected ':' after except clause");
            handlers.add(new ExceptClause(handlerLoc, type, name, parser.parseSuite()));
        }

        Block elseBranch = null;
        if (!handlers.isEmpty()) {
            elseBranch = parseOptionalElse();
        }
        Block finallyBlock = null;
        if (parser.match(KW_FINALLY)) {
            parser.expect(COLON, "Expected ':' after 'finally'");
            finallyBlock = parser.parseSuite();
        }
        if (handlers.isEmpty() && finallyBlock == null) {
            throw new ParseException("Expected 'except' or 'finally' block", parser.current);
        }
        return new TryStmt(loc, body, handlers, elseBranch, finallyBlock);
    }

    private WithStmt parseWithStmt(boolean async, SourceLocation loc) {
        parser.expect(KW_WITH, "Expected 'with'");
        List<WithStmt.Item> items = new ArrayList<WithStmt.Item>();
        do {
            Expression context = parser.parseTest();
            Expression target = null;
            if (parser.match(KW_AS)) {
                target = parser.parseTargetList();
                checkAssignable(target, parser.previous);
            }
            items.add(new WithStmt.Item(context, target));
        } while (parser.match(COMMA));
        parser.expect(COLON, "Expected ':' after with items");
        Block body = parser.parseSuite();
        return new WithStmt(loc, items, body, async);
    }

    // ============ 简单语句 ============

    private List<Statement> parseSimpleStatements() {
        List<Statement> statements = new ArrayList<Statement>();
        statements.add(parseSimpleStatement());
        while (parser.match(SEMICOLON)) {
            if (parser.check(NEWLINE) || parser.isAtEnd()) break;
            statements.add(parseSimpleStatement());
        }
        if (!parser.isAtEnd()) {
            parser.expect(NEWLINE, "Expected end of statement");
        }
        return statements;
    }

    private Statement parseSimpleStatement() {
        SourceLocation loc = parser.location();
        switch (parser.current.getType()) {
            case KW_PASS:
                parser.advance();
                return new PassStmt(loc);
            case KW_BREAK:
                parser.advance();
                return new BreakStmt(loc);
            case KW_CONTINUE:
                parser.advance();
                return new ContinueStmt(loc);
            case KW_RETURN:
                return parseReturnStmt();
            case KW_RAISE:
                return parseRaiseStmt();
            case KW_GLOBAL:
            case KW_NONLOCAL:
                return parseGlobalStmt();
            case KW_DEL:
                return parseDelStmt();
            case KW_ASSERT:
                return parseAssertStmt();
            case KW_IMPORT:
                return parseImport();
            case KW_FROM:
                return parseFromImport();
            default:
                return parseExpressionStatement();
        }
    }

    private ReturnStmt parseReturnStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_RETURN, "Expected 'return'");
        Expression value = null;
        if (!isStatementEnd()) {
            value = parser.parseTestListStarExpr();
        }
        return new ReturnStmt(loc, value);
    }

    private RaiseStmt parseRaiseStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_RAISE, "Expected 'raise'");
        Expression exception = null;
        Expression cause = null;
        if (!isStatementEnd()) {
            exception = parser.parseTest();
            if (parser.match(KW_FROM)) {
                cause = parser.parseTest();
            }
        }
        return new RaiseStmt(loc, exception, cause);
    }

    private GlobalStmt parseGlobalStmt() {
        SourceLocation loc = parser.location();
        boolean nonlocal = parser.advance().getType() == KW_NONLOCAL;
        List<String> names = new ArrayList<String>();
        do {
            names.add(parser.expect(IDENTIFIER, "Expected name").getLexeme());
        } while (parser.match(COMMA));
        return new GlobalStmt(loc, names, nonlocal);
    }

    private DelStmt parseDelStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_DEL, "Expected 'del'");
        Token start = parser.current;
        Expression targets = parser.parseTargetList();
        checkAssignable(targets, start);
        List<Expression> list;
        if (targets instanceof CollectionLiteral
                && ((CollectionLiteral) targets).getKind() == CollectionLiteral.CollectionKind.TUPLE) {
            list = ((CollectionLiteral) targets).getElements();
        } else {
            list = Collections.singletonList(targets);
        }
        return new DelStmt(loc, list);
    }

    private AssertStmt parseAssertStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_ASSERT, "Expected 'assert'");
        Expression test = parser.parseTest();
        Expression message = null;
        if (parser.match(COMMA)) {
            message = parser.parseTest();
        }
        return new AssertStmt(loc, test, message);
    }

    private ImportDecl parseImport() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IMPORT, "Expected 'import'");
        List<ImportDecl.Alias> names = new ArrayList<ImportDecl.Alias>();
        do {
            String name = parseDottedName();
            String asName = null;
            if (parser.match(KW_AS)) {
                asName = parser.expect(IDENTIFIER, "Expected alias name").getLexeme();
            }
            names.add(new ImportDecl.Alias(name, asName));
        } while (parser.match(COMMA));
        return new ImportDecl(loc, null, false, 0, names, false);
    }

    private ImportDecl parseFromImport() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FROM, "Expected 'from'");
        int level = 0;
        while (parser.checkAny(DOT, ELLIPSIS)) {
            level += parser.advance().getType() == ELLIPSIS ? 3 : 1;
        }
        String module = null;
        if (parser.check(IDENTIFIER)) {
            module = parseDottedName();
        } else if (level == 0) {
            throw new ParseException("Expected module name", parser.current);
        }
        parser.expect(KW_IMPORT, "Expected 'import'");

        if (parser.match(STAR)) {
            return new ImportDecl(loc, module, true, level, Collections.<ImportDecl.Alias>emptyList(), true);
        }
        boolean parenthesized = parser.match(LPAREN);
        List<ImportDecl.Alias> names = new ArrayList<ImportDecl.Alias>();
        do {
            if (parenthesized && parser.check(RPAREN)) break;  // 尾随逗号
            String name = parser.expect(IDENTIFIER, "Expected name to import").getLexeme();
            String asName = null;
            if (parser.match(KW_AS)) {
                asName = parser.expect(IDENTIFIER, "Expected alias name").getLexeme();
            }
            names.add(new ImportDecl.Alias(name, asName));
        } while (parser.match(COMMA));
        if (parenthesized) {
            parser.expect(RPAREN, "Expected ')' after import list");
        }
        return new ImportDecl(loc, module, true, level, names, false);
    }

    private String parseDottedName() {
        StringBuilder sb = new StringBuilder();
        sb.append(parser.expect(IDENTIFIER, "Expected module name").getLexeme());
        while (parser.match(DOT)) {
            sb.append('.').append(parser.expect(IDENTIFIER, "Expected identifier after '.'").getLexeme());
        }
        return sb.toString();
    }

    /**
     * 表达式语句、赋值、增量赋值与注解赋值
     */
    private Statement parseExpressionStatement() {
        SourceLocation loc = parser.location();
        Token start = parser.current;
        if (parser.check(KW_YIELD)) {
            return new ExpressionStmt(loc, parser.exprParser.parseYieldExpr());
        }
        Expression first = parser.parseTestListStarExpr();

        // x: T [= value]
        if (parser.match(COLON)) {
            checkAnnotatable(first, start);
            Expression annotation = parser.parseTest();
            Expression value = null;
            if (parser.match(ASSIGN)) {
                value = parseAssignedValue();
            }
            return new AnnAssignStmt(loc, first, annotation, value);
        }

        // x op= value
        if (parser.current.getType().isAugmentedAssignOp()) {
            checkAnnotatable(first, start);
            BinaryOp op = augmentedOp(parser.advance());
            Expression value = parseAssignedValue();
            return new AugAssignStmt(loc, first, op, value);
        }

        // a = b = value
        if (parser.check(ASSIGN)) {
            checkAssignable(first, start);
            List<Expression> targets = new ArrayList<Expression>();
            targets.add(first);
            Expression value = null;
            while (parser.match(ASSIGN)) {
                Token valueStart = parser.current;
                Expression next = parseAssignedValue();
                if (parser.check(ASSIGN)) {
                    checkAssignable(next, valueStart);
                    targets.add(next);
                } else {
                    value = next;
                }
            }
            return new AssignStmt(loc, targets, value);
        }

        return new ExpressionStmt(loc, first);
    }

    private Expression parseAssignedValue() {
        if (parser.check(KW_YIELD)) {
            return parser.exprParser.parseYieldExpr();
        }
        return parser.parseTestListStarExpr();
    }

    private boolean isStatementEnd() {
        return parser.checkAny(NEWLINE, SEMICOLON, EOF);
    }

    private static BinaryOp augmentedOp(Token token) {
        switch (token.getType()) {
            case PLUS_ASSIGN: return BinaryOp.ADD;
            case MINUS_ASSIGN: return BinaryOp.SUB;
            case STAR_ASSIGN: return BinaryOp.MUL;
            case SLASH_ASSIGN: return BinaryOp.DIV;
            case DOUBLE_SLASH_ASSIGN: return BinaryOp.FLOOR_DIV;
            case PERCENT_ASSIGN: return BinaryOp.MOD;
            case DOUBLE_STAR_ASSIGN: return BinaryOp.POW;
            case AT_ASSIGN: return BinaryOp.MAT_MUL;
            case AMPER_ASSIGN: return BinaryOp.BIT_AND;
            case PIPE_ASSIGN: return BinaryOp.BIT_OR;
            case CARET_ASSIGN: return BinaryOp.BIT_XOR;
            case LSHIFT_ASSIGN: return BinaryOp.LSHIFT;
            case RSHIFT_ASSIGN: return BinaryOp.RSHIFT;
            default: throw new ParseException("Unexpected assignment operator", token);
        }
    }

    // ============ 赋值目标校验 ============

    /**
     * 赋值 / for / with / del 目标：名称、属性、下标、星号展开，以及由它们构成的元组或列表
     */
    private void checkAssignable(Expression target, Token at) {
        if (target instanceof Identifier || target instanceof MemberExpr || target instanceof IndexExpr) {
            return;
        }
        if (target instanceof StarredExpr) {
            checkAssignable(((StarredExpr) target).getValue(), at);
            return;
        }
        if (target instanceof CollectionLiteral
                && ((CollectionLiteral) target).getKind() != CollectionLiteral.CollectionKind.SET) {
            for (Expression element : ((CollectionLiteral) target).getElements()) {
                checkAssignable(element, at);
            }
            return;
        }
        throw new ParseException("Cannot assign to " + describe(target), at);
    }

    /**
     * 增量赋值与注解赋值只允许单一目标
     */
    private void checkAnnotatable(Expression target, Token at) {
        if (target instanceof Identifier || target instanceof MemberExpr || target instanceof IndexExpr) {
            return;
        }
        throw new ParseException("Illegal target for annotation or augmented assignment: " + describe(target), at);
    }

    private static String describe(Expression expr) {
        if (expr instanceof Literal) return "literal";
        if (expr instanceof CallExpr) return "function call";
        if (expr instanceof BinaryExpr || expr instanceof UnaryExpr) return "expression";
        if (expr instanceof CompareExpr) return "comparison";
        if (expr instanceof LambdaExpr) return "lambda";
        if (expr instanceof ConditionalExpr) return "conditional expression";
        if (expr instanceof CollectionLiteral) return "set display";
        if (expr instanceof DictLiteral) return "dict literal";
        if (expr instanceof ComprehensionExpr) return "comprehension";
        return expr.getClass().getSimpleName();
    }
}
