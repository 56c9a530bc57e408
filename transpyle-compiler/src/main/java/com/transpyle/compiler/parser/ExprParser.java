package com.transpyle.compiler.parser;

import com.transpyle.compiler.ast.SourceLocation;
import com.transpyle.compiler.ast.decl.Parameter;
import com.transpyle.compiler.ast.decl.Parameter.ParameterKind;
import com.transpyle.compiler.ast.expr.*;
import com.transpyle.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.transpyle.compiler.ast.expr.CallExpr.Argument;
import com.transpyle.compiler.ast.expr.CallExpr.ArgumentKind;
import com.transpyle.compiler.ast.expr.CollectionLiteral.CollectionKind;
import com.transpyle.compiler.ast.expr.CompareExpr.CompareOp;
import com.transpyle.compiler.ast.expr.ComprehensionExpr.ComprehensionKind;
import com.transpyle.compiler.ast.expr.Literal.LiteralKind;
import com.transpyle.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.transpyle.compiler.lexer.Token;
import com.transpyle.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.transpyle.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级自低向高：lambda / 条件表达式、or、and、not、比较、|、^、&amp;、移位、
 * 加减、乘除、一元正负与取反、幂、await、后缀（调用 / 下标 / 属性）、原子。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    // ============ 表达式列表 ============

    /**
     * 逗号分隔的表达式（允许星号展开），出现逗号时构成元组
     */
    Expression parseTestListStarExpr() {
        SourceLocation loc = parser.location();
        Expression first = parseTestOrStar();
        if (!parser.check(COMMA)) {
            return first;
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (!canStartExpression()) break;  // 尾随逗号
            elements.add(parseTestOrStar());
        }
        return new CollectionLiteral(loc, CollectionKind.TUPLE, elements);
    }

    /**
     * for / with / del 的目标列表。在按位或层级解析，以免吞掉 {@code in}。
     */
    Expression parseTargetList() {
        SourceLocation loc = parser.location();
        Expression first = parseTargetItem();
        if (!parser.check(COMMA)) {
            return first;
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (!canStartExpression()) break;
            elements.add(parseTargetItem());
        }
        return new CollectionLiteral(loc, CollectionKind.TUPLE, elements);
    }

    private Expression parseTargetItem() {
        if (parser.check(STAR)) {
            SourceLocation loc = parser.location();
            parser.advance();
            return new StarredExpr(loc, parseBitOr());
        }
        return parseBitOr();
    }

    private Expression parseTestOrStar() {
        if (parser.check(STAR)) {
            SourceLocation loc = parser.location();
            parser.advance();
            return new StarredExpr(loc, parseBitOr());
        }
        return parseTest();
    }

    private Expression parseNamedOrStar() {
        if (parser.check(STAR)) {
            return parseTestOrStar();
        }
        return parseNamedExpression();
    }

    boolean canStartExpression() {
        TokenType type = parser.current.getType();
        if (type.isStringLike()) return true;
        switch (type) {
            case IDENTIFIER:
            case INT_LITERAL:
            case FLOAT_LITERAL:
            case KW_TRUE:
            case KW_FALSE:
            case KW_NONE:
            case ELLIPSIS:
            case LPAREN:
            case LBRACKET:
            case LBRACE:
            case PLUS:
            case MINUS:
            case TILDE:
            case STAR:
            case KW_NOT:
            case KW_LAMBDA:
            case KW_AWAIT:
                return true;
            default:
                return false;
        }
    }

    // ============ 条件与逻辑 ============

    /**
     * 海象赋值 {@code name := value}，或普通表达式
     */
    Expression parseNamedExpression() {
        if (parser.check(IDENTIFIER) && parser.checkAhead(WALRUS)) {
            SourceLocation loc = parser.location();
            String name = parser.advance().getLexeme();
            parser.advance();  // :=
            return new NamedExpr(loc, name, parseTest());
        }
        return parseTest();
    }

    /**
     * lambda 或条件表达式 {@code a if cond else b}
     */
    Expression parseTest() {
        if (parser.check(KW_LAMBDA)) {
            return parseLambda();
        }
        Expression body = parseOrTest();
        if (parser.match(KW_IF)) {
            SourceLocation loc = parser.previousLocation();
            Expression condition = parseOrTest();
            parser.expect(KW_ELSE, "Expected 'else' in conditional expression");
            Expression orElse = parseTest();  // 右结合
            return new ConditionalExpr(loc, condition, body, orElse);
        }
        return body;
    }

    private Expression parseLambda() {
        SourceLocation loc = parser.location();
        parser.expect(KW_LAMBDA, "Expected 'lambda'");
        List<Parameter> params = parseParameters(COLON, false);
        parser.expect(COLON, "Expected ':' after lambda parameters");
        return new LambdaExpr(loc, params, parseTest());
    }

    private Expression parseOrTest() {
        Expression left = parseAndTest();
        while (parser.match(KW_OR)) {
            SourceLocation loc = parser.previousLocation();
            left = new BinaryExpr(loc, left, BinaryOp.OR, parseAndTest());
        }
        return left;
    }

    private Expression parseAndTest() {
        Expression left = parseNotTest();
        while (parser.match(KW_AND)) {
            SourceLocation loc = parser.previousLocation();
            left = new BinaryExpr(loc, left, BinaryOp.AND, parseNotTest());
        }
        return left;
    }

    private Expression parseNotTest() {
        if (parser.match(KW_NOT)) {
            SourceLocation loc = parser.previousLocation();
            return new UnaryExpr(loc, UnaryOp.NOT, parseNotTest());
        }
        return parseComparison();
    }

    // ============ 比较 ============

    private Expression parseComparison() {
        SourceLocation loc = parser.location();
        Expression left = parseBitOr();
        List<CompareOp> operators = new ArrayList<CompareOp>();
        List<Expression> comparators = new ArrayList<Expression>();
        CompareOp op;
        while ((op = matchCompareOp()) != null) {
            operators.add(op);
            comparators.add(parseBitOr());
        }
        if (operators.isEmpty()) {
            return left;
        }
        return new CompareExpr(loc, left, operators, comparators);
    }

    private CompareOp matchCompareOp() {
        switch (parser.current.getType()) {
            case EQ: parser.advance(); return CompareOp.EQ;
            case NE: parser.advance(); return CompareOp.NE;
            case LT: parser.advance(); return CompareOp.LT;
            case GT: parser.advance(); return CompareOp.GT;
            case LE: parser.advance(); return CompareOp.LE;
            case GE: parser.advance(); return CompareOp.GE;
            case KW_IN:
                parser.advance();
                return CompareOp.IN;
            case KW_NOT:
                if (parser.checkAhead(KW_IN)) {
                    parser.advance();
                    parser.advance();
                    return CompareOp.NOT_IN;
                }
                return null;
            case KW_IS:
                parser.advance();
                return parser.match(KW_NOT) ? CompareOp.IS_NOT : CompareOp.IS;
            default:
                return null;
        }
    }

    // ============ 位运算与算术 ============

    private Expression parseBitOr() {
        Expression left = parseBitXor();
        while (parser.match(PIPE)) {
            SourceLocation loc = parser.previousLocation();
            left = new BinaryExpr(loc, left, BinaryOp.BIT_OR, parseBitXor());
        }
        return left;
    }

    private Expression parseBitXor() {
        Expression left = parseBitAnd();
        while (parser.match(CARET)) {
            SourceLocation loc = parser.previousLocation();
            left = new BinaryExpr(loc, left, BinaryOp.BIT_XOR, parseBitAnd());
        }
        return left;
    }

    private Expression parseBitAnd() {
        Expression left = parseShift();
        while (parser.match(AMPER)) {
            SourceLocation loc = parser.previousLocation();
            left = new BinaryExpr(loc, left, BinaryOp.BIT_AND, parseShift());
        }
        return left;
    }

    private Expression parseShift() {
        Expression left = parseArith();
        while (parser.checkAny(LSHIFT, RSHIFT)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            BinaryOp binOp = op.getType() == LSHIFT ? BinaryOp.LSHIFT : BinaryOp.RSHIFT;
            left = new BinaryExpr(loc, left, binOp, parseArith());
        }
        return left;
    }

    private Expression parseArith() {
        Expression left = parseTerm();
        while (parser.checkAny(PLUS, MINUS)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            BinaryOp binOp = op.getType() == PLUS ? BinaryOp.ADD : BinaryOp.SUB;
            left = new BinaryExpr(loc, left, binOp, parseTerm());
        }
        return left;
    }

    private Expression parseTerm() {
        Expression left = parseFactor();
        while (parser.checkAny(STAR, SLASH, DOUBLE_SLASH, PERCENT, AT)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            BinaryOp binOp;
            switch (op.getType()) {
                case STAR: binOp = BinaryOp.MUL; break;
                case SLASH: binOp = BinaryOp.DIV; break;
                case DOUBLE_SLASH: binOp = BinaryOp.FLOOR_DIV; break;
                case PERCENT: binOp = BinaryOp.MOD; break;
                default: binOp = BinaryOp.MAT_MUL; break;
            }
            left = new BinaryExpr(loc, left, binOp, parseFactor());
        }
        return left;
    }

    private Expression parseFactor() {
        if (parser.checkAny(PLUS, MINUS, TILDE)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            UnaryOp unaryOp;
            switch (op.getType()) {
                case PLUS: unaryOp = UnaryOp.POS; break;
                case MINUS: unaryOp = UnaryOp.NEG; break;
                default: unaryOp = UnaryOp.INVERT; break;
            }
            return new UnaryExpr(loc, unaryOp, parseFactor());
        }
        return parsePower();
    }

    /**
     * 幂运算右结合，且比左侧一元运算符绑定更紧：{@code -2 ** 2 == -(2 ** 2)}
     */
    private Expression parsePower() {
        Expression base = parseAwait();
        if (parser.match(DOUBLE_STAR)) {
            SourceLocation loc = parser.previousLocation();
            return new BinaryExpr(loc, base, BinaryOp.POW, parseFactor());
        }
        return base;
    }

    private Expression parseAwait() {
        if (parser.match(KW_AWAIT)) {
            SourceLocation loc = parser.previousLocation();
            return new UnaryExpr(loc, UnaryOp.AWAIT, parsePostfix());
        }
        return parsePostfix();
    }

    // ============ 后缀 ============

    private Expression parsePostfix() {
        Expression expr = parseAtom();
        while (true) {
            if (parser.match(LPAREN)) {
                SourceLocation loc = parser.previousLocation();
                expr = new CallExpr(loc, expr, parseArguments());
            } else if (parser.match(LBRACKET)) {
                SourceLocation loc = parser.previousLocation();
                expr = new IndexExpr(loc, expr, parseSubscriptList());
                parser.expect(RBRACKET, "Expected ']' after subscript");
            } else if (parser.match(DOT)) {
                SourceLocation loc = parser.previousLocation();
                String member = parser.expect(IDENTIFIER, "Expected attribute name after '.'").getLexeme();
                expr = new MemberExpr(loc, expr, member);
            } else {
                return expr;
            }
        }
    }

    /**
     * 解析调用参数，'(' 已消费，消费结尾的 ')'
     */
    List<Argument> parseArguments() {
        List<Argument> args = new ArrayList<Argument>();
        while (!parser.check(RPAREN)) {
            if (parser.match(STAR)) {
                args.add(new Argument(null, parseTest(), ArgumentKind.STAR));
            } else if (parser.match(DOUBLE_STAR)) {
                args.add(new Argument(null, parseTest(), ArgumentKind.DOUBLE_STAR));
            } else if (parser.check(IDENTIFIER) && parser.checkAhead(ASSIGN)) {
                String name = parser.advance().getLexeme();
                parser.advance();  // =
                args.add(new Argument(name, parseTest(), ArgumentKind.KEYWORD));
            } else {
                SourceLocation loc = parser.location();
                Expression value = parseNamedExpression();
                if (isComprehensionStart()) {
                    value = parseComprehension(loc, ComprehensionKind.GENERATOR, value, null);
                }
                args.add(Argument.positional(value));
            }
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RPAREN, "Expected ')' after arguments");
        return args;
    }

    private Expression parseSubscriptList() {
        SourceLocation loc = parser.location();
        Expression first = parseSubscript();
        if (!parser.check(COMMA)) {
            return first;
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RBRACKET)) break;
            elements.add(parseSubscript());
        }
        return new CollectionLiteral(loc, CollectionKind.TUPLE, elements);
    }

    private Expression parseSubscript() {
        SourceLocation loc = parser.location();
        Expression lower = null;
        if (!parser.check(COLON)) {
            lower = parseNamedOrStar();
            if (!parser.check(COLON)) {
                return lower;
            }
        }
        parser.expect(COLON, "Expected ':' in slice");
        Expression upper = null;
        Expression step = null;
        if (!parser.checkAny(COLON, COMMA, RBRACKET)) {
            upper = parseTest();
        }
        if (parser.match(COLON) && !parser.checkAny(COMMA, RBRACKET)) {
            step = parseTest();
        }
        return new SliceExpr(loc, lower, upper, step);
    }

    // ============ 原子 ============

    private Expression parseAtom() {
        SourceLocation loc = parser.location();
        Token token = parser.current;

        if (token.getType().isStringLike()) {
            return parseStrings();
        }
        switch (token.getType()) {
            case IDENTIFIER:
                parser.advance();
                return new Identifier(loc, token.getLexeme());
            case INT_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), LiteralKind.INT);
            case FLOAT_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), LiteralKind.FLOAT);
            case KW_TRUE:
                parser.advance();
                return new Literal(loc, Boolean.TRUE, LiteralKind.BOOLEAN);
            case KW_FALSE:
                parser.advance();
                return new Literal(loc, Boolean.FALSE, LiteralKind.BOOLEAN);
            case KW_NONE:
                parser.advance();
                return new Literal(loc, null, LiteralKind.NONE);
            case ELLIPSIS:
                parser.advance();
                return new Literal(loc, null, LiteralKind.ELLIPSIS);
            case LPAREN:
                return parseParenthesized();
            case LBRACKET:
                return parseListDisplay();
            case LBRACE:
                return parseBraceDisplay();
            default:
                throw new ParseException("Expected expression", token);
        }
    }

    /**
     * 相邻字符串字面量在解析期拼接
     */
    private Expression parseStrings() {
        SourceLocation loc = parser.location();
        StringBuilder sb = new StringBuilder();
        boolean formatted = false;
        boolean bytes = false;
        boolean text = false;
        while (parser.current.getType().isStringLike()) {
            Token token = parser.advance();
            if (token.getType() == BYTES_LITERAL) {
                bytes = true;
            } else {
                text = true;
                formatted |= token.getType() == FSTRING_LITERAL;
            }
            if (bytes && text) {
                throw new ParseException("Cannot mix bytes and nonbytes literals", token);
            }
            sb.append((String) token.getLiteral());
        }
        LiteralKind kind = bytes ? LiteralKind.BYTES : formatted ? LiteralKind.FSTRING : LiteralKind.STRING;
        return new Literal(loc, sb.toString(), kind);
    }

    private Expression parseParenthesized() {
        SourceLocation loc = parser.location();
        parser.expect(LPAREN, "Expected '('");
        if (parser.match(RPAREN)) {
            return new CollectionLiteral(loc, CollectionKind.TUPLE, Collections.<Expression>emptyList());
        }
        if (parser.check(KW_YIELD)) {
            Expression yield = parseYieldExpr();
            parser.expect(RPAREN, "Expected ')' after yield expression");
            return yield;
        }
        Expression first = parseNamedOrStar();
        if (isComprehensionStart()) {
            Expression generator = parseComprehension(loc, ComprehensionKind.GENERATOR, first, null);
            parser.expect(RPAREN, "Expected ')' after generator expression");
            return generator;
        }
        if (!parser.check(COMMA)) {
            parser.expect(RPAREN, "Expected ')'");
            return first;
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RPAREN)) break;
            elements.add(parseNamedOrStar());
        }
        parser.expect(RPAREN, "Expected ')' after tuple");
        return new CollectionLiteral(loc, CollectionKind.TUPLE, elements);
    }

    private Expression parseListDisplay() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACKET, "Expected '['");
        List<Expression> elements = new ArrayList<Expression>();
        if (parser.match(RBRACKET)) {
            return new CollectionLiteral(loc, CollectionKind.LIST, elements);
        }
        Expression first = parseNamedOrStar();
        if (isComprehensionStart()) {
            Expression comprehension = parseComprehension(loc, ComprehensionKind.LIST, first, null);
            parser.expect(RBRACKET, "Expected ']' after list comprehension");
            return comprehension;
        }
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RBRACKET)) break;
            elements.add(parseNamedOrStar());
        }
        parser.expect(RBRACKET, "Expected ']' after list elements");
        return new CollectionLiteral(loc, CollectionKind.LIST, elements);
    }

    /**
     * 花括号：字典、集合及其推导式
     */
    private Expression parseBraceDisplay() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");
        List<Expression> keys = new ArrayList<Expression>();
        List<Expression> values = new ArrayList<Expression>();
        if (parser.match(RBRACE)) {
            return new DictLiteral(loc, keys, values);
        }

        Expression firstKey = null;
        Expression firstValue;
        if (parser.match(DOUBLE_STAR)) {
            firstValue = parseBitOr();
        } else {
            Expression first = parseNamedOrStar();
            if (!parser.check(COLON)) {
                return parseSetRest(loc, first);
            }
            parser.advance();  // :
            firstKey = first;
            firstValue = parseTest();
            if (isComprehensionStart()) {
                Expression comprehension = parseComprehension(loc, ComprehensionKind.DICT, firstKey, firstValue);
                parser.expect(RBRACE, "Expected '}' after dict comprehension");
                return comprehension;
            }
        }
        keys.add(firstKey);
        values.add(firstValue);
        while (parser.match(COMMA)) {
            if (parser.check(RBRACE)) break;
            if (parser.match(DOUBLE_STAR)) {
                keys.add(null);
                values.add(parseBitOr());
            } else {
                keys.add(parseTest());
                parser.expect(COLON, "Expected ':' in dict entry");
                values.add(parseTest());
            }
        }
        parser.expect(RBRACE, "Expected '}' after dict entries");
        return new DictLiteral(loc, keys, values);
    }

    private Expression parseSetRest(SourceLocation loc, Expression first) {
        if (isComprehensionStart()) {
            Expression comprehension = parseComprehension(loc, ComprehensionKind.SET, first, null);
            parser.expect(RBRACE, "Expected '}' after set comprehension");
            return comprehension;
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RBRACE)) break;
            elements.add(parseNamedOrStar());
        }
        parser.expect(RBRACE, "Expected '}' after set elements");
        return new CollectionLiteral(loc, CollectionKind.SET, elements);
    }

    // ============ 推导式 ============

    private boolean isComprehensionStart() {
        return parser.check(KW_FOR) || (parser.check(KW_ASYNC) && parser.checkAhead(KW_FOR));
    }

    private Expression parseComprehension(SourceLocation loc, ComprehensionKind kind,
                                          Expression element, Expression valueElement) {
        List<ComprehensionExpr.Generator> generators = new ArrayList<ComprehensionExpr.Generator>();
        while (isComprehensionStart()) {
            boolean async = parser.match(KW_ASYNC);
            parser.expect(KW_FOR, "Expected 'for'");
            Expression target = parseTargetList();
            parser.expect(KW_IN, "Expected 'in' in comprehension");
            Expression iterable = parseOrTest();
            List<Expression> conditions = new ArrayList<Expression>();
            while (parser.match(KW_IF)) {
                conditions.add(parseOrTest());
            }
            generators.add(new ComprehensionExpr.Generator(target, iterable, conditions, async));
        }
        return new ComprehensionExpr(loc, kind, element, valueElement, generators);
    }

    // ============ yield 与参数 ============

    Expression parseYieldExpr() {
        SourceLocation loc = parser.location();
        parser.expect(KW_YIELD, "Expected 'yield'");
        if (parser.match(KW_FROM)) {
            return new YieldExpr(loc, parseTest(), true);
        }
        Expression value = null;
        if (canStartExpression()) {
            value = parseTestListStarExpr();
        }
        return new YieldExpr(loc, value, false);
    }

    /**
     * 解析形参列表直到 closer（不消费 closer）。lambda 形参不允许注解。
     */
    List<Parameter> parseParameters(TokenType closer, boolean allowAnnotations) {
        List<Parameter> params = new ArrayList<Parameter>();
        while (!parser.check(closer)) {
            SourceLocation loc = parser.location();
            if (parser.match(SLASH)) {
                params.add(new Parameter(loc, "/", null, null, ParameterKind.POSITIONAL_MARKER));
            } else if (parser.match(STAR)) {
                if (parser.check(IDENTIFIER)) {
                    String name = parser.advance().getLexeme();
                    params.add(new Parameter(loc, name, parseAnnotation(allowAnnotations), null,
                            ParameterKind.VAR_POSITIONAL));
                } else {
                    params.add(new Parameter(loc, "*", null, null, ParameterKind.KEYWORD_MARKER));
                }
            } else if (parser.match(DOUBLE_STAR)) {
                String name = parser.expect(IDENTIFIER, "Expected parameter name after '**'").getLexeme();
                params.add(new Parameter(loc, name, parseAnnotation(allowAnnotations), null,
                        ParameterKind.VAR_KEYWORD));
            } else {
                String name = parser.expect(IDENTIFIER, "Expected parameter name").getLexeme();
                Expression annotation = parseAnnotation(allowAnnotations);
                Expression defaultValue = null;
                if (parser.match(ASSIGN)) {
                    defaultValue = parseTest();
                }
                params.add(new Parameter(loc, name, annotation, defaultValue, ParameterKind.NORMAL));
            }
            if (!parser.match(COMMA)) break;
        }
        return params;
    }

    private Expression parseAnnotation(boolean allowAnnotations) {
        if (allowAnnotations && parser.match(COLON)) {
            return parseTest();
        }
        return null;
    }
}
