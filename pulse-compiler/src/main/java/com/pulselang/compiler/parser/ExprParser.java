package com.pulselang.compiler.parser;

import com.pulselang.compiler.ast.SourceLocation;
import com.pulselang.compiler.ast.TypeRef;
import com.pulselang.compiler.ast.expr.*;
import com.pulselang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.pulselang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级从低到高：赋值 → {@code ||} → {@code &&} → 相等 → 关系 → 加减 → 乘除模
 * → 一元 → 后缀（调用、成员、下标、自增自减）→ 基本表达式。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseAssignExpr();
    }

    /**
     * 声明的初始值：允许数组初始化器 {@code {1, 2}}
     */
    Expression parseInitializer() {
        if (parser.check(LBRACE)) {
            return parseArrayLiteral();
        }
        return parseExpression();
    }

    private ArrayLiteral parseArrayLiteral() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");
        parser.braceDepth++;
        List<Expression> elements = new ArrayList<Expression>();
        if (!parser.check(RBRACE)) {
            do {
                if (parser.check(RBRACE)) break;  // 允许尾随逗号
                elements.add(parseInitializer());
            } while (parser.match(COMMA));
        }
        parser.expect(RBRACE, "Expected '}' after array elements");
        parser.braceDepth--;
        return new ArrayLiteral(loc, elements);
    }

    // 赋值表达式（最低优先级，右结合）
    private Expression parseAssignExpr() {
        Expression left = parseOrExpr();

        if (parser.check(ASSIGN)) {
            Token op = parser.advance();
            if (!isAssignable(left)) {
                throw new ParseException("Invalid assignment target", op);
            }
            SourceLocation loc = parser.locationOf(op);
            Expression right = parseAssignExpr();
            return new AssignExpr(loc, left, right);
        }

        return left;
    }

    private static boolean isAssignable(Expression expr) {
        return expr instanceof Identifier || expr instanceof IndexExpr || expr instanceof MemberExpr;
    }

    // ||
    private Expression parseOrExpr() {
        Expression left = parseAndExpr();
        while (parser.check(OR)) {
            SourceLocation loc = parser.locationOf(parser.advance());
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.OR, parseAndExpr());
        }
        return left;
    }

    // &&
    private Expression parseAndExpr() {
        Expression left = parseEqualityExpr();
        while (parser.check(AND)) {
            SourceLocation loc = parser.locationOf(parser.advance());
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.AND, parseEqualityExpr());
        }
        return left;
    }

    // == !=
    private Expression parseEqualityExpr() {
        Expression left = parseRelationalExpr();
        while (parser.checkAny(EQ, NE)) {
            Token op = parser.advance();
            BinaryExpr.BinaryOp binaryOp = op.is(EQ) ? BinaryExpr.BinaryOp.EQ : BinaryExpr.BinaryOp.NE;
            left = new BinaryExpr(parser.locationOf(op), left, binaryOp, parseRelationalExpr());
        }
        return left;
    }

    // < > <= >=
    private Expression parseRelationalExpr() {
        Expression left = parseAdditiveExpr();
        while (parser.current.getType().isComparisonOp()) {
            Token op = parser.advance();
            BinaryExpr.BinaryOp binaryOp;
            switch (op.getType()) {
                case LT: binaryOp = BinaryExpr.BinaryOp.LT; break;
                case GT: binaryOp = BinaryExpr.BinaryOp.GT; break;
                case LE: binaryOp = BinaryExpr.BinaryOp.LE; break;
                case GE: binaryOp = BinaryExpr.BinaryOp.GE; break;
                default: throw new ParseException("Unexpected comparison operator", op);
            }
            left = new BinaryExpr(parser.locationOf(op), left, binaryOp, parseAdditiveExpr());
        }
        return left;
    }

    // + -
    private Expression parseAdditiveExpr() {
        Expression left = parseMultiplicativeExpr();
        while (parser.checkAny(PLUS, MINUS)) {
            Token op = parser.advance();
            BinaryExpr.BinaryOp binaryOp = op.is(PLUS) ? BinaryExpr.BinaryOp.ADD : BinaryExpr.BinaryOp.SUB;
            left = new BinaryExpr(parser.locationOf(op), left, binaryOp, parseMultiplicativeExpr());
        }
        return left;
    }

    // * / %
    private Expression parseMultiplicativeExpr() {
        Expression left = parseUnaryExpr();
        while (parser.checkAny(MUL, DIV, MOD)) {
            Token op = parser.advance();
            BinaryExpr.BinaryOp binaryOp;
            switch (op.getType()) {
                case MUL: binaryOp = BinaryExpr.BinaryOp.MUL; break;
                case DIV: binaryOp = BinaryExpr.BinaryOp.DIV; break;
                default: binaryOp = BinaryExpr.BinaryOp.MOD; break;
            }
            left = new BinaryExpr(parser.locationOf(op), left, binaryOp, parseUnaryExpr());
        }
        return left;
    }

    // ! - ++ --（前缀）
    private Expression parseUnaryExpr() {
        if (parser.checkAny(NOT, MINUS, INC, DEC)) {
            Token op = parser.advance();
            SourceLocation loc = parser.locationOf(op);
            Expression operand = parseUnaryExpr();
            UnaryExpr.UnaryOp unaryOp;
            switch (op.getType()) {
                case NOT: unaryOp = UnaryExpr.UnaryOp.NOT; break;
                case MINUS: unaryOp = UnaryExpr.UnaryOp.NEG; break;
                case INC: unaryOp = UnaryExpr.UnaryOp.INC; break;
                default: unaryOp = UnaryExpr.UnaryOp.DEC; break;
            }
            if (unaryOp.isMutating() && !isAssignable(operand)) {
                throw new ParseException("Operand of '" + op.getLexeme() + "' must be a variable", op);
            }
            return new UnaryExpr(loc, unaryOp, operand, true);
        }
        return parsePostfixExpr();
    }

    // 调用、成员访问、下标、后缀 ++ --
    private Expression parsePostfixExpr() {
        Expression expr = parsePrimaryExpr();

        while (true) {
            if (parser.check(LPAREN)) {
                SourceLocation loc = parser.location();
                parser.advance();
                List<Expression> args = parseArguments();
                expr = new CallExpr(loc, expr, args);
            } else if (parser.check(DOT)) {
                SourceLocation loc = parser.location();
                parser.advance();
                String name = parser.expect(IDENTIFIER, "Expected member name after '.'").getLexeme();
                expr = new MemberExpr(loc, expr, name);
            } else if (parser.check(LBRACKET)) {
                SourceLocation loc = parser.location();
                parser.advance();
                Expression index = parseExpression();
                parser.expect(RBRACKET, "Expected ']' after index");
                expr = new IndexExpr(loc, expr, index);
            } else if (parser.checkAny(INC, DEC)) {
                Token op = parser.advance();
                if (!isAssignable(expr)) {
                    throw new ParseException("Operand of '" + op.getLexeme() + "' must be a variable", op);
                }
                UnaryExpr.UnaryOp unaryOp = op.is(INC) ? UnaryExpr.UnaryOp.INC : UnaryExpr.UnaryOp.DEC;
                return new UnaryExpr(parser.locationOf(op), unaryOp, expr, false);
            } else {
                return expr;
            }
        }
    }

    /**
     * 解析 {@code (} 之后的实参列表，消费结尾的 {@code )}
     */
    private List<Expression> parseArguments() {
        if (parser.match(RPAREN)) {
            return Collections.emptyList();
        }
        List<Expression> args = new ArrayList<Expression>();
        do {
            args.add(parseExpression());
        } while (parser.match(COMMA));
        parser.expect(RPAREN, "Expected ')' after arguments");
        return args;
    }

    private Expression parsePrimaryExpr() {
        Token token = parser.current;
        SourceLocation loc = parser.location();

        switch (token.getType()) {
            case INT_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.INT);
            case DOUBLE_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.DOUBLE);
            case STRING_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.STRING);
            case KW_TRUE:
                parser.advance();
                return new Literal(loc, Boolean.TRUE, Literal.LiteralKind.BOOLEAN);
            case KW_FALSE:
                parser.advance();
                return new Literal(loc, Boolean.FALSE, Literal.LiteralKind.BOOLEAN);
            case KW_NULL:
                parser.advance();
                return new Literal(loc, null, Literal.LiteralKind.NULL);
            case KW_THIS:
                parser.advance();
                return new Identifier(loc, "this");
            case IDENTIFIER:
                parser.advance();
                return new Identifier(loc, token.getLexeme());
            case LPAREN: {
                parser.advance();
                Expression inner = parseExpression();
                parser.expect(RPAREN, "Expected ')' after expression");
                return inner;
            }
            case KW_NEW:
                return parseNewExpr();
            case ERROR:
                throw new ParseException(String.valueOf(token.getLiteral()), token);
            case LBRACE:
                throw new ParseException("Array initializer is only allowed in a declaration", token);
            default:
                throw new ParseException("Expected expression", token);
        }
    }

    // new Foo(args) | new int[n]
    private Expression parseNewExpr() {
        SourceLocation loc = parser.location();
        parser.expect(KW_NEW, "Expected 'new'");

        Token typeToken = parser.current;
        boolean named = typeToken.is(IDENTIFIER)
                || (typeToken.getType().isTypeKeyword() && !typeToken.is(KW_VOID));
        if (!named) {
            throw new ParseException("Expected type after 'new'", typeToken);
        }
        parser.advance();

        if (parser.match(LBRACKET)) {
            Expression size = parseExpression();
            parser.expect(RBRACKET, "Expected ']' after array size");
            int dimensions = 0;
            while (parser.check(LBRACKET) && parser.peek(1).is(RBRACKET)) {
                parser.advance();
                parser.advance();
                dimensions++;
            }
            return new NewExpr(loc, new TypeRef(typeToken.getLexeme(), dimensions),
                    Collections.<Expression>emptyList(), size);
        }

        if (!typeToken.is(IDENTIFIER)) {
            throw new ParseException("Expected '[' after primitive type in 'new'", parser.current);
        }
        parser.expect(LPAREN, "Expected '(' or '[' after type in 'new'");
        List<Expression> args = parseArguments();
        return new NewExpr(loc, TypeRef.of(typeToken.getLexeme()), args, null);
    }
}
