package com.pulselang.compiler.parser;

import com.pulselang.compiler.ast.SourceLocation;
import com.pulselang.compiler.ast.TypeRef;
import com.pulselang.compiler.ast.expr.Expression;
import com.pulselang.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.pulselang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        if (parser.check(LBRACE)) {
            return parseBlock();
        }
        if (parser.check(KW_IF)) {
            return parseIfStmt();
        }
        if (parser.check(KW_WHILE)) {
            return parseWhileStmt();
        }
        if (parser.check(KW_FOR)) {
            return parseForStmt();
        }
        if (parser.check(KW_RETURN)) {
            return parseReturnStmt();
        }
        if (parser.check(SEMICOLON)) {
            // 空语句
            SourceLocation loc = parser.location();
            parser.advance();
            return new Block(loc, Collections.<Statement>emptyList());
        }
        if (parser.isVarDeclStart()) {
            VarDeclStmt decl = parseVarDecl();
            parser.expect(SEMICOLON, "Expected ';' after variable declaration");
            return decl;
        }
        return parseExpressionStmt();
    }

    Block parseBlock() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");
        parser.braceDepth++;

        List<Statement> statements = new ArrayList<Statement>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            statements.add(parseStatement());
        }

        parser.expect(RBRACE, "Expected '}'");
        parser.braceDepth--;
        return new Block(loc, statements);
    }

    private Statement parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IF, "Expected 'if'");
        parser.expect(LPAREN, "Expected '(' after 'if'");
        Expression condition = parser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after if condition");

        Statement thenBranch = parseStatement();
        Statement elseBranch = null;
        if (parser.match(KW_ELSE)) {
            elseBranch = parseStatement();
        }
        return new IfStmt(loc, condition, thenBranch, elseBranch);
    }

    private Statement parseWhileStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_WHILE, "Expected 'while'");
        parser.expect(LPAREN, "Expected '(' after 'while'");
        Expression condition = parser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after while condition");
        return new WhileStmt(loc, condition, parseStatement());
    }

    private Statement parseForStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FOR, "Expected 'for'");
        parser.expect(LPAREN, "Expected '(' after 'for'");

        Statement init = null;
        if (!parser.check(SEMICOLON)) {
            if (parser.isVarDeclStart()) {
                init = parseVarDecl();
            } else {
                SourceLocation initLoc = parser.location();
                init = new ExpressionStmt(initLoc, parser.parseExpression());
            }
        }
        parser.expect(SEMICOLON, "Expected ';' after for initializer");

        Expression condition = null;
        if (!parser.check(SEMICOLON)) {
            condition = parser.parseExpression();
        }
        parser.expect(SEMICOLON, "Expected ';' after for condition");

        Expression update = null;
        if (!parser.check(RPAREN)) {
            update = parser.parseExpression();
        }
        parser.expect(RPAREN, "Expected ')' after for clauses");

        return new ForStmt(loc, init, condition, update, parseStatement());
    }

    private Statement parseReturnStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_RETURN, "Expected 'return'");
        Expression value = null;
        if (!parser.check(SEMICOLON)) {
            value = parser.parseExpression();
        }
        parser.expect(SEMICOLON, "Expected ';' after return");
        return new ReturnStmt(loc, value);
    }

    /**
     * 解析 {@code Type name [= init]}，不消费结尾的分号
     */
    VarDeclStmt parseVarDecl() {
        SourceLocation loc = parser.location();
        TypeRef type = parser.parseType();
        String name = parser.expect(IDENTIFIER, "Expected variable name").getLexeme();
        Expression initializer = null;
        if (parser.match(ASSIGN)) {
            initializer = parser.parseInitializer();
        }
        return new VarDeclStmt(loc, type, name, initializer);
    }

    private Statement parseExpressionStmt() {
        SourceLocation loc = parser.location();
        Expression expr = parser.parseExpression();
        parser.expect(SEMICOLON, "Expected ';' after expression");
        return new ExpressionStmt(loc, expr);
    }
}
