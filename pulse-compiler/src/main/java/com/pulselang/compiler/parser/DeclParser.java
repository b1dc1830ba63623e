package com.pulselang.compiler.parser;

import com.pulselang.compiler.ast.Modifier;
import com.pulselang.compiler.ast.SourceLocation;
import com.pulselang.compiler.ast.TypeRef;
import com.pulselang.compiler.ast.decl.*;
import com.pulselang.compiler.ast.expr.Expression;
import com.pulselang.compiler.ast.stmt.Block;
import com.pulselang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.pulselang.compiler.lexer.TokenType.*;

/**
 * 声明解析辅助类：注解、修饰符、类、方法、字段、类型引用
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    // ============ 注解 ============

    List<Annotation> parseAnnotations() {
        List<Annotation> annotations = new ArrayList<Annotation>();
        while (parser.current.getType().isAnnotation()) {
            annotations.add(parseAnnotation());
        }
        return annotations;
    }

    private Annotation parseAnnotation() {
        SourceLocation loc = parser.location();
        Token token = parser.advance();
        String name = (String) token.getLiteral();

        Map<String, Object> args = new LinkedHashMap<String, Object>();
        if (parser.match(LPAREN)) {
            if (!parser.check(RPAREN)) {
                do {
                    Token argName = parser.expect(IDENTIFIER, "Expected annotation argument name");
                    parser.expect(ASSIGN, "Expected '=' after annotation argument name");
                    if (args.containsKey(argName.getLexeme())) {
                        throw new ParseException("Duplicate annotation argument '"
                                + argName.getLexeme() + "'", argName);
                    }
                    args.put(argName.getLexeme(), parseAnnotationValue());
                } while (parser.match(COMMA));
            }
            parser.expect(RPAREN, "Expected ')' after annotation arguments");
        }
        return new Annotation(loc, name, args);
    }

    /**
     * 注解参数值只能是字面量（数值可带负号）
     */
    private Object parseAnnotationValue() {
        boolean negative = parser.match(MINUS);
        Token token = parser.current;
        switch (token.getType()) {
            case INT_LITERAL:
                parser.advance();
                return negative ? -((Integer) token.getLiteral()) : token.getLiteral();
            case DOUBLE_LITERAL:
                parser.advance();
                return negative ? -((Double) token.getLiteral()) : token.getLiteral();
            case STRING_LITERAL:
            case KW_TRUE:
            case KW_FALSE:
                if (negative) break;
                parser.advance();
                if (token.getType() == STRING_LITERAL) {
                    return token.getLiteral();
                }
                return Boolean.valueOf(token.getType() == KW_TRUE);
            default:
                break;
        }
        throw new ParseException("Annotation argument must be a literal", token);
    }

    // ============ 修饰符 ============

    List<Modifier> parseModifiers() {
        List<Modifier> modifiers = new ArrayList<Modifier>();
        while (true) {
            Modifier modifier;
            if (parser.check(KW_PUBLIC)) {
                modifier = Modifier.PUBLIC;
            } else if (parser.check(KW_PRIVATE)) {
                modifier = Modifier.PRIVATE;
            } else if (parser.check(KW_STATIC)) {
                modifier = Modifier.STATIC;
            } else {
                return modifiers;
            }
            if (modifiers.contains(modifier)) {
                throw new ParseException("Repeated modifier '" + modifier.getKeyword() + "'", parser.current);
            }
            parser.advance();
            modifiers.add(modifier);
        }
    }

    // ============ 类 ============

    ClassDecl parseClassDecl(List<Annotation> annotations, List<Modifier> modifiers) {
        SourceLocation loc = parser.location();
        parser.expect(KW_CLASS, "Expected 'class'");
        String name = parser.expect(IDENTIFIER, "Expected class name").getLexeme();
        parser.expect(LBRACE, "Expected '{' after class name");
        parser.braceDepth++;

        List<FieldDecl> fields = new ArrayList<FieldDecl>();
        List<MethodDecl> methods = new ArrayList<MethodDecl>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            List<Annotation> memberAnnotations = parseAnnotations();
            List<Modifier> memberModifiers = parseModifiers();
            if (parser.check(IDENTIFIER) && name.equals(parser.current.getLexeme())
                    && parser.peek(1).getType() == LPAREN) {
                methods.add(parseMethodDecl(memberAnnotations, memberModifiers, name));
            } else if (parser.isMethodStart()) {
                methods.add(parseMethodDecl(memberAnnotations, memberModifiers, null));
            } else {
                fields.add(parseFieldDecl(memberAnnotations, memberModifiers));
            }
        }
        parser.expect(RBRACE, "Expected '}' to close class '" + name + "'");
        parser.braceDepth--;

        return new ClassDecl(loc, annotations, modifiers, name, fields, methods, false);
    }

    // ============ 方法 ============

    /**
     * 解析方法声明
     *
     * @param constructorOf 构造器所属类名；普通方法传 null
     */
    MethodDecl parseMethodDecl(List<Annotation> annotations, List<Modifier> modifiers, String constructorOf) {
        SourceLocation loc = parser.location();
        TypeRef returnType;
        if (constructorOf != null || parser.match(KW_VOID)) {
            returnType = TypeRef.VOID;
        } else {
            returnType = parseType();
        }
        String name = parser.expect(IDENTIFIER, "Expected method name").getLexeme();

        parser.expect(LPAREN, "Expected '(' after method name");
        List<Parameter> params = new ArrayList<Parameter>();
        if (!parser.check(RPAREN)) {
            do {
                SourceLocation paramLoc = parser.location();
                TypeRef type = parseType();
                String paramName = parser.expect(IDENTIFIER, "Expected parameter name").getLexeme();
                for (Parameter existing : params) {
                    if (existing.getName().equals(paramName)) {
                        throw new ParseException("Duplicate parameter '" + paramName + "'", parser.previous);
                    }
                }
                params.add(new Parameter(paramLoc, type, paramName));
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')' after parameters");

        Block body = parser.parseBlock();
        return new MethodDecl(loc, annotations, modifiers, returnType, name,
                params.isEmpty() ? Collections.<Parameter>emptyList() : params, body);
    }

    // ============ 字段 ============

    FieldDecl parseFieldDecl(List<Annotation> annotations, List<Modifier> modifiers) {
        SourceLocation loc = parser.location();
        TypeRef type = parseType();
        String name = parser.expect(IDENTIFIER, "Expected field name").getLexeme();
        Expression initializer = null;
        if (parser.match(ASSIGN)) {
            initializer = parser.parseInitializer();
        }
        parser.expect(SEMICOLON, "Expected ';' after field declaration");
        return new FieldDecl(loc, annotations, modifiers, type, name, initializer);
    }

    // ============ 类型 ============

    TypeRef parseType() {
        Token token = parser.current;
        boolean named = token.getType() == IDENTIFIER
                || (token.getType().isTypeKeyword() && token.getType() != KW_VOID);
        if (!named) {
            throw new ParseException("Expected type", token);
        }
        parser.advance();
        int dimensions = 0;
        while (parser.check(LBRACKET) && parser.peek(1).getType() == RBRACKET) {
            parser.advance();
            parser.advance();
            dimensions++;
        }
        return new TypeRef(token.getLexeme(), dimensions);
    }
}
