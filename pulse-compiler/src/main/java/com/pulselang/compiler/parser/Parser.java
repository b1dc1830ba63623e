package com.pulselang.compiler.parser;

import com.pulselang.compiler.ast.Modifier;
import com.pulselang.compiler.ast.SourceLocation;
import com.pulselang.compiler.ast.TypeRef;
import com.pulselang.compiler.ast.decl.*;
import com.pulselang.compiler.ast.expr.Expression;
import com.pulselang.compiler.ast.stmt.Block;
import com.pulselang.compiler.ast.stmt.Statement;
import com.pulselang.compiler.lexer.Lexer;
import com.pulselang.compiler.lexer.Token;
import com.pulselang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.pulselang.compiler.lexer.TokenType.*;

/**
 * PulseLang 语法分析器（递归下降）
 *
 * <p>构造时一次性取得完整 token 列表并丢弃注释，因此可以任意前瞻。
 * 顶层方法、字段和语句归并到合成类 {@link ClassDecl#SYNTHETIC_NAME}，
 * 顶层语句成为其 {@code main} 方法体。</p>
 */
public class Parser {

    final String fileName;
    private final List<Token> tokens;
    private int position;
    Token current;
    Token previous;

    /** 已打开尚未闭合的花括号层数，供错误恢复使用 */
    int braceDepth;

    // === Helper 实例 ===
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    /**
     * @throws com.pulselang.compiler.lexer.LexException 源码包含未闭合的字符串
     */
    public Parser(Lexer lexer) {
        this.fileName = lexer.getFileName();
        List<Token> scanned = lexer.scanTokens();
        List<Token> significant = new ArrayList<Token>(scanned.size());
        for (Token token : scanned) {
            if (!token.isTrivia()) {
                significant.add(token);
            }
        }
        this.tokens = significant;
        this.position = 0;
        this.current = tokens.get(0);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，返回被消费的 token
     */
    Token advance() {
        previous = current;
        if (current.getType() != EOF) {
            position++;
            current = tokens.get(position);
        }
        return previous;
    }

    /**
     * 向前看 n 个 token（0 为当前），越界时返回 EOF
     */
    Token peek(int n) {
        int index = position + n;
        if (index >= tokens.size()) {
            return tokens.get(tokens.size() - 1);
        }
        return tokens.get(index);
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
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
        throw new ParseException(message, current, type);
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    SourceLocation location() {
        return locationOf(current);
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn(),
                token.getOffset(), token.getLength());
    }

    // ============ 前瞻判断 ============

    /**
     * 从当前位置偏移 n 处尝试匹配一个类型引用（名称加若干 {@code []}），
     * 返回类型之后的偏移；不是类型时返回 -1
     */
    int scanType(int n) {
        Token first = peek(n);
        boolean named = first.getType() == IDENTIFIER
                || (first.getType().isTypeKeyword() && first.getType() != KW_VOID);
        if (!named) {
            return -1;
        }
        int offset = n + 1;
        while (peek(offset).getType() == LBRACKET && peek(offset + 1).getType() == RBRACKET) {
            offset += 2;
        }
        return offset;
    }

    /**
     * 当前位置是否为变量声明：{@code Type name}
     */
    boolean isVarDeclStart() {
        int after = scanType(0);
        return after > 0 && peek(after).getType() == IDENTIFIER;
    }

    /**
     * 当前位置是否为方法头：{@code Type name (} 或 {@code void name (}
     */
    boolean isMethodStart() {
        int after = check(KW_VOID) ? 1 : scanType(0);
        return after > 0
                && peek(after).getType() == IDENTIFIER
                && peek(after + 1).getType() == LPAREN;
    }

    /**
     * 当前 token 是否开启一个带注解或修饰符的声明
     */
    boolean isDeclarationStart() {
        return current.getType().isAnnotation()
                || checkAny(KW_PUBLIC, KW_PRIVATE, KW_STATIC, KW_CLASS);
    }

    // ============ 程序解析 ============

    /**
     * 解析程序，遇到第一个语法错误即抛出 {@link ParseException}
     */
    public Program parse() {
        SourceLocation loc = location();
        TopLevel topLevel = new TopLevel();
        while (!isAtEnd()) {
            parseTopLevel(topLevel);
        }
        return topLevel.toProgram(loc);
    }

    /**
     * 容错解析：遇到错误时跳过到下一个语句或声明边界继续解析。
     * 返回的 ParseResult 包含已成功解析的部分和收集到的错误列表。
     */
    public ParseResult parseTolerant() {
        SourceLocation loc = location();
        TopLevel topLevel = new TopLevel();
        List<ParseError> errors = new ArrayList<ParseError>();
        while (!isAtEnd()) {
            braceDepth = 0;
            try {
                parseTopLevel(topLevel);
            } catch (ParseException e) {
                errors.add(ParseError.from(e));
                synchronize();
            }
        }
        Program program;
        try {
            program = topLevel.toProgram(loc);
        } catch (ParseException e) {
            errors.add(ParseError.from(e));
            program = new Program(loc, topLevel.classes);
        }
        return new ParseResult(program, errors);
    }

    private void parseTopLevel(TopLevel topLevel) {
        if (isDeclarationStart()) {
            List<Annotation> annotations = declParser.parseAnnotations();
            List<Modifier> modifiers = declParser.parseModifiers();
            if (check(KW_CLASS)) {
                topLevel.classes.add(declParser.parseClassDecl(annotations, modifiers));
            } else if (isMethodStart()) {
                topLevel.methods.add(declParser.parseMethodDecl(annotations, modifiers, null));
            } else {
                topLevel.fields.add(declParser.parseFieldDecl(annotations, modifiers));
            }
        } else if (isMethodStart()) {
            topLevel.methods.add(declParser.parseMethodDecl(
                    Collections.<Annotation>emptyList(), Collections.<Modifier>emptyList(), null));
        } else {
            Token first = current;
            topLevel.statements.add(parseStatement());
            if (topLevel.firstStatement == null) {
                topLevel.firstStatement = first;
            }
        }
    }

    /**
     * 错误恢复：跳过 token 直到出错位置所在的顶层成员结束
     * （回到花括号深度 0 后的第一个分号或右花括号）
     */
    private void synchronize() {
        int depth = braceDepth;
        braceDepth = 0;
        while (!isAtEnd()) {
            Token token = advance();
            if (token.is(LBRACE)) {
                depth++;
            } else if (token.is(RBRACE)) {
                depth--;
            }
            if (depth <= 0 && token.isOneOf(SEMICOLON, RBRACE)) {
                return;
            }
        }
    }

    /**
     * 顶层成员收集器
     */
    private final class TopLevel {
        final List<ClassDecl> classes = new ArrayList<ClassDecl>();
        final List<MethodDecl> methods = new ArrayList<MethodDecl>();
        final List<FieldDecl> fields = new ArrayList<FieldDecl>();
        final List<Statement> statements = new ArrayList<Statement>();
        Token firstStatement;

        Program toProgram(SourceLocation loc) {
            List<ClassDecl> result = new ArrayList<ClassDecl>(classes);
            if (!methods.isEmpty() || !fields.isEmpty() || !statements.isEmpty()) {
                for (ClassDecl cls : classes) {
                    if (ClassDecl.SYNTHETIC_NAME.equals(cls.getName())) {
                        throw new ParseException("Class '" + ClassDecl.SYNTHETIC_NAME
                                + "' conflicts with top-level declarations", firstToken());
                    }
                }
                List<MethodDecl> members = new ArrayList<MethodDecl>(methods);
                if (!statements.isEmpty()) {
                    for (MethodDecl method : methods) {
                        if ("main".equals(method.getName()) && method.getParams().isEmpty()) {
                            throw new ParseException(
                                    "Top-level statements conflict with method 'main'", firstStatement);
                        }
                    }
                    SourceLocation mainLoc = locationOf(firstStatement);
                    List<Modifier> modifiers = new ArrayList<Modifier>();
                    modifiers.add(Modifier.PUBLIC);
                    modifiers.add(Modifier.STATIC);
                    members.add(new MethodDecl(mainLoc, Collections.<Annotation>emptyList(), modifiers,
                            TypeRef.VOID, "main", Collections.<Parameter>emptyList(),
                            new Block(mainLoc, statements)));
                }
                result.add(new ClassDecl(loc, Collections.<Annotation>emptyList(),
                        Collections.<Modifier>emptyList(), ClassDecl.SYNTHETIC_NAME,
                        fields, members, true));
            }
            return new Program(loc, result);
        }

        private Token firstToken() {
            return tokens.get(0);
        }
    }

    // ============ 语句解析委托 ============

    Statement parseStatement() { return stmtParser.parseStatement(); }
    Block parseBlock() { return stmtParser.parseBlock(); }

    // ============ 表达式解析委托 ============

    Expression parseExpression() { return exprParser.parseExpression(); }
    Expression parseInitializer() { return exprParser.parseInitializer(); }

    TypeRef parseType() { return declParser.parseType(); }
}
