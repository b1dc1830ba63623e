package com.pulselang.compiler.analysis;

import com.pulselang.compiler.lexer.Token;
import com.pulselang.compiler.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.pulselang.compiler.lexer.TokenType.*;

/**
 * 基于 token 流的静态检查，不执行代码
 *
 * <p>检查注解参数、字面量除零、IoT 环境禁止的操作、括号配对和缺失分号。
 * 同一行同一消息只报告一次，结果按行、列排序。</p>
 */
public class SyntaxValidator {

    static final String INVALID_DEADLINE = "Invalid @Deadline syntax. Use @Deadline(ms=value)";
    static final String DEADLINE_NOT_POSITIVE = "Deadline must be positive";
    static final String DEADLINE_NOT_REAL_TIME = "Deadline > 1000ms may not be real-time";
    static final String DIVISION_BY_ZERO = "Division by zero detected";
    static final String UNSAFE_OPERATION = "Unsafe operation not allowed in IoT environment";
    static final String UNMATCHED_CLOSING = "Unmatched closing brace/bracket/parenthesis";
    static final String MISMATCHED = "Mismatched brace/bracket/parenthesis";
    static final String UNCLOSED = "Unclosed brace/bracket/parenthesis";
    static final String SENSOR_WITHOUT_TYPE = "@Sensor should declare a type";
    static final String MISSING_SEMICOLON = "Missing semicolon";

    /** 实时截止时间的上限（毫秒） */
    private static final long REAL_TIME_LIMIT_MS = 1000;

    private static final int MAX_SEMICOLON_WARNINGS = 3;

    /** 缺失分号启发式检查的前后扫描窗口 */
    private static final int STATEMENT_WINDOW = 5;

    private final List<Token> tokens;
    private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

    public SyntaxValidator(List<Token> tokens) {
        List<Token> significant = new ArrayList<Token>(tokens.size());
        for (Token token : tokens) {
            if (!token.isTrivia()) {
                significant.add(token);
            }
        }
        this.tokens = significant;
    }

    /**
     * 执行全部检查
     */
    public List<Diagnostic> validate() {
        diagnostics.clear();

        validateDeadlineAnnotations();
        validateSensorAnnotations();
        validateDivisionByZero();
        validateUnsafeOperations();
        validateBraceMatching();
        validateSemicolons();

        List<Diagnostic> sorted = new ArrayList<Diagnostic>(diagnostics);
        Collections.sort(sorted, new Comparator<Diagnostic>() {
            @Override
            public int compare(Diagnostic a, Diagnostic b) {
                if (a.getLine() != b.getLine()) {
                    return Integer.compare(a.getLine(), b.getLine());
                }
                return Integer.compare(a.getColumn(), b.getColumn());
            }
        });
        return sorted;
    }

    /** 是否包含 ERROR 级诊断 */
    public static boolean hasErrors(List<Diagnostic> diagnostics) {
        for (Diagnostic d : diagnostics) {
            if (d.isError()) return true;
        }
        return false;
    }

    // ============ 注解 ============

    private void validateDeadlineAnnotations() {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getType() != ANN_DEADLINE) continue;

            if (i + 1 >= tokens.size() || tokens.get(i + 1).getType() != LPAREN) {
                error(token, INVALID_DEADLINE);
                continue;
            }
            Map<String, Token> params = annotationParameters(i + 1);
            Token ms = params.get("ms");
            if (ms == null) {
                error(token, INVALID_DEADLINE);
                continue;
            }
            Long value = integerValue(ms);
            if (value == null || value <= 0) {
                error(token, DEADLINE_NOT_POSITIVE);
            } else if (value > REAL_TIME_LIMIT_MS) {
                warning(token, DEADLINE_NOT_REAL_TIME);
            }
        }
    }

    private void validateSensorAnnotations() {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getType() != ANN_SENSOR) continue;

            boolean typed = i + 1 < tokens.size()
                    && tokens.get(i + 1).getType() == LPAREN
                    && annotationParameters(i + 1).containsKey("type");
            if (!typed) {
                warning(token, SENSOR_WITHOUT_TYPE);
            }
        }
    }

    /**
     * 从左括号开始收集 {@code name=value} 对，直到右括号；值为 {@code =} 之后的 token
     */
    private Map<String, Token> annotationParameters(int openParen) {
        Map<String, Token> params = new LinkedHashMap<String, Token>();
        int i = openParen + 1;
        while (i < tokens.size() && !tokens.get(i).isOneOf(RPAREN, EOF)) {
            Token token = tokens.get(i);
            if (token.is(IDENTIFIER) && i + 2 < tokens.size() && tokens.get(i + 1).is(ASSIGN)) {
                params.put(token.getLexeme(), tokens.get(i + 2));
                i += 3;
            } else {
                i++;
            }
        }
        return params;
    }

    /**
     * 参数值的整数部分；不是正向数值时返回 null（负号作为独立 token 出现）
     */
    private static Long integerValue(Token token) {
        switch (token.getType()) {
            case INT_LITERAL:
                return Long.valueOf(((Integer) token.getLiteral()).longValue());
            case DOUBLE_LITERAL:
                return Long.valueOf((long) ((Double) token.getLiteral()).doubleValue());
            case STRING_LITERAL:
                try {
                    return Long.valueOf(((String) token.getLiteral()).trim());
                } catch (NumberFormatException e) {
                    return null;
                }
            default:
                return null;
        }
    }

    // ============ 除零 ============

    private void validateDivisionByZero() {
        for (int i = 0; i + 1 < tokens.size(); i++) {
            Token op = tokens.get(i);
            if (!op.isOneOf(DIV, MOD)) continue;
            if (isZeroLiteral(tokens.get(i + 1))) {
                error(op, DIVISION_BY_ZERO);
            }
        }
    }

    private static boolean isZeroLiteral(Token token) {
        if (token.is(INT_LITERAL)) {
            return ((Integer) token.getLiteral()).intValue() == 0;
        }
        if (token.is(DOUBLE_LITERAL)) {
            return ((Double) token.getLiteral()).doubleValue() == 0.0;
        }
        return false;
    }

    // ============ 禁止的操作 ============

    private void validateUnsafeOperations() {
        Set<Integer> reportedLines = new HashSet<Integer>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.is(IDENTIFIER) || reportedLines.contains(token.getLine())) continue;

            if (isUnsafeAt(i)) {
                error(token, UNSAFE_OPERATION);
                reportedLines.add(token.getLine());
            }
        }
    }

    private boolean isUnsafeAt(int i) {
        String name = tokens.get(i).getLexeme();
        if ("ProcessBuilder".equals(name)) {
            return true;
        }
        return memberAccessAt(i, "System", "exit")
                || memberAccessAt(i, "Runtime", "getRuntime")
                || memberAccessAt(i, "Class", "forName");
    }

    private boolean memberAccessAt(int i, String owner, String member) {
        return i + 2 < tokens.size()
                && owner.equals(tokens.get(i).getLexeme())
                && tokens.get(i + 1).is(DOT)
                && tokens.get(i + 2).is(IDENTIFIER)
                && member.equals(tokens.get(i + 2).getLexeme());
    }

    // ============ 括号配对 ============

    private void validateBraceMatching() {
        Deque<Token> stack = new ArrayDeque<Token>();
        for (Token token : tokens) {
            if (token.isOneOf(LBRACE, LPAREN, LBRACKET)) {
                stack.push(token);
            } else if (token.isOneOf(RBRACE, RPAREN, RBRACKET)) {
                if (stack.isEmpty()) {
                    error(token, UNMATCHED_CLOSING);
                } else {
                    Token open = stack.pop();
                    if (closerOf(open.getType()) != token.getType()) {
                        error(token, MISMATCHED);
                    }
                }
            }
        }
        // 栈底是最早打开的
        List<Token> unclosed = new ArrayList<Token>(stack);
        Collections.reverse(unclosed);
        for (Token open : unclosed) {
            error(open, UNCLOSED);
        }
    }

    private static TokenType closerOf(TokenType open) {
        switch (open) {
            case LBRACE: return RBRACE;
            case LPAREN: return RPAREN;
            default: return RBRACKET;
        }
    }

    // ============ 缺失分号（启发式） ============

    /**
     * 声明或赋值行上以数字/标识符结尾、下一个 token 在新行且不是 {@code ; } 的情况
     */
    private void validateSemicolons() {
        Set<Integer> checkedLines = new HashSet<Integer>();
        int warnings = 0;

        for (int i = 0; i + 1 < tokens.size(); i++) {
            if (warnings >= MAX_SEMICOLON_WARNINGS) break;

            Token token = tokens.get(i);
            Token next = tokens.get(i + 1);
            if (checkedLines.contains(token.getLine())) continue;

            boolean endsValue = token.isOneOf(INT_LITERAL, DOUBLE_LITERAL, IDENTIFIER);
            if (endsValue
                    && !next.isOneOf(SEMICOLON, RBRACE, EOF)
                    && next.getLine() != token.getLine()
                    && isStatementLine(i)) {
                warning(token, MISSING_SEMICOLON);
                checkedLines.add(token.getLine());
                warnings++;
            }
        }
    }

    private boolean isStatementLine(int index) {
        int line = tokens.get(index).getLine();
        int from = Math.max(0, index - STATEMENT_WINDOW);
        int to = Math.min(tokens.size(), index + STATEMENT_WINDOW);
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.getLine() != line) continue;
            if (token.isOneOf(KW_INT, KW_DOUBLE, KW_STRING, KW_BOOLEAN, ASSIGN)) {
                return true;
            }
        }
        return false;
    }

    // ============ 结果收集 ============

    private void error(Token at, String message) {
        add(new Diagnostic(Diagnostic.Severity.ERROR, message, at.getLine(), at.getColumn()));
    }

    private void warning(Token at, String message) {
        add(new Diagnostic(Diagnostic.Severity.WARNING, message, at.getLine(), at.getColumn()));
    }

    private void add(Diagnostic diagnostic) {
        for (Diagnostic existing : diagnostics) {
            if (existing.getLine() == diagnostic.getLine()
                    && existing.getMessage().equals(diagnostic.getMessage())) {
                return;
            }
        }
        diagnostics.add(diagnostic);
    }
}
