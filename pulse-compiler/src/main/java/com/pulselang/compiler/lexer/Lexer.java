package com.pulselang.compiler.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PulseLang 词法分析器
 *
 * <p>单遍从左到右扫描，不回溯。注释作为 {@link TokenType#COMMENT} 保留，
 * 空白不产生 token。</p>
 */
public class Lexer {
    private static final Logger LOG = Logger.getLogger(Lexer.class.getName());

    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<Token>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 当前 token 的起始行列（多行 token 需要）
    private int startLine = 1;
    private int startColumn = 1;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    // 注解映射表（含 @ 前缀）
    private static final Map<String, TokenType> ANNOTATIONS;

    static {
        Map<String, TokenType> map = new HashMap<String, TokenType>();

        // 声明与修饰符
        map.put("class", TokenType.KW_CLASS);
        map.put("public", TokenType.KW_PUBLIC);
        map.put("private", TokenType.KW_PRIVATE);
        map.put("static", TokenType.KW_STATIC);
        map.put("new", TokenType.KW_NEW);
        map.put("this", TokenType.KW_THIS);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("while", TokenType.KW_WHILE);
        map.put("for", TokenType.KW_FOR);
        map.put("return", TokenType.KW_RETURN);

        // 常量
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("null", TokenType.KW_NULL);

        // 内置类型
        map.put("void", TokenType.KW_VOID);
        map.put("int", TokenType.KW_INT);
        map.put("double", TokenType.KW_DOUBLE);
        map.put("boolean", TokenType.KW_BOOLEAN);
        map.put("String", TokenType.KW_STRING);

        KEYWORDS = Collections.unmodifiableMap(map);

        Map<String, TokenType> ann = new HashMap<String, TokenType>();
        ann.put("@Deadline", TokenType.ANN_DEADLINE);
        ann.put("@Sensor", TokenType.ANN_SENSOR);
        ann.put("@SafetyCheck", TokenType.ANN_SAFETY_CHECK);
        ann.put("@RealTime", TokenType.ANN_REAL_TIME);
        ANNOTATIONS = Collections.unmodifiableMap(ann);
    }

    /** 获取所有关键词集合 */
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

    /**
     * 执行词法分析，返回以 EOF 结尾的 Token 列表
     *
     * @throws LexException 遇到未闭合的字符串
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case '.': addToken(TokenType.DOT); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '*': addToken(TokenType.MUL); break;
            case '%': addToken(TokenType.MOD); break;

            case '@':
                annotation();
                break;

            // 可能是多字符的 Token
            case '+':
                addToken(match('+') ? TokenType.INC : TokenType.PLUS);
                break;

            case '-':
                addToken(match('-') ? TokenType.DEC : TokenType.MINUS);
                break;

            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                    addToken(TokenType.COMMENT);
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(TokenType.DIV);
                }
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;

            case '<':
                addToken(match('=') ? TokenType.LE : TokenType.LT);
                break;

            case '>':
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            case '&':
                if (match('&')) {
                    addToken(TokenType.AND);
                } else {
                    error("Unexpected character '&'. Did you mean '&&'?");
                }
                break;

            case '|':
                if (match('|')) {
                    addToken(TokenType.OR);
                } else {
                    error("Unexpected character '|'. Did you mean '||'?");
                }
                break;

            // 空白字符
            case ' ':
            case '\r':
            case '\t':
                break;

            case '\n':
                newLine();
                break;

            // 字符串
            case '"':
                string();
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
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
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               c == '$';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, startLine, startColumn, start));
    }

    // === 复杂 Token 扫描 ===

    private void annotation() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = ANNOTATIONS.get(text);
        if (type == null) type = TokenType.ANNOTATION;
        addToken(type, text.substring(1));
    }

    private void string() {
        StringBuilder value = new StringBuilder();

        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n') {
                throw new LexException("Unterminated string", startLine, startColumn);
            }
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) break;
                value.append(escapeChar(advance()));
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            throw new LexException("Unterminated string", startLine, startColumn);
        }

        advance(); // 闭合的 "
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private String escapeChar(char c) {
        switch (c) {
            case 'n': return "\n";
            case 't': return "\t";
            case 'r': return "\r";
            case '0': return "\0";
            case '"': return "\"";
            case '\'': return "'";
            case '\\': return "\\";
            default:
                // 未知转义原样保留
                return "\\" + c;
        }
    }

    private void number() {
        while (isDigit(peek())) advance();

        // 小数部分
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消费 .
            while (isDigit(peek())) advance();
            addToken(TokenType.DOUBLE_LITERAL, Double.parseDouble(source.substring(start, current)));
            return;
        }

        String text = source.substring(start, current);
        try {
            addToken(TokenType.INT_LITERAL, Integer.parseInt(text));
        } catch (NumberFormatException e) {
            // 超出 int 范围的整数按 double 处理
            addToken(TokenType.DOUBLE_LITERAL, Double.parseDouble(text));
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                break;
            }
            if (peek() == '\n') {
                advance();
                newLine();
            } else {
                advance();
            }
        }
        // 未闭合的块注释延伸到输入末尾
        addToken(TokenType.COMMENT);
    }

    private void error(String message) {
        LOG.log(Level.WARNING, String.format("[%s:%d:%d] Lexer error: %s",
                fileName, startLine, startColumn, message));
        addToken(TokenType.ERROR, message);
    }
}
