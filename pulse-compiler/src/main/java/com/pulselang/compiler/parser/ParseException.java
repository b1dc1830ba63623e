package com.pulselang.compiler.parser;

import com.pulselang.compiler.lexer.Token;
import com.pulselang.compiler.lexer.TokenType;

/**
 * 语法错误，定位到出错的 token
 */
public class ParseException extends RuntimeException {

    private final Token token;
    private final TokenType expected;

    public ParseException(String message, Token token) {
        this(message, token, null);
    }

    /**
     * @param expected 期望的 token 类型，用于消息末尾的提示
     */
    public ParseException(String message, Token token, TokenType expected) {
        super(message);
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    /** 可能为 null */
    public TokenType getExpected() {
        return expected;
    }

    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    /** 不含位置的错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    /**
     * 形如 {@code Expected ';' at line 2, column 1 (found 'int')}
     */
    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine())
              .append(", column ").append(token.getColumn());
            if (token.getType() == TokenType.EOF) {
                sb.append(" (found end of input)");
            } else {
                sb.append(" (found '").append(token.getLexeme()).append("')");
            }
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
