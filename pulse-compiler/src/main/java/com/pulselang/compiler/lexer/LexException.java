package com.pulselang.compiler.lexer;

/**
 * 致命词法错误（如未闭合的字符串）
 */
public class LexException extends RuntimeException {
    private final int line;
    private final int column;

    public LexException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** 不含位置信息的错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " at line " + line + ", column " + column;
    }
}
