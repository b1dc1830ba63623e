package com.pulselang.compiler.lexer;

/**
 * 词法单元
 *
 * <p>{@code source.substring(offset, offset + length)} 恒等于 {@link #getLexeme()}，
 * 词法分析结果可以逐字还原源码。</p>
 */
public final class Token {

    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, Object literal, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() { return type; }
    public String getLexeme() { return lexeme; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getOffset() { return offset; }
    public int getLength() { return lexeme.length(); }

    /** 不含 */
    public int getEndOffset() {
        return offset + lexeme.length();
    }

    /**
     * 随 token 类型而定：
     * INT_LITERAL 为 Integer，DOUBLE_LITERAL 为 Double，STRING_LITERAL 为反转义后的 String，
     * 注解类 token 为注解名（不含 @），ERROR 为错误描述，其余为 null
     */
    public Object getLiteral() {
        return literal;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    /** 注释：解析和静态检查前滤掉，格式化和高亮时保留 */
    public boolean isTrivia() {
        return type == TokenType.COMMENT;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(type).append(" '").append(lexeme).append('\'');
        if (literal != null && type != TokenType.ERROR) {
            sb.append(" = ").append(literal);
        }
        return sb.append(" @").append(line).append(':').append(column).toString();
    }
}
