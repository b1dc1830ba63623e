package com.pulselang.compiler.parser;

import com.pulselang.compiler.analysis.Diagnostic;

/**
 * 容错解析收集到的一条语法错误
 */
public final class ParseError {

    private final String message;
    private final int line;
    private final int column;

    public ParseError(String message, int line, int column) {
        this.message = message;
        this.line = line;
        this.column = column;
    }

    static ParseError from(ParseException e) {
        return new ParseError(e.getRawMessage(), e.getLine(), e.getColumn());
    }

    /** 不含位置 */
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    /** 以 ERROR 级诊断的形式与静态检查结果一起报告 */
    public Diagnostic toDiagnostic() {
        return new Diagnostic(Diagnostic.Severity.ERROR, message, line, column);
    }

    @Override
    public String toString() {
        return "Line " + line + ", column " + column + ": " + message;
    }
}
