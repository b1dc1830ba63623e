package com.pulselang.compiler.formatter;

/**
 * 打印上下文，跟踪输出缓冲区和缩进层级
 */
public class PrinterContext {
    private final StringBuilder output = new StringBuilder();
    private final String indentUnit;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public PrinterContext(PrintConfig config) {
        this.indentUnit = config.indentUnit();
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            for (int i = 0; i < indentLevel; i++) {
                output.append(indentUnit);
            }
            atLineStart = false;
        }
        output.append(text);
    }

    public void newLine() {
        output.append("\n");
        atLineStart = true;
    }

    /**
     * 追加空行，不产生连续多个空行
     */
    public void blankLine() {
        if (output.length() == 0) {
            return;
        }
        if (output.charAt(output.length() - 1) != '\n') {
            output.append("\n");
        }
        if (output.length() >= 2 && output.charAt(output.length() - 2) == '\n') {
            atLineStart = true;
            return;
        }
        output.append("\n");
        atLineStart = true;
    }

    public String getOutput() {
        return output.toString();
    }
}
