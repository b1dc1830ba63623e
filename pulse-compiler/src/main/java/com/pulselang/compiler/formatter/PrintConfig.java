package com.pulselang.compiler.formatter;

/**
 * AstPrinter 的输出选项，setter 可链式调用
 */
public class PrintConfig {

    private int indentSize = 4;
    private boolean useSpaces = true;
    private boolean blankLineBetweenMethods = true;

    public int getIndentSize() {
        return indentSize;
    }

    /**
     * @throws IllegalArgumentException 负数
     */
    public PrintConfig setIndentSize(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must be >= 0: " + indentSize);
        }
        this.indentSize = indentSize;
        return this;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    /** false 时每层缩进一个 tab，忽略 indentSize */
    public PrintConfig setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
        return this;
    }

    public boolean isBlankLineBetweenMethods() {
        return blankLineBetweenMethods;
    }

    /** 同一类内相邻方法之间是否空一行（类与类之间总是空行） */
    public PrintConfig setBlankLineBetweenMethods(boolean blankLineBetweenMethods) {
        this.blankLineBetweenMethods = blankLineBetweenMethods;
        return this;
    }

    String indentUnit() {
        if (!useSpaces) {
            return "\t";
        }
        StringBuilder sb = new StringBuilder(indentSize);
        for (int i = 0; i < indentSize; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
