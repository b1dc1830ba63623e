package com.pulselang.compiler.ast;

/**
 * 节点在源码中的位置：起始 token 的行列和字符区间
 *
 * <p>行列从 1 开始；{@link #UNKNOWN} 的行号为 0。</p>
 */
public final class SourceLocation {

    public static final SourceLocation UNKNOWN = new SourceLocation(null, 0, 0, 0, 0);

    private final String file;
    private final int line;
    private final int column;
    private final int offset;
    private final int length;

    public SourceLocation(String file, int line, int column, int offset, int length) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.length = length;
    }

    /** 未命名源码为 null */
    public String getFile() { return file; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getOffset() { return offset; }
    public int getLength() { return length; }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation other = (SourceLocation) o;
        return line == other.line && column == other.column
                && offset == other.offset && length == other.length
                && (file == null ? other.file == null : file.equals(other.file));
    }

    @Override
    public int hashCode() {
        int h = file != null ? file.hashCode() : 0;
        h = 31 * h + line;
        h = 31 * h + column;
        return 31 * h + offset;
    }

    /** {@code file:line:column}，未命名源码为 {@code <pulse>} */
    @Override
    public String toString() {
        return (file != null ? file : "<pulse>") + ":" + line + ":" + column;
    }
}
