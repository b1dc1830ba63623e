package com.pulselang.compiler.ast;

/**
 * 声明修饰符
 */
public enum Modifier {
    PUBLIC("public"),
    PRIVATE("private"),
    STATIC("static");

    private final String keyword;

    Modifier(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
