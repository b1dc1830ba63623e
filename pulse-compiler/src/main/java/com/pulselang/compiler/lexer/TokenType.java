package com.pulselang.compiler.lexer;

/**
 * PulseLang 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    DOUBLE_LITERAL,
    STRING_LITERAL,

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 - 声明与修饰符 ===
    KW_CLASS, KW_PUBLIC, KW_PRIVATE, KW_STATIC, KW_NEW, KW_THIS,

    // === 关键词 - 控制流 ===
    KW_IF, KW_ELSE, KW_WHILE, KW_FOR, KW_RETURN,

    // === 关键词 - 常量 ===
    KW_TRUE, KW_FALSE, KW_NULL,

    // === 关键词 - 内置类型 ===
    KW_VOID, KW_INT, KW_DOUBLE, KW_BOOLEAN, KW_STRING,

    // === 注解（sigil 与名称合为一个 token）===
    ANN_DEADLINE,       // @Deadline
    ANN_SENSOR,         // @Sensor
    ANN_SAFETY_CHECK,   // @SafetyCheck
    ANN_REAL_TIME,      // @RealTime
    ANNOTATION,         // 其他 @name

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    MOD,            // %
    INC,            // ++
    DEC,            // --

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 操作符 - 逻辑 ===
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // === 操作符 - 赋值 ===
    ASSIGN,         // =

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    LBRACE,         // {
    RBRACE,         // }
    LBRACKET,       // [
    RBRACKET,       // ]
    COMMA,          // ,
    DOT,            // .
    SEMICOLON,      // ;

    // === 特殊 ===
    COMMENT,
    EOF,
    ERROR;

    /**
     * 是否为注解（包括通用注解）
     */
    public boolean isAnnotation() {
        switch (this) {
            case ANN_DEADLINE:
            case ANN_SENSOR:
            case ANN_SAFETY_CHECK:
            case ANN_REAL_TIME:
            case ANNOTATION:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为类型关键词（含 void）
     */
    public boolean isTypeKeyword() {
        switch (this) {
            case KW_VOID:
            case KW_INT:
            case KW_DOUBLE:
            case KW_BOOLEAN:
            case KW_STRING:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为比较操作符
     */
    public boolean isComparisonOp() {
        switch (this) {
            case LT:
            case GT:
            case LE:
            case GE:
                return true;
            default:
                return false;
        }
    }
}
