package pulse.runtime.safety;

/**
 * 求值器在操作前请求的检查种类
 */
public enum CheckKind {
    /** 除法和取模之前 */
    DIVISION,
    /** 数组下标访问之前 */
    ARRAY_ACCESS,
    /** 方法入口（调用深度） */
    METHOD_CALL,
    /** 每次绑定 */
    MEMORY_ALLOCATION,
    /** 对值做成员访问或方法调用之前 */
    NULL_ACCESS
}
