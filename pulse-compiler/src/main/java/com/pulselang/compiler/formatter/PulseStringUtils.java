package com.pulselang.compiler.formatter;

import java.math.BigDecimal;

/**
 * PulseLang 源码字符串转义工具
 */
public final class PulseStringUtils {

    private PulseStringUtils() {}

    /** 转义字符串内容（用于双引号包裹的字符串），结果可被词法分析器还原 */
    public static String escapeString(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\0': sb.append("\\0"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    /** 双精度字面量的源码形式：无指数，总带小数点 */
    public static String formatDouble(double value) {
        String plain = BigDecimal.valueOf(value).toPlainString();
        return plain.indexOf('.') >= 0 ? plain : plain + ".0";
    }
}
