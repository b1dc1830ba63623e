package pulse.runtime.memory;

import java.util.function.DoubleSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按代码复杂度估算的演示用指标
 *
 * <p>仅在配置开启且本次运行没有发生任何真实收集时使用，
 * 产出的样本带 {@code simulated} 标记，不与真实样本混合。</p>
 */
public final class SimulatedMetrics {

    private static final Pattern VARIABLE = Pattern.compile("\\b(int|String|boolean|double)\\s+\\w+");
    private static final Pattern LOOP = Pattern.compile("\\b(for|while)\\s*\\(");
    private static final Pattern METHOD = Pattern.compile("\\bvoid\\s+\\w+\\s*\\(");

    private SimulatedMetrics() {
    }

    /**
     * 复杂度 = 变量声明数 + 2 × 循环数 + 3 × void 方法数，至少为 1
     */
    public static int complexity(String source) {
        int variables = count(VARIABLE, source);
        int loops = count(LOOP, source);
        int methods = count(METHOD, source);
        return Math.max(1, variables + loops * 2 + methods * 3);
    }

    /**
     * @param random 取值 [0, 1) 的随机源
     */
    public static GcMetricsSample estimate(String source, DoubleSupplier random, long timestamp) {
        int complexity = complexity(source);
        return new GcMetricsSample(
                0.4 + random.getAsDouble() * 0.6,
                clamp(complexity * 2.5 + random.getAsDouble() * 10, 8, 45),
                clamp(complexity * 1.2 + random.getAsDouble() * 5, 2, 25),
                1,
                complexity * 2L,
                (long) Math.floor(complexity * 0.3),
                0.1 + random.getAsDouble() * 0.3,
                timestamp,
                true);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static int count(Pattern pattern, String source) {
        Matcher matcher = pattern.matcher(source);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
