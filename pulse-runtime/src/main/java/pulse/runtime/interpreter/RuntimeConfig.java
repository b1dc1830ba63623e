package pulse.runtime.interpreter;

import java.util.Locale;
import java.util.Properties;

/**
 * 运行时资源配置
 *
 * <p>控制循环上限、调用深度、堆和堆外预算、快照和指标历史容量。</p>
 *
 * <p>使用示例：</p>
 * <pre>
 * // 预定义配置
 * PulseInterpreter interp = new PulseInterpreter(RuntimeConfig.embedded());
 *
 * // 自定义配置
 * RuntimeConfig config = RuntimeConfig.custom()
 *     .maxLoopIterations(500)
 *     .heapBudget(64 * 1024)
 *     .build();
 *
 * // 从 properties 文件读取 pulse.* 键
 * RuntimeConfig config = RuntimeConfig.fromProperties(props);
 * </pre>
 */
public final class RuntimeConfig {

    /** 配置档 */
    public enum Profile { STANDARD, EMBEDDED, CUSTOM }

    public static final String PROFILE = "pulse.profile";
    public static final String MAX_LOOP_ITERATIONS = "pulse.maxLoopIterations";
    public static final String MAX_CALL_DEPTH = "pulse.maxCallDepth";
    public static final String HEAP_BUDGET = "pulse.heap.budget";
    public static final String GC_THRESHOLD = "pulse.heap.gcThreshold";
    public static final String PROMOTION_THRESHOLD = "pulse.heap.promotionThreshold";
    public static final String OFF_HEAP_CAPACITY = "pulse.offheap.capacity";
    public static final String SNAPSHOT_CAPACITY = "pulse.snapshots.capacity";
    public static final String METRICS_HISTORY = "pulse.metrics.history";
    public static final String SIMULATED_METRICS = "pulse.metrics.simulated";

    private final Profile profile;

    // --- 执行限制 ---
    private final long maxLoopIterations;
    private final int maxCallDepth;

    // --- 内存 ---
    private final long heapBudget;
    private final double gcThreshold;
    private final int promotionThreshold;
    private final long offHeapCapacity;

    // --- 历史 ---
    private final int snapshotCapacity;
    private final int metricsHistory;
    private final boolean simulatedMetrics;

    private RuntimeConfig(Builder builder) {
        this.profile = builder.profile;
        this.maxLoopIterations = builder.maxLoopIterations;
        this.maxCallDepth = builder.maxCallDepth;
        this.heapBudget = builder.heapBudget;
        this.gcThreshold = builder.gcThreshold;
        this.promotionThreshold = builder.promotionThreshold;
        this.offHeapCapacity = builder.offHeapCapacity;
        this.snapshotCapacity = builder.snapshotCapacity;
        this.metricsHistory = builder.metricsHistory;
        this.simulatedMetrics = builder.simulatedMetrics;
    }

    // ============ 预定义工厂方法 ============

    /** 标准配置：1 MiB 堆，512 KiB 堆外区域 */
    public static RuntimeConfig standard() {
        return new Builder(Profile.STANDARD).build();
    }

    /** 嵌入式配置：更小的预算和更严格的循环上限 */
    public static RuntimeConfig embedded() {
        return new Builder(Profile.EMBEDDED)
                .maxLoopIterations(1_000)
                .maxCallDepth(64)
                .heapBudget(256 * 1024)
                .offHeapCapacity(128 * 1024)
                .snapshotCapacity(256)
                .build();
    }

    /** 自定义配置 Builder，初始值同标准配置 */
    public static Builder custom() {
        return new Builder(Profile.CUSTOM);
    }

    public static RuntimeConfig forProfile(Profile profile) {
        switch (profile) {
            case EMBEDDED: return embedded();
            case CUSTOM: return custom().build();
            default: return standard();
        }
    }

    /**
     * 从 {@code pulse.*} 键读取配置，未给出的键取 {@code pulse.profile} 对应预设的值
     *
     * @throws IllegalArgumentException 键值无法解析或超出范围
     */
    public static RuntimeConfig fromProperties(Properties props) {
        String profileName = props.getProperty(PROFILE, "standard").trim();
        Profile profile;
        try {
            profile = Profile.valueOf(profileName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown profile '" + profileName + "' for " + PROFILE, e);
        }

        Builder builder = forProfile(profile).toBuilder();
        if (props.containsKey(MAX_LOOP_ITERATIONS)) {
            builder.maxLoopIterations(parseLong(props, MAX_LOOP_ITERATIONS));
        }
        if (props.containsKey(MAX_CALL_DEPTH)) {
            builder.maxCallDepth((int) parseLong(props, MAX_CALL_DEPTH));
        }
        if (props.containsKey(HEAP_BUDGET)) {
            builder.heapBudget(parseLong(props, HEAP_BUDGET));
        }
        if (props.containsKey(GC_THRESHOLD)) {
            builder.gcThreshold(parseDouble(props, GC_THRESHOLD));
        }
        if (props.containsKey(PROMOTION_THRESHOLD)) {
            builder.promotionThreshold((int) parseLong(props, PROMOTION_THRESHOLD));
        }
        if (props.containsKey(OFF_HEAP_CAPACITY)) {
            builder.offHeapCapacity(parseLong(props, OFF_HEAP_CAPACITY));
        }
        if (props.containsKey(SNAPSHOT_CAPACITY)) {
            builder.snapshotCapacity((int) parseLong(props, SNAPSHOT_CAPACITY));
        }
        if (props.containsKey(METRICS_HISTORY)) {
            builder.metricsHistory((int) parseLong(props, METRICS_HISTORY));
        }
        if (props.containsKey(SIMULATED_METRICS)) {
            String value = props.getProperty(SIMULATED_METRICS).trim();
            if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
                throw invalid(SIMULATED_METRICS, value, null);
            }
            builder.simulatedMetrics(Boolean.parseBoolean(value));
        }
        return builder.build();
    }

    private static long parseLong(Properties props, String key) {
        String value = props.getProperty(key).trim();
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw invalid(key, value, e);
        }
    }

    private static double parseDouble(Properties props, String key) {
        String value = props.getProperty(key).trim();
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw invalid(key, value, e);
        }
    }

    private static IllegalArgumentException invalid(String key, String value, Throwable cause) {
        return new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", cause);
    }

    /** 以当前配置为初始值的 Builder，档位保持不变 */
    public Builder toBuilder() {
        Builder builder = new Builder(profile);
        builder.maxLoopIterations = maxLoopIterations;
        builder.maxCallDepth = maxCallDepth;
        builder.heapBudget = heapBudget;
        builder.gcThreshold = gcThreshold;
        builder.promotionThreshold = promotionThreshold;
        builder.offHeapCapacity = offHeapCapacity;
        builder.snapshotCapacity = snapshotCapacity;
        builder.metricsHistory = metricsHistory;
        builder.simulatedMetrics = simulatedMetrics;
        return builder;
    }

    // ============ 查询方法 ============

    public Profile getProfile() { return profile; }
    public long getMaxLoopIterations() { return maxLoopIterations; }
    public int getMaxCallDepth() { return maxCallDepth; }
    public long getHeapBudget() { return heapBudget; }
    public double getGcThreshold() { return gcThreshold; }
    public int getPromotionThreshold() { return promotionThreshold; }
    public long getOffHeapCapacity() { return offHeapCapacity; }
    public int getSnapshotCapacity() { return snapshotCapacity; }
    public int getMetricsHistory() { return metricsHistory; }
    public boolean isSimulatedMetrics() { return simulatedMetrics; }

    @Override
    public String toString() {
        return "RuntimeConfig{profile=" + profile
                + ", maxLoopIterations=" + maxLoopIterations
                + ", maxCallDepth=" + maxCallDepth
                + ", heapBudget=" + heapBudget
                + ", gcThreshold=" + gcThreshold
                + ", promotionThreshold=" + promotionThreshold
                + ", offHeapCapacity=" + offHeapCapacity
                + ", snapshotCapacity=" + snapshotCapacity
                + ", metricsHistory=" + metricsHistory
                + ", simulatedMetrics=" + simulatedMetrics + "}";
    }

    // ============ Builder ============

    public static final class Builder {
        private Profile profile;
        private long maxLoopIterations = 10_000;
        private int maxCallDepth = 100;
        private long heapBudget = 1024 * 1024;
        private double gcThreshold = 0.7;
        private int promotionThreshold = 1024;
        private long offHeapCapacity = 512 * 1024;
        private int snapshotCapacity = 1_000;
        private int metricsHistory = 50;
        private boolean simulatedMetrics = false;

        private Builder(Profile profile) {
            this.profile = profile;
        }

        public Builder maxLoopIterations(long value) { this.maxLoopIterations = value; return this; }
        public Builder maxCallDepth(int value) { this.maxCallDepth = value; return this; }
        public Builder heapBudget(long value) { this.heapBudget = value; return this; }
        public Builder gcThreshold(double value) { this.gcThreshold = value; return this; }
        public Builder promotionThreshold(int value) { this.promotionThreshold = value; return this; }
        public Builder offHeapCapacity(long value) { this.offHeapCapacity = value; return this; }
        public Builder snapshotCapacity(int value) { this.snapshotCapacity = value; return this; }
        public Builder metricsHistory(int value) { this.metricsHistory = value; return this; }
        public Builder simulatedMetrics(boolean value) { this.simulatedMetrics = value; return this; }

        /**
         * @throws IllegalArgumentException 任一限制不为正，或 GC 阈值不在 (0, 1] 内
         */
        public RuntimeConfig build() {
            requirePositive(MAX_LOOP_ITERATIONS, maxLoopIterations);
            requirePositive(MAX_CALL_DEPTH, maxCallDepth);
            requirePositive(HEAP_BUDGET, heapBudget);
            requirePositive(PROMOTION_THRESHOLD, promotionThreshold);
            requirePositive(OFF_HEAP_CAPACITY, offHeapCapacity);
            requirePositive(SNAPSHOT_CAPACITY, snapshotCapacity);
            requirePositive(METRICS_HISTORY, metricsHistory);
            if (!(gcThreshold > 0.0 && gcThreshold <= 1.0)) {
                throw new IllegalArgumentException(GC_THRESHOLD + " must be in (0, 1]: " + gcThreshold);
            }
            return new RuntimeConfig(this);
        }

        private static void requirePositive(String key, long value) {
            if (value <= 0) {
                throw new IllegalArgumentException(key + " must be positive: " + value);
            }
        }
    }
}
