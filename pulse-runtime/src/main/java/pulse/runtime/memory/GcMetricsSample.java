package pulse.runtime.memory;

/**
 * 一次收集周期的指标
 *
 * <p>{@code simulated} 为 true 的样本由代码复杂度估算得出，并非真实收集。</p>
 */
public final class GcMetricsSample {

    private final double pauseTimeMs;
    private final double heapUsagePct;
    private final double offHeapUsagePct;
    private final long collections;
    private final long allocatedCount;
    private final long freedCount;
    private final double compactionTimeMs;
    private final long timestamp;
    private final boolean simulated;

    public GcMetricsSample(double pauseTimeMs, double heapUsagePct, double offHeapUsagePct,
                           long collections, long allocatedCount, long freedCount,
                           double compactionTimeMs, long timestamp, boolean simulated) {
        this.pauseTimeMs = pauseTimeMs;
        this.heapUsagePct = heapUsagePct;
        this.offHeapUsagePct = offHeapUsagePct;
        this.collections = collections;
        this.allocatedCount = allocatedCount;
        this.freedCount = freedCount;
        this.compactionTimeMs = compactionTimeMs;
        this.timestamp = timestamp;
        this.simulated = simulated;
    }

    public double getPauseTimeMs() { return pauseTimeMs; }
    public double getHeapUsagePct() { return heapUsagePct; }
    public double getOffHeapUsagePct() { return offHeapUsagePct; }
    /** 截至本样本的累计收集次数 */
    public long getCollections() { return collections; }
    public long getAllocatedCount() { return allocatedCount; }
    /** 截至本样本的累计回收对象数 */
    public long getFreedCount() { return freedCount; }
    public double getCompactionTimeMs() { return compactionTimeMs; }
    public long getTimestamp() { return timestamp; }
    public boolean isSimulated() { return simulated; }
}
