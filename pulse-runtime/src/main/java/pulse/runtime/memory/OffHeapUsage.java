package pulse.runtime.memory;

/**
 * 堆外区域用量快照
 *
 * <p>{@code allocated + free == total}；fragmentation 为空闲链表中的块数
 * 占全部已切分块数的比例（0..1）。</p>
 */
public final class OffHeapUsage {

    private final long allocated;
    private final long free;
    private final long total;
    private final double fragmentation;

    public OffHeapUsage(long allocated, long free, long total, double fragmentation) {
        this.allocated = allocated;
        this.free = free;
        this.total = total;
        this.fragmentation = fragmentation;
    }

    public long getAllocated() { return allocated; }
    public long getFree() { return free; }
    public long getTotal() { return total; }
    public double getFragmentation() { return fragmentation; }

    public double getUsagePercent() {
        return total == 0 ? 0.0 : allocated * 100.0 / total;
    }

    @Override
    public String toString() {
        return "OffHeapUsage{allocated=" + allocated + ", free=" + free + ", total=" + total
                + ", fragmentation=" + fragmentation + "}";
    }
}
