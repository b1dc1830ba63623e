package pulse.runtime.interpreter;

import pulse.runtime.memory.OffHeapUsage;

import java.util.Locale;

/**
 * 托管堆和堆外区域的即时用量
 */
public final class HeapStatus {

    private final long used;
    private final long max;
    private final double percentage;
    private final OffHeapUsage offHeap;

    public HeapStatus(long used, long max, OffHeapUsage offHeap) {
        this.used = used;
        this.max = max;
        this.percentage = max > 0 ? used * 100.0 / max : 0.0;
        this.offHeap = offHeap;
    }

    public long getUsed() { return used; }
    public long getMax() { return max; }
    public double getPercentage() { return percentage; }
    public OffHeapUsage getOffHeap() { return offHeap; }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Heap: %d/%d bytes (%.1f%%), off-heap: %s",
                used, max, percentage, offHeap);
    }
}
