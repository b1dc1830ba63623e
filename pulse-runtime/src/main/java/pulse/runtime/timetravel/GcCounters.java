package pulse.runtime.timetravel;

/**
 * 快照时刻的 GC 计数
 */
public final class GcCounters {

    private final double heapUsagePct;
    private final long allocatedObjects;
    private final long freedObjects;

    public GcCounters(double heapUsagePct, long allocatedObjects, long freedObjects) {
        this.heapUsagePct = heapUsagePct;
        this.allocatedObjects = allocatedObjects;
        this.freedObjects = freedObjects;
    }

    public double getHeapUsagePct() { return heapUsagePct; }
    public long getAllocatedObjects() { return allocatedObjects; }
    public long getFreedObjects() { return freedObjects; }
}
