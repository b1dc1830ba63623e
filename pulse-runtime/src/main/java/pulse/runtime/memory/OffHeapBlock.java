package pulse.runtime.memory;

/**
 * 堆外内存块
 */
public final class OffHeapBlock {

    private final int id;
    private int size;
    private byte[] buffer;
    private boolean allocated;
    private long lastTouched;

    OffHeapBlock(int id, int size, long now) {
        this.id = id;
        this.size = size;
        this.buffer = new byte[size];
        this.allocated = true;
        this.lastTouched = now;
    }

    public int getId() { return id; }
    public int getSize() { return size; }
    public boolean isAllocated() { return allocated; }
    public long getLastTouched() { return lastTouched; }

    byte[] buffer() {
        return buffer;
    }

    void markAllocated(long now) {
        allocated = true;
        lastTouched = now;
    }

    void touch(long now) {
        lastTouched = now;
    }

    void markFree() {
        allocated = false;
    }

    /**
     * 吸收相邻空闲块；合并后内容清零
     */
    void absorb(OffHeapBlock other) {
        size += other.size;
        buffer = new byte[size];
    }

    @Override
    public String toString() {
        return "offheap_" + id + "(" + size + "B, " + (allocated ? "allocated" : "free") + ")";
    }
}
