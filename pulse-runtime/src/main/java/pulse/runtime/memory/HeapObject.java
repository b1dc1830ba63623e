package pulse.runtime.memory;

import pulse.runtime.PulseValue;

/**
 * 堆登记表中的一个对象：一次绑定产生的值
 */
public final class HeapObject {

    /** 未晋升到堆外 */
    public static final int NO_BLOCK = -1;

    private final int id;
    private final PulseValue value;
    private final int size;
    private int offHeapBlockId = NO_BLOCK;

    HeapObject(int id, PulseValue value) {
        this.id = id;
        this.value = value;
        this.size = value.getSize();
    }

    public int getId() {
        return id;
    }

    public PulseValue getValue() {
        return value;
    }

    /** 登记时的名义大小 */
    public int getSize() {
        return size;
    }

    public int getOffHeapBlockId() {
        return offHeapBlockId;
    }

    public boolean isOffHeap() {
        return offHeapBlockId != NO_BLOCK;
    }

    void setOffHeapBlockId(int blockId) {
        this.offHeapBlockId = blockId;
    }

    @Override
    public String toString() {
        return "obj_" + id + "(" + value.getTypeName() + ", " + size + "B"
                + (isOffHeap() ? ", offheap_" + offHeapBlockId : "") + ")";
    }
}
