package pulse.runtime.memory;

import pulse.runtime.PulseValue;

import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 受管堆：对象登记表和用量记账
 *
 * <p>不变量：{@code used} 等于所有未晋升对象的大小之和。</p>
 */
public final class ManagedHeap {

    private final long budget;
    private final Map<Integer, HeapObject> objects = new LinkedHashMap<Integer, HeapObject>();
    /** 值到最近一次登记它的对象 */
    private final Map<PulseValue, HeapObject> byValue = new IdentityHashMap<PulseValue, HeapObject>();
    private int nextId = 1;
    private long used;
    private long allocatedCount;

    public ManagedHeap(long budget) {
        if (budget <= 0) {
            throw new IllegalArgumentException("Heap budget must be positive: " + budget);
        }
        this.budget = budget;
    }

    /**
     * 登记一个新绑定的值，容量检查由调用方负责
     */
    public HeapObject register(PulseValue value) {
        HeapObject object = new HeapObject(nextId++, value);
        objects.put(object.getId(), object);
        byValue.put(value, object);
        used += object.getSize();
        allocatedCount++;
        return object;
    }

    /**
     * 移除对象；在堆上的对象同时归还其用量
     */
    void remove(HeapObject object) {
        if (objects.remove(object.getId()) == null) {
            return;
        }
        if (byValue.get(object.getValue()) == object) {
            byValue.remove(object.getValue());
        }
        if (!object.isOffHeap()) {
            used -= object.getSize();
        }
    }

    /**
     * 对象已搬到堆外块 blockId，不再计入堆用量
     */
    void markPromoted(HeapObject object, int blockId) {
        if (!object.isOffHeap()) {
            object.setOffHeapBlockId(blockId);
            used -= object.getSize();
        }
    }

    public boolean wouldOverflow(long size) {
        return used + size > budget;
    }

    public Collection<HeapObject> getObjects() {
        return Collections.unmodifiableCollection(objects.values());
    }

    /**
     * 快照用的堆视图：给定值各自对应的已登记对象，键为 {@code obj_<id>}
     *
     * <p>只描述传入的值而不是整张登记表，登记表在两次收集之间可能很大。</p>
     */
    public Map<String, PulseValue> describe(Collection<PulseValue> values) {
        Map<String, PulseValue> result = new LinkedHashMap<String, PulseValue>();
        for (PulseValue value : values) {
            HeapObject object = byValue.get(value);
            if (object != null) {
                result.put("obj_" + object.getId(), value);
            }
        }
        return result;
    }

    /**
     * 值对应的已登记对象；值被多次登记时返回最近一次
     */
    public HeapObject find(PulseValue value) {
        return byValue.get(value);
    }

    public int getObjectCount() {
        return objects.size();
    }

    public long getUsed() {
        return used;
    }

    public long getBudget() {
        return budget;
    }

    /** 自创建（或 clear）以来登记过的对象总数 */
    public long getAllocatedCount() {
        return allocatedCount;
    }

    public double getUsagePercent() {
        return used * 100.0 / budget;
    }

    public void clear() {
        objects.clear();
        byValue.clear();
        nextId = 1;
        used = 0;
        allocatedCount = 0;
    }
}
