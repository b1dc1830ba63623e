package pulse.runtime.memory;

import pulse.runtime.PulseArray;
import pulse.runtime.PulseObject;
import pulse.runtime.PulseValue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 标记-清除收集器，带大对象堆外晋升
 *
 * <p>一个周期：(1) 标记：与根集合中某个值引用相同的对象可达，数组元素和对象字段
 * 递归计入根集合；(2) 晋升：可达且大于晋升阈值的对象搬到堆外区域，区域放不下时留在堆上；
 * (3) 清除：不可达对象移出登记表并释放其堆外块；(4) 整理堆外空闲链表。
 * 暂停时间为 (1)–(3) 的耗时，整理耗时单独记录。</p>
 */
public final class GarbageCollector {

    private static final Logger LOG = Logger.getLogger(GarbageCollector.class.getName());

    private static final double NANOS_PER_MS = 1_000_000.0;

    private final ManagedHeap heap;
    private final OffHeapMemoryManager offHeap;
    private final GcMetricsLog metricsLog;
    private final double gcThreshold;
    private final int promotionThreshold;
    private final LongSupplier nanoTicker;
    private final LongSupplier clock;

    private long collections;
    private long freedCount;
    private long promotedCount;

    public GarbageCollector(ManagedHeap heap, OffHeapMemoryManager offHeap, GcMetricsLog metricsLog,
                            double gcThreshold, int promotionThreshold,
                            LongSupplier nanoTicker, LongSupplier clock) {
        this.heap = heap;
        this.offHeap = offHeap;
        this.metricsLog = metricsLog;
        this.gcThreshold = gcThreshold;
        this.promotionThreshold = promotionThreshold;
        this.nanoTicker = nanoTicker;
        this.clock = clock;
    }

    /**
     * 堆用量是否超过阈值
     */
    public boolean shouldCollect() {
        return heap.getUsed() > gcThreshold * heap.getBudget();
    }

    /**
     * 执行一次完整收集并记录样本
     *
     * @param roots 当前所有绑定的值
     */
    public GcMetricsSample collect(Collection<PulseValue> roots) {
        long start = nanoTicker.getAsLong();

        Set<PulseValue> reachable = trace(roots);
        List<HeapObject> live = new ArrayList<HeapObject>();
        List<HeapObject> dead = new ArrayList<HeapObject>();
        for (HeapObject object : heap.getObjects()) {
            if (reachable.contains(object.getValue())) {
                live.add(object);
            } else {
                dead.add(object);
            }
        }

        int promoted = 0;
        for (HeapObject object : live) {
            if (!object.isOffHeap() && object.getSize() > promotionThreshold && promote(object)) {
                promoted++;
            }
        }

        for (HeapObject object : dead) {
            if (object.isOffHeap()) {
                offHeap.deallocate(object.getOffHeapBlockId());
            }
            heap.remove(object);
        }

        long sweepEnd = nanoTicker.getAsLong();
        int merged = offHeap.defragment();
        long compactionEnd = nanoTicker.getAsLong();

        collections++;
        freedCount += dead.size();
        promotedCount += promoted;

        GcMetricsSample sample = new GcMetricsSample(
                (sweepEnd - start) / NANOS_PER_MS,
                heap.getUsagePercent(),
                offHeap.getUsage().getUsagePercent(),
                collections,
                heap.getAllocatedCount(),
                freedCount,
                (compactionEnd - sweepEnd) / NANOS_PER_MS,
                clock.getAsLong(),
                false);
        metricsLog.add(sample);

        LOG.log(Level.FINE, "GC #{0}: freed {1}, promoted {2}, merged {3} free blocks, heap {4}/{5} bytes",
                new Object[]{collections, dead.size(), promoted, merged, heap.getUsed(), heap.getBudget()});
        return sample;
    }

    private boolean promote(HeapObject object) {
        OptionalInt blockId = offHeap.allocate(object.getSize());
        if (!blockId.isPresent()) {
            LOG.log(Level.FINE, "Promotion of {0} skipped, off-heap arena is full", object);
            return false;
        }
        byte[] content = object.getValue().toString().getBytes(StandardCharsets.UTF_8);
        offHeap.write(blockId.getAsInt(), 0, Arrays.copyOf(content, Math.min(content.length, object.getSize())));
        heap.markPromoted(object, blockId.getAsInt());
        return true;
    }

    /**
     * 根集合加上从根出发经数组元素和对象字段可达的全部值（按引用）
     */
    static Set<PulseValue> trace(Collection<PulseValue> roots) {
        Set<PulseValue> seen = Collections.newSetFromMap(new IdentityHashMap<PulseValue, Boolean>());
        Deque<PulseValue> pending = new ArrayDeque<PulseValue>(roots);
        while (!pending.isEmpty()) {
            PulseValue value = pending.pop();
            if (!seen.add(value)) {
                continue;
            }
            if (value instanceof PulseArray) {
                pending.addAll(((PulseArray) value).getElements());
            } else if (value instanceof PulseObject) {
                pending.addAll(((PulseObject) value).getFields().values());
            }
        }
        return seen;
    }

    public long getCollections() {
        return collections;
    }

    public long getFreedCount() {
        return freedCount;
    }

    public long getPromotedCount() {
        return promotedCount;
    }
}
