package pulse.runtime.timetravel;

import pulse.runtime.PulseValue;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * 执行历史记录器
 *
 * <p>固定容量的环形缓冲，满了覆盖最旧的快照。游标只在已记录的历史中移动，
 * 不会重新执行程序；移到两端时停在边界快照上。</p>
 */
public final class TimeTravelRecorder {

    private final ExecutionSnapshot[] ring;
    private final LongSupplier clock;
    /** 最旧快照在 ring 中的下标 */
    private int head;
    private int count;
    /** 游标的逻辑位置，0 为最旧 */
    private int cursor;
    private long nextId;

    public TimeTravelRecorder(int capacity) {
        this(capacity, System::currentTimeMillis);
    }

    public TimeTravelRecorder(int capacity, LongSupplier clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Snapshot capacity must be positive: " + capacity);
        }
        this.ring = new ExecutionSnapshot[capacity];
        this.clock = clock;
    }

    /**
     * 深拷贝输入并记录为最新快照，游标移到最新处
     *
     * @param output 只追加的输出缓冲，快照保存其当前长度
     * @return 快照 id（{@code snapshot_<n>}）
     */
    public String capture(int line, Map<String, PulseValue> variables, List<String> callStack,
                          Map<String, PulseValue> heapState, CharSequence output, GcCounters gcCounters) {
        // 共享一张副本表，变量和堆登记表中的同一实例复制后仍是同一实例
        Map<PulseValue, PulseValue> copies = new IdentityHashMap<PulseValue, PulseValue>();
        ExecutionSnapshot snapshot = new ExecutionSnapshot(
                "snapshot_" + nextId++,
                clock.getAsLong(),
                line,
                copyValues(variables, copies),
                new ArrayList<String>(callStack),
                copyValues(heapState, copies),
                output,
                output.length(),
                gcCounters);

        if (count < ring.length) {
            ring[(head + count) % ring.length] = snapshot;
            count++;
        } else {
            ring[head] = snapshot;
            head = (head + 1) % ring.length;
        }
        cursor = count - 1;
        return snapshot.getId();
    }

    private static Map<String, PulseValue> copyValues(Map<String, PulseValue> values,
                                                      Map<PulseValue, PulseValue> copies) {
        Map<String, PulseValue> result = new LinkedHashMap<String, PulseValue>();
        for (Map.Entry<String, PulseValue> entry : values.entrySet()) {
            PulseValue value = entry.getValue();
            PulseValue copy = copies.get(value);
            if (copy == null) {
                copy = value.deepCopy();
                copies.put(value, copy);
            }
            result.put(entry.getKey(), copy);
        }
        return result;
    }

    private ExecutionSnapshot at(int logicalIndex) {
        return ring[(head + logicalIndex) % ring.length];
    }

    public Optional<ExecutionSnapshot> stepBack() {
        if (count == 0) {
            return Optional.empty();
        }
        cursor = Math.max(0, cursor - 1);
        return Optional.of(at(cursor));
    }

    public Optional<ExecutionSnapshot> stepForward() {
        if (count == 0) {
            return Optional.empty();
        }
        cursor = Math.min(count - 1, cursor + 1);
        return Optional.of(at(cursor));
    }

    /**
     * 移动游标到指定快照；已被覆盖或不存在的 id 返回空，游标不动
     */
    public Optional<ExecutionSnapshot> jumpTo(String snapshotId) {
        for (int i = 0; i < count; i++) {
            if (at(i).getId().equals(snapshotId)) {
                cursor = i;
                return Optional.of(at(i));
            }
        }
        return Optional.empty();
    }

    public Optional<ExecutionSnapshot> current() {
        return count == 0 ? Optional.<ExecutionSnapshot>empty() : Optional.of(at(cursor));
    }

    /** 由旧到新 */
    public List<ExecutionSnapshot> all() {
        List<ExecutionSnapshot> result = new ArrayList<ExecutionSnapshot>(count);
        for (int i = 0; i < count; i++) {
            result.add(at(i));
        }
        return result;
    }

    /**
     * 时间戳落在 [fromMillis, toMillis] 内的快照
     */
    public List<ExecutionSnapshot> range(long fromMillis, long toMillis) {
        List<ExecutionSnapshot> result = new ArrayList<ExecutionSnapshot>();
        for (int i = 0; i < count; i++) {
            ExecutionSnapshot snapshot = at(i);
            if (snapshot.getTimestamp() >= fromMillis && snapshot.getTimestamp() <= toMillis) {
                result.add(snapshot);
            }
        }
        return result;
    }

    public List<MemoryUsagePoint> memoryUsageHistory() {
        List<MemoryUsagePoint> result = new ArrayList<MemoryUsagePoint>(count);
        for (int i = 0; i < count; i++) {
            ExecutionSnapshot snapshot = at(i);
            result.add(new MemoryUsagePoint(snapshot.getTimestamp(), snapshot.getGcState().getHeapUsagePct()));
        }
        return result;
    }

    public int size() {
        return count;
    }

    public int getCapacity() {
        return ring.length;
    }

    public void clear() {
        for (int i = 0; i < ring.length; i++) {
            ring[i] = null;
        }
        head = 0;
        count = 0;
        cursor = 0;
        nextId = 0;
    }

    /**
     * 某一时刻的堆使用率
     */
    public static final class MemoryUsagePoint {
        private final long timestamp;
        private final double heapUsagePct;

        public MemoryUsagePoint(long timestamp, double heapUsagePct) {
            this.timestamp = timestamp;
            this.heapUsagePct = heapUsagePct;
        }

        public long getTimestamp() {
            return timestamp;
        }

        public double getHeapUsagePct() {
            return heapUsagePct;
        }
    }
}
