package pulse.runtime.memory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 固定容量的堆外内存区域
 *
 * <p>分配优先复用第一个足够大的空闲块（沿用原块 id），否则在剩余容量中切分新块；
 * 都不满足时返回空，调用方可以恢复。不变量：{@code allocated + free == total}。</p>
 */
public final class OffHeapMemoryManager {

    private static final Logger LOG = Logger.getLogger(OffHeapMemoryManager.class.getName());

    private final long capacity;
    private final LongSupplier clock;
    private final Map<Integer, OffHeapBlock> allocatedBlocks = new LinkedHashMap<Integer, OffHeapBlock>();
    private final List<OffHeapBlock> freeBlocks = new ArrayList<OffHeapBlock>();
    /** 已切分出去的字节数（含空闲链表中的块） */
    private long carved;
    private int nextId;

    public OffHeapMemoryManager(long capacity) {
        this(capacity, System::currentTimeMillis);
    }

    public OffHeapMemoryManager(long capacity, LongSupplier clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Off-heap capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    /**
     * 分配至少 size 字节的块
     *
     * @return 块 id；空间不足时为空
     */
    public OptionalInt allocate(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Allocation size must be positive: " + size);
        }
        for (int i = 0; i < freeBlocks.size(); i++) {
            OffHeapBlock block = freeBlocks.get(i);
            if (block.getSize() >= size) {
                freeBlocks.remove(i);
                block.markAllocated(clock.getAsLong());
                allocatedBlocks.put(block.getId(), block);
                return OptionalInt.of(block.getId());
            }
        }

        if (carved + size > capacity) {
            LOG.log(Level.FINE, "Off-heap arena cannot fit {0} bytes ({1} of {2} carved)",
                    new Object[]{size, carved, capacity});
            return OptionalInt.empty();
        }

        OffHeapBlock block = new OffHeapBlock(nextId++, size, clock.getAsLong());
        allocatedBlocks.put(block.getId(), block);
        carved += size;
        return OptionalInt.of(block.getId());
    }

    /**
     * 释放块并放回空闲链表
     *
     * @return 块存在且处于分配状态时为 true
     */
    public boolean deallocate(int blockId) {
        OffHeapBlock block = allocatedBlocks.remove(blockId);
        if (block == null) {
            return false;
        }
        block.markFree();
        freeBlocks.add(block);
        return true;
    }

    /**
     * 读取块内 [offset, offset + length)
     *
     * @return 越界或块未分配时为空
     */
    public Optional<byte[]> read(int blockId, int offset, int length) {
        OffHeapBlock block = allocatedBlocks.get(blockId);
        if (block == null || offset < 0 || length < 0 || offset + length > block.getSize()) {
            return Optional.empty();
        }
        block.touch(clock.getAsLong());
        return Optional.of(Arrays.copyOfRange(block.buffer(), offset, offset + length));
    }

    /**
     * 写入块内 offset 处
     *
     * @return 越界或块未分配时为 false，块内容不变
     */
    public boolean write(int blockId, int offset, byte[] data) {
        OffHeapBlock block = allocatedBlocks.get(blockId);
        if (block == null || offset < 0 || offset + data.length > block.getSize()) {
            return false;
        }
        System.arraycopy(data, 0, block.buffer(), offset, data.length);
        block.touch(clock.getAsLong());
        return true;
    }

    /**
     * 整理空闲链表：按大小升序排列，合并相邻块直到合并后大小超过容量
     *
     * @return 合并次数
     */
    public int defragment() {
        freeBlocks.sort(Comparator.comparingInt(OffHeapBlock::getSize));
        int merged = 0;
        int i = 0;
        while (i < freeBlocks.size() - 1) {
            OffHeapBlock current = freeBlocks.get(i);
            OffHeapBlock next = freeBlocks.get(i + 1);
            if ((long) current.getSize() + next.getSize() <= capacity) {
                current.absorb(next);
                freeBlocks.remove(i + 1);
                merged++;
            } else {
                i++;
            }
        }
        return merged;
    }

    public OffHeapUsage getUsage() {
        long allocated = 0;
        for (OffHeapBlock block : allocatedBlocks.values()) {
            allocated += block.getSize();
        }
        int blockCount = allocatedBlocks.size() + freeBlocks.size();
        double fragmentation = (double) freeBlocks.size() / Math.max(1, blockCount);
        return new OffHeapUsage(allocated, capacity - allocated, capacity, fragmentation);
    }

    public Optional<OffHeapBlock> getBlock(int blockId) {
        OffHeapBlock block = allocatedBlocks.get(blockId);
        if (block != null) {
            return Optional.of(block);
        }
        for (OffHeapBlock free : freeBlocks) {
            if (free.getId() == blockId) {
                return Optional.of(free);
            }
        }
        return Optional.empty();
    }

    public List<OffHeapBlock> getFreeBlocks() {
        return Collections.unmodifiableList(freeBlocks);
    }

    public long getCapacity() {
        return capacity;
    }

    public void clear() {
        allocatedBlocks.clear();
        freeBlocks.clear();
        carved = 0;
        nextId = 0;
    }
}
