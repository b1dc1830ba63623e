package pulse.runtime.memory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * 有界指标日志，只保留最近的若干样本
 */
public final class GcMetricsLog {

    private final int capacity;
    private final Deque<GcMetricsSample> samples;

    public GcMetricsLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Metrics history must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.samples = new ArrayDeque<GcMetricsSample>(capacity);
    }

    public void add(GcMetricsSample sample) {
        if (samples.size() == capacity) {
            samples.removeFirst();
        }
        samples.addLast(sample);
    }

    /** 由旧到新 */
    public List<GcMetricsSample> getSamples() {
        return Collections.unmodifiableList(new ArrayList<GcMetricsSample>(samples));
    }

    public boolean hasRealSamples() {
        for (GcMetricsSample sample : samples) {
            if (!sample.isSimulated()) return true;
        }
        return false;
    }

    public int size() {
        return samples.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public void clear() {
        samples.clear();
    }
}
