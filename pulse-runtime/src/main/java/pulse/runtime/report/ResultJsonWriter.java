package pulse.runtime.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.pulselang.compiler.analysis.Diagnostic;
import pulse.runtime.PulseValue;
import pulse.runtime.deadline.DeadlineViolation;
import pulse.runtime.interpreter.ExecutionResult;
import pulse.runtime.interpreter.HeapStatus;
import pulse.runtime.memory.GcMetricsSample;
import pulse.runtime.memory.OffHeapUsage;
import pulse.runtime.safety.SafetyViolation;
import pulse.runtime.timetravel.ExecutionSnapshot;

import java.util.Map;

/**
 * 把执行结果渲染为 JSON（{@code pulse run --json}）
 */
public final class ResultJsonWriter {

    private final Gson gson;
    private final boolean includeSnapshots;

    /**
     * @param includeSnapshots 是否输出完整的快照历史（可能很大）
     */
    public ResultJsonWriter(boolean includeSnapshots) {
        this.gson = new GsonBuilder()
                .setPrettyPrinting()
                .serializeNulls()
                .serializeSpecialFloatingPointValues()
                .create();
        this.includeSnapshots = includeSnapshots;
    }

    public String write(ExecutionResult result) {
        return gson.toJson(toJson(result));
    }

    public String write(HeapStatus status) {
        return gson.toJson(toJson(status));
    }

    public JsonObject toJson(ExecutionResult result) {
        JsonObject root = new JsonObject();
        root.addProperty("output", result.getOutput());
        root.addProperty("halted", result.isHalted());

        JsonArray diagnostics = new JsonArray();
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            JsonObject diag = new JsonObject();
            diag.addProperty("severity", diagnostic.getSeverity().name());
            diag.addProperty("message", diagnostic.getMessage());
            diag.addProperty("line", diagnostic.getLine());
            diag.addProperty("column", diagnostic.getColumn());
            diagnostics.add(diag);
        }
        root.add("diagnostics", diagnostics);

        JsonArray safety = new JsonArray();
        for (SafetyViolation violation : result.getSafetyViolations()) {
            JsonObject item = new JsonObject();
            item.addProperty("kind", violation.getKind().name());
            item.addProperty("severity", violation.getSeverity().name());
            item.addProperty("message", violation.getMessage());
            item.addProperty("line", violation.getLine());
            item.addProperty("timestamp", violation.getTimestamp());
            safety.add(item);
        }
        root.add("safetyViolations", safety);

        JsonArray deadlines = new JsonArray();
        for (DeadlineViolation violation : result.getDeadlineViolations()) {
            JsonObject item = new JsonObject();
            item.addProperty("method", violation.getMethodName());
            item.addProperty("expectedMs", violation.getExpectedMs());
            item.addProperty("actualMs", violation.getActualMs());
            item.addProperty("severity", violation.getSeverity().name());
            item.addProperty("line", violation.getLine());
            item.addProperty("timestamp", violation.getTimestamp());
            deadlines.add(item);
        }
        root.add("deadlineViolations", deadlines);

        JsonArray metrics = new JsonArray();
        for (GcMetricsSample sample : result.getGcMetrics()) {
            metrics.add(toJson(sample));
        }
        root.add("gcMetrics", metrics);

        root.addProperty("snapshotCount", result.getSnapshots().size());
        if (includeSnapshots) {
            JsonArray snapshots = new JsonArray();
            for (ExecutionSnapshot snapshot : result.getSnapshots()) {
                snapshots.add(toJson(snapshot));
            }
            root.add("snapshots", snapshots);
        }
        return root;
    }

    public JsonObject toJson(HeapStatus status) {
        JsonObject heap = new JsonObject();
        heap.addProperty("used", status.getUsed());
        heap.addProperty("max", status.getMax());
        heap.addProperty("percentage", status.getPercentage());
        OffHeapUsage usage = status.getOffHeap();
        JsonObject offHeap = new JsonObject();
        offHeap.addProperty("allocated", usage.getAllocated());
        offHeap.addProperty("free", usage.getFree());
        offHeap.addProperty("total", usage.getTotal());
        offHeap.addProperty("fragmentation", usage.getFragmentation());
        heap.add("offHeap", offHeap);
        return heap;
    }

    private JsonObject toJson(GcMetricsSample sample) {
        JsonObject item = new JsonObject();
        item.addProperty("pauseTimeMs", sample.getPauseTimeMs());
        item.addProperty("heapUsagePct", sample.getHeapUsagePct());
        item.addProperty("offHeapUsagePct", sample.getOffHeapUsagePct());
        item.addProperty("collections", sample.getCollections());
        item.addProperty("allocatedCount", sample.getAllocatedCount());
        item.addProperty("freedCount", sample.getFreedCount());
        item.addProperty("compactionTimeMs", sample.getCompactionTimeMs());
        item.addProperty("timestamp", sample.getTimestamp());
        item.addProperty("simulated", sample.isSimulated());
        return item;
    }

    private JsonObject toJson(ExecutionSnapshot snapshot) {
        JsonObject item = new JsonObject();
        item.addProperty("id", snapshot.getId());
        item.addProperty("timestamp", snapshot.getTimestamp());
        item.addProperty("line", snapshot.getLine());
        item.add("variables", values(snapshot.getVariables()));

        JsonArray callStack = new JsonArray();
        for (String frame : snapshot.getCallStack()) {
            callStack.add(frame);
        }
        item.add("callStack", callStack);
        item.add("heapState", values(snapshot.getHeapState()));
        item.addProperty("output", snapshot.getOutput());

        JsonObject gc = new JsonObject();
        gc.addProperty("heapUsagePct", snapshot.getGcState().getHeapUsagePct());
        gc.addProperty("allocatedObjects", snapshot.getGcState().getAllocatedObjects());
        gc.addProperty("freedObjects", snapshot.getGcState().getFreedObjects());
        item.add("gcState", gc);
        return item;
    }

    private JsonObject values(Map<String, PulseValue> values) {
        JsonObject object = new JsonObject();
        for (Map.Entry<String, PulseValue> entry : values.entrySet()) {
            object.add(entry.getKey(), gson.toJsonTree(entry.getValue().toJavaValue()));
        }
        return object;
    }
}
