package pulse.runtime.timetravel;

import pulse.runtime.PulseValue;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 某条语句执行后的完整状态副本
 *
 * <p>输出缓冲在一次运行内只追加，快照只记录当时的长度，读取时截取前缀。</p>
 */
public final class ExecutionSnapshot {

    private final String id;
    private final long timestamp;
    private final int line;
    private final Map<String, PulseValue> variables;
    private final List<String> callStack;
    private final Map<String, PulseValue> heapState;
    private final CharSequence outputSource;
    private final int outputLength;
    private final GcCounters gcState;

    ExecutionSnapshot(String id, long timestamp, int line, Map<String, PulseValue> variables,
                      List<String> callStack, Map<String, PulseValue> heapState,
                      CharSequence outputSource, int outputLength, GcCounters gcState) {
        this.id = id;
        this.timestamp = timestamp;
        this.line = line;
        this.variables = Collections.unmodifiableMap(variables);
        this.callStack = Collections.unmodifiableList(callStack);
        this.heapState = Collections.unmodifiableMap(heapState);
        this.outputSource = outputSource;
        this.outputLength = outputLength;
        this.gcState = gcState;
    }

    public String getId() { return id; }
    public long getTimestamp() { return timestamp; }
    public int getLine() { return line; }
    public Map<String, PulseValue> getVariables() { return variables; }
    /** 栈底在前 */
    public List<String> getCallStack() { return callStack; }
    public Map<String, PulseValue> getHeapState() { return heapState; }

    /** 截至本快照的输出 */
    public String getOutput() {
        return outputSource.subSequence(0, outputLength).toString();
    }

    public GcCounters getGcState() { return gcState; }

    @Override
    public String toString() {
        return id + " (line " + line + ", " + variables.size() + " variables)";
    }
}
