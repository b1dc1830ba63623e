package pulse.runtime.interpreter;

import com.pulselang.compiler.ast.SourceLocation;
import com.pulselang.compiler.ast.decl.Program;
import pulse.runtime.PulseNull;
import pulse.runtime.PulseValue;
import pulse.runtime.deadline.DeadlineEnforcer;
import pulse.runtime.memory.GarbageCollector;
import pulse.runtime.memory.GcMetricsLog;
import pulse.runtime.memory.GcMetricsSample;
import pulse.runtime.memory.ManagedHeap;
import pulse.runtime.memory.OffHeapMemoryManager;
import pulse.runtime.safety.SafetyVerifier;
import pulse.runtime.safety.SafetyViolation;
import pulse.runtime.timetravel.GcCounters;
import pulse.runtime.timetravel.TimeTravelRecorder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 一次运行的全部可变状态
 *
 * <p>环境、输出、调用栈、堆登记表、堆外区域、快照环和违规列表都归同一个实例所有，
 * 每次 {@code interpret} 创建新实例，不存在跨运行的全局状态。</p>
 */
final class RuntimeState {

    private static final Logger LOG = Logger.getLogger(RuntimeState.class.getName());

    static final String SYSTEM_HALT = "SYSTEM HALT: Critical safety violation detected";

    final RuntimeConfig config;
    final RandomSource random;
    final Environment env = new Environment();
    final StringBuilder output = new StringBuilder();

    final ManagedHeap heap;
    final OffHeapMemoryManager offHeap;
    final GcMetricsLog gcLog;
    final GarbageCollector gc;
    final SafetyVerifier verifier;
    final DeadlineEnforcer deadlines;
    final TimeTravelRecorder recorder;
    final List<SafetyViolation> safetyViolations = new ArrayList<SafetyViolation>();

    /** 栈顶在前 */
    private final Deque<CallFrame> frames = new ArrayDeque<CallFrame>();

    Program program;

    private int realTimeDepth;
    private int safetyCheckDepth;
    private boolean collectionDeferred;

    RuntimeState(RuntimeConfig config, RandomSource random, LongSupplier nanoTicker, LongSupplier clock) {
        this.config = config;
        this.random = random;
        this.heap = new ManagedHeap(config.getHeapBudget());
        this.offHeap = new OffHeapMemoryManager(config.getOffHeapCapacity(), clock);
        this.gcLog = new GcMetricsLog(config.getMetricsHistory());
        this.gc = new GarbageCollector(heap, offHeap, gcLog, config.getGcThreshold(),
                config.getPromotionThreshold(), nanoTicker, clock);
        this.verifier = new SafetyVerifier(config.getMaxCallDepth(), config.getHeapBudget(), clock);
        this.deadlines = new DeadlineEnforcer(nanoTicker, clock);
        this.recorder = new TimeTravelRecorder(config.getSnapshotCapacity(), clock);
    }

    // ============ 输出 ============

    void print(String text) {
        output.append(text);
    }

    void println(String text) {
        output.append(text).append('\n');
    }

    // ============ 调用栈和注解状态 ============

    void pushFrame(CallFrame frame) {
        frames.push(frame);
    }

    /**
     * 弹出当前帧并还原它覆盖的绑定
     */
    void popFrame() {
        frames.pop().restore(env);
    }

    /** 顶层执行（字段初始化）时为 null */
    CallFrame currentFrame() {
        return frames.peek();
    }

    /** 栈底在前的帧名称 */
    List<String> callStackBottomFirst() {
        List<String> labels = new ArrayList<String>(frames.size());
        Iterator<CallFrame> it = frames.descendingIterator();
        while (it.hasNext()) {
            labels.add(it.next().getLabel());
        }
        return labels;
    }

    void enterRealTime() {
        realTimeDepth++;
    }

    /**
     * 最外层实时方法返回时补做推迟的收集
     */
    void exitRealTime() {
        realTimeDepth--;
        if (realTimeDepth == 0 && collectionDeferred) {
            collectionDeferred = false;
            if (gc.shouldCollect()) {
                collect();
            }
        }
    }

    void enterSafetyCheck() {
        safetyCheckDepth++;
    }

    void exitSafetyCheck() {
        safetyCheckDepth--;
    }

    // ============ 安全违规 ============

    /**
     * 记录并输出违规；CRITICAL（含 {@code @SafetyCheck} 内升级的 ERROR）终止执行
     *
     * @return 是否有违规（调用方据此使用回退值）
     * @throws SafetyHaltException 出现 CRITICAL 违规
     */
    boolean report(List<SafetyViolation> violations, SourceLocation loc) {
        for (SafetyViolation raw : violations) {
            SafetyViolation violation = safetyCheckDepth > 0 ? raw.escalate() : raw;
            safetyViolations.add(violation);
            println(violation.toString());
            if (violation.isCritical()) {
                LOG.log(Level.SEVERE, violation.toString());
                println(SYSTEM_HALT);
                throw new SafetyHaltException(violation, loc);
            }
            LOG.log(Level.WARNING, violation.toString());
        }
        return !violations.isEmpty();
    }

    // ============ 内存 ============

    /**
     * 为一次绑定登记堆对象；已登记的值（别名绑定）不重复计入。放不下时先收集一次再检查
     *
     * @return 原值，便于链式使用
     */
    PulseValue allocate(PulseValue value, SourceLocation loc) {
        if (value instanceof PulseNull || heap.find(value) != null) {
            return value;
        }
        int size = value.getSize();
        if (heap.wouldOverflow(size)) {
            collect();
        }
        report(verifier.checkAllocation(size, heap.getUsed(), loc.getLine()), loc);
        heap.register(value);
        return value;
    }

    /**
     * 每条语句之后：记录快照，超过阈值时收集（实时方法内推迟）
     */
    void afterStatement(int line) {
        recordSnapshot(line);
        if (gc.shouldCollect()) {
            if (realTimeDepth > 0) {
                collectionDeferred = true;
            } else {
                collect();
            }
        }
    }

    GcMetricsSample collect() {
        return gc.collect(roots());
    }

    /**
     * 所有绑定的值、各帧的接收者，以及被调用帧遮蔽的调用方绑定
     */
    Collection<PulseValue> roots() {
        Collection<PulseValue> roots = env.values();
        for (CallFrame frame : frames) {
            if (frame.getReceiver() != null) {
                roots.add(frame.getReceiver());
            }
            roots.addAll(frame.shadowedValues());
        }
        return roots;
    }

    void recordSnapshot(int line) {
        Collection<PulseValue> values = env.values();
        recorder.capture(line, env.snapshot(), callStackBottomFirst(), heap.describe(values), output,
                new GcCounters(heap.getUsagePercent(), heap.getAllocatedCount(), gc.getFreedCount()));
    }
}
