package pulse.runtime.interpreter;

import com.pulselang.compiler.analysis.Diagnostic;
import com.pulselang.compiler.analysis.SyntaxValidator;
import com.pulselang.compiler.ast.decl.Program;
import com.pulselang.compiler.lexer.LexException;
import com.pulselang.compiler.lexer.Lexer;
import com.pulselang.compiler.lexer.Token;
import com.pulselang.compiler.parser.ParseException;
import com.pulselang.compiler.parser.Parser;
import pulse.runtime.deadline.DeadlineViolation;
import pulse.runtime.memory.GcMetricsSample;
import pulse.runtime.memory.SimulatedMetrics;
import pulse.runtime.safety.SafetyViolation;
import pulse.runtime.timetravel.ExecutionSnapshot;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PulseLang 解释器。
 *
 * <p>词法分析、静态检查、解析后由树遍历求值器执行。每次 {@link #interpret} 使用全新的
 * {@link RuntimeState}；运行结束后状态保留，供时间旅行和堆查询使用。</p>
 *
 * <p>用户代码的错误（语法错误、运行时错误、CRITICAL 违规）都写入结果输出，
 * 不会从 {@code interpret} 抛出。</p>
 *
 * <p>非线程安全：并发执行请使用各自的实例。</p>
 */
public class PulseInterpreter {

    private static final Logger LOG = Logger.getLogger(PulseInterpreter.class.getName());

    static final String STATIC_ERRORS_HEADER = "CRITICAL ERRORS DETECTED - EXECUTION HALTED:";

    private final RuntimeConfig config;
    private final RandomSource random;
    private final LongSupplier nanoTicker;
    private final LongSupplier clock;
    /** 模拟指标单独取随机数，不消耗程序的随机序列 */
    private final Random metricsRandom = new Random();

    /** 最近一次执行的状态 */
    private RuntimeState state;

    public PulseInterpreter() {
        this(RuntimeConfig.standard());
    }

    public PulseInterpreter(RuntimeConfig config) {
        this(config, RandomSource.system());
    }

    public PulseInterpreter(RuntimeConfig config, RandomSource random) {
        this(config, random, System::nanoTime);
    }

    public PulseInterpreter(RuntimeConfig config, RandomSource random, LongSupplier nanoTicker) {
        this(config, random, nanoTicker, System::currentTimeMillis);
    }

    public PulseInterpreter(RuntimeConfig config, RandomSource random, LongSupplier nanoTicker, LongSupplier clock) {
        if (config == null) throw new IllegalArgumentException("config must not be null");
        if (random == null) throw new IllegalArgumentException("random must not be null");
        this.config = config;
        this.random = random;
        this.nanoTicker = nanoTicker;
        this.clock = clock;
        this.state = newState();
    }

    private RuntimeState newState() {
        return new RuntimeState(config, random, nanoTicker, clock);
    }

    // ============ 执行 ============

    public ExecutionResult interpret(String source) {
        return interpret(source, "<pulse>");
    }

    /**
     * 重置全部状态后执行源码
     */
    public ExecutionResult interpret(String source, String fileName) {
        state = newState();
        LOG.log(Level.FINE, "Interpreting {0} with profile {1}", new Object[]{fileName, config.getProfile()});

        List<Token> tokens;
        try {
            tokens = new Lexer(source, fileName).scanTokens();
        } catch (LexException e) {
            state.println("Lex error: " + e.getMessage());
            return result(source, Collections.<Diagnostic>emptyList(), true);
        }

        List<Diagnostic> diagnostics = new SyntaxValidator(tokens).validate();
        if (SyntaxValidator.hasErrors(diagnostics)) {
            state.println(STATIC_ERRORS_HEADER);
            for (Diagnostic diagnostic : diagnostics) {
                if (diagnostic.isError()) {
                    state.println(diagnostic.toString());
                }
            }
            return result(source, diagnostics, true);
        }

        Program program;
        try {
            program = new Parser(new Lexer(source, fileName)).parse();
        } catch (ParseException e) {
            state.println("Parse error: " + e.getMessage());
            return result(source, diagnostics, true);
        }

        boolean halted = false;
        try {
            new Evaluator(state).run(program);
        } catch (SafetyHaltException e) {
            // 违规和 SYSTEM HALT 已写入输出
            LOG.log(Level.FINE, "Execution halted: {0}", e.getViolation());
            halted = true;
        } catch (PulseRuntimeException e) {
            LOG.log(Level.FINE, "Runtime error", e);
            state.println("Runtime error at line " + e.getLine() + ": " + e.getRawMessage());
            halted = true;
        }
        return result(source, diagnostics, halted);
    }

    private ExecutionResult result(String source, List<Diagnostic> diagnostics, boolean halted) {
        if (config.isSimulatedMetrics() && !state.gcLog.hasRealSamples()) {
            state.gcLog.add(SimulatedMetrics.estimate(source, metricsRandom::nextDouble, clock.getAsLong()));
        }
        return new ExecutionResult(state.output.toString(),
                state.recorder.all(),
                state.gcLog.getSamples(),
                state.deadlines.getViolations(),
                state.safetyViolations,
                diagnostics,
                halted);
    }

    // ============ 运行后查询 ============

    /**
     * 以当前绑定为根强制执行一次收集
     */
    public GcMetricsSample triggerGC() {
        return state.collect();
    }

    public HeapStatus getHeapStatus() {
        return new HeapStatus(state.heap.getUsed(), state.heap.getBudget(), state.offHeap.getUsage());
    }

    public Optional<ExecutionSnapshot> stepBackInTime() {
        return state.recorder.stepBack();
    }

    public Optional<ExecutionSnapshot> stepForwardInTime() {
        return state.recorder.stepForward();
    }

    public Optional<ExecutionSnapshot> jumpToSnapshot(String snapshotId) {
        return state.recorder.jumpTo(snapshotId);
    }

    public Optional<ExecutionSnapshot> currentSnapshot() {
        return state.recorder.current();
    }

    public List<DeadlineViolation> getDeadlineViolations() {
        return Collections.unmodifiableList(state.deadlines.getViolations());
    }

    public List<SafetyViolation> getSafetyViolations() {
        return Collections.unmodifiableList(state.safetyViolations);
    }

    public List<GcMetricsSample> getGCMetrics() {
        return Collections.unmodifiableList(state.gcLog.getSamples());
    }

    public List<ExecutionSnapshot> getSnapshots() {
        return Collections.unmodifiableList(state.recorder.all());
    }

    public RuntimeConfig getConfig() {
        return config;
    }
}
