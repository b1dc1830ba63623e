package pulse.runtime.deadline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 截止时间执行器
 *
 * <p>{@link #start} 记录开始时刻，{@link #stop} 计算耗时并在超时时产生违规。
 * 时间源是可注入的纳秒计时器，测试中使用手动推进的计时器。
 * 同名方法递归时按后进先出配对。</p>
 */
public final class DeadlineEnforcer {

    private static final Logger LOG = Logger.getLogger(DeadlineEnforcer.class.getName());

    private static final double NANOS_PER_MS = 1_000_000.0;

    private final LongSupplier nanoTicker;
    private final LongSupplier clock;
    private final List<ActiveDeadline> active = new ArrayList<ActiveDeadline>();
    private final List<DeadlineViolation> violations = new ArrayList<DeadlineViolation>();

    public DeadlineEnforcer() {
        this(System::nanoTime, System::currentTimeMillis);
    }

    /**
     * @param nanoTicker 单调纳秒计时器
     * @param clock      违规时间戳来源（毫秒）
     */
    public DeadlineEnforcer(LongSupplier nanoTicker, LongSupplier clock) {
        this.nanoTicker = nanoTicker;
        this.clock = clock;
    }

    public void start(String methodName, long deadlineMs, int line) {
        if (deadlineMs <= 0) {
            throw new IllegalArgumentException("Deadline must be positive: " + deadlineMs);
        }
        active.add(new ActiveDeadline(methodName, deadlineMs, line, nanoTicker.getAsLong()));
    }

    /**
     * 结束计时
     *
     * @return 超时时的违规；方法未在计时或按时完成时为空
     */
    public Optional<DeadlineViolation> stop(String methodName) {
        ActiveDeadline deadline = null;
        for (int i = active.size() - 1; i >= 0; i--) {
            if (active.get(i).methodName.equals(methodName)) {
                deadline = active.remove(i);
                break;
            }
        }
        if (deadline == null) {
            return Optional.empty();
        }

        double actualMs = (nanoTicker.getAsLong() - deadline.startNanos) / NANOS_PER_MS;
        if (actualMs <= deadline.deadlineMs) {
            return Optional.empty();
        }
        DeadlineViolation violation = new DeadlineViolation(methodName, deadline.deadlineMs,
                actualMs, deadline.line, clock.getAsLong());
        violations.add(violation);
        LOG.log(Level.WARNING, violation.toString());
        return Optional.of(violation);
    }

    public List<DeadlineViolation> getViolations() {
        return Collections.unmodifiableList(violations);
    }

    public void clearViolations() {
        violations.clear();
    }

    /**
     * 正在计时的方法及剩余毫秒数（不小于 0）
     */
    public List<RemainingDeadline> getActiveDeadlines() {
        long now = nanoTicker.getAsLong();
        List<RemainingDeadline> result = new ArrayList<RemainingDeadline>(active.size());
        for (ActiveDeadline deadline : active) {
            double elapsedMs = (now - deadline.startNanos) / NANOS_PER_MS;
            result.add(new RemainingDeadline(deadline.methodName, Math.max(0.0, deadline.deadlineMs - elapsedMs)));
        }
        return result;
    }

    /**
     * 清空计时和违规
     */
    public void reset() {
        active.clear();
        violations.clear();
    }

    private static final class ActiveDeadline {
        final String methodName;
        final long deadlineMs;
        final int line;
        final long startNanos;

        ActiveDeadline(String methodName, long deadlineMs, int line, long startNanos) {
            this.methodName = methodName;
            this.deadlineMs = deadlineMs;
            this.line = line;
            this.startNanos = startNanos;
        }
    }

    /**
     * 正在计时的方法的剩余时间
     */
    public static final class RemainingDeadline {
        private final String methodName;
        private final double remainingMs;

        public RemainingDeadline(String methodName, double remainingMs) {
            this.methodName = methodName;
            this.remainingMs = remainingMs;
        }

        public String getMethodName() {
            return methodName;
        }

        public double getRemainingMs() {
            return remainingMs;
        }
    }
}
