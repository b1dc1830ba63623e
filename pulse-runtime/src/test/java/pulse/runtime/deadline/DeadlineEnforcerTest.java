package pulse.runtime.deadline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import pulse.runtime.safety.Severity;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 截止时间执行器测试（手动推进的计时器）
 */
class DeadlineEnforcerTest {

    private static final long MS = 1_000_000L;

    private final AtomicLong ticker = new AtomicLong();
    private DeadlineEnforcer enforcer;

    @BeforeEach
    void setUp() {
        ticker.set(0);
        enforcer = new DeadlineEnforcer(ticker::get, () -> 1000L);
    }

    @Nested
    @DisplayName("严重程度")
    class SeverityTests {

        @Test
        @DisplayName("5ms 截止耗时 11ms 为 CRITICAL")
        void testCritical() {
            enforcer.start("read", 5, 3);
            ticker.addAndGet(11 * MS);
            Optional<DeadlineViolation> violation = enforcer.stop("read");

            assertThat(violation).isPresent();
            assertThat(violation.get().getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(violation.get().getLine()).isEqualTo(3);
            assertThat(violation.get().toString())
                    .isEqualTo("DEADLINE VIOLATION: read took 11.00ms (expected 5ms)");
        }

        @Test
        @DisplayName("5ms 截止耗时 7ms 为 WARNING")
        void testWarning() {
            enforcer.start("read", 5, 3);
            ticker.addAndGet(7 * MS);
            assertThat(enforcer.stop("read"))
                    .hasValueSatisfying(v -> assertThat(v.getSeverity()).isEqualTo(Severity.WARNING));
        }

        @Test
        @DisplayName("恰好 2 倍仍为 WARNING")
        void testExactlyDouble() {
            enforcer.start("read", 5, 3);
            ticker.addAndGet(10 * MS);
            assertThat(enforcer.stop("read"))
                    .hasValueSatisfying(v -> assertThat(v.getSeverity()).isEqualTo(Severity.WARNING));
        }

        @Test
        @DisplayName("按时完成无违规")
        void testOnTime() {
            enforcer.start("read", 5, 3);
            ticker.addAndGet(5 * MS);
            assertThat(enforcer.stop("read")).isEmpty();
            assertThat(enforcer.getViolations()).isEmpty();
        }
    }

    @Nested
    @DisplayName("生命周期")
    class LifecycleTests {

        @Test
        @DisplayName("非正截止时间被拒绝")
        void testNonPositive() {
            assertThatThrownBy(() -> enforcer.start("read", 0, 1))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("未计时的方法 stop 返回空")
        void testStopUnknown() {
            assertThat(enforcer.stop("missing")).isEmpty();
        }

        @Test
        @DisplayName("递归调用按后进先出配对")
        void testNestedSameName() {
            enforcer.start("tick", 10, 1);
            ticker.addAndGet(8 * MS);
            enforcer.start("tick", 10, 1);
            ticker.addAndGet(1 * MS);
            assertThat(enforcer.stop("tick")).isEmpty();
            ticker.addAndGet(4 * MS);
            assertThat(enforcer.stop("tick"))
                    .hasValueSatisfying(v -> assertThat(v.getActualMs()).isEqualTo(13.0));
        }

        @Test
        @DisplayName("getActiveDeadlines 报告剩余时间")
        void testActiveDeadlines() {
            enforcer.start("control", 20, 1);
            ticker.addAndGet(5 * MS);
            assertThat(enforcer.getActiveDeadlines()).singleElement()
                    .satisfies(d -> {
                        assertThat(d.getMethodName()).isEqualTo("control");
                        assertThat(d.getRemainingMs()).isEqualTo(15.0);
                    });
        }

        @Test
        @DisplayName("clearViolations 只清空违规")
        void testClear() {
            enforcer.start("a", 1, 1);
            ticker.addAndGet(3 * MS);
            enforcer.stop("a");
            assertThat(enforcer.getViolations()).hasSize(1);
            enforcer.clearViolations();
            assertThat(enforcer.getViolations()).isEmpty();
        }
    }
}
