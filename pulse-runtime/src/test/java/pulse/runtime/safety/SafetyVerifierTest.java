package pulse.runtime.safety;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import pulse.runtime.*;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 安全校验器测试
 */
class SafetyVerifierTest {

    private SafetyVerifier verifier;

    @BeforeEach
    void setUp() {
        verifier = new SafetyVerifier(3, 100, () -> 42L);
    }

    @Nested
    @DisplayName("除法")
    class DivisionTests {

        @Test
        @DisplayName("除以整数零为 CRITICAL")
        void testIntZero() {
            List<SafetyViolation> violations = verifier.checkDivision(PulseInt.of(10), PulseInt.of(0), 4);
            assertThat(violations).hasSize(1);
            SafetyViolation v = violations.get(0);
            assertThat(v.getKind()).isEqualTo(ViolationKind.DIVISION_BY_ZERO);
            assertThat(v.getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(v.getMessage()).isEqualTo("Division by zero detected: 10 / 0");
            assertThat(v.getLine()).isEqualTo(4);
            assertThat(v.getTimestamp()).isEqualTo(42L);
        }

        @Test
        @DisplayName("除以浮点零同样违规")
        void testDoubleZero() {
            assertThat(verifier.checkDivision(PulseDouble.of(1.5), PulseDouble.of(0.0), 1)).hasSize(1);
        }

        @Test
        @DisplayName("非零除数无违规")
        void testNonZero() {
            assertThat(verifier.checkDivision(PulseInt.of(10), PulseInt.of(2), 1)).isEmpty();
        }
    }

    @Nested
    @DisplayName("数组和空值")
    class AccessTests {

        private final PulseArray array = new PulseArray("int",
                Arrays.<PulseValue>asList(PulseInt.of(1), PulseInt.of(2)));

        @Test
        @DisplayName("越界为 ERROR")
        void testOutOfBounds() {
            List<SafetyViolation> violations = verifier.checkArrayAccess(array, 2, 7);
            assertThat(violations).singleElement()
                    .satisfies(v -> {
                        assertThat(v.getSeverity()).isEqualTo(Severity.ERROR);
                        assertThat(v.getMessage()).isEqualTo("Array index out of bounds: index 2, array length 2");
                    });
        }

        @Test
        @DisplayName("负下标越界")
        void testNegativeIndex() {
            assertThat(verifier.checkArrayAccess(array, -1, 1)).hasSize(1);
        }

        @Test
        @DisplayName("界内访问无违规")
        void testInBounds() {
            assertThat(verifier.checkArrayAccess(array, 1, 1)).isEmpty();
        }

        @Test
        @DisplayName("null 访问为 ERROR")
        void testNull() {
            assertThat(verifier.checkNullAccess(PulseNull.NULL, 3)).singleElement()
                    .satisfies(v -> assertThat(v.toString())
                            .isEqualTo("SAFETY VIOLATION [ERROR]: Null pointer access detected (Line 3)"));
            assertThat(verifier.checkNullAccess(PulseString.of("x"), 3)).isEmpty();
        }
    }

    @Nested
    @DisplayName("调用深度")
    class DepthTests {

        @Test
        @DisplayName("超过上限时守卫携带 CRITICAL 违规")
        void testOverflow() {
            try (CallDepthGuard a = verifier.enterMethod(1);
                 CallDepthGuard b = verifier.enterMethod(1);
                 CallDepthGuard c = verifier.enterMethod(1)) {
                assertThat(c.getViolations()).isEmpty();
                try (CallDepthGuard d = verifier.enterMethod(9)) {
                    assertThat(d.getDepth()).isEqualTo(4);
                    assertThat(d.getViolations()).singleElement()
                            .satisfies(v -> {
                                assertThat(v.isCritical()).isTrue();
                                assertThat(v.getMessage()).isEqualTo("Stack overflow: depth 4 exceeds maximum 3");
                            });
                }
            }
            assertThat(verifier.getCurrentDepth()).isZero();
        }

        @Test
        @DisplayName("异常退出时深度同样归还")
        void testReleaseOnException() {
            assertThatThrownBy(() -> {
                try (CallDepthGuard guard = verifier.enterMethod(1)) {
                    throw new IllegalStateException("boom");
                }
            }).isInstanceOf(IllegalStateException.class);
            assertThat(verifier.getCurrentDepth()).isZero();
        }

        @Test
        @DisplayName("verify(METHOD_CALL) 只检查不占用")
        void testVerifyDoesNotAcquire() {
            assertThat(verifier.verify(CheckKind.METHOD_CALL, 1)).isEmpty();
            assertThat(verifier.getCurrentDepth()).isZero();
        }
    }

    @Nested
    @DisplayName("分配与分派")
    class AllocationTests {

        @Test
        @DisplayName("超出预算为 CRITICAL")
        void testHeapOverflow() {
            assertThat(verifier.checkAllocation(30, 80, 2)).singleElement()
                    .satisfies(v -> {
                        assertThat(v.getKind()).isEqualTo(ViolationKind.HEAP_OVERFLOW);
                        assertThat(v.getMessage()).isEqualTo("Heap overflow: requested 30 bytes, available 20");
                    });
            assertThat(verifier.checkAllocation(20, 80, 2)).isEmpty();
        }

        @Test
        @DisplayName("verify 按种类分派")
        void testDispatch() {
            assertThat(verifier.verify(CheckKind.DIVISION, 1, PulseInt.of(1), PulseInt.of(0))).hasSize(1);
            assertThat(verifier.verify(CheckKind.MEMORY_ALLOCATION, 1, 200L, 0L)).hasSize(1);
            assertThat(verifier.verify(CheckKind.NULL_ACCESS, 1, PulseNull.NULL)).hasSize(1);
        }

        @Test
        @DisplayName("@SafetyCheck 升级：ERROR 变 CRITICAL，其它不变")
        void testEscalate() {
            SafetyViolation error = verifier.checkNullAccess(PulseNull.NULL, 1).get(0);
            assertThat(error.escalate().getSeverity()).isEqualTo(Severity.CRITICAL);
            SafetyViolation critical = verifier.checkDivision(PulseInt.of(1), PulseInt.of(0), 1).get(0);
            assertThat(critical.escalate().getSeverity()).isEqualTo(Severity.CRITICAL);
        }
    }
}
