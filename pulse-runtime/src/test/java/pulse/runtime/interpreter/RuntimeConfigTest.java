package pulse.runtime.interpreter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 运行时配置测试
 */
class RuntimeConfigTest {

    @Nested
    @DisplayName("预设")
    class PresetTests {

        @Test
        @DisplayName("standard 默认值")
        void testStandard() {
            RuntimeConfig config = RuntimeConfig.standard();
            assertEquals(RuntimeConfig.Profile.STANDARD, config.getProfile());
            assertEquals(10_000, config.getMaxLoopIterations());
            assertEquals(100, config.getMaxCallDepth());
            assertEquals(1024 * 1024, config.getHeapBudget());
            assertEquals(512 * 1024, config.getOffHeapCapacity());
            assertEquals(0.7, config.getGcThreshold(), 1e-9);
            assertEquals(1024, config.getPromotionThreshold());
            assertEquals(1_000, config.getSnapshotCapacity());
            assertEquals(50, config.getMetricsHistory());
            assertFalse(config.isSimulatedMetrics());
        }

        @Test
        @DisplayName("embedded 收紧限制")
        void testEmbedded() {
            RuntimeConfig config = RuntimeConfig.embedded();
            assertEquals(1_000, config.getMaxLoopIterations());
            assertEquals(64, config.getMaxCallDepth());
            assertEquals(256 * 1024, config.getHeapBudget());
            assertEquals(128 * 1024, config.getOffHeapCapacity());
            assertEquals(256, config.getSnapshotCapacity());
        }

        @Test
        @DisplayName("toBuilder 保留档位和值")
        void testToBuilder() {
            RuntimeConfig config = RuntimeConfig.embedded().toBuilder().maxCallDepth(10).build();
            assertEquals(RuntimeConfig.Profile.EMBEDDED, config.getProfile());
            assertEquals(10, config.getMaxCallDepth());
            assertEquals(1_000, config.getMaxLoopIterations());
        }

        @Test
        @DisplayName("非法值被 build 拒绝")
        void testValidation() {
            assertThrows(IllegalArgumentException.class,
                    () -> RuntimeConfig.custom().maxLoopIterations(0).build());
            assertThrows(IllegalArgumentException.class,
                    () -> RuntimeConfig.custom().gcThreshold(1.5).build());
            assertThrows(IllegalArgumentException.class,
                    () -> RuntimeConfig.custom().gcThreshold(0).build());
        }
    }

    @Nested
    @DisplayName("fromProperties")
    class PropertiesTests {

        @Test
        @DisplayName("以档位为基础覆盖单个键")
        void testOverride() {
            Properties props = new Properties();
            props.setProperty(RuntimeConfig.PROFILE, "embedded");
            props.setProperty(RuntimeConfig.MAX_LOOP_ITERATIONS, " 50 ");
            props.setProperty(RuntimeConfig.SIMULATED_METRICS, "true");

            RuntimeConfig config = RuntimeConfig.fromProperties(props);
            assertEquals(RuntimeConfig.Profile.EMBEDDED, config.getProfile());
            assertEquals(50, config.getMaxLoopIterations());
            assertEquals(64, config.getMaxCallDepth());
            assertTrue(config.isSimulatedMetrics());
        }

        @Test
        @DisplayName("空 properties 等同 standard")
        void testEmpty() {
            RuntimeConfig config = RuntimeConfig.fromProperties(new Properties());
            assertEquals(RuntimeConfig.Profile.STANDARD, config.getProfile());
            assertEquals(10_000, config.getMaxLoopIterations());
        }

        @Test
        @DisplayName("无法解析的值")
        void testInvalidNumber() {
            Properties props = new Properties();
            props.setProperty(RuntimeConfig.HEAP_BUDGET, "lots");
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> RuntimeConfig.fromProperties(props));
            assertEquals("Invalid value for pulse.heap.budget: 'lots'", e.getMessage());
        }

        @Test
        @DisplayName("未知档位")
        void testUnknownProfile() {
            Properties props = new Properties();
            props.setProperty(RuntimeConfig.PROFILE, "turbo");
            assertThrows(IllegalArgumentException.class, () -> RuntimeConfig.fromProperties(props));
        }

        @Test
        @DisplayName("布尔值必须为 true/false")
        void testInvalidBoolean() {
            Properties props = new Properties();
            props.setProperty(RuntimeConfig.SIMULATED_METRICS, "yes");
            assertThrows(IllegalArgumentException.class, () -> RuntimeConfig.fromProperties(props));
        }
    }
}
