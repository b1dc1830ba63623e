package pulse.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 值类型测试
 */
class PulseValueTest {

    @Nested
    @DisplayName("相等与大小")
    class EqualityTests {

        @Test
        @DisplayName("数值跨类型比较")
        void testNumericEquality() {
            assertTrue(PulseInt.of(3).valueEquals(PulseDouble.of(3.0)));
            assertFalse(PulseInt.of(3).valueEquals(PulseString.of("3")));
        }

        @Test
        @DisplayName("字符串按内容比较，对象按引用比较")
        void testReferenceEquality() {
            assertTrue(PulseString.of("ab").valueEquals(PulseString.of("ab")));
            PulseObject a = new PulseObject("Sensor");
            assertTrue(a.valueEquals(a));
            assertFalse(a.valueEquals(new PulseObject("Sensor")));
            assertTrue(PulseNull.NULL.valueEquals(PulseNull.NULL));
        }

        @Test
        @DisplayName("of 每次返回新实例")
        void testNoCaching() {
            assertNotSame(PulseInt.of(1), PulseInt.of(1));
            assertNotSame(PulseString.of("x"), PulseString.of("x"));
        }

        @Test
        @DisplayName("大小估算")
        void testSizes() {
            assertEquals(4, PulseInt.of(1).getSize());
            assertEquals(8, PulseDouble.of(1).getSize());
            assertEquals(1, PulseBoolean.of(true).getSize());
            assertEquals(10, PulseString.of("hello").getSize());
            PulseArray array = new PulseArray("int", Arrays.<PulseValue>asList(PulseInt.of(1), PulseInt.of(2)));
            assertEquals(16 + 8, array.getSize());
        }
    }

    @Nested
    @DisplayName("数组")
    class ArrayTests {

        @Test
        @DisplayName("with 返回新数组，原数组不变")
        void testWith() {
            PulseArray array = new PulseArray("int", Arrays.<PulseValue>asList(PulseInt.of(1), PulseInt.of(2)));
            PulseArray updated = array.with(0, PulseInt.of(9));
            assertEquals("[1, 2]", array.toString());
            assertEquals("[9, 2]", updated.toString());
        }

        @Test
        @DisplayName("下标边界")
        void testBounds() {
            PulseArray array = new PulseArray("int", Arrays.<PulseValue>asList(PulseInt.of(1)));
            assertTrue(array.isInBounds(0));
            assertFalse(array.isInBounds(1));
            assertFalse(array.isInBounds(-1));
        }
    }

    @Nested
    @DisplayName("深拷贝")
    class DeepCopyTests {

        @Test
        @DisplayName("对象环被保留")
        void testCycle() {
            PulseObject node = new PulseObject("Node");
            node.setField("next", node);
            PulseObject copy = (PulseObject) node.deepCopy();
            assertNotSame(node, copy);
            assertSame(copy, copy.getField("next"));
        }

        @Test
        @DisplayName("拷贝与原对象互不影响")
        void testIndependence() {
            PulseObject sensor = new PulseObject("Sensor");
            sensor.setField("value", PulseInt.of(1));
            PulseObject copy = (PulseObject) sensor.deepCopy();
            sensor.setField("value", PulseInt.of(2));
            assertEquals("1", copy.getField("value").toString());
        }

        @Test
        @DisplayName("标量拷贝返回自身")
        void testScalar() {
            PulseInt value = PulseInt.of(5);
            assertSame(value, value.deepCopy());
        }
    }
}
