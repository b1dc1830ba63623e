package pulse.runtime.interpreter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import pulse.runtime.PulseInt;
import pulse.runtime.memory.GcMetricsSample;
import pulse.runtime.safety.Severity;
import pulse.runtime.timetravel.ExecutionSnapshot;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 解释器端到端测试
 */
class PulseInterpreterTest {

    private static ExecutionResult run(String... lines) {
        return new PulseInterpreter(RuntimeConfig.standard(), RandomSource.seeded(1)).interpret(source(lines));
    }

    private static String source(String... lines) {
        return String.join("\n", lines);
    }

    // ============ 基础执行 ============

    @Nested
    @DisplayName("基础执行")
    class BasicTests {

        @Test
        @DisplayName("顶层语句按顺序执行")
        void testTopLevel() {
            ExecutionResult result = run(
                    "int x = 2;",
                    "double y = x * 1.5;",
                    "System.out.println(\"x=\" + x);",
                    "System.out.println(y);");
            assertThat(result.getOutput()).isEqualTo("x=2\n3.0\n");
            assertThat(result.isHalted()).isFalse();
        }

        @Test
        @DisplayName("整数运算保持整数，声明时按类型转换")
        void testArithmetic() {
            ExecutionResult result = run(
                    "int a = 7 / 2;",
                    "int b = 7 % 3;",
                    "int c = 9.9;",
                    "double d = 3;",
                    "System.out.println(a + \",\" + b + \",\" + c + \",\" + d);");
            assertThat(result.getOutput()).isEqualTo("3,1,9,3.0\n");
        }

        @Test
        @DisplayName("if/else 只执行一个分支，&& 短路")
        void testControlFlow() {
            ExecutionResult result = run(
                    "int t = 30;",
                    "if (t > 25 && t < 40) {",
                    "    System.out.println(\"warm\");",
                    "} else {",
                    "    System.out.println(\"cold\");",
                    "}",
                    "int[] empty = new int[0];",
                    "if (empty.length > 0 && empty[0] == 1) {",
                    "    System.out.println(\"unreachable\");",
                    "}");
            assertThat(result.getOutput()).isEqualTo("warm\n");
            assertThat(result.getSafetyViolations()).isEmpty();
        }

        @Test
        @DisplayName("for 循环和自增")
        void testForLoop() {
            ExecutionResult result = run(
                    "int sum = 0;",
                    "for (int i = 1; i <= 4; i++) {",
                    "    sum = sum + i;",
                    "}",
                    "System.out.println(sum);");
            assertThat(result.getOutput()).isEqualTo("10\n");
        }

        @Test
        @DisplayName("字符串 == 比较内容，字符串方法")
        void testStrings() {
            ExecutionResult result = run(
                    "String a = \"temp\";",
                    "String b = \"te\" + \"mp\";",
                    "System.out.println(a == b);",
                    "System.out.println(a.toUpperCase() + a.length());",
                    "System.out.println(a.contains(\"em\"));");
            assertThat(result.getOutput()).isEqualTo("true\nTEMP4\ntrue\n");
        }

        @Test
        @DisplayName("数组初始化、下标赋值和 length")
        void testArrays() {
            ExecutionResult result = run(
                    "int[] readings = {1, 2, 3};",
                    "readings[1] = 20;",
                    "System.out.println(readings[1] + readings.length);");
            assertThat(result.getOutput()).isEqualTo("23\n");
        }

        @Test
        @DisplayName("Math 内建函数")
        void testMath() {
            ExecutionResult result = run(
                    "System.out.println(Math.floor(2.7));",
                    "System.out.println(Math.max(3, 8));",
                    "System.out.println(Math.abs(-2.5));",
                    "System.out.println(Math.sqrt(16.0));");
            assertThat(result.getOutput()).isEqualTo("2\n8\n2.5\n4.0\n");
        }

        @Test
        @DisplayName("相同种子的 Math.random 可复现")
        void testSeededRandom() {
            String program = "System.out.println(Math.random());";
            String first = new PulseInterpreter(RuntimeConfig.standard(), RandomSource.seeded(7))
                    .interpret(program).getOutput();
            String second = new PulseInterpreter(RuntimeConfig.standard(), RandomSource.seeded(7))
                    .interpret(program).getOutput();
            assertThat(first).isEqualTo(second);
        }

        @Test
        @DisplayName("下标自增只求值一次下标")
        void testIndexedIncrement() {
            ExecutionResult result = run(
                    "int[] a = new int[4];",
                    "int i = 0;",
                    "a[i++]++;",
                    "--a[++i];",
                    "System.out.println(i + \" \" + a[0] + \" \" + a[1] + \" \" + a[2]);");
            assertThat(result.getOutput()).isEqualTo("2 1 0 -1\n");
        }

        @Test
        @DisplayName("下标赋值中的副作用只发生一次")
        void testIndexedAssignment() {
            ExecutionResult result = run(
                    "int[] a = new int[3];",
                    "int i = 0;",
                    "a[i++] = 5;",
                    "a[i] = a[i] + 2;",
                    "System.out.println(i + \" \" + a[0] + \" \" + a[1]);");
            assertThat(result.getOutput()).isEqualTo("1 5 2\n");
        }
    }

    // ============ 方法与对象 ============

    @Nested
    @DisplayName("方法与对象")
    class MethodTests {

        @Test
        @DisplayName("递归调用，参数在返回后恢复")
        void testRecursion() {
            ExecutionResult result = run(
                    "int fact(int n) {",
                    "    if (n <= 1) {",
                    "        return 1;",
                    "    }",
                    "    return n * fact(n - 1);",
                    "}",
                    "void main() {",
                    "    System.out.println(fact(5));",
                    "}");
            assertThat(result.getOutput()).isEqualTo("120\n");
        }

        @Test
        @DisplayName("对象字段、构造器和实例方法")
        void testObjects() {
            ExecutionResult result = run(
                    "class Sensor {",
                    "    int value;",
                    "    double offset = 0.5;",
                    "    Sensor(int initial) {",
                    "        value = initial;",
                    "    }",
                    "    void calibrate(int delta) {",
                    "        value = value + delta;",
                    "    }",
                    "    double read() {",
                    "        return value + offset;",
                    "    }",
                    "}",
                    "Sensor s = new Sensor(5);",
                    "s.calibrate(2);",
                    "System.out.println(s.read());",
                    "System.out.println(s.value);");
            assertThat(result.getOutput()).isEqualTo("7.5\n7\n");
        }

        @Test
        @DisplayName("没有 main 时按声明顺序调用无参方法")
        void testSensorLoopEntry() {
            ExecutionResult result = run(
                    "class Station {",
                    "    static int count = 0;",
                    "    void first() {",
                    "        count++;",
                    "        System.out.println(\"first \" + count);",
                    "    }",
                    "    void second() {",
                    "        count++;",
                    "        System.out.println(\"second \" + count);",
                    "    }",
                    "}");
            assertThat(result.getOutput()).isEqualTo("first 1\nsecond 2\n");
        }

        @Test
        @DisplayName("非 void 方法缺少 return 是运行时错误")
        void testMissingReturn() {
            ExecutionResult result = run(
                    "int broken() {",
                    "    int x = 1;",
                    "}",
                    "void main() {",
                    "    broken();",
                    "}");
            assertThat(result.isHalted()).isTrue();
            assertThat(result.getOutput()).startsWith("Runtime error at line 5: Method 'broken' must return");
        }
    }

    // ============ 安全 ============

    @Nested
    @DisplayName("安全检查")
    class SafetyTests {

        @Test
        @DisplayName("字面量除零在执行前被静态检查拦截")
        void testStaticDivisionByZero() {
            ExecutionResult result = run("int x = 10 / 0;");
            assertThat(result.getOutput())
                    .startsWith("CRITICAL ERRORS DETECTED - EXECUTION HALTED:\n")
                    .contains("Line 1: Division by zero detected");
            assertThat(result.getDiagnostics()).filteredOn(d -> d.isError()).hasSize(1);
            assertThat(result.isHalted()).isTrue();
            assertThat(result.getSnapshots()).isEmpty();
        }

        @Test
        @DisplayName("运行时除零终止执行并保留已有输出")
        void testRuntimeDivisionHalts() {
            ExecutionResult result = run(
                    "int zero = 0;",
                    "System.out.println(\"before\");",
                    "int y = 10 / zero;",
                    "System.out.println(\"after\");");
            assertThat(result.isHalted()).isTrue();
            assertThat(result.getOutput())
                    .contains("before\n")
                    .contains("SAFETY VIOLATION [CRITICAL]: Division by zero detected: 10 / 0 (Line 3)")
                    .contains("SYSTEM HALT: Critical safety violation detected")
                    .doesNotContain("after");
            assertThat(result.getSafetyViolations()).singleElement()
                    .satisfies(v -> assertThat(v.getSeverity()).isEqualTo(Severity.CRITICAL));
        }

        @Test
        @DisplayName("数组越界记录 ERROR 并以默认值继续")
        void testArrayBoundsContinues() {
            ExecutionResult result = run(
                    "int[] a = {1, 2};",
                    "int v = a[5];",
                    "System.out.println(\"v=\" + v);");
            assertThat(result.isHalted()).isFalse();
            assertThat(result.getOutput())
                    .contains("SAFETY VIOLATION [ERROR]: Array index out of bounds: index 5, array length 2 (Line 2)")
                    .endsWith("v=0\n");
        }

        @Test
        @DisplayName("@SafetyCheck 方法内 ERROR 升级为 CRITICAL")
        void testSafetyCheckEscalates() {
            ExecutionResult result = run(
                    "@SafetyCheck",
                    "void guarded() {",
                    "    int[] a = {1};",
                    "    int v = a[3];",
                    "    System.out.println(\"unreachable\");",
                    "}");
            assertThat(result.isHalted()).isTrue();
            assertThat(result.getOutput()).doesNotContain("unreachable");
            assertThat(result.getSafetyViolations()).singleElement()
                    .satisfies(v -> assertThat(v.isCritical()).isTrue());
        }

        @Test
        @DisplayName("无限递归触发调用深度违规")
        void testStackOverflow() {
            ExecutionResult result = run(
                    "int down(int n) {",
                    "    return down(n + 1);",
                    "}",
                    "void main() {",
                    "    down(0);",
                    "}");
            assertThat(result.isHalted()).isTrue();
            assertThat(result.getOutput()).contains("Stack overflow: depth 101 exceeds maximum 100");
        }

        @Test
        @DisplayName("对 null 调用方法记录违规")
        void testNullAccess() {
            ExecutionResult result = run(
                    "String s = null;",
                    "String u = s.toUpperCase();",
                    "System.out.println(u);");
            assertThat(result.getOutput())
                    .contains("SAFETY VIOLATION [ERROR]: Null pointer access detected (Line 2)")
                    .endsWith("null\n");
            assertThat(result.getSafetyViolations()).hasSize(1);
            assertThat(result.isHalted()).isFalse();
        }

        @Test
        @DisplayName("循环超过上限时输出警告并跳出")
        void testLoopBound() {
            ExecutionResult result = run(
                    "int i = 0;",
                    "while (i < 1000000) {",
                    "    i++;",
                    "}",
                    "System.out.println(i);");
            assertThat(result.getOutput())
                    .isEqualTo("WARNING: Loop terminated after 10000 iterations for safety\n10000\n");
            assertThat(result.isHalted()).isFalse();
        }

        @Test
        @DisplayName("embedded 档位的循环上限更低")
        void testEmbeddedLoopBound() {
            ExecutionResult result = new PulseInterpreter(RuntimeConfig.embedded())
                    .interpret("for (int i = 0; i < 5000; i++) { }");
            assertThat(result.getOutput()).contains("after 1000 iterations");
        }
    }

    // ============ 错误 ============

    @Nested
    @DisplayName("错误报告")
    class ErrorTests {

        @Test
        @DisplayName("词法错误不执行")
        void testLexError() {
            ExecutionResult result = run("String s = \"open;");
            assertThat(result.getOutput()).startsWith("Lex error: ");
            assertThat(result.isHalted()).isTrue();
        }

        @Test
        @DisplayName("语法错误不执行")
        void testParseError() {
            ExecutionResult result = run("int x = ;");
            assertThat(result.getOutput()).startsWith("Parse error: ");
            assertThat(result.getSnapshots()).isEmpty();
        }

        @Test
        @DisplayName("未定义变量是运行时错误")
        void testUndefinedVariable() {
            ExecutionResult result = run(
                    "System.out.println(\"start\");",
                    "int y = missing + 1;");
            assertThat(result.getOutput())
                    .isEqualTo("start\nRuntime error at line 2: Undefined variable 'missing'\n");
            assertThat(result.isHalted()).isTrue();
        }

        @Test
        @DisplayName("类型不匹配")
        void testTypeMismatch() {
            ExecutionResult result = run("int x = \"text\";");
            assertThat(result.getOutput()).contains("Type mismatch");
        }

        @Test
        @DisplayName("每次 interpret 重置状态")
        void testReset() {
            PulseInterpreter interpreter = new PulseInterpreter();
            interpreter.interpret("System.out.println(\"one\");");
            ExecutionResult second = interpreter.interpret("System.out.println(\"two\");");
            assertThat(second.getOutput()).isEqualTo("two\n");
            assertThat(interpreter.getSafetyViolations()).isEmpty();
        }
    }

    // ============ 注解 ============

    @Nested
    @DisplayName("注解")
    class AnnotationTests {

        @Test
        @DisplayName("@Deadline 超时写入输出但不终止")
        void testDeadlineViolation() {
            AtomicLong ticker = new AtomicLong();
            PulseInterpreter interpreter = new PulseInterpreter(RuntimeConfig.standard(), RandomSource.seeded(1),
                    () -> ticker.addAndGet(3_000_000L));
            ExecutionResult result = interpreter.interpret(source(
                    "class Controller {",
                    "    @Deadline(ms=1)",
                    "    void control() {",
                    "        int x = 1;",
                    "    }",
                    "}"));

            assertThat(result.isHalted()).isFalse();
            assertThat(result.getOutput()).isEqualTo("DEADLINE VIOLATION: control took 3.00ms (expected 1ms)\n");
            assertThat(result.getDeadlineViolations()).singleElement()
                    .satisfies(v -> assertThat(v.getSeverity()).isEqualTo(Severity.CRITICAL));
        }

        @Test
        @DisplayName("@Sensor 类型出现在调用栈帧名中")
        void testSensorFrameLabel() {
            PulseInterpreter interpreter = new PulseInterpreter();
            interpreter.interpret(source(
                    "class Probe {",
                    "    @Sensor(type=\"temperature\")",
                    "    void read() {",
                    "        double t = 21.5;",
                    "    }",
                    "}"));
            List<ExecutionSnapshot> snapshots = interpreter.getSnapshots();
            assertThat(snapshots).anySatisfy(s ->
                    assertThat(s.getCallStack()).containsExactly("read[temperature]"));
        }
    }

    // ============ 内存与历史 ============

    @Nested
    @DisplayName("内存与时间旅行")
    class MemoryTests {

        @Test
        @DisplayName("超过阈值时自动收集")
        void testAutomaticCollection() {
            RuntimeConfig config = RuntimeConfig.custom().heapBudget(2_000).build();
            PulseInterpreter interpreter = new PulseInterpreter(config);
            ExecutionResult result = interpreter.interpret(source(
                    "String s = \"\";",
                    "int i = 0;",
                    "while (i < 300) {",
                    "    s = \"reading-\" + i;",
                    "    i++;",
                    "}",
                    "System.out.println(s);"));

            assertThat(result.isHalted()).isFalse();
            assertThat(result.getOutput()).isEqualTo("reading-299\n");
            assertThat(result.getGcMetrics()).isNotEmpty().noneMatch(GcMetricsSample::isSimulated);
            assertThat(result.getGcMetrics().get(result.getGcMetrics().size() - 1).getFreedCount()).isPositive();
            HeapStatus status = interpreter.getHeapStatus();
            assertThat(status.getUsed()).isLessThanOrEqualTo(status.getMax());
        }

        @Test
        @DisplayName("被调用方同名参数遮蔽的调用方变量在收集后仍登记在堆上")
        void testShadowedBindingSurvivesCollection() {
            RuntimeConfig config = RuntimeConfig.custom().heapBudget(64).gcThreshold(0.01).build();
            PulseInterpreter interpreter = new PulseInterpreter(config, RandomSource.seeded(1));
            ExecutionResult result = interpreter.interpret(source(
                    "void f(String s) {",
                    "    int k = 1;",
                    "}",
                    "String s = \"abcdefghij\";",
                    "f(\"x\");",
                    "System.out.println(s);"));

            assertThat(result.getOutput()).isEqualTo("abcdefghij\n");
            assertThat(result.getGcMetrics()).isNotEmpty();
            ExecutionSnapshot last = result.getSnapshots().get(result.getSnapshots().size() - 1);
            assertThat(last.getHeapState()).containsValue(last.getVariables().get("s"));
            assertThat(interpreter.getHeapStatus().getUsed()).isPositive();
        }

        @Test
        @DisplayName("模拟指标不消耗程序的随机序列")
        void testSimulatedMetricsKeepProgramRandom() {
            String program = "System.out.println(Math.random());";
            PulseInterpreter simulated = new PulseInterpreter(
                    RuntimeConfig.custom().simulatedMetrics(true).build(), RandomSource.seeded(11));
            PulseInterpreter plain = new PulseInterpreter(
                    RuntimeConfig.custom().simulatedMetrics(false).build(), RandomSource.seeded(11));
            simulated.interpret(program);
            plain.interpret(program);

            assertThat(simulated.interpret(program).getOutput()).isEqualTo(plain.interpret(program).getOutput());
        }

        @Test
        @DisplayName("启用模拟指标且没有真实收集时追加一个模拟样本")
        void testSimulatedMetrics() {
            RuntimeConfig config = RuntimeConfig.custom().simulatedMetrics(true).build();
            ExecutionResult result = new PulseInterpreter(config, RandomSource.seeded(3))
                    .interpret("int x = 1;");
            assertThat(result.getGcMetrics()).singleElement()
                    .satisfies(sample -> assertThat(sample.isSimulated()).isTrue());
        }

        @Test
        @DisplayName("默认不产生模拟样本")
        void testNoSimulatedByDefault() {
            assertThat(run("int x = 1;").getGcMetrics()).isEmpty();
        }

        @Test
        @DisplayName("triggerGC 强制收集")
        void testTriggerGc() {
            PulseInterpreter interpreter = new PulseInterpreter();
            interpreter.interpret("int x = 1;");
            GcMetricsSample sample = interpreter.triggerGC();
            assertThat(sample.getCollections()).isEqualTo(1);
            assertThat(interpreter.getGCMetrics()).containsExactly(sample);
        }

        @Test
        @DisplayName("每条语句记录快照，可前后移动")
        void testTimeTravel() {
            PulseInterpreter interpreter = new PulseInterpreter();
            interpreter.interpret(source(
                    "int x = 1;",
                    "x = 2;",
                    "x = 3;"));

            assertThat(interpreter.getSnapshots()).hasSize(3);
            assertThat(interpreter.currentSnapshot().get().getVariables().get("x"))
                    .isInstanceOf(PulseInt.class)
                    .hasToString("3");

            ExecutionSnapshot back = interpreter.stepBackInTime().get();
            assertThat(back.getLine()).isEqualTo(2);
            assertThat(back.getVariables().get("x")).hasToString("2");

            ExecutionSnapshot first = interpreter.jumpToSnapshot("snapshot_0").get();
            assertThat(first.getVariables().get("x")).hasToString("1");
            assertThat(interpreter.stepForwardInTime().get().getLine()).isEqualTo(2);
            assertThat(interpreter.jumpToSnapshot("snapshot_99")).isEmpty();
        }
    }
}
