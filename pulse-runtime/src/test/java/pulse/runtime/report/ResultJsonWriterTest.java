package pulse.runtime.report;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pulse.runtime.interpreter.ExecutionResult;
import pulse.runtime.interpreter.PulseInterpreter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JSON 报告测试
 */
class ResultJsonWriterTest {

    @Test
    @DisplayName("结果字段和违规列表")
    void testResultFields() {
        ExecutionResult result = new PulseInterpreter().interpret(
                "int[] a = {1};\nint v = a[2];\nSystem.out.println(v);");

        JsonObject json = new ResultJsonWriter(false).toJson(result);

        assertThat(json.get("halted").getAsBoolean()).isFalse();
        assertThat(json.get("output").getAsString()).endsWith("0\n");
        assertThat(json.getAsJsonArray("safetyViolations")).hasSize(1);
        JsonObject violation = json.getAsJsonArray("safetyViolations").get(0).getAsJsonObject();
        assertThat(violation.get("severity").getAsString()).isEqualTo("ERROR");
        assertThat(violation.get("line").getAsInt()).isEqualTo(2);
        assertThat(json.get("snapshotCount").getAsInt()).isEqualTo(3);
        assertThat(json.has("snapshots")).isFalse();
    }

    @Test
    @DisplayName("可选输出快照，文本可被重新解析")
    void testSnapshotsAndText() {
        ExecutionResult result = new PulseInterpreter().interpret("int x = 4;\nString s = \"hi\";");

        String text = new ResultJsonWriter(true).write(result);
        JsonObject json = JsonParser.parseString(text).getAsJsonObject();

        JsonObject last = json.getAsJsonArray("snapshots").get(1).getAsJsonObject();
        assertThat(last.getAsJsonObject("variables").get("x").getAsInt()).isEqualTo(4);
        assertThat(last.getAsJsonObject("variables").get("s").getAsString()).isEqualTo("hi");
        assertThat(last.getAsJsonArray("callStack").get(0).getAsString()).isEqualTo("main");
    }

    @Test
    @DisplayName("堆状态")
    void testHeapStatus() {
        PulseInterpreter interpreter = new PulseInterpreter();
        interpreter.interpret("int x = 1;");
        JsonObject heap = new ResultJsonWriter(false).toJson(interpreter.getHeapStatus());
        assertThat(heap.get("max").getAsLong()).isEqualTo(1024 * 1024);
        JsonObject offHeap = heap.getAsJsonObject("offHeap");
        assertThat(offHeap.get("allocated").getAsLong() + offHeap.get("free").getAsLong())
                .isEqualTo(offHeap.get("total").getAsLong());
    }
}
