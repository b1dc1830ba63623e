package com.pulselang.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pulse.runtime.interpreter.PulseInterpreter;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("时间旅行调试命令")
class DebugShellTest {

    private PulseInterpreter interpreter;
    private StringWriter out;
    private DebugShell shell;

    @BeforeEach
    void setUp() {
        interpreter = new PulseInterpreter();
        interpreter.interpret("int x = 1;\nx = x + 1;\nx = x + 1;\nSystem.out.println(x);\n");
        out = new StringWriter();
        shell = new DebugShell(interpreter, new PrintWriter(out));
    }

    @Test
    @DisplayName("后退显示前一个快照的变量")
    void back() {
        assertThat(shell.execute(":back")).isTrue();
        assertThat(out.toString()).contains("[snapshot_2] line 3").contains("x = 3 : int");
    }

    @Test
    @DisplayName("后退多步后再前进")
    void backThenForward() {
        shell.execute(":back 3");
        assertThat(out.toString()).contains("[snapshot_0] line 1").contains("x = 1 : int");
        shell.execute(":forward");
        assertThat(out.toString()).contains("[snapshot_1] line 2");
    }

    @Test
    @DisplayName("跳转到指定快照")
    void jump() {
        shell.execute(":jump snapshot_1");
        assertThat(out.toString()).contains("x = 2 : int");
        shell.execute(":jump snapshot_99");
        assertThat(out.toString()).contains("快照不存在: snapshot_99");
    }

    @Test
    @DisplayName("堆与 GC 查询")
    void heapAndGc() {
        shell.execute(":heap");
        shell.execute(":gc");
        assertThat(out.toString()).contains("GC #1");
    }

    @Test
    @DisplayName("非法步数与未知命令不会退出")
    void invalidInput() {
        assertThat(shell.execute(":back zero")).isTrue();
        assertThat(shell.execute("hello")).isTrue();
        assertThat(out.toString()).contains("步数必须是正整数").contains("未知命令: hello");
    }

    @Test
    @DisplayName("命令可省略冒号")
    void withoutColon() {
        shell.execute("back");
        assertThat(out.toString()).contains("[snapshot_2] line 3");
        assertThat(shell.execute("quit")).isFalse();
    }

    @Test
    @DisplayName(":quit 退出")
    void quit() {
        assertThat(shell.execute(":quit")).isFalse();
    }
}
