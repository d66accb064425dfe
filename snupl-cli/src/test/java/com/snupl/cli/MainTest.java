package com.snupl.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * 命令行端到端测试
 */
@DisplayName("snuplc 命令行")
class MainTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private Path sample;
    private Path broken;

    @BeforeEach
    void setUp() throws IOException {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        sample = copy("sample.json");
        broken = copy("type_error.json");
    }

    private Path copy(String name) throws IOException {
        Path target = tempDir.resolve(name);
        Files.write(target, AstJsonReaderTest.resource(name).getBytes(StandardCharsets.UTF_8));
        return target;
    }

    private int run(String... args) {
        PrintStream o = new PrintStream(out, true, StandardCharsets.UTF_8);
        PrintStream e = new PrintStream(err, true, StandardCharsets.UTF_8);
        CommandLine cmd = new CommandLine(new Main(o, e));
        StringWriter usage = new StringWriter();
        cmd.setOut(new PrintWriter(usage, true));
        cmd.setErr(new PrintWriter(usage, true));
        int code = cmd.execute(args);
        o.print(usage);
        o.flush();
        return code;
    }

    private String stdout() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private String stderr() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("编译")
    class Compile {

        @Test
        @DisplayName("默认输出三地址码")
        void testTac() {
            assertThat(run(sample.toString())).isZero();
            assertThat(stdout())
                    .startsWith("module sample:\n")
                    .contains("\nprocedure square:\n")
                    .contains("call square")
                    .contains("dofs")
                    .contains("&() _str_1");
            assertThat(stderr()).isEmpty();
        }

        @Test
        @DisplayName("--no-cleanup 保留每条语句末尾的跳转")
        void testNoCleanup() {
            assertThat(run(sample.toString())).isZero();
            String cleaned = stdout();
            out.reset();

            assertThat(run("--no-cleanup", sample.toString())).isZero();
            String raw = stdout();
            assertThat(raw.length()).isGreaterThan(cleaned.length());
            assertThat(raw).contains("    goto 0\n0:\n");
        }

        @Test
        @DisplayName("--ast 输出文本转储")
        void testAst() {
            assertThat(run("--ast", sample.toString())).isZero();
            assertThat(stdout())
                    .startsWith("module 'sample' NULL\n")
                    .contains("    procedure 'square' integer\n")
                    .contains("[global _str_1: char[6] = \"done\\n\"]");
        }

        @Test
        @DisplayName("--dot 输出 Graphviz")
        void testDot() {
            assertThat(run("--dot", sample.toString())).isZero();
            assertThat(stdout()).startsWith("digraph AST {\n").endsWith("}\n")
                    .contains("[label=\"m sample\",shape=box];")
                    .contains("[label=\"p/f square\",shape=box];");
        }

        @Test
        @DisplayName("-o 写入文件")
        void testOutputFile() throws IOException {
            Path target = tempDir.resolve("out.tac");
            assertThat(run("-o", target.toString(), sample.toString())).isZero();
            String written = new String(Files.readAllBytes(target), StandardCharsets.UTF_8);
            assertThat(written).startsWith("module sample:\n");
            assertThat(stdout()).isEmpty();
        }

        @Test
        @DisplayName("类型错误返回 1 并报告位置")
        void testSemanticError() {
            assertThat(run(broken.toString())).isEqualTo(1);
            assertThat(stderr()).startsWith("语义错误 (3:5): 赋值类型不匹配");
            assertThat(stdout()).isEmpty();
        }

        @Test
        @DisplayName("--ast 不做类型检查")
        void testAstSkipsTypeCheck() {
            assertThat(run("--ast", broken.toString())).isZero();
            assertThat(stdout()).contains(":= integer");
        }
    }

    @Nested
    @DisplayName("参数与错误")
    class Arguments {

        @Test
        @DisplayName("缺少输入文件")
        void testMissingArgument() {
            assertThat(run()).isEqualTo(2);
            assertThat(stderr()).contains("缺少输入文件");
        }

        @Test
        @DisplayName("文件不存在")
        void testMissingFile() {
            assertThat(run(tempDir.resolve("none.json").toString())).isEqualTo(1);
            assertThat(stderr()).contains("文件不存在");
        }

        @Test
        @DisplayName("AST 格式错误")
        void testFormatError() throws IOException {
            Path bad = tempDir.resolve("bad.json");
            Files.write(bad, "{\"body\":[{\"kind\":\"loop\"}]}".getBytes(StandardCharsets.UTF_8));
            assertThat(run(bad.toString())).isEqualTo(1);
            assertThat(stderr()).contains("AST 格式错误").contains("loop");
        }

        @Test
        @DisplayName("未知选项")
        void testUnknownOption() {
            assertThat(run("--bogus", sample.toString())).isEqualTo(2);
        }

        @Test
        @DisplayName("输出模式互斥")
        void testConflictingModes() {
            assertThat(run("--ast", "--dot", sample.toString())).isEqualTo(2);
            assertThat(stdout()).contains("mutually exclusive");
            assertThat(run("--tac", "--ast", sample.toString())).isEqualTo(2);
        }

        @Test
        @DisplayName("--version")
        void testVersion() {
            assertThat(run("--version")).isZero();
            assertThat(stdout()).contains("SnuPL v0.1.0");
        }
    }

    @Nested
    @DisplayName("check 子命令")
    class Check {

        @Test
        @DisplayName("检查通过")
        void testCheckOk() {
            assertThat(run("check", sample.toString())).isZero();
            assertThat(stdout()).isEqualTo("检查通过: sample" + System.lineSeparator());
        }

        @Test
        @DisplayName("检查失败")
        void testCheckFails() {
            assertThat(run("check", broken.toString())).isEqualTo(1);
            assertThat(stderr()).contains("语义错误 (3:5)").contains("'integer'").contains("'boolean'");
        }
    }
}
