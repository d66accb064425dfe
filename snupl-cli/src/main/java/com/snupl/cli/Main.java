package com.snupl.cli;

import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.util.concurrent.Callable;

/**
 * SnuPL CLI 入口点（picocli）
 */
@Command(name = "snuplc", version = "SnuPL v0.1.0",
         mixinStandardHelpOptions = true,
         description = "对 JSON 形式的 SnuPL/1 AST 做类型检查并生成三地址码",
         subcommands = {CheckCommand.class})
public class Main implements Callable<Integer> {

    /** 输出模式，三者互斥 */
    static class OutputMode {
        @Option(names = "--tac", description = "输出三地址码（默认）")
        boolean tac;

        @Option(names = "--ast", description = "输出 AST 文本转储")
        boolean ast;

        @Option(names = "--dot", description = "输出 Graphviz 格式的 AST")
        boolean dot;
    }

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    OutputMode outputMode;

    @Option(names = "--no-cleanup", description = "不做控制流清理")
    boolean noCleanup;

    @Option(names = {"-o", "--output"}, description = "输出文件路径")
    String output;

    @Parameters(index = "0", arity = "0..1", description = "JSON AST 文件")
    String file;

    private final PrintStream out;
    private final PrintStream err;

    public Main() {
        this(System.out, System.err);
    }

    public Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    PrintStream getOut() { return out; }
    PrintStream getErr() { return err; }

    @Override
    public Integer call() {
        if (file == null) {
            err.println("错误: 缺少输入文件");
            return 2;
        }
        CompileRunner.Mode mode = CompileRunner.Mode.TAC;
        if (outputMode != null && outputMode.ast) {
            mode = CompileRunner.Mode.AST;
        } else if (outputMode != null && outputMode.dot) {
            mode = CompileRunner.Mode.DOT;
        }
        return new CompileRunner(out, err).compileFile(file, mode, !noCleanup, output);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
