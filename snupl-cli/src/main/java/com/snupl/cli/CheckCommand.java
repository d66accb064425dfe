package com.snupl.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

/**
 * picocli check 子命令：只做类型检查
 */
@Command(name = "check", description = "只做类型检查")
public class CheckCommand implements Callable<Integer> {

    @ParentCommand
    Main parent;

    @Parameters(index = "0", description = "JSON AST 文件")
    String file;

    @Override
    public Integer call() {
        return new CompileRunner(parent.getOut(), parent.getErr()).checkFile(file);
    }
}
