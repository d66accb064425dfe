package com.snupl.cli;

import com.snupl.compiler.analysis.AnalysisResult;
import com.snupl.compiler.analysis.SemanticDiagnostic;
import com.snupl.compiler.analysis.SemanticException;
import com.snupl.compiler.ast.decl.ModuleDecl;
import com.snupl.compiler.formatter.AstDumper;
import com.snupl.compiler.formatter.DotWriter;
import com.snupl.compiler.lexer.Token;
import com.snupl.ir.IrOptions;
import com.snupl.ir.SnuplIrCompiler;
import com.snupl.ir.tac.TacModule;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 检查、编译、转储执行器。返回进程退出码：0 成功，1 失败。
 */
public class CompileRunner {

    public enum Mode {
        TAC, AST, DOT
    }

    private final PrintStream out;
    private final PrintStream err;

    public CompileRunner(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 读取 AST 并按模式输出
     */
    public int compileFile(String filePath, Mode mode, boolean cleanup, String outputPath) {
        ModuleDecl module = readModule(filePath);
        if (module == null) {
            return 1;
        }

        String result;
        switch (mode) {
            case AST:
                result = new AstDumper().dump(module);
                break;
            case DOT:
                result = new DotWriter().write(module);
                break;
            default:
                IrOptions options = new IrOptions();
                options.setCleanupControlFlow(cleanup);
                try {
                    TacModule tac = new SnuplIrCompiler(options).compile(module);
                    result = tac.toString();
                } catch (SemanticException e) {
                    err.println("语义错误" + position(e.getToken()) + ": " + e.getDetail());
                    return 1;
                }
                break;
        }
        return write(result, outputPath);
    }

    /**
     * 只做类型检查
     */
    public int checkFile(String filePath) {
        ModuleDecl module = readModule(filePath);
        if (module == null) {
            return 1;
        }
        AnalysisResult analysis = new SnuplIrCompiler().check(module);
        if (!analysis.isSuccess()) {
            SemanticDiagnostic d = analysis.getFirstError();
            err.println("语义错误" + position(d.getToken()) + ": " + d.getMessage());
            return 1;
        }
        out.println("检查通过: " + module.getName());
        return 0;
    }

    private ModuleDecl readModule(String filePath) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return null;
        }
        try {
            String json = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            return new AstJsonReader().read(json);
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + filePath + ": " + e.getMessage());
            return null;
        } catch (AstFormatException e) {
            err.println("AST 格式错误: " + e.getMessage());
            return null;
        }
    }

    private int write(String result, String outputPath) {
        if (outputPath == null) {
            out.print(result);
            out.flush();
            return 0;
        }
        try {
            Files.write(Paths.get(outputPath), result.getBytes(StandardCharsets.UTF_8));
            return 0;
        } catch (IOException e) {
            err.println("错误: 无法写入文件 - " + outputPath + ": " + e.getMessage());
            return 1;
        }
    }

    private static String position(Token token) {
        if (token == null || !token.hasPosition()) {
            return "";
        }
        return " (" + token.getLine() + ":" + token.getColumn() + ")";
    }
}
