package com.snupl.compiler.formatter;

import com.snupl.compiler.AstFixture;
import com.snupl.compiler.analysis.Symbol;
import com.snupl.compiler.analysis.types.Types;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.decl.ModuleDecl;
import com.snupl.compiler.ast.decl.ProcedureDecl;
import com.snupl.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.snupl.compiler.ast.expr.Constant;
import com.snupl.compiler.ast.expr.Designator;
import com.snupl.compiler.ast.stmt.AssignStmt;
import com.snupl.compiler.lexer.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.snupl.compiler.AstFixture.block;
import static com.snupl.compiler.AstFixture.empty;
import static org.assertj.core.api.Assertions.*;

@DisplayName("AST 文本转储")
class AstDumperTest {

    @Test
    @DisplayName("模块：符号表、语句、嵌套作用域")
    void testModule() {
        AstContext ctx = new AstContext();
        ModuleDecl module = new ModuleDecl(ctx, Token.synthetic("module"), "m");
        Symbol x = module.createVar("x", Types.INTEGER);
        module.getSymbolTable().define(x);
        module.addStatement(new AssignStmt(ctx, Token.synthetic(":="),
                new Designator(ctx, Token.synthetic("x"), x),
                new Constant(ctx, Token.synthetic("1"), Types.INTEGER, 1)));

        String expected = ""
                + "module 'm' NULL\n"
                + "  symbol table:\n"
                + "    [global x: integer]\n"
                + "  statement list:\n"
                + "    := integer\n"
                + "      x integer\n"
                + "      1 integer\n"
                + "  nested scopes:\n"
                + "    empty.\n"
                + "\n";
        assertThat(new AstDumper().dump(module)).isEqualTo(expected);
    }

    @Test
    @DisplayName("空模块")
    void testEmptyModule() {
        ModuleDecl module = new ModuleDecl(new AstContext(), Token.synthetic("module"), "e");
        String out = new AstDumper().dump(module);
        assertThat(out).isEqualTo(""
                + "module 'e' NULL\n"
                + "  symbol table:\n"
                + "    empty.\n"
                + "  statement list:\n"
                + "    empty.\n"
                + "  nested scopes:\n"
                + "    empty.\n"
                + "\n");
    }

    @Test
    @DisplayName("关闭符号表输出")
    void testWithoutSymbolTables() {
        FormatConfig config = new FormatConfig();
        config.setPrintSymbolTables(false);
        ModuleDecl module = new ModuleDecl(new AstContext(), Token.synthetic("module"), "e");
        assertThat(new AstDumper(config).dump(module)).doesNotContain("symbol table:");
    }

    @Test
    @DisplayName("过程、控制流与无效类型")
    void testProcedureAndControlFlow() {
        AstFixture f = new AstFixture();
        Symbol b = f.global("b", Types.BOOLEAN);
        Symbol a = f.global("a", Types.arrayOf(Types.INTEGER, 3));
        ProcedureDecl fn = f.procedure("fn", Types.CHAR, "n", Types.INTEGER);
        fn.addStatement(f.ret(fn, f.charConst('\n')));
        f.module.addStatement(f.ifStmt(f.var(b),
                block(f.callStmt(f.call("WriteLn"))), empty()));
        f.module.addStatement(f.whileStmt(f.binary(BinaryOp.AND, f.var(b), f.boolConst(true)),
                f.callStmt(f.call("WriteInt", f.index(a, f.intConst(0), f.intConst(1))))));

        String out = new AstDumper().dump(f.module);

        assertThat(out)
                .contains("    if cond\n      b boolean\n    if-body\n      call WriteLn NULL\n"
                        + "    else-body\n      empty.\n")
                .contains("    while cond\n      && boolean\n        b boolean\n        true boolean\n"
                        + "    while-body\n      call WriteInt NULL\n        a[] <INVALID>\n")
                .contains("    procedure 'fn' char\n")
                .contains("        [parameter n: integer]\n")
                .contains("        return char\n          '\\n' char\n");
    }
}
