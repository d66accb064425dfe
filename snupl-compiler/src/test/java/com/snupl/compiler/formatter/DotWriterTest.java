package com.snupl.compiler.formatter;

import com.snupl.compiler.AstFixture;
import com.snupl.compiler.analysis.Symbol;
import com.snupl.compiler.analysis.types.Types;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.decl.ModuleDecl;
import com.snupl.compiler.ast.expr.Constant;
import com.snupl.compiler.ast.expr.Designator;
import com.snupl.compiler.ast.expr.FunctionCall;
import com.snupl.compiler.ast.stmt.AssignStmt;
import com.snupl.compiler.ast.stmt.CallStmt;
import com.snupl.compiler.lexer.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Graphviz 转储")
class DotWriterTest {

    @Test
    @DisplayName("节点、实线子边与虚线语句序列")
    void testAssign() {
        AstContext ctx = new AstContext();
        ModuleDecl module = new ModuleDecl(ctx, Token.synthetic("module"), "m");
        Symbol x = module.createVar("x", Types.INTEGER);
        module.getSymbolTable().define(x);
        Designator target = new Designator(ctx, Token.synthetic("x"), x);
        Constant one = new Constant(ctx, Token.synthetic("1"), Types.INTEGER, 1);
        module.addStatement(new AssignStmt(ctx, Token.synthetic(":="), target, one));

        String expected = ""
                + "digraph AST {\n"
                + "  graph [fontname=\"Times New Roman\",fontsize=10];\n"
                + "  node  [fontname=\"Courier New\",fontsize=10];\n"
                + "  edge  [fontname=\"Times New Roman\",fontsize=10];\n"
                + "\n"
                + "  node0 [label=\"m m\",shape=box];\n"
                + "  node3 [label=\":=\",shape=box];\n"
                + "  node1 [label=\"x\",shape=ellipse];\n"
                + "  node3 -> node1;\n"
                + "  node2 [label=\"1\",shape=ellipse];\n"
                + "  node3 -> node2;\n"
                + "  node0 -> node3 [style=dotted];\n"
                + "}\n";
        assertThat(new DotWriter().write(module)).isEqualTo(expected);
    }

    @Test
    @DisplayName("调用语句复用 FunctionCall 的节点")
    void testCallStmtSharesNode() {
        AstFixture f = new AstFixture();
        FunctionCall call = f.call("WriteLn");
        CallStmt stmt = f.callStmt(call);
        f.module.addStatement(stmt);

        assertThat(DotWriter.dotId(stmt)).isEqualTo(DotWriter.dotId(call));
        String out = new DotWriter().write(f.module);
        assertThat(out).contains("  " + DotWriter.dotId(call) + " [label=\"call WriteLn\",shape=box];\n");
        assertThat(out).contains("  node0 -> " + DotWriter.dotId(call) + " [style=dotted];\n");
    }

    @Test
    @DisplayName("嵌套过程与字符串标签转义")
    void testProcedureAndString() {
        AstFixture f = new AstFixture();
        f.procedure("p", Types.NULL);
        f.module.addStatement(f.callStmt(f.call("WriteStr", f.address(f.string("say \\\"hi\\\"", f.module)))));

        String out = new DotWriter().write(f.module);

        assertThat(out).contains("[label=\"p/f p\",shape=box];");
        assertThat(out).contains("[label=\"&()\",shape=box];");
        assertThat(out).contains("[label=\"\\\"say \\\\\\\"hi\\\\\\\"\\\"\",shape=ellipse];");
    }
}
