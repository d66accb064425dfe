package com.snupl.compiler.formatter;

import com.snupl.compiler.analysis.Symbol;
import com.snupl.compiler.analysis.types.Types;
import com.snupl.compiler.ast.AstNode;
import com.snupl.compiler.ast.AstVisitor;
import com.snupl.compiler.ast.decl.AstScope;
import com.snupl.compiler.ast.decl.ModuleDecl;
import com.snupl.compiler.ast.decl.ProcedureDecl;
import com.snupl.compiler.ast.expr.*;
import com.snupl.compiler.ast.stmt.*;

import java.util.List;

/**
 * AST 文本转储：按缩进逐行列出节点及其静态类型，类型未知时显示 {@code <INVALID>}。
 * 只读遍历，不影响语义。
 */
public class AstDumper implements AstVisitor<Void, FormatterContext> {

    private final FormatConfig config;

    public AstDumper() {
        this(new FormatConfig());
    }

    public AstDumper(FormatConfig config) {
        this.config = config;
    }

    public String dump(AstNode node) {
        FormatterContext ctx = new FormatterContext(config);
        node.accept(this, ctx);
        return ctx.getOutput();
    }

    /** 节点行：标签 + 类型，然后缩进输出子节点 */
    private void header(FormatterContext ctx, String label, AstNode node) {
        ctx.line(label + " " + Types.nameOf(node.getType()));
    }

    private void children(FormatterContext ctx, List<? extends AstNode> nodes) {
        ctx.indent();
        for (AstNode n : nodes) {
            n.accept(this, ctx);
        }
        ctx.dedent();
    }

    private void child(FormatterContext ctx, AstNode node) {
        ctx.indent();
        node.accept(this, ctx);
        ctx.dedent();
    }

    /** 带标题的语句块，空块输出 empty. */
    private void section(FormatterContext ctx, String title, List<? extends AstNode> nodes) {
        ctx.line(title);
        if (nodes.isEmpty()) {
            ctx.indent();
            ctx.line("empty.");
            ctx.dedent();
        } else {
            children(ctx, nodes);
        }
    }

    // ============ 作用域 ============

    @Override
    public Void visitModuleDecl(ModuleDecl node, FormatterContext ctx) {
        dumpScope(node, "module", ctx);
        return null;
    }

    @Override
    public Void visitProcedureDecl(ProcedureDecl node, FormatterContext ctx) {
        dumpScope(node, "procedure", ctx);
        return null;
    }

    private void dumpScope(AstScope scope, String kind, FormatterContext ctx) {
        ctx.line(kind + " '" + scope.getName() + "' " + Types.nameOf(scope.getType()));
        ctx.indent();
        if (ctx.getConfig().isPrintSymbolTables()) {
            ctx.line("symbol table:");
            ctx.indent();
            List<Symbol> symbols = scope.getSymbolTable().getSymbols();
            if (symbols.isEmpty()) {
                ctx.line("empty.");
            }
            for (Symbol s : symbols) {
                ctx.line(s.toString());
            }
            ctx.dedent();
        }
        section(ctx, "statement list:", scope.getStatements());
        section(ctx, "nested scopes:", scope.getChildren());
        ctx.dedent();
        ctx.newLine();
    }

    // ============ 语句 ============

    @Override
    public Void visitAssignStmt(AssignStmt node, FormatterContext ctx) {
        header(ctx, ":=", node);
        child(ctx, node.getTarget());
        child(ctx, node.getValue());
        return null;
    }

    @Override
    public Void visitCallStmt(CallStmt node, FormatterContext ctx) {
        node.getCall().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, FormatterContext ctx) {
        header(ctx, "return", node);
        if (node.hasValue()) {
            child(ctx, node.getValue());
        }
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, FormatterContext ctx) {
        ctx.line("if cond");
        child(ctx, node.getCondition());
        section(ctx, "if-body", node.getThenBody());
        section(ctx, "else-body", node.getElseBody());
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, FormatterContext ctx) {
        ctx.line("while cond");
        child(ctx, node.getCondition());
        section(ctx, "while-body", node.getBody());
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitBinaryExpr(BinaryExpr node, FormatterContext ctx) {
        header(ctx, node.getOperator().toSourceString(), node);
        child(ctx, node.getLeft());
        child(ctx, node.getRight());
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, FormatterContext ctx) {
        header(ctx, node.getOperator().toSourceString(), node);
        child(ctx, node.getOperand());
        return null;
    }

    @Override
    public Void visitSpecialExpr(SpecialExpr node, FormatterContext ctx) {
        header(ctx, node.getOperator().toSourceString(), node);
        child(ctx, node.getOperand());
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCall node, FormatterContext ctx) {
        header(ctx, "call " + node.getSymbol().getName(), node);
        children(ctx, node.getArguments());
        return null;
    }

    @Override
    public Void visitDesignator(Designator node, FormatterContext ctx) {
        header(ctx, node.getSymbol().getName(), node);
        return null;
    }

    @Override
    public Void visitArrayDesignator(ArrayDesignator node, FormatterContext ctx) {
        header(ctx, node.getSymbol().getName() + "[]", node);
        children(ctx, node.getIndices());
        return null;
    }

    @Override
    public Void visitConstant(Constant node, FormatterContext ctx) {
        header(ctx, node.getValueString(), node);
        return null;
    }

    @Override
    public Void visitStringConstant(StringConstant node, FormatterContext ctx) {
        header(ctx, "\"" + node.getValue() + "\"", node);
        return null;
    }
}
