package com.snupl.compiler.formatter;

import com.snupl.compiler.ast.AstNode;
import com.snupl.compiler.ast.AstVisitor;
import com.snupl.compiler.ast.decl.AstScope;
import com.snupl.compiler.ast.decl.ModuleDecl;
import com.snupl.compiler.ast.decl.ProcedureDecl;
import com.snupl.compiler.ast.expr.*;
import com.snupl.compiler.ast.stmt.*;

import java.util.List;

/**
 * AST 的 Graphviz 图转储。
 *
 * <p>节点标识为 {@code node<id>}；父子关系为实线边，同一语句序列用虚线边串联。
 * 调用语句直接复用其 FunctionCall 的节点。</p>
 */
public class DotWriter implements AstVisitor<Void, StringBuilder> {

    private static final String IND = "  ";

    public String write(AstNode root) {
        StringBuilder out = new StringBuilder();
        out.append("digraph AST {\n");
        out.append(IND).append("graph [fontname=\"Times New Roman\",fontsize=10];\n");
        out.append(IND).append("node  [fontname=\"Courier New\",fontsize=10];\n");
        out.append(IND).append("edge  [fontname=\"Times New Roman\",fontsize=10];\n");
        out.append('\n');
        root.accept(this, out);
        out.append("}\n");
        return out.toString();
    }

    /** 节点在图中的标识 */
    public static String dotId(AstNode node) {
        if (node instanceof CallStmt) {
            return dotId(((CallStmt) node).getCall());
        }
        return "node" + node.getId();
    }

    static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private void node(StringBuilder out, AstNode node, String label, String shape) {
        out.append(IND).append(dotId(node))
                .append(" [label=\"").append(escape(label)).append("\",shape=").append(shape).append("];\n");
    }

    private void edge(StringBuilder out, AstNode from, AstNode to) {
        to.accept(this, out);
        out.append(IND).append(dotId(from)).append(" -> ").append(dotId(to)).append(";\n");
    }

    private void sequence(StringBuilder out, AstNode owner, List<Statement> block) {
        String prev = dotId(owner);
        for (Statement s : block) {
            s.accept(this, out);
            out.append(IND).append(prev).append(" -> ").append(dotId(s)).append(" [style=dotted];\n");
            prev = dotId(s);
        }
    }

    // ============ 作用域 ============

    @Override
    public Void visitModuleDecl(ModuleDecl node, StringBuilder out) {
        writeScope(node, "m " + node.getName(), out);
        return null;
    }

    @Override
    public Void visitProcedureDecl(ProcedureDecl node, StringBuilder out) {
        writeScope(node, "p/f " + node.getName(), out);
        return null;
    }

    private void writeScope(AstScope scope, String label, StringBuilder out) {
        node(out, scope, label, "box");
        sequence(out, scope, scope.getStatements());
        for (AstScope child : scope.getChildren()) {
            edge(out, scope, child);
        }
    }

    // ============ 语句 ============

    @Override
    public Void visitAssignStmt(AssignStmt node, StringBuilder out) {
        node(out, node, ":=", "box");
        edge(out, node, node.getTarget());
        edge(out, node, node.getValue());
        return null;
    }

    @Override
    public Void visitCallStmt(CallStmt node, StringBuilder out) {
        node.getCall().accept(this, out);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, StringBuilder out) {
        node(out, node, "return", "box");
        if (node.hasValue()) {
            edge(out, node, node.getValue());
        }
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, StringBuilder out) {
        node(out, node, "if", "box");
        edge(out, node, node.getCondition());
        sequence(out, node, node.getThenBody());
        sequence(out, node, node.getElseBody());
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, StringBuilder out) {
        node(out, node, "while", "box");
        edge(out, node, node.getCondition());
        sequence(out, node, node.getBody());
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitBinaryExpr(BinaryExpr node, StringBuilder out) {
        node(out, node, node.getOperator().toSourceString(), "box");
        edge(out, node, node.getLeft());
        edge(out, node, node.getRight());
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, StringBuilder out) {
        node(out, node, node.getOperator().toSourceString(), "box");
        edge(out, node, node.getOperand());
        return null;
    }

    @Override
    public Void visitSpecialExpr(SpecialExpr node, StringBuilder out) {
        node(out, node, node.getOperator().toSourceString(), "box");
        edge(out, node, node.getOperand());
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCall node, StringBuilder out) {
        node(out, node, "call " + node.getSymbol().getName(), "box");
        for (Expression arg : node.getArguments()) {
            edge(out, node, arg);
        }
        return null;
    }

    @Override
    public Void visitDesignator(Designator node, StringBuilder out) {
        node(out, node, node.getSymbol().getName(), "ellipse");
        return null;
    }

    @Override
    public Void visitArrayDesignator(ArrayDesignator node, StringBuilder out) {
        node(out, node, node.getSymbol().getName() + "[]", "ellipse");
        for (Expression index : node.getIndices()) {
            edge(out, node, index);
        }
        return null;
    }

    @Override
    public Void visitConstant(Constant node, StringBuilder out) {
        node(out, node, node.getValueString(), "ellipse");
        return null;
    }

    @Override
    public Void visitStringConstant(StringConstant node, StringBuilder out) {
        node(out, node, "\"" + node.getValue() + "\"", "ellipse");
        return null;
    }
}
