package com.snupl.compiler.ast;

import com.snupl.compiler.ast.decl.*;
import com.snupl.compiler.ast.expr.*;
import com.snupl.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 作用域 ============

    default R visitModuleDecl(ModuleDecl node, C ctx) { return null; }

    default R visitProcedureDecl(ProcedureDecl node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitAssignStmt(AssignStmt node, C ctx) { return null; }

    default R visitCallStmt(CallStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitWhileStmt(WhileStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitSpecialExpr(SpecialExpr node, C ctx) { return null; }

    default R visitFunctionCall(FunctionCall node, C ctx) { return null; }

    default R visitDesignator(Designator node, C ctx) { return null; }

    default R visitArrayDesignator(ArrayDesignator node, C ctx) { return null; }

    default R visitConstant(Constant node, C ctx) { return null; }

    default R visitStringConstant(StringConstant node, C ctx) { return null; }
}
