package com.snupl.compiler.analysis;

import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.analysis.types.Types;
import com.snupl.compiler.ast.AstNode;
import com.snupl.compiler.ast.AstVisitor;
import com.snupl.compiler.ast.decl.AstScope;
import com.snupl.compiler.ast.decl.ModuleDecl;
import com.snupl.compiler.ast.decl.ProcedureDecl;
import com.snupl.compiler.ast.expr.*;
import com.snupl.compiler.ast.stmt.*;
import com.snupl.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * 类型检查器
 *
 * <p>先检查子节点（从左到右，if/while 先条件后分支），再检查节点自身的约束。
 * 遇到第一个错误即抛出 {@link SemanticException}，不做错误恢复。</p>
 */
public class TypeChecker implements AstVisitor<Void, Void> {

    static final long INT_MIN_MAGNITUDE = 1L << 31;

    /**
     * 检查一个模块，返回至多包含一条诊断的结果
     */
    public static AnalysisResult analyze(ModuleDecl module) {
        List<SemanticDiagnostic> diagnostics = new ArrayList<SemanticDiagnostic>();
        try {
            new TypeChecker().check(module);
        } catch (SemanticException e) {
            diagnostics.add(SemanticDiagnostic.of(e));
        }
        return new AnalysisResult(module, diagnostics);
    }

    /**
     * 检查任意子树
     *
     * @throws SemanticException 第一个类型错误
     */
    public void check(AstNode node) {
        node.accept(this, null);
    }

    private static SemanticException error(ErrorKind kind, Token token, String message) {
        return new SemanticException(kind, message, token);
    }

    private static String name(Type t) {
        return Types.nameOf(t);
    }

    // ============ 作用域 ============

    @Override
    public Void visitModuleDecl(ModuleDecl node, Void ctx) {
        checkScope(node);
        return null;
    }

    @Override
    public Void visitProcedureDecl(ProcedureDecl node, Void ctx) {
        checkScope(node);
        return null;
    }

    private void checkScope(AstScope scope) {
        checkBlock(scope.getStatements());
        for (AstScope child : scope.getChildren()) {
            check(child);
        }
    }

    private void checkBlock(List<Statement> block) {
        for (Statement s : block) {
            check(s);
        }
    }

    // ============ 语句 ============

    @Override
    public Void visitAssignStmt(AssignStmt node, Void ctx) {
        Designator target = node.getTarget();
        Expression value = node.getValue();
        check(target);
        check(value);

        Type lt = target.getType();
        Type rt = value.getType();
        if (lt == null || !lt.isScalar()) {
            throw error(ErrorKind.INVALID_ASSIGN_TARGET, target.getToken(),
                    "赋值目标必须是标量类型，实际 '" + name(lt) + "'");
        }
        if (rt == null || !rt.isScalar()) {
            throw error(ErrorKind.INVALID_ASSIGN_VALUE, value.getToken(),
                    "赋值的值必须是标量类型，实际 '" + name(rt) + "'");
        }
        if (!lt.match(rt)) {
            throw error(ErrorKind.ASSIGN_TYPE_MISMATCH, node.getToken(),
                    "赋值类型不匹配，期望 '" + name(lt) + "'，实际 '" + name(rt) + "'");
        }
        return null;
    }

    @Override
    public Void visitCallStmt(CallStmt node, Void ctx) {
        check(node.getCall());
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, Void ctx) {
        Type expected = node.getScope().getType();
        Expression value = node.getValue();

        if (expected == null || expected.isNull()) {
            if (value != null) {
                throw error(ErrorKind.UNEXPECTED_RETURN_VALUE, value.getToken(),
                        "过程不能返回值");
            }
            return null;
        }
        if (value == null) {
            throw error(ErrorKind.MISSING_RETURN_VALUE, node.getToken(),
                    "函数必须返回 '" + name(expected) + "' 类型的值");
        }
        check(value);
        if (!expected.match(value.getType())) {
            throw error(ErrorKind.RETURN_TYPE_MISMATCH, value.getToken(),
                    "返回类型不匹配，期望 '" + name(expected) + "'，实际 '" + name(value.getType()) + "'");
        }
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, Void ctx) {
        checkCondition(node.getCondition());
        checkBlock(node.getThenBody());
        checkBlock(node.getElseBody());
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, Void ctx) {
        checkCondition(node.getCondition());
        checkBlock(node.getBody());
        return null;
    }

    private void checkCondition(Expression cond) {
        check(cond);
        if (!Types.isBoolean(cond.getType())) {
            throw error(ErrorKind.CONDITION_NOT_BOOLEAN, cond.getToken(),
                    "条件必须是 boolean 类型，实际 '" + name(cond.getType()) + "'");
        }
    }

    // ============ 表达式 ============

    @Override
    public Void visitBinaryExpr(BinaryExpr node, Void ctx) {
        BinaryExpr.BinaryOp op = node.getOperator();
        String opName = "'" + op.toSourceString() + "'";
        check(node.getLeft());
        check(node.getRight());

        Type lt = node.getLeft().getType();
        Type rt = node.getRight().getType();
        checkScalarOperand(node.getLeft(), lt, "左");
        checkScalarOperand(node.getRight(), rt, "右");

        if (!lt.match(rt)) {
            throw error(ErrorKind.OPERAND_TYPE_MISMATCH, node.getToken(),
                    opName + " 两侧类型不匹配: '" + name(lt) + "' 与 '" + name(rt) + "'");
        }
        if (op.isArithmetic() && !Types.isInteger(lt)) {
            throw error(ErrorKind.OPERAND_NOT_INTEGER, node.getLeft().getToken(),
                    opName + " 要求 integer 运算数，实际 '" + name(lt) + "'");
        }
        if (op.isLogical() && !Types.isBoolean(lt)) {
            throw error(ErrorKind.OPERAND_NOT_BOOLEAN, node.getLeft().getToken(),
                    opName + " 要求 boolean 运算数，实际 '" + name(lt) + "'");
        }
        if (op.isRelational() && Types.isBoolean(lt)) {
            throw error(ErrorKind.BOOLEAN_OPERAND, node.getLeft().getToken(),
                    opName + " 不能比较 boolean 运算数");
        }
        return null;
    }

    private void checkScalarOperand(Expression operand, Type t, String side) {
        if (t == null || !t.isScalar()) {
            throw error(ErrorKind.OPERAND_NOT_SCALAR, operand.getToken(),
                    side + "运算数必须是标量类型，实际 '" + name(t) + "'");
        }
        if (t.isPointer()) {
            throw error(ErrorKind.POINTER_OPERAND, operand.getToken(),
                    side + "运算数不能是指针类型 '" + name(t) + "'");
        }
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, Void ctx) {
        UnaryExpr.UnaryOp op = node.getOperator();
        Expression operand = node.getOperand();

        // -2147483648：字面量本身越界，取负后恰好是 integer 最小值。
        // 取负的字面量检查失败时整个表达式视为合法
        if (op == UnaryExpr.UnaryOp.NEG && operand instanceof Constant) {
            if (checkConstant((Constant) operand) != null) {
                return null;
            }
        } else {
            check(operand);
        }
        Type t = operand.getType();
        if (op == UnaryExpr.UnaryOp.NOT) {
            if (!Types.isBoolean(t)) {
                throw error(ErrorKind.OPERAND_NOT_BOOLEAN, operand.getToken(),
                        "'!' 要求 boolean 运算数，实际 '" + name(t) + "'");
            }
        } else if (!Types.isInteger(t)) {
            throw error(ErrorKind.OPERAND_NOT_INTEGER, operand.getToken(),
                    "'" + op.toSourceString() + "' 要求 integer 运算数，实际 '" + name(t) + "'");
        }
        return null;
    }

    @Override
    public Void visitSpecialExpr(SpecialExpr node, Void ctx) {
        Expression operand = node.getOperand();
        check(operand);
        if (node.getOperator() == SpecialExpr.SpecialOp.DEREF) {
            Type t = operand.getType();
            if (t == null || !t.isPointer()) {
                throw error(ErrorKind.DEREF_NON_POINTER, operand.getToken(),
                        "不能解引用非指针类型 '" + name(t) + "'");
            }
        }
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCall node, Void ctx) {
        ProcedureSymbol proc = node.getSymbol();
        if (node.getArgumentCount() != proc.getParameterCount()) {
            throw error(ErrorKind.ARGUMENT_COUNT_MISMATCH, node.getToken(),
                    "'" + proc.getName() + "' 需要 " + proc.getParameterCount()
                            + " 个参数，实际 " + node.getArgumentCount() + " 个");
        }
        for (int i = 0; i < node.getArgumentCount(); i++) {
            Expression arg = node.getArgument(i);
            check(arg);
            Type expected = proc.getParameter(i).getDataType();
            Type actual = arg.getType();
            if (actual == null || !expected.match(actual)) {
                throw error(ErrorKind.ARGUMENT_TYPE_MISMATCH, arg.getToken(),
                        "'" + proc.getName() + "' 第 " + (i + 1) + " 个参数类型不匹配，期望 '"
                                + name(expected) + "'，实际 '" + name(actual) + "'");
            }
        }
        return null;
    }

    @Override
    public Void visitDesignator(Designator node, Void ctx) {
        checkSymbolType(node);
        return null;
    }

    @Override
    public Void visitArrayDesignator(ArrayDesignator node, Void ctx) {
        if (!node.isFinalized()) {
            throw new IllegalStateException("indices of '" + node.getSymbol().getName() + "' are not complete");
        }
        checkSymbolType(node);
        for (Expression index : node.getIndices()) {
            check(index);
            if (!Types.isInteger(index.getType())) {
                throw error(ErrorKind.INDEX_NOT_INTEGER, index.getToken(),
                        "数组下标必须是 integer 类型，实际 '" + name(index.getType()) + "'");
            }
        }
        if (node.getType() == null) {
            throw error(ErrorKind.INVALID_ARRAY_ACCESS, node.getToken(),
                    "'" + node.getSymbol().getName() + "' 的类型 '" + name(node.getSymbol().getDataType())
                            + "' 不能用 " + node.getIndexCount() + " 个下标访问");
        }
        return null;
    }

    private void checkSymbolType(Designator node) {
        Type t = node.getSymbol().getDataType();
        if (t == null || t.isNull()) {
            throw error(ErrorKind.INVALID_DESIGNATOR_TYPE, node.getToken(),
                    "'" + node.getSymbol().getName() + "' 没有有效类型");
        }
    }

    @Override
    public Void visitConstant(Constant node, Void ctx) {
        SemanticException e = checkConstant(node);
        if (e != null) {
            throw e;
        }
        return null;
    }

    /**
     * 常量自身的约束：类型非空，值不能是 2147483648
     *
     * @return 违反的约束，合法时返回 null
     */
    private static SemanticException checkConstant(Constant node) {
        Type t = node.getType();
        if (t == null || t.isNull()) {
            return error(ErrorKind.INVALID_CONSTANT_TYPE, node.getToken(), "常量没有有效类型");
        }
        long v = node.getValue();
        if (v == INT_MIN_MAGNITUDE) {
            return error(ErrorKind.INTEGER_OUT_OF_RANGE, node.getToken(), "整数越界 (" + v + ")");
        }
        return null;
    }

    @Override
    public Void visitStringConstant(StringConstant node, Void ctx) {
        if (node.getType() == null || node.getType().isNull()) {
            throw error(ErrorKind.INVALID_STRING_TYPE, node.getToken(), "字符串常量没有有效类型");
        }
        return null;
    }
}
