package com.snupl.ir.lowering;

import com.snupl.compiler.analysis.Symbol;
import com.snupl.compiler.analysis.types.ArrayType;
import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.analysis.types.Types;
import com.snupl.compiler.ast.decl.AstScope;
import com.snupl.compiler.ast.decl.ModuleDecl;
import com.snupl.compiler.ast.expr.*;
import com.snupl.compiler.ast.stmt.*;
import com.snupl.ir.tac.CodeBlock;
import com.snupl.ir.tac.Opcode;
import com.snupl.ir.tac.TacAddr;
import com.snupl.ir.tac.TacConst;
import com.snupl.ir.tac.TacLabel;
import com.snupl.ir.tac.TacModule;
import com.snupl.ir.tac.TacName;
import com.snupl.ir.tac.TacReference;
import com.snupl.ir.tac.TacTemp;

import java.util.List;

/**
 * AST → 三地址码降级。
 *
 * <p>表达式有两种降级方式：值模式返回保存结果的操作数；条件模式不返回值，
 * 保证控制流只会到达 onTrue 或 onFalse。语句降级后总是显式跳转到调用方给出的
 * 后继标签，不隐式落空。</p>
 *
 * <p>调用前 AST 必须已通过类型检查；违反结构前提时抛出
 * {@link IllegalStateException}。</p>
 */
public class AstToTacLowering {

    private TacModule tac;

    /**
     * 降级整个模块，每个作用域生成一个代码块
     */
    public TacModule lower(ModuleDecl module) {
        tac = new TacModule(module);
        lowerScope(module);
        return tac;
    }

    // ========== 作用域 ==========

    private void lowerScope(AstScope scope) {
        CodeBlock cb = tac.getCodeBlock(scope);
        TacBuilder builder = new TacBuilder(cb);
        lowerBlock(scope.getStatements(), builder);
        for (AstScope child : scope.getChildren()) {
            lowerScope(child);
        }
    }

    /** 每条语句分配一个后继标签，语句降级后放置该标签 */
    private void lowerBlock(List<Statement> statements, TacBuilder builder) {
        for (Statement s : statements) {
            TacLabel next = builder.newLabel();
            lowerStmt(s, builder, next);
            builder.place(next);
        }
    }

    // ========== 语句 ==========

    private void lowerStmt(Statement stmt, TacBuilder builder, TacLabel next) {
        if (stmt instanceof AssignStmt) {
            lowerAssign((AssignStmt) stmt, builder);
        } else if (stmt instanceof CallStmt) {
            lowerExpr(((CallStmt) stmt).getCall(), builder);
        } else if (stmt instanceof ReturnStmt) {
            lowerReturn((ReturnStmt) stmt, builder);
        } else if (stmt instanceof IfStmt) {
            lowerIf((IfStmt) stmt, builder, next);
        } else if (stmt instanceof WhileStmt) {
            lowerWhile((WhileStmt) stmt, builder, next);
        } else {
            throw new IllegalStateException("unsupported statement: " + stmt.getClass().getSimpleName());
        }
        builder.emitGoto(next);
    }

    /** 先计算右侧的值，再计算左侧的地址 */
    private void lowerAssign(AssignStmt stmt, TacBuilder builder) {
        TacAddr value = lowerExpr(stmt.getValue(), builder);
        TacAddr target = lowerExpr(stmt.getTarget(), builder);
        builder.emitAssign(target, value);
    }

    private void lowerReturn(ReturnStmt stmt, TacBuilder builder) {
        TacAddr value = stmt.hasValue() ? lowerExpr(stmt.getValue(), builder) : null;
        builder.emitReturn(value);
    }

    private void lowerIf(IfStmt stmt, TacBuilder builder, TacLabel next) {
        TacLabel thenLabel = builder.newLabel("if_true");
        TacLabel elseLabel = builder.newLabel("if_false");

        lowerCondition(stmt.getCondition(), builder, thenLabel, elseLabel);

        builder.place(thenLabel);
        lowerBlock(stmt.getThenBody(), builder);
        builder.emitGoto(next);

        builder.place(elseLabel);
        lowerBlock(stmt.getElseBody(), builder);
        // 末尾跳转由 lowerStmt 统一发射
    }

    private void lowerWhile(WhileStmt stmt, TacBuilder builder, TacLabel next) {
        TacLabel condLabel = builder.newLabel("while_cond");
        TacLabel bodyLabel = builder.newLabel("while_body");

        builder.place(condLabel);
        lowerCondition(stmt.getCondition(), builder, bodyLabel, next);

        builder.place(bodyLabel);
        lowerBlock(stmt.getBody(), builder);
        builder.emitGoto(condLabel);
        // 之后的 goto next 不可达，由控制流清理删除
    }

    // ========== 表达式：值模式 ==========

    /**
     * 值模式降级，返回保存表达式值的操作数（过程调用返回 null）
     */
    private TacAddr lowerExpr(Expression expr, TacBuilder builder) {
        TacAddr result;
        if (expr instanceof BinaryExpr) result = lowerBinary((BinaryExpr) expr, builder);
        else if (expr instanceof UnaryExpr) result = lowerUnary((UnaryExpr) expr, builder);
        else if (expr instanceof SpecialExpr) result = lowerSpecial((SpecialExpr) expr, builder);
        else if (expr instanceof FunctionCall) result = lowerCall((FunctionCall) expr, builder);
        else if (expr instanceof ArrayDesignator) result = lowerArrayDesignator((ArrayDesignator) expr, builder);
        else if (expr instanceof Designator) result = new TacName(((Designator) expr).getSymbol());
        else if (expr instanceof Constant) result = new TacConst(((Constant) expr).getValue());
        else if (expr instanceof StringConstant) result = new TacName(((StringConstant) expr).getSymbol());
        else throw new IllegalStateException("unsupported expression: " + expr.getClass().getSimpleName());

        if (result != null) {
            tac.setOperand(expr, result);
        }
        return result;
    }

    private TacAddr lowerBinary(BinaryExpr expr, TacBuilder builder) {
        BinaryExpr.BinaryOp op = expr.getOperator();
        if (op.isArithmetic()) {
            TacAddr left = lowerExpr(expr.getLeft(), builder);
            TacAddr right = lowerExpr(expr.getRight(), builder);
            return builder.emitBinary(toOpcode(op), Types.INTEGER, left, right);
        }
        return materialize(expr, builder);
    }

    private TacAddr lowerUnary(UnaryExpr expr, TacBuilder builder) {
        UnaryExpr.UnaryOp op = expr.getOperator();
        if (op == UnaryExpr.UnaryOp.NOT) {
            return materialize(expr, builder);
        }
        // 字面量直接折叠，-2147483648 只能由此得到
        if (expr.getOperand() instanceof Constant) {
            long v = ((Constant) expr.getOperand()).getValue();
            return new TacConst(op == UnaryExpr.UnaryOp.NEG ? -v : v);
        }
        TacAddr operand = lowerExpr(expr.getOperand(), builder);
        return builder.emitUnary(op == UnaryExpr.UnaryOp.NEG ? Opcode.NEG : Opcode.POS, Types.INTEGER, operand);
    }

    private TacAddr lowerSpecial(SpecialExpr expr, TacBuilder builder) {
        TacAddr operand = lowerExpr(expr.getOperand(), builder);
        switch (expr.getOperator()) {
            case ADDRESS:
                return builder.emitUnary(Opcode.ADDRESS, expr.getType(), operand);
            case DEREF: {
                Type t = expr.getOperand().getType();
                if (t == null || !t.isPointer()) {
                    throw new IllegalStateException("dereference of non-pointer type " + Types.nameOf(t));
                }
                TacName address = asName(operand, t, builder);
                Symbol symbol = expr.getOperand() instanceof Designator
                        ? ((Designator) expr.getOperand()).getSymbol()
                        : address.getSymbol();
                return new TacReference(address, symbol);
            }
            case CAST:
                return builder.emitUnary(Opcode.CAST, expr.getCastType(), operand);
            default:
                throw new IllegalStateException("unsupported operator: " + expr.getOperator());
        }
    }

    /** 保证操作数是具名变量，必要时复制到临时变量 */
    private TacName asName(TacAddr operand, Type type, TacBuilder builder) {
        if (operand instanceof TacName) {
            return (TacName) operand;
        }
        TacTemp t = builder.newTemp(type);
        builder.emitAssign(t, operand);
        return t;
    }

    /**
     * 参数从最后一个开始逐个求值并压入，第 0 个最后压入
     */
    private TacAddr lowerCall(FunctionCall call, TacBuilder builder) {
        for (int i = call.getArgumentCount() - 1; i >= 0; i--) {
            TacAddr arg = lowerExpr(call.getArgument(i), builder);
            builder.emitParam(i, arg);
        }
        return builder.emitCall(call.getSymbol());
    }

    /**
     * 数组元素地址：按维展开下标 idx = (..(i0 * d1 + i1) * d2 + ..)，
     * 乘以元素大小，加上数据偏移和数组起始地址。
     */
    private TacAddr lowerArrayDesignator(ArrayDesignator expr, TacBuilder builder) {
        if (!expr.isFinalized()) {
            throw new IllegalStateException("indices of '" + expr.getSymbol().getName() + "' are not complete");
        }
        Symbol symbol = expr.getSymbol();
        ArrayType arrayType = expr.getArrayType();
        if (arrayType == null) {
            throw new IllegalStateException("'" + symbol.getName() + "' is not an array");
        }

        // 指向数组的指针本身就是数组地址
        TacAddr base;
        if (symbol.isPointer()) {
            base = new TacName(symbol);
        } else {
            base = builder.emitUnary(Opcode.ADDRESS, Types.pointerTo(arrayType), new TacName(symbol));
        }

        int ndim = arrayType.getNDim();
        TacAddr idx = expr.getIndexCount() > 0 ? lowerExpr(expr.getIndex(0), builder) : new TacConst(0);
        for (int i = 1; i < ndim; i++) {
            TacAddr extent = builder.emitDim(Types.INTEGER, base, i + 1);
            idx = builder.emitBinary(Opcode.MUL, Types.INTEGER, idx, extent);
            TacAddr next = i < expr.getIndexCount() ? lowerExpr(expr.getIndex(i), builder) : new TacConst(0);
            idx = builder.emitBinary(Opcode.ADD, Types.INTEGER, idx, next);
        }

        Type elementType = arrayType.getBaseType();
        TacAddr offset = builder.emitBinary(Opcode.MUL, Types.INTEGER, idx, new TacConst(elementType.getSize()));
        TacAddr dataOffset = builder.emitDofs(Types.INTEGER, base);
        offset = builder.emitBinary(Opcode.ADD, Types.INTEGER, offset, dataOffset);
        TacTemp address = builder.emitBinary(Opcode.ADD, Types.pointerTo(elementType), base, offset);
        return new TacReference(address, symbol);
    }

    /**
     * 布尔值物化：条件模式跳转到 ltrue/lfalse，分别赋值 1 和 0
     */
    private TacAddr materialize(Expression expr, TacBuilder builder) {
        TacLabel ltrue = builder.newLabel();
        TacLabel lfalse = builder.newLabel();
        TacLabel lend = builder.newLabel();

        lowerCondition(expr, builder, ltrue, lfalse);

        TacTemp value = builder.newTemp(Types.BOOLEAN);
        builder.place(ltrue);
        builder.emitAssign(value, new TacConst(1));
        builder.emitGoto(lend);
        builder.place(lfalse);
        builder.emitAssign(value, new TacConst(0));
        builder.place(lend);
        return value;
    }

    // ========== 表达式：条件模式 ==========

    /**
     * 条件模式降级：控制流只会转到 onTrue 或 onFalse
     */
    private void lowerCondition(Expression expr, TacBuilder builder, TacLabel onTrue, TacLabel onFalse) {
        if (expr instanceof BinaryExpr) {
            lowerBinaryCondition((BinaryExpr) expr, builder, onTrue, onFalse);
        } else if (expr instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expr;
            if (unary.getOperator() != UnaryExpr.UnaryOp.NOT) {
                throw new IllegalStateException("'" + unary.getOperator().toSourceString() + "' is not a condition");
            }
            lowerCondition(unary.getOperand(), builder, onFalse, onTrue);
        } else if (expr instanceof Constant) {
            builder.emitGoto(((Constant) expr).getValue() != 0 ? onTrue : onFalse);
        } else {
            if (!Types.isBoolean(expr.getType())) {
                throw new IllegalStateException("condition of type " + Types.nameOf(expr.getType()));
            }
            TacAddr value = lowerExpr(expr, builder);
            builder.emitBranch(Opcode.EQUAL, onTrue, value, new TacConst(1));
            builder.emitGoto(onFalse);
        }
    }

    private void lowerBinaryCondition(BinaryExpr expr, TacBuilder builder, TacLabel onTrue, TacLabel onFalse) {
        BinaryExpr.BinaryOp op = expr.getOperator();
        if (op.isArithmetic()) {
            throw new IllegalStateException("'" + op.toSourceString() + "' is not a condition");
        }
        if (op == BinaryExpr.BinaryOp.AND) {
            TacLabel mid = builder.newLabel();
            lowerCondition(expr.getLeft(), builder, mid, onFalse);
            builder.place(mid);
            lowerCondition(expr.getRight(), builder, onTrue, onFalse);
        } else if (op == BinaryExpr.BinaryOp.OR) {
            TacLabel mid = builder.newLabel();
            lowerCondition(expr.getLeft(), builder, onTrue, mid);
            builder.place(mid);
            lowerCondition(expr.getRight(), builder, onTrue, onFalse);
        } else {
            TacAddr left = lowerExpr(expr.getLeft(), builder);
            TacAddr right = lowerExpr(expr.getRight(), builder);
            builder.emitBranch(toOpcode(op), onTrue, left, right);
            builder.emitGoto(onFalse);
        }
    }

    /** 运算符与操作码同名 */
    private static Opcode toOpcode(BinaryExpr.BinaryOp op) {
        return Opcode.valueOf(op.name());
    }
}
