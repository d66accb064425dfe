package com.snupl.compiler;

import com.snupl.compiler.analysis.Builtins;
import com.snupl.compiler.analysis.ProcedureSymbol;
import com.snupl.compiler.analysis.Symbol;
import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.analysis.types.Types;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.decl.AstScope;
import com.snupl.compiler.ast.decl.ModuleDecl;
import com.snupl.compiler.ast.decl.ProcedureDecl;
import com.snupl.compiler.ast.expr.*;
import com.snupl.compiler.ast.stmt.*;
import com.snupl.compiler.lexer.Token;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 测试用 AST 构建辅助：一个模块加若干便捷工厂方法
 */
public class AstFixture {

    public final AstContext ctx = new AstContext();
    public final ModuleDecl module;
    private int line = 1;

    public AstFixture() {
        module = new ModuleDecl(ctx, tok("module"), "test");
        Builtins.register(module.getSymbolTable());
    }

    public Token tok(String lexeme) {
        return new Token(lexeme, line++, 1);
    }

    public Symbol global(String name, Type type) {
        Symbol s = module.createVar(name, type);
        module.getSymbolTable().define(s);
        return s;
    }

    public ProcedureDecl procedure(String name, Type returns, Object... params) {
        ProcedureSymbol sym = new ProcedureSymbol(name, returns);
        for (int i = 0; i + 1 < params.length; i += 2) {
            sym.addParameter((String) params[i], (Type) params[i + 1]);
        }
        module.getSymbolTable().define(sym);
        return new ProcedureDecl(ctx, tok(name), module, sym);
    }

    public ProcedureSymbol proc(String name) {
        return (ProcedureSymbol) module.getSymbolTable().resolve(name);
    }

    // ============ 表达式 ============

    public Constant intConst(long v) {
        return new Constant(ctx, tok(Long.toString(v)), Types.INTEGER, v);
    }

    public Constant boolConst(boolean v) {
        return new Constant(ctx, tok(Boolean.toString(v)), Types.BOOLEAN, v ? 1 : 0);
    }

    public Constant charConst(char c) {
        return new Constant(ctx, tok("'" + c + "'"), Types.CHAR, c);
    }

    public Designator var(Symbol s) {
        return new Designator(ctx, tok(s.getName()), s);
    }

    public ArrayDesignator index(Symbol s, Expression... indices) {
        ArrayDesignator d = new ArrayDesignator(ctx, tok(s.getName()), s);
        for (Expression e : indices) {
            d.addIndex(e);
        }
        d.indicesComplete();
        return d;
    }

    public BinaryExpr binary(BinaryExpr.BinaryOp op, Expression l, Expression r) {
        return new BinaryExpr(ctx, tok(op.toSourceString()), op, l, r);
    }

    public UnaryExpr unary(UnaryExpr.UnaryOp op, Expression e) {
        return new UnaryExpr(ctx, tok(op.toSourceString()), op, e);
    }

    public SpecialExpr address(Expression e) {
        return new SpecialExpr(ctx, tok("&"), SpecialExpr.SpecialOp.ADDRESS, e, null);
    }

    public SpecialExpr deref(Expression e) {
        return new SpecialExpr(ctx, tok("^"), SpecialExpr.SpecialOp.DEREF, e, null);
    }

    public SpecialExpr cast(Type t, Expression e) {
        return new SpecialExpr(ctx, tok("cast"), SpecialExpr.SpecialOp.CAST, e, t);
    }

    public FunctionCall call(String name, Expression... args) {
        FunctionCall c = new FunctionCall(ctx, tok(name), proc(name));
        for (Expression a : args) {
            c.addArgument(a);
        }
        return c;
    }

    public StringConstant string(String value, AstScope scope) {
        return new StringConstant(ctx, tok("\"" + value + "\""), value, scope);
    }

    // ============ 语句 ============

    public AssignStmt assign(Designator target, Expression value) {
        return new AssignStmt(ctx, tok(":="), target, value);
    }

    public CallStmt callStmt(FunctionCall call) {
        return new CallStmt(ctx, call.getToken(), call);
    }

    public ReturnStmt ret(AstScope scope, Expression value) {
        return new ReturnStmt(ctx, tok("return"), scope, value);
    }

    public IfStmt ifStmt(Expression cond, List<Statement> thenBody, List<Statement> elseBody) {
        return new IfStmt(ctx, tok("if"), cond, thenBody, elseBody);
    }

    public WhileStmt whileStmt(Expression cond, Statement... body) {
        return new WhileStmt(ctx, tok("while"), cond, Arrays.asList(body));
    }

    public static List<Statement> block(Statement... statements) {
        return Arrays.asList(statements);
    }

    public static List<Statement> empty() {
        return Collections.<Statement>emptyList();
    }
}
