package com.snupl.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.snupl.compiler.analysis.Builtins;
import com.snupl.compiler.analysis.ProcedureSymbol;
import com.snupl.compiler.analysis.Symbol;
import com.snupl.compiler.analysis.types.ArrayType;
import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.analysis.types.Types;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.decl.AstScope;
import com.snupl.compiler.ast.decl.ModuleDecl;
import com.snupl.compiler.ast.decl.ProcedureDecl;
import com.snupl.compiler.ast.expr.*;
import com.snupl.compiler.ast.stmt.*;
import com.snupl.compiler.formatter.SnuplStringUtils;
import com.snupl.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * 从 JSON 读取解析器产出的 AST。
 *
 * <p>先登记所有作用域的变量和过程签名，再读取语句体，
 * 因此过程可以调用在其后声明的过程。名字沿作用域链解析。</p>
 */
public class AstJsonReader {

    private final Gson gson = new GsonBuilder().create();
    private AstContext context;

    /** 待读取语句体的作用域 */
    private static final class PendingBody {
        final AstScope scope;
        final JsonObject json;

        PendingBody(AstScope scope, JsonObject json) {
            this.scope = scope;
            this.json = json;
        }
    }

    public ModuleDecl read(String json) {
        JsonObject root;
        try {
            root = gson.fromJson(json, JsonObject.class);
        } catch (JsonParseException e) {
            throw new AstFormatException("JSON 语法错误: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new AstFormatException("空的 AST 文档", 0, 0);
        }

        context = new AstContext();
        String name = root.has("name") ? root.get("name").getAsString() : "main";
        ModuleDecl module = new ModuleDecl(context, token(root, name), name);
        Builtins.register(module.getSymbolTable());

        List<PendingBody> pending = new ArrayList<PendingBody>();
        declare(module, root, pending);
        for (PendingBody p : pending) {
            p.scope.setStatements(readBlock(p.json.get("body"), p.scope));
        }
        return module;
    }

    // ========== 声明 ==========

    private void declare(AstScope scope, JsonObject json, List<PendingBody> pending) {
        String varsKey = scope instanceof ModuleDecl ? "globals" : "locals";
        for (JsonObject var : objects(json.get(varsKey))) {
            String varName = string(var, "name");
            Symbol symbol = scope.createVar(varName, parseType(string(var, "type"), var));
            if (!scope.getSymbolTable().define(symbol)) {
                throw error(var, "重复声明 '" + varName + "'");
            }
        }

        for (JsonObject proc : objects(json.get("procedures"))) {
            String procName = string(proc, "name");
            Type returns = proc.has("returns") ? parseType(string(proc, "returns"), proc) : Types.NULL;
            ProcedureSymbol symbol = new ProcedureSymbol(procName, returns);
            for (JsonObject param : objects(proc.get("params"))) {
                symbol.addParameter(string(param, "name"), parseType(string(param, "type"), param));
            }
            if (!scope.getSymbolTable().define(symbol)) {
                throw error(proc, "重复声明 '" + procName + "'");
            }
            ProcedureDecl decl;
            try {
                decl = new ProcedureDecl(context, token(proc, procName), scope, symbol);
            } catch (IllegalArgumentException e) {
                throw error(proc, e.getMessage());
            }
            declare(decl, proc, pending);
        }

        pending.add(new PendingBody(scope, json));
    }

    // ========== 语句 ==========

    private List<Statement> readBlock(JsonElement element, AstScope scope) {
        List<Statement> block = new ArrayList<Statement>();
        for (JsonObject s : objects(element)) {
            block.add(readStatement(s, scope));
        }
        return block;
    }

    private Statement readStatement(JsonObject json, AstScope scope) {
        String kind = string(json, "kind");
        switch (kind) {
            case "assign": {
                Expression target = readExpression(object(json, "target"), scope);
                if (!(target instanceof Designator)) {
                    throw error(json, "赋值目标必须是变量或数组元素");
                }
                Expression value = readExpression(object(json, "value"), scope);
                return new AssignStmt(context, token(json, ":="), (Designator) target, value);
            }
            case "call": {
                FunctionCall call = readCall(json, scope);
                return new CallStmt(context, call.getToken(), call);
            }
            case "return": {
                Expression value = json.has("value") ? readExpression(object(json, "value"), scope) : null;
                return new ReturnStmt(context, token(json, "return"), scope, value);
            }
            case "if": {
                Expression cond = readExpression(object(json, "cond"), scope);
                return new IfStmt(context, token(json, "if"), cond,
                        readBlock(json.get("then"), scope), readBlock(json.get("else"), scope));
            }
            case "while": {
                Expression cond = readExpression(object(json, "cond"), scope);
                return new WhileStmt(context, token(json, "while"), cond, readBlock(json.get("body"), scope));
            }
            default:
                throw error(json, "未知语句类型 '" + kind + "'");
        }
    }

    // ========== 表达式 ==========

    private Expression readExpression(JsonObject json, AstScope scope) {
        String kind = string(json, "kind");
        switch (kind) {
            case "binary": {
                String op = string(json, "op");
                BinaryExpr.BinaryOp binaryOp = BinaryExpr.BinaryOp.fromSource(op);
                if (binaryOp == null) {
                    throw error(json, "未知二元运算符 '" + op + "'");
                }
                Expression left = readExpression(object(json, "left"), scope);
                Expression right = readExpression(object(json, "right"), scope);
                return new BinaryExpr(context, token(json, op), binaryOp, left, right);
            }
            case "unary": {
                String op = string(json, "op");
                UnaryExpr.UnaryOp unaryOp = UnaryExpr.UnaryOp.fromSource(op);
                if (unaryOp == null) {
                    throw error(json, "未知一元运算符 '" + op + "'");
                }
                Expression operand = readExpression(object(json, "operand"), scope);
                return new UnaryExpr(context, token(json, op), unaryOp, operand);
            }
            case "address":
                return new SpecialExpr(context, token(json, "&"), SpecialExpr.SpecialOp.ADDRESS,
                        readExpression(object(json, "operand"), scope), null);
            case "deref":
                return new SpecialExpr(context, token(json, "^"), SpecialExpr.SpecialOp.DEREF,
                        readExpression(object(json, "operand"), scope), null);
            case "cast":
                return new SpecialExpr(context, token(json, "cast"), SpecialExpr.SpecialOp.CAST,
                        readExpression(object(json, "operand"), scope), parseType(string(json, "type"), json));
            case "call":
                return readCall(json, scope);
            case "var": {
                String name = string(json, "name");
                return new Designator(context, token(json, name), resolveVariable(json, name, scope));
            }
            case "index": {
                String name = string(json, "name");
                ArrayDesignator designator = new ArrayDesignator(context, token(json, name),
                        resolveVariable(json, name, scope));
                for (JsonObject index : objects(json.get("indices"))) {
                    designator.addIndex(readExpression(index, scope));
                }
                designator.indicesComplete();
                return designator;
            }
            case "int": {
                long value = integer(json, "value");
                return new Constant(context, token(json, Long.toString(value)), Types.INTEGER, value);
            }
            case "bool": {
                boolean value = bool(json, "value");
                return new Constant(context, token(json, Boolean.toString(value)), Types.BOOLEAN, value ? 1 : 0);
            }
            case "char": {
                String raw = string(json, "value");
                String c = SnuplStringUtils.unescape(raw);
                if (c.length() != 1) {
                    throw error(json, "字符常量必须是单个字符: '" + raw + "'");
                }
                return new Constant(context, token(json, "'" + raw + "'"), Types.CHAR, c.charAt(0));
            }
            case "string": {
                String value = string(json, "value");
                return new StringConstant(context, token(json, "\"" + value + "\""), value, scope);
            }
            default:
                throw error(json, "未知表达式类型 '" + kind + "'");
        }
    }

    private FunctionCall readCall(JsonObject json, AstScope scope) {
        String callee = string(json, "callee");
        Symbol symbol = scope.getSymbolTable().resolve(callee);
        if (!(symbol instanceof ProcedureSymbol)) {
            throw error(json, "未声明的过程 '" + callee + "'");
        }
        FunctionCall call = new FunctionCall(context, token(json, callee), (ProcedureSymbol) symbol);
        for (JsonObject arg : objects(json.get("args"))) {
            call.addArgument(readExpression(arg, scope));
        }
        return call;
    }

    private Symbol resolveVariable(JsonObject json, String name, AstScope scope) {
        Symbol symbol = scope.getSymbolTable().resolve(name);
        if (symbol == null) {
            throw error(json, "未声明的变量 '" + name + "'");
        }
        if (symbol instanceof ProcedureSymbol) {
            throw error(json, "'" + name + "' 是过程，不能作为变量使用");
        }
        return symbol;
    }

    // ========== 类型 ==========

    /**
     * 解析类型：integer / boolean / char，前缀 ^ 表示指针，后缀 [n] 或 [] 表示数组维度
     */
    Type parseType(String text, JsonObject at) {
        String s = text.trim();
        if (s.startsWith("^")) {
            return Types.pointerTo(parseType(s.substring(1), at));
        }
        int bracket = s.indexOf('[');
        String baseName = bracket < 0 ? s : s.substring(0, bracket).trim();
        Type base;
        switch (baseName) {
            case "integer": base = Types.INTEGER; break;
            case "boolean": base = Types.BOOLEAN; break;
            case "char":    base = Types.CHAR; break;
            default:
                throw error(at, "未知类型 '" + text + "'");
        }
        if (bracket < 0) {
            return base;
        }

        List<Integer> dims = new ArrayList<Integer>();
        int i = bracket;
        while (i < s.length()) {
            int close = s.indexOf(']', i);
            if (s.charAt(i) != '[' || close < 0) {
                throw error(at, "类型语法错误 '" + text + "'");
            }
            String n = s.substring(i + 1, close).trim();
            try {
                dims.add(n.isEmpty() ? ArrayType.OPEN : Integer.parseInt(n));
            } catch (NumberFormatException e) {
                throw error(at, "数组大小必须是整数: '" + text + "'");
            }
            i = close + 1;
        }
        int[] dimArray = new int[dims.size()];
        for (int k = 0; k < dimArray.length; k++) {
            dimArray[k] = dims.get(k);
        }
        try {
            return Types.arrayOf(base, dimArray);
        } catch (IllegalArgumentException e) {
            throw error(at, e.getMessage());
        }
    }

    // ========== JSON 辅助 ==========

    private static Token token(JsonObject json, String lexeme) {
        checkPosition(json, "line");
        checkPosition(json, "col");
        return new Token(lexeme, position(json, "line"), position(json, "col"));
    }

    private static void checkPosition(JsonObject json, String key) {
        if (json.has(key) && !isNumber(json.get(key))) {
            throw error(json, "位置字段 '" + key + "' 必须是整数");
        }
    }

    /** 位置字段缺失或不是数字时记为 0 */
    private static int position(JsonObject json, String key) {
        JsonElement e = json.get(key);
        return isNumber(e) ? e.getAsInt() : 0;
    }

    private static AstFormatException error(JsonObject json, String message) {
        return new AstFormatException(message, position(json, "line"), position(json, "col"));
    }

    private static boolean isNumber(JsonElement e) {
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isNumber();
    }

    private static long integer(JsonObject json, String key) {
        JsonElement e = json.get(key);
        if (!isNumber(e)) {
            throw error(json, "缺少整数字段 '" + key + "'");
        }
        try {
            return e.getAsBigDecimal().longValueExact();
        } catch (ArithmeticException ex) {
            throw error(json, "字段 '" + key + "' 不是 64 位整数: " + e.getAsString());
        }
    }

    private static boolean bool(JsonObject json, String key) {
        JsonElement e = json.get(key);
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isBoolean()) {
            throw error(json, "缺少布尔字段 '" + key + "'");
        }
        return e.getAsBoolean();
    }

    private static String string(JsonObject json, String key) {
        if (!json.has(key) || !json.get(key).isJsonPrimitive()) {
            throw error(json, "缺少字段 '" + key + "'");
        }
        return json.get(key).getAsString();
    }

    private static JsonObject object(JsonObject json, String key) {
        if (!json.has(key) || !json.get(key).isJsonObject()) {
            throw error(json, "缺少对象字段 '" + key + "'");
        }
        return json.getAsJsonObject(key);
    }

    /** 数组字段中的对象，字段缺失视为空 */
    private static List<JsonObject> objects(JsonElement element) {
        List<JsonObject> result = new ArrayList<JsonObject>();
        if (element == null || element.isJsonNull()) {
            return result;
        }
        if (!element.isJsonArray()) {
            throw new AstFormatException("期望 JSON 数组: " + element, 0, 0);
        }
        JsonArray array = element.getAsJsonArray();
        for (JsonElement e : array) {
            if (!e.isJsonObject()) {
                throw new AstFormatException("期望 JSON 对象: " + e, 0, 0);
            }
            result.add(e.getAsJsonObject());
        }
        return result;
    }
}
