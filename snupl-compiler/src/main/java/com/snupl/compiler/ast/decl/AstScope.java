package com.snupl.compiler.ast.decl;

import com.snupl.compiler.analysis.Symbol;
import com.snupl.compiler.analysis.SymbolTable;
import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.AstNode;
import com.snupl.compiler.ast.stmt.Statement;
import com.snupl.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 作用域节点（模块或过程）：拥有符号表、语句序列和嵌套的子作用域。
 *
 * <p>构造时自动登记到父作用域的子作用域列表，顺序即声明顺序。</p>
 */
public abstract class AstScope extends AstNode {
    private final String name;
    private final AstScope parent;
    private final SymbolTable symbolTable;
    private final List<Statement> statements = new ArrayList<Statement>();
    private final List<AstScope> children = new ArrayList<AstScope>();

    protected AstScope(AstContext context, Token token, String name, AstScope parent, SymbolTable symbolTable) {
        super(context, token);
        this.name = name;
        this.parent = parent;
        this.symbolTable = symbolTable;
        if (parent != null) {
            parent.children.add(this);
        }
    }

    public String getName() {
        return name;
    }

    /** 外层作用域，模块为 null */
    public AstScope getParent() {
        return parent;
    }

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    public List<Statement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public void addStatement(Statement statement) {
        statements.add(statement);
    }

    public void setStatements(List<Statement> body) {
        statements.clear();
        statements.addAll(body);
    }

    public List<AstScope> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int getChildCount() {
        return children.size();
    }

    public AstScope getChild(int index) {
        return children.get(index);
    }

    /**
     * 创建一个属于本作用域的变量符号（模块中为全局变量，过程中为局部变量）。
     * 只创建，不登记到符号表。
     */
    public abstract Symbol createVar(String name, Type type);
}
