package com.snupl.compiler.ast.decl;

import com.snupl.compiler.analysis.Symbol;
import com.snupl.compiler.analysis.SymbolKind;
import com.snupl.compiler.analysis.SymbolTable;
import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.analysis.types.Types;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.AstVisitor;
import com.snupl.compiler.lexer.Token;

/**
 * 模块：编译单元的根作用域
 */
public class ModuleDecl extends AstScope {

    public ModuleDecl(AstContext context, Token token, String name) {
        super(context, token, name, null, new SymbolTable());
    }

    @Override
    public Symbol createVar(String name, Type type) {
        return new Symbol(name, SymbolKind.GLOBAL, type);
    }

    @Override
    public Type getType() {
        return Types.NULL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModuleDecl(this, context);
    }
}
