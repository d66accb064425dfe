package com.snupl.compiler.analysis;

import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.analysis.types.Types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 过程/函数签名。数据类型即返回类型，过程返回 {@link Types#NULL}。
 */
public final class ProcedureSymbol extends Symbol {
    private final List<ParameterSymbol> parameters = new ArrayList<ParameterSymbol>();

    public ProcedureSymbol(String name, Type returnType) {
        super(name, SymbolKind.PROCEDURE, returnType != null ? returnType : Types.NULL);
    }

    /** 追加形参，返回新建的参数符号 */
    public ParameterSymbol addParameter(String name, Type type) {
        ParameterSymbol p = new ParameterSymbol(name, type, parameters.size());
        parameters.add(p);
        return p;
    }

    public List<ParameterSymbol> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public int getParameterCount() {
        return parameters.size();
    }

    public ParameterSymbol getParameter(int index) {
        return parameters.get(index);
    }

    public Type getReturnType() {
        return getDataType();
    }

    public boolean isFunction() {
        return !getDataType().isNull();
    }
}
