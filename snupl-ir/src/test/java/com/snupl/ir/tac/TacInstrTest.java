package com.snupl.ir.tac;

import com.snupl.compiler.analysis.Symbol;
import com.snupl.compiler.analysis.types.Types;
import com.snupl.ir.TacFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("三地址码指令与代码块")
class TacInstrTest {

    @Test
    @DisplayName("跳转指令必须通过工厂方法创建")
    void testBranchRequiresLabel() {
        assertThatThrownBy(() -> new TacInstr(Opcode.GOTO, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TacInstr.branch(Opcode.ADD, null, new TacConst(1), new TacConst(2)))
                .isInstanceOf(IllegalArgumentException.class);
        TacInstr assign = new TacInstr(Opcode.ASSIGN, new TacConst(0), new TacConst(1), null);
        assertThatThrownBy(() -> assign.setTarget(null)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("标签与临时变量编号在块内递增")
    void testNumbering() {
        TacFixture f = new TacFixture();
        f.global("$t0", Types.INTEGER);
        CodeBlock cb = new CodeBlock(f.module);

        assertThat(cb.createLabel().getName()).isEqualTo("0");
        assertThat(cb.createLabel("if_true").getName()).isEqualTo("1_if_true");
        TacTemp t = cb.createTemp(Types.BOOLEAN);
        assertThat(t.toString()).isEqualTo("$t1");
        Symbol s = f.module.getSymbolTable().resolveLocal("$t1");
        assertThat(t.getSymbol()).isSameAs(s);
        assertThat(s.getDataType()).isSameAs(Types.BOOLEAN);
    }

    @Test
    @DisplayName("指令文本形式")
    void testToString() {
        TacFixture f = new TacFixture();
        TacName a = new TacName(f.global("a", Types.INTEGER));
        CodeBlock cb = new CodeBlock(f.module);
        TacLabel l = cb.createLabel();

        assertThat(TacInstr.branch(Opcode.NOT_EQUAL, l, a, new TacConst(3)).toString()).isEqualTo("if a # 3 goto 0");
        assertThat(new TacInstr(Opcode.DIV, a, a, new TacConst(2)).toString()).isEqualTo("a := a / 2");
        assertThat(new TacInstr(Opcode.RETURN, null, a, null).toString()).isEqualTo("return a");
        assertThat(new TacInstr(Opcode.ASSIGN, new TacReference(a, a.getSymbol()), new TacConst(1), null).toString())
                .isEqualTo("@a := 1");
        assertThat(l.toString()).isEqualTo("0:");
    }
}
