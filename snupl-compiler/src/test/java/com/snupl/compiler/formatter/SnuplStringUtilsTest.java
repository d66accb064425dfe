package com.snupl.compiler.formatter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("转义工具")
class SnuplStringUtilsTest {

    @Test
    @DisplayName("反转义已知序列")
    void testUnescape() {
        assertThat(SnuplStringUtils.unescape("a\\tb\\n")).isEqualTo("a\tb\n");
        assertThat(SnuplStringUtils.unescape("\\\"q\\\"")).isEqualTo("\"q\"");
        assertThat(SnuplStringUtils.unescape("\\0")).isEqualTo("\0");
    }

    @Test
    @DisplayName("未知转义保留反斜杠后的字符")
    void testUnknownEscape() {
        assertThat(SnuplStringUtils.unescape("\\q")).isEqualTo("q");
        assertThat(SnuplStringUtils.unescapeChar('q')).isEqualTo(-1);
        assertThat(SnuplStringUtils.unescape("end\\")).isEqualTo("end\\");
    }

    @Test
    @DisplayName("字符与字符串转义")
    void testEscape() {
        assertThat(SnuplStringUtils.escapeChar('\'')).isEqualTo("\\'");
        assertThat(SnuplStringUtils.escapeChar('a')).isEqualTo("a");
        assertThat(SnuplStringUtils.escapeString("say \"hi\"\n")).isEqualTo("say \\\"hi\\\"\\n");
    }
}
