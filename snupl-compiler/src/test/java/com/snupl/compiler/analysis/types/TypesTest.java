package com.snupl.compiler.analysis.types;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("类型模型")
class TypesTest {

    @Nested
    @DisplayName("基本类型")
    class PrimitiveTypes {

        @Test
        @DisplayName("大小与标量属性")
        void testSizes() {
            assertThat(Types.INTEGER.getSize()).isEqualTo(4);
            assertThat(Types.BOOLEAN.getSize()).isEqualTo(1);
            assertThat(Types.CHAR.getSize()).isEqualTo(1);
            assertThat(Types.NULL.getSize()).isZero();
            assertThat(Types.INTEGER.isScalar()).isTrue();
            assertThat(Types.NULL.isScalar()).isFalse();
            assertThat(Types.NULL.isNull()).isTrue();
        }

        @Test
        @DisplayName("只与同种类型匹配")
        void testMatch() {
            assertThat(Types.INTEGER.match(Types.INTEGER)).isTrue();
            assertThat(Types.INTEGER.match(Types.CHAR)).isFalse();
            assertThat(Types.BOOLEAN.match(Types.pointerTo(Types.BOOLEAN))).isFalse();
        }
    }

    @Nested
    @DisplayName("指针")
    class Pointers {

        @Test
        @DisplayName("按基类型匹配")
        void testMatchByBase() {
            assertThat(Types.pointerTo(Types.INTEGER).match(Types.pointerTo(Types.INTEGER))).isTrue();
            assertThat(Types.pointerTo(Types.INTEGER).match(Types.pointerTo(Types.CHAR))).isFalse();
        }

        @Test
        @DisplayName("基类型为 NULL 的指针匹配任意指针")
        void testNullPointerMatchesAny() {
            PointerType anyPtr = Types.pointerTo(Types.NULL);
            assertThat(anyPtr.match(Types.pointerTo(Types.CHAR))).isTrue();
            assertThat(Types.pointerTo(Types.CHAR).match(anyPtr)).isTrue();
            assertThat(anyPtr.match(Types.INTEGER)).isFalse();
        }

        @Test
        @DisplayName("指针是 8 字节标量")
        void testPointerIsScalar() {
            PointerType p = Types.pointerTo(Types.INTEGER);
            assertThat(p.isScalar()).isTrue();
            assertThat(p.isPointer()).isTrue();
            assertThat(p.getSize()).isEqualTo(8);
            assertThat(p.toDisplayString()).isEqualTo("^integer");
        }
    }

    @Nested
    @DisplayName("数组")
    class ArrayTypes {

        @Test
        @DisplayName("多维数组的维数、元素类型与数据偏移")
        void testDimensions() {
            ArrayType a = Types.arrayOf(Types.INTEGER, 3, 4);
            assertThat(a.getNDim()).isEqualTo(2);
            assertThat(a.getElementCount()).isEqualTo(3);
            assertThat(((ArrayType) a.getInnerType()).getElementCount()).isEqualTo(4);
            assertThat(a.getBaseType()).isSameAs(Types.INTEGER);
            assertThat(a.getDataOffset()).isEqualTo(12);
            assertThat(a.getSize()).isEqualTo(12 + 3 * 4 * 4);
            assertThat(a.isScalar()).isFalse();
            assertThat(a.toDisplayString()).isEqualTo("integer[3][4]");
        }

        @Test
        @DisplayName("开放维度匹配任意元素数")
        void testOpenDimension() {
            ArrayType open = Types.arrayOf(ArrayType.OPEN, Types.CHAR);
            assertThat(open.match(Types.arrayOf(6, Types.CHAR))).isTrue();
            assertThat(Types.arrayOf(6, Types.CHAR).match(Types.arrayOf(7, Types.CHAR))).isFalse();
            assertThat(Types.pointerTo(open).match(Types.pointerTo(Types.arrayOf(6, Types.CHAR)))).isTrue();
            assertThat(open.toDisplayString()).isEqualTo("char[]");
        }

        @Test
        @DisplayName("非法的数组构造")
        void testInvalidConstruction() {
            assertThatThrownBy(() -> Types.arrayOf(3, Types.NULL))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> Types.arrayOf(-5, Types.INTEGER))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("null 类型显示为 <INVALID>")
    void testNameOfNull() {
        assertThat(Types.nameOf(null)).isEqualTo("<INVALID>");
        assertThat(Types.nameOf(Types.BOOLEAN)).isEqualTo("boolean");
    }
}
