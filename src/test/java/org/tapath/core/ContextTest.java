package org.tapath.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ContextTest {

    private static final String DECLARATION = String.join("\n",
            "// Place global declarations here.",
            "clock x, y;",
            "const int N = 5;",
            "const int M = N;",
            "int i = 2, j, k = M;",
            "int arr[3];",
            "chan c;");

    @Nested
    @DisplayName("解析声明")
    class ParseTests {

        @Test
        @DisplayName("识别时钟、常量与变量，忽略其他行")
        void testParse() {
            Context ctx = Context.parse(DECLARATION);

            assertAll("parse",
                    () -> assertEquals(Set.of("x", "y"), ctx.getClocks()),
                    () -> assertEquals(Map.of("N", 5, "M", 5), ctx.getConstants()),
                    () -> assertEquals(Map.of("i", 2, "j", 0, "k", 5), ctx.getInitialState()),
                    () -> assertFalse(ctx.isDefined("c")),
                    () -> assertFalse(ctx.isDefined("arr"))
            );
        }

        @Test
        @DisplayName("null 与空文本得到空 Context")
        void testEmpty() {
            assertAll("empty",
                    () -> assertTrue(Context.parse(null).getClocks().isEmpty()),
                    () -> assertTrue(Context.parse("").getInitialState().isEmpty()),
                    () -> assertTrue(Context.empty().getConstants().isEmpty())
            );
        }

        @Test
        @DisplayName("缺少分号或初始化式无法解析时抛出 IllegalArgumentException")
        void testMalformed() {
            assertAll("malformed",
                    () -> assertThrows(IllegalArgumentException.class, () -> Context.parse("clock x")),
                    () -> assertThrows(IllegalArgumentException.class, () -> Context.parse("int i = UNKNOWN;"))
            );
        }

        @Test
        @DisplayName("同一标识符被声明为两类时抛出 IllegalArgumentException")
        void testNotDisjoint() {
            assertThrows(IllegalArgumentException.class, () -> Context.parse("clock x;\nint x = 1;"));
        }
    }

    @Nested
    @DisplayName("取值")
    class GetValTests {

        private final Context ctx = Context.parse(DECLARATION);

        @Test
        @DisplayName("字面量、常量与变量")
        void testGetVal() {
            assertAll("getVal",
                    () -> assertEquals(-3, ctx.getVal("-3")),
                    () -> assertEquals(5, ctx.getVal("N")),
                    () -> assertEquals(2, ctx.getVal("i"))
            );
        }

        @Test
        @DisplayName("读取时钟抛出 ClockValueException")
        void testClock() {
            ClockValueException e = assertThrows(ClockValueException.class, () -> ctx.getVal("x"));
            assertEquals("x", e.getClock());
        }

        @Test
        @DisplayName("未定义的标识符抛出 UndefinedIdentifierException 并携带标识符")
        void testUndefined() {
            UndefinedIdentifierException e = assertThrows(UndefinedIdentifierException.class, () -> ctx.getVal("zz"));
            assertEquals("zz", e.getIdentifier());
        }
    }

    @Nested
    @DisplayName("可变副本")
    class MutableTests {

        @Test
        @DisplayName("对副本的修改不影响原 Context")
        void testIndependentCopy() {
            Context ctx = Context.parse(DECLARATION);
            MutableContext copy = ctx.toMutable();
            copy.setVal("i", 42);

            assertAll("copy",
                    () -> assertEquals(42, copy.getVal("i")),
                    () -> assertEquals(2, ctx.getVal("i"))
            );
        }

        @Test
        @DisplayName("常量与时钟不可赋值，未定义的标识符报告为未定义")
        void testSetValRejects() {
            MutableContext copy = Context.parse(DECLARATION).toMutable();
            assertAll("setVal",
                    () -> assertThrows(IllegalArgumentException.class, () -> copy.setVal("N", 1)),
                    () -> assertThrows(IllegalArgumentException.class, () -> copy.setVal("x", 1)),
                    () -> assertThrows(UndefinedIdentifierException.class, () -> copy.setVal("zz", 1))
            );
        }
    }
}
