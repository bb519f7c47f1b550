package org.smtlib.encoding;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.smtlib.core.ArraySort;
import org.smtlib.core.BitVectorSort;
import org.smtlib.core.FunctionSort;
import org.smtlib.core.SortProvider;
import org.smtlib.core.SortSort;
import org.smtlib.core.TupleSort;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SortEncoderTest {

    private ScopeStack scopes;
    private SortEncoder encoder;

    @BeforeEach
    void setUp() {
        scopes = new ScopeStack();
        encoder = new SortEncoder(scopes);
    }

    @Nested
    @DisplayName("内置 Sort (Built-in sorts)")
    class BuiltinTests {

        @Test
        @DisplayName("Int、Bool、位向量与数组")
        void testBuiltinSorts() {
            assertAll(
                    () -> assertEquals("Int", encoder.toSmtLibSort(SortProvider.SINT)),
                    () -> assertEquals("Int", encoder.toSmtLibSort(SortProvider.UINT)),
                    () -> assertEquals("Bool", encoder.toSmtLibSort(SortProvider.BOOL)),
                    () -> assertEquals("(_ BitVec 8)", encoder.toSmtLibSort(new BitVectorSort(8))),
                    () -> assertEquals("(Array Int (_ BitVec 8))",
                            encoder.toSmtLibSort(new ArraySort(SortProvider.SINT, new BitVectorSort(8))))
            );
            assertEquals("", scopes.contents(), "Built-in sorts emit no declarations");
        }

        @Test
        @DisplayName("Sort 列表每项后跟一个空格")
        void testSortList() {
            assertEquals("(Int Bool )", encoder.toSmtLibSort(List.of(SortProvider.SINT, SortProvider.BOOL)));
            assertEquals("()", encoder.toSmtLibSort(List.of()));
        }

        @Test
        @DisplayName("函数 Sort 与 Sort 种类不能内联编码")
        void testInvalidKinds() {
            FunctionSort f = new FunctionSort(List.of(SortProvider.SINT), SortProvider.BOOL);
            assertThrows(IllegalStateException.class, () -> encoder.toSmtLibSort(f));
            assertThrows(IllegalStateException.class, () -> encoder.toSmtLibSort(new SortSort(SortProvider.SINT)));
        }
    }

    @Nested
    @DisplayName("元组 datatype (Tuple datatypes)")
    class TupleTests {

        @Test
        @DisplayName("首次使用时写出 declare-datatypes")
        void testTupleDeclaration() {
            TupleSort pair = new TupleSort("P", List.of("a", "b"), List.of(SortProvider.SINT, SortProvider.BOOL));

            assertEquals("|P|", encoder.toSmtLibSort(pair));
            assertEquals("(declare-datatypes ((|P| 0)) (((|P| (|a| Int) (|b| Bool)))))\n", scopes.contents());
            assertEquals(1, encoder.getUserSorts().size());
            assertEquals("|P|", encoder.getUserSorts().get(0).getLeft());
        }

        @Test
        @DisplayName("同名元组只声明一次，即使是不同实例")
        void testTupleDeclaredOnce() {
            TupleSort first = new TupleSort("P", List.of("a"), List.of(SortProvider.SINT));
            TupleSort second = new TupleSort("P", List.of("a"), List.of(SortProvider.SINT));

            assertEquals("|P|", encoder.toSmtLibSort(first));
            assertEquals("|P|", encoder.toSmtLibSort(first));
            assertEquals("|P|", encoder.toSmtLibSort(second));

            String contents = scopes.contents();
            assertEquals(contents.indexOf("(declare-datatypes"), contents.lastIndexOf("(declare-datatypes"));
        }

        @Test
        @DisplayName("被依赖的元组先声明")
        void testNestedTupleOrder() {
            TupleSort inner = new TupleSort("Inner", List.of("x"), List.of(SortProvider.SINT));
            TupleSort outer = new TupleSort("Outer", List.of("i", "arr"),
                    List.of(inner, new ArraySort(SortProvider.SINT, inner)));

            assertEquals("|Outer|", encoder.toSmtLibSort(outer));

            String contents = scopes.contents();
            int innerDecl = contents.indexOf("(declare-datatypes ((|Inner| 0))");
            int outerDecl = contents.indexOf("(declare-datatypes ((|Outer| 0))");
            assertAll(
                    () -> assertTrue(innerDecl >= 0),
                    () -> assertTrue(innerDecl < outerDecl),
                    () -> assertTrue(contents.contains("(|i| |Inner|) (|arr| (Array Int |Inner|))"))
            );
        }

        @Test
        @DisplayName("声明写入当前作用域，缓存跨 pop 保留")
        void testMemoSurvivesPop() {
            TupleSort pair = new TupleSort("P", List.of("a"), List.of(SortProvider.SINT));
            scopes.push();
            encoder.toSmtLibSort(pair);
            scopes.pop();

            assertEquals("|P|", encoder.toSmtLibSort(pair));
            assertEquals("", scopes.contents());
        }

        @Test
        @DisplayName("reset 清空注册表")
        void testReset() {
            TupleSort pair = new TupleSort("P", List.of("a"), List.of(SortProvider.SINT));
            encoder.toSmtLibSort(pair);
            encoder.reset();
            scopes.reset();

            encoder.toSmtLibSort(pair);
            assertTrue(scopes.contents().startsWith("(declare-datatypes ((|P| 0))"));
        }
    }
}
