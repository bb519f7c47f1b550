package org.smtlib.encoding;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.smtlib.core.BitVectorSort;
import org.smtlib.core.FunctionSort;
import org.smtlib.core.SortProvider;
import org.smtlib.core.TupleSort;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeclarationManagerTest {

    private ScopeStack scopes;
    private DeclarationManager declarations;

    @BeforeEach
    void setUp() {
        scopes = new ScopeStack();
        declarations = new DeclarationManager(scopes, new SortEncoder(scopes));
    }

    @Test
    @DisplayName("变量声明为零元函数")
    void testDeclareVariable() {
        declarations.declareVariable("x", SortProvider.SINT);
        declarations.declareVariable("b v", new BitVectorSort(4));

        assertEquals("(declare-fun |x| () Int)\n(declare-fun |b v| () (_ BitVec 4))\n", scopes.contents());
        assertTrue(declarations.isDeclared("x"));
    }

    @Test
    @DisplayName("重复声明只输出一次，即使 Sort 不同 (idempotent declare)")
    void testRedeclarationIsIgnored() {
        declarations.declareVariable("x", SortProvider.SINT);
        declarations.declareVariable("x", SortProvider.BOOL);
        declarations.declareVariable("x", SortProvider.SINT);

        assertEquals("(declare-fun |x| () Int)\n", scopes.contents());
        assertEquals(SortProvider.SINT, declarations.getVariables().get("x"));
    }

    @Test
    @DisplayName("函数声明列出参数 Sort")
    void testDeclareFunction() {
        FunctionSort f = new FunctionSort(List.of(SortProvider.SINT, SortProvider.BOOL), SortProvider.SINT);
        declarations.declareFunction("f", f);
        declarations.declareFunction("f", new FunctionSort(List.of(), SortProvider.BOOL));

        assertEquals("(declare-fun |f| (Int Bool ) Int)\n", scopes.contents());
    }

    @Test
    @DisplayName("以函数 Sort 声明变量时转为函数声明")
    void testDeclareVariableDelegatesToFunction() {
        declarations.declareVariable("g", new FunctionSort(List.of(SortProvider.SINT), SortProvider.SINT));

        assertEquals("(declare-fun |g| (Int ) Int)\n", scopes.contents());
    }

    @Test
    @DisplayName("declareFunction 需要函数 Sort")
    void testDeclareFunctionRequiresFunctionSort() {
        assertThrows(IllegalArgumentException.class, () -> declarations.declareFunction("h", SortProvider.SINT));
        assertEquals("", scopes.contents());
    }

    @Test
    @DisplayName("元组变量的 datatype 先于变量声明")
    void testTupleVariable() {
        TupleSort pair = new TupleSort("P", List.of("a"), List.of(SortProvider.SINT));
        declarations.declareVariable("p", pair);
        declarations.declareVariable("q", pair);

        assertEquals("(declare-datatypes ((|P| 0)) (((|P| (|a| Int)))))\n"
                + "(declare-fun |p| () |P|)\n"
                + "(declare-fun |q| () |P|)\n", scopes.contents());
    }
}
