package org.smtlib.encoding;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScopeStackTest {

    private ScopeStack scopes;

    @BeforeEach
    void setUp() {
        scopes = new ScopeStack();
        scopes.write("(set-logic ALL)");
    }

    @Test
    @DisplayName("写入追加到最顶层缓冲区并以换行结束")
    void testWriteAppendsToTop() {
        scopes.push();
        scopes.write("(assert true)");

        assertAll(
                () -> assertEquals(2, scopes.depth()),
                () -> assertEquals("(set-logic ALL)\n\n(assert true)\n", scopes.contents())
        );
    }

    @Test
    @DisplayName("push 后立即 pop 恢复原有上下文 (push/pop round trip)")
    void testPushPopRestoresContents() {
        String before = scopes.contents();

        scopes.push();
        scopes.write("(declare-fun |x| () Int)");
        scopes.push();
        scopes.write("(assert (> x 0))");
        scopes.pop();
        scopes.write("(assert (< x 0))");
        scopes.pop();

        assertEquals(before, scopes.contents());
    }

    @Test
    @DisplayName("不能弹出根作用域")
    void testPopOnRootFails() {
        assertThrows(IllegalStateException.class, scopes::pop);
        assertEquals(1, scopes.depth());
    }

    @Test
    @DisplayName("reset 只保留一个空缓冲区")
    void testReset() {
        scopes.push();
        scopes.write("(assert false)");
        scopes.reset();

        assertAll(
                () -> assertEquals(1, scopes.depth()),
                () -> assertEquals("", scopes.contents())
        );
    }
}
