package com.transpyle.ir.backend;

import com.transpyle.ir.expr.TypeTag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 声明作用域测试
 */
class DeclarationScopeTest {

    @Test
    @DisplayName("BLOCK 模式：内层声明在退出后不可见")
    void testBlockScoping() {
        DeclarationScope scope = new DeclarationScope(ScopingMode.BLOCK);
        scope.declare("x", TypeTag.INT);
        scope.enter();
        scope.declare("y", TypeTag.STRING);
        assertTrue(scope.isDeclared("x"));
        assertEquals(TypeTag.STRING, scope.lookup("y"));
        scope.exit();
        assertFalse(scope.isDeclared("y"));
        assertTrue(scope.isDeclared("x"));
    }

    @Test
    @DisplayName("BLOCK 模式：内层同名声明遮蔽外层")
    void testShadowing() {
        DeclarationScope scope = new DeclarationScope(ScopingMode.BLOCK);
        scope.declare("v", TypeTag.INT);
        scope.enter();
        scope.declare("v", TypeTag.DOUBLE);
        assertEquals(TypeTag.DOUBLE, scope.lookup("v"));
        scope.exit();
        assertEquals(TypeTag.INT, scope.lookup("v"));
    }

    @Test
    @DisplayName("FLAT 模式：所有声明全局可见")
    void testFlatScoping() {
        DeclarationScope scope = new DeclarationScope(ScopingMode.FLAT);
        scope.enter();
        scope.declare("y", TypeTag.INT);
        scope.exit();
        assertTrue(scope.isDeclared("y"));
        assertEquals(1, scope.depth());
    }

    @Test
    @DisplayName("不能退出最外层作用域")
    void testExitOutermost() {
        DeclarationScope scope = new DeclarationScope(ScopingMode.BLOCK);
        assertThrows(IllegalStateException.class, scope::exit);
    }
}
