package org.axioms.core;

import org.axioms.utils.Rational;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.axioms.core.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

class ExpressionsTest {

    @Nested
    @DisplayName("节点构造 (Node construction)")
    class ConstructionTests {

        @Test
        @DisplayName("常量解析布尔与数值字面量")
        void testConstantParse() {
            assertAll(
                    () -> assertSame(Constant.TRUE, Constant.parse("true")),
                    () -> assertEquals(Constant.of(Rational.valueOf(3, 2)), Constant.parse("1.5")),
                    () -> assertTrue(num(12).isNumber()),
                    () -> assertEquals(Rational.valueOf(12), num(12).getNumber().orElseThrow())
            );
        }

        @Test
        @DisplayName("结构相等与 toString")
        void testEqualityAndToString() {
            Expression a = plus(var("x"), num(1));
            Expression b = op("plus", var("x"), num(1));

            assertAll(
                    () -> assertEquals(a, b),
                    () -> assertEquals(a.hashCode(), b.hashCode()),
                    () -> assertEquals("plus(x, 1)", a.toString()),
                    () -> assertEquals("∀(x : ℤ). equals(x, x)",
                            forAll(bound("x:ℤ"), eq(var("x"), var("x"))).toString())
            );
        }

        @Test
        @DisplayName("量词至少需要一个约束变量")
        void testQuantifiedWithoutVariables_ShouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> Quantified.forAll(List.of(), Constant.TRUE));
        }

        @Test
        @DisplayName("空白变量名应被拒绝")
        void testBlankVariable_ShouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> Variable.of("  "));
        }

        @Test
        @DisplayName("bound 解析可选的类型标注")
        void testBoundParsesTypes() {
            List<BoundVariable> vars = bound("x : ℝ", "y");

            assertAll(
                    () -> assertEquals("x", vars.get(0).getName()),
                    () -> assertEquals("ℝ", vars.get(0).getType().orElseThrow()),
                    () -> assertTrue(vars.get(1).getType().isEmpty())
            );
        }
    }

    @Nested
    @DisplayName("遍历 (Traversal)")
    class TraversalTests {

        @Test
        @DisplayName("自由变量不包括量词约束的变量")
        void testFreeVariables() {
            Expression e = and(
                    forAll(bound("x"), eq(op("•", var("e"), var("x")), var("x"))),
                    eq(var("x"), var("y")));

            assertEquals(Set.of("e", "x", "y"), freeVariables(e));
            assertEquals(Set.of("e"), freeVariables(forAll(bound("x"), eq(op("•", var("e"), var("x")), var("x")))));
        }

        @Test
        @DisplayName("where 守卫中的变量同样受约束")
        void testFreeVariables_GuardIsScoped() {
            Expression e = Quantified.forAll(bound("x"), op("gt", var("x"), num(0)), op("geq", var("x"), var("k")));

            assertEquals(Set.of("k"), freeVariables(e));
        }

        @Test
        @DisplayName("运算名按首次出现顺序收集")
        void testOperationNames() {
            Expression e = eq(op("•", op("•", var("x"), var("y")), var("z")), Conditional.of(Constant.TRUE, num(1), negate(num(1))));

            assertEquals(List.of("equals", "•", "negate"), List.copyOf(operationNames(e)));
        }
    }
}
