package org.axioms.solvers.z3;

import org.axioms.core.Expression;
import org.axioms.solvers.Counterexample;
import org.axioms.solvers.SatisfiabilityResult;
import org.axioms.solvers.SolverBackend;
import org.axioms.solvers.SolverBackends;
import org.axioms.solvers.SolverConfig;
import org.axioms.solvers.VerificationResult;
import org.axioms.structures.StructureRegistry;
import org.axioms.symbolic.OperationTranslatorRegistry;
import org.axioms.symbolic.TranslationException;
import org.junit.jupiter.api.*;

import java.util.Map;

import static org.axioms.core.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

class Z3BackendTest {

    private Z3Backend backend;

    @BeforeEach
    void setUp() {
        backend = new Z3Backend(SolverConfig.defaults(), OperationTranslatorRegistry.withDefaults(),
                new StructureRegistry());
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    @Nested
    @DisplayName("验证 (verifyAxiom)")
    class VerifyTests {

        @Test
        @DisplayName("算术恒等式成立")
        void testVerify_Identity_Valid() {
            Expression commutative = forAll(bound("a", "b"), eq(plus(var("a"), var("b")), plus(var("b"), var("a"))));

            VerificationResult result = backend.verifyAxiom(commutative);

            assertAll(
                    () -> assertEquals(VerificationResult.Status.VALID, result.getStatus()),
                    () -> assertTrue(result.getCounterexample().isEmpty()),
                    () -> assertEquals(0, backend.scopeDepth(), "验证后作用域恢复")
            );
        }

        @Test
        @DisplayName("错误命题给出反例")
        void testVerify_False_Invalid() {
            VerificationResult result = backend.verifyAxiom(forAll(bound("x:ℤ"), eq(plus(var("x"), num(1)), var("x"))));

            assertTrue(result.isInvalid());
            Counterexample counterexample = result.getCounterexample().orElseThrow();
            assertAll(
                    () -> assertTrue(counterexample.get("x").isPresent()),
                    () -> assertFalse(counterexample.getRawModel().isEmpty())
            );
        }

        @Test
        @DisplayName("无法翻译的目标返回 ERROR 而不是抛出")
        void testVerify_Untranslatable_Error() {
            VerificationResult result = backend.verifyAxiom(
                    forAll(bound("x"), eq(op("negate", var("x"), var("x")), var("x"))));

            assertAll(
                    () -> assertEquals(VerificationResult.Status.ERROR, result.getStatus()),
                    () -> assertTrue(result.getMessage().isPresent())
            );
        }
    }

    @Nested
    @DisplayName("求值与化简 (evaluate / simplify)")
    class EvaluationTests {

        @Test
        @DisplayName("常量表达式求值为数值")
        void testEvaluate_Constant() {
            assertAll(
                    () -> assertEquals(num(12), backend.evaluate(times(num(3), plus(num(2), num(2))), Map.of())),
                    () -> assertEquals(num("1/2"), backend.evaluate(op("divide", num(1), num(2)), Map.of())),
                    () -> assertEquals(num(42), backend.evaluate(plus(var("x"), num(1)), Map.of("x", num(41))))
            );
        }

        @Test
        @DisplayName("化简保留符号部分")
        void testSimplify_Symbolic() {
            Expression simplified = backend.simplify(times(plus(num(3), num(2)), var("x")));

            assertEquals(times(num(5), var("x")), simplified);
        }

        @Test
        @DisplayName("等价判断")
        void testAreEquivalent() {
            assertAll(
                    () -> assertTrue(backend.areEquivalent(plus(var("x"), var("x")), times(num(2), var("x")))),
                    () -> assertFalse(backend.areEquivalent(plus(var("x"), num(1)), var("x"))),
                    () -> assertThrows(TranslationException.class,
                            () -> backend.areEquivalent(eq(var("x"), num(0)), num(0)))
            );
        }

        @Test
        @DisplayName("可满足性检查给出见证")
        void testCheckSatisfiability() {
            SatisfiabilityResult sat = backend.checkSatisfiability(eq(times(num(2), var("y")), num(10)));
            SatisfiabilityResult unsat = backend.checkSatisfiability(and(op("gt", var("y"), num(0)),
                    op("lt", var("y"), num(0))));

            assertAll(
                    () -> assertTrue(sat.isSatisfiable()),
                    () -> assertEquals(num(5), sat.getWitness().orElseThrow().get("y").orElseThrow()),
                    () -> assertTrue(unsat.isUnsatisfiable())
            );
        }
    }

    @Nested
    @DisplayName("断言与作用域 (Assertions and scopes)")
    class ScopeTests {

        @Test
        @DisplayName("背景断言在 pop 后撤销")
        void testPushPop_RetractsAssertions() {
            backend.declareSpecialElement("c", "ℤ");
            backend.push();
            backend.assertExpression(eq(var("c"), num(3)));
            assertTrue(backend.verifyAxiom(op("gt", var("c"), num(0))).isValid());
            backend.pop();

            assertAll(
                    () -> assertFalse(backend.verifyAxiom(op("gt", var("c"), num(0))).isValid()),
                    () -> assertEquals(0, backend.scopeDepth()),
                    () -> assertThrows(IllegalStateException.class, backend::pop)
            );
        }

        @Test
        @DisplayName("背景断言中的自由变量被拒绝")
        void testAssertExpression_FreeVariable_ShouldThrow() {
            assertThrows(TranslationException.class, () -> backend.assertExpression(eq(var("w"), num(0))));
        }

        @Test
        @DisplayName("派生运算定义可用于验证")
        void testDefineFunction() {
            backend.defineFunction("twice", bound("n"), times(num(2), var("n")));

            assertAll(
                    () -> assertTrue(backend.verifyAxiom(forAll(bound("k"),
                            eq(op("twice", var("k")), plus(var("k"), var("k"))))).isValid()),
                    () -> assertEquals(1, backend.declaredOperationCount())
            );
        }

        @Test
        @DisplayName("不一致的背景理论")
        void testCheckConsistency() {
            backend.declareSpecialElement("c", "ℤ");
            assertTrue(backend.checkConsistency().isSatisfiable());

            backend.assertExpression(and(op("gt", var("c"), num(0)), op("lt", var("c"), num(0))));
            assertTrue(backend.checkConsistency().isUnsatisfiable());

            backend.reset();
            assertAll(
                    () -> assertTrue(backend.checkConsistency().isSatisfiable(), "reset 清除断言"),
                    () -> assertEquals(0, backend.declaredOperationCount())
            );
        }
    }

    @Test
    @DisplayName("按名称创建后端")
    void testSolverBackends_Create() {
        try (SolverBackend created = SolverBackends.create(SolverConfig.defaults(), new StructureRegistry())) {
            assertAll(
                    () -> assertEquals(Z3Backend.NAME, created.name()),
                    () -> assertTrue(created.capabilities().hasOperation("plus")),
                    () -> assertTrue(SolverBackends.names().contains("z3"))
            );
        }
        SolverConfig unknown = SolverConfig.builder().backendName("cvc5").build();
        assertThrows(IllegalArgumentException.class, () -> SolverBackends.create(unknown, new StructureRegistry()));
    }
}
