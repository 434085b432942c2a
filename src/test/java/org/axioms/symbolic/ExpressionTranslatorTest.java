package org.axioms.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Status;
import com.microsoft.z3.UninterpretedSort;
import org.axioms.core.Conditional;
import org.axioms.core.Constant;
import org.axioms.core.Expression;
import org.axioms.core.Quantified;
import org.axioms.structures.OperationDecl;
import org.axioms.structures.StructureDef;
import org.axioms.structures.StructureRegistry;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.axioms.core.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ExpressionTranslatorTest {

    private Context ctx;
    private StructureRegistry structures;
    private Z3SymbolManager symbols;
    private ExpressionTranslator translator;

    @BeforeAll
    void setUpContext() {
        ctx = new Context();
    }

    @AfterAll
    void tearDown() {
        if (ctx != null) {
            ctx.close();
        }
    }

    @BeforeEach
    void setUp() {
        structures = new StructureRegistry();
        structures.registerStructure(StructureDef.builder()
                .name("Scaled")
                .member(OperationDecl.of("scale", List.of("ℝ"), "ℝ"))
                .build());
        symbols = new Z3SymbolManager(ctx, structures);
        translator = new ExpressionTranslator(symbols, OperationTranslatorRegistry.withDefaults());
    }

    private Status check(BoolExpr assertion) {
        Solver solver = ctx.mkSolver();
        solver.add(assertion);
        return solver.check();
    }

    @Nested
    @DisplayName("变量解析 (Name resolution)")
    class NameResolutionTests {

        @Test
        @DisplayName("封闭模式下自由变量应被拒绝")
        void testTranslateClosed_FreeVariable_ShouldThrow() {
            TranslationException ex = assertThrows(TranslationException.class,
                    () -> translator.translateClosed(eq(var("w"), num(0))));
            assertEquals(TranslationException.Kind.UNSUPPORTED_CONSTRUCT, ex.getKind());
        }

        @Test
        @DisplayName("开放模式下自由变量成为具名 Int 常量")
        void testTranslateOpen_FreeVariable_IsIntConstant() {
            Expr x = translator.translateOpen(var("x"));

            assertAll(
                    () -> assertTrue(x.isInt()),
                    () -> assertEquals("x", x.toString()),
                    () -> assertSame(x, symbols.findFreeVariable("x").orElseThrow()),
                    () -> assertTrue(symbols.findConstant("x").isEmpty(), "自由变量不是特殊元素")
            );
        }

        @Test
        @DisplayName("特殊元素可以以变量或零元运算的形式引用")
        void testTranslateClosed_SpecialElement() {
            Expr e = symbols.constant("e", ctx.getIntSort());

            assertAll(
                    () -> assertSame(e, translator.translateClosed(var("e"))),
                    () -> assertSame(e, translator.translateClosed(op("e")))
            );
        }

        @Test
        @DisplayName("量词约束变量遮蔽同名特殊元素")
        void testTranslate_BoundShadowsElement() {
            symbols.constant("e", ctx.getIntSort());
            BoolExpr prop = translator.translateProposition(
                    forAll(bound("e"), eq(plus(var("e"), num(0)), var("e"))), false);

            assertEquals(Status.SATISFIABLE, check(prop));
            assertEquals(Status.UNSATISFIABLE, check(ctx.mkNot(prop)));
        }
    }

    @Nested
    @DisplayName("构造翻译 (Constructs)")
    class ConstructTests {

        @Test
        @DisplayName("ℕ 类型的约束变量带有非负前提")
        void testTranslate_NaturalBound() {
            Expression prop = forAll(bound("n:ℕ"), op("geq", var("n"), num(0)));

            assertEquals(Status.UNSATISFIABLE, check(ctx.mkNot(translator.translateProposition(prop, false))));
        }

        @Test
        @DisplayName("where 守卫作为全称量词的前提，存在量词的合取项")
        void testTranslate_Guards() {
            Expression guardedForAll = Quantified.forAll(bound("x"), op("gt", var("x"), num(0)),
                    op("geq", var("x"), num(1)));
            Expression guardedExists = Quantified.exists(bound("x"), op("gt", var("x"), num(0)),
                    op("lt", var("x"), num(1)));

            assertAll(
                    () -> assertEquals(Status.UNSATISFIABLE,
                            check(ctx.mkNot(translator.translateProposition(guardedForAll, false)))),
                    () -> assertEquals(Status.UNSATISFIABLE,
                            check(translator.translateProposition(guardedExists, false)))
            );
        }

        @Test
        @DisplayName("条件表达式翻译为 ite")
        void testTranslate_Conditional() {
            Expr ite = translator.translateOpen(Conditional.of(Constant.TRUE, num(1), num(2)));

            assertAll(
                    () -> assertTrue(ite.isITE()),
                    () -> assertEquals("1", ite.simplify().toString())
            );
        }

        @Test
        @DisplayName("未解释函数按注册表中的签名定型")
        void testTranslate_UninterpretedUsesSignature() {
            Expr applied = translator.translateOpen(op("scale", num(2)));

            assertAll(
                    () -> assertTrue(applied.isReal(), "scale : ℝ → ℝ"),
                    () -> assertTrue(applied.getArgs()[0].isReal(), "整数参数被提升")
            );
        }

        @Test
        @DisplayName("非命题不能作为命题翻译")
        void testTranslateProposition_NonBoolean_ShouldThrow() {
            assertThrows(TranslationException.class,
                    () -> translator.translateProposition(plus(num(1), num(2)), true));
        }
    }

    @Nested
    @DisplayName("目标展开 (openUniversals)")
    class OpenUniversalsTests {

        @Test
        @DisplayName("前缀全称量词被剥离为见证变量")
        void testOpenUniversals_StripsPrefix() {
            Expression goal = forAll(bound("x"), forAll(bound("y:ℕ"), eq(plus(var("x"), var("y")), var("z"))));

            OpenGoal open = translator.openUniversals(goal);

            assertAll(
                    () -> assertEquals(List.of("x", "y", "z"),
                            open.getWitnesses().stream().map(p -> p.getLeft()).toList()),
                    () -> assertEquals(1, open.getPremises().size(), "ℕ 产生一个非负前提"),
                    () -> assertTrue(open.getConclusion().isEq())
            );
        }

        @Test
        @DisplayName("内层存在量词保持为 Z3 量词")
        void testOpenUniversals_KeepsInnerExists() {
            Expression goal = forAll(bound("x"), exists(bound("y"), eq(var("y"), plus(var("x"), num(1)))));

            OpenGoal open = translator.openUniversals(goal);

            assertAll(
                    () -> assertEquals(1, open.getWitnesses().size()),
                    () -> assertTrue(open.getConclusion().isQuantifier()),
                    () -> assertEquals(Status.UNSATISFIABLE, check(open.negation(ctx)))
            );
        }
    }

    @Nested
    @DisplayName("载体排序 (Carrier sorts)")
    class CarrierSortTests {

        @BeforeEach
        void registerSemigroup() {
            structures.registerStructure(StructureDef.builder()
                    .name("Semigroup")
                    .typeParameter("S")
                    .member(OperationDecl.of("•", List.of("S", "S"), "S"))
                    .build());
        }

        @Test
        @DisplayName("非内置类型名映射为未解释排序，内置类型名不变")
        void testSortFor_CarrierIsUninterpreted() {
            Sort carrier = symbols.sortFor("S");

            assertAll(
                    () -> assertTrue(carrier instanceof UninterpretedSort),
                    () -> assertSame(carrier, symbols.sortFor("S")),
                    () -> assertEquals(ctx.getIntSort(), symbols.sortFor("ℤ")),
                    () -> assertEquals(ctx.getRealSort(), symbols.sortFor("ℚ"))
            );
        }

        @Test
        @DisplayName("继承方的类型参数与被继承方共用排序")
        void testBindCarrier() {
            assertAll(
                    () -> assertTrue(symbols.bindCarrier("M", "S")),
                    () -> assertEquals(symbols.sortFor("S"), symbols.sortFor("M")),
                    () -> assertFalse(symbols.bindCarrier("M", "T"), "已绑定的别名不变"),
                    () -> assertFalse(symbols.bindCarrier("ℤ", "S"), "内置类型不能作为别名"),
                    () -> assertEquals(ctx.getIntSort(), symbols.sortFor("ℤ"))
            );
        }

        @Test
        @DisplayName("未标注类型的约束变量按运算签名推断为载体排序")
        void testOpenUniversals_InfersCarrierFromSignature() {
            Expression goal = forAll(bound("x", "y"),
                    eq(op("•", var("x"), var("y")), op("•", var("y"), var("x"))));

            OpenGoal open = translator.openUniversals(goal);

            assertAll(
                    () -> assertEquals(symbols.sortFor("S"), open.getWitnesses().get(0).getRight().getSort()),
                    () -> assertEquals(symbols.sortFor("S"), open.getWitnesses().get(1).getRight().getSort()),
                    () -> assertEquals(Status.SATISFIABLE, check(open.negation(ctx)), "交换律不是结合运算的推论")
            );
        }

        @Test
        @DisplayName("等式另一侧的已知元素决定约束变量的排序")
        void testTranslate_InfersCarrierFromEqualitySibling() {
            symbols.constant("e", symbols.sortFor("S"));

            Expr translated = translator.translateClosed(exists(bound("x"), eq(var("x"), var("e"))));

            assertAll(
                    () -> assertTrue(translated.isQuantifier()),
                    () -> assertEquals(Status.SATISFIABLE, check((BoolExpr) translated))
            );
        }

        @Test
        @DisplayName("载体上的整数比较不被当作整数序")
        void testTranslate_ComparisonOnCarrier_NotArithmetic() {
            Expression goal = forAll(bound("x:S"), op("lt", var("x"), plus(var("x"), num(1))));

            OpenGoal open = translator.openUniversals(goal);

            assertEquals(Status.SATISFIABLE, check(open.negation(ctx)));
        }

        @Test
        @DisplayName("Int 变量与载体运算混用应抛出 TranslationException")
        void testTranslate_IntIntoCarrier_ShouldThrow() {
            assertThrows(TranslationException.class,
                    () -> translator.translateOpen(op("•", var("n"), num(1))));
        }
    }
}
