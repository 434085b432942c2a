package org.axioms.session;

import org.axioms.resolution.ResolutionException;
import org.axioms.solvers.SolverConfig;
import org.axioms.solvers.z3.Z3Backend;
import org.axioms.structures.AxiomDecl;
import org.axioms.structures.FunctionDef;
import org.axioms.structures.RegistryException;
import org.axioms.structures.StructureDef;
import org.axioms.structures.StructureRef;
import org.axioms.structures.StructureRegistry;
import org.axioms.symbolic.OperationTranslatorRegistry;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.axioms.core.Expressions.*;
import static org.axioms.session.AlgebraFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SolverSessionTest {

    private StructureRegistry registry;
    private Z3Backend backend;
    private SolverSession session;

    @BeforeEach
    void setUp() {
        registry = monoidRegistry();
        backend = new Z3Backend(SolverConfig.defaults(), OperationTranslatorRegistry.withDefaults(), registry);
        session = new SolverSession(backend, registry);
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    @Nested
    @DisplayName("加载 (ensureStructureLoaded)")
    class LoadingTests {

        @Test
        @DisplayName("依赖先于结构自身加载")
        void testEnsureLoaded_LoadsDependenciesFirst() {
            session.ensureStructureLoaded("Monoid");

            assertAll(
                    () -> assertEquals(List.of("Semigroup", "Monoid"), session.getLoaded().structures()),
                    () -> assertTrue(session.isLoaded("Semigroup")),
                    () -> assertEquals("Monoid", session.getLoaded().getSpecialElement("e").orElseThrow().getOwner()),
                    () -> assertEquals(0, backend.scopeDepth())
            );
        }

        @Test
        @DisplayName("重复加载是幂等的")
        void testEnsureLoaded_Idempotent() {
            session.ensureStructureLoaded("Monoid");
            session.ensureStructureLoaded("Monoid");
            session.ensureStructureLoaded("Semigroup");

            assertAll(
                    () -> assertEquals(2, session.getLoaded().size()),
                    () -> assertEquals(3, session.getLoadRequests()),
                    () -> assertEquals(2, session.getCacheHits())
            );
        }

        @Test
        @DisplayName("未注册的结构应抛出 RegistryException")
        void testEnsureLoaded_Unknown_ShouldThrow() {
            assertThrows(RegistryException.class, () -> session.ensureStructureLoaded("Group"));
        }

        @Test
        @DisplayName("循环依赖在任何断言之前失败")
        void testEnsureLoaded_Cycle_ShouldThrow() {
            registry.registerStructure(StructureDef.builder().name("A").overRef(StructureRef.of("B")).build());
            registry.registerStructure(StructureDef.builder().name("B").overRef(StructureRef.of("A")).build());

            assertThrows(ResolutionException.class, () -> session.ensureStructureLoaded("A"));
            assertEquals(0, session.getLoaded().size());
        }
    }

    @Nested
    @DisplayName("失败回滚 (Load failures)")
    class FailureTests {

        @Test
        @DisplayName("含自由变量的公理使结构加载失败，依赖保持已加载")
        void testLoad_FreeVariableAxiom_RollsBack() {
            registry.registerStructure(StructureDef.builder()
                    .name("Broken")
                    .extendsRef(StructureRef.of("Semigroup"))
                    .member(AxiomDecl.of("dangling", forAll(bound("x"), eq(dot(var("x"), var("w")), var("x")))))
                    .build());

            StructureLoadException ex = assertThrows(StructureLoadException.class,
                    () -> session.ensureStructureLoaded("Broken"));

            assertAll(
                    () -> assertEquals("Broken", ex.getStructureName()),
                    () -> assertEquals("dangling", ex.getMemberName()),
                    () -> assertFalse(session.isLoaded("Broken")),
                    () -> assertTrue(session.isLoaded("Semigroup")),
                    () -> assertEquals(0, backend.scopeDepth()),
                    () -> assertTrue(backend.checkConsistency().isSatisfiable())
            );
        }

        @Test
        @DisplayName("元数不匹配的公理使结构加载失败")
        void testLoad_ArityMismatch_ShouldThrow() {
            registry.registerStructure(StructureDef.builder()
                    .name("BadArity")
                    .member(AxiomDecl.of("bad", forAll(bound("x"), eq(op("negate", var("x"), var("x")), var("x")))))
                    .build());

            StructureLoadException ex = assertThrows(StructureLoadException.class,
                    () -> session.ensureStructureLoaded("BadArity"));
            assertEquals("bad", ex.getMemberName());
        }

        @Test
        @DisplayName("自递归的派生运算被拒绝")
        void testLoad_RecursiveFunction_ShouldThrow() {
            registry.registerStructure(StructureDef.builder()
                    .name("Loop")
                    .member(FunctionDef.of("f", bound("n"), plus(op("f", var("n")), num(1))))
                    .build());

            StructureLoadException ex = assertThrows(StructureLoadException.class,
                    () -> session.ensureStructureLoaded("Loop"));
            assertAll(
                    () -> assertEquals("f", ex.getMemberName()),
                    () -> assertFalse(session.isLoaded("Loop"))
            );
        }

        @Test
        @DisplayName("跨结构的互递归派生运算被拒绝")
        void testLoad_MutualRecursion_ShouldThrow() {
            registry.registerStructure(StructureDef.builder()
                    .name("Even")
                    .member(FunctionDef.of("g", bound("n"), op("h", var("n"))))
                    .build());
            registry.registerStructure(StructureDef.builder()
                    .name("Odd")
                    .member(FunctionDef.of("h", bound("n"), op("g", var("n"))))
                    .build());

            assertThrows(StructureLoadException.class, () -> session.ensureStructureLoaded("Even"));
        }
    }

    @Nested
    @DisplayName("作用域与重置 (Scopes and reset)")
    class ScopeTests {

        @Test
        @DisplayName("withPushedScope 在异常时也弹出作用域")
        void testWithPushedScope_PopsOnException() {
            assertThrows(IllegalStateException.class, () -> session.withPushedScope(() -> {
                throw new IllegalStateException("boom");
            }));
            assertEquals(0, backend.scopeDepth());
        }

        @Test
        @DisplayName("reset 清空已加载集合，之后可以重新加载")
        void testReset_AllowsReload() {
            session.ensureStructureLoaded("Monoid");
            session.reset();

            assertAll(
                    () -> assertEquals(0, session.getLoaded().size()),
                    () -> assertTrue(session.getLoaded().specialElements().isEmpty())
            );
            session.ensureStructureLoaded("Monoid");
            assertTrue(session.isLoaded("Monoid"));
        }
    }
}
