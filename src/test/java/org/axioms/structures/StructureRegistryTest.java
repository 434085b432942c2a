package org.axioms.structures;

import org.axioms.core.Expression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.axioms.core.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

class StructureRegistryTest {

    private StructureRegistry registry;
    private StructureDef semigroup;
    private StructureDef monoid;

    @BeforeEach
    void setUp() {
        registry = new StructureRegistry();
        Expression assoc = forAll(bound("x", "y", "z"),
                eq(op("•", op("•", var("x"), var("y")), var("z")), op("•", var("x"), op("•", var("y"), var("z")))));
        semigroup = StructureDef.builder()
                .name("Semigroup")
                .typeParameter("S")
                .member(OperationDecl.of("•", List.of("S", "S"), "S"))
                .member(AxiomDecl.of("assoc", assoc))
                .build();
        monoid = StructureDef.builder()
                .name("Monoid")
                .typeParameter("M")
                .extendsRef(StructureRef.of("Semigroup", "M"))
                .member(ElementDecl.of("e", "M"))
                .member(AxiomDecl.of("left_id", forAll(bound("x"), eq(op("•", var("e"), var("x")), var("x")))))
                .build();
        registry.registerStructure(semigroup);
        registry.registerStructure(monoid);
    }

    @Nested
    @DisplayName("注册 (Registration)")
    class RegistrationTests {

        @Test
        @DisplayName("重复注册同名结构应抛出 DUPLICATE_NAME")
        void testRegisterStructure_Duplicate_ShouldThrow() {
            RegistryException ex = assertThrows(RegistryException.class, () -> registry.registerStructure(semigroup));

            assertAll(
                    () -> assertEquals(RegistryException.Kind.DUPLICATE_NAME, ex.getKind()),
                    () -> assertEquals("Semigroup", ex.getStructureName())
            );
        }

        @Test
        @DisplayName("实现未注册的结构应抛出 UNKNOWN_STRUCTURE")
        void testRegisterImplements_UnknownStructure_ShouldThrow() {
            ImplementsDef impl = ImplementsDef.of("Group", List.of("ℤ"), List.of());

            RegistryException ex = assertThrows(RegistryException.class, () -> registry.registerImplements(impl));
            assertEquals(RegistryException.Kind.UNKNOWN_STRUCTURE, ex.getKind());
        }

        @Test
        @DisplayName("where 约束引用未注册的结构应抛出 UNKNOWN_STRUCTURE")
        void testRegisterImplements_UnknownWhereTarget_ShouldThrow() {
            ImplementsDef impl = ImplementsDef.of("Monoid", List.of("T"),
                    List.of(WhereConstraint.of("Ordered", "T")), List.of());

            RegistryException ex = assertThrows(RegistryException.class, () -> registry.registerImplements(impl));
            assertAll(
                    () -> assertEquals(RegistryException.Kind.UNKNOWN_STRUCTURE, ex.getKind()),
                    () -> assertEquals("Ordered", ex.getStructureName()),
                    () -> assertTrue(registry.getImplementations("Monoid").isEmpty(), "失败的注册不应留下痕迹")
            );
        }

        @Test
        @DisplayName("结构内成员名重复应在构造时被拒绝")
        void testStructureDef_DuplicateMember_ShouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> StructureDef.builder()
                    .name("Bad")
                    .member(ElementDecl.of("e"))
                    .member(OperationDecl.of("e", List.of(), "S"))
                    .build());
        }

        @Test
        @DisplayName("实现块内成员名重复应被拒绝")
        void testImplementsDef_DuplicateMember_ShouldThrow() {
            assertThrows(IllegalArgumentException.class, () -> ImplementsDef.of("Monoid", List.of("ℤ"),
                    List.of(ImplMember.element("e", num(0)), ImplMember.element("e", num(1)))));
        }
    }

    @Nested
    @DisplayName("查询 (Accessors)")
    class AccessorTests {

        @Test
        @DisplayName("extends/over/axioms 访问器")
        void testAccessors() {
            assertAll(
                    () -> assertEquals("Semigroup", registry.getExtends("Monoid").orElseThrow().getName()),
                    () -> assertTrue(registry.getOver("Monoid").isEmpty()),
                    () -> assertEquals(List.of("left_id"),
                            registry.getAxioms("Monoid").stream().map(AxiomDecl::getName).toList()),
                    () -> assertEquals(List.of("Semigroup", "Monoid"), registry.structureNames()),
                    () -> assertTrue(registry.contains("Monoid")),
                    () -> assertTrue(registry.get("Group").isEmpty())
            );
        }

        @Test
        @DisplayName("对未注册结构调用访问器应抛出 UNKNOWN_STRUCTURE")
        void testAccessors_UnknownStructure_ShouldThrow() {
            RegistryException ex = assertThrows(RegistryException.class, () -> registry.getExtends("Group"));
            assertEquals(RegistryException.Kind.UNKNOWN_STRUCTURE, ex.getKind());
        }

        @Test
        @DisplayName("where 约束汇总自所有实现块")
        void testWhereConstraints() {
            registry.registerStructure(StructureDef.builder().name("Ordered").typeParameter("T").build());
            registry.registerImplements(ImplementsDef.of("Monoid", List.of("T"),
                    List.of(WhereConstraint.of("Ordered", "T")), List.of(ImplMember.element("e", num(0)))));

            assertAll(
                    () -> assertEquals(List.of(WhereConstraint.of("Ordered", "T")), registry.getWhereConstraints("Monoid")),
                    () -> assertEquals(1, registry.getImplementations("Monoid").size()),
                    () -> assertTrue(registry.getWhereConstraints("Semigroup").isEmpty())
            );
        }

        @Test
        @DisplayName("运算签名与归属结构（含嵌套成员）")
        void testOperationSignatureAndOwners() {
            StructureDef inner = StructureDef.builder()
                    .name("AdditiveGroup")
                    .member(OperationDecl.of("⊕", List.of("ℝ", "ℝ"), "ℝ"))
                    .member(ElementDecl.of("zero", "ℝ"))
                    .build();
            registry.registerStructure(StructureDef.builder()
                    .name("Ring")
                    .member(NestedStructure.of("additive", inner))
                    .build());

            assertAll(
                    () -> assertEquals(List.of("ℝ", "ℝ"),
                            registry.getOperationSignature("⊕").orElseThrow().getParameterTypes()),
                    () -> assertTrue(registry.getOperationSignature("sin").isEmpty()),
                    () -> assertEquals(Set.of("Ring"), registry.getOperationOwners("zero")),
                    () -> assertEquals(Set.of("Monoid"), registry.getOperationOwners("e")),
                    () -> assertEquals(Set.of("Semigroup"), registry.getOperationOwners("•")),
                    () -> assertTrue(registry.getOperationOwners("assoc").isEmpty(), "公理名不是运算"),
                    () -> assertEquals(List.of("Semigroup", "Monoid"), registry.structuresWithAxioms())
            );
        }
    }
}
