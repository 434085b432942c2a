package org.axioms.structures;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 代数结构定义：名称、类型参数、可选的父结构 (extends) 与参数结构 (over)，以及成员列表。
 * 同一结构内成员名必须唯一。
 * 此类是不可变的。
 */
@Getter
public final class StructureDef {
    private static final Logger logger = LoggerFactory.getLogger(StructureDef.class);

    private final String name;
    private final List<String> typeParameters;
    private final List<Member> members;

    @Getter(lombok.AccessLevel.NONE)
    private final StructureRef extendsRef;
    @Getter(lombok.AccessLevel.NONE)
    private final StructureRef overRef;

    @Builder
    private StructureDef(String name, @Singular List<String> typeParameters, StructureRef extendsRef,
                         StructureRef overRef, @Singular List<Member> members) {
        this.name = Validate.notBlank(name, "StructureDef-构造函数: name 不能为空");
        this.typeParameters = List.copyOf(Objects.requireNonNull(typeParameters, "StructureDef-构造函数: typeParameters 不能为 null"));
        this.members = List.copyOf(Objects.requireNonNull(members, "StructureDef-构造函数: members 不能为 null"));
        this.extendsRef = extendsRef;
        this.overRef = overRef;

        Set<String> seen = new HashSet<>();
        for (Member member : this.members) {
            if (!seen.add(member.getName())) {
                logger.error("StructureDef-构造函数: 结构 {} 中成员名 {} 重复", name, member.getName());
                throw new IllegalArgumentException("StructureDef-构造函数: 结构 " + name + " 中成员名重复: "
                        + member.getName());
            }
        }
    }

    public Optional<StructureRef> getExtends() {
        return Optional.ofNullable(extendsRef);
    }

    public Optional<StructureRef> getOver() {
        return Optional.ofNullable(overRef);
    }

    public List<AxiomDecl> getAxioms() {
        return membersOf(AxiomDecl.class);
    }

    public List<OperationDecl> getOperations() {
        return membersOf(OperationDecl.class);
    }

    public List<ElementDecl> getElements() {
        return membersOf(ElementDecl.class);
    }

    public List<NestedStructure> getNested() {
        return membersOf(NestedStructure.class);
    }

    public List<FunctionDef> getFunctions() {
        return membersOf(FunctionDef.class);
    }

    public Optional<Member> findMember(String memberName) {
        return members.stream().filter(m -> m.getName().equals(memberName)).findFirst();
    }

    /**
     * 本结构及其所有嵌套子结构是否声明了公理或派生运算。
     */
    public boolean hasAxioms() {
        return !getAxioms().isEmpty() || !getFunctions().isEmpty()
                || getNested().stream().anyMatch(n -> n.getDefinition().hasAxioms());
    }

    private <T extends Member> List<T> membersOf(Class<T> type) {
        return members.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StructureDef that)) {
            return false;
        }
        return name.equals(that.name) && typeParameters.equals(that.typeParameters)
                && Objects.equals(extendsRef, that.extendsRef) && Objects.equals(overRef, that.overRef)
                && members.equals(that.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeParameters, extendsRef, overRef, members);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("structure ").append(name);
        if (!typeParameters.isEmpty()) {
            sb.append('(').append(String.join(", ", typeParameters)).append(')');
        }
        if (extendsRef != null) {
            sb.append(" extends ").append(extendsRef);
        }
        if (overRef != null) {
            sb.append(" over ").append(overRef);
        }
        return sb.append(" {").append(members.size()).append(" members}").toString();
    }
}
