package org.axioms.structures;

import org.apache.commons.lang3.Validate;

import java.util.Objects;

/**
 * 嵌套子结构，例如环中的 structure additive : AbelianGroup(R)。
 * 其成员随外层结构一同加载。
 */
public final class NestedStructure implements Member {

    private final String name;
    private final StructureDef definition;

    private NestedStructure(String name, StructureDef definition) {
        this.name = Validate.notBlank(name, "NestedStructure-构造函数: name 不能为空");
        this.definition = Objects.requireNonNull(definition, "NestedStructure-构造函数: definition 不能为 null");
    }

    public static NestedStructure of(String name, StructureDef definition) {
        return new NestedStructure(name, definition);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public MemberKind getKind() {
        return MemberKind.NESTED;
    }

    public StructureDef getDefinition() {
        return definition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NestedStructure that)) {
            return false;
        }
        return name.equals(that.name) && definition.equals(that.definition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, definition);
    }

    @Override
    public String toString() {
        return "structure " + name + " : " + definition.getName();
    }
}
