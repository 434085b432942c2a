package org.axioms.structures;

import org.apache.commons.lang3.Validate;

import java.util.List;
import java.util.Objects;

/**
 * 按名称引用另一个结构，例如 extends Semigroup(M)。通过注册表解析。
 */
public final class StructureRef {

    private final String name;
    private final List<String> typeArgs;

    private StructureRef(String name, List<String> typeArgs) {
        this.name = Validate.notBlank(name, "StructureRef-构造函数: name 不能为空");
        this.typeArgs = List.copyOf(Objects.requireNonNull(typeArgs, "StructureRef-构造函数: typeArgs 不能为 null"));
    }

    public static StructureRef of(String name, String... typeArgs) {
        return new StructureRef(name, List.of(typeArgs));
    }

    public static StructureRef of(String name, List<String> typeArgs) {
        return new StructureRef(name, typeArgs);
    }

    public String getName() {
        return name;
    }

    public List<String> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StructureRef that)) {
            return false;
        }
        return name.equals(that.name) && typeArgs.equals(that.typeArgs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeArgs);
    }

    @Override
    public String toString() {
        return typeArgs.isEmpty() ? name : name + "(" + String.join(", ", typeArgs) + ")";
    }
}
