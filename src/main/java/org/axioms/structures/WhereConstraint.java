package org.axioms.structures;

import org.apache.commons.lang3.Validate;

import java.util.List;
import java.util.Objects;

/**
 * 实现块上的泛型约束，例如 where T : Field。
 */
public final class WhereConstraint {

    private final String structureName;
    private final List<String> typeArgs;

    private WhereConstraint(String structureName, List<String> typeArgs) {
        this.structureName = Validate.notBlank(structureName, "WhereConstraint-构造函数: structureName 不能为空");
        this.typeArgs = List.copyOf(Objects.requireNonNull(typeArgs, "WhereConstraint-构造函数: typeArgs 不能为 null"));
    }

    public static WhereConstraint of(String structureName, String... typeArgs) {
        return new WhereConstraint(structureName, List.of(typeArgs));
    }

    public String getStructureName() {
        return structureName;
    }

    public List<String> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WhereConstraint that)) {
            return false;
        }
        return structureName.equals(that.structureName) && typeArgs.equals(that.typeArgs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(structureName, typeArgs);
    }

    @Override
    public String toString() {
        return String.join(", ", typeArgs) + " : " + structureName;
    }
}
