package org.axioms.structures;

import org.apache.commons.lang3.Validate;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 结构的具体实现块，例如 implements Field(ℝ) { element zero = 0 ... }，
 * 可带 where 约束限定泛型参数。
 * 此类是不可变的。
 */
public final class ImplementsDef {

    private final String structureName;
    private final List<String> typeArgs;
    private final List<WhereConstraint> where; // 可为 null，表示无 where 子句
    private final List<ImplMember> members;

    private ImplementsDef(String structureName, List<String> typeArgs, List<WhereConstraint> where,
                          List<ImplMember> members) {
        this.structureName = Validate.notBlank(structureName, "ImplementsDef-构造函数: structureName 不能为空");
        this.typeArgs = List.copyOf(Objects.requireNonNull(typeArgs, "ImplementsDef-构造函数: typeArgs 不能为 null"));
        this.where = where == null ? null : List.copyOf(where);
        this.members = List.copyOf(Objects.requireNonNull(members, "ImplementsDef-构造函数: members 不能为 null"));

        Set<String> seen = new HashSet<>();
        for (ImplMember member : this.members) {
            if (!seen.add(member.getName())) {
                throw new IllegalArgumentException("ImplementsDef-构造函数: 实现块 " + structureName
                        + " 中成员名重复: " + member.getName());
            }
        }
    }

    public static ImplementsDef of(String structureName, List<String> typeArgs, List<ImplMember> members) {
        return new ImplementsDef(structureName, typeArgs, null, members);
    }

    public static ImplementsDef of(String structureName, List<String> typeArgs, List<WhereConstraint> where,
                                   List<ImplMember> members) {
        return new ImplementsDef(structureName, typeArgs,
                Objects.requireNonNull(where, "ImplementsDef-of: where 不能为 null"), members);
    }

    public String getStructureName() {
        return structureName;
    }

    public List<String> getTypeArgs() {
        return typeArgs;
    }

    public Optional<List<WhereConstraint>> getWhere() {
        return Optional.ofNullable(where);
    }

    public List<ImplMember> getMembers() {
        return members;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ImplementsDef that)) {
            return false;
        }
        return structureName.equals(that.structureName) && typeArgs.equals(that.typeArgs)
                && Objects.equals(where, that.where) && members.equals(that.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(structureName, typeArgs, where, members);
    }

    @Override
    public String toString() {
        String args = typeArgs.isEmpty() ? "" : "(" + String.join(", ", typeArgs) + ")";
        return "implements " + structureName + args + (where == null ? "" : " where " + where);
    }
}
