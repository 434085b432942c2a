package org.axioms.structures;

import org.apache.commons.lang3.Validate;

import java.util.Objects;
import java.util.Optional;

/**
 * 特殊元素声明（单位元、零元等），例如 element e : M。
 */
public final class ElementDecl implements Member {

    private final String name;
    private final String type; // 可为 null

    private ElementDecl(String name, String type) {
        this.name = Validate.notBlank(name, "ElementDecl-构造函数: name 不能为空");
        this.type = type;
    }

    public static ElementDecl of(String name) {
        return new ElementDecl(name, null);
    }

    public static ElementDecl of(String name, String type) {
        return new ElementDecl(name, type);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public MemberKind getKind() {
        return MemberKind.ELEMENT;
    }

    public Optional<String> getType() {
        return Optional.ofNullable(type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ElementDecl that)) {
            return false;
        }
        return name.equals(that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "element " + name + (type == null ? "" : " : " + type);
    }
}
