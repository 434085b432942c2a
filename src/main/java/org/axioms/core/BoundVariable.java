package org.axioms.core;

import org.apache.commons.lang3.Validate;

import java.util.Objects;
import java.util.Optional;

/**
 * 量词或派生运算参数中声明的变量，可带类型标注，例如 (x : ℤ)。
 * 此类是不可变的。
 */
public final class BoundVariable {

    private final String name;
    private final String type; // 可为 null，表示未标注

    private BoundVariable(String name, String type) {
        this.name = Validate.notBlank(name, "BoundVariable-构造函数: name 不能为空");
        this.type = type;
    }

    public static BoundVariable of(String name) {
        return new BoundVariable(name, null);
    }

    public static BoundVariable of(String name, String type) {
        return new BoundVariable(name, type);
    }

    public String getName() {
        return name;
    }

    public Optional<String> getType() {
        return Optional.ofNullable(type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BoundVariable that = (BoundVariable) o;
        return name.equals(that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return type == null ? name : name + " : " + type;
    }
}
