package org.axioms.symbolic;

import org.apache.commons.lang3.Validate;

import java.util.Objects;

/**
 * 运算分派键：(名称, 元数)。元数为 {@link #ANY_ARITY} 表示可变元数。
 */
public final class OperationKey implements Comparable<OperationKey> {

    public static final int ANY_ARITY = -1;

    private final String name;
    private final int arity;

    private OperationKey(String name, int arity) {
        this.name = Validate.notBlank(name, "OperationKey-构造函数: name 不能为空");
        if (arity < ANY_ARITY) {
            throw new IllegalArgumentException("OperationKey-构造函数: 非法元数 " + arity);
        }
        this.arity = arity;
    }

    public static OperationKey of(String name, int arity) {
        return new OperationKey(name, arity);
    }

    public static OperationKey variadic(String name) {
        return new OperationKey(name, ANY_ARITY);
    }

    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    public boolean isVariadic() {
        return arity == ANY_ARITY;
    }

    @Override
    public int compareTo(OperationKey other) {
        int byName = name.compareTo(other.name);
        return byName != 0 ? byName : Integer.compare(arity, other.arity);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OperationKey that)) {
            return false;
        }
        return arity == that.arity && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arity);
    }

    @Override
    public String toString() {
        return name + "/" + (isVariadic() ? "*" : String.valueOf(arity));
    }
}
