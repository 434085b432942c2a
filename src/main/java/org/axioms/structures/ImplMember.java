package org.axioms.structures;

import org.apache.commons.lang3.Validate;
import org.axioms.core.BoundVariable;
import org.axioms.core.Expression;

import java.util.List;
import java.util.Objects;

/**
 * 实现块中的成员：元素绑定 (element zero = 0) 或内联运算实现 (operation abs(x) = ...)。
 */
public final class ImplMember {

    public enum Kind {
        ELEMENT_BINDING,
        OPERATION_IMPL
    }

    private final Kind kind;
    private final String name;
    private final List<BoundVariable> parameters;
    private final Expression value;

    private ImplMember(Kind kind, String name, List<BoundVariable> parameters, Expression value) {
        this.kind = kind;
        this.name = Validate.notBlank(name, "ImplMember-构造函数: name 不能为空");
        this.parameters = List.copyOf(parameters);
        this.value = Objects.requireNonNull(value, "ImplMember-构造函数: value 不能为 null");
    }

    public static ImplMember element(String name, Expression value) {
        return new ImplMember(Kind.ELEMENT_BINDING, name, List.of(), value);
    }

    public static ImplMember operation(String name, List<BoundVariable> parameters, Expression body) {
        return new ImplMember(Kind.OPERATION_IMPL, name,
                Objects.requireNonNull(parameters, "ImplMember-operation: parameters 不能为 null"), body);
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    /**
     * @return 内联运算的参数；元素绑定返回空列表
     */
    public List<BoundVariable> getParameters() {
        return parameters;
    }

    /**
     * @return 元素的绑定值或运算体
     */
    public Expression getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ImplMember that)) {
            return false;
        }
        return kind == that.kind && name.equals(that.name) && parameters.equals(that.parameters)
                && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, parameters, value);
    }

    @Override
    public String toString() {
        return kind == Kind.ELEMENT_BINDING
                ? "element " + name + " = " + value
                : "operation " + name + parameters + " = " + value;
    }
}
