package org.axioms.structures;

import org.apache.commons.lang3.Validate;
import org.axioms.core.BoundVariable;
import org.axioms.core.Expression;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 派生运算定义，例如 define (-)(x, y) = x + negate(y)。
 * 加载时断言为 ∀params. name(params) = body。
 */
public final class FunctionDef implements Member {

    private final String name;
    private final List<BoundVariable> parameters;
    private final Expression body;

    private FunctionDef(String name, List<BoundVariable> parameters, Expression body) {
        this.name = Validate.notBlank(name, "FunctionDef-构造函数: name 不能为空");
        this.parameters = List.copyOf(Objects.requireNonNull(parameters, "FunctionDef-构造函数: parameters 不能为 null"));
        this.body = Objects.requireNonNull(body, "FunctionDef-构造函数: body 不能为 null");
        long distinct = this.parameters.stream().map(BoundVariable::getName).distinct().count();
        if (distinct != this.parameters.size()) {
            throw new IllegalArgumentException("FunctionDef-构造函数: " + name + " 的参数名重复");
        }
    }

    public static FunctionDef of(String name, List<BoundVariable> parameters, Expression body) {
        return new FunctionDef(name, parameters, body);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public MemberKind getKind() {
        return MemberKind.FUNCTION;
    }

    public List<BoundVariable> getParameters() {
        return parameters;
    }

    public int getArity() {
        return parameters.size();
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FunctionDef that)) {
            return false;
        }
        return name.equals(that.name) && parameters.equals(that.parameters) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parameters, body);
    }

    @Override
    public String toString() {
        return "define " + name + parameters.stream().map(BoundVariable::toString)
                .collect(Collectors.joining(", ", "(", ")")) + " = " + body;
    }
}
