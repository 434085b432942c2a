package org.axioms.structures;

import org.apache.commons.lang3.Validate;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 运算签名声明，例如 operation •(S, S) : S。
 * 零元运算（无参数）视作特殊元素处理。
 */
public final class OperationDecl implements Member {

    private final String name;
    private final List<String> parameterTypes;
    private final String resultType;

    private OperationDecl(String name, List<String> parameterTypes, String resultType) {
        this.name = Validate.notBlank(name, "OperationDecl-构造函数: name 不能为空");
        this.parameterTypes = List.copyOf(Objects.requireNonNull(parameterTypes,
                "OperationDecl-构造函数: parameterTypes 不能为 null"));
        this.resultType = Validate.notBlank(resultType, "OperationDecl-构造函数: resultType 不能为空");
    }

    public static OperationDecl of(String name, List<String> parameterTypes, String resultType) {
        return new OperationDecl(name, parameterTypes, resultType);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public MemberKind getKind() {
        return MemberKind.OPERATION;
    }

    public List<String> getParameterTypes() {
        return parameterTypes;
    }

    public String getResultType() {
        return resultType;
    }

    public int getArity() {
        return parameterTypes.size();
    }

    public boolean isNullary() {
        return parameterTypes.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OperationDecl that)) {
            return false;
        }
        return name.equals(that.name) && parameterTypes.equals(that.parameterTypes)
                && resultType.equals(that.resultType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parameterTypes, resultType);
    }

    @Override
    public String toString() {
        return "operation " + name + parameterTypes.stream().collect(Collectors.joining(", ", "(", ")"))
                + " : " + resultType;
    }
}
