package org.axioms.core;

import org.apache.commons.lang3.Validate;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 运算应用节点：name(arg1, ..., argN)。
 * 算术、比较与逻辑联结词同样以运算的形式出现，由翻译器按名称与元数分派。
 * 此类是不可变的。
 */
public final class Operation implements Expression {

    private final String name;
    private final List<Expression> args;
    private final int hashCode;

    private Operation(String name, List<Expression> args) {
        this.name = Validate.notBlank(name, "Operation-构造函数: name 不能为空");
        Objects.requireNonNull(args, "Operation-构造函数: args 不能为 null");
        args.forEach(a -> Objects.requireNonNull(a, "Operation-构造函数: 参数不能为 null"));
        this.args = List.copyOf(args);
        this.hashCode = Objects.hash(this.name, this.args);
    }

    public static Operation of(String name, List<Expression> args) {
        return new Operation(name, args);
    }

    public static Operation of(String name, Expression... args) {
        return new Operation(name, List.of(args));
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public int getArity() {
        return args.size();
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.OPERATION;
    }

    @Override
    public List<Expression> children() {
        return args;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Operation that = (Operation) o;
        return name.equals(that.name) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (args.isEmpty()) {
            return name;
        }
        return name + args.stream().map(Expression::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
