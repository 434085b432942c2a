package org.axioms.core;

import org.apache.commons.lang3.Validate;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 变量或具名对象的引用（量词约束变量、特殊元素或自由变量）。
 * 此类是不可变的。
 */
public final class Variable implements Expression {

    private final String name;

    private Variable(String name) {
        this.name = Validate.notBlank(name, "Variable-构造函数: name 不能为空");
    }

    public static Variable of(String name) {
        return new Variable(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.VARIABLE;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
