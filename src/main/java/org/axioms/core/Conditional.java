package org.axioms.core;

import java.util.List;
import java.util.Objects;

/**
 * 条件表达式：if condition then thenBranch else elseBranch。
 * 此类是不可变的。
 */
public final class Conditional implements Expression {

    private final Expression condition;
    private final Expression thenBranch;
    private final Expression elseBranch;

    private Conditional(Expression condition, Expression thenBranch, Expression elseBranch) {
        this.condition = Objects.requireNonNull(condition, "Conditional-构造函数: condition 不能为 null");
        this.thenBranch = Objects.requireNonNull(thenBranch, "Conditional-构造函数: thenBranch 不能为 null");
        this.elseBranch = Objects.requireNonNull(elseBranch, "Conditional-构造函数: elseBranch 不能为 null");
    }

    public static Conditional of(Expression condition, Expression thenBranch, Expression elseBranch) {
        return new Conditional(condition, thenBranch, elseBranch);
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getThenBranch() {
        return thenBranch;
    }

    public Expression getElseBranch() {
        return elseBranch;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.CONDITIONAL;
    }

    @Override
    public List<Expression> children() {
        return List.of(condition, thenBranch, elseBranch);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Conditional that = (Conditional) o;
        return condition.equals(that.condition)
                && thenBranch.equals(that.thenBranch)
                && elseBranch.equals(that.elseBranch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, thenBranch, elseBranch);
    }

    @Override
    public String toString() {
        return "if " + condition + " then " + thenBranch + " else " + elseBranch;
    }
}
