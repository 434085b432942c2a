package org.axioms.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 量词节点：∀/∃ (x : T, ...) where guard. body。
 * 带 where 守卫的全称量词语义为 guard ⟹ body，存在量词为 guard ∧ body。
 * 此类是不可变的。
 */
public final class Quantified implements Expression {

    private final QuantifierKind quantifier;
    private final List<BoundVariable> variables;
    private final Expression guard; // 可为 null
    private final Expression body;
    private final int hashCode;

    private Quantified(QuantifierKind quantifier, List<BoundVariable> variables, Expression guard, Expression body) {
        this.quantifier = Objects.requireNonNull(quantifier, "Quantified-构造函数: quantifier 不能为 null");
        Objects.requireNonNull(variables, "Quantified-构造函数: variables 不能为 null");
        if (variables.isEmpty()) {
            throw new IllegalArgumentException("Quantified-构造函数: 量词至少需要一个约束变量");
        }
        this.variables = List.copyOf(variables);
        this.guard = guard;
        this.body = Objects.requireNonNull(body, "Quantified-构造函数: body 不能为 null");
        this.hashCode = Objects.hash(quantifier, this.variables, guard, body);
    }

    public static Quantified forAll(List<BoundVariable> variables, Expression body) {
        return new Quantified(QuantifierKind.FORALL, variables, null, body);
    }

    public static Quantified forAll(List<BoundVariable> variables, Expression guard, Expression body) {
        return new Quantified(QuantifierKind.FORALL, variables, guard, body);
    }

    public static Quantified exists(List<BoundVariable> variables, Expression body) {
        return new Quantified(QuantifierKind.EXISTS, variables, null, body);
    }

    public static Quantified exists(List<BoundVariable> variables, Expression guard, Expression body) {
        return new Quantified(QuantifierKind.EXISTS, variables, guard, body);
    }

    public QuantifierKind getQuantifier() {
        return quantifier;
    }

    public List<BoundVariable> getVariables() {
        return variables;
    }

    public Optional<Expression> getGuard() {
        return Optional.ofNullable(guard);
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.QUANTIFIED;
    }

    @Override
    public List<Expression> children() {
        List<Expression> result = new ArrayList<>(2);
        if (guard != null) {
            result.add(guard);
        }
        result.add(body);
        return List.copyOf(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Quantified that = (Quantified) o;
        return quantifier == that.quantifier
                && variables.equals(that.variables)
                && Objects.equals(guard, that.guard)
                && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        String vars = variables.stream().map(BoundVariable::toString).collect(Collectors.joining(", ", "(", ")"));
        String where = guard == null ? "" : " where " + guard;
        return quantifier.getSymbol() + vars + where + ". " + body;
    }
}
