package org.axioms.structures;

import org.apache.commons.lang3.Validate;
import org.axioms.core.Expression;

import java.util.Objects;

/**
 * 具名公理：axiom name: proposition。
 */
public final class AxiomDecl implements Member {

    private final String name;
    private final Expression proposition;

    private AxiomDecl(String name, Expression proposition) {
        this.name = Validate.notBlank(name, "AxiomDecl-构造函数: name 不能为空");
        this.proposition = Objects.requireNonNull(proposition, "AxiomDecl-构造函数: proposition 不能为 null");
    }

    public static AxiomDecl of(String name, Expression proposition) {
        return new AxiomDecl(name, proposition);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public MemberKind getKind() {
        return MemberKind.AXIOM;
    }

    public Expression getProposition() {
        return proposition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AxiomDecl that)) {
            return false;
        }
        return name.equals(that.name) && proposition.equals(that.proposition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, proposition);
    }

    @Override
    public String toString() {
        return "axiom " + name + ": " + proposition;
    }
}
