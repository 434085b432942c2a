package org.axioms.resolution;

import java.util.Objects;

/**
 * 一条有向依赖边：source 依赖 target。
 */
public final class Dependency {

    private final String source;
    private final String target;
    private final DependencyKind kind;

    private Dependency(String source, String target, DependencyKind kind) {
        this.source = Objects.requireNonNull(source, "Dependency-构造函数: source 不能为 null");
        this.target = Objects.requireNonNull(target, "Dependency-构造函数: target 不能为 null");
        this.kind = Objects.requireNonNull(kind, "Dependency-构造函数: kind 不能为 null");
    }

    public static Dependency of(String source, String target, DependencyKind kind) {
        return new Dependency(source, target, kind);
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public DependencyKind getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dependency that)) {
            return false;
        }
        return source.equals(that.source) && target.equals(that.target) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, kind);
    }

    @Override
    public String toString() {
        return source + " -" + kind + "-> " + target;
    }
}
