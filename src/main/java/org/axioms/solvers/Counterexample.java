package org.axioms.solvers;

import org.axioms.core.Expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 反例：变量名 → 取值（已转换为表达式）的有序绑定，外加求解器原始模型文本。
 */
public final class Counterexample {

    private final Map<String, Expression> bindings;
    private final String rawModel;

    public Counterexample(Map<String, Expression> bindings, String rawModel) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(bindings, "Counterexample-构造函数: bindings 不能为 null")));
        this.rawModel = rawModel == null ? "" : rawModel;
    }

    public Map<String, Expression> getBindings() {
        return bindings;
    }

    public Optional<Expression> get(String variable) {
        return Optional.ofNullable(bindings.get(variable));
    }

    public String getRawModel() {
        return rawModel;
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Counterexample that)) {
            return false;
        }
        return bindings.equals(that.bindings) && rawModel.equals(that.rawModel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bindings, rawModel);
    }

    /**
     * @return 形如 "x = 0, y = 42" 的描述
     */
    @Override
    public String toString() {
        return bindings.entrySet().stream()
                .map(e -> e.getKey() + " = " + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
