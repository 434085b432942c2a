package org.axioms.solvers.z3;

import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import org.apache.commons.lang3.tuple.Pair;
import org.axioms.core.Expression;
import org.axioms.solvers.Counterexample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 从 Z3 模型中提取被跟踪变量的取值，构造反例或见证。
 */
public class Z3WitnessExtractor {

    private static final Logger logger = LoggerFactory.getLogger(Z3WitnessExtractor.class);

    private final Z3ResultConverter converter;

    public Z3WitnessExtractor(Z3ResultConverter converter) {
        this.converter = Objects.requireNonNull(converter, "Z3WitnessExtractor-构造函数: converter 不能为 null");
    }

    /**
     * @param model 求解器给出的模型
     * @param tracked (显示名, Z3 常量) 列表；同名变量后出现者加撇号区分
     * @return 按跟踪顺序排列的绑定
     */
    public Counterexample extract(Model model, List<Pair<String, Expr>> tracked) {
        Map<String, Expression> bindings = new LinkedHashMap<>();
        for (Pair<String, Expr> entry : tracked) {
            Expr value = model.eval(entry.getRight(), true);
            String name = entry.getLeft();
            while (bindings.containsKey(name)) {
                name = name + "'";
            }
            bindings.put(name, converter.toExpression(value));
        }
        Counterexample counterexample = new Counterexample(bindings, model.toString());
        logger.debug("提取见证: {}", counterexample);
        return counterexample;
    }
}
