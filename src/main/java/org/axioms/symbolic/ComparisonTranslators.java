package org.axioms.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;

import java.util.List;

/**
 * 比较运算的原生翻译器：equals、neq、lt、leq、gt、geq 及其符号别名。
 */
public final class ComparisonTranslators {

    private ComparisonTranslators() {
    }

    public static void registerInto(OperationTranslatorRegistry registry) {
        OperationTranslator equals = (ctx, args) -> equality(ctx, "equals", args.get(0), args.get(1));
        OperationTranslator notEquals = (ctx, args) -> ctx.mkNot(equality(ctx, "neq", args.get(0), args.get(1)));
        registry.register("equals", 2, Theory.COMPARISON, equals);
        registry.register("=", 2, Theory.COMPARISON, equals);
        registry.register("neq", 2, Theory.COMPARISON, notEquals);
        registry.register("≠", 2, Theory.COMPARISON, notEquals);

        OperationTranslator lt = (ctx, args) -> {
            ArithExpr[] operands = ArithmeticTranslators.unify(ctx, "lt", args);
            return ctx.mkLt(operands[0], operands[1]);
        };
        OperationTranslator leq = (ctx, args) -> {
            ArithExpr[] operands = ArithmeticTranslators.unify(ctx, "leq", args);
            return ctx.mkLe(operands[0], operands[1]);
        };
        OperationTranslator gt = (ctx, args) -> {
            ArithExpr[] operands = ArithmeticTranslators.unify(ctx, "gt", args);
            return ctx.mkGt(operands[0], operands[1]);
        };
        OperationTranslator geq = (ctx, args) -> {
            ArithExpr[] operands = ArithmeticTranslators.unify(ctx, "geq", args);
            return ctx.mkGe(operands[0], operands[1]);
        };
        for (String name : List.of("lt", "<")) {
            registry.register(name, 2, Theory.COMPARISON, lt);
        }
        for (String name : List.of("leq", "≤")) {
            registry.register(name, 2, Theory.COMPARISON, leq);
        }
        for (String name : List.of("gt", ">")) {
            registry.register(name, 2, Theory.COMPARISON, gt);
        }
        for (String name : List.of("geq", "≥")) {
            registry.register(name, 2, Theory.COMPARISON, geq);
        }
    }

    /**
     * 构造等式。数值参数先统一排序，其余排序必须相同。
     * @throws TranslationException 两侧排序不兼容
     */
    public static BoolExpr equality(Context ctx, String operation, Expr left, Expr right) {
        if (left instanceof ArithExpr && right instanceof ArithExpr) {
            ArithExpr[] operands = ArithmeticTranslators.unify(ctx, operation, List.of(left, right));
            return ctx.mkEq(operands[0], operands[1]);
        }
        if (!left.getSort().equals(right.getSort())) {
            throw TranslationException.unsupported(operation + " 两侧排序不一致: "
                    + left.getSort() + " 与 " + right.getSort());
        }
        return ctx.mkEq(left, right);
    }
}
