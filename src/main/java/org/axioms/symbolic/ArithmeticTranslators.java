package org.axioms.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;

import java.util.List;

/**
 * 算术运算的原生翻译器：plus、minus、times、divide、negate、power、mod、abs、min、max 及其符号别名。
 * 整数与实数混合时，整数参数统一提升为实数。
 */
public final class ArithmeticTranslators {

    private ArithmeticTranslators() {
    }

    public static void registerInto(OperationTranslatorRegistry registry) {
        OperationTranslator plus = (ctx, args) -> ctx.mkAdd(unify(ctx, "plus", args));
        OperationTranslator minus = (ctx, args) -> ctx.mkSub(unify(ctx, "minus", args));
        OperationTranslator unaryMinus = (ctx, args) -> ctx.mkUnaryMinus(unify(ctx, "minus", args)[0]);
        OperationTranslator times = (ctx, args) -> ctx.mkMul(unify(ctx, "times", args));
        for (String name : List.of("plus", "+", "add")) {
            registry.register(name, OperationKey.ANY_ARITY, Theory.ARITHMETIC, requireAtLeastOne(name, plus));
        }
        for (String name : List.of("minus", "-", "subtract")) {
            registry.register(name, 2, Theory.ARITHMETIC, minus);
            registry.register(name, 1, Theory.ARITHMETIC, unaryMinus);
        }
        for (String name : List.of("times", "*", "multiply")) {
            registry.register(name, OperationKey.ANY_ARITY, Theory.ARITHMETIC, requireAtLeastOne(name, times));
        }

        // 除法总是实数除法，整数参数先提升
        OperationTranslator divide = (ctx, args) -> {
            ArithExpr[] operands = unify(ctx, "divide", args);
            return ctx.mkDiv(toReal(ctx, operands[0]), toReal(ctx, operands[1]));
        };
        registry.register("divide", 2, Theory.ARITHMETIC, divide);
        registry.register("/", 2, Theory.ARITHMETIC, divide);

        registry.register("negate", 1, Theory.ARITHMETIC,
                (ctx, args) -> ctx.mkUnaryMinus(unify(ctx, "negate", args)[0]));

        OperationTranslator power = (ctx, args) -> {
            ArithExpr[] operands = unify(ctx, "power", args);
            return ctx.mkPower(operands[0], operands[1]);
        };
        registry.register("power", 2, Theory.ARITHMETIC, power);
        registry.register("^", 2, Theory.ARITHMETIC, power);

        registry.register("mod", 2, Theory.ARITHMETIC, (ctx, args) -> {
            ArithExpr[] operands = unify(ctx, "mod", args);
            if (!operands[0].isInt() || !operands[1].isInt()) {
                throw TranslationException.unsupported("mod 只支持整数参数: " + args);
            }
            return ctx.mkMod((IntExpr) operands[0], (IntExpr) operands[1]);
        });

        registry.register("abs", 1, Theory.ARITHMETIC, (ctx, args) -> {
            ArithExpr x = unify(ctx, "abs", args)[0];
            return ctx.mkITE(ctx.mkLt(x, zeroLike(ctx, x)), ctx.mkUnaryMinus(x), x);
        });
        registry.register("min", 2, Theory.ARITHMETIC, (ctx, args) -> {
            ArithExpr[] operands = unify(ctx, "min", args);
            return ctx.mkITE(ctx.mkLe(operands[0], operands[1]), operands[0], operands[1]);
        });
        registry.register("max", 2, Theory.ARITHMETIC, (ctx, args) -> {
            ArithExpr[] operands = unify(ctx, "max", args);
            return ctx.mkITE(ctx.mkGe(operands[0], operands[1]), operands[0], operands[1]);
        });
    }

    /**
     * 检查参数均为数值，并在混合 Int/Real 时把整数提升为实数。
     * @param ctx Z3 Context 实例
     * @param operation 运算名，用于错误信息
     * @param args 已翻译的参数
     * @return 排序一致的算术表达式数组
     * @throws TranslationException 某个参数不是数值
     */
    static ArithExpr[] unify(Context ctx, String operation, List<Expr> args) {
        boolean anyReal = false;
        for (Expr arg : args) {
            if (!(arg instanceof ArithExpr)) {
                throw TranslationException.unsupported(operation + " 的参数不是数值: " + arg);
            }
            anyReal |= arg.isReal();
        }
        ArithExpr[] result = new ArithExpr[args.size()];
        for (int i = 0; i < result.length; i++) {
            ArithExpr arg = (ArithExpr) args.get(i);
            result[i] = anyReal ? toReal(ctx, arg) : arg;
        }
        return result;
    }

    static ArithExpr toReal(Context ctx, ArithExpr expr) {
        return expr.isInt() ? ctx.mkInt2Real((IntExpr) expr) : expr;
    }

    private static ArithExpr zeroLike(Context ctx, ArithExpr expr) {
        return expr.isInt() ? ctx.mkInt(0) : ctx.mkReal(0);
    }

    private static OperationTranslator requireAtLeastOne(String name, OperationTranslator translator) {
        return (ctx, args) -> {
            if (args.isEmpty()) {
                throw TranslationException.arityMismatch(name, 0, "≥ 1");
            }
            return translator.translate(ctx, args);
        };
    }

    static BoolExpr asBool(String operation, Expr expr) {
        if (!(expr instanceof BoolExpr)) {
            throw TranslationException.unsupported(operation + " 的参数不是布尔值: " + expr);
        }
        return (BoolExpr) expr;
    }
}
