package org.axioms.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;

import java.util.List;

/**
 * 逻辑联结词的原生翻译器：and、or、not、implies、iff、xor 及其符号别名。
 */
public final class BooleanTranslators {

    private BooleanTranslators() {
    }

    public static void registerInto(OperationTranslatorRegistry registry) {
        OperationTranslator and = (ctx, args) -> ctx.mkAnd(bools("and", args));
        OperationTranslator or = (ctx, args) -> ctx.mkOr(bools("or", args));
        OperationTranslator not = (ctx, args) -> ctx.mkNot(bools("not", args)[0]);
        OperationTranslator implies = (ctx, args) -> {
            BoolExpr[] operands = bools("implies", args);
            return ctx.mkImplies(operands[0], operands[1]);
        };
        OperationTranslator iff = (ctx, args) -> {
            BoolExpr[] operands = bools("iff", args);
            return ctx.mkIff(operands[0], operands[1]);
        };

        for (String name : List.of("and", "∧")) {
            registry.register(name, OperationKey.ANY_ARITY, Theory.BOOLEAN, and);
        }
        for (String name : List.of("or", "∨")) {
            registry.register(name, OperationKey.ANY_ARITY, Theory.BOOLEAN, or);
        }
        for (String name : List.of("not", "¬")) {
            registry.register(name, 1, Theory.BOOLEAN, not);
        }
        for (String name : List.of("implies", "→")) {
            registry.register(name, 2, Theory.BOOLEAN, implies);
        }
        for (String name : List.of("iff", "↔")) {
            registry.register(name, 2, Theory.BOOLEAN, iff);
        }
        registry.register("xor", 2, Theory.BOOLEAN, (ctx, args) -> {
            BoolExpr[] operands = bools("xor", args);
            return ctx.mkXor(operands[0], operands[1]);
        });
    }

    private static BoolExpr[] bools(String operation, List<Expr> args) {
        BoolExpr[] result = new BoolExpr[args.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = ArithmeticTranslators.asBool(operation, args.get(i));
        }
        return result;
    }
}
