package org.axioms.solvers.z3;

import com.microsoft.z3.AlgebraicNum;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.Quantifier;
import com.microsoft.z3.RatNum;
import com.microsoft.z3.RealSort;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Symbol;
import org.axioms.core.BoundVariable;
import org.axioms.core.Conditional;
import org.axioms.core.Constant;
import org.axioms.core.Expression;
import org.axioms.core.Operation;
import org.axioms.core.Quantified;
import org.axioms.core.Variable;
import org.axioms.solvers.ResultConverter;
import org.axioms.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 将 Z3 的值与项转换回表达式 AST。
 * 数值（Int 与 Real 均为精确有理数）和布尔值转为常量；符号结果按函数声明重建运算树，
 * 原生运算映射回本库的标准运算名。
 */
public class Z3ResultConverter implements ResultConverter<Expr> {

    private static final Logger logger = LoggerFactory.getLogger(Z3ResultConverter.class);
    private static final int ALGEBRAIC_PRECISION = 20;

    @Override
    public Expression toExpression(Expr value) {
        return convert(value, new ArrayList<>());
    }

    /**
     * @param boundNames 外层量词的约束变量名，最内层在末尾
     */
    private Expression convert(Expr expr, List<String> boundNames) {
        if (expr.isTrue()) {
            return Constant.TRUE;
        }
        if (expr.isFalse()) {
            return Constant.FALSE;
        }
        if (expr.isIntNum()) {
            return Constant.of(Rational.valueOf(((IntNum) expr).getBigInteger()));
        }
        if (expr.isRatNum()) {
            RatNum rat = (RatNum) expr;
            return Constant.of(Rational.valueOf(rat.getBigIntNumerator(), rat.getBigIntDenominator()));
        }
        if (expr.isAlgebraicNumber()) {
            // 无理数只能给出十进制近似
            String decimal = ((AlgebraicNum) expr).toDecimal(ALGEBRAIC_PRECISION).replace("?", "");
            logger.warn("代数数 {} 以十进制近似 {} 表示", expr, decimal);
            return Constant.of(Rational.valueOf(decimal));
        }
        if (expr.isVar()) {
            int index = expr.getIndex();
            return Variable.of(boundNames.get(boundNames.size() - 1 - index));
        }
        if (expr.isQuantifier()) {
            return convertQuantifier((Quantifier) expr, boundNames);
        }
        if (!expr.isApp()) {
            logger.warn("无法识别的 Z3 项 {}，按名称保留", expr);
            return Variable.of(expr.toString());
        }

        Expr[] rawArgs = expr.getArgs();
        if (expr.isIntToReal()) {
            return convert(rawArgs[0], boundNames);
        }
        if (expr.isConst()) {
            return Variable.of(expr.getFuncDecl().getName().toString());
        }
        List<Expression> args = new ArrayList<>(rawArgs.length);
        for (Expr arg : rawArgs) {
            args.add(convert(arg, boundNames));
        }
        if (expr.isITE()) {
            return Conditional.of(args.get(0), args.get(1), args.get(2));
        }
        return Operation.of(operationName(expr, args.size()), args);
    }

    private Expression convertQuantifier(Quantifier quantifier, List<String> boundNames) {
        Symbol[] names = quantifier.getBoundVariableNames();
        Sort[] sorts = quantifier.getBoundVariableSorts();
        List<BoundVariable> variables = new ArrayList<>(names.length);
        List<String> scope = new ArrayList<>(boundNames);
        for (int i = 0; i < names.length; i++) {
            String name = names[i].toString();
            variables.add(BoundVariable.of(name, typeName(sorts[i])));
            scope.add(name);
        }
        Expression body = convert(quantifier.getBody(), scope);
        return quantifier.isUniversal() ? Quantified.forAll(variables, body) : Quantified.exists(variables, body);
    }

    private static String operationName(Expr expr, int arity) {
        if (expr.isAdd()) {
            return "plus";
        } else if (expr.isSub()) {
            return "minus";
        } else if (expr.isMul()) {
            return "times";
        } else if (expr.isUMinus()) {
            return "negate";
        } else if (expr.isDiv() || expr.isIDiv()) {
            return "divide";
        } else if (expr.isModulus()) {
            return "mod";
        } else if (expr.isLE()) {
            return "leq";
        } else if (expr.isLT()) {
            return "lt";
        } else if (expr.isGE()) {
            return "geq";
        } else if (expr.isGT()) {
            return "gt";
        } else if (expr.isEq()) {
            return "equals";
        } else if (expr.isDistinct() && arity == 2) {
            return "neq";
        } else if (expr.isNot()) {
            return "not";
        } else if (expr.isAnd()) {
            return "and";
        } else if (expr.isOr()) {
            return "or";
        } else if (expr.isImplies()) {
            return "implies";
        } else if (expr.isIff()) {
            return "iff";
        } else if (expr.isXor()) {
            return "xor";
        }
        String declName = expr.getFuncDecl().getName().toString();
        // 未解释函数或其他内部运算沿用声明名
        return "^".equals(declName) ? "power" : declName;
    }

    private static String typeName(Sort sort) {
        if (sort instanceof IntSort) {
            return "ℤ";
        }
        if (sort instanceof RealSort) {
            return "ℝ";
        }
        if (sort instanceof BoolSort) {
            return "Bool";
        }
        return sort.toString();
    }
}
