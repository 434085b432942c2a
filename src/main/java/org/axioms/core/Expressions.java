package org.axioms.core;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 表达式构造与遍历的静态工具方法。
 * 构造方法使用本库原生识别的运算名（plus、times、equals、...）。
 */
public final class Expressions {

    private Expressions() {
    }

    // ========== 构造 ==========

    public static Constant num(long value) {
        return Constant.of(value);
    }

    public static Constant num(String literal) {
        return Constant.parse(literal);
    }

    public static Variable var(String name) {
        return Variable.of(name);
    }

    public static Operation op(String name, Expression... args) {
        return Operation.of(name, args);
    }

    public static Operation plus(Expression left, Expression right) {
        return Operation.of("plus", left, right);
    }

    public static Operation minus(Expression left, Expression right) {
        return Operation.of("minus", left, right);
    }

    public static Operation times(Expression left, Expression right) {
        return Operation.of("times", left, right);
    }

    public static Operation negate(Expression operand) {
        return Operation.of("negate", operand);
    }

    public static Operation eq(Expression left, Expression right) {
        return Operation.of("equals", left, right);
    }

    public static Operation not(Expression operand) {
        return Operation.of("not", operand);
    }

    public static Operation and(Expression... operands) {
        return Operation.of("and", operands);
    }

    public static Operation implies(Expression premise, Expression conclusion) {
        return Operation.of("implies", premise, conclusion);
    }

    /**
     * 以 "x:ℤ" 或 "x" 形式的声明构造约束变量列表。
     */
    public static List<BoundVariable> bound(String... declarations) {
        return Arrays.stream(declarations).map(Expressions::parseBound).collect(Collectors.toList());
    }

    public static Quantified forAll(List<BoundVariable> variables, Expression body) {
        return Quantified.forAll(variables, body);
    }

    public static Quantified exists(List<BoundVariable> variables, Expression body) {
        return Quantified.exists(variables, body);
    }

    private static BoundVariable parseBound(String declaration) {
        int colon = declaration.indexOf(':');
        if (colon < 0) {
            return BoundVariable.of(declaration.trim());
        }
        return BoundVariable.of(declaration.substring(0, colon).trim(), declaration.substring(colon + 1).trim());
    }

    // ========== 遍历 ==========

    /**
     * 收集表达式中出现的全部运算名，按首次出现顺序。
     */
    public static Set<String> operationNames(Expression expression) {
        Set<String> names = new LinkedHashSet<>();
        Deque<Expression> stack = new ArrayDeque<>();
        stack.push(expression);
        while (!stack.isEmpty()) {
            Expression current = stack.pop();
            if (current instanceof Operation operation) {
                names.add(operation.getName());
            }
            List<Expression> children = current.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return names;
    }

    /**
     * 收集未被任何外层量词约束的变量名，按首次出现顺序。
     */
    public static Set<String> freeVariables(Expression expression) {
        Set<String> result = new LinkedHashSet<>();
        collectFree(expression, new ArrayDeque<>(), result);
        return result;
    }

    private static void collectFree(Expression expression, Deque<Set<String>> scopes, Set<String> out) {
        switch (expression.getKind()) {
            case VARIABLE -> {
                String name = ((Variable) expression).getName();
                if (scopes.stream().noneMatch(scope -> scope.contains(name))) {
                    out.add(name);
                }
            }
            case QUANTIFIED -> {
                Quantified quantified = (Quantified) expression;
                scopes.push(quantified.getVariables().stream()
                        .map(BoundVariable::getName)
                        .collect(Collectors.toSet()));
                quantified.children().forEach(child -> collectFree(child, scopes, out));
                scopes.pop();
            }
            default -> expression.children().forEach(child -> collectFree(child, scopes, out));
        }
    }
}
