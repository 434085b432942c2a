package org.axioms.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;
import org.apache.commons.lang3.tuple.Pair;
import org.axioms.core.BoundVariable;
import org.axioms.core.Conditional;
import org.axioms.core.Constant;
import org.axioms.core.Expression;
import org.axioms.core.Expressions;
import org.axioms.core.Operation;
import org.axioms.core.Quantified;
import org.axioms.core.QuantifierKind;
import org.axioms.core.Variable;
import org.axioms.structures.OperationDecl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 将表达式 AST 翻译为 Z3 表达式。
 * 变量依次在量词作用域、特殊元素中查找；开放模式下其余变量作为自由常量，
 * 封闭模式（背景公理）下视为错误。运算统一交给 {@link OperationTranslatorRegistry} 分派。
 */
public class ExpressionTranslator {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionTranslator.class);
    private static final Set<String> EQUALITY_NAMES = Set.of("equals", "=", "neq", "≠");

    private final Z3SymbolManager symbols;
    private final OperationTranslatorRegistry translators;
    private final Context ctx;

    public ExpressionTranslator(Z3SymbolManager symbols, OperationTranslatorRegistry translators) {
        this.symbols = Objects.requireNonNull(symbols, "ExpressionTranslator-构造函数: symbols 不能为 null");
        this.translators = Objects.requireNonNull(translators, "ExpressionTranslator-构造函数: translators 不能为 null");
        this.ctx = symbols.getCtx();
    }

    /**
     * 翻译封闭表达式（背景公理、派生运算体）。未约束的变量必须是已声明的特殊元素。
     * @throws TranslationException 出现自由变量或无法翻译的构造
     */
    public Expr translateClosed(Expression expression) {
        return translate(expression, Collections.emptyMap(), false);
    }

    /**
     * 翻译查询表达式，自由变量作为具名 Int 常量。
     */
    public Expr translateOpen(Expression expression) {
        return translate(expression, Collections.emptyMap(), true);
    }

    public BoolExpr translateProposition(Expression expression, boolean allowFree) {
        return asBool(translate(expression, Collections.emptyMap(), allowFree), expression);
    }

    /**
     * 在给定的变量环境下翻译表达式。
     * @param expression 表达式
     * @param environment 变量名 → Z3 表达式
     * @param allowFree 是否允许自由变量
     * @return Z3 表达式
     */
    public Expr translate(Expression expression, Map<String, Expr> environment, boolean allowFree) {
        Objects.requireNonNull(expression, "ExpressionTranslator-translate: expression 不能为 null");
        return switch (expression.getKind()) {
            case CONSTANT -> translateConstant((Constant) expression);
            case VARIABLE -> resolveName(((Variable) expression).getName(), environment, allowFree);
            case OPERATION -> translateOperation((Operation) expression, environment, allowFree);
            case QUANTIFIED -> translateQuantified((Quantified) expression, environment, allowFree);
            case CONDITIONAL -> translateConditional((Conditional) expression, environment, allowFree);
        };
    }

    /**
     * 去掉目标前缀的全称量词（及其 where 守卫），将约束变量替换为可在模型中求值的常量。
     * 目标中的自由变量同样记录为见证变量。
     * @param goal 待证命题
     * @return 开放目标
     * @throws TranslationException 目标无法翻译或不是命题
     */
    public OpenGoal openUniversals(Expression goal) {
        Map<String, Expr> environment = new HashMap<>();
        List<Pair<String, Expr>> witnesses = new ArrayList<>();
        List<BoolExpr> premises = new ArrayList<>();

        Expression current = goal;
        while (current instanceof Quantified quantified && quantified.getQuantifier() == QuantifierKind.FORALL) {
            for (BoundVariable variable : quantified.getVariables()) {
                String type = variable.getType().orElse(null);
                Expr constant = ctx.mkFreshConst(variable.getName(), boundSort(variable, quantified));
                environment.put(variable.getName(), constant);
                witnesses.add(Pair.of(variable.getName(), constant));
                if (Z3SymbolManager.isNatural(type)) {
                    premises.add(ctx.mkGe((ArithExpr) constant, ctx.mkInt(0)));
                }
            }
            if (quantified.getGuard().isPresent()) {
                Expression guard = quantified.getGuard().get();
                premises.add(asBool(translate(guard, environment, true), guard));
            }
            current = quantified.getBody();
        }
        BoolExpr conclusion = asBool(translate(current, environment, true), current);

        for (String name : Expressions.freeVariables(goal)) {
            symbols.findFreeVariable(name).ifPresent(constant -> witnesses.add(Pair.of(name, constant)));
        }
        logger.debug("目标 {} 展开为 {} 个见证变量、{} 个前提", goal, witnesses.size(), premises.size());
        return new OpenGoal(witnesses, premises, conclusion);
    }

    /**
     * 派生运算参数或约束变量的排序：有类型标注时按标注，否则从作用域内的用法推断，推断不出时为 Int。
     * 推断依据是变量作为直接参数出现的位置：有签名或已声明的运算取对应形参排序；
     * 等式、算术与比较运算取同一运算中已知排序的另一参数。
     * @param variable 约束变量
     * @param scope 变量的作用域（派生运算体或量词体）
     * @return Z3 排序
     */
    public Sort parameterSort(BoundVariable variable, Expression scope) {
        if (variable.getType().isPresent()) {
            return symbols.sortFor(variable.getType().get());
        }
        Sort inferred = inferSort(variable.getName(), scope);
        if (inferred != null) {
            logger.debug("约束变量 {} 的排序推断为 {}", variable.getName(), inferred);
            return inferred;
        }
        return ctx.getIntSort();
    }

    private Sort boundSort(BoundVariable variable, Quantified quantified) {
        if (variable.getType().isPresent() || quantified.getGuard().isEmpty()) {
            return parameterSort(variable, quantified.getBody());
        }
        Sort fromGuard = inferSort(variable.getName(), quantified.getGuard().get());
        return fromGuard != null ? fromGuard : parameterSort(variable, quantified.getBody());
    }

    private Sort inferSort(String name, Expression expression) {
        if (expression instanceof Quantified quantified
                && quantified.getVariables().stream().anyMatch(v -> v.getName().equals(name))) {
            // 内层同名约束变量遮蔽外层
            return null;
        }
        if (expression instanceof Operation operation) {
            Sort direct = sortFromPosition(name, operation);
            if (direct != null) {
                return direct;
            }
        }
        for (Expression child : expression.children()) {
            Sort found = inferSort(name, child);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private Sort sortFromPosition(String name, Operation operation) {
        List<Expression> args = operation.getArgs();
        Optional<OperationDecl> signature = symbols.signatureOf(operation.getName(), args.size());
        boolean sameSorted = EQUALITY_NAMES.contains(operation.getName())
                || translators.theoryOf(operation.getName(), args.size())
                .map(theory -> theory == Theory.ARITHMETIC || theory == Theory.COMPARISON).orElse(false);
        for (int i = 0; i < args.size(); i++) {
            if (!names(args.get(i), name)) {
                continue;
            }
            if (signature.isPresent()) {
                return symbols.sortFor(signature.get().getParameterTypes().get(i));
            }
            Optional<FuncDecl> declared = symbols.findDeclared(operation.getName(), args.size());
            if (declared.isPresent()) {
                return declared.get().getDomain()[i];
            }
            if (sameSorted) {
                for (int j = 0; j < args.size(); j++) {
                    Sort sibling = j == i ? null : knownSort(args.get(j));
                    if (sibling != null) {
                        return sibling;
                    }
                }
            }
        }
        return null;
    }

    private Sort knownSort(Expression expression) {
        if (expression instanceof Variable variable) {
            return symbols.findConstant(variable.getName()).map(Expr::getSort).orElse(null);
        }
        if (expression instanceof Operation operation) {
            if (operation.getArity() == 0 && symbols.findConstant(operation.getName()).isPresent()) {
                return symbols.findConstant(operation.getName()).get().getSort();
            }
            Optional<OperationDecl> signature = symbols.signatureOf(operation.getName(), operation.getArity());
            if (signature.isPresent()) {
                return symbols.sortFor(signature.get().getResultType());
            }
            return symbols.findDeclared(operation.getName(), operation.getArity())
                    .map(FuncDecl::getRange).orElse(null);
        }
        return null;
    }

    private static boolean names(Expression expression, String name) {
        if (expression instanceof Variable variable) {
            return variable.getName().equals(name);
        }
        return expression instanceof Operation operation && operation.getArity() == 0
                && operation.getName().equals(name);
    }

    private Expr translateConstant(Constant constant) {
        if (constant.isBoolean()) {
            return ctx.mkBool(constant.getBoolean().orElseThrow());
        }
        return constant.getNumber().orElseThrow().toZ3(ctx, true);
    }

    private Expr resolveName(String name, Map<String, Expr> environment, boolean allowFree) {
        Expr bound = environment.get(name);
        if (bound != null) {
            return bound;
        }
        return symbols.findConstant(name).orElseGet(() -> {
            if (!allowFree) {
                logger.error("自由变量 {} 既未被量词约束，也不是已声明的特殊元素", name);
                throw TranslationException.unsupported("自由变量 " + name + " 既未被量词约束，也不是已声明的特殊元素");
            }
            return symbols.freeVariable(name);
        });
    }

    private Expr translateOperation(Operation operation, Map<String, Expr> environment, boolean allowFree) {
        if (operation.getArity() == 0) {
            // 零元运算可能指向特殊元素
            Expr named = environment.get(operation.getName());
            if (named != null) {
                return named;
            }
            if (symbols.findConstant(operation.getName()).isPresent()) {
                return symbols.findConstant(operation.getName()).get();
            }
        }
        List<Expr> args = new ArrayList<>(operation.getArity());
        for (Expression arg : operation.getArgs()) {
            args.add(translate(arg, environment, allowFree));
        }
        return translators.translate(operation.getName(), args, symbols);
    }

    private Expr translateQuantified(Quantified quantified, Map<String, Expr> environment, boolean allowFree) {
        Map<String, Expr> scope = new HashMap<>(environment);
        List<BoundVariable> variables = quantified.getVariables();
        Expr[] bound = new Expr[variables.size()];
        List<BoolExpr> premises = new ArrayList<>();
        for (int i = 0; i < bound.length; i++) {
            BoundVariable variable = variables.get(i);
            String type = variable.getType().orElse(null);
            bound[i] = ctx.mkFreshConst(variable.getName(), boundSort(variable, quantified));
            scope.put(variable.getName(), bound[i]);
            if (Z3SymbolManager.isNatural(type)) {
                premises.add(ctx.mkGe((ArithExpr) bound[i], ctx.mkInt(0)));
            }
        }
        if (quantified.getGuard().isPresent()) {
            Expression guard = quantified.getGuard().get();
            premises.add(asBool(translate(guard, scope, allowFree), guard));
        }
        BoolExpr body = asBool(translate(quantified.getBody(), scope, allowFree), quantified.getBody());

        if (quantified.getQuantifier() == QuantifierKind.FORALL) {
            BoolExpr matrix = premises.isEmpty() ? body : ctx.mkImplies(conjunction(premises), body);
            return ctx.mkForall(bound, matrix, 1, null, null, null, null);
        }
        List<BoolExpr> conjuncts = new ArrayList<>(premises);
        conjuncts.add(body);
        return ctx.mkExists(bound, conjunction(conjuncts), 1, null, null, null, null);
    }

    private Expr translateConditional(Conditional conditional, Map<String, Expr> environment, boolean allowFree) {
        BoolExpr condition = asBool(translate(conditional.getCondition(), environment, allowFree),
                conditional.getCondition());
        Expr thenBranch = translate(conditional.getThenBranch(), environment, allowFree);
        Expr elseBranch = translate(conditional.getElseBranch(), environment, allowFree);
        if (thenBranch instanceof ArithExpr && elseBranch instanceof ArithExpr) {
            ArithExpr[] branches = ArithmeticTranslators.unify(ctx, "if", List.of(thenBranch, elseBranch));
            return ctx.mkITE(condition, branches[0], branches[1]);
        }
        if (!thenBranch.getSort().equals(elseBranch.getSort())) {
            throw TranslationException.unsupported("条件表达式两个分支排序不一致: " + conditional);
        }
        return ctx.mkITE(condition, thenBranch, elseBranch);
    }

    private BoolExpr conjunction(List<BoolExpr> conjuncts) {
        return conjuncts.size() == 1 ? conjuncts.get(0) : ctx.mkAnd(conjuncts.toArray(new BoolExpr[0]));
    }

    private static BoolExpr asBool(Expr expr, Expression source) {
        if (!(expr instanceof BoolExpr)) {
            throw TranslationException.unsupported("表达式不是命题: " + source);
        }
        return (BoolExpr) expr;
    }
}
