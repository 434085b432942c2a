package org.axioms.solvers.z3;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.axioms.core.BoundVariable;
import org.axioms.core.Expression;
import org.axioms.core.Expressions;
import org.axioms.solvers.CapabilityManifest;
import org.axioms.solvers.SatisfiabilityResult;
import org.axioms.solvers.SolverBackend;
import org.axioms.solvers.SolverCapabilities;
import org.axioms.solvers.SolverConfig;
import org.axioms.solvers.SolverException;
import org.axioms.solvers.VerificationResult;
import org.axioms.structures.StructureRegistry;
import org.axioms.symbolic.ComparisonTranslators;
import org.axioms.symbolic.ExpressionTranslator;
import org.axioms.symbolic.OpenGoal;
import org.axioms.symbolic.OperationTranslatorRegistry;
import org.axioms.symbolic.TranslationException;
import org.axioms.symbolic.Z3SymbolManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 基于 Z3 Java API 的求解器后端。持有一个 Context 与一个增量 Solver。
 * 非线程安全，使用完毕后必须 {@link #close()}。
 * @author Ayalyt
 */
public class Z3Backend implements SolverBackend {

    private static final Logger logger = LoggerFactory.getLogger(Z3Backend.class);

    public static final String NAME = "z3";
    static final String MANIFEST_RESOURCE = "/solvers/z3-capabilities.json";

    private final SolverConfig config;
    private final Context ctx;
    private final Solver solver;
    private final OperationTranslatorRegistry translators;
    private final Z3SymbolManager symbols;
    private final ExpressionTranslator translator;
    private final Z3ResultConverter converter;
    private final Z3WitnessExtractor witnessExtractor;
    private final SolverCapabilities capabilities;

    public Z3Backend(SolverConfig config, OperationTranslatorRegistry translators, StructureRegistry registry) {
        this.config = Objects.requireNonNull(config, "Z3Backend-构造函数: config 不能为 null");
        this.translators = Objects.requireNonNull(translators, "Z3Backend-构造函数: translators 不能为 null");
        this.capabilities = SolverCapabilities.of(CapabilityManifest.load(MANIFEST_RESOURCE), translators);
        this.ctx = new Context();
        this.solver = ctx.mkSolver();
        applyTimeout();
        this.symbols = new Z3SymbolManager(ctx, registry);
        this.translator = new ExpressionTranslator(symbols, translators);
        this.converter = new Z3ResultConverter();
        this.witnessExtractor = new Z3WitnessExtractor(converter);
        logger.debug("Z3 后端初始化完成，超时 {} ms", config.getTimeoutMillis());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SolverCapabilities capabilities() {
        return capabilities;
    }

    @Override
    public VerificationResult verifyAxiom(Expression axiom) {
        Objects.requireNonNull(axiom, "Z3Backend-verifyAxiom: axiom 不能为 null");
        OpenGoal goal;
        try {
            goal = translator.openUniversals(axiom);
        } catch (TranslationException e) {
            logger.warn("目标无法翻译: {}", e.getMessage());
            return VerificationResult.error(e.getMessage());
        } catch (Z3Exception e) {
            logger.error("翻译目标时 Z3 出错", e);
            return VerificationResult.error("Z3 错误: " + e.getMessage());
        }

        solver.push();
        try {
            solver.add(goal.negation(ctx));
            Status status = solver.check();
            logger.debug("verifyAxiom {}: {}", axiom, status);
            return switch (status) {
                case UNSATISFIABLE -> VerificationResult.valid();
                case SATISFIABLE -> VerificationResult.invalid(
                        witnessExtractor.extract(solver.getModel(), goal.getWitnesses()));
                case UNKNOWN -> VerificationResult.unknown(solver.getReasonUnknown());
            };
        } catch (Z3Exception e) {
            logger.error("验证 {} 时 Z3 出错", axiom, e);
            return VerificationResult.error("Z3 错误: " + e.getMessage());
        } finally {
            solver.pop();
        }
    }

    @Override
    public SatisfiabilityResult checkSatisfiability(Expression proposition) {
        Objects.requireNonNull(proposition, "Z3Backend-checkSatisfiability: proposition 不能为 null");
        try {
            BoolExpr query = translator.translateProposition(proposition, true);
            List<Pair<String, Expr>> tracked = new ArrayList<>();
            for (String name : Expressions.freeVariables(proposition)) {
                symbols.findFreeVariable(name).ifPresent(c -> tracked.add(Pair.of(name, c)));
            }
            solver.push();
            try {
                solver.add(query);
                return toSatisfiability(solver.check(), tracked);
            } finally {
                solver.pop();
            }
        } catch (Z3Exception e) {
            throw engineFailure("checkSatisfiability", e);
        }
    }

    @Override
    public boolean areEquivalent(Expression left, Expression right) {
        Objects.requireNonNull(left, "Z3Backend-areEquivalent: left 不能为 null");
        Objects.requireNonNull(right, "Z3Backend-areEquivalent: right 不能为 null");
        try {
            Expr l = translator.translateOpen(left);
            Expr r = translator.translateOpen(right);
            BoolExpr equal = ComparisonTranslators.equality(ctx, "areEquivalent", l, r);
            solver.push();
            try {
                solver.add(ctx.mkNot(equal));
                Status status = solver.check();
                logger.debug("areEquivalent {} ≡ {}: {}", left, right, status);
                if (status == Status.UNKNOWN) {
                    String reason = solver.getReasonUnknown();
                    throw new SolverException(isTimeout(reason) ? SolverException.Kind.TIMEOUT
                            : SolverException.Kind.ENGINE_FAILURE, "无法判定等价性: " + reason);
                }
                return status == Status.UNSATISFIABLE;
            } finally {
                solver.pop();
            }
        } catch (Z3Exception e) {
            throw engineFailure("areEquivalent", e);
        }
    }

    /**
     * 代入绑定后由 Z3 化简求值。只做项化简，不使用背景断言，
     * 因此含未解释函数的结果以符号形式返回。
     */
    @Override
    public Expression evaluate(Expression expression, Map<String, Expression> bindings) {
        Objects.requireNonNull(expression, "Z3Backend-evaluate: expression 不能为 null");
        Objects.requireNonNull(bindings, "Z3Backend-evaluate: bindings 不能为 null");
        try {
            Map<String, Expr> environment = new HashMap<>();
            bindings.forEach((name, value) -> environment.put(name, translator.translateOpen(value)));
            Expr result = translator.translate(expression, environment, true).simplify();
            return converter.toExpression(result);
        } catch (Z3Exception e) {
            throw engineFailure("evaluate", e);
        }
    }

    @Override
    public Expression simplify(Expression expression) {
        Objects.requireNonNull(expression, "Z3Backend-simplify: expression 不能为 null");
        try {
            return converter.toExpression(translator.translateOpen(expression).simplify());
        } catch (Z3Exception e) {
            throw engineFailure("simplify", e);
        }
    }

    @Override
    public void assertExpression(Expression proposition) {
        try {
            solver.add(translator.translateProposition(proposition, false));
        } catch (Z3Exception e) {
            throw engineFailure("assertExpression", e);
        }
        logger.debug("断言: {}", proposition);
    }

    @Override
    public void defineFunction(String name, List<BoundVariable> parameters, Expression body) {
        if (translators.hasNative(name)) {
            logger.warn("派生运算 {} 与原生运算同名，其定义将作为约束断言", name);
        }
        try {
            Map<String, Expr> environment = new HashMap<>();
            Expr[] bound = new Expr[parameters.size()];
            for (int i = 0; i < bound.length; i++) {
                BoundVariable parameter = parameters.get(i);
                bound[i] = ctx.mkFreshConst(parameter.getName(), translator.parameterSort(parameter, body));
                environment.put(parameter.getName(), bound[i]);
            }
            Expr definition = translator.translate(body, environment, false);
            Expr head = translators.translate(name, List.of(bound), symbols);
            BoolExpr equation = ComparisonTranslators.equality(ctx, "define " + name, head, definition);
            solver.add(bound.length == 0 ? equation : ctx.mkForall(bound, equation, 1, null, null, null, null));
        } catch (Z3Exception e) {
            throw engineFailure("defineFunction " + name, e);
        }
        logger.debug("定义派生运算 {}/{}", name, parameters.size());
    }

    @Override
    public void declareCarrierAlias(String alias, String carrier) {
        if (symbols.bindCarrier(alias, carrier)) {
            logger.debug("载体 {} 与 {} 共用排序", alias, carrier);
        }
    }

    @Override
    public void declareSpecialElement(String name, String type) {
        symbols.constant(name, symbols.sortFor(type));
    }

    @Override
    public void push() {
        solver.push();
    }

    @Override
    public void pop() {
        if (solver.getNumScopes() == 0) {
            logger.error("Z3Backend-pop: 没有可弹出的作用域");
            throw new IllegalStateException("Z3Backend-pop: 没有可弹出的作用域");
        }
        solver.pop();
    }

    @Override
    public int scopeDepth() {
        return solver.getNumScopes();
    }

    @Override
    public void reset() {
        solver.reset();
        applyTimeout();
        symbols.clear();
        logger.info("Z3 后端已重置");
    }

    @Override
    public SatisfiabilityResult checkConsistency() {
        try {
            return toSatisfiability(solver.check(), List.of());
        } catch (Z3Exception e) {
            throw engineFailure("checkConsistency", e);
        }
    }

    @Override
    public int declaredOperationCount() {
        return symbols.declaredOperationCount();
    }

    @Override
    public void close() {
        ctx.close();
        logger.debug("Z3 Context 已关闭");
    }

    private SatisfiabilityResult toSatisfiability(Status status, List<Pair<String, Expr>> tracked) {
        return switch (status) {
            case SATISFIABLE -> SatisfiabilityResult.satisfiable(witnessExtractor.extract(solver.getModel(), tracked));
            case UNSATISFIABLE -> SatisfiabilityResult.unsatisfiable();
            case UNKNOWN -> SatisfiabilityResult.unknown(solver.getReasonUnknown());
        };
    }

    private void applyTimeout() {
        if (config.getTimeoutMillis() > 0) {
            Params params = ctx.mkParams();
            params.add("timeout", config.getTimeoutMillis());
            solver.setParameters(params);
        }
    }

    private static boolean isTimeout(String reason) {
        return StringUtils.containsAnyIgnoreCase(reason, "timeout", "canceled");
    }

    private static SolverException engineFailure(String operation, Z3Exception e) {
        logger.error("{} 时 Z3 出错", operation, e);
        return new SolverException(SolverException.Kind.ENGINE_FAILURE, operation + " 失败: " + e.getMessage(), e);
    }
}
