package org.axioms.session;

import org.axioms.core.Expression;
import org.axioms.core.Expressions;
import org.axioms.solvers.SatisfiabilityResult;
import org.axioms.solvers.SolverBackend;
import org.axioms.solvers.SolverBackends;
import org.axioms.solvers.SolverConfig;
import org.axioms.solvers.SolverException;
import org.axioms.solvers.VerificationResult;
import org.axioms.structures.StructureRegistry;
import org.axioms.symbolic.OperationTranslatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 公理验证的入口：加载结构依赖后在临时作用域中验证命题，并提供求值、化简与等价判断。
 * 每个实例独占一个后端与会话，非线程安全。
 * <pre>
 *     try (AxiomVerifier verifier = AxiomVerifier.newSession(backend, registry)) {
 *         VerificationResult result = verifier.verify("Monoid", axiom);
 *     }
 * </pre>
 */
public class AxiomVerifier implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AxiomVerifier.class);

    private final SolverSession session;
    private final SolverBackend backend;
    private final SolverConfig config;
    private final StructureRegistry registry;
    private int verifications;

    private AxiomVerifier(SolverBackend backend, StructureRegistry registry, SolverConfig config) {
        this.backend = Objects.requireNonNull(backend, "AxiomVerifier-构造函数: backend 不能为 null");
        this.registry = Objects.requireNonNull(registry, "AxiomVerifier-构造函数: registry 不能为 null");
        this.config = Objects.requireNonNull(config, "AxiomVerifier-构造函数: config 不能为 null");
        this.session = new SolverSession(backend, registry);
    }

    public static AxiomVerifier newSession(SolverBackend backend, StructureRegistry registry) {
        return new AxiomVerifier(backend, registry, SolverConfig.defaults());
    }

    public static AxiomVerifier newSession(SolverBackend backend, StructureRegistry registry, SolverConfig config) {
        return new AxiomVerifier(backend, registry, config);
    }

    /**
     * 按配置选择后端并创建会话。
     */
    public static AxiomVerifier create(SolverConfig config, OperationTranslatorRegistry translators,
                                       StructureRegistry registry) {
        return new AxiomVerifier(SolverBackends.create(config, translators, registry), registry, config);
    }

    /**
     * 加载结构（及其依赖）后验证命题。
     * @param structureName 结构名
     * @param axiom 待证命题
     * @return 验证结果
     * @throws org.axioms.structures.RegistryException 结构未注册
     * @throws org.axioms.resolution.ResolutionException 依赖图有环
     * @throws StructureLoadException 结构成员无法加载
     */
    public VerificationResult verify(String structureName, Expression axiom) {
        session.ensureStructureLoaded(structureName);
        return verifyLoaded(axiom);
    }

    /**
     * 根据命题中出现的运算与元素名，加载声明它们的结构后验证。
     */
    public VerificationResult verify(Expression axiom) {
        Objects.requireNonNull(axiom, "AxiomVerifier-verify: axiom 不能为 null");
        for (String owner : owningStructures(axiom)) {
            session.ensureStructureLoaded(owner);
        }
        return verifyLoaded(axiom);
    }

    public Expression evaluate(Expression expression) {
        return backend.evaluate(expression, Map.of());
    }

    public Expression evaluate(Expression expression, Map<String, Expression> bindings) {
        return backend.evaluate(expression, bindings);
    }

    public Expression simplify(Expression expression) {
        return backend.simplify(expression);
    }

    /**
     * @throws SolverException 求解器无法判定
     */
    public boolean areEquivalent(Expression left, Expression right) {
        return session.withPushedScope(() -> backend.areEquivalent(left, right));
    }

    public SatisfiabilityResult checkSatisfiability(Expression proposition) {
        return backend.checkSatisfiability(proposition);
    }

    /**
     * 检查已加载的背景理论本身是否可满足。
     */
    public SatisfiabilityResult checkConsistency() {
        return backend.checkConsistency();
    }

    public void ensureStructureLoaded(String structureName) {
        session.ensureStructureLoaded(structureName);
    }

    public VerifierStats stats() {
        return VerifierStats.builder()
                .structuresLoaded(session.getLoaded().size())
                .loadRequests(session.getLoadRequests())
                .cacheHits(session.getCacheHits())
                .verifications(verifications)
                .declaredOperations(backend.declaredOperationCount())
                .build();
    }

    public SolverSession getSession() {
        return session;
    }

    public void reset() {
        session.reset();
    }

    @Override
    public void close() {
        backend.close();
    }

    private VerificationResult verifyLoaded(Expression axiom) {
        Objects.requireNonNull(axiom, "AxiomVerifier-verify: axiom 不能为 null");
        verifications++;
        if (config.isCheckConsistency()) {
            SatisfiabilityResult consistency;
            try {
                consistency = backend.checkConsistency();
            } catch (SolverException e) {
                return VerificationResult.error(e.getMessage());
            }
            if (consistency.isUnsatisfiable()) {
                logger.warn("已加载的背景理论不一致，拒绝验证 {}", axiom);
                return VerificationResult.error("已加载的背景理论不一致: " + session.getLoaded().structures());
            }
        }
        VerificationResult result = session.withPushedScope(() -> backend.verifyAxiom(axiom));
        logger.info("验证 {}: {}", axiom, result);
        return result;
    }

    private Set<String> owningStructures(Expression axiom) {
        Set<String> names = new LinkedHashSet<>(Expressions.operationNames(axiom));
        names.addAll(Expressions.freeVariables(axiom));
        Set<String> owners = new LinkedHashSet<>();
        for (String name : names) {
            owners.addAll(registry.getOperationOwners(name));
        }
        logger.debug("命题 {} 依赖的结构: {}", axiom, owners);
        return owners;
    }
}
