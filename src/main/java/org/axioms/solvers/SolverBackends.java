package org.axioms.solvers;

import org.axioms.solvers.z3.Z3Backend;
import org.axioms.structures.StructureRegistry;
import org.axioms.symbolic.OperationTranslatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按名称选择后端。内置 "z3"，其他后端可通过 {@link #register} 加入。
 */
public final class SolverBackends {

    private static final Logger logger = LoggerFactory.getLogger(SolverBackends.class);

    /**
     * 后端工厂。
     */
    @FunctionalInterface
    public interface Factory {
        SolverBackend create(SolverConfig config, OperationTranslatorRegistry translators, StructureRegistry registry);
    }

    private static final Map<String, Factory> FACTORIES = new ConcurrentHashMap<>();

    static {
        FACTORIES.put(Z3Backend.NAME, Z3Backend::new);
    }

    private SolverBackends() {
    }

    /**
     * @throws IllegalStateException 同名后端已注册
     */
    public static void register(String name, Factory factory) {
        Objects.requireNonNull(factory, "SolverBackends-register: factory 不能为 null");
        if (FACTORIES.putIfAbsent(name, factory) != null) {
            throw new IllegalStateException("后端已注册: " + name);
        }
        logger.info("注册求解器后端: {}", name);
    }

    public static Set<String> names() {
        return new TreeSet<>(FACTORIES.keySet());
    }

    /**
     * 按配置中的后端名创建后端。
     * @throws IllegalArgumentException 后端名未注册
     */
    public static SolverBackend create(SolverConfig config, OperationTranslatorRegistry translators,
                                       StructureRegistry registry) {
        Objects.requireNonNull(config, "SolverBackends-create: config 不能为 null");
        Factory factory = FACTORIES.get(config.getBackendName());
        if (factory == null) {
            logger.error("未知后端 {}，可用: {}", config.getBackendName(), names());
            throw new IllegalArgumentException("未知后端: " + config.getBackendName() + "，可用: " + names());
        }
        return factory.create(config, translators, registry);
    }

    public static SolverBackend create(SolverConfig config, StructureRegistry registry) {
        return create(config, OperationTranslatorRegistry.withDefaults(), registry);
    }
}
