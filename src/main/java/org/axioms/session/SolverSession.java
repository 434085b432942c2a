package org.axioms.session;

import org.axioms.core.Expressions;
import org.axioms.resolution.DependencyResolver;
import org.axioms.resolution.ResolutionException;
import org.axioms.solvers.SolverBackend;
import org.axioms.solvers.SolverException;
import org.axioms.structures.AxiomDecl;
import org.axioms.structures.ElementDecl;
import org.axioms.structures.FunctionDef;
import org.axioms.structures.NestedStructure;
import org.axioms.structures.OperationDecl;
import org.axioms.structures.RegistryException;
import org.axioms.structures.StructureDef;
import org.axioms.structures.StructureRef;
import org.axioms.structures.StructureRegistry;
import org.axioms.symbolic.TranslationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 一个长期存在的求解会话：按需解析依赖并把结构的公理、派生运算和特殊元素加载为背景断言。
 * 加载是幂等的，已加载结构记录在 {@link LoadedStructureSet} 中。
 * 非线程安全：并发调用方应各自持有会话。
 */
public class SolverSession {

    private static final Logger logger = LoggerFactory.getLogger(SolverSession.class);

    private final SolverBackend backend;
    private final StructureRegistry registry;
    private final DependencyResolver resolver;
    private final LoadedStructureSet loaded = new LoadedStructureSet();

    private int loadRequests;
    private int cacheHits;

    public SolverSession(SolverBackend backend, StructureRegistry registry) {
        this.backend = Objects.requireNonNull(backend, "SolverSession-构造函数: backend 不能为 null");
        this.registry = Objects.requireNonNull(registry, "SolverSession-构造函数: registry 不能为 null");
        this.resolver = new DependencyResolver(registry);
    }

    /**
     * 确保结构及其全部依赖已加载。重复调用不会重复断言。
     * @param structureName 结构名
     * @throws RegistryException UNKNOWN_STRUCTURE，如果结构或其依赖未注册
     * @throws ResolutionException 依赖图有环
     * @throws StructureLoadException 某个成员无法翻译；该结构保持未加载
     */
    public void ensureStructureLoaded(String structureName) {
        Objects.requireNonNull(structureName, "SolverSession-ensureStructureLoaded: structureName 不能为 null");
        loadRequests++;
        if (loaded.contains(structureName)) {
            cacheHits++;
            logger.debug("结构 {} 已加载，跳过", structureName);
            return;
        }
        if (!registry.contains(structureName)) {
            logger.error("请求加载未注册的结构 {}", structureName);
            throw RegistryException.unknownStructure(structureName);
        }
        for (String name : resolver.resolve(structureName)) {
            if (!loaded.contains(name)) {
                loadStructure(registry.get(name).orElseThrow(() -> RegistryException.unknownStructure(name)));
            }
        }
    }

    /**
     * 在临时作用域中执行查询，结束后总是弹出作用域。
     */
    public <T> T withPushedScope(Supplier<T> action) {
        backend.push();
        try {
            return action.get();
        } finally {
            backend.pop();
        }
    }

    /**
     * 丢弃求解器状态、已加载集合与依赖缓存。
     */
    public void reset() {
        backend.reset();
        loaded.clear();
        resolver.clear();
        logger.info("会话已重置");
    }

    public boolean isLoaded(String structureName) {
        return loaded.contains(structureName);
    }

    public LoadedStructureSet getLoaded() {
        return loaded;
    }

    public SolverBackend getBackend() {
        return backend;
    }

    public StructureRegistry getRegistry() {
        return registry;
    }

    public int getLoadRequests() {
        return loadRequests;
    }

    public int getCacheHits() {
        return cacheHits;
    }

    private void loadStructure(StructureDef def) {
        rejectRecursiveDefinitions(def);
        bindCarrierAliases(def);

        // 先在试探作用域中断言，任一成员失败则整个结构回滚
        backend.push();
        try {
            assertMembers(def.getName(), def, "", new ArrayList<>());
        } finally {
            backend.pop();
        }

        List<SpecialElement> declared = new ArrayList<>();
        assertMembers(def.getName(), def, "", declared);
        loaded.markLoaded(def.getName(), declared);
        logger.info("加载结构 {}: {} 条公理，{} 个派生运算，{} 个特殊元素",
                def.getName(), def.getAxioms().size(), def.getFunctions().size(), declared.size());
    }

    /**
     * extends/over 引用的类型实参与被引用结构的类型参数按位置共用排序，嵌套结构同样处理。
     */
    private void bindCarrierAliases(StructureDef def) {
        List<StructureRef> refs = new ArrayList<>();
        def.getExtends().ifPresent(refs::add);
        def.getOver().ifPresent(refs::add);
        for (StructureRef ref : refs) {
            Optional<StructureDef> target = registry.get(ref.getName());
            if (target.isEmpty()) {
                continue;
            }
            List<String> parameters = target.get().getTypeParameters();
            int shared = Math.min(parameters.size(), ref.getTypeArgs().size());
            for (int i = 0; i < shared; i++) {
                backend.declareCarrierAlias(ref.getTypeArgs().get(i), parameters.get(i));
            }
        }
        for (NestedStructure nested : def.getNested()) {
            bindCarrierAliases(nested.getDefinition());
        }
    }

    private void assertMembers(String owner, StructureDef def, String prefix, List<SpecialElement> declared) {
        // 特殊元素必须先于引用它们的公理声明
        for (ElementDecl element : def.getElements()) {
            backend.declareSpecialElement(element.getName(), element.getType().orElse(null));
            declared.add(new SpecialElement(element.getName(), element.getType().orElse(null), owner));
        }
        for (OperationDecl operation : def.getOperations()) {
            if (operation.isNullary()) {
                backend.declareSpecialElement(operation.getName(), operation.getResultType());
                declared.add(new SpecialElement(operation.getName(), operation.getResultType(), owner));
            }
        }
        for (NestedStructure nested : def.getNested()) {
            assertMembers(owner, nested.getDefinition(), prefix + nested.getName() + ".", declared);
        }
        for (FunctionDef function : def.getFunctions()) {
            String member = prefix + function.getName();
            try {
                backend.defineFunction(function.getName(), function.getParameters(), function.getBody());
            } catch (TranslationException | SolverException e) {
                logger.error("结构 {} 的派生运算 {} 无法加载: {}", owner, member, e.getMessage());
                throw new StructureLoadException(owner, member, e);
            }
        }
        for (AxiomDecl axiom : def.getAxioms()) {
            String member = prefix + axiom.getName();
            try {
                backend.assertExpression(axiom.getProposition());
            } catch (TranslationException | SolverException e) {
                logger.error("结构 {} 的公理 {} 无法加载: {}", owner, member, e.getMessage());
                throw new StructureLoadException(owner, member, e);
            }
        }
    }

    /**
     * 拒绝自递归或互递归的派生运算。调用关系取整个注册表中的派生运算定义。
     */
    private void rejectRecursiveDefinitions(StructureDef def) {
        Map<String, Set<String>> calls = new HashMap<>();
        for (String name : registry.structureNames()) {
            registry.get(name).ifPresent(other -> collectCalls(other, calls));
        }
        List<FunctionDef> local = new ArrayList<>();
        collectFunctions(def, local);
        for (FunctionDef function : local) {
            List<String> path = new ArrayList<>();
            path.add(function.getName());
            if (reaches(function.getName(), function.getName(), calls, path, new HashSet<>())) {
                logger.error("结构 {} 的派生运算 {} 是递归定义: {}", def.getName(), function.getName(), path);
                throw new StructureLoadException(def.getName(), function.getName(),
                        "不支持递归定义的派生运算: " + String.join(" -> ", path));
            }
        }
    }

    private static void collectCalls(StructureDef def, Map<String, Set<String>> calls) {
        List<FunctionDef> functions = new ArrayList<>();
        collectFunctions(def, functions);
        for (FunctionDef function : functions) {
            calls.computeIfAbsent(function.getName(), k -> new HashSet<>())
                    .addAll(Expressions.operationNames(function.getBody()));
        }
    }

    private static void collectFunctions(StructureDef def, List<FunctionDef> out) {
        out.addAll(def.getFunctions());
        for (NestedStructure nested : def.getNested()) {
            collectFunctions(nested.getDefinition(), out);
        }
    }

    private static boolean reaches(String current, String target, Map<String, Set<String>> calls,
                                   List<String> path, Set<String> visited) {
        for (String callee : calls.getOrDefault(current, Set.of())) {
            if (callee.equals(target)) {
                path.add(callee);
                return true;
            }
            if (calls.containsKey(callee) && visited.add(callee)) {
                path.add(callee);
                if (reaches(callee, target, calls, path, visited)) {
                    return true;
                }
                path.remove(path.size() - 1);
            }
        }
        return false;
    }
}
