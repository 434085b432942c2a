package org.axioms.resolution;

import org.axioms.structures.NestedStructure;
import org.axioms.structures.RegistryException;
import org.axioms.structures.StructureDef;
import org.axioms.structures.StructureRef;
import org.axioms.structures.StructureRegistry;
import org.axioms.structures.WhereConstraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 计算一个结构需要加载的依赖闭包（extends、over、where、nested 四类边）。
 * 结果按"依赖先于被依赖者"排序，并在解析器内缓存。
 * 通过显式的"解析中"路径检测环，不依赖调用栈深度。
 * 非线程安全：每个会话持有一个实例。
 */
public class DependencyResolver {

    private static final Logger logger = LoggerFactory.getLogger(DependencyResolver.class);

    private final StructureRegistry registry;
    private final Map<String, List<String>> memo = new HashMap<>();
    private final List<String> inProgress = new ArrayList<>();

    public DependencyResolver(StructureRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "DependencyResolver-构造函数: registry 不能为 null");
    }

    /**
     * 解析结构的加载顺序，结构自身位于最后。
     * @param name 结构名
     * @return 依赖闭包，依赖在前
     * @throws RegistryException UNKNOWN_STRUCTURE，如果结构或其引用的结构未注册
     * @throws ResolutionException CIRCULAR_DEPENDENCY，如果依赖图有环
     */
    public List<String> resolve(String name) {
        Objects.requireNonNull(name, "DependencyResolver-resolve: name 不能为 null");
        try {
            return visit(name);
        } finally {
            inProgress.clear();
        }
    }

    /**
     * 返回结构的直接依赖边（不做传递闭包）。
     */
    public List<Dependency> directDependencies(String name) {
        StructureDef def = registry.get(name).orElseThrow(() -> RegistryException.unknownStructure(name));
        List<Dependency> edges = new ArrayList<>();
        def.getExtends().ifPresent(ref -> edges.add(Dependency.of(name, ref.getName(), DependencyKind.EXTENDS)));
        def.getOver().ifPresent(ref -> edges.add(Dependency.of(name, ref.getName(), DependencyKind.OVER)));
        for (WhereConstraint constraint : registry.getWhereConstraints(name)) {
            edges.add(Dependency.of(name, constraint.getStructureName(), DependencyKind.WHERE));
        }
        collectNestedEdges(name, def, edges);
        return edges;
    }

    public boolean isMemoized(String name) {
        return memo.containsKey(name);
    }

    public void clear() {
        memo.clear();
        inProgress.clear();
    }

    private List<String> visit(String name) {
        List<String> cached = memo.get(name);
        if (cached != null) {
            return cached;
        }
        int index = inProgress.indexOf(name);
        if (index >= 0) {
            List<String> cycle = new ArrayList<>(inProgress.subList(index, inProgress.size()));
            cycle.add(name);
            logger.error("结构依赖图存在环: {}", cycle);
            throw new ResolutionException(cycle);
        }

        inProgress.add(name);
        Set<String> order = new LinkedHashSet<>();
        for (Dependency dependency : directDependencies(name)) {
            order.addAll(visit(dependency.getTarget()));
        }
        order.add(name);
        inProgress.remove(inProgress.size() - 1);

        List<String> result = List.copyOf(order);
        memo.put(name, result);
        logger.debug("解析 {} 的依赖: {}", name, result);
        return result;
    }

    private void collectNestedEdges(String owner, StructureDef def, List<Dependency> edges) {
        for (NestedStructure nested : def.getNested()) {
            StructureDef child = nested.getDefinition();
            if (!child.getName().equals(owner) && registry.contains(child.getName())) {
                edges.add(Dependency.of(owner, child.getName(), DependencyKind.NESTED));
            }
            child.getExtends().map(StructureRef::getName)
                    .ifPresent(target -> edges.add(Dependency.of(owner, target, DependencyKind.NESTED)));
            child.getOver().map(StructureRef::getName)
                    .ifPresent(target -> edges.add(Dependency.of(owner, target, DependencyKind.NESTED)));
            collectNestedEdges(owner, child, edges);
        }
    }
}
