package org.axioms.structures;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 结构与实现块的权威存储。加载阶段一次性填充，验证期间只读，可在多个会话间共享。
 * 结构按注册顺序保存。
 * @author Ayalyt
 */
public class StructureRegistry {

    private static final Logger logger = LoggerFactory.getLogger(StructureRegistry.class);

    private final Map<String, StructureDef> structures = new LinkedHashMap<>();
    private final Map<String, List<ImplementsDef>> implementations = new LinkedHashMap<>();

    /**
     * 注册一个结构定义。
     * @param def 结构定义
     * @throws RegistryException DUPLICATE_NAME，如果同名结构已存在
     */
    public synchronized void registerStructure(StructureDef def) {
        Objects.requireNonNull(def, "StructureRegistry-registerStructure: def 不能为 null");
        if (structures.containsKey(def.getName())) {
            logger.error("结构 {} 重复注册", def.getName());
            throw RegistryException.duplicateName(def.getName());
        }
        structures.put(def.getName(), def);
        logger.debug("注册结构: {}", def);
    }

    /**
     * 注册一个实现块。被实现的结构及所有 where 约束指向的结构都必须已注册。
     * @param def 实现块
     * @throws RegistryException UNKNOWN_STRUCTURE，如果任一引用的结构不存在
     */
    public synchronized void registerImplements(ImplementsDef def) {
        Objects.requireNonNull(def, "StructureRegistry-registerImplements: def 不能为 null");
        if (!structures.containsKey(def.getStructureName())) {
            logger.error("实现块引用了未注册的结构 {}", def.getStructureName());
            throw RegistryException.unknownStructure(def.getStructureName());
        }
        for (WhereConstraint constraint : def.getWhere().orElse(List.of())) {
            if (!structures.containsKey(constraint.getStructureName())) {
                logger.error("实现块 {} 的 where 约束引用了未注册的结构 {}", def, constraint.getStructureName());
                throw RegistryException.unknownStructure(constraint.getStructureName());
            }
        }
        implementations.computeIfAbsent(def.getStructureName(), k -> new ArrayList<>()).add(def);
        logger.debug("注册实现块: {}", def);
    }

    // ========== 只读访问 ==========

    public synchronized Optional<StructureDef> get(String name) {
        return Optional.ofNullable(structures.get(name));
    }

    public synchronized boolean contains(String name) {
        return structures.containsKey(name);
    }

    /**
     * @return 所有结构名，按注册顺序
     */
    public synchronized List<String> structureNames() {
        return List.copyOf(structures.keySet());
    }

    public Optional<StructureRef> getExtends(String name) {
        return require(name).getExtends();
    }

    public Optional<StructureRef> getOver(String name) {
        return require(name).getOver();
    }

    public List<NestedStructure> getNested(String name) {
        return require(name).getNested();
    }

    public List<AxiomDecl> getAxioms(String name) {
        return require(name).getAxioms();
    }

    public synchronized List<ImplementsDef> getImplementations(String name) {
        require(name);
        return Collections.unmodifiableList(implementations.getOrDefault(name, List.of()));
    }

    /**
     * 汇总该结构所有实现块上的 where 约束。
     */
    public List<WhereConstraint> getWhereConstraints(String name) {
        return getImplementations(name).stream()
                .flatMap(impl -> impl.getWhere().orElse(List.of()).stream())
                .distinct()
                .collect(Collectors.toList());
    }

    /**
     * 查找某个运算的签名（包括嵌套结构中的声明），用于为未解释函数确定排序。
     * 多个结构声明同名运算时返回注册顺序中的第一个。
     */
    public synchronized Optional<OperationDecl> getOperationSignature(String operationName) {
        for (StructureDef def : structures.values()) {
            Optional<OperationDecl> found = findOperation(def, operationName);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * 返回声明了该名字（运算、元素或派生运算，含嵌套成员）的所有结构名。
     */
    public synchronized Set<String> getOperationOwners(String operationName) {
        Set<String> owners = new LinkedHashSet<>();
        for (StructureDef def : structures.values()) {
            if (declares(def, operationName)) {
                owners.add(def.getName());
            }
        }
        return owners;
    }

    public synchronized List<String> structuresWithAxioms() {
        return structures.values().stream()
                .filter(StructureDef::hasAxioms)
                .map(StructureDef::getName)
                .collect(Collectors.toList());
    }

    private synchronized StructureDef require(String name) {
        StructureDef def = structures.get(name);
        if (def == null) {
            throw RegistryException.unknownStructure(name);
        }
        return def;
    }

    private static Optional<OperationDecl> findOperation(StructureDef def, String operationName) {
        for (OperationDecl decl : def.getOperations()) {
            if (decl.getName().equals(operationName)) {
                return Optional.of(decl);
            }
        }
        for (NestedStructure nested : def.getNested()) {
            Optional<OperationDecl> found = findOperation(nested.getDefinition(), operationName);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private static boolean declares(StructureDef def, String memberName) {
        for (Member member : def.getMembers()) {
            if (member instanceof NestedStructure nested) {
                if (declares(nested.getDefinition(), memberName)) {
                    return true;
                }
            } else if (member.getKind() != MemberKind.AXIOM && member.getName().equals(memberName)) {
                return true;
            }
        }
        return false;
    }
}
