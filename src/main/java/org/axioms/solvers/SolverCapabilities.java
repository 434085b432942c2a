package org.axioms.solvers;

import lombok.Getter;
import org.axioms.symbolic.OperationKey;
import org.axioms.symbolic.OperationTranslatorRegistry;
import org.axioms.symbolic.Theory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 后端能力描述。构造后不可变，可在会话之间共享。
 */
@Getter
public final class SolverCapabilities {

    private final String solverName;
    private final String version;
    private final String solverType;
    private final String description;
    private final Set<String> theories;
    private final Map<OperationKey, Theory> nativeOperations;
    private final FeatureFlags features;
    private final int maxAxioms;

    private SolverCapabilities(CapabilityManifest manifest, Map<OperationKey, Theory> nativeOperations) {
        this.solverName = manifest.getSolver().getName();
        this.version = manifest.getSolver().getVersion();
        this.solverType = manifest.getSolver().getType();
        this.description = manifest.getSolver().getDescription();
        this.theories = Set.copyOf(manifest.getCapabilities().getTheories());
        this.nativeOperations = nativeOperations;
        this.features = manifest.getCapabilities().getFeatures();
        this.maxAxioms = manifest.getCapabilities().getPerformance().getMaxAxioms();
    }

    /**
     * @param manifest 后端的能力清单
     * @param translators 后端使用的翻译器注册表（取其当前的原生运算快照）
     */
    public static SolverCapabilities of(CapabilityManifest manifest, OperationTranslatorRegistry translators) {
        return new SolverCapabilities(manifest, translators.nativeOperations());
    }

    public boolean hasOperation(String name) {
        return nativeOperations.keySet().stream().anyMatch(k -> k.getName().equals(name));
    }

    public boolean hasOperation(String name, int arity) {
        return nativeOperations.containsKey(OperationKey.of(name, arity))
                || nativeOperations.containsKey(OperationKey.variadic(name));
    }

    public Optional<Theory> theoryOf(String name, int arity) {
        Theory exact = nativeOperations.get(OperationKey.of(name, arity));
        return Optional.ofNullable(exact != null ? exact : nativeOperations.get(OperationKey.variadic(name)));
    }

    public boolean hasTheory(String theory) {
        return theories.contains(theory);
    }

    public Set<String> nativeOperationNames() {
        return nativeOperations.keySet().stream().map(OperationKey::getName)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    public String toString() {
        return solverName + " " + version + " (" + nativeOperations.size() + " native operations, theories "
                + theories + ")";
    }
}
