package org.axioms.resolution;

import org.axioms.core.AxiomVerificationException;

import java.util.List;

/**
 * 依赖解析失败：结构图中存在环。在任何求解器交互之前抛出。
 */
public class ResolutionException extends AxiomVerificationException {

    public enum Kind {
        CIRCULAR_DEPENDENCY
    }

    private final Kind kind;
    private final List<String> path;

    public ResolutionException(List<String> path) {
        super("检测到循环依赖: " + String.join(" -> ", path));
        this.kind = Kind.CIRCULAR_DEPENDENCY;
        this.path = List.copyOf(path);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return 环上的结构名，首尾相同
     */
    public List<String> getPath() {
        return path;
    }
}
