package org.axioms.structures;

import org.axioms.core.AxiomVerificationException;

/**
 * 注册结构或实现块时的失败。调用方总可以修正后重试。
 */
public class RegistryException extends AxiomVerificationException {

    public enum Kind {
        /** 同名结构已注册 */
        DUPLICATE_NAME,
        /** 引用的结构不存在 */
        UNKNOWN_STRUCTURE
    }

    private final Kind kind;
    private final String structureName;

    public RegistryException(Kind kind, String structureName, String message) {
        super(message);
        this.kind = kind;
        this.structureName = structureName;
    }

    public static RegistryException duplicateName(String name) {
        return new RegistryException(Kind.DUPLICATE_NAME, name, "结构已注册: " + name);
    }

    public static RegistryException unknownStructure(String name) {
        return new RegistryException(Kind.UNKNOWN_STRUCTURE, name, "未知结构: " + name);
    }

    public Kind getKind() {
        return kind;
    }

    public String getStructureName() {
        return structureName;
    }
}
