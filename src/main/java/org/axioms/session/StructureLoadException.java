package org.axioms.session;

import org.axioms.core.AxiomVerificationException;

/**
 * 加载结构时某个成员无法断言。该结构保持未加载，已加载的依赖不受影响。
 */
public class StructureLoadException extends AxiomVerificationException {

    private final String structureName;
    private final String memberName;

    public StructureLoadException(String structureName, String memberName, Throwable cause) {
        super("加载结构 " + structureName + " 失败，成员 " + memberName + ": " + cause.getMessage(), cause);
        this.structureName = structureName;
        this.memberName = memberName;
    }

    public StructureLoadException(String structureName, String memberName, String message) {
        super("加载结构 " + structureName + " 失败，成员 " + memberName + ": " + message);
        this.structureName = structureName;
        this.memberName = memberName;
    }

    public String getStructureName() {
        return structureName;
    }

    public String getMemberName() {
        return memberName;
    }
}
