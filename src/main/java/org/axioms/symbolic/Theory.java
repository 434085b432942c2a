package org.axioms.symbolic;

/**
 * 原生翻译器所属的求解器理论。
 */
public enum Theory {
    ARITHMETIC("arithmetic"),
    COMPARISON("comparison"),
    BOOLEAN("boolean"),
    /** 通过 register 钩子注册的自定义翻译器 */
    CUSTOM("custom");

    private final String id;

    Theory(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
