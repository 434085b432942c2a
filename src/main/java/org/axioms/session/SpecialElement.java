package org.axioms.session;

import java.util.Objects;
import java.util.Optional;

/**
 * 已声明的特殊元素（单位元、零元、零元运算）的描述。对应的求解器常量保存在后端内部。
 */
public final class SpecialElement {

    private final String name;
    private final String type; // 可为 null
    private final String owner;

    SpecialElement(String name, String type, String owner) {
        this.name = Objects.requireNonNull(name, "SpecialElement-构造函数: name 不能为 null");
        this.type = type;
        this.owner = Objects.requireNonNull(owner, "SpecialElement-构造函数: owner 不能为 null");
    }

    public String getName() {
        return name;
    }

    public Optional<String> getType() {
        return Optional.ofNullable(type);
    }

    /**
     * @return 声明该元素的结构名
     */
    public String getOwner() {
        return owner;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SpecialElement that)) {
            return false;
        }
        return name.equals(that.name) && Objects.equals(type, that.type) && owner.equals(that.owner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, owner);
    }

    @Override
    public String toString() {
        return owner + "." + name + (type == null ? "" : " : " + type);
    }
}
