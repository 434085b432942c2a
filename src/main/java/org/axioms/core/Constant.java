package org.axioms.core;

import org.axioms.utils.Rational;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 常量节点：精确数值或布尔值。
 * 此类是不可变的。
 */
public final class Constant implements Expression {

    public static final Constant TRUE = new Constant(null, Boolean.TRUE);
    public static final Constant FALSE = new Constant(null, Boolean.FALSE);

    // 二者恰有一个非 null
    private final Rational number;
    private final Boolean bool;

    private Constant(Rational number, Boolean bool) {
        this.number = number;
        this.bool = bool;
    }

    public static Constant of(long value) {
        return new Constant(Rational.valueOf(value), null);
    }

    public static Constant of(Rational value) {
        return new Constant(Objects.requireNonNull(value, "Constant-of: value 不能为 null"), null);
    }

    public static Constant of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * 解析数值字面量，"true"/"false" 解析为布尔常量。
     * @param literal 字面量
     * @return 常量节点
     * @throws NumberFormatException 字面量既非布尔也非数值
     */
    public static Constant parse(String literal) {
        Objects.requireNonNull(literal, "Constant-parse: literal 不能为 null");
        String text = literal.trim();
        if ("true".equalsIgnoreCase(text)) {
            return TRUE;
        }
        if ("false".equalsIgnoreCase(text)) {
            return FALSE;
        }
        return of(Rational.valueOf(text));
    }

    public boolean isNumber() {
        return number != null;
    }

    public boolean isBoolean() {
        return bool != null;
    }

    public Optional<Rational> getNumber() {
        return Optional.ofNullable(number);
    }

    public Optional<Boolean> getBoolean() {
        return Optional.ofNullable(bool);
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.CONSTANT;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Constant that = (Constant) o;
        return Objects.equals(number, that.number) && Objects.equals(bool, that.bool);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, bool);
    }

    @Override
    public String toString() {
        return isNumber() ? number.toString() : bool.toString();
    }
}
