package org.axioms.utils;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 精确有理数，作为表达式常量和求解器数值结果的载体。
 * 始终保持约分后的规范形式，分母恒为正。
 * 此类是不可变的。
 */
public final class Rational {
    private static final Logger logger = LoggerFactory.getLogger(Rational.class);
    private static final ConcurrentHashMap<List<BigInteger>, Rational> CACHE = new ConcurrentHashMap<>(256);

    private static final BigInteger BIG_INT_ZERO = BigInteger.ZERO;
    private static final BigInteger BIG_INT_ONE = BigInteger.ONE;

    private final BigInteger numerator;
    private final BigInteger denominator;

    private volatile int hash;

    // 常用常量
    public static final Rational ZERO = new Rational(BIG_INT_ZERO, BIG_INT_ONE); // 0/1
    public static final Rational ONE = new Rational(BIG_INT_ONE, BIG_INT_ONE);   // 1/1

    static {
        CACHE.put(ZERO.getCacheKey(), ZERO);
        CACHE.put(ONE.getCacheKey(), ONE);
        for (int i = -16; i <= 16; i++) {
            if (i != 0 && i != 1) {
                Rational r = new Rational(BigInteger.valueOf(i), BIG_INT_ONE);
                CACHE.put(r.getCacheKey(), r);
            }
        }
    }

    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    // ========== 工厂方法 ==========

    public static Rational valueOf(long numerator) {
        if (numerator == 0L) {
            return ZERO;
        }
        if (numerator == 1L) {
            return ONE;
        }
        return valueOf(BigInteger.valueOf(numerator), BIG_INT_ONE);
    }

    public static Rational valueOf(BigInteger numerator) {
        return valueOf(numerator, BIG_INT_ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "Rational-valueOf: numerator 不能为 null");
        Objects.requireNonNull(denominator, "Rational-valueOf: denominator 不能为 null");

        if (denominator.signum() == 0) {
            logger.error("Rational-valueOf: 分母为 0 ({} / 0)", numerator);
            throw new ArithmeticException("Rational-valueOf: 分母不能为 0");
        }
        if (numerator.signum() == 0) {
            return ZERO;
        }

        // 分母总是正数
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }

        BigInteger commonDivisor = numerator.gcd(denominator);
        if (!commonDivisor.equals(BIG_INT_ONE)) {
            numerator = numerator.divide(commonDivisor);
            denominator = denominator.divide(commonDivisor);
        }

        List<BigInteger> key = List.of(numerator, denominator);
        Rational cached = CACHE.get(key);
        if (cached != null) {
            return cached;
        }
        Rational result = new Rational(numerator, denominator);
        if (numerator.bitLength() + denominator.bitLength() < 64) {
            CACHE.put(key, result);
        }
        return result;
    }

    /**
     * 解析 "42"、"-3/4" 或 "1.25" 形式的字面量。
     * @param s 字面量文本
     * @return 对应的有理数
     * @throws NumberFormatException 文本不是合法数字
     */
    public static Rational valueOf(String s) {
        Objects.requireNonNull(s, "Rational-valueOf: 字面量不能为 null");
        String text = s.trim();
        try {
            int slash = text.indexOf('/');
            if (slash >= 0) {
                BigInteger num = new BigInteger(text.substring(0, slash).trim());
                BigInteger den = new BigInteger(text.substring(slash + 1).trim());
                return valueOf(num, den);
            }
            if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
                BigDecimal decimal = new BigDecimal(text);
                BigInteger unscaled = decimal.unscaledValue();
                int scale = decimal.scale();
                if (scale <= 0) {
                    return valueOf(unscaled.multiply(BigInteger.TEN.pow(-scale)));
                }
                return valueOf(unscaled, BigInteger.TEN.pow(scale));
            }
            return valueOf(new BigInteger(text));
        } catch (NumberFormatException | ArithmeticException e) {
            throw new NumberFormatException("无效数字格式: " + s);
        }
    }

    // ========== 工具方法 ==========

    public BigInteger getNumerator() {
        return numerator;
    }

    public BigInteger getDenominator() {
        return denominator;
    }

    /**
     *  判断该rational是否是整数
     */
    public boolean isInteger() {
        return denominator.equals(BIG_INT_ONE);
    }

    /**
     * 转换为 Z3 数值常量。整数在整数排序下生成 IntNum，其余生成 RatNum。
     * @param ctx Z3 Context 实例
     * @param asInteger 是否以整数排序表示（仅对整数值有效）
     * @return Z3 数值表达式
     */
    public ArithExpr toZ3(Context ctx, boolean asInteger) {
        if (asInteger && isInteger()) {
            return ctx.mkInt(numerator.toString());
        }
        return ctx.mkReal(this.toString());
    }

    // ========== 对象基础方法 ==========

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rational that)) {
            return false;
        }
        return this.numerator.equals(that.numerator) && this.denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(numerator, denominator);
            if (h == 0) {
                h = 1;
            }
            hash = h;
        }
        return h;
    }

    private List<BigInteger> getCacheKey() {
        return List.of(this.numerator, this.denominator);
    }

    @Override
    public String toString() {
        if (isInteger()) {
            return numerator.toString();
        }
        return numerator + "/" + denominator;
    }
}
