package org.axioms.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.Sort;
import com.microsoft.z3.UninterpretedSort;
import lombok.Getter;
import org.axioms.structures.OperationDecl;
import org.axioms.structures.StructureRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 负责会话内的 Z3 符号：未解释函数声明、具名常量（特殊元素与自由变量）以及类型名到排序的映射。
 * 同一 (名称, 元数) 在一个会话中始终对应同一个 FuncDecl，同一名称始终对应同一个常量。
 * 内置类型之外的类型名（类型参数、载体集合）各自对应一个未解释排序，
 * 因此结构上的推理不会借用整数或实数的性质。
 * 非线程安全，随会话使用。
 * @author Ayalyt
 */
public class Z3SymbolManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3SymbolManager.class);

    @Getter
    private final Context ctx;
    @Getter
    private final StructureRegistry registry;
    // 会话独占，不会有并发访问
    private final Map<OperationKey, FuncDecl> uninterpretedFunctions = new HashMap<>();
    private final Map<String, Expr> constants = new HashMap<>();
    private final Map<String, Expr> freeVariables = new HashMap<>();
    private final Map<String, Sort> carriers = new HashMap<>();

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     * @param registry 结构注册表，用于为未解释函数确定签名。
     */
    public Z3SymbolManager(Context ctx, StructureRegistry registry) {
        this.ctx = Objects.requireNonNull(ctx, "Z3SymbolManager-构造函数: ctx 不能为 null");
        this.registry = Objects.requireNonNull(registry, "Z3SymbolManager-构造函数: registry 不能为 null");
    }

    /**
     * 将类型名映射到 Z3 排序。ℤ/Int/ℕ/Nat → Int，ℝ/Real/ℚ → Real，Bool → Bool，
     * 其余名字（类型参数、载体集合名）映射为同名的未解释排序，首次使用时声明。
     * @param typeName 类型名，null 表示未标注类型，按 Int 处理
     * @return 对应排序
     */
    public Sort sortFor(String typeName) {
        if (typeName == null) {
            return ctx.getIntSort();
        }
        Sort builtin = builtinSort(typeName.trim());
        if (builtin != null) {
            return builtin;
        }
        return carriers.computeIfAbsent(typeName.trim(), name -> {
            logger.debug("声明未解释排序 {}", name);
            return ctx.mkUninterpretedSort(name);
        });
    }

    public static boolean isNatural(String typeName) {
        return typeName != null && ("ℕ".equals(typeName.trim()) || "Nat".equals(typeName.trim()));
    }

    public static boolean isBuiltinType(String typeName) {
        return typeName != null && switch (typeName.trim()) {
            case "ℤ", "Int", "Integer", "ℕ", "Nat", "ℝ", "Real", "ℚ", "Rational", "Bool", "Boolean", "𝔹" -> true;
            default -> false;
        };
    }

    /**
     * 令载体名 alias 与 carrier 共用同一个排序，用于 extends/over 引用中的类型实参，
     * 例如 Monoid(M) extends Semigroup(M) 时 M 与 Semigroup 的 S 是同一载体。
     * @return 是否建立了别名；alias 为内置类型或已有排序时不做修改
     */
    public boolean bindCarrier(String alias, String carrier) {
        Objects.requireNonNull(alias, "Z3SymbolManager-bindCarrier: alias 不能为 null");
        Objects.requireNonNull(carrier, "Z3SymbolManager-bindCarrier: carrier 不能为 null");
        String name = alias.trim();
        if (name.equals(carrier.trim()) || isBuiltinType(name) || carriers.containsKey(name)) {
            logger.debug("载体 {} 已有排序，不绑定到 {}", name, carrier);
            return false;
        }
        carriers.put(name, sortFor(carrier));
        logger.debug("载体 {} 绑定到 {} 的排序", name, carrier);
        return true;
    }

    public static boolean isUninterpreted(Sort sort) {
        return sort instanceof UninterpretedSort;
    }

    /**
     * 获取（或创建并缓存）具名常量。
     * @param name 常量名
     * @param sort 首次创建时使用的排序
     * @return Z3 常量
     */
    public Expr constant(String name, Sort sort) {
        return constants.computeIfAbsent(name, n -> {
            logger.debug("创建 Z3 常量: {} : {}", n, sort);
            return ctx.mkConst(n, sort);
        });
    }

    public Optional<Expr> findConstant(String name) {
        return Optional.ofNullable(constants.get(name));
    }

    /**
     * 获取（或创建）查询中出现的自由变量对应的 Int 常量。不计入特殊元素。
     */
    public Expr freeVariable(String name) {
        return freeVariables.computeIfAbsent(name, n -> {
            logger.debug("自由变量 {} 作为 Int 常量处理", n);
            return ctx.mkConst(n, ctx.getIntSort());
        });
    }

    public Optional<Expr> findFreeVariable(String name) {
        return Optional.ofNullable(freeVariables.get(name));
    }

    /**
     * 应用未解释函数。函数在首次使用时声明：若注册表中有元数匹配的签名则按签名定型，
     * 否则形参取实参的排序，结果排序见 {@link #defaultRange}。
     * Int 参数传给 Real 形参时自动提升。
     * @param name 运算名
     * @param args 已翻译的参数
     * @return 函数应用表达式
     * @throws TranslationException 参数排序与声明不兼容
     */
    public Expr applyUninterpreted(String name, List<Expr> args, boolean predicate) {
        FuncDecl decl = uninterpretedFunctions.computeIfAbsent(OperationKey.of(name, args.size()),
                key -> declare(key, args, predicate));
        Sort[] domain = decl.getDomain();
        Expr[] actual = new Expr[args.size()];
        for (int i = 0; i < actual.length; i++) {
            Expr arg = args.get(i);
            if (arg.isInt() && domain[i].equals(ctx.getRealSort())) {
                arg = ctx.mkInt2Real((IntExpr) arg);
            } else if (!arg.getSort().equals(domain[i])) {
                throw TranslationException.unsupported("未解释函数 " + name + " 的第 " + (i + 1)
                        + " 个参数排序为 " + arg.getSort() + "，期望 " + domain[i]);
            }
            actual[i] = arg;
        }
        return ctx.mkApp(decl, actual);
    }

    public Expr applyUninterpreted(String name, List<Expr> args) {
        return applyUninterpreted(name, args, false);
    }

    /**
     * 查找注册表中元数匹配的运算签名。
     */
    public Optional<OperationDecl> signatureOf(String name, int arity) {
        return registry.getOperationSignature(name).filter(decl -> decl.getArity() == arity);
    }

    /**
     * 已声明的未解释函数（派生运算的头部同样在此登记）。
     */
    public Optional<FuncDecl> findDeclared(String name, int arity) {
        return Optional.ofNullable(uninterpretedFunctions.get(OperationKey.of(name, arity)));
    }

    public int declaredOperationCount() {
        return uninterpretedFunctions.size();
    }

    public void clear() {
        uninterpretedFunctions.clear();
        constants.clear();
        freeVariables.clear();
        carriers.clear();
    }

    private FuncDecl declare(OperationKey key, List<Expr> args, boolean predicate) {
        Optional<OperationDecl> signature = signatureOf(key.getName(), key.getArity());
        Sort[] domain = new Sort[key.getArity()];
        Sort range;
        if (signature.isPresent()) {
            List<String> parameterTypes = signature.get().getParameterTypes();
            for (int i = 0; i < domain.length; i++) {
                domain[i] = sortFor(parameterTypes.get(i));
            }
            range = sortFor(signature.get().getResultType());
            logger.debug("声明未解释函数 {}，签名: {}", key, signature.get());
        } else {
            for (int i = 0; i < domain.length; i++) {
                domain[i] = args.get(i).getSort();
            }
            range = predicate ? ctx.getBoolSort() : defaultRange(domain);
            logger.warn("运算 {} 没有签名，按实参排序声明为未解释函数，结果排序 {}", key, range);
        }
        return ctx.mkFuncDecl(key.getName(), domain, range);
    }

    /**
     * 无签名时的结果排序：首个未解释排序的参数决定结果排序，否则为 Int。
     */
    private Sort defaultRange(Sort[] domain) {
        for (Sort sort : domain) {
            if (isUninterpreted(sort)) {
                return sort;
            }
        }
        return ctx.getIntSort();
    }

    private Sort builtinSort(String typeName) {
        return switch (typeName) {
            case "ℤ", "Int", "Integer", "ℕ", "Nat" -> ctx.getIntSort();
            case "ℝ", "Real", "ℚ", "Rational" -> ctx.getRealSort();
            case "Bool", "Boolean", "𝔹" -> ctx.getBoolSort();
            default -> null;
        };
    }
}
