package org.axioms.symbolic;

import com.microsoft.z3.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * (运算名, 元数) → 翻译器 的注册表。
 * 未注册的名字回退为未解释函数，由会话的 {@link Z3SymbolManager} 为每个键只声明一次。
 * 注册表本身可在会话之间共享：额外的翻译器应在首次使用前注册。
 */
public class OperationTranslatorRegistry {

    private static final Logger logger = LoggerFactory.getLogger(OperationTranslatorRegistry.class);

    private final Map<OperationKey, OperationTranslator> translators = new ConcurrentHashMap<>();
    private final Map<OperationKey, Theory> theories = new ConcurrentHashMap<>();
    // 曾以未解释函数形式使用过的键，之后不允许再注册原生翻译器
    private final Set<OperationKey> uninterpretedKeys = ConcurrentHashMap.newKeySet();

    private static final Set<String> EQUALITY_NAMES = Set.of("equals", "=", "neq", "≠");

    /**
     * @return 仅包含算术、比较与逻辑原生翻译器的注册表
     */
    public static OperationTranslatorRegistry withDefaults() {
        OperationTranslatorRegistry registry = new OperationTranslatorRegistry();
        ArithmeticTranslators.registerInto(registry);
        ComparisonTranslators.registerInto(registry);
        BooleanTranslators.registerInto(registry);
        logger.debug("默认翻译器注册完成，共 {} 个键", registry.translators.size());
        return registry;
    }

    /**
     * 注册一个翻译器。
     * @param name 运算名
     * @param arity 元数，或 {@link OperationKey#ANY_ARITY}
     * @param theory 所属理论
     * @param translator 翻译规则
     * @throws IllegalStateException 该键已有翻译器，或该名字已作为未解释函数使用过
     */
    public void register(String name, int arity, Theory theory, OperationTranslator translator) {
        OperationKey key = OperationKey.of(name, arity);
        Objects.requireNonNull(theory, "OperationTranslatorRegistry-register: theory 不能为 null");
        Objects.requireNonNull(translator, "OperationTranslatorRegistry-register: translator 不能为 null");
        if (uninterpretedKeys.stream().anyMatch(k -> k.getName().equals(name))) {
            logger.error("运算 {} 已作为未解释函数使用，不能再注册翻译器", name);
            throw new IllegalStateException("运算 " + name + " 已作为未解释函数使用，不支持提升为原生翻译器");
        }
        if (translators.putIfAbsent(key, translator) != null) {
            logger.error("运算 {} 已注册翻译器", key);
            throw new IllegalStateException("运算 " + key + " 已注册翻译器");
        }
        theories.put(key, theory);
    }

    /**
     * 查找翻译器：先精确匹配元数，再匹配可变元数。
     */
    public Optional<OperationTranslator> lookup(String name, int arity) {
        OperationTranslator exact = translators.get(OperationKey.of(name, arity));
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(translators.get(OperationKey.variadic(name)));
    }

    public boolean hasNative(String name) {
        return translators.keySet().stream().anyMatch(k -> k.getName().equals(name));
    }

    public boolean isNative(String name, int arity) {
        return lookup(name, arity).isPresent();
    }

    public Set<Integer> aritiesOf(String name) {
        Set<Integer> arities = new TreeSet<>();
        translators.keySet().stream().filter(k -> k.getName().equals(name)).forEach(k -> arities.add(k.getArity()));
        return arities;
    }

    /**
     * @return 所有原生翻译器的键及其理论，按键排序
     */
    public Map<OperationKey, Theory> nativeOperations() {
        return Collections.unmodifiableMap(new TreeMap<>(theories));
    }

    public boolean isUninterpreted(OperationKey key) {
        return uninterpretedKeys.contains(key);
    }

    public Optional<Theory> theoryOf(String name, int arity) {
        Theory exact = theories.get(OperationKey.of(name, arity));
        return Optional.ofNullable(exact != null ? exact : theories.get(OperationKey.variadic(name)));
    }

    /**
     * 翻译一次运算应用：有原生翻译器则使用之，否则回退为未解释函数。
     * 参数含未解释排序（抽象载体）时，算术与比较运算同样回退为未解释函数，
     * 只有等式保持原生语义。
     * @param name 运算名
     * @param args 已翻译的参数
     * @param symbols 当前会话的符号管理器
     * @return Z3 表达式
     * @throws TranslationException ARITY_MISMATCH，如果该名字有原生翻译器但元数不匹配
     */
    public Expr translate(String name, List<Expr> args, Z3SymbolManager symbols) {
        Optional<OperationTranslator> translator = lookup(name, args.size());
        if (translator.isPresent()) {
            Theory theory = theoryOf(name, args.size()).orElse(Theory.CUSTOM);
            if (!isAbstractApplication(name, theory, args)) {
                return translator.get().translate(symbols.getCtx(), args);
            }
            logger.debug("运算 {} 作用于抽象载体，按未解释函数处理", name);
            uninterpretedKeys.add(OperationKey.of(name, args.size()));
            return symbols.applyUninterpreted(name, args, theory == Theory.COMPARISON);
        }
        if (hasNative(name) && !hasAbstractArgument(args)) {
            logger.error("运算 {} 不支持 {} 个参数", name, args.size());
            throw TranslationException.arityMismatch(name, args.size(), aritiesOf(name));
        }
        uninterpretedKeys.add(OperationKey.of(name, args.size()));
        return symbols.applyUninterpreted(name, args);
    }

    private static boolean isAbstractApplication(String name, Theory theory, List<Expr> args) {
        if (theory != Theory.ARITHMETIC && theory != Theory.COMPARISON) {
            return false;
        }
        return !EQUALITY_NAMES.contains(name) && hasAbstractArgument(args);
    }

    private static boolean hasAbstractArgument(List<Expr> args) {
        return args.stream().anyMatch(arg -> Z3SymbolManager.isUninterpreted(arg.getSort()));
    }
}
