package org.axioms.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;

import java.util.List;

/**
 * 将一个运算应用翻译为 Z3 表达式的规则。参数已翻译完毕。
 */
@FunctionalInterface
public interface OperationTranslator {

    /**
     * @param ctx Z3 Context 实例
     * @param args 已翻译的参数
     * @return 对应的 Z3 表达式
     * @throws TranslationException 参数的排序不被该运算支持
     */
    Expr translate(Context ctx, List<Expr> args);
}
