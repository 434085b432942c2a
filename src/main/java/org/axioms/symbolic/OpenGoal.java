package org.axioms.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.List;

/**
 * 去掉前缀全称量词后的待证目标：premises ⟹ conclusion，
 * 其中原约束变量已替换为可在模型中求值的常量。
 */
@Getter
public final class OpenGoal {

    /** (显示名, Z3 常量)，按出现顺序 */
    private final List<Pair<String, Expr>> witnesses;
    private final List<BoolExpr> premises;
    private final BoolExpr conclusion;

    OpenGoal(List<Pair<String, Expr>> witnesses, List<BoolExpr> premises, BoolExpr conclusion) {
        this.witnesses = List.copyOf(witnesses);
        this.premises = List.copyOf(premises);
        this.conclusion = conclusion;
    }

    /**
     * @return premises ∧ ¬conclusion，可满足即说明目标不成立
     */
    public BoolExpr negation(Context ctx) {
        List<BoolExpr> conjuncts = new ArrayList<>(premises);
        conjuncts.add(ctx.mkNot(conclusion));
        return conjuncts.size() == 1 ? conjuncts.get(0) : ctx.mkAnd(conjuncts.toArray(new BoolExpr[0]));
    }
}
