package com.abt.mixfix.examples;

import com.abt.mixfix.term.Binder;
import com.abt.mixfix.term.Node;
import com.abt.mixfix.term.Term;

import lombok.RequiredArgsConstructor;

/**
 * Rewrites formulas of {@link LogicLanguage} bottom-up:
 * <ul>
 *   <li>{@code m = n} with alpha-equal sides becomes {@code 1};</li>
 *   <li>a quantifier whose variable does not occur in its body is dropped;</li>
 *   <li>{@code 1} is a unit for {@code *}.</li>
 * </ul>
 */
@RequiredArgsConstructor
public class FormulaSimplifier {
    private final LogicLanguage logic;

    public Term simplify(Term term) {
        if (!(term instanceof Node node)) {
            return term;
        }
        ArithmeticLanguage arithmetic = logic.getArithmetic();

        if (node.is(logic.getEq())) {
            Term m = node.get("m");
            Term n = node.get("n");
            return m.alphaEquals(n) ? arithmetic.one() : logic.eq(simplify(m), simplify(n));
        }
        if (node.is(logic.getForall()) || node.is(logic.getExists())) {
            Binder.Opened opened = node.getBinder("xp").open();
            Term body = simplify(opened.getBody());
            if (!body.freeNames().contains(opened.getName())) {
                return body;
            }
            return node.getKind().make(Binder.of(opened.getName(), body));
        }
        if (node.is(arithmetic.getTimes())) {
            Term p = simplify(node.get("p"));
            Term q = simplify(node.get("q"));
            if (isOne(p)) {
                return q;
            }
            if (isOne(q)) {
                return p;
            }
            return arithmetic.times(p, q);
        }
        if (node.is(arithmetic.getPlus()) || node.is(arithmetic.getPow())) {
            return node.getKind().make(simplify(node.get("p")), simplify(node.get("q")));
        }
        return node;
    }

    private boolean isOne(Term term) {
        return term instanceof Node node && node.is(logic.getArithmetic().getTop());
    }
}
