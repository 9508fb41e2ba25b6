package com.abt.mixfix.examples;

import java.util.function.Function;

import com.abt.mixfix.syntax.Kind;
import com.abt.mixfix.syntax.KindDeclaration;
import com.abt.mixfix.syntax.Spelling;
import com.abt.mixfix.syntax.Syntax;
import com.abt.mixfix.term.Binder;
import com.abt.mixfix.term.Node;
import com.abt.mixfix.term.Term;
import com.abt.mixfix.term.Var;

import lombok.Getter;

/**
 * First-order formulas layered over {@link ArithmeticLanguage}: quantifiers
 * and equality, declared in the same syntax so that formulas can be
 * combined with {@code *}.
 *
 * Quantifiers parse as {@code forall x. p} and pretty-print as
 * {@code ∀ x. p}. Their bodies extend as far right as possible; an equation
 * inside a product needs brackets.
 */
@Getter
public class LogicLanguage {
    private final ArithmeticLanguage arithmetic;
    private final Kind forall;
    private final Kind exists;
    private final Kind eq;

    public LogicLanguage(ArithmeticLanguage arithmetic) {
        this.arithmetic = arithmetic;
        Syntax syntax = arithmetic.getSyntax();

        forall = syntax.declare(KindDeclaration.builder()
                .name("Forall")
                .literal("forall", Spelling.of("forall ").in(ArithmeticLanguage.PRETTY, "∀ "))
                .binder("xp")
                .build());
        exists = syntax.declare(KindDeclaration.builder()
                .name("Exists")
                .literal("exists", Spelling.of("exists ").in(ArithmeticLanguage.PRETTY, "∃ "))
                .binder("xp")
                .build());
        syntax.declareGreaterOrEqual(forall.exit("xp"), exists.exit("xp"))
                .declareGreaterOrEqual(exists.exit("xp"), forall.exit("xp"));

        eq = syntax.declare(KindDeclaration.builder()
                .name("Eq")
                .term("m")
                .literal("eq", " = ")
                .term("n")
                .build());
        syntax.declareGreaterOrEqual(eq.exit("n"), exists.exit("xp"))
                .declareGreaterOrEqual(arithmetic.getTimes().exit("q"), exists.exit("xp"));
    }

    public Syntax getSyntax() {
        return arithmetic.getSyntax();
    }

    public Node forall(String tag, Function<Var, Term> body) {
        return forall.make(Binder.create(tag, body));
    }

    public Node exists(String tag, Function<Var, Term> body) {
        return exists.make(Binder.create(tag, body));
    }

    public Node eq(Term m, Term n) {
        return eq.make(m, n);
    }
}
