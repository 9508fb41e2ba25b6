package com.abt.mixfix.examples;

import com.abt.mixfix.syntax.Kind;
import com.abt.mixfix.syntax.KindDeclaration;
import com.abt.mixfix.syntax.Mode;
import com.abt.mixfix.syntax.Syntax;
import com.abt.mixfix.term.Node;
import com.abt.mixfix.term.Term;

import lombok.Getter;

/**
 * Simple types over a single base type:
 * <pre>
 *   t ::= 1 | t * t | t + t | t -> t
 * </pre>
 * All three operators are right associative, {@code *} takes precedence over
 * {@code +}, and both take precedence over {@code ->} on its left only. On
 * the right of an arrow a product or sum keeps its brackets.
 */
@Getter
public class ArithmeticLanguage {
    public static final Mode PRETTY = Mode.of("pretty");

    private final Syntax syntax;
    private final Kind top;
    private final Kind times;
    private final Kind plus;
    private final Kind pow;

    public ArithmeticLanguage(Syntax syntax) {
        this.syntax = syntax;

        top = syntax.declare(KindDeclaration.builder()
                .name("Top")
                .literal("s", "1")
                .build());
        syntax.declareTop(top.getEntry(), top.exit("s"));

        times = syntax.declare(KindDeclaration.builder()
                .name("Times")
                .term("p")
                .literal("times", " * ")
                .term("q")
                .build());
        syntax.declareGreaterOrEqual(times.getEntry(), times.exit("times"));

        plus = syntax.declare(KindDeclaration.builder()
                .name("Plus")
                .term("p")
                .literal("plus", " + ")
                .term("q")
                .build());
        syntax.declareGreaterOrEqual(plus.getEntry(), plus.exit("plus"))
                .declareGreaterOrEqual(times.getEntry(), plus.getEntry())
                .declareGreaterOrEqual(times.exit("q"), plus.exit("p"))
                .declareGreaterOrEqual(times.exit("q"), plus.exit("q"));

        pow = syntax.declare(KindDeclaration.builder()
                .name("Pow")
                .term("p")
                .literal("to", " -> ")
                .term("q")
                .build());
        // products and sums also bind tighter than -> on its left, by transitivity
        syntax.declareGreaterOrEqual(pow.getEntry(), pow.exit("to"))
                .declareGreaterOrEqual(plus.getEntry(), pow.getEntry())
                .declareGreaterOrEqual(plus.exit("q"), pow.exit("p"));
    }

    public Node one() {
        return top.make();
    }

    public Node times(Term p, Term q) {
        return times.make(p, q);
    }

    public Node plus(Term p, Term q) {
        return plus.make(p, q);
    }

    public Node pow(Term p, Term q) {
        return pow.make(p, q);
    }
}
