package com.abt.mixfix.examples;

import java.util.function.Function;

import com.abt.mixfix.syntax.Kind;
import com.abt.mixfix.syntax.KindDeclaration;
import com.abt.mixfix.syntax.Mode;
import com.abt.mixfix.syntax.Spelling;
import com.abt.mixfix.syntax.Syntax;
import com.abt.mixfix.term.Binder;
import com.abt.mixfix.term.Node;
import com.abt.mixfix.term.Term;
import com.abt.mixfix.term.Var;

import lombok.Getter;

/**
 * Untyped lambda calculus. Abstractions parse as {@code \x. m} and
 * pretty-print as {@code λx. m}; application is juxtaposition, left
 * associative, and binds tighter than abstraction.
 */
@Getter
public class LambdaLanguage {
    public static final Mode PRETTY = Mode.of("pretty");

    private final Syntax syntax;
    private final Kind lam;
    private final Kind app;

    public LambdaLanguage(Syntax syntax) {
        this.syntax = syntax;

        lam = syntax.declare(KindDeclaration.builder()
                .name("Lam")
                .literal("lam", Spelling.of("\\").in(PRETTY, "λ"))
                .binder("m")
                .build());
        app = syntax.declare(KindDeclaration.builder()
                .name("App")
                .term("m")
                .literal("app", " ")
                .term("n")
                .build());
        syntax.declareGreaterOrEqual(app.exit("n"), app.exit("m"))
                .declareGreaterOrEqual(app.exit("n"), lam.exit("m"));
    }

    public Node lam(String tag, Function<Var, Term> body) {
        return lam.make(Binder.create(tag, body));
    }

    public Node app(Term m, Term n) {
        return app.make(m, n);
    }
}
