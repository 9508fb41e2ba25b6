package com.abt.mixfix.examples;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abt.mixfix.exception.MixfixException;
import com.abt.mixfix.term.Binder;
import com.abt.mixfix.term.Node;
import com.abt.mixfix.term.Term;

import lombok.RequiredArgsConstructor;

/**
 * Leftmost-outermost single-step reduction for {@link LambdaLanguage},
 * reducing under abstractions.
 */
@RequiredArgsConstructor
public class LambdaReducer {
    private static final Logger log = LoggerFactory.getLogger(LambdaReducer.class);

    private final LambdaLanguage language;

    /**
     * Raised when a term has no redex.
     */
    public static class StuckException extends MixfixException {

        private static final long serialVersionUID = 1L;

        public StuckException(Term term) {
            super("No reduction step applies to " + term);
        }
    }

    /**
     * Performs one beta step.
     *
     * @throws StuckException if {@code term} is in normal form
     */
    public Term step(Term term) {
        if (term instanceof Node node && node.is(language.getLam())) {
            Binder.Opened opened = node.getBinder("m").open();
            return language.getLam().make(Binder.of(opened.getName(), step(opened.getBody())));
        }
        if (term instanceof Node node && node.is(language.getApp())) {
            Term function = node.get("m");
            Term argument = node.get("n");
            if (function instanceof Node lam && lam.is(language.getLam())) {
                Binder.Opened opened = lam.getBinder("m").open();
                log.trace("Contracting redex {}", node);
                return opened.getBody().subst(Map.of(opened.getName(), argument));
            }
            try {
                return language.app(step(function), argument);
            } catch (StuckException e) {
                return language.app(function, step(argument));
            }
        }
        throw new StuckException(term);
    }

    /**
     * Steps until a normal form is reached or {@code maxSteps} steps were
     * taken, whichever comes first.
     */
    public Term normalize(Term term, int maxSteps) {
        Term current = term;
        for (int i = 0; i < maxSteps; i++) {
            try {
                current = step(current);
            } catch (StuckException e) {
                log.debug("Normal form after {} step(s)", i);
                return current;
            }
        }
        log.debug("Gave up after {} step(s)", maxSteps);
        return current;
    }
}
