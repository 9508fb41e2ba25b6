package com.abt.mixfix.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abt.mixfix.cli.model.NotationResult;
import com.abt.mixfix.cli.model.ValidatedNotationOptions;
import com.abt.mixfix.examples.ArithmeticLanguage;
import com.abt.mixfix.examples.LambdaLanguage;
import com.abt.mixfix.examples.LambdaReducer;
import com.abt.mixfix.examples.LogicLanguage;
import com.abt.mixfix.syntax.Syntax;
import com.abt.mixfix.term.Term;

/**
 * Declares the selected example language in a fresh {@link Syntax}, parses
 * the expression and collects what should be shown.
 */
public class NotationRunner {

    private static final Logger log = LoggerFactory.getLogger(NotationRunner.class);

    /**
     * @throws com.abt.mixfix.exception.NoParseException if the expression does not parse
     * @throws com.abt.mixfix.exception.AmbiguousParseException if it parses more than one way
     */
    public NotationResult run(ValidatedNotationOptions options) {
        Syntax syntax = new Syntax();
        LambdaReducer reducer = null;
        switch (options.getLanguage()) {
            case ARITHMETIC -> new ArithmeticLanguage(syntax);
            case LOGIC -> new LogicLanguage(new ArithmeticLanguage(syntax));
            case LAMBDA -> reducer = new LambdaReducer(new LambdaLanguage(syntax));
        }
        log.debug("Declared {} kind(s) for {}", syntax.getKinds().size(), options.getLanguage());

        NotationResult.NotationResultBuilder result = NotationResult.builder()
                .language(options.getLanguage())
                .input(options.getExpression());
        if (options.isPrintGrammar()) {
            result.grammar(syntax.describeGrammar());
        }
        if (options.getExpression() == null) {
            return result.build();
        }

        Term term = syntax.parse(options.getExpression());
        result.term(term)
                .canonical(term.render())
                .rendered(display(term, options));

        Term current = term;
        for (int i = 0; i < options.getReduceSteps(); i++) {
            try {
                current = reducer.step(current);
            } catch (LambdaReducer.StuckException e) {
                result.normalForm(true);
                break;
            }
            result.reduction(display(current, options));
        }
        return result.build();
    }

    private static String display(Term term, ValidatedNotationOptions options) {
        return (options.isSimplifyNames() ? term.simplifyNames() : term).render(options.getMode());
    }
}
