package com.abt.mixfix.cli.output;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abt.mixfix.cli.model.NotationResult;
import com.abt.mixfix.cli.model.ValidatedNotationOptions;
import com.abt.mixfix.exception.AmbiguousParseException;
import com.abt.mixfix.term.Term;

/**
 * Responsible only for printing CLI output for the notation command.
 * No validation, no execution.
 */
public class NotationResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(NotationResultsPrinter.class);

    public void printBanner(ValidatedNotationOptions v) {
        log.info("=================================================");
        log.info("Mixfix Notation");
        log.info("=================================================");
        log.info("Language: {}", v.getLanguage());
        log.info("Mode: {}", v.getMode());
        if (v.getExpression() != null) {
            log.info("Input: {}", v.getExpression());
        }
        log.info("=================================================");
    }

    public void printSuccess(NotationResult result) {
        if (result.getGrammar() != null) {
            log.info("Grammar:");
            log.info("{}", result.getGrammar().stripTrailing());
        }
        if (result.getTerm() == null) {
            return;
        }

        log.info("Term:      {}", result.getTerm());
        log.info("Canonical: {}", result.getCanonical());
        log.info("Rendered:  {}", result.getRendered());

        List<String> reductions = result.getReductions();
        for (int i = 0; i < reductions.size(); i++) {
            log.info("  -> [{}] {}", i + 1, reductions.get(i));
        }
        if (result.isNormalForm()) {
            log.info("  (normal form)");
        }
    }

    public void printNoParse(String message) {
        log.error("{}", message);
    }

    public void printAmbiguity(AmbiguousParseException e) {
        log.error("Ambiguous input '{}': {} candidate(s)", e.getInput(), e.getCandidates().size());
        for (Term candidate : e.getCandidates()) {
            log.error("  {}  =>  {}", candidate, candidate.render());
        }
    }
}
