package com.abt.mixfix.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.abt.mixfix.exception.InvalidConstructionException;
import com.abt.mixfix.parser.Derivation;
import com.abt.mixfix.parser.DerivationTree;
import com.abt.mixfix.parser.Token;
import com.abt.mixfix.term.Term;

import lombok.RequiredArgsConstructor;

/**
 * Turns a derivation tree into a term, bottom-up, using the transformer
 * registered for each production label.
 */
@RequiredArgsConstructor
class TermBuilder {
    private final Map<String, ProductionTransformer> transformers;

    Term build(DerivationTree tree) {
        List<Term> operands = new ArrayList<>();
        List<Token> tokens = new ArrayList<>();
        for (Derivation child : tree.getChildren()) {
            if (child instanceof DerivationTree subtree) {
                operands.add(build(subtree));
            } else {
                tokens.add((Token) child);
            }
        }

        String label = tree.getProduction().getLabel();
        ProductionTransformer transformer = transformers.get(label);
        if (transformer == null) {
            throw new InvalidConstructionException("No transformer registered for " + label);
        }
        return transformer.transform(operands, tokens);
    }
}
