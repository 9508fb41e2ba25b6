package com.abt.mixfix.syntax;

import java.util.List;

import com.abt.mixfix.parser.Token;
import com.abt.mixfix.term.Term;

/**
 * Builds a term from one derivation step: the already-built terms for each
 * {@code term} operand and the tokens matched by terminals, both in order.
 *
 * Throwing {@link com.abt.mixfix.exception.InvalidConstructionException}
 * rejects the derivation.
 */
@FunctionalInterface
public interface ProductionTransformer {
    Term transform(List<Term> operands, List<Token> tokens);
}
