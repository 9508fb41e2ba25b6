package com.abt.mixfix.parser;

import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

import lombok.NonNull;
import lombok.Value;

/**
 * One alternative of the {@code term} nonterminal. The label selects the
 * transformer that turns a matching derivation into a term.
 */
@Value
public class Production {
    @NonNull
    String label;
    @NonNull
    ImmutableList<Symbol> symbols;

    /**
     * A production consisting of a single {@code term} would derive every
     * term from itself.
     */
    public boolean isUnit() {
        return symbols.size() == 1 && symbols.get(0).isNonterminal();
    }

    @Override
    public String toString() {
        return symbols.stream().map(Symbol::toString).collect(Collectors.joining(" ")) + " -> " + label;
    }
}
