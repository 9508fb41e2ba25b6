package com.abt.mixfix.parser;

import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

import lombok.Value;

/**
 * One complete derivation of a token span by a single production.
 *
 * Trees are compared structurally, which is what deduplicating a parse
 * forest needs.
 */
@Value
public class DerivationTree implements Derivation {
    Production production;
    ImmutableList<Derivation> children;

    @Override
    public String toString() {
        return production.getLabel() + children.stream()
                .map(Object::toString)
                .collect(Collectors.joining(" ", "[", "]"));
    }
}
