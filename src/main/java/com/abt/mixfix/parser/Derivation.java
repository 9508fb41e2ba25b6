package com.abt.mixfix.parser;

/**
 * A child of a derivation tree: either a matched token or a sub-derivation.
 */
public sealed interface Derivation permits Token, DerivationTree {
}
