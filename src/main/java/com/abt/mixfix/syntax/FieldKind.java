package com.abt.mixfix.syntax;

/**
 * What a declared field holds.
 */
public enum FieldKind {
    /** Any term except a bare binder. */
    TERM,
    /** A {@link com.abt.mixfix.term.Binder}. */
    BINDER,
    /** Fixed text; carries no data. */
    LITERAL
}
