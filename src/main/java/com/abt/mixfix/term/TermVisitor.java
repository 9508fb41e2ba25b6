package com.abt.mixfix.term;

/**
 * Visitor pattern interface for traversing terms.
 */
public interface TermVisitor<R> {
    R visit(Var var);
    R visit(Binder binder);
    R visit(Node node);
    R visit(Atom atom);
}
