package com.abt.mixfix.term;

import java.util.stream.Collectors;

/**
 * Prints a term in constructor form, e.g. {@code Plus(Top(), V(x@3))}.
 */
public class TermDebugPrinter implements TermVisitor<String> {

    @Override
    public String visit(Var var) {
        return "V(" + var.getName() + ")";
    }

    @Override
    public String visit(Binder binder) {
        return "F(" + binder.getName() + ", " + binder.getBody().accept(this) + ")";
    }

    @Override
    public String visit(Node node) {
        return node.getKind().getName() + node.getArguments().stream()
                .map(arg -> arg.accept(this))
                .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String visit(Atom atom) {
        return atom.getType() + "(" + atom.getText() + ")";
    }
}
