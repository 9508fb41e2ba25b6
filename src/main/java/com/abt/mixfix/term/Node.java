package com.abt.mixfix.term;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

import com.abt.mixfix.precedence.CursorPosition;
import com.abt.mixfix.syntax.Kind;
import com.abt.mixfix.syntax.Mode;
import com.abt.mixfix.syntax.PrecedencePrinter;
import com.google.common.collect.ImmutableList;

import lombok.Getter;

/**
 * An instance of a declared {@link Kind}: one argument per sub-term or binder
 * field, in declaration order. Literal fields carry no data.
 */
@Getter
public final class Node extends Term {
    private final Kind kind;
    private final ImmutableList<Term> arguments;

    /**
     * Positional constructor. Prefer {@link Kind#make(Term...)}.
     *
     * @throws com.abt.mixfix.exception.InvalidConstructionException if the
     *         arguments do not line up with the kind's fields
     */
    public Node(Kind kind, List<? extends Term> arguments) {
        this.kind = kind;
        this.arguments = ImmutableList.copyOf(arguments);
        kind.checkArguments(this.arguments);
    }

    /**
     * Named accessor for a sub-term or binder field.
     */
    public Term get(String fieldName) {
        return arguments.get(kind.argumentIndex(fieldName));
    }

    public Binder getBinder(String fieldName) {
        return (Binder) get(fieldName);
    }

    public boolean is(Kind other) {
        return kind == other;
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Term fresh(Map<Name, Name> renaming) {
        return map(arg -> arg.fresh(renaming));
    }

    @Override
    public Term subst(Map<Name, ? extends Term> substitution) {
        return map(arg -> arg.subst(substitution));
    }

    @Override
    public boolean alphaEquals(Term other, Map<Name, Name> renaming) {
        if (!(other instanceof Node node) || node.kind != kind) {
            return false;
        }
        for (int i = 0; i < arguments.size(); i++) {
            if (!arguments.get(i).alphaEquals(node.arguments.get(i), renaming)) {
                return false;
            }
        }
        return true;
    }

    @Override
    int structuralHash(Map<Name, Integer> depths) {
        int hash = kind.getName().hashCode();
        for (Term arg : arguments) {
            hash = 31 * hash + arg.structuralHash(depths);
        }
        return hash;
    }

    @Override
    public Set<Name> freeNames() {
        Set<Name> names = new HashSet<>();
        for (Term arg : arguments) {
            names.addAll(arg.freeNames());
        }
        return Set.copyOf(names);
    }

    @Override
    public Term simplifyNames(Map<Name, Name> renaming, Set<Name> reserved) {
        return map(arg -> arg.simplifyNames(renaming, reserved));
    }

    @Override
    public String render(Mode mode, CursorPosition left, CursorPosition right) {
        return PrecedencePrinter.render(this, mode, left, right);
    }

    private Node map(UnaryOperator<Term> f) {
        ImmutableList.Builder<Term> mapped = ImmutableList.builderWithExpectedSize(arguments.size());
        for (Term arg : arguments) {
            mapped.add(f.apply(arg));
        }
        return new Node(kind, mapped.build());
    }
}
