package com.abt.mixfix.term;

import java.util.Map;
import java.util.Set;

import com.abt.mixfix.precedence.CursorPosition;
import com.abt.mixfix.syntax.Mode;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * An occurrence of a variable name.
 *
 * Usually not constructed directly; see {@link Binder#create}.
 */
@Getter
@RequiredArgsConstructor(staticName = "of")
public final class Var extends Term {
    @NonNull
    private final Name name;

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Term fresh(Map<Name, Name> renaming) {
        Name renamed = renaming.get(name);
        return renamed != null ? Var.of(renamed) : this;
    }

    @Override
    public Term subst(Map<Name, ? extends Term> substitution) {
        Term replacement = substitution.get(name);
        return replacement != null ? replacement : this;
    }

    @Override
    public boolean alphaEquals(Term other, Map<Name, Name> renaming) {
        if (!(other instanceof Var var)) {
            return false;
        }
        Name bound = renaming.get(name);
        if (bound != null) {
            return bound.equals(var.name);
        }
        // a free name on the left never matches a bound name on the right
        return name.equals(var.name) && !renaming.containsValue(var.name);
    }

    @Override
    int structuralHash(Map<Name, Integer> depths) {
        Integer depth = depths.get(name);
        return depth != null ? 31 * depth + 17 : name.hashCode();
    }

    @Override
    public Set<Name> freeNames() {
        return Set.of(name);
    }

    @Override
    public Term simplifyNames(Map<Name, Name> renaming, Set<Name> reserved) {
        return fresh(renaming);
    }

    @Override
    public String render(Mode mode, CursorPosition left, CursorPosition right) {
        return name.toString();
    }
}
