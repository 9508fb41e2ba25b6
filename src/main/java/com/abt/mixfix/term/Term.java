package com.abt.mixfix.term;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import com.abt.mixfix.precedence.CursorPosition;
import com.abt.mixfix.syntax.Mode;

/**
 * Base class for all abstract binding tree nodes.
 *
 * Terms are immutable. Every structural operation returns a new tree and
 * leaves the receiver untouched, so terms can be shared freely between
 * threads. Only {@link #fresh} and {@link Binder#open()} draw on the
 * process-wide {@link NamePool}.
 *
 * Alpha-equivalence is exposed as {@link #alphaEquals(Term)} and
 * {@link #structuralHash()}; {@code equals} keeps its reference semantics.
 */
public abstract sealed class Term permits Var, Binder, Node, Atom {

    public abstract <R> R accept(TermVisitor<R> visitor);

    /**
     * Renames every bound name in this term to a freshly allocated one.
     */
    public Term fresh() {
        return fresh(Map.of());
    }

    /**
     * Freshens bound names, additionally applying {@code renaming} to free
     * occurrences.
     */
    public abstract Term fresh(Map<Name, Name> renaming);

    /**
     * Capture-avoiding substitution of terms for free names.
     */
    public abstract Term subst(Map<Name, ? extends Term> substitution);

    public boolean alphaEquals(Term other) {
        return alphaEquals(other, Map.of());
    }

    /**
     * Equality up to renaming of bound names. {@code renaming} pairs the
     * left-hand bound names in scope with their right-hand counterparts.
     */
    public abstract boolean alphaEquals(Term other, Map<Name, Name> renaming);

    /**
     * Hash code consistent with {@link #alphaEquals(Term)}.
     */
    public int structuralHash() {
        return structuralHash(Map.of());
    }

    abstract int structuralHash(Map<Name, Integer> depths);

    public abstract Set<Name> freeNames();

    /**
     * Rewrites bound names to the simplest display names that do not change
     * the meaning of the term: {@code x}, then {@code x@0}, {@code x@1}, ...
     */
    public Term simplifyNames() {
        return simplifyNames(Map.of(), Set.of());
    }

    public abstract Term simplifyNames(Map<Name, Name> renaming, Set<Name> reserved);

    public String render() {
        return render(Mode.DEFAULT);
    }

    public String render(Mode mode) {
        return render(mode, CursorPosition.BOTTOM, CursorPosition.BOTTOM);
    }

    /**
     * Renders this term between the given incoming cursor positions,
     * bracketing only where the precedence order requires it.
     */
    public abstract String render(Mode mode, CursorPosition left, CursorPosition right);

    @Override
    public String toString() {
        return accept(new TermDebugPrinter());
    }

    /**
     * Extends a renaming with {@code from -> to}, dropping any older entry
     * that also targets {@code to} so the map stays injective.
     */
    static Map<Name, Name> extend(Map<Name, Name> renaming, Name from, Name to) {
        Map<Name, Name> extended = new HashMap<>(renaming);
        extended.values().removeIf(to::equals);
        extended.put(from, to);
        return extended;
    }
}
