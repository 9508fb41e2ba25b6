package com.abt.mixfix.term;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import com.abt.mixfix.exception.InvalidConstructionException;
import com.abt.mixfix.precedence.CursorPosition;
import com.abt.mixfix.syntax.Mode;
import com.abt.mixfix.syntax.Spelling;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Value;

/**
 * A binding form: one bound name scoped over a body.
 *
 * There are two ways to construct a binder:
 * <ul>
 *   <li>{@link #create(String, Function)} allocates a fresh name and builds
 *   the body from an occurrence of it. This is the only way user code should
 *   introduce a bound name.</li>
 *   <li>{@link #of(Name, Term)} wraps an existing name and body verbatim. The
 *   parser uses it, and so does code that rebuilds a binder from the pair
 *   returned by {@link #open()}.</li>
 * </ul>
 * Taking a binder apart goes through {@link #open()}, which hands back a
 * freshly renamed copy of the name together with its body, so the two can
 * never get out of step.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Binder extends Term {
    private final Name name;
    private final Term body;

    /**
     * The result of opening a binder: a fresh name and the body scoped to it.
     */
    @Value
    public static class Opened {
        Name name;
        Term body;
    }

    public static Binder create(String tag, Function<Var, Term> bodyBuilder) {
        Name name = Name.fresh(tag);
        return of(name, bodyBuilder.apply(Var.of(name)));
    }

    public static Binder of(Name name, Term body) {
        if (name == null || body == null) {
            throw new InvalidConstructionException("Binder requires a name and a body");
        }
        if (body instanceof Binder) {
            throw new InvalidConstructionException("Binder body cannot itself be a bare binder: " + body);
        }
        return new Binder(name, body);
    }

    /**
     * Returns a renamed copy of the bound name and body. Every call allocates
     * a new name.
     */
    public Opened open() {
        Name renamed = name.fresh();
        return new Opened(renamed, body.fresh(Map.of(name, renamed)));
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Term fresh(Map<Name, Name> renaming) {
        Name renamed = name.fresh();
        return new Binder(renamed, body.fresh(extend(renaming, name, renamed)));
    }

    @Override
    public Term subst(Map<Name, ? extends Term> substitution) {
        // always refresh: a replacement may mention a name equal to ours
        Name renamed = name.fresh();
        Map<Name, Term> extended = new HashMap<>(substitution);
        extended.put(name, Var.of(renamed));
        return of(renamed, body.subst(extended));
    }

    @Override
    public boolean alphaEquals(Term other, Map<Name, Name> renaming) {
        return other instanceof Binder binder
                && body.alphaEquals(binder.body, extend(renaming, name, binder.name));
    }

    @Override
    int structuralHash(Map<Name, Integer> depths) {
        // the innermost enclosing binder always holds the largest depth, even under shadowing
        int depth = depths.isEmpty() ? 0 : Collections.max(depths.values()) + 1;
        Map<Name, Integer> extended = new HashMap<>(depths);
        extended.put(name, depth);
        return 7 * body.structuralHash(extended) + 3;
    }

    @Override
    public Set<Name> freeNames() {
        Set<Name> names = new HashSet<>(body.freeNames());
        names.remove(name);
        return Set.copyOf(names);
    }

    @Override
    public Term simplifyNames(Map<Name, Name> renaming, Set<Name> reserved) {
        Set<Name> inUse = new HashSet<>(reserved);
        inUse.addAll(renaming.values());
        for (Name free : freeNames()) {
            inUse.add(renaming.getOrDefault(free, free));
        }

        Name chosen = name.withDisambiguator(null);
        for (long n = 0; inUse.contains(chosen); n++) {
            chosen = name.withDisambiguator(n);
        }

        inUse.add(chosen);
        return new Binder(chosen, body.simplifyNames(extend(renaming, name, chosen), inUse));
    }

    /**
     * Renders a binder that stands on its own, outside any node. Without an
     * enclosing field there is no declared separator to use, so this always
     * writes {@link Spelling#BINDER_SEPARATOR}, whatever the
     * {@code binderSeparator} of the syntax the body belongs to. Binders inside
     * a node are printed with their field's separator instead.
     */
    @Override
    public String render(Mode mode, CursorPosition left, CursorPosition right) {
        return render(mode, Spelling.BINDER_SEPARATOR, right);
    }

    /**
     * Renders as {@code <name><separator><body>}. The body always starts
     * right after the separator, so only the right bound is passed on.
     */
    public String render(Mode mode, Spelling separator, CursorPosition right) {
        return name + separator.inMode(mode) + body.render(mode, CursorPosition.BOTTOM, right);
    }
}
