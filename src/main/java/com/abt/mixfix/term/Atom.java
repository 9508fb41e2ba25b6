package com.abt.mixfix.term;

import java.util.Map;
import java.util.Set;

import com.abt.mixfix.precedence.CursorPosition;
import com.abt.mixfix.syntax.Mode;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * An atomic literal: a number or a quoted string. Atoms carry no names.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Atom extends Term {

    public enum AtomType {
        NUMBER,
        STRING
    }

    @NonNull
    private final AtomType type;
    /** Number text as written, or the unescaped string contents. */
    @NonNull
    private final String text;

    public static Atom number(String text) {
        return new Atom(AtomType.NUMBER, text);
    }

    public static Atom string(String value) {
        return new Atom(AtomType.STRING, value);
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Term fresh(Map<Name, Name> renaming) {
        return this;
    }

    @Override
    public Term subst(Map<Name, ? extends Term> substitution) {
        return this;
    }

    @Override
    public boolean alphaEquals(Term other, Map<Name, Name> renaming) {
        return other instanceof Atom atom && type == atom.type && text.equals(atom.text);
    }

    @Override
    int structuralHash(Map<Name, Integer> depths) {
        return 31 * type.hashCode() + text.hashCode();
    }

    @Override
    public Set<Name> freeNames() {
        return Set.of();
    }

    @Override
    public Term simplifyNames(Map<Name, Name> renaming, Set<Name> reserved) {
        return this;
    }

    @Override
    public String render(Mode mode, CursorPosition left, CursorPosition right) {
        if (type == AtomType.NUMBER) {
            return text;
        }
        StringBuilder sb = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
