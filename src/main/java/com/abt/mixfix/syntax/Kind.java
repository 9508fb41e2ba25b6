package com.abt.mixfix.syntax;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.abt.mixfix.exception.InvalidConstructionException;
import com.abt.mixfix.precedence.CursorPosition;
import com.abt.mixfix.term.Binder;
import com.abt.mixfix.term.Node;
import com.abt.mixfix.term.Term;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import lombok.Getter;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A declared node kind: one case of the term sum type.
 *
 * Owns the field layout, the cursor positions used for precedence and the
 * bracketers. Instances are created only by {@link Syntax#declare}.
 */
@Getter
public class Kind {
    private final Syntax syntax;
    private final String name;
    private final ImmutableList<FieldSpec> fields;
    /** Sub-term and binder fields, in order; these are the constructor parameters. */
    private final ImmutableList<FieldSpec> argumentFields;
    private final CursorPosition entry;
    private final ImmutableMap<String, CursorPosition> exits;
    private final ImmutableMap<Mode, Bracketer> bracketers;
    private final Bracketer defaultBracketer;

    Kind(Syntax syntax, KindDeclaration declaration, SyntaxConfig config) {
        this.syntax = syntax;
        this.name = declaration.getName();
        this.entry = CursorPosition.entry(name);

        ImmutableList.Builder<FieldSpec> all = ImmutableList.builder();
        ImmutableList.Builder<FieldSpec> arguments = ImmutableList.builder();
        Map<String, CursorPosition> exitPositions = new LinkedHashMap<>();
        for (FieldSpec field : declaration.getFields()) {
            FieldSpec resolved = field.getKind() == FieldKind.BINDER && field.getSpelling() == null
                    ? field.withSpelling(config.getBinderSeparator())
                    : field;
            all.add(resolved);
            if (!resolved.isLiteral()) {
                arguments.add(resolved);
            }
            exitPositions.put(resolved.getName(), CursorPosition.exit(name, resolved.getName()));
        }
        this.fields = all.build();
        this.argumentFields = arguments.build();
        this.exits = ImmutableMap.copyOf(exitPositions);
        this.bracketers = ImmutableMap.copyOf(declaration.getBracketers());
        this.defaultBracketer = config.defaultBracketer();
    }

    /**
     * Positional constructor over the sub-term and binder fields.
     *
     * @throws InvalidConstructionException on an arity or field-kind mismatch
     */
    public Node make(Term... arguments) {
        return new Node(this, Arrays.asList(arguments));
    }

    /**
     * Cursor position right after the named field.
     */
    public CursorPosition exit(String fieldName) {
        CursorPosition exit = exits.get(fieldName);
        checkArgument(exit != null, "Kind %s has no field %s", name, fieldName);
        return exit;
    }

    public CursorPosition lastExit() {
        return exit(fields.get(fields.size() - 1).getName());
    }

    public int argumentIndex(String fieldName) {
        for (int i = 0; i < argumentFields.size(); i++) {
            if (argumentFields.get(i).getName().equals(fieldName)) {
                return i;
            }
        }
        throw new IllegalArgumentException("Kind " + name + " has no sub-term or binder field " + fieldName);
    }

    public Bracketer bracketerFor(Mode mode) {
        return mode.isDefault() ? defaultBracketer : bracketers.getOrDefault(mode, defaultBracketer);
    }

    public void checkArguments(List<Term> arguments) {
        if (arguments.size() != argumentFields.size()) {
            throw new InvalidConstructionException(String.format("%s expects %d argument(s) but got %d",
                    name, argumentFields.size(), arguments.size()));
        }
        for (int i = 0; i < arguments.size(); i++) {
            FieldSpec field = argumentFields.get(i);
            Term argument = arguments.get(i);
            if (argument == null) {
                throw new InvalidConstructionException(name + "." + field.getName() + " is null");
            }
            boolean isBinder = argument instanceof Binder;
            if (field.getKind() == FieldKind.BINDER && !isBinder) {
                throw new InvalidConstructionException(
                        name + "." + field.getName() + " expects a binder but got " + argument);
            }
            if (field.getKind() == FieldKind.TERM && isBinder) {
                throw new InvalidConstructionException(
                        name + "." + field.getName() + " expects a term but got binder " + argument);
            }
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
