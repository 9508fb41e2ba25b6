package com.abt.mixfix.syntax;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * One entry of a kind's ordered field list.
 *
 * Literal fields carry their spelling; binder fields carry the separator
 * written between the bound name and the body.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FieldSpec {
    @NonNull
    String name;
    @NonNull
    FieldKind kind;
    Spelling spelling;

    public static FieldSpec term(String name) {
        return new FieldSpec(name, FieldKind.TERM, null);
    }

    public static FieldSpec binder(String name) {
        return new FieldSpec(name, FieldKind.BINDER, null);
    }

    public static FieldSpec binder(String name, Spelling separator) {
        return new FieldSpec(name, FieldKind.BINDER, separator);
    }

    public static FieldSpec literal(String name, String text) {
        return literal(name, Spelling.of(text));
    }

    public static FieldSpec literal(String name, Spelling spelling) {
        return new FieldSpec(name, FieldKind.LITERAL, spelling);
    }

    public boolean isLiteral() {
        return kind == FieldKind.LITERAL;
    }

    FieldSpec withSpelling(Spelling spelling) {
        return new FieldSpec(name, kind, spelling);
    }
}
