package com.abt.mixfix.precedence;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * A textual insertion point in a kind's canonical rendering, used as a token
 * in the precedence order.
 *
 * <pre>
 *   Plus        refers to   |p + q
 *   Plus.p      refers to    p|+ q
 *   Plus.plus   refers to    p +|q
 *   Plus.q      refers to    p + q|
 * </pre>
 * The kind name alone is the entry position; every field contributes the
 * position right after it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CursorPosition {
    public static final CursorPosition BOTTOM = new CursorPosition("bot", null);
    public static final CursorPosition TOP = new CursorPosition("top", null);

    @NonNull
    String kindName;
    String fieldName;

    public static CursorPosition entry(String kindName) {
        return new CursorPosition(kindName, null);
    }

    public static CursorPosition exit(String kindName, String fieldName) {
        return new CursorPosition(kindName, fieldName);
    }

    public boolean isEntry() {
        return fieldName == null;
    }

    @Override
    public String toString() {
        return fieldName == null ? kindName : kindName + "." + fieldName;
    }
}
