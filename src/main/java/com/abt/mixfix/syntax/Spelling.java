package com.abt.mixfix.syntax;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableMap;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * How a literal field is written. The parsing spelling is used by the
 * grammar and by {@link Mode#DEFAULT}; other modes may override it, either
 * one by one or with a single fallback for every non-default mode.
 *
 * For example {@code Spelling.of("\\").in(Mode.of("pretty"), "λ")} parses a
 * backslash and pretty-prints a lambda.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Spelling {
    public static final Spelling BINDER_SEPARATOR = Spelling.of(".").otherwise(". ");

    @NonNull
    String text;
    @NonNull
    ImmutableMap<Mode, String> modes;
    String otherModes;

    public static Spelling of(String text) {
        return new Spelling(text, ImmutableMap.of(), null);
    }

    public Spelling in(Mode mode, String display) {
        return new Spelling(text, ImmutableMap.<Mode, String>builder()
                .putAll(modes)
                .put(mode, display)
                .buildKeepingLast(), otherModes);
    }

    public Spelling otherwise(String display) {
        return new Spelling(text, modes, display);
    }

    public String inMode(Mode mode) {
        if (mode.isDefault()) {
            return text;
        }
        String display = modes.get(mode);
        if (display != null) {
            return display;
        }
        return otherModes != null ? otherModes : text;
    }

    /**
     * The grammar tokens of the parsing spelling. Surrounding whitespace is
     * layout only; an all-whitespace spelling contributes no tokens.
     */
    public List<String> tokens() {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? List.of() : Arrays.asList(trimmed.split("\\s+"));
    }
}
