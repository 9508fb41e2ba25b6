package com.abt.mixfix.syntax;

import lombok.Builder;
import lombok.Value;

/**
 * Settings shared by every kind declared in one {@link Syntax}.
 */
@Value
@Builder
public class SyntaxConfig {
    /** Separator between a bound name and its body, when a binder field does not set its own. */
    @Builder.Default
    Spelling binderSeparator = Spelling.BINDER_SEPARATOR;
    @Builder.Default
    char openBracket = '(';
    @Builder.Default
    char closeBracket = ')';
    /** Derivation counts above this are logged as a warning. */
    @Builder.Default
    int forestWarningThreshold = 10_000;

    public static SyntaxConfig defaults() {
        return SyntaxConfig.builder().build();
    }

    public Bracketer defaultBracketer() {
        return rendered -> openBracket + rendered + closeBracket;
    }
}
