package com.abt.mixfix.cli.model;

import com.abt.mixfix.syntax.Mode;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the runner. Keeps NotationCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedNotationOptions {
    ExampleLanguage language;
    Mode mode;
    boolean simplifyNames;
    int reduceSteps;
    boolean printGrammar;
    /** Null when only the grammar was requested. */
    String expression;
}
