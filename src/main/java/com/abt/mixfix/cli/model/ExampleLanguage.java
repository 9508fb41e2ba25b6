package com.abt.mixfix.cli.model;

/**
 * The built-in languages the command line can parse.
 */
public enum ExampleLanguage {
    /** {@code 1}, {@code *}, {@code +} and {@code ->}. */
    ARITHMETIC,
    /** Arithmetic plus {@code forall}, {@code exists} and {@code =}. */
    LOGIC,
    /** Untyped lambda calculus. */
    LAMBDA
}
