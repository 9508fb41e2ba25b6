package com.abt.mixfix.syntax;

/**
 * Wraps a rendered node whose precedence does not fit its context.
 */
@FunctionalInterface
public interface Bracketer {
    String bracket(String rendered);
}
