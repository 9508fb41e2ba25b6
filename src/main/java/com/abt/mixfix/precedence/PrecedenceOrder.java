package com.abt.mixfix.precedence;

/**
 * Monotonic partial order on cursor positions.
 *
 * Registrations are irrevocable: once {@code lo <= hi} holds it holds for
 * every later query. {@link CursorPosition#BOTTOM} and
 * {@link CursorPosition#TOP} are always present.
 */
public interface PrecedenceOrder {

    /**
     * Makes a position known to the order without relating it to anything.
     */
    void addToken(CursorPosition token);

    /**
     * Declares {@code token} below every position, including later ones.
     */
    void addBottom(CursorPosition token);

    /**
     * Declares {@code token} above every position, including later ones.
     */
    void addTop(CursorPosition token);

    /**
     * Records {@code lo <= hi}; the order is closed under transitivity.
     */
    void add(CursorPosition lo, CursorPosition hi);

    boolean lessOrEqual(CursorPosition a, CursorPosition b);

    boolean contains(CursorPosition token);
}
