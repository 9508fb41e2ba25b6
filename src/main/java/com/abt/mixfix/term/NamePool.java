package com.abt.mixfix.term;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide source of name disambiguators.
 *
 * Values are handed out in increasing order and never reused.
 */
public final class NamePool {

    private static final AtomicLong COUNTER = new AtomicLong();

    private NamePool() {
        // Utility class
    }

    /**
     * Returns the next disambiguator.
     */
    public static long next() {
        return COUNTER.getAndIncrement();
    }
}
