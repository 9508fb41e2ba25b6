package com.abt.mixfix.term;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * A variable name: a display tag plus an optional disambiguator.
 *
 * Two names are the same identity only when both parts match, so {@code x@3}
 * and {@code x@4} are distinct even though they print with the same tag.
 * Plain names (no disambiguator) come from parsed source text; disambiguated
 * ones come from {@link NamePool}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Name {
    @NonNull
    String tag;
    Long disambiguator;

    public static Name plain(String tag) {
        return new Name(tag, null);
    }

    public static Name fresh(String tag) {
        return new Name(tag, NamePool.next());
    }

    /**
     * Same tag, new disambiguator from the pool.
     */
    public Name fresh() {
        return fresh(tag);
    }

    /**
     * Same tag with an explicit display disambiguator. Only used when
     * simplifying names for display.
     */
    Name withDisambiguator(Long n) {
        return new Name(tag, n);
    }

    public boolean hasDisambiguator() {
        return disambiguator != null;
    }

    @Override
    public String toString() {
        return disambiguator == null ? tag : tag + "@" + disambiguator;
    }
}
