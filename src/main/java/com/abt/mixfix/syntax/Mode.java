package com.abt.mixfix.syntax;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Output mode tag chosen by the caller of {@code render}.
 *
 * {@link #DEFAULT} is reserved: it is the mode the parser checks candidates
 * against, so its spellings and brackets are the parsing ones.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Mode {
    public static final Mode DEFAULT = new Mode("default");

    @NonNull
    String name;

    public static Mode of(String name) {
        return DEFAULT.name.equals(name) ? DEFAULT : new Mode(name);
    }

    public boolean isDefault() {
        return DEFAULT.equals(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
