package com.abt.mixfix.cli.model;

import java.util.List;

import com.abt.mixfix.term.Term;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Everything the printer shows after a successful run.
 */
@Value
@Builder
public class NotationResult {
    ExampleLanguage language;
    String grammar;
    String input;
    Term term;
    String canonical;
    String rendered;
    @Singular
    List<String> reductions;
    /** True when reduction stopped at a normal form before the requested step count. */
    boolean normalForm;
}
