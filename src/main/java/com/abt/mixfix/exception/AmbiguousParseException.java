package com.abt.mixfix.exception;

import java.util.List;
import java.util.stream.Collectors;

import com.abt.mixfix.term.Term;

/**
 * More than one derivation survived disambiguation. Holds every survivor so
 * the caller can see which declarations are under-specified.
 */
public class AmbiguousParseException extends MixfixException {

	private static final long serialVersionUID = 1L;
	private final String input;
	private final transient List<Term> candidates;

	public AmbiguousParseException(String input, List<Term> candidates) {
		super("Ambiguous parse for '" + input + "'. Parses:" + System.lineSeparator()
				+ candidates.stream().map(Term::toString).collect(Collectors.joining(System.lineSeparator())));
		this.input = input;
		this.candidates = List.copyOf(candidates);
	}

	public String getInput() {
		return input;
	}

	public List<Term> getCandidates() {
		return candidates;
	}
}
