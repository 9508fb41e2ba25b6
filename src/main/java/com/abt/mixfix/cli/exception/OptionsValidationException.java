package com.abt.mixfix.cli.exception;

import java.io.Serializable;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.Value;

/**
 * Every problem found with the command line in one pass, each tied to the
 * option or parameter that caused it.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<Violation> violations;

	/**
	 * One rejected option, e.g. {@code --reduce}, or {@code <expression>} for
	 * the positional parameter.
	 */
	@Value
	public static class Violation implements Serializable {
		private static final long serialVersionUID = 1L;

		String option;
		String message;

		@Override
		public String toString() {
			return option + ": " + message;
		}
	}

	public OptionsValidationException(List<Violation> violations) {
		super("Invalid options:" + violations.stream()
				.map(v -> System.lineSeparator() + "\t" + v)
				.collect(Collectors.joining()));
		this.violations = List.copyOf(violations);
	}

	public List<Violation> getViolations() {
		return violations;
	}

	/**
	 * The offending options in the order they were reported, without
	 * duplicates.
	 */
	public Set<String> getRejectedOptions() {
		Set<String> options = new LinkedHashSet<>();
		violations.forEach(v -> options.add(v.getOption()));
		return options;
	}

	/**
	 * Printable {@code option: message} lines.
	 */
	public List<String> getErrors() {
		return violations.stream().map(Violation::toString).collect(Collectors.toList());
	}
}
