package com.abt.mixfix.exception;

import lombok.Getter;

/**
 * The input matches no alternative of the current grammar, or every
 * derivation was discarded.
 */
@Getter
public class NoParseException extends MixfixException {

	private static final long serialVersionUID = 1L;
	private final String input;

	public NoParseException(String input, String reason) {
		super("No parse for '" + input + "': " + reason);
		this.input = input;
	}
}
