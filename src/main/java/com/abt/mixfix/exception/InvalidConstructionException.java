package com.abt.mixfix.exception;

/**
 * A node was built with arguments that do not match its kind's fields.
 */
public class InvalidConstructionException extends MixfixException {

	private static final long serialVersionUID = 1L;

	public InvalidConstructionException(String message) {
		super(message);
	}
}
