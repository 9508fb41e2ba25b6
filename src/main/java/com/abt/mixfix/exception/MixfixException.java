package com.abt.mixfix.exception;

/**
 * Base class for failures raised while building, declaring or parsing terms.
 */
public class MixfixException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public MixfixException(String message) {
		super(message);
	}

	public MixfixException(String message, Throwable cause) {
		super(message, cause);
	}
}
