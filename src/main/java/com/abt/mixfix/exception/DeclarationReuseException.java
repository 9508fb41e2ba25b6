package com.abt.mixfix.exception;

/**
 * A kind with the same name was already declared.
 */
public class DeclarationReuseException extends MixfixException {

	private static final long serialVersionUID = 1L;

	public DeclarationReuseException(String kindName) {
		super("Kind already declared: " + kindName);
	}
}
