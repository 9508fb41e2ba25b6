package com.abt.mixfix.cli.model;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the notation command. No validation, no
 * execution logic, no printing.
 */
@Getter
public class NotationOptions {

	@Option(names = { "--language", "-l" }, defaultValue = "ARITHMETIC",
			description = "Example language: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
	private ExampleLanguage language;

	@Option(names = { "--mode", "-m" }, defaultValue = "pretty",
			description = "Output mode for the rendered term (default: ${DEFAULT-VALUE})")
	private String mode;

	@Option(names = { "--simplify-names", "-s" }, description = "Rename bound variables to their simplest display names")
	private boolean simplifyNames;

	@Option(names = { "--reduce", "-r" }, defaultValue = "0",
			description = "Number of beta-reduction steps to show (lambda only)")
	private int reduceSteps;

	@Option(names = { "--grammar", "-g" }, description = "Print the grammar of the selected language")
	private boolean printGrammar;

	@Parameters(index = "0", arity = "0..1", description = "Expression to parse")
	private String expression;
}
