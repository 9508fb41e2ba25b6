package com.abt.mixfix.cli.validation;

import java.util.ArrayList;
import java.util.List;

import com.abt.mixfix.cli.exception.OptionsValidationException;
import com.abt.mixfix.cli.exception.OptionsValidationException.Violation;
import com.abt.mixfix.cli.model.ExampleLanguage;
import com.abt.mixfix.cli.model.NotationOptions;
import com.abt.mixfix.cli.model.ValidatedNotationOptions;
import com.abt.mixfix.syntax.Mode;

public class NotationOptionsValidator {

	public ValidatedNotationOptions validate(NotationOptions o) {
		List<Violation> errors = new ArrayList<>();

		if (isBlank(o.getExpression()) && !o.isPrintGrammar()) {
			errors.add(new Violation("<expression>", "An expression is required unless --grammar is given."));
		}

		if (isBlank(o.getMode())) {
			errors.add(new Violation("--mode", "Output mode must not be blank."));
		}

		if (o.getReduceSteps() < 0) {
			errors.add(new Violation("--reduce", "Reduction steps must be >= 0. Got: " + o.getReduceSteps()));
		} else if (o.getReduceSteps() > 0 && o.getLanguage() != ExampleLanguage.LAMBDA) {
			errors.add(new Violation("--reduce", "Only available for the LAMBDA language. Got: " + o.getLanguage()));
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedNotationOptions(o.getLanguage(), Mode.of(o.getMode().trim()), o.isSimplifyNames(),
				o.getReduceSteps(), o.isPrintGrammar(), isBlank(o.getExpression()) ? null : o.getExpression());
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
