package com.abt.mixfix.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abt.mixfix.cli.exception.OptionsValidationException;
import com.abt.mixfix.cli.model.NotationOptions;
import com.abt.mixfix.cli.model.NotationResult;
import com.abt.mixfix.cli.model.ValidatedNotationOptions;
import com.abt.mixfix.cli.output.NotationResultsPrinter;
import com.abt.mixfix.cli.validation.NotationOptionsValidator;
import com.abt.mixfix.exception.AmbiguousParseException;
import com.abt.mixfix.exception.NoParseException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for parsing and printing expressions of the example languages.
 */
@Command(
        name = "mixfix",
        mixinStandardHelpOptions = true,
        version = "mixfix-abt 1.0.0",
        description = "Parses an expression in one of the example mixfix languages and prints it back."
)
public class NotationCommand implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_INVALID_OPTIONS = 1;
    public static final int EXIT_NO_PARSE = 2;
    public static final int EXIT_AMBIGUOUS = 3;

    private static final Logger log = LoggerFactory.getLogger(NotationCommand.class);

    @Mixin
    private NotationOptions options = new NotationOptions();

    private final NotationOptionsValidator validator = new NotationOptionsValidator();
    private final NotationRunner runner = new NotationRunner();
    private final NotationResultsPrinter printer = new NotationResultsPrinter();

    @Override
    public Integer call() {
        ValidatedNotationOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return EXIT_INVALID_OPTIONS;
        }

        printer.printBanner(validated);
        try {
            NotationResult result = runner.run(validated);
            printer.printSuccess(result);
            return EXIT_OK;
        } catch (NoParseException e) {
            printer.printNoParse(e.getMessage());
            return EXIT_NO_PARSE;
        } catch (AmbiguousParseException e) {
            printer.printAmbiguity(e);
            return EXIT_AMBIGUOUS;
        }
    }
}
