package com.abt.mixfix.cli;

import org.junit.jupiter.api.Test;

import com.abt.mixfix.cli.model.ExampleLanguage;
import com.abt.mixfix.cli.model.NotationResult;
import com.abt.mixfix.cli.model.ValidatedNotationOptions;
import com.abt.mixfix.exception.NoParseException;
import com.abt.mixfix.syntax.Mode;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NotationRunner.
 */
class NotationRunnerTest {

    private static final Mode PRETTY = Mode.of("pretty");

    private final NotationRunner runner = new NotationRunner();

    @Test
    void testCanonicalAndRenderedForms() {
        NotationResult result = runner.run(new ValidatedNotationOptions(
                ExampleLanguage.LOGIC, PRETTY, true, 0, false, "forall  x. (exists y. (x = y))"));

        assertThat(result.getCanonical()).isEqualTo("forall x.exists y.x = y");
        assertThat(result.getRendered()).isEqualTo("∀ x. ∃ y. x = y");
        assertThat(result.getGrammar()).isNull();
        assertThat(result.getReductions()).isEmpty();
    }

    @Test
    void testReductionStopsAtNormalForm() {
        NotationResult result = runner.run(new ValidatedNotationOptions(
                ExampleLanguage.LAMBDA, PRETTY, true, 5, false, "(\\x. x x) (\\y. y)"));

        assertThat(result.getRendered()).isEqualTo("(λx. x x) (λy. y)");
        assertThat(result.getReductions()).containsExactly("(λy. y) (λy. y)", "λy. y");
        assertThat(result.isNormalForm()).isTrue();
    }

    @Test
    void testReductionStopsAfterRequestedSteps() {
        NotationResult result = runner.run(new ValidatedNotationOptions(
                ExampleLanguage.LAMBDA, PRETTY, true, 1, false, "(\\x. x x) (\\y. y)"));

        assertThat(result.getReductions()).containsExactly("(λy. y) (λy. y)");
        assertThat(result.isNormalForm()).isFalse();
    }

    @Test
    void testGrammarWithoutExpression() {
        NotationResult result = runner.run(new ValidatedNotationOptions(
                ExampleLanguage.ARITHMETIC, Mode.DEFAULT, false, 0, true, null));

        assertThat(result.getTerm()).isNull();
        assertThat(result.getGrammar()).contains("term \"->\" term -> Pow");
    }

    @Test
    void testParseFailurePropagates() {
        ValidatedNotationOptions options = new ValidatedNotationOptions(
                ExampleLanguage.ARITHMETIC, PRETTY, false, 0, false, "1 -> 1 * 1");

        assertThatThrownBy(() -> runner.run(options)).isInstanceOf(NoParseException.class);
    }
}
