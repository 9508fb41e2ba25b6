package com.abt.mixfix.parser;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.abt.mixfix.exception.NoParseException;
import com.google.common.collect.ImmutableList;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for grammar snapshots and all-derivations enumeration.
 */
class DerivationEngineTest {

    private final DerivationEngine engine = new DerivationEngine();
    private Grammar grammar;

    @BeforeEach
    void setUp() {
        grammar = Grammar.base('(', ')')
                .with(new Production("Plus", ImmutableList.of(Symbol.TERM, Symbol.literal("+"), Symbol.TERM)))
                .with(new Production("Neg", ImmutableList.of(Symbol.literal("-"), Symbol.TERM)));
    }

    private List<DerivationTree> derive(String input) {
        return engine.deriveAll(grammar, grammar.tokenize(input), input);
    }

    @Test
    void testSingleIdentifier() {
        List<DerivationTree> trees = derive("x");

        assertThat(trees).hasSize(1);
        assertThat(trees.get(0).getProduction().getLabel()).isEqualTo(Grammar.IDENTIFIER);
    }

    @Test
    void testEnumeratesEveryDerivation() {
        assertThat(derive("1 + 2")).hasSize(1);
        assertThat(derive("1 + 2 + 3")).hasSize(2);
        // Catalan number C3
        assertThat(derive("1 + 2 + 3 + 4")).hasSize(5);
    }

    @Test
    void testPrefixAndInfixInteract() {
        // -(a + b) and (-a) + b
        List<DerivationTree> trees = derive("- a + b");

        assertThat(trees).extracting(t -> t.getProduction().getLabel()).containsExactlyInAnyOrder("Neg", "Plus");
    }

    @Test
    void testBracketsRestrictDerivations() {
        List<DerivationTree> trees = derive("(1 + 2) + 3");

        assertThat(trees).hasSize(1);
        DerivationTree left = (DerivationTree) trees.get(0).getChildren().get(0);
        assertThat(left.getProduction().getLabel()).isEqualTo(Grammar.PAREN);
    }

    @Test
    void testEmptyInputFails() {
        assertThatThrownBy(() -> derive("   "))
                .isInstanceOf(NoParseException.class)
                .hasMessageContaining("empty input");
    }

    @Test
    void testNoMatchingAlternativeFails() {
        assertThatThrownBy(() -> derive("1 +"))
                .isInstanceOf(NoParseException.class)
                .hasMessageContaining("matches no alternative");
        assertThatThrownBy(() -> derive("(1"))
                .isInstanceOf(NoParseException.class);
    }

    @Test
    void testGrammarSnapshotsAreImmutable() {
        Grammar base = Grammar.base('(', ')');
        Grammar extended = base.with(new Production("Star", ImmutableList.of(Symbol.TERM, Symbol.literal("*"))));

        assertThat(base.getProductions()).hasSize(4);
        assertThat(base.getLiterals()).isEmpty();
        assertThat(extended.getProductions()).hasSize(5);
        assertThat(extended.getLiterals()).containsExactly("*");
    }

    @Test
    void testDescribe() {
        String description = grammar.describe();

        assertThat(description).startsWith("term : \"(\" term \")\" -> #paren");
        assertThat(description).contains("| IDENTIFIER -> #identifier");
        assertThat(description).contains("| term \"+\" term -> Plus");
        assertThat(description).contains("| \"-\" term -> Neg");
    }

    @Test
    void testUnitProductionIsRecognised() {
        assertThat(new Production("Id", ImmutableList.of(Symbol.TERM)).isUnit()).isTrue();
        assertThat(new Production("Neg", ImmutableList.of(Symbol.literal("-"), Symbol.TERM)).isUnit()).isFalse();
    }
}
