package com.abt.mixfix.parser;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.abt.mixfix.exception.NoParseException;
import com.abt.mixfix.parser.Token.TokenType;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Tokenizer.
 */
class TokenizerTest {

    private static List<Token> tokenize(String source, String... literals) {
        return new Tokenizer(source, Set.of(literals), '(', ')').tokenize();
    }

    @Test
    void testIdentifiersAreLongestMatch() {
        List<Token> tokens = tokenize("snake_case123 _abc xy");

        assertThat(tokens).extracting(Token::getType).containsOnly(TokenType.IDENTIFIER);
        assertThat(tokens).extracting(Token::getText).containsExactly("snake_case123", "_abc", "xy");
    }

    @Test
    void testLiteralWinsOverIdentifierOfSameLength() {
        List<Token> tokens = tokenize("forall x", "forall");

        assertThat(tokens).extracting(Token::getType).containsExactly(TokenType.LITERAL, TokenType.IDENTIFIER);
    }

    @Test
    void testLongerIdentifierWinsOverLiteral() {
        List<Token> tokens = tokenize("forallx", "forall");

        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.IDENTIFIER);
    }

    @Test
    void testLiteralWinsOverNumber() {
        List<Token> tokens = tokenize("1 12", "1");

        assertThat(tokens).extracting(Token::getType).containsExactly(TokenType.LITERAL, TokenType.NUMBER);
    }

    @Test
    void testLongestLiteralWins() {
        List<Token> tokens = tokenize("a->b-c", "-", "->");

        assertThat(tokens).extracting(Token::getText).containsExactly("a", "->", "b", "-", "c");
        assertThat(tokens.get(1).getOffset()).isEqualTo(1);
    }

    @Test
    void testBracketsAndWhitespace() {
        List<Token> tokens = tokenize(" ( x  )\t");

        assertThat(tokens).extracting(Token::getType)
                .containsExactly(TokenType.LPAREN, TokenType.IDENTIFIER, TokenType.RPAREN);
    }

    @Test
    void testNumbers() {
        List<Token> tokens = tokenize("42 3.14 1e10 x.1", ".");

        assertThat(tokens).extracting(Token::getText).containsExactly("42", "3.14", "1e10", "x", ".", "1");
    }

    @Test
    void testLeadingMinusBelongsToNumber() {
        List<Token> tokens = tokenize("-3 x -2.5e1");

        assertThat(tokens).extracting(Token::getType)
                .containsExactly(TokenType.NUMBER, TokenType.IDENTIFIER, TokenType.NUMBER);
        assertThat(tokens).extracting(Token::getText).containsExactly("-3", "x", "-2.5e1");
    }

    @Test
    void testDeclaredMinusLiteralKeepsItsSign() {
        List<Token> tokens = tokenize("1 -2", "-");

        assertThat(tokens).extracting(Token::getText).containsExactly("1", "-", "2");
        assertThat(tokens).extracting(Token::getType)
                .containsExactly(TokenType.NUMBER, TokenType.LITERAL, TokenType.NUMBER);
    }

    @Test
    void testLoneMinusFails() {
        assertThatThrownBy(() -> tokenize("- x"))
                .isInstanceOf(NoParseException.class)
                .hasMessageContaining("unexpected character '-' at offset 0");
    }

    @Test
    void testStringWithEscapes() {
        List<Token> tokens = tokenize("\"a \\\"b\\\"\\n\"");

        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(0).getText()).isEqualTo("a \"b\"\n");
    }

    @Test
    void testUnterminatedStringFails() {
        assertThatThrownBy(() -> tokenize("\"abc"))
                .isInstanceOf(NoParseException.class)
                .hasMessageContaining("unterminated string");
    }

    @Test
    void testUnknownCharacterFails() {
        assertThatThrownBy(() -> tokenize("x $ y"))
                .isInstanceOf(NoParseException.class)
                .hasMessageContaining("unexpected character '$' at offset 2");
    }
}
