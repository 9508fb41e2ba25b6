package com.abt.mixfix.parser;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.abt.mixfix.parser.Token.TokenType;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Immutable snapshot of the single-nonterminal mixfix grammar.
 *
 * The grammar does not encode precedence at all: every declared kind adds
 * one alternative for {@code term} whose operands are {@code term} again.
 * Derivations are filtered afterwards by the printer.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Grammar {
    public static final String PAREN = "#paren";
    public static final String IDENTIFIER = "#identifier";
    public static final String NUMBER = "#number";
    public static final String STRING = "#string";

    private final ImmutableList<Production> productions;
    private final ImmutableSet<String> literals;
    private final char openBracket;
    private final char closeBracket;

    /**
     * The always-present alternatives: bracketed term, identifier, number and
     * string.
     */
    public static Grammar base(char openBracket, char closeBracket) {
        ImmutableList<Production> base = ImmutableList.of(
                new Production(PAREN, ImmutableList.of(
                        Symbol.terminal(TokenType.LPAREN), Symbol.TERM, Symbol.terminal(TokenType.RPAREN))),
                new Production(IDENTIFIER, ImmutableList.of(Symbol.terminal(TokenType.IDENTIFIER))),
                new Production(NUMBER, ImmutableList.of(Symbol.terminal(TokenType.NUMBER))),
                new Production(STRING, ImmutableList.of(Symbol.terminal(TokenType.STRING))));
        return new Grammar(base, ImmutableSet.of(), openBracket, closeBracket);
    }

    /**
     * Returns a new grammar with one more alternative. The receiver is left
     * unchanged.
     */
    public Grammar with(Production production) {
        Set<String> extended = new LinkedHashSet<>(literals);
        for (Symbol symbol : production.getSymbols()) {
            if (symbol.getText() != null) {
                extended.add(symbol.getText());
            }
        }
        return new Grammar(
                ImmutableList.<Production>builder().addAll(productions).add(production).build(),
                ImmutableSet.copyOf(extended), openBracket, closeBracket);
    }

    public List<Token> tokenize(String input) {
        return new Tokenizer(input, literals, openBracket, closeBracket).tokenize();
    }

    /**
     * EBNF-like listing of the current alternatives.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder("term :");
        String separator = " ";
        for (Production production : productions) {
            sb.append(separator).append(describe(production)).append(System.lineSeparator());
            separator = "     | ";
        }
        return sb.toString();
    }

    private String describe(Production production) {
        StringBuilder sb = new StringBuilder();
        for (Symbol symbol : production.getSymbols()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            if (symbol.getTerminal() == TokenType.LPAREN) {
                sb.append('"').append(openBracket).append('"');
            } else if (symbol.getTerminal() == TokenType.RPAREN) {
                sb.append('"').append(closeBracket).append('"');
            } else {
                sb.append(symbol);
            }
        }
        return sb.append(" -> ").append(production.getLabel()).toString();
    }
}
