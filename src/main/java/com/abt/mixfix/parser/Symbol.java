package com.abt.mixfix.parser;

import com.abt.mixfix.parser.Token.TokenType;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * An element of a production: the shared {@code term} nonterminal or a
 * terminal matching one token.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Symbol {
    public static final Symbol TERM = new Symbol(null, null);

    /** Null for the nonterminal. */
    TokenType terminal;
    /** Exact text for literal terminals, otherwise null. */
    String text;

    public static Symbol terminal(TokenType type) {
        return new Symbol(type, null);
    }

    public static Symbol literal(String text) {
        return new Symbol(TokenType.LITERAL, text);
    }

    public boolean isNonterminal() {
        return terminal == null;
    }

    public boolean matches(Token token) {
        if (terminal != token.getType()) {
            return false;
        }
        return text == null || text.equals(token.getText());
    }

    @Override
    public String toString() {
        if (terminal == null) {
            return "term";
        }
        return text != null ? '"' + text + '"' : terminal.name();
    }
}
