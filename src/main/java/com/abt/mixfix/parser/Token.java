package com.abt.mixfix.parser;

import lombok.Value;

/**
 * Represents a token from the mixfix tokenizer.
 */
@Value
public class Token implements Derivation {
    TokenType type;
    String text;
    int offset;

    public enum TokenType {
        IDENTIFIER,
        NUMBER,
        STRING,
        LITERAL,
        LPAREN,
        RPAREN
    }

    @Override
    public String toString() {
        return type == TokenType.LITERAL ? "'" + text + "'" : type + "(" + text + ")";
    }
}
