package com.abt.mixfix.parser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abt.mixfix.exception.NoParseException;
import com.abt.mixfix.parser.Token.TokenType;

/**
 * Tokenizer for mixfix source text.
 *
 * Identifiers, numbers and declared literal spellings are all matched
 * greedily. When a literal and an identifier or number match at the same
 * position, the literal wins unless the other match is strictly longer, so
 * {@code forall} is a keyword but {@code forallx} is an identifier.
 * Numbers may carry a leading minus unless a declared literal claims it.
 */
public class Tokenizer {
    private static final Logger log = LoggerFactory.getLogger(Tokenizer.class);

    private final String source;
    private final Collection<String> literals;
    private final char openBracket;
    private final char closeBracket;
    private int pos = 0;

    public Tokenizer(String source, Collection<String> literals, char openBracket, char closeBracket) {
        this.source = source;
        this.literals = literals;
        this.openBracket = openBracket;
        this.closeBracket = closeBracket;
    }

    /**
     * Tokenize the entire source text.
     *
     * @throws NoParseException on a character no token can start with, or
     *         an unterminated string
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == openBracket) {
                tokens.add(new Token(TokenType.LPAREN, String.valueOf(c), pos++));
            } else if (c == closeBracket) {
                tokens.add(new Token(TokenType.RPAREN, String.valueOf(c), pos++));
            } else if (c == '"') {
                tokens.add(readStringLiteral());
            } else {
                tokens.add(readWord());
            }
        }

        log.trace("Tokenized '{}' into {}", source, tokens);
        return tokens;
    }

    private Token readWord() {
        int start = pos;
        int identifierLength = identifierLength(start);
        String literal = longestLiteral(start);
        int numberLength = literal == null ? signedNumberLength(start) : numberLength(start);
        int literalLength = literal == null ? 0 : literal.length();

        if (literalLength > 0 && literalLength >= identifierLength && literalLength >= numberLength) {
            pos += literalLength;
            return new Token(TokenType.LITERAL, literal, start);
        }
        if (identifierLength > 0) {
            pos += identifierLength;
            return new Token(TokenType.IDENTIFIER, source.substring(start, pos), start);
        }
        if (numberLength > 0) {
            pos += numberLength;
            return new Token(TokenType.NUMBER, source.substring(start, pos), start);
        }
        throw new NoParseException(source, "unexpected character '" + source.charAt(start) + "' at offset " + start);
    }

    private String longestLiteral(int start) {
        String best = null;
        for (String literal : literals) {
            if (source.startsWith(literal, start) && (best == null || literal.length() > best.length())) {
                best = literal;
            }
        }
        return best;
    }

    private int identifierLength(int start) {
        int end = start;
        if (end < source.length() && isIdentifierStart(source.charAt(end))) {
            end++;
            while (end < source.length() && isIdentifierPart(source.charAt(end))) {
                end++;
            }
        }
        return end - start;
    }

    /**
     * A leading minus belongs to the number only when no declared literal
     * starts at the same position, so {@code ->} and {@code -} keep working
     * as operators.
     */
    private int signedNumberLength(int start) {
        if (source.charAt(start) == '-' && start + 1 < source.length() && isDigit(source.charAt(start + 1))) {
            return 1 + numberLength(start + 1);
        }
        return numberLength(start);
    }

    private int numberLength(int start) {
        int end = skipDigits(start);
        if (end == start) {
            return 0;
        }
        // fraction only when a digit follows the point, so "x.1" stays separable
        if (end + 1 < source.length() && source.charAt(end) == '.' && isDigit(source.charAt(end + 1))) {
            end = skipDigits(end + 1);
        }
        if (end < source.length() && (source.charAt(end) == 'e' || source.charAt(end) == 'E')) {
            int exponent = end + 1;
            if (exponent < source.length() && (source.charAt(exponent) == '+' || source.charAt(exponent) == '-')) {
                exponent++;
            }
            int exponentEnd = skipDigits(exponent);
            if (exponentEnd > exponent) {
                end = exponentEnd;
            }
        }
        return end - start;
    }

    private int skipDigits(int from) {
        int end = from;
        while (end < source.length() && isDigit(source.charAt(end))) {
            end++;
        }
        return end;
    }

    private Token readStringLiteral() {
        int start = pos;
        StringBuilder sb = new StringBuilder();
        pos++; // Skip opening quote

        while (pos < source.length()) {
            char c = source.charAt(pos++);

            if (c == '"') {
                return new Token(TokenType.STRING, sb.toString(), start);
            }
            if (c == '\\' && pos < source.length()) {
                char escaped = source.charAt(pos++);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }

        throw new NoParseException(source, "unterminated string starting at offset " + start);
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
