package com.abt.mixfix.parser;

/**
 * Checks that one text is obtainable from another purely by deleting
 * bracket characters, ignoring whitespace on both sides.
 */
public final class CanonicalReduction {

    private CanonicalReduction() {
        // Utility class
    }

    /**
     * True when {@code canonical} is {@code input} with zero or more bracket
     * characters removed and nothing else changed.
     */
    public static boolean reducesTo(String input, String canonical, char openBracket, char closeBracket) {
        String s = removeWhitespace(input);
        String t = removeWhitespace(canonical);

        int i = 0;
        for (int j = 0; j < t.length(); j++) {
            while (i < s.length() && s.charAt(i) != t.charAt(j) && isBracket(s.charAt(i), openBracket, closeBracket)) {
                i++;
            }
            if (i == s.length() || s.charAt(i) != t.charAt(j)) {
                return false;
            }
            i++;
        }
        for (; i < s.length(); i++) {
            if (!isBracket(s.charAt(i), openBracket, closeBracket)) {
                return false;
            }
        }
        return true;
    }

    public static String removeWhitespace(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean isBracket(char c, char openBracket, char closeBracket) {
        return c == openBracket || c == closeBracket;
    }
}
