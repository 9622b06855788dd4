package de.mirkosertic.mediashrink.encoder;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a free-form argument string the way a POSIX shell would, without expansion.
 * Single quotes are literal, double quotes allow backslash escapes.
 */
public final class ArgumentTokenizer {

    private ArgumentTokenizer() {
    }

    /**
     * @throws IllegalArgumentException on an unterminated quote or a trailing backslash
     */
    public static List<String> tokenize(final String input) {
        final List<String> tokens = new ArrayList<>();
        if (input == null || input.isBlank()) {
            return tokens;
        }

        final StringBuilder current = new StringBuilder();
        boolean inToken = false;
        char quote = 0;

        for (int i = 0; i < input.length(); i++) {
            final char c = input.charAt(i);
            if (quote == '\'') {
                if (c == '\'') {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '\\' && quote != '\'') {
                if (i + 1 >= input.length()) {
                    throw new IllegalArgumentException("trailing backslash");
                }
                current.append(input.charAt(++i));
                inToken = true;
            } else if (quote == '"') {
                if (c == '"') {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }

        if (quote != 0) {
            throw new IllegalArgumentException("unterminated " + (quote == '"' ? "double" : "single") + " quote");
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
