package org.scharp.cif;

/**
 * A token that was produced by {@link CifScanner}.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
final class Token {
    private final TokenType type;
    private final String text;
    private final int line;

    Token(TokenType type, String text, int line) {
        assert type != null : "type must not be null";
        assert text != null : "text must not be null";
        this.type = type;
        this.text = text;
        this.line = line;
    }

    TokenType type() {
        return type;
    }

    /**
     * Gets the token's payload: a name, a tag, the raw text of a value, or an error message.
     *
     * @return The token's text. This is never {@code null}.
     */
    String text() {
        return text;
    }

    /**
     * Gets the 1-based line number on which the scanner was positioned when this token was produced.
     *
     * @return The line number.
     */
    int line() {
        return line;
    }

    @Override
    public String toString() {
        return type + "(" + text + ") at line " + line;
    }
}
