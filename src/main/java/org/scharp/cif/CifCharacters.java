///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.cif;

/**
 * The character classes of the CIF 1.1 grammar.
 * <p>
 * CIF 1.1 is restricted to printable ASCII plus blanks, so every class is a subset of ASCII.  Each class is a superset
 * of the one before it:
 * </p>
 * <ol>
 * <li><b>ordinary</b>: letters, digits, and the punctuation that may start an unquoted value.</li>
 * <li><b>non-blank</b>: ordinary plus {@code " # $ ' _ ; [ ]}, the characters that may appear in names, tags, and the
 * rest of an unquoted value.</li>
 * <li><b>printable</b>: non-blank plus space and tab, the characters that may appear in quoted strings and text
 * fields.</li>
 * </ol>
 */
final class CifCharacters {

    /** The value that the scanner uses to represent the end of the input. */
    static final int EOF = -1;

    // private constructor to prevent anyone from instantiating the class.
    private CifCharacters() {
    }

    static boolean isOrdinaryChar(int c) {
        if (('A' <= c && c <= 'Z') || ('a' <= c && c <= 'z') || ('0' <= c && c <= '9')) {
            return true;
        }
        switch (c) {
        case '!':
        case '%':
        case '&':
        case '(':
        case ')':
        case '*':
        case '+':
        case ',':
        case '-':
        case '.':
        case '/':
        case ':':
        case '<':
        case '=':
        case '>':
        case '?':
        case '@':
        case '\\':
        case '^':
        case '`':
        case '{':
        case '|':
        case '}':
        case '~':
            return true;
        default:
            return false;
        }
    }

    static boolean isNonBlankChar(int c) {
        switch (c) {
        case '"':
        case '#':
        case '$':
        case '\'':
        case '_':
        case ';':
        case '[':
        case ']':
            return true;
        default:
            return isOrdinaryChar(c);
        }
    }

    static boolean isPrintChar(int c) {
        return c == ' ' || c == '\t' || isNonBlankChar(c);
    }

    static boolean isNewline(int c) {
        return c == '\n' || c == '\r';
    }

    static boolean isWhiteSpace(int c) {
        return c == ' ' || c == '\t' || isNewline(c);
    }

    static boolean isDigit(int c) {
        return '0' <= c && c <= '9';
    }

    /**
     * Renders a character for an error message.  Newlines and the end of input are spelled out so that the message
     * stays on one line.
     *
     * @param c
     *     The character to render, or {@link #EOF}.
     *
     * @return A printable rendering of {@code c}.
     */
    static String describe(int c) {
        switch (c) {
        case EOF:
            return "EOF";
        case '\n':
            return "\\n";
        case '\r':
            return "\\r";
        case '\t':
            return "\\t";
        default:
            if (c < ' ' || c == 0x7F) {
                return String.format("\\u%04X", c);
            }
            return String.valueOf((char) c);
        }
    }
}
