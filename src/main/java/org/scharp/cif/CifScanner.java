///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.cif;

import java.util.ArrayDeque;
import java.util.Deque;

import static org.scharp.cif.CifCharacters.EOF;
import static org.scharp.cif.CifCharacters.describe;
import static org.scharp.cif.CifCharacters.isDigit;
import static org.scharp.cif.CifCharacters.isNewline;
import static org.scharp.cif.CifCharacters.isNonBlankChar;
import static org.scharp.cif.CifCharacters.isOrdinaryChar;
import static org.scharp.cif.CifCharacters.isPrintChar;
import static org.scharp.cif.CifCharacters.isWhiteSpace;

/**
 * A tokenizer for CIF 1.1 text.
 * <p>
 * The scanner is a pushdown automaton.  It has a current {@link State} and a stack of states to resume once a
 * sub-scan completes.  For example, after a data tag is read, the scanner pushes the state that reads the tag's value
 * and the state that emits the tag, then scans the tag's characters.  When the characters run out, the "emit tag" state
 * is popped, which in turn hands control to the value state.  This lets the same value-scanning states serve single
 * items, loop bodies, and save frames.
 * </p>
 * <p>
 * Each step of the automaton either consumes input, halts, or moves to a state that does.  A step emits at most one
 * token.  {@link #nextToken()} runs steps until a token is available.
 * </p>
 * <p>
 * The first problem halts the scanner with an {@link TokenType#ERROR} token.  There is no attempt to resynchronize, so
 * every subsequent call to {@code nextToken()} returns the same error.
 * </p>
 */
final class CifScanner {

    private static final char TAG_PREFIX = '_';
    private static final char COMMENT_START = '#';

    private enum State {
        INITIAL,
        VERSION,
        VERSION_END,
        TOP_LEVEL,
        DATA_BLOCK_HEADING,
        BLOCK_BODY,
        SAVE_FRAME_HEADING,
        FIRST_SAVE_FRAME_ITEM,
        SAVE_FRAME_BODY,
        DATA_ITEM,
        DATA_TAG,
        LOOP_START,
        LOOP_FIRST_TAG,
        LOOP_TAGS,
        LOOP_FIRST_VALUE,
        LOOP_VALUES,
        VALUE,
        VALUE_END,
        SIGNED_NUMBER,
        INTEGER_DIGITS,
        LEADING_DECIMAL_POINT,
        FRACTION_DIGITS,
        EXPONENT_SIGN,
        EXPONENT_FIRST_DIGIT,
        EXPONENT_DIGITS,
        UNQUOTED_END,
        SINGLE_QUOTED,
        DOUBLE_QUOTED,
        TEXT_FIELD_FIRST_LINE,
        TEXT_FIELD,
        NON_BLANK_RUN_FIRST,
        NON_BLANK_RUN,
        PRINTABLE_RUN,
        WHITE_SPACE,
        WHITE_SPACE_CONTINUE,
        SPACE_OR_EOF,
        COMMENT,
    }

    private final String input;
    private final Deque<State> stack;

    private int start;
    private int position;
    private int line;

    private State state;
    private Token emitted;
    private Token finalToken;

    /**
     * Creates a scanner over the complete text of a CIF.
     *
     * @param input
     *     The text to scan.  Carriage return/line feed pairs and lone carriage returns are each treated as a single
     *     newline.
     */
    CifScanner(String input) {
        assert input != null : "input must not be null";
        this.input = input.replace("\r\n", "\n").replace('\r', '\n');
        stack = new ArrayDeque<>();
        start = 0;
        position = 0;
        line = 1;
        state = State.INITIAL;
        emitted = null;
        finalToken = null;
    }

    /**
     * Gets the next token from the input.
     *
     * @return The next token.  After the input has been exhausted, this is always {@link TokenType#END_OF_INPUT}.
     *     After a scan error, this is always the same {@link TokenType#ERROR} token.
     */
    Token nextToken() {
        while (emitted == null && state != null) {
            state = step(state);
        }

        if (emitted == null) {
            // The scanner halted on an earlier call.
            return finalToken;
        }

        Token token = emitted;
        emitted = null;
        if (state == null) {
            finalToken = token;
        }
        return token;
    }

    //
    // Input handling
    //

    private int next() {
        if (input.length() <= position) {
            return EOF;
        }
        char c = input.charAt(position);
        if (c == '\n') {
            line++;
        }
        position++;
        return c;
    }

    /** Steps back one character. This must only be invoked after {@link #next()} returned a character other than EOF. */
    private void backup() {
        assert 0 < position : "backed up past the start of the input";
        position--;
        if (input.charAt(position) == '\n') {
            line--;
        }
    }

    private int peek() {
        return position < input.length() ? input.charAt(position) : EOF;
    }

    private int peek(int offset) {
        int index = position + offset;
        return index < input.length() ? input.charAt(index) : EOF;
    }

    /** Gets the character immediately before the current position, treating the start of input as a newline. */
    private int previous() {
        return position == 0 ? '\n' : input.charAt(position - 1);
    }

    /** Determines if the input at the current position starts with {@code word}, ignoring case. */
    private boolean aheadMatch(String word) {
        return input.regionMatches(true, position, word, 0, word.length());
    }

    private void skip(int count) {
        for (int i = 0; i < count; i++) {
            next();
        }
    }

    /** Discards the pending input. */
    private void ignore() {
        start = position;
    }

    private String current() {
        return input.substring(start, position);
    }

    //
    // Stack and token handling
    //

    private void push(State continuation) {
        stack.push(continuation);
    }

    private State pop() {
        State continuation = stack.poll();
        if (continuation == null) {
            return error("BUG in scanner: no states to pop.");
        }
        return continuation;
    }

    private void emit(TokenType type) {
        assert emitted == null : "a state may only emit a single token";
        emitted = new Token(type, current(), line);
        start = position;
    }

    private State stop() {
        ignore();
        emit(TokenType.END_OF_INPUT);
        return null;
    }

    private State error(String format, Object... arguments) {
        assert emitted == null : "a state may only emit a single token";
        emitted = new Token(TokenType.ERROR, String.format(format, arguments), line);
        return null;
    }

    /** Requires at least one whitespace character, skips any whitespace and comments after it, then resumes. */
    private State whiteSpaceThen(State continuation) {
        push(continuation);
        return State.WHITE_SPACE;
    }

    /** Requires whitespace or the end of input, without consuming anything, then resumes. */
    private State spaceOrEofThen(State continuation) {
        push(continuation);
        return State.SPACE_OR_EOF;
    }

    /** Falls back to reading the pending characters as the start of an unquoted string. */
    private State unquotedString() {
        push(State.UNQUOTED_END);
        return State.NON_BLANK_RUN;
    }

    private static boolean isSpaceOrEof(int c) {
        return c == EOF || isWhiteSpace(c);
    }

    /**
     * Reports an error if a reserved word that is never legal appears at the current position.
     *
     * @return The error state, or {@code null} if the input doesn't start with an unsupported reserved word.
     */
    private State checkUnsupportedReservedWords() {
        if (aheadMatch("global_")) {
            return error("global_ is not supported in the CIF format.");
        }
        if (aheadMatch("stop_")) {
            return error("stop_ is not supported in the CIF format.");
        }
        return null;
    }

    //
    // The state machine
    //

    private State step(State current) {
        switch (current) {
        case INITIAL:
            return scanInitial();
        case VERSION:
            return scanVersion();
        case VERSION_END:
            emit(TokenType.VERSION);
            push(State.TOP_LEVEL);
            return State.COMMENT;
        case TOP_LEVEL:
            return scanTopLevel();
        case DATA_BLOCK_HEADING:
            emit(TokenType.DATA_BLOCK_START);
            return spaceOrEofThen(State.BLOCK_BODY);
        case BLOCK_BODY:
            return scanBlockBody();
        case SAVE_FRAME_HEADING:
            emit(TokenType.SAVE_FRAME_START);
            return whiteSpaceThen(State.FIRST_SAVE_FRAME_ITEM);
        case FIRST_SAVE_FRAME_ITEM:
            return scanFirstSaveFrameItem();
        case SAVE_FRAME_BODY:
            return scanSaveFrameBody();
        case DATA_ITEM:
            return scanDataItem();
        case DATA_TAG:
            emit(TokenType.DATA_TAG);
            return whiteSpaceThen(pop());
        case LOOP_START:
            return whiteSpaceThen(State.LOOP_FIRST_TAG);
        case LOOP_FIRST_TAG:
            return scanLoopFirstTag();
        case LOOP_TAGS:
            return scanLoopTags();
        case LOOP_FIRST_VALUE:
            push(State.LOOP_VALUES);
            return State.VALUE;
        case LOOP_VALUES:
            return scanLoopValues();
        case VALUE:
            return scanValue();
        case VALUE_END:
            return whiteSpaceThen(pop());
        case SIGNED_NUMBER:
            return scanSignedNumber();
        case INTEGER_DIGITS:
            return scanIntegerDigits();
        case LEADING_DECIMAL_POINT:
            return scanLeadingDecimalPoint();
        case FRACTION_DIGITS:
            return scanFractionDigits();
        case EXPONENT_SIGN:
            return scanExponentSign();
        case EXPONENT_FIRST_DIGIT:
            return scanExponentFirstDigit();
        case EXPONENT_DIGITS:
            return scanExponentDigits();
        case UNQUOTED_END:
            return scanUnquotedEnd();
        case SINGLE_QUOTED:
            return scanQuoted('\'');
        case DOUBLE_QUOTED:
            return scanQuoted('"');
        case TEXT_FIELD_FIRST_LINE:
            push(State.TEXT_FIELD);
            return State.PRINTABLE_RUN;
        case TEXT_FIELD:
            return scanTextField();
        case NON_BLANK_RUN_FIRST:
            return scanNonBlankRunFirst();
        case NON_BLANK_RUN:
            return scanRun(false);
        case PRINTABLE_RUN:
            return scanRun(true);
        case WHITE_SPACE:
            return scanWhiteSpace();
        case WHITE_SPACE_CONTINUE:
            return scanWhiteSpaceContinue();
        case SPACE_OR_EOF:
            return scanSpaceOrEof();
        case COMMENT:
            return scanComment();
        default:
            throw new IllegalStateException("unknown scanner state " + current);
        }
    }

    private State scanInitial() {
        if (input.startsWith("#\\#CIF_")) {
            // Drop the "#\#" so that the version's text is "CIF_x.y".
            skip(3);
            ignore();
            return State.VERSION;
        }
        return State.TOP_LEVEL;
    }

    private State scanVersion() {
        push(State.VERSION_END);
        return State.NON_BLANK_RUN_FIRST;
    }

    /** Consumes everything before the first data block heading, which may only be whitespace and comments. */
    private State scanTopLevel() {
        int c = peek();
        if (c == EOF) {
            return stop();
        }
        if (c == COMMENT_START || isWhiteSpace(c)) {
            push(State.TOP_LEVEL);
            ignore();
            return State.WHITE_SPACE_CONTINUE;
        }
        if (aheadMatch("data_")) {
            skip(5);
            ignore();
            push(State.DATA_BLOCK_HEADING);
            return State.NON_BLANK_RUN_FIRST;
        }
        State reservedWordError = checkUnsupportedReservedWords();
        if (reservedWordError != null) {
            return reservedWordError;
        }
        return error("Expected comments, whitespace or a data block heading, but got '%s' instead.", describe(c));
    }

    /**
     * Looks for the next data block heading, a save frame heading, or a data item within a data block.  This assumes
     * that the whitespace which must separate these has already been verified.
     */
    private State scanBlockBody() {
        int c = peek();
        if (isWhiteSpace(c)) {
            return whiteSpaceThen(State.BLOCK_BODY);
        }
        if (c == EOF) {
            return stop();
        }

        State reservedWordError = checkUnsupportedReservedWords();
        if (reservedWordError != null) {
            return reservedWordError;
        }

        if (aheadMatch("data_")) {
            skip(5);
            ignore();
            push(State.DATA_BLOCK_HEADING);
            return State.NON_BLANK_RUN_FIRST;
        }
        if (aheadMatch("save_")) {
            skip(5);
            ignore();
            push(State.SAVE_FRAME_HEADING);
            return State.NON_BLANK_RUN_FIRST;
        }
        push(State.BLOCK_BODY);
        return State.DATA_ITEM;
    }

    private State scanFirstSaveFrameItem() {
        if (aheadMatch("save_")) {
            return error("A save frame must contain at least one data item.");
        }
        push(State.SAVE_FRAME_BODY);
        return State.DATA_ITEM;
    }

    /** Consumes the next data item in a save frame or the "save_" that ends it. */
    private State scanSaveFrameBody() {
        if (aheadMatch("save_")) {
            if (isNonBlankChar(peek(5))) {
                return error("Save frames cannot be nested; expected a bare 'save_' to end the current save frame.");
            }
            emit(TokenType.SAVE_FRAME_END);
            skip(5);
            ignore();
            return spaceOrEofThen(State.BLOCK_BODY);
        }
        if (peek() == TAG_PREFIX || aheadMatch("loop_")) {
            push(State.SAVE_FRAME_BODY);
            return State.DATA_ITEM;
        }

        State reservedWordError = checkUnsupportedReservedWords();
        if (reservedWordError != null) {
            return reservedWordError;
        }
        if (aheadMatch("data_")) {
            return error("Expected 'save_' to end the save frame before the next data block heading.");
        }
        return error("Expected either a data item or the end of a save frame, but got '%s' instead.",
            describe(peek()));
    }

    /** Consumes a single data item: either a tag and its value or a complete loop. */
    private State scanDataItem() {
        if (aheadMatch("loop_")) {
            ignore();
            skip(5);
            emit(TokenType.LOOP);
            return State.LOOP_START;
        }

        int c = next();
        if (c != TAG_PREFIX) {
            return error("Expected data item name starting with '%s' but got '%s' instead. (Strings with spaces " +
                "must be quoted and all data names must begin with an underscore.)", TAG_PREFIX, describe(c));
        }
        ignore();
        push(State.VALUE);
        push(State.DATA_TAG);
        return State.NON_BLANK_RUN_FIRST;
    }

    private State scanLoopFirstTag() {
        int c = next();
        if (c != TAG_PREFIX) {
            return error("Every 'loop_' section must have at least one data tag defined (starting with a '%s'), " +
                "but found '%s' instead.", TAG_PREFIX, describe(c));
        }
        ignore();
        push(State.LOOP_TAGS);
        push(State.DATA_TAG);
        return State.NON_BLANK_RUN_FIRST;
    }

    /** Consumes another data tag in a loop header, otherwise starts consuming the loop's values. */
    private State scanLoopTags() {
        if (peek() == TAG_PREFIX) {
            next();
            ignore();
            push(State.LOOP_TAGS);
            push(State.DATA_TAG);
            return State.NON_BLANK_RUN_FIRST;
        }
        return State.LOOP_FIRST_VALUE;
    }

    /**
     * Consumes the next value in a loop body.  The values end at the next tag, at a heading, at another loop, or at
     * the end of input.
     */
    private State scanLoopValues() {
        int c = peek();
        if (c == EOF) {
            return stop();
        }
        if (c == TAG_PREFIX) {
            return pop();
        }
        if (aheadMatch("data_") || aheadMatch("save_") || aheadMatch("loop_") || aheadMatch("global_") ||
            aheadMatch("stop_")) {
            return pop();
        }
        push(State.LOOP_VALUES);
        return State.VALUE;
    }

    /** Consumes any kind of value: omitted, missing, numeric, quoted, text field, or unquoted. */
    private State scanValue() {
        // A ';' only starts a text field at the beginning of a line.
        final boolean atStartOfLine = isNewline(previous());

        for (String reservedWord : new String[] { "data_", "save_" }) {
            if (aheadMatch(reservedWord)) {
                return error("%s cannot be used in the beginning of an unquoted value.", reservedWord);
            }
        }

        int c = next();
        if (c == '.' && isSpaceOrEof(peek())) {
            emit(TokenType.OMITTED);
            return spaceOrEofThen(State.VALUE_END);
        }
        if (c == '?' && isSpaceOrEof(peek())) {
            emit(TokenType.MISSING);
            return spaceOrEofThen(State.VALUE_END);
        }
        if (c == '+' || c == '-') {
            return State.SIGNED_NUMBER;
        }
        if (isDigit(c)) {
            return State.INTEGER_DIGITS;
        }
        if (c == '.') {
            return State.LEADING_DECIMAL_POINT;
        }
        if (c == '\'') {
            ignore();
            return State.SINGLE_QUOTED;
        }
        if (c == '"') {
            ignore();
            return State.DOUBLE_QUOTED;
        }
        if (c == ';' && atStartOfLine) {
            ignore();
            return State.TEXT_FIELD_FIRST_LINE;
        }
        if (isOrdinaryChar(c) || c == ';') {
            return unquotedString();
        }
        return error("Expected a value ('.', '?', numeric or string), but got '%s'.", describe(c));
    }

    // The numeric states accept [+-]?([0-9]+(\.[0-9]*)?|\.[0-9]+)([eE][+-]?[0-9]+)?
    // Anything that stops matching before whitespace is read as an unquoted string instead.

    private State scanSignedNumber() {
        int c = peek();
        if (isDigit(c)) {
            next();
            return State.INTEGER_DIGITS;
        }
        if (c == '.') {
            next();
            return State.LEADING_DECIMAL_POINT;
        }
        return unquotedString();
    }

    private State scanIntegerDigits() {
        while (isDigit(peek())) {
            next();
        }
        int c = peek();
        if (c == '.') {
            next();
            return State.FRACTION_DIGITS;
        }
        if (c == 'e' || c == 'E') {
            next();
            return State.EXPONENT_SIGN;
        }
        if (isSpaceOrEof(c)) {
            emit(TokenType.INTEGER);
            return spaceOrEofThen(State.VALUE_END);
        }
        return unquotedString();
    }

    private State scanLeadingDecimalPoint() {
        if (isDigit(peek())) {
            next();
            return State.FRACTION_DIGITS;
        }
        return unquotedString();
    }

    private State scanFractionDigits() {
        while (isDigit(peek())) {
            next();
        }
        int c = peek();
        if (c == 'e' || c == 'E') {
            next();
            return State.EXPONENT_SIGN;
        }
        if (isSpaceOrEof(c)) {
            emit(TokenType.FLOAT);
            return spaceOrEofThen(State.VALUE_END);
        }
        return unquotedString();
    }

    private State scanExponentSign() {
        int c = peek();
        if (c == '+' || c == '-') {
            next();
            return State.EXPONENT_FIRST_DIGIT;
        }
        return scanExponentFirstDigit();
    }

    private State scanExponentFirstDigit() {
        if (isDigit(peek())) {
            next();
            return State.EXPONENT_DIGITS;
        }
        return unquotedString();
    }

    private State scanExponentDigits() {
        while (isDigit(peek())) {
            next();
        }
        if (isSpaceOrEof(peek())) {
            emit(TokenType.FLOAT);
            return spaceOrEofThen(State.VALUE_END);
        }
        return unquotedString();
    }

    /** Emits an unquoted string after rejecting the reserved words that can't be values. */
    private State scanUnquotedEnd() {
        String text = current();
        for (String reservedWord : new String[] { "loop_", "stop_", "global_" }) {
            if (reservedWord.equalsIgnoreCase(text)) {
                return error("%s cannot be used as an unquoted string value.", reservedWord);
            }
        }
        emit(TokenType.STRING);
        return spaceOrEofThen(State.VALUE_END);
    }

    /**
     * Consumes the rest of a quoted string.  The string only ends at a matching quote that is followed by whitespace,
     * so values like {@code 'andrew's pet'} are legal.
     */
    private State scanQuoted(char quote) {
        while (true) {
            int c = next();
            if (c == EOF) {
                return error("Expected end of quoted string, but got EOF.");
            }
            if (isNewline(c)) {
                // Report the line on which the string started.
                backup();
                return error("Quoted strings may not contain new lines.");
            }
            if (!isPrintChar(c)) {
                return error("The character '%s' is not allowed in a quoted string.", describe(c));
            }
            if (c == quote && isSpaceOrEof(peek())) {
                backup();
                emit(TokenType.STRING);
                next();
                ignore();
                return spaceOrEofThen(State.VALUE_END);
            }
        }
    }

    /**
     * Consumes a text field up to its terminating line.  This assumes that the first line has already been consumed
     * and that the current position is at the end of a line.
     */
    private State scanTextField() {
        if (isNewline(peek()) && peek(1) == ';') {
            // The terminating ";" is not part of the value, and neither is the newline before it.
            emit(TokenType.STRING);
            skip(2);
            ignore();
            return spaceOrEofThen(State.VALUE_END);
        }

        int c = next();
        if (c == EOF || (isNewline(c) && peek() == EOF)) {
            return error("Expected a semicolon terminator, but got EOF.");
        }
        if (!isNewline(c)) {
            return error("The character '%s' is not allowed in a text field.", describe(c));
        }

        // Consume the next line.  It can't begin with ';', as that was handled above.
        push(State.TEXT_FIELD);
        return State.PRINTABLE_RUN;
    }

    private State scanNonBlankRunFirst() {
        int c = next();
        if (!isNonBlankChar(c)) {
            return error("Expected at least one character, but got '%s' instead.", describe(c));
        }
        return State.NON_BLANK_RUN;
    }

    /** Consumes zero or more characters of a class, then resumes the caller. */
    private State scanRun(boolean printable) {
        while (true) {
            int c = peek();
            boolean matches = printable ? isPrintChar(c) : isNonBlankChar(c);
            if (!matches) {
                return pop();
            }
            next();
        }
    }

    private State scanWhiteSpace() {
        int c = next();
        if (!isWhiteSpace(c)) {
            return error("Expected white space, but got '%s' instead.", describe(c));
        }
        return State.WHITE_SPACE_CONTINUE;
    }

    /** Consumes zero or more whitespace characters and comments, then resumes the caller. */
    private State scanWhiteSpaceContinue() {
        while (true) {
            int c = peek();
            if (c == COMMENT_START) {
                next();
                ignore();
                return State.COMMENT;
            }
            if (!isWhiteSpace(c)) {
                ignore();
                return pop();
            }
            next();
        }
    }

    /** Makes sure that the next character is whitespace or the end of input without consuming it. */
    private State scanSpaceOrEof() {
        int c = peek();
        if (c == EOF) {
            return stop();
        }
        if (!isWhiteSpace(c)) {
            return error("Expected whitespace or EOF, but got '%s' instead.", describe(c));
        }
        return pop();
    }

    /** Consumes a comment up to, but not including, the end of the line. */
    private State scanComment() {
        while (true) {
            int c = peek();
            if (c == EOF || isNewline(c)) {
                emit(TokenType.COMMENT);
                return State.WHITE_SPACE_CONTINUE;
            }
            next();
        }
    }
}
