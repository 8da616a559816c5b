///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.cif;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A recursive descent parser that builds a {@link CifDocument} from the tokens of a {@link CifScanner}.
 * <p>
 * The scanner enforces the lexical rules.  This class enforces the rules that need memory: unique names, loop shape,
 * and the type of each loop column.
 * </p>
 */
final class CifParser {
    private final CifScanner scanner;
    private final NumericPlaceholderMode placeholderMode;

    /** The lookahead token.  This is never a comment. */
    private Token token;

    CifParser(CifScanner scanner, NumericPlaceholderMode placeholderMode) {
        assert scanner != null : "scanner must not be null";
        assert placeholderMode != null : "placeholderMode must not be null";
        this.scanner = scanner;
        this.placeholderMode = placeholderMode;
    }

    /**
     * Parses the complete input.
     *
     * @return The document.
     *
     * @throws CifParseException
     *     if the input is not a well-formed CIF.
     */
    CifDocument parse() throws CifParseException {
        CifDocument.Builder documentBuilder = CifDocument.builder();

        advance();
        if (token.type() == TokenType.VERSION) {
            documentBuilder.version(token.text());
            advance();
        }

        while (token.type() != TokenType.END_OF_INPUT) {
            if (token.type() != TokenType.DATA_BLOCK_START) {
                throw error("Expected comments, whitespace or a data block heading, but got '%s' instead.",
                    describe(token));
            }
            documentBuilder.dataBlock(parseDataBlock(documentBuilder));
        }

        return documentBuilder.build();
    }

    /** Moves to the next token that isn't a comment. */
    private void advance() throws CifParseException {
        do {
            token = scanner.nextToken();
        } while (token.type() == TokenType.COMMENT);

        if (token.type() == TokenType.ERROR) {
            throw new CifParseException(token.line(), token.text());
        }
    }

    private CifParseException error(String format, Object... arguments) {
        return new CifParseException(token.line(), String.format(format, arguments));
    }

    private static String describe(Token token) {
        switch (token.type()) {
        case END_OF_INPUT:
            return "EOF";
        case DATA_BLOCK_START:
            return "data_" + token.text();
        case SAVE_FRAME_START:
            return "save_" + token.text();
        case SAVE_FRAME_END:
            return "save_";
        case DATA_TAG:
            return "_" + token.text();
        default:
            return token.text();
        }
    }

    private DataBlock parseDataBlock(CifDocument.Builder documentBuilder) throws CifParseException {
        String name = token.text().toLowerCase(Locale.ROOT);
        if (documentBuilder.containsDataBlock(name)) {
            throw error("Data block with name '%s' already exists.", name);
        }
        DataBlock.Builder blockBuilder = DataBlock.builder().name(name);
        advance();

        while (true) {
            switch (token.type()) {
            case END_OF_INPUT:
            case DATA_BLOCK_START:
                return blockBuilder.build();

            case SAVE_FRAME_START:
                blockBuilder.saveFrame(parseSaveFrame(blockBuilder, name));
                break;

            case LOOP:
                parseLoop(blockBuilder, name);
                break;

            case DATA_TAG:
                parseItem(blockBuilder, name);
                break;

            default:
                throw error("Expected a data item, a save frame or a data block heading, but got '%s' instead.",
                    describe(token));
            }
        }
    }

    private SaveFrame parseSaveFrame(DataBlock.Builder blockBuilder, String blockName) throws CifParseException {
        String name = token.text().toLowerCase(Locale.ROOT);
        if (blockBuilder.containsSaveFrame(name)) {
            throw error("Save frame with name '%s' already exists in data block '%s'.", name, blockName);
        }
        SaveFrame.Builder frameBuilder = SaveFrame.builder().name(name);
        advance();

        while (true) {
            switch (token.type()) {
            case SAVE_FRAME_END:
                advance();
                return frameBuilder.build();

            case LOOP:
                parseLoop(frameBuilder, name);
                break;

            case DATA_TAG:
                parseItem(frameBuilder, name);
                break;

            default:
                throw error("Expected a data item or end of save frame delimiter, but got '%s' instead.",
                    describe(token));
            }
        }
    }

    private String parseTag(Block.Builder<?> builder, List<String> loopTags, String blockName)
        throws CifParseException {
        String tag = token.text().toLowerCase(Locale.ROOT);
        if (builder.containsTag(tag) || loopTags.contains(tag)) {
            throw error("Data item with name '%s' already exists in block '%s'.", tag, blockName);
        }
        advance();
        return tag;
    }

    private void parseItem(Block.Builder<?> builder, String blockName) throws CifParseException {
        String tag = parseTag(builder, List.of(), blockName);
        if (!token.type().isValue()) {
            throw error("Expected value for data tag '%s' in block '%s', but got '%s' instead.", tag, blockName,
                describe(token));
        }
        builder.item(tag, toValue(token));
        advance();
    }

    private void parseLoop(Block.Builder<?> builder, String blockName) throws CifParseException {
        final int loopLine = token.line();
        advance();

        List<String> tags = new ArrayList<>();
        while (token.type() == TokenType.DATA_TAG) {
            tags.add(parseTag(builder, tags, blockName));
        }
        if (tags.isEmpty()) {
            throw error("After 'loop_' declaration, there must be at least one data tag, but found '%s' instead.",
                describe(token));
        }

        List<Token> cells = new ArrayList<>();
        while (token.type().isValue()) {
            cells.add(token);
            advance();
        }
        if (cells.isEmpty()) {
            throw error("A 'loop_' must have at least one data tag and at least one value, but found '%s' instead " +
                "of a value.", describe(token));
        }

        final int columnCount = tags.size();
        if (cells.size() % columnCount != 0) {
            throw new CifParseException(loopLine, String.format(
                "There are %d values in loop (starting on line %d), which is not a multiple of the number of " +
                    "columns in the loop (%d).", cells.size(), loopLine, columnCount));
        }

        // The cells are given row by row; split them into columns.
        final int rowCount = cells.size() / columnCount;
        Loop.Builder loopBuilder = Loop.builder();
        for (int column = 0; column < columnCount; column++) {
            List<Token> columnCells = new ArrayList<>(rowCount);
            for (int row = 0; row < rowCount; row++) {
                columnCells.add(cells.get(row * columnCount + column));
            }
            loopBuilder.column(tags.get(column), toColumn(columnCells));
        }
        builder.loop(loopBuilder.build());
    }

    private static Value toValue(Token valueToken) throws CifParseException {
        switch (valueToken.type()) {
        case INTEGER:
            return Value.of(parseInteger(valueToken));
        case FLOAT:
            return Value.of(parseFloat(valueToken));
        default:
            // Strings and the "." and "?" markers.
            return Value.of(valueToken.text());
        }
    }

    /**
     * Determines the type of a loop column from its non-placeholder cells.  Integers mixed with floats are widened to
     * floats.  Any other mix, or a column of only placeholders, is a string column.
     */
    static ValueType inferType(List<Token> cells) {
        ValueType columnType = null;
        for (Token cell : cells) {
            ValueType cellType;
            switch (cell.type()) {
            case OMITTED:
            case MISSING:
                continue;
            case INTEGER:
                cellType = ValueType.INTEGER;
                break;
            case FLOAT:
                cellType = ValueType.FLOAT;
                break;
            default:
                return ValueType.STRING;
            }

            if (columnType == null || columnType == cellType) {
                columnType = cellType;
            } else {
                // One is INTEGER and the other is FLOAT.
                columnType = ValueType.FLOAT;
            }
        }
        return columnType == null ? ValueType.STRING : columnType;
    }

    private Column toColumn(List<Token> cells) throws CifParseException {
        final int size = cells.size();
        final boolean retainPlaceholders = placeholderMode == NumericPlaceholderMode.RETAIN;
        String[] placeholders = null;

        switch (inferType(cells)) {
        case INTEGER: {
            long[] ints = new long[size];
            for (int i = 0; i < size; i++) {
                Token cell = cells.get(i);
                if (cell.type().isPlaceholder()) {
                    if (retainPlaceholders) {
                        placeholders = markPlaceholder(placeholders, size, i, cell);
                    }
                } else {
                    ints[i] = parseInteger(cell);
                }
            }
            return Column.ofParsedInts(ints, placeholders);
        }

        case FLOAT: {
            double[] floats = new double[size];
            for (int i = 0; i < size; i++) {
                Token cell = cells.get(i);
                if (cell.type().isPlaceholder()) {
                    if (retainPlaceholders) {
                        placeholders = markPlaceholder(placeholders, size, i, cell);
                    }
                } else {
                    floats[i] = parseFloat(cell);
                }
            }
            return Column.ofParsedFloats(floats, placeholders);
        }

        default: {
            String[] strings = new String[size];
            for (int i = 0; i < size; i++) {
                strings[i] = cells.get(i).text();
            }
            return Column.ofParsedStrings(strings);
        }
        }
    }

    private static String[] markPlaceholder(String[] placeholders, int size, int row, Token cell) {
        String[] marks = placeholders == null ? new String[size] : placeholders;
        marks[row] = cell.text();
        return marks;
    }

    private static long parseInteger(Token valueToken) throws CifParseException {
        try {
            return Long.parseLong(valueToken.text());
        } catch (NumberFormatException exception) {
            // The scanner only produces digits, so the only way this can fail is overflow.
            throw new CifParseException(valueToken.line(),
                String.format("Could not parse '%s' as an integer: value out of range", valueToken.text()));
        }
    }

    private static double parseFloat(Token valueToken) throws CifParseException {
        double number = Double.parseDouble(valueToken.text());
        if (Double.isInfinite(number)) {
            throw new CifParseException(valueToken.line(),
                String.format("Could not parse '%s' as a float: value out of range", valueToken.text()));
        }
        return number;
    }
}
