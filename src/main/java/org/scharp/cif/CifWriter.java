///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.cif;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Serializes a {@link CifDocument} as CIF 1.1 text.
 * <p>
 * The output is laid out in a fixed order: the version comment, then each data block with its save frames, its single
 * items, and finally its loops.  Strings are quoted only when they must be, so that reading the output back gives a
 * document that is equal to the one that was written.
 * </p>
 * <p>
 * Some documents cannot be written.  For example, a string with a character outside printable ASCII, or a float that
 * is infinite.  Such documents cause a {@link CifWriteException}, but since the output is streamed, anything before
 * the offending value will already have been written.
 * </p>
 * <p>
 * Writing a new file:
 * </p>
 * <pre>
 * DataBlock block = DataBlock.builder().
 *     name("1abc").
 *     item("struct.title", Value.of("Sample structure")).
 *     loop(Loop.builder().
 *         column("entity_poly_seq.num", Column.ofInts(1, 2, 3)).
 *         column("entity_poly_seq.mon_id", Column.ofStrings("MET", "ALA", "LYS")).
 *         build()).
 *     build();
 *
 * CifDocument document = CifDocument.builder().version("CIF_1.1").dataBlock(block).build();
 * CifWriter.writeDocument(Path.of("1abc.cif"), document);
 * </pre>
 */
public final class CifWriter {

    private static final Pattern NUMERIC = Pattern.compile("[+-]?([0-9]+(\\.[0-9]*)?|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    private static final String ITEM_SEPARATOR = "    ";
    private static final String CELL_SEPARATOR = "  ";

    private final Writer writer;

    private CifWriter(Writer writer) {
        this.writer = writer;
    }

    /**
     * Writes a document to a character stream.  The stream is not closed.
     *
     * @param document
     *     The document to write.
     * @param writer
     *     The destination.
     *
     * @throws CifWriteException
     *     if the document contains a value that cannot be represented in CIF 1.1.
     * @throws IOException
     *     if the destination couldn't be written.
     * @throws NullPointerException
     *     if {@code document} or {@code writer} is {@code null}.
     */
    public static void write(CifDocument document, Writer writer) throws IOException {
        ArgumentUtil.checkNotNull(document, "document");
        ArgumentUtil.checkNotNull(writer, "writer");
        new CifWriter(writer).writeDocument(document);
    }

    /**
     * Writes a document to a byte stream in UTF-8.  The stream is flushed but not closed.
     *
     * @param document
     *     The document to write.
     * @param outputStream
     *     The destination.
     *
     * @throws CifWriteException
     *     if the document contains a value that cannot be represented in CIF 1.1.
     * @throws IOException
     *     if the destination couldn't be written.
     * @throws NullPointerException
     *     if {@code document} or {@code outputStream} is {@code null}.
     */
    public static void write(CifDocument document, OutputStream outputStream) throws IOException {
        ArgumentUtil.checkNotNull(document, "document");
        ArgumentUtil.checkNotNull(outputStream, "outputStream");

        Writer writer = new BufferedWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8));
        new CifWriter(writer).writeDocument(document);
        writer.flush();
    }

    /**
     * Writes a document to a file in UTF-8.
     *
     * @param targetLocation
     *     The path to the file to which the document should be written.  If the file doesn't exist, then it will be
     *     created.  If the file does exist, then its contents will be replaced.
     * @param document
     *     The document to write.
     *
     * @throws CifWriteException
     *     if the document contains a value that cannot be represented in CIF 1.1.
     * @throws IOException
     *     if the file couldn't be written.
     * @throws NullPointerException
     *     if {@code targetLocation} or {@code document} is {@code null}.
     */
    public static void writeDocument(Path targetLocation, CifDocument document) throws IOException {
        ArgumentUtil.checkNotNull(targetLocation, "targetLocation");
        ArgumentUtil.checkNotNull(document, "document");

        try (Writer writer = Files.newBufferedWriter(targetLocation, StandardCharsets.UTF_8)) {
            new CifWriter(writer).writeDocument(document);
        }
    }

    private void writeDocument(CifDocument document) throws IOException {
        if (document.hasVersion()) {
            writer.write("#\\#" + document.version() + "\n");
        }

        for (DataBlock dataBlock : document.dataBlocks().values()) {
            writer.write("data_" + dataBlock.name() + "\n");

            for (SaveFrame saveFrame : dataBlock.frames().values()) {
                writer.write("save_" + saveFrame.name() + "\n");
                writeBlockContents(saveFrame);
                writer.write("save_\n");
            }

            writeBlockContents(dataBlock);
        }
    }

    private void writeBlockContents(Block block) throws IOException {
        for (Map.Entry<String, Value> item : block.items().entrySet()) {
            writer.write("_" + item.getKey() + ITEM_SEPARATOR + formatValue(item.getValue()) + "\n");
        }
        for (Loop loop : block.distinctLoops()) {
            writeLoop(loop);
        }
    }

    private void writeLoop(Loop loop) throws IOException {
        writer.write("loop_\n");
        for (String tag : loop.tags()) {
            writer.write("_" + tag + "\n");
        }

        // Format each column once, then write the cells row by row.
        List<Column> columns = loop.values();
        String[][] formattedColumns = new String[columns.size()][];
        for (int i = 0; i < columns.size(); i++) {
            formattedColumns[i] = formatColumn(columns.get(i));
        }

        for (int row = 0; row < loop.rowCount(); row++) {
            StringBuilder line = new StringBuilder();
            for (int column = 0; column < formattedColumns.length; column++) {
                if (column != 0) {
                    line.append(CELL_SEPARATOR);
                }
                line.append(formattedColumns[column][row]);
            }
            writer.write(line.append('\n').toString());
        }
    }

    private static String formatValue(Value value) throws CifWriteException {
        switch (value.type()) {
        case INTEGER:
            return Value.formatInt(value.intValue());
        case FLOAT:
            return formatFloat(value.floatValue());
        default:
            return formatString(value.stringValue());
        }
    }

    private static String[] formatColumn(Column column) throws CifWriteException {
        String[] cells = column.strings();
        switch (column.type()) {
        case FLOAT:
            // Column.strings() doesn't reject numbers that have no CIF syntax.
            double[] floats = column.floats();
            for (int row = 0; row < floats.length; row++) {
                if (!column.isPlaceholder(row)) {
                    checkFinite(floats[row]);
                }
            }
            return cells;
        case INTEGER:
            // Numbers and retained placeholders never need quotes.
            return cells;
        default:
            for (int row = 0; row < cells.length; row++) {
                cells[row] = formatString(cells[row]);
            }
            return cells;
        }
    }

    private static String formatFloat(double number) throws CifWriteException {
        checkFinite(number);
        return Value.formatFloat(number);
    }

    private static void checkFinite(double number) throws CifWriteException {
        if (!Double.isFinite(number)) {
            throw new CifWriteException("the float " + number + " cannot be represented in CIF");
        }
    }

    /**
     * Formats a string so that it is read back as the same string.
     *
     * @param string
     *     The string to format.
     *
     * @return The string, with whatever quoting it requires.
     *
     * @throws CifWriteException
     *     if the string cannot be represented in CIF 1.1.
     */
    static String formatString(String string) throws CifWriteException {
        if (string.isEmpty()) {
            return "''";
        }

        // A string that looks like a number must be quoted, or else it would be read back as a number.
        if (NUMERIC.matcher(string).matches()) {
            return '"' + string + '"';
        }

        boolean hasNewline = false;
        boolean hasSingleQuote = false;
        boolean hasDoubleQuote = false;
        boolean allOrdinary = true;
        for (int i = 0; i < string.length(); i++) {
            char c = string.charAt(i);
            if (c == '\n') {
                hasNewline = true;
            } else if (!CifCharacters.isPrintChar(c)) {
                // This includes '\r', which is read back as a line feed.
                throw new CifWriteException(
                    "the character '" + CifCharacters.describe(c) + "' cannot be represented in CIF");
            } else if (c == '\'') {
                hasSingleQuote = true;
            } else if (c == '"') {
                hasDoubleQuote = true;
            }
            if (!CifCharacters.isOrdinaryChar(c)) {
                allOrdinary = false;
            }
        }

        if (hasNewline || (hasSingleQuote && hasDoubleQuote)) {
            return formatTextField(string);
        }
        if (hasDoubleQuote) {
            return '\'' + string + '\'';
        }
        if (!allOrdinary) {
            // This includes every reserved word, since they all contain '_'.
            return '"' + string + '"';
        }
        return string;
    }

    private static String formatTextField(String string) throws CifWriteException {
        if (string.contains("\n;")) {
            throw new CifWriteException("a string with a line that starts with ';' cannot be represented in CIF");
        }
        // The text field's content runs from after the opening ';' to before the newline that precedes the
        // closing ';'.
        return "\n;" + string + "\n;";
    }
}
