///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.cif;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads CIF 1.1 text into a {@link CifDocument}.
 * <p>
 * The whole input is read into memory before it is parsed.  Parsing stops at the first error, which is reported as a
 * {@link CifParseException} with the line number on which it was found.
 * </p>
 * <p>
 * A reader holds no state between calls, so a single instance may be shared.
 * </p>
 */
public final class CifReader {

    private final NumericPlaceholderMode placeholderMode;

    /**
     * Creates a reader that converts omitted and missing cells of numeric loop columns to zero.
     */
    public CifReader() {
        this(NumericPlaceholderMode.COERCE_TO_ZERO);
    }

    /**
     * Creates a reader.
     *
     * @param placeholderMode
     *     How omitted ({@code .}) and missing ({@code ?}) cells of numeric loop columns are represented.
     *
     * @throws NullPointerException
     *     if {@code placeholderMode} is {@code null}.
     */
    public CifReader(NumericPlaceholderMode placeholderMode) {
        ArgumentUtil.checkNotNull(placeholderMode, "placeholderMode");
        this.placeholderMode = placeholderMode;
    }

    /**
     * @return How omitted and missing cells of numeric loop columns are represented.
     */
    public NumericPlaceholderMode placeholderMode() {
        return placeholderMode;
    }

    /**
     * Parses the complete text of a CIF.
     *
     * @param text
     *     The text to parse.
     *
     * @return The parsed document.
     *
     * @throws CifParseException
     *     if {@code text} is not a well-formed CIF 1.1 document.
     * @throws NullPointerException
     *     if {@code text} is {@code null}.
     */
    public CifDocument parse(String text) throws CifParseException {
        ArgumentUtil.checkNotNull(text, "text");
        return new CifParser(new CifScanner(text), placeholderMode).parse();
    }

    /**
     * Reads and parses a CIF from a character stream.  The stream is read to its end but is not closed.
     *
     * @param reader
     *     The source of the text.
     *
     * @return The parsed document.
     *
     * @throws CifParseException
     *     if the text is not a well-formed CIF 1.1 document.
     * @throws IOException
     *     if the text couldn't be read.
     * @throws NullPointerException
     *     if {@code reader} is {@code null}.
     */
    public CifDocument read(Reader reader) throws IOException, CifParseException {
        ArgumentUtil.checkNotNull(reader, "reader");
        StringWriter text = new StringWriter();
        reader.transferTo(text);
        return parse(text.toString());
    }

    /**
     * Reads and parses a CIF from a byte stream that is encoded in UTF-8.  The stream is read to its end but is not
     * closed.
     *
     * @param inputStream
     *     The source of the text.
     *
     * @return The parsed document.
     *
     * @throws CifParseException
     *     if the text is not a well-formed CIF 1.1 document.
     * @throws IOException
     *     if the text couldn't be read.
     * @throws NullPointerException
     *     if {@code inputStream} is {@code null}.
     */
    public CifDocument read(InputStream inputStream) throws IOException, CifParseException {
        ArgumentUtil.checkNotNull(inputStream, "inputStream");
        return read(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
    }

    /**
     * Reads and parses a CIF file that is encoded in UTF-8.
     *
     * @param sourceLocation
     *     The path to the file.
     *
     * @return The parsed document.
     *
     * @throws CifParseException
     *     if the file is not a well-formed CIF 1.1 document.
     * @throws IOException
     *     if the file couldn't be read.
     * @throws NullPointerException
     *     if {@code sourceLocation} is {@code null}.
     */
    public CifDocument read(Path sourceLocation) throws IOException, CifParseException {
        ArgumentUtil.checkNotNull(sourceLocation, "sourceLocation");
        return parse(Files.readString(sourceLocation, StandardCharsets.UTF_8));
    }

    /**
     * Reads a CIF file with the default options.
     * <p>
     * This is a convenience method for {@code new CifReader().read(sourceLocation)}.
     * </p>
     *
     * @param sourceLocation
     *     The path to the file.
     *
     * @return The parsed document.
     *
     * @throws CifParseException
     *     if the file is not a well-formed CIF 1.1 document.
     * @throws IOException
     *     if the file couldn't be read.
     * @throws NullPointerException
     *     if {@code sourceLocation} is {@code null}.
     */
    public static CifDocument readDocument(Path sourceLocation) throws IOException, CifParseException {
        return new CifReader().read(sourceLocation);
    }
}
