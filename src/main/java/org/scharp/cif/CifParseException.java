///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.cif;

/**
 * Thrown when the input to {@link CifReader} is not a well-formed CIF 1.1 document.
 * <p>
 * Reading stops at the first error, so there is exactly one error per exception.
 * </p>
 */
public class CifParseException extends Exception {
    private static final long serialVersionUID = 1L;

    private final int lineNumber;

    /**
     * Creates an exception for an error on a line of the input.
     *
     * @param lineNumber
     *     The one-based line number on which the error was detected.
     * @param detail
     *     A description of the error.
     */
    public CifParseException(int lineNumber, String detail) {
        super("CIF parse error (line " + lineNumber + "): " + detail);
        this.lineNumber = lineNumber;
    }

    /**
     * @return The one-based line number on which the error was detected.
     */
    public int lineNumber() {
        return lineNumber;
    }
}
