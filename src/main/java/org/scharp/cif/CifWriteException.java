///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.cif;

import java.io.IOException;

/**
 * Thrown when a document contains a value that cannot be written as CIF 1.1.
 * <p>
 * This extends {@link IOException} so that callers of {@link CifWriter} only need to handle one exception type.
 * </p>
 */
public class CifWriteException extends IOException {
    private static final long serialVersionUID = 1L;

    /**
     * @param detail
     *     A description of the value that could not be written.
     */
    public CifWriteException(String detail) {
        super("CIF write: " + detail);
    }
}
