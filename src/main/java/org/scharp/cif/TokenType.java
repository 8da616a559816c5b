package org.scharp.cif;

/** The kinds of tokens that {@link CifScanner} produces. */
enum TokenType {
    /** The leading {@code #\#CIF_x.y} line. The token's text is everything after {@code #\#}. */
    VERSION,

    /** A comment. The token's text does not include the leading {@code #}. */
    COMMENT,

    /** A {@code data_} heading. The token's text is the block name. */
    DATA_BLOCK_START,

    /** A {@code save_} heading. The token's text is the frame name. */
    SAVE_FRAME_START,

    /** The bare {@code save_} that closes a save frame. */
    SAVE_FRAME_END,

    /** The {@code loop_} keyword. */
    LOOP,

    /** A data name. The token's text does not include the leading underscore. */
    DATA_TAG,

    /** The value {@code .} */
    OMITTED,

    /** The value {@code ?} */
    MISSING,

    /** A value that lexically matches an integer. */
    INTEGER,

    /** A value that lexically matches a floating point number. */
    FLOAT,

    /** An unquoted string, a quoted string (without quotes), or the content of a text field. */
    STRING,

    /** The end of the input. */
    END_OF_INPUT,

    /** A scan error. The token's text is the error message. */
    ERROR;

    /**
     * Determines if this token type is a value that can follow a data tag.
     *
     * @return {@code true} if this is a value; {@code false}, otherwise.
     */
    boolean isValue() {
        return this == OMITTED || this == MISSING || this == INTEGER || this == FLOAT || this == STRING;
    }

    /**
     * Determines if this token type is a placeholder for a value that is not given.
     *
     * @return {@code true}, if this is {@link #OMITTED} or {@link #MISSING}; {@code false}, otherwise.
     */
    boolean isPlaceholder() {
        return this == OMITTED || this == MISSING;
    }
}
