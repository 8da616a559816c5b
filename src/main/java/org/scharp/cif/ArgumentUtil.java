package org.scharp.cif;

/**
 * A class with utility methods for validating arguments.
 */
abstract class ArgumentUtil {
    /**
     * Throws an exception if {@code argument} is {@code null}.
     *
     * @param argument
     *     The argument to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     */
    static void checkNotNull(Object argument, String argumentName) {
        if (argument == null) {
            throw new NullPointerException(argumentName + " must not be null");
        }
    }

    /**
     * Throws an exception if {@code argument} is {@code null} or empty.
     *
     * @param argument
     *     The string to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code argument} is empty.
     */
    static void checkNotEmpty(String argument, String argumentName) {
        checkNotNull(argument, argumentName);
        if (argument.isEmpty()) {
            throw new IllegalArgumentException(argumentName + " must not be empty");
        }
    }

    /**
     * Throws an exception if {@code argument} cannot be used as a CIF name or data tag.
     * <p>
     * A name is the text that follows {@code data_} or {@code save_} in a heading, and a tag is the text that follows
     * the leading underscore of a data name.  Both must be a non-empty run of non-blank characters, or else they could
     * not be written and read back.
     * </p>
     *
     * @param argument
     *     The name to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code argument} is empty or contains a character that is not a non-blank CIF character.
     */
    static void checkName(String argument, String argumentName) {
        checkNotEmpty(argument, argumentName);
        for (int i = 0; i < argument.length(); i++) {
            char c = argument.charAt(i);
            if (!CifCharacters.isNonBlankChar(c)) {
                throw new IllegalArgumentException(
                    argumentName + " \"" + argument + "\" contains the character '" + CifCharacters.describe(c) +
                        "', which is not allowed in a CIF name");
            }
        }
    }
}
