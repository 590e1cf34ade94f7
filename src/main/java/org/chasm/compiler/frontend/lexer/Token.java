package org.chasm.compiler.frontend.lexer;

import org.chasm.compiler.api.SourceInfo;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., INSTRUCTION, REGISTER, NUMBER).
 * @param text The exact text of the token from the source code.
 * @param value The 16-bit value of a numeric token, null for every other type.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        Integer value,
        int line,
        int column,
        String fileName
) {

    /**
     * @return The position of this token.
     */
    public SourceInfo source() {
        return new SourceInfo(fileName, line, column);
    }

    /**
     * @return The numeric payload.
     * @throws IllegalStateException if the token carries no number.
     */
    public int intValue() {
        if (value == null) {
            throw new IllegalStateException("Token '" + text + "' of type " + type + " has no numeric value.");
        }
        return value;
    }
}
