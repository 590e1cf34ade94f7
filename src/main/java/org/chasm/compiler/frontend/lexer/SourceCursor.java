package org.chasm.compiler.frontend.lexer;

import org.chasm.compiler.api.SourceInfo;

/**
 * Walks over raw source text and tracks the line and column of the next character.
 */
public final class SourceCursor {

    private final String source;
    private final String fileName;
    private int offset = 0;
    private int line = 1;
    private int column = 1;

    /**
     * Creates a cursor positioned at the first character.
     * @param source The source text.
     * @param fileName The logical file name used in positions.
     */
    public SourceCursor(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    /**
     * @return true if every character has been consumed.
     */
    public boolean isAtEnd() {
        return offset >= source.length();
    }

    /**
     * @return The next character without consuming it, or '\0' at the end.
     */
    public char peek() {
        return isAtEnd() ? '\0' : source.charAt(offset);
    }

    /**
     * @return The character after the next one without consuming anything, or '\0'.
     */
    public char peekNext() {
        return offset + 1 >= source.length() ? '\0' : source.charAt(offset + 1);
    }

    /**
     * Consumes the next character and moves the position past it.
     * @return The consumed character.
     */
    public char advance() {
        char c = source.charAt(offset++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    /**
     * @return The offset of the next character in the source.
     */
    public int offset() {
        return offset;
    }

    /**
     * Returns the source text between a previous offset and the current one.
     * @param start The start offset, inclusive.
     * @return The consumed text.
     */
    public String textFrom(int start) {
        return source.substring(start, offset);
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public String fileName() {
        return fileName;
    }

    /**
     * @return The position of the next character.
     */
    public SourceInfo position() {
        return new SourceInfo(fileName, line, column);
    }
}
