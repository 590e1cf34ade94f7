package org.chasm.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** A numeric literal, also produced for ASCII-byte literals such as 'A'. */
    NUMBER("numerical"),
    /** A name of a constant, config, label, procedure or sprite. */
    IDENTIFIER("identifier"),
    /** An instruction mnemonic, such as CLS or LD. */
    INSTRUCTION("instruction"),
    /** A register, such as V0 or DT. */
    REGISTER("register name"),

    // Keywords.
    DEFINE("define"),
    CONFIG("config"),
    DEFAULT("default"),
    SPRITE("sprite"),
    RAW("raw"),
    PROC("proc"),
    ENDP("endp"),

    // Single-character tokens.
    BRACKET_OPEN("["),
    BRACKET_CLOSE("]"),
    PAREN_OPEN("("),
    PAREN_CLOSE(")"),
    COLON(":"),
    COMMA(","),
    EQUAL("="),
    /** The '.' that introduces a label definition. */
    DOT("."),
    /** The '@' of a label reference. */
    AT("@"),
    /** The '$' of a procedure reference. */
    DOLLAR("$"),
    /** The '#' of a sprite reference. */
    HASH("#"),

    /** Represents the end of the source file. */
    END_OF_FILE("end of file");

    private final String displayName;

    TokenType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return The name used for this token type in diagnostics.
     */
    public String displayName() {
        return displayName;
    }
}
