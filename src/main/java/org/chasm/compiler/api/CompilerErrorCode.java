package org.chasm.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the message texts.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** A digit that is not valid for the numeric base of the literal. */
    INVALID_DIGIT_FOR_BASE,
    /** A numeric literal whose value does not fit into 16 bits. */
    NUMERIC_CONSTANT_TOO_LARGE,
    /** A character that cannot start any token. */
    UNDEFINED_CHARACTER_TOKEN,
    // endregion

    // region Parser Errors
    /** A token of an unexpected kind was found. */
    UNEXPECTED_TOKEN,
    /** The source ended inside a construct that requires a closing token. */
    UNEXPECTED_END_OF_INPUT,
    /** The name after endp does not match the name after proc. */
    UNMATCHING_PROCEDURE_NAMES,
    /** A procedure was opened inside another procedure. */
    NESTED_PROCEDURE,
    /** A sprite literal has more rows than the architecture allows. */
    SPRITE_TOO_LARGE,
    /** A sprite row does not fit into a byte. */
    SPRITE_ROW_OUT_OF_RANGE,
    // endregion

    // region Semantic Analysis Errors
    /** A name was declared more than once, in any symbol category. */
    SYMBOL_ALREADY_DEFINED,
    /** A referenced name was never declared. */
    UNDEFINED_SYMBOL,
    /** A referenced name belongs to a symbol category the reference does not accept. */
    WRONG_SYMBOL_KIND,
    /** A default value was requested for a name the architecture declares no default for. */
    NO_DEFAULT_VALUE,
    // endregion

    // region Generation Errors
    /** The operands of an instruction do not match any of its encodings. */
    OPERAND_MISMATCH,
    /** An immediate value does not fit the width of its instruction field. */
    IMMEDIATE_OUT_OF_RANGE,
    /** The program does not fit into the target memory. */
    PROGRAM_TOO_LARGE,
    // endregion

    // region General Errors
    /** The source file does not exist. */
    FILE_NOT_FOUND,
    /** An I/O error occurred while reading a file. */
    IO_ERROR_READING_FILE
    // endregion
}
