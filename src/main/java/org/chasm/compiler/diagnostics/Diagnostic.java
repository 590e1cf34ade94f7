package org.chasm.compiler.diagnostics;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.api.CompilerErrorCode;
import org.chasm.compiler.api.SourceInfo;

/**
 * The fatal error that ended a compilation, ready to be rendered on one line.
 *
 * @param code The error code.
 * @param message The diagnostic message without position.
 * @param source The source position, or null if the error has none (e.g. a missing file).
 */
public record Diagnostic(
        CompilerErrorCode code,
        String message,
        SourceInfo source
) {
    /**
     * Creates the diagnostic describing a failed compilation.
     * @param e The exception that ended the compilation.
     * @return The diagnostic.
     */
    public static Diagnostic from(CompilationException e) {
        return new Diagnostic(e.getErrorCode(), e.getDetail(), e.getSourceInfo());
    }

    @Override
    public String toString() {
        if (source == null) {
            return "[ERROR] " + message;
        }
        return String.format("[ERROR] %s: %s", source, message);
    }
}
