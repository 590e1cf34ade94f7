package org.chasm.compiler.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Defines the public, clean interface for the chasm compiler.
 */
public interface ICompiler {

    /**
     * Compiles the given source code.
     * <p>
     * Only the first error is reported, in phase order: lexical, syntactic, symbol declaration,
     * symbol reference, layout, then encoding. Layout and encoding walk the statements after
     * priority ordering, so an error inside a procedure or sprite is found after the errors
     * of top-level code.
     *
     * @param source The complete source text.
     * @param programName A name for the program, used in diagnostics.
     * @return A {@link ProgramArtifact} containing the compiled program and all associated metadata.
     * @throws CompilationException if an error occurs during the compilation process.
     */
    ProgramArtifact compile(String source, String programName) throws CompilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=errors only ... 4=trace).
     */
    void setVerbosity(int level);

    /**
     * Compiles the source code from a file. Load failures are classified as
     * {@link CompilerErrorCode#FILE_NOT_FOUND} or {@link CompilerErrorCode#IO_ERROR_READING_FILE}.
     * @param programPath The path to the source file.
     * @return A {@link ProgramArtifact} containing the compiled program.
     * @throws CompilationException if the file cannot be read or compilation fails.
     */
    default ProgramArtifact compile(Path programPath) throws CompilationException {
        String source;
        try {
            source = Files.readString(programPath, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new CompilationException(CompilerErrorCode.FILE_NOT_FOUND, "File " + programPath + " not found.", e);
        } catch (IOException e) {
            throw new CompilationException(CompilerErrorCode.IO_ERROR_READING_FILE, "Could not read file " + programPath + ".", e);
        }
        return compile(source, programPath.getFileName().toString());
    }
}
