package org.chasm.compiler.frontend.parser.ast;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.api.ProgramArtifact;
import org.chasm.compiler.backend.Generator;
import org.chasm.compiler.frontend.semantics.SymbolSanitizer;
import org.chasm.compiler.frontend.semantics.SymbolTable;
import org.chasm.compiler.isa.IInstructionSet;

import java.util.List;

/**
 * The parsed program: its top-level statements in source order.
 *
 * @param statements The top-level statements.
 */
public record AbstractTree(List<Statement> statements) {

    public AbstractTree {
        statements = List.copyOf(statements);
    }

    /**
     * Declares and checks all symbols of the program.
     * @return A freshly populated symbol table.
     * @throws CompilationException on the first symbol error.
     */
    public SymbolTable sanitize() throws CompilationException {
        return new SymbolSanitizer(new SymbolTable()).sanitize(statements);
    }

    /**
     * Sanitizes the program and generates its machine words.
     * @param programName The name of the program.
     * @param isa The instruction table used to encode instructions.
     * @return The compiled artifact.
     * @throws CompilationException on the first symbol, layout or encoding error.
     */
    public ProgramArtifact generate(String programName, IInstructionSet isa) throws CompilationException {
        SymbolTable symbolTable = sanitize();
        return new Generator(isa).generate(programName, statements, symbolTable);
    }
}
