package org.chasm.compiler.backend;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.api.ProgramArtifact;
import org.chasm.compiler.backend.emit.Emitter;
import org.chasm.compiler.backend.layout.LayoutEngine;
import org.chasm.compiler.backend.layout.LayoutResult;
import org.chasm.compiler.frontend.parser.ast.Statement;
import org.chasm.compiler.frontend.semantics.SymbolTable;
import org.chasm.compiler.isa.IInstructionSet;

import java.util.List;

/**
 * Runs the backend over a sanitized program: priority ordering, layout and encoding.
 */
public class Generator {

    private final IInstructionSet isa;
    private final StatementOrderer orderer = new StatementOrderer();
    private final LayoutEngine layoutEngine = new LayoutEngine();
    private final Emitter emitter = new Emitter();

    public Generator(IInstructionSet isa) {
        this.isa = isa;
    }

    /**
     * Generates the machine words of a program.
     * @param programName The name of the program.
     * @param statements The top-level statements in source order.
     * @param symbolTable The symbol table produced by sanitization.
     * @return The compiled artifact.
     * @throws CompilationException on the first layout or encoding error.
     */
    public ProgramArtifact generate(String programName, List<Statement> statements, SymbolTable symbolTable)
            throws CompilationException {
        List<Statement> ordered = orderer.order(statements);
        LayoutResult layout = layoutEngine.layout(ordered, symbolTable);
        return emitter.emit(programName, ordered, layout, symbolTable, isa);
    }
}
