package org.chasm.compiler.frontend.semantics.analysis;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.frontend.parser.ast.ProcedureStatement;
import org.chasm.compiler.frontend.parser.ast.Statement;
import org.chasm.compiler.frontend.semantics.Symbol;
import org.chasm.compiler.frontend.semantics.SymbolTable;

/**
 * Handles the semantic analysis of {@link ProcedureStatement}s.
 */
public class ProcedureAnalysisHandler implements IAnalysisHandler {

    @Override
    public void declare(Statement statement, SymbolTable symbolTable) throws CompilationException {
        if (statement instanceof ProcedureStatement procedure) {
            symbolTable.define(new Symbol(procedure.name(), Symbol.Kind.PROCEDURE));
        }
    }
}
