package org.chasm.compiler.frontend.semantics.analysis;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.frontend.parser.ast.ConfigStatement;
import org.chasm.compiler.frontend.parser.ast.Statement;
import org.chasm.compiler.frontend.semantics.Symbol;
import org.chasm.compiler.frontend.semantics.SymbolTable;

/**
 * Handles {@link ConfigStatement}s. Config values behave like constants in the source
 * and are additionally exported with the program artifact.
 */
public class ConfigAnalysisHandler implements IAnalysisHandler {

    @Override
    public void declare(Statement statement, SymbolTable symbolTable) throws CompilationException {
        if (statement instanceof ConfigStatement config) {
            int value = DefineAnalysisHandler.resolveValue(config.name(), config.value());
            symbolTable.define(new Symbol(config.name(), Symbol.Kind.CONFIG, value));
        }
    }
}
