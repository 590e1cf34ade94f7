package org.chasm.compiler.frontend.semantics.analysis;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.frontend.parser.ast.LabelStatement;
import org.chasm.compiler.frontend.parser.ast.Statement;
import org.chasm.compiler.frontend.semantics.Symbol;
import org.chasm.compiler.frontend.semantics.SymbolTable;

/**
 * Handles the semantic analysis of {@link LabelStatement}s.
 * The label is declared here; its address is bound by the layout engine.
 */
public class LabelAnalysisHandler implements IAnalysisHandler {

    @Override
    public void declare(Statement statement, SymbolTable symbolTable) throws CompilationException {
        if (statement instanceof LabelStatement label) {
            symbolTable.define(new Symbol(label.name(), Symbol.Kind.LABEL));
        }
    }
}
