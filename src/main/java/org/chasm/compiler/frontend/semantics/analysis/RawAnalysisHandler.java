package org.chasm.compiler.frontend.semantics.analysis;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.frontend.lexer.TokenType;
import org.chasm.compiler.frontend.parser.ast.RawStatement;
import org.chasm.compiler.frontend.parser.ast.Statement;
import org.chasm.compiler.frontend.semantics.SymbolTable;

/**
 * Handles {@link RawStatement}s. A symbolic raw value may name any declared symbol.
 */
public class RawAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(Statement statement, SymbolTable symbolTable) throws CompilationException {
        if (statement instanceof RawStatement raw && raw.value().type() == TokenType.IDENTIFIER) {
            symbolTable.require(raw.value());
        }
    }
}
