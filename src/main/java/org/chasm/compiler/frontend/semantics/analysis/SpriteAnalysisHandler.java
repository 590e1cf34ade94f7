package org.chasm.compiler.frontend.semantics.analysis;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.frontend.parser.ast.SpriteStatement;
import org.chasm.compiler.frontend.parser.ast.Statement;
import org.chasm.compiler.frontend.semantics.Symbol;
import org.chasm.compiler.frontend.semantics.SymbolTable;

/**
 * Handles {@link SpriteStatement}s. Row widths were already validated by the parser.
 */
public class SpriteAnalysisHandler implements IAnalysisHandler {

    @Override
    public void declare(Statement statement, SymbolTable symbolTable) throws CompilationException {
        if (statement instanceof SpriteStatement sprite) {
            symbolTable.define(new Symbol(sprite.name(), Symbol.Kind.SPRITE));
        }
    }
}
