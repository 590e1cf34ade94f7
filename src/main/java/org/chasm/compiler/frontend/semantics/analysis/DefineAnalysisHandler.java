package org.chasm.compiler.frontend.semantics.analysis;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.api.CompilerErrorCode;
import org.chasm.compiler.frontend.lexer.Token;
import org.chasm.compiler.frontend.lexer.TokenType;
import org.chasm.compiler.frontend.parser.ast.DefineStatement;
import org.chasm.compiler.frontend.parser.ast.Statement;
import org.chasm.compiler.frontend.semantics.Symbol;
import org.chasm.compiler.frontend.semantics.SymbolTable;
import org.chasm.compiler.isa.Architecture;

/**
 * Handles the semantic analysis of {@link DefineStatement}s.
 * This involves resolving the value and defining the constant in the symbol table.
 */
public class DefineAnalysisHandler implements IAnalysisHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public void declare(Statement statement, SymbolTable symbolTable) throws CompilationException {
        if (statement instanceof DefineStatement define) {
            int value = resolveValue(define.name(), define.value());
            symbolTable.define(new Symbol(define.name(), Symbol.Kind.DEFINE, value));
        }
    }

    /**
     * Resolves the value token of a define or config declaration. A <code>default</code>
     * value is looked up in the architecture defaults under the declared name.
     * @param name The declared name.
     * @param value A numeric token or the <code>default</code> keyword.
     * @return The resolved value.
     * @throws CompilationException if the architecture has no default for the name.
     */
    static int resolveValue(Token name, Token value) throws CompilationException {
        if (value.type() != TokenType.DEFAULT) {
            return value.intValue();
        }
        return Architecture.defaultValue(name.text()).orElseThrow(() -> new CompilationException(
                CompilerErrorCode.NO_DEFAULT_VALUE,
                String.format("The architecture has no default value for \"%s\"", name.text()),
                value.source()));
    }
}
