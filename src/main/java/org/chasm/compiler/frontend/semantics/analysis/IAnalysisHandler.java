package org.chasm.compiler.frontend.semantics.analysis;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.frontend.parser.ast.Statement;
import org.chasm.compiler.frontend.semantics.SymbolTable;

/**
 * Interface for specialized handlers in semantic analysis.
 * Each handler is responsible for one statement kind and takes part in two passes:
 * declarations are collected for the whole tree first, references are checked afterwards,
 * so the order of declarations in the source does not matter.
 */
public interface IAnalysisHandler {

    /**
     * Declares the symbols introduced by a statement.
     * @param statement The statement.
     * @param symbolTable The symbol table of the compilation.
     * @throws CompilationException if a declaration is invalid.
     */
    default void declare(Statement statement, SymbolTable symbolTable) throws CompilationException {
    }

    /**
     * Checks the references a statement makes, after all declarations are known.
     * @param statement The statement.
     * @param symbolTable The symbol table of the compilation.
     * @throws CompilationException if a reference is invalid.
     */
    default void analyze(Statement statement, SymbolTable symbolTable) throws CompilationException {
    }
}
