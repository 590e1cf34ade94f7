package org.chasm.compiler.frontend.semantics;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.frontend.parser.ast.ConfigStatement;
import org.chasm.compiler.frontend.parser.ast.DefineStatement;
import org.chasm.compiler.frontend.parser.ast.InstructionStatement;
import org.chasm.compiler.frontend.parser.ast.LabelStatement;
import org.chasm.compiler.frontend.parser.ast.ProcedureStatement;
import org.chasm.compiler.frontend.parser.ast.RawStatement;
import org.chasm.compiler.frontend.parser.ast.SpriteStatement;
import org.chasm.compiler.frontend.parser.ast.Statement;
import org.chasm.compiler.frontend.semantics.analysis.ConfigAnalysisHandler;
import org.chasm.compiler.frontend.semantics.analysis.DefineAnalysisHandler;
import org.chasm.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.chasm.compiler.frontend.semantics.analysis.InstructionAnalysisHandler;
import org.chasm.compiler.frontend.semantics.analysis.LabelAnalysisHandler;
import org.chasm.compiler.frontend.semantics.analysis.ProcedureAnalysisHandler;
import org.chasm.compiler.frontend.semantics.analysis.RawAnalysisHandler;
import org.chasm.compiler.frontend.semantics.analysis.SpriteAnalysisHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves and checks the symbols of a parsed program. It traverses the tree twice,
 * nested bodies included, dispatching each statement to the handler registered for its class:
 * the first pass declares every name, the second checks every reference.
 * No addresses are assigned here.
 * <p>
 * Errors follow pass order: a declaration error anywhere in the program is reported
 * before a reference error, even one that appears earlier in the source.
 */
public class SymbolSanitizer {

    private static final Logger LOG = LoggerFactory.getLogger(SymbolSanitizer.class);

    private final SymbolTable symbolTable;
    private final Map<Class<? extends Statement>, IAnalysisHandler> handlers = new HashMap<>();

    /**
     * Constructs a new sanitizer.
     * @param symbolTable The symbol table to populate.
     */
    public SymbolSanitizer(SymbolTable symbolTable) {
        this.symbolTable = symbolTable;
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        handlers.put(DefineStatement.class, new DefineAnalysisHandler());
        handlers.put(ConfigStatement.class, new ConfigAnalysisHandler());
        handlers.put(SpriteStatement.class, new SpriteAnalysisHandler());
        handlers.put(LabelStatement.class, new LabelAnalysisHandler());
        handlers.put(ProcedureStatement.class, new ProcedureAnalysisHandler());
        handlers.put(RawStatement.class, new RawAnalysisHandler());
        handlers.put(InstructionStatement.class, new InstructionAnalysisHandler());
    }

    /**
     * Sanitizes the given statements.
     * @param statements The top-level statements of the program.
     * @return The populated symbol table.
     * @throws CompilationException on the first duplicate declaration, missing default or invalid reference.
     */
    public SymbolTable sanitize(List<Statement> statements) throws CompilationException {
        collectDeclarations(statements);
        checkReferences(statements);
        LOG.debug("Declared {} symbols", symbolTable.size());
        return symbolTable;
    }

    private void collectDeclarations(List<Statement> statements) throws CompilationException {
        for (Statement statement : statements) {
            handlerFor(statement).declare(statement, symbolTable);
            collectDeclarations(statement.getChildren());
        }
    }

    private void checkReferences(List<Statement> statements) throws CompilationException {
        for (Statement statement : statements) {
            handlerFor(statement).analyze(statement, symbolTable);
            checkReferences(statement.getChildren());
        }
    }

    private IAnalysisHandler handlerFor(Statement statement) {
        IAnalysisHandler handler = handlers.get(statement.getClass());
        if (handler == null) {
            throw new IllegalStateException("No analysis handler for " + statement.getClass().getSimpleName());
        }
        return handler;
    }
}
