package org.chasm.compiler.frontend.semantics.analysis;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.frontend.lexer.TokenType;
import org.chasm.compiler.frontend.parser.ast.InstructionStatement;
import org.chasm.compiler.frontend.parser.ast.Operand;
import org.chasm.compiler.frontend.parser.ast.Statement;
import org.chasm.compiler.frontend.semantics.Symbol;
import org.chasm.compiler.frontend.semantics.SymbolTable;

import java.util.EnumSet;
import java.util.Set;

/**
 * Handles the semantic analysis of {@link InstructionStatement}s.
 * It checks that every symbolic operand names a declared symbol of the kind its sigil requires.
 * Operand shapes and widths are checked when the instruction is encoded.
 */
public class InstructionAnalysisHandler implements IAnalysisHandler {

    private static final Set<Symbol.Kind> VALUE_KINDS = EnumSet.of(Symbol.Kind.DEFINE, Symbol.Kind.CONFIG);

    @Override
    public void analyze(Statement statement, SymbolTable symbolTable) throws CompilationException {
        if (!(statement instanceof InstructionStatement instruction)) {
            return;
        }
        for (Operand operand : instruction.operands()) {
            if (operand instanceof Operand.LabelRef) {
                symbolTable.require(operand.token(), EnumSet.of(Symbol.Kind.LABEL));
            } else if (operand instanceof Operand.ProcedureRef) {
                symbolTable.require(operand.token(), EnumSet.of(Symbol.Kind.PROCEDURE));
            } else if (operand instanceof Operand.SpriteRef) {
                symbolTable.require(operand.token(), EnumSet.of(Symbol.Kind.SPRITE));
            } else if (operand instanceof Operand.Immediate && operand.token().type() == TokenType.IDENTIFIER) {
                symbolTable.require(operand.token(), VALUE_KINDS);
            } else if (operand instanceof Operand.Indirect && operand.token().type() == TokenType.IDENTIFIER) {
                symbolTable.require(operand.token());
            }
        }
    }
}
