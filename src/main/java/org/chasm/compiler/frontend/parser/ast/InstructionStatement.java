package org.chasm.compiler.frontend.parser.ast;

import org.chasm.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A statement that represents a single machine instruction.
 *
 * @param mnemonic The token of the mnemonic (e.g., LD).
 * @param operands The operands of the instruction, in source order.
 */
public record InstructionStatement(Token mnemonic, List<Operand> operands) implements Statement {

    public InstructionStatement {
        operands = List.copyOf(operands);
    }

    @Override
    public int priority() {
        return PRIORITY_CODE;
    }

    @Override
    public Token anchor() {
        return mnemonic;
    }
}
