package org.chasm.compiler.frontend.parser.ast;

import org.chasm.compiler.api.SourceInfo;
import org.chasm.compiler.frontend.lexer.Token;

/**
 * Base type for instruction operands. Keeps the addressing mode and the source token
 * intact until the backend resolves them.
 */
public sealed interface Operand permits Operand.Reg, Operand.Immediate, Operand.LabelRef, Operand.ProcedureRef,
        Operand.SpriteRef, Operand.Indirect {

	/**
	 * @return The token that carries the register name, the number or the referenced name.
	 */
	Token token();

	/**
	 * @return The position of the operand.
	 */
	default SourceInfo source() {
		return token().source();
	}

	/**
	 * A register operand, e.g. <code>v3</code> or <code>dt</code>.
	 * @param token The register token.
	 */
	record Reg(Token token) implements Operand {}

	/**
	 * An immediate value: a number or the name of a define or config.
	 * @param token The numeric or identifier token.
	 */
	record Immediate(Token token) implements Operand {}

	/**
	 * A label reference, <code>@name</code>.
	 * @param token The identifier token after the sigil.
	 */
	record LabelRef(Token token) implements Operand {}

	/**
	 * A procedure reference, <code>$name</code>.
	 * @param token The identifier token after the sigil.
	 */
	record ProcedureRef(Token token) implements Operand {}

	/**
	 * A sprite reference, <code>#name</code>.
	 * @param token The identifier token after the sigil.
	 */
	record SpriteRef(Token token) implements Operand {}

	/**
	 * A memory reference, <code>[number]</code> or <code>[name]</code>.
	 * @param token The numeric or identifier token between the brackets.
	 */
	record Indirect(Token token) implements Operand {}
}
