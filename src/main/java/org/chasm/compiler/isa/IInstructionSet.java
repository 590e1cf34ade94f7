package org.chasm.compiler.isa;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Stable ISA interface used by the lexer and the compiler backend to avoid direct coupling
 * to a concrete instruction table.
 */
public interface IInstructionSet {

	/**
	 * Checks whether a name is a known mnemonic (case-insensitive).
	 * @param name The candidate mnemonic.
	 * @return true if at least one template exists for it.
	 */
	boolean isMnemonic(String name);

	/**
	 * Gets all encodings of a mnemonic in selection order.
	 * @param mnemonic The mnemonic (case-insensitive).
	 * @return The templates, empty if the mnemonic is unknown.
	 */
	List<OpcodeTemplate> getTemplates(String mnemonic);

	/**
	 * Selects the first encoding of a mnemonic that accepts the given operands.
	 * @param mnemonic The mnemonic (case-insensitive).
	 * @param operands One predicate per operand telling which slot kinds it can fill.
	 * @return The matching template, or empty if none accepts the operands.
	 */
	default Optional<OpcodeTemplate> select(String mnemonic, List<? extends Predicate<OperandKind>> operands) {
		return getTemplates(mnemonic).stream().filter(t -> t.accepts(operands)).findFirst();
	}

	/**
	 * @return All known mnemonics, in table order.
	 */
	Set<String> mnemonics();

	/**
	 * Resolves a register token (e.g., "v0", "DT") to a register.
	 * @param token The register token to resolve.
	 * @return An optional containing the register, or empty if not found.
	 */
	default Optional<Register> resolveRegisterToken(String token) {
		return Register.fromName(token);
	}
}
