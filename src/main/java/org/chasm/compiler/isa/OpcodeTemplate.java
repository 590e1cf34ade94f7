package org.chasm.compiler.isa;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * One encoding of a mnemonic: the operand shapes it accepts and where each operand lands in the word.
 *
 * @param mnemonic The lower-case mnemonic.
 * @param baseWord The instruction word with all operand fields set to zero.
 * @param slots The operand slots, in source order.
 */
public record OpcodeTemplate(String mnemonic, int baseWord, List<Slot> slots) {

    /**
     * A single operand position of a template.
     *
     * @param kind The accepted operand kind.
     * @param shift The bit position of the field in the word, or -1 if the operand is implied by the opcode.
     */
    public record Slot(OperandKind kind, int shift) {}

    public OpcodeTemplate {
        slots = List.copyOf(slots);
    }

    /**
     * @return The accepted operand kinds, in source order.
     */
    public List<OperandKind> kinds() {
        return slots.stream().map(Slot::kind).collect(Collectors.toList());
    }

    /**
     * Checks whether this template accepts the given operands. Each operand is represented
     * by a predicate that tells which slot kinds it can fill; values are not checked here.
     * @param operands One predicate per operand, in source order.
     * @return true if the arity matches and every operand fits its slot.
     */
    public boolean accepts(List<? extends Predicate<OperandKind>> operands) {
        if (operands.size() != slots.size()) return false;
        for (int i = 0; i < slots.size(); i++) {
            if (!operands.get(i).test(slots.get(i).kind())) return false;
        }
        return true;
    }

    /**
     * @return A human readable signature, e.g. "ld VX, N8".
     */
    public String signature() {
        if (slots.isEmpty()) return mnemonic;
        return mnemonic + " " + slots.stream().map(s -> s.kind().name()).collect(Collectors.joining(", "));
    }
}
