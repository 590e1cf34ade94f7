package org.chasm.compiler.backend.emit;

import org.chasm.compiler.frontend.parser.ast.Operand;
import org.chasm.compiler.isa.OperandKind;
import org.chasm.compiler.isa.Register;

import java.util.function.Predicate;

/**
 * An instruction operand with its register or numeric value resolved.
 * It tests which template slot kinds it can fill: registers fill their own kind,
 * plain immediates fill any value slot, and symbolic or indirect references fill address slots.
 *
 * @param operand The operand from the source.
 * @param register The named register, or null for value operands.
 * @param value The register field value or the resolved number.
 */
record ResolvedOperand(Operand operand, Register register, int value) implements Predicate<OperandKind> {

    @Override
    public boolean test(OperandKind kind) {
        if (register != null) {
            return kind == OperandKind.of(register);
        }
        if (operand instanceof Operand.Immediate) {
            return kind.isValue();
        }
        return kind == OperandKind.ADDR;
    }

    /**
     * @return The operand as written in the source.
     */
    String describe() {
        String text = operand.token().text();
        if (operand instanceof Operand.LabelRef) return "@" + text;
        if (operand instanceof Operand.ProcedureRef) return "$" + text;
        if (operand instanceof Operand.SpriteRef) return "#" + text;
        if (operand instanceof Operand.Indirect) return "[" + text + "]";
        return text;
    }
}
