package org.chasm.compiler.isa;

/**
 * The operand shapes an instruction encoding accepts.
 */
public enum OperandKind {
    /** A general purpose register V0..VF. */
    VX(null),
    /** The index register. */
    I(null),
    /** The delay timer register. */
    DT(null),
    /** The sound timer register. */
    ST(null),
    /** A 4-bit immediate. */
    N4(ImmediateFormat.IMM4),
    /** An 8-bit immediate. */
    N8(ImmediateFormat.IMM8),
    /** A 12-bit address: literal, constant, label, procedure, sprite or indirect reference. */
    ADDR(ImmediateFormat.IMM12);

    private final ImmediateFormat format;

    OperandKind(ImmediateFormat format) {
        this.format = format;
    }

    /**
     * @return The immediate format of this kind, or null for register kinds.
     */
    public ImmediateFormat format() {
        return format;
    }

    /**
     * @return true if the operand is encoded from a value rather than a register.
     */
    public boolean isValue() {
        return format != null;
    }

    /**
     * Maps a named register to the operand kind it satisfies.
     * @param register The register.
     * @return The matching operand kind.
     */
    public static OperandKind of(Register register) {
        if (register.isGeneralPurpose()) return VX;
        switch (register) {
            case I: return I;
            case DT: return DT;
            case ST: return ST;
            default: throw new IllegalArgumentException("Unknown register " + register);
        }
    }
}
