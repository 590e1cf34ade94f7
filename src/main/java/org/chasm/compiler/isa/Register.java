package org.chasm.compiler.isa;

import java.util.Locale;
import java.util.Optional;

/**
 * The registers of the target machine as they can be named in source code.
 */
public enum Register {
    V0(0), V1(1), V2(2), V3(3), V4(4), V5(5), V6(6), V7(7),
    V8(8), V9(9), VA(10), VB(11), VC(12), VD(13), VE(14), VF(15),
    /** The 12-bit index register. */
    I(-1),
    /** The delay timer. */
    DT(-1),
    /** The sound timer. */
    ST(-1);

    private final int index;

    Register(int index) {
        this.index = index;
    }

    /**
     * @return The 4-bit register field value, or -1 for special registers.
     */
    public int index() {
        return index;
    }

    /**
     * @return true for V0..VF.
     */
    public boolean isGeneralPurpose() {
        return index >= 0;
    }

    /**
     * Resolves a register name case-insensitively (e.g., "v3", "DT").
     * @param name The register name.
     * @return The register, or empty if the name is not a register.
     */
    public static Optional<Register> fromName(String name) {
        if (name == null) return Optional.empty();
        try {
            return Optional.of(Register.valueOf(name.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
