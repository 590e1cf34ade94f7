package org.chasm.compiler.isa;

/**
 * Bit-width families of immediate values the target machine can encode.
 */
public enum ImmediateFormat {
    /** A nibble, e.g. the row count of DRW. */
    IMM4(4),
    /** A byte, e.g. the constant of LD Vx, nn and every sprite row. */
    IMM8(8),
    /** A 12-bit memory address. */
    IMM12(12),
    /** A full machine word, only used by raw statements. */
    IMM16(16);

    private final int bits;

    ImmediateFormat(int bits) {
        this.bits = bits;
    }

    /**
     * @return The width of this format in bits.
     */
    public int bits() {
        return bits;
    }

    /**
     * @return The largest unsigned value this format can hold.
     */
    public int max() {
        return (1 << bits) - 1;
    }

    /**
     * Checks whether a value can be encoded in this format.
     * @param value The value to check.
     * @return true if {@code 0 <= value <= max()}.
     */
    public boolean matches(int value) {
        return value >= 0 && value <= max();
    }
}
