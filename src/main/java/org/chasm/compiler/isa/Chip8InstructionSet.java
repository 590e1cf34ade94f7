package org.chasm.compiler.isa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static org.chasm.compiler.isa.OperandKind.ADDR;
import static org.chasm.compiler.isa.OperandKind.DT;
import static org.chasm.compiler.isa.OperandKind.I;
import static org.chasm.compiler.isa.OperandKind.N4;
import static org.chasm.compiler.isa.OperandKind.N8;
import static org.chasm.compiler.isa.OperandKind.ST;
import static org.chasm.compiler.isa.OperandKind.VX;

/**
 * The fixed CHIP-8 instruction table. Templates of one mnemonic are tried in declaration order.
 */
public final class Chip8InstructionSet implements IInstructionSet {

    private static final Chip8InstructionSet INSTANCE = new Chip8InstructionSet();

    private static final int X = 8;
    private static final int Y = 4;
    private static final int LOW = 0;
    private static final int IMPLIED = -1;

    private final Map<String, List<OpcodeTemplate>> templates = new LinkedHashMap<>();

    private Chip8InstructionSet() {
        register("cls", 0x00E0);
        register("ret", 0x00EE);
        register("sys", 0x0000, slot(ADDR, LOW));
        register("jmp", 0x1000, slot(ADDR, LOW));
        register("call", 0x2000, slot(ADDR, LOW));

        register("se", 0x3000, slot(VX, X), slot(N8, LOW));
        register("se", 0x5000, slot(VX, X), slot(VX, Y));
        register("sne", 0x4000, slot(VX, X), slot(N8, LOW));
        register("sne", 0x9000, slot(VX, X), slot(VX, Y));

        register("ld", 0x6000, slot(VX, X), slot(N8, LOW));
        register("ld", 0x8000, slot(VX, X), slot(VX, Y));
        register("ld", 0xF007, slot(VX, X), slot(DT, IMPLIED));
        register("ld", 0xF015, slot(DT, IMPLIED), slot(VX, X));
        register("ld", 0xF018, slot(ST, IMPLIED), slot(VX, X));
        register("ld", 0xA000, slot(I, IMPLIED), slot(ADDR, LOW));

        register("add", 0x7000, slot(VX, X), slot(N8, LOW));
        register("add", 0x8004, slot(VX, X), slot(VX, Y));
        register("add", 0xF01E, slot(I, IMPLIED), slot(VX, X));

        register("or", 0x8001, slot(VX, X), slot(VX, Y));
        register("and", 0x8002, slot(VX, X), slot(VX, Y));
        register("xor", 0x8003, slot(VX, X), slot(VX, Y));
        register("sub", 0x8005, slot(VX, X), slot(VX, Y));
        register("subn", 0x8007, slot(VX, X), slot(VX, Y));
        register("shr", 0x8006, slot(VX, X));
        register("shr", 0x8006, slot(VX, X), slot(VX, Y));
        register("shl", 0x800E, slot(VX, X));
        register("shl", 0x800E, slot(VX, X), slot(VX, Y));

        register("ldi", 0xA000, slot(ADDR, LOW));
        register("jmpv0", 0xB000, slot(ADDR, LOW));
        register("rnd", 0xC000, slot(VX, X), slot(N8, LOW));
        register("drw", 0xD000, slot(VX, X), slot(VX, Y), slot(N4, LOW));

        register("skp", 0xE09E, slot(VX, X));
        register("sknp", 0xE0A1, slot(VX, X));
        register("wkey", 0xF00A, slot(VX, X));
        register("font", 0xF029, slot(VX, X));
        register("bcd", 0xF033, slot(VX, X));
        register("stm", 0xF055, slot(VX, X));
        register("ldm", 0xF065, slot(VX, X));
    }

    /**
     * @return The shared instruction table.
     */
    public static Chip8InstructionSet getInstance() {
        return INSTANCE;
    }

    private static OpcodeTemplate.Slot slot(OperandKind kind, int shift) {
        return new OpcodeTemplate.Slot(kind, shift);
    }

    private void register(String mnemonic, int baseWord, OpcodeTemplate.Slot... slots) {
        templates.computeIfAbsent(mnemonic, k -> new ArrayList<>())
                .add(new OpcodeTemplate(mnemonic, baseWord, List.of(slots)));
    }

    @Override
    public boolean isMnemonic(String name) {
        return name != null && templates.containsKey(name.toLowerCase(Locale.ROOT));
    }

    @Override
    public List<OpcodeTemplate> getTemplates(String mnemonic) {
        if (mnemonic == null) return List.of();
        return Collections.unmodifiableList(templates.getOrDefault(mnemonic.toLowerCase(Locale.ROOT), List.of()));
    }

    @Override
    public Set<String> mnemonics() {
        return Collections.unmodifiableSet(templates.keySet());
    }
}
