package org.chasm.compiler.isa;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed constants of the target machine, consulted by the parser and the backend.
 */
public final class Architecture {

    /** Size of the addressable memory in bytes. */
    public static final int MEMORY_SIZE = 4096;
    /** Address at which programs are loaded and start executing. */
    public static final int LOAD_ADDRESS = 0x200;
    /** Size of one machine word in bytes. */
    public static final int WORD_SIZE = 2;
    /** Maximum number of rows a sprite can have (the N field of DRW). */
    public static final int MAX_SPRITE_ROWS = 15;
    /** Format every sprite row must satisfy. */
    public static final ImmediateFormat SPRITE_ROW_FORMAT = ImmediateFormat.IMM8;
    /** Format of values emitted by raw statements. */
    public static final ImmediateFormat RAW_FORMAT = ImmediateFormat.IMM16;

    private static final Map<String, Integer> DEFAULTS;

    static {
        Map<String, Integer> defaults = new LinkedHashMap<>();
        defaults.put("MEMORY_SIZE", MEMORY_SIZE);
        defaults.put("LOAD_ADDRESS", LOAD_ADDRESS);
        defaults.put("FONT_ADDRESS", 0x050);
        defaults.put("FONT_HEIGHT", 5);
        defaults.put("SCREEN_WIDTH", 64);
        defaults.put("SCREEN_HEIGHT", 32);
        defaults.put("STACK_DEPTH", 16);
        defaults.put("TIMER_FREQUENCY", 60);
        defaults.put("REGISTER_COUNT", 16);
        defaults.put("MAX_SPRITE_ROWS", MAX_SPRITE_ROWS);
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private Architecture() {}

    /**
     * Looks up the value the architecture declares for a symbol requested with {@code default}.
     * @param name The symbol name, matched exactly.
     * @return The default value, or empty if the architecture declares none.
     */
    public static Optional<Integer> defaultValue(String name) {
        return Optional.ofNullable(DEFAULTS.get(name));
    }

    /**
     * @return All declared defaults, in declaration order.
     */
    public static Map<String, Integer> defaults() {
        return DEFAULTS;
    }

    /**
     * @return The instruction table of this architecture.
     */
    public static IInstructionSet instructionSet() {
        return Chip8InstructionSet.getInstance();
    }
}
