package org.chasm.compiler.backend.layout;

import org.chasm.compiler.api.CompilationException;
import org.chasm.compiler.api.CompilerErrorCode;
import org.chasm.compiler.api.SourceInfo;
import org.chasm.compiler.isa.Architecture;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable state of a layout pass: the next free byte address and the origin of every placed item.
 */
public final class LayoutContext {

    private final int baseAddress;
    private final int memorySize;
    private int address;
    private final Map<Integer, SourceInfo> sourceMap = new LinkedHashMap<>();

    public LayoutContext(int baseAddress, int memorySize) {
        this.baseAddress = baseAddress;
        this.memorySize = memorySize;
        this.address = baseAddress;
    }

    public LayoutContext() {
        this(Architecture.LOAD_ADDRESS, Architecture.MEMORY_SIZE);
    }

    public int baseAddress() {
        return baseAddress;
    }

    /**
     * @return The address the next placed item will get.
     */
    public int address() {
        return address;
    }

    /**
     * Reserves memory for one item.
     * @param size The number of bytes.
     * @param source The statement that produces the bytes.
     * @return The address of the first reserved byte.
     * @throws CompilationException if the item does not fit into memory.
     */
    public int place(int size, SourceInfo source) throws CompilationException {
        if (address + size > memorySize) {
            throw new CompilationException(CompilerErrorCode.PROGRAM_TOO_LARGE,
                    String.format("Program does not fit into memory: %d bytes at 0x%03X exceed the limit of 0x%03X",
                            size, address, memorySize),
                    source);
        }
        int placed = address;
        sourceMap.put(placed, source);
        address += size;
        return placed;
    }

    public Map<Integer, SourceInfo> sourceMap() {
        return sourceMap;
    }
}
