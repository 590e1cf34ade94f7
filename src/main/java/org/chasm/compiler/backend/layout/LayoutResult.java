package org.chasm.compiler.backend.layout;

import org.chasm.compiler.api.SourceInfo;

import java.util.Map;

/**
 * Result of the layout phase. Symbol addresses are bound in the symbol table itself.
 *
 * @param baseAddress The address of the first byte of the image.
 * @param endAddress The address after the last byte of the image.
 * @param sourceMap A map from the start address of every placed item to its source position.
 */
public record LayoutResult(
        int baseAddress,
        int endAddress,
        Map<Integer, SourceInfo> sourceMap
) {
    /**
     * @return The size of the byte image.
     */
    public int size() {
        return endAddress - baseAddress;
    }
}
