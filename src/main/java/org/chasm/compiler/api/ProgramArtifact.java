package org.chasm.compiler.api;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Represents the complete, self-contained output of the compilation process.
 * This is an immutable data carrier that includes the compiled machine words
 * and the metadata a loader or debugger needs.
 *
 * @param programName The name of the compiled program, used for diagnostics.
 * @param baseAddress The memory address at which the first word must be loaded.
 * @param words The program image as ordered 16-bit machine words.
 * @param symbolAddresses A map from label, procedure and sprite names to their memory addresses.
 * @param configValues A map from config names to their resolved values.
 * @param sourceMap A map from word index to the source position of the statement that produced it.
 */
public record ProgramArtifact(
        String programName,
        int baseAddress,
        List<Integer> words,
        Map<String, Integer> symbolAddresses,
        Map<String, Integer> configValues,
        Map<Integer, SourceInfo> sourceMap
) {
    public ProgramArtifact {
        words = List.copyOf(words);
        symbolAddresses = Collections.unmodifiableMap(symbolAddresses);
        configValues = Collections.unmodifiableMap(configValues);
        sourceMap = sourceMap != null ? Collections.unmodifiableMap(sourceMap) : Collections.emptyMap();
    }

    /**
     * Returns the program image as big-endian bytes, two per word.
     * @return The byte image, ready to be copied to {@link #baseAddress()}.
     */
    public byte[] toBytes() {
        byte[] bytes = new byte[words.size() * 2];
        for (int i = 0; i < words.size(); i++) {
            int word = words.get(i);
            bytes[2 * i] = (byte) (word >>> 8);
            bytes[2 * i + 1] = (byte) word;
        }
        return bytes;
    }
}
