package org.chasm.cli.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.chasm.compiler.api.ProgramArtifact;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Serializes a {@link ProgramArtifact} in one of the {@link OutputFormat}s.
 */
public final class ArtifactWriter {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private ArtifactWriter() {}

    /**
     * Writes the artifact to a file, replacing any existing content.
     * @param artifact The compiled program.
     * @param format The output format.
     * @param target The output file.
     * @throws IOException if the file cannot be written.
     */
    public static void write(ProgramArtifact artifact, OutputFormat format, Path target) throws IOException {
        if (format == OutputFormat.BINARY) {
            Files.write(target, artifact.toBytes());
        } else {
            Files.writeString(target, render(artifact, format), StandardCharsets.UTF_8);
        }
    }

    /**
     * Renders the artifact in a text format.
     * @param artifact The compiled program.
     * @param format {@link OutputFormat#HEX} or {@link OutputFormat#JSON}.
     * @return The rendered text.
     * @throws IllegalArgumentException for {@link OutputFormat#BINARY}.
     */
    public static String render(ProgramArtifact artifact, OutputFormat format) {
        switch (format) {
            case HEX:
                StringBuilder sb = new StringBuilder();
                for (int word : artifact.words()) {
                    sb.append(String.format("%04X", word)).append('\n');
                }
                return sb.toString();
            case JSON:
                return GSON.toJson(toJson(artifact));
            default:
                throw new IllegalArgumentException("Format " + format + " is not a text format");
        }
    }

    private static JsonObject toJson(ProgramArtifact artifact) {
        JsonObject root = new JsonObject();
        root.addProperty("programName", artifact.programName());
        root.addProperty("baseAddress", artifact.baseAddress());
        JsonArray words = new JsonArray();
        artifact.words().forEach(words::add);
        root.add("words", words);
        root.add("symbols", toJson(artifact.symbolAddresses()));
        root.add("config", toJson(artifact.configValues()));
        return root;
    }

    private static JsonObject toJson(Map<String, Integer> values) {
        JsonObject object = new JsonObject();
        values.forEach(object::addProperty);
        return object;
    }
}
