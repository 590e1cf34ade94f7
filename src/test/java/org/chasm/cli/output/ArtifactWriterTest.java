package org.chasm.cli.output;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.chasm.compiler.api.ProgramArtifact;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ArtifactWriterTest {

    private static ProgramArtifact artifact() {
        Map<String, Integer> symbols = new LinkedHashMap<>();
        symbols.put("main", 0x200);
        symbols.put("face", 0x204);
        return new ProgramArtifact("game.asm", 0x200, List.of(0x00E0, 0x1200, 0x3C42),
                symbols, Map.of("SPEED", 4), Map.of());
    }

    @Test
    void rendersOneHexWordPerLine() {
        assertThat(ArtifactWriter.render(artifact(), OutputFormat.HEX)).isEqualTo("00E0\n1200\n3C42\n");
    }

    @Test
    void rendersJsonWithMetadata() {
        JsonObject json = JsonParser.parseString(ArtifactWriter.render(artifact(), OutputFormat.JSON)).getAsJsonObject();

        assertThat(json.get("programName").getAsString()).isEqualTo("game.asm");
        assertThat(json.get("baseAddress").getAsInt()).isEqualTo(0x200);
        assertThat(json.getAsJsonArray("words")).hasSize(3);
        assertThat(json.getAsJsonArray("words").get(2).getAsInt()).isEqualTo(0x3C42);
        assertThat(json.getAsJsonObject("symbols").keySet()).containsExactly("main", "face");
        assertThat(json.getAsJsonObject("config").get("SPEED").getAsInt()).isEqualTo(4);
    }

    @Test
    void binaryIsNotATextFormat() {
        assertThatThrownBy(() -> ArtifactWriter.render(artifact(), OutputFormat.BINARY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void writesBigEndianImage(@TempDir Path dir) throws IOException {
        Path target = dir.resolve("game.c8c");

        ArtifactWriter.write(artifact(), OutputFormat.BINARY, target);

        assertThat(Files.readAllBytes(target)).isEqualTo(new byte[] {0x00, (byte) 0xE0, 0x12, 0x00, 0x3C, 0x42});
    }

    @Test
    void replacesExistingFile(@TempDir Path dir) throws IOException {
        Path target = dir.resolve("game.hex");
        Files.writeString(target, "stale content that is longer than the program\n");

        ArtifactWriter.write(artifact(), OutputFormat.HEX, target);

        assertThat(target).hasContent("00E0\n1200\n3C42");
    }
}
