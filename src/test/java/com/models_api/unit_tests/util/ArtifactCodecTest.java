package com.models_api.unit_tests.util;

import com.models_api.util.ArtifactCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArtifactCodecTest {

    @TempDir
    Path folder;

    @Test
    void readType_ReadsOnlyTheHeader() throws Exception {
        byte[] bytes = ArtifactCodec.encode("weka", new byte[4096]);
        Path file = folder.resolve("m.model");
        Files.write(file, bytes);

        assertThat(ArtifactCodec.readType(file)).isEqualTo("weka");
        assertThat(ArtifactCodec.decode(bytes).payload()).hasSize(4096);
    }

    @Test
    void decode_RejectsForeignFiles() {
        byte[] bytes = "{\"not\":\"an artifact\"}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> ArtifactCodec.decode(bytes))
                .isInstanceOf(IOException.class)
                .hasMessage("Not a model artifact");
    }

    @Test
    void decode_RejectsTruncatedPayload() {
        byte[] bytes = ArtifactCodec.encode("demo", new byte[]{1, 2, 3, 4, 5, 6, 7, 8});
        byte[] truncated = Arrays.copyOf(bytes, bytes.length - 3);

        assertThatThrownBy(() -> ArtifactCodec.decode(truncated))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("truncated");
    }
}
