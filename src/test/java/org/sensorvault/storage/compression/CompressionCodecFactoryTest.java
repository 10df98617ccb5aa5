package org.sensorvault.storage.compression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class CompressionCodecFactoryTest {

    @Test
    void defaultsToGzipWhenEnabled() {
        ICompressionCodec codec = CompressionCodecFactory.create(ConfigFactory.parseString("compression.enabled = true"));
        assertThat(codec.getName()).isEqualTo("gzip");
        assertThat(codec.getFileExtension()).isEqualTo(".gz");
    }

    @Test
    void disabledOrMissingBlockYieldsPassThrough() {
        assertThat(CompressionCodecFactory.create(ConfigFactory.empty()).getName()).isEqualTo("none");
        assertThat(CompressionCodecFactory.create(ConfigFactory.parseString("compression.enabled = false"))
                .getFileExtension()).isEmpty();
    }

    @Test
    void rejectsUnknownCodecAndBadLevel() {
        assertThatThrownBy(() -> CompressionCodecFactory.create(ConfigFactory.parseString("compression.codec = lz4")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CompressionCodecFactory.create(ConfigFactory.parseString("compression.level = 12")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void gzipRoundTrip() throws IOException {
        ICompressionCodec codec = new GzipCodec(9);
        byte[] payload = "{\"temp_c\":21.5}\n".repeat(200).getBytes(StandardCharsets.UTF_8);

        ByteArrayOutputStream compressed = new ByteArrayOutputStream();
        try (OutputStream out = codec.wrapOutputStream(compressed)) {
            out.write(payload);
        }
        assertThat(compressed.size()).isLessThan(payload.length);

        try (InputStream in = codec.wrapInputStream(new ByteArrayInputStream(compressed.toByteArray()))) {
            assertThat(in.readAllBytes()).isEqualTo(payload);
        }
    }

    @Test
    void detectsCodecFromExtension() {
        assertThat(CompressionCodecFactory.detectFromExtension("readings_a4c138123456.json.gz").getName()).isEqualTo("gzip");
        assertThat(CompressionCodecFactory.detectFromExtension("readings_a4c138123456.json").getName()).isEqualTo("none");
    }
}
