package org.sensorvault.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.sensorvault.storage.TestReadings.DEVICE_A;
import static org.sensorvault.storage.TestReadings.DEVICE_B;
import static org.sensorvault.storage.TestReadings.reading;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sensorvault.storage.api.IStorageBackend;
import org.sensorvault.storage.api.Reading;
import org.sensorvault.storage.api.ReadingFilter;
import org.sensorvault.storage.database.H2ReadingStore;
import org.sensorvault.storage.file.PartitionedFileStore;

import com.typesafe.config.ConfigFactory;

/**
 * Runs the same writes and queries against both backends and expects identical answers.
 */
@Tag("integration")
class BackendConsistencyTest {

    private static final Clock MAY_15 = Clock.fixed(Instant.parse("2026-05-15T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private String jdbcUrl;
    private PartitionedFileStore files;
    private H2ReadingStore indexed;

    @BeforeEach
    void setUp() {
        files = new PartitionedFileStore("files", ConfigFactory.parseMap(Map.of(
                "rootDirectory", tempDir.toString(),
                "partitionInterval", "1d")), MAY_15);
        jdbcUrl = "jdbc:h2:mem:consistency-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        indexed = new H2ReadingStore("indexed", ConfigFactory.parseMap(Map.of("jdbcUrl", jdbcUrl)));
    }

    @AfterEach
    void tearDown() throws Exception {
        files.close();
        indexed.close();
        try (Connection conn = DriverManager.getConnection(jdbcUrl, "sa", "");
             Statement stmt = conn.createStatement()) {
            stmt.execute("SHUTDOWN");
        }
    }

    private void writeToBoth(Reading reading) throws Exception {
        files.write(reading);
        indexed.write(reading);
    }

    @Test
    void everyAddressSpellingMatchesInBothBackends() throws Exception {
        writeToBoth(reading("a4c13800000a", "2026-04-03T10:00:00Z"));
        writeToBoth(reading("a4:c1:38:00:00:0a", "2026-04-04T10:00:00Z"));
        writeToBoth(reading(DEVICE_A, "2026-04-05T10:00:00Z"));

        for (String spelling : List.of(DEVICE_A, "a4c13800000a", "A4C13800000A", "a4:c1:38:00:00:0a")) {
            List<Reading> fromFiles = files.query(spelling, null, null);
            List<Reading> fromIndex = indexed.query(spelling, null, null);
            assertThat(fromFiles).as("file store, %s", spelling).hasSize(3);
            assertThat(fromIndex).as("indexed store, %s", spelling).containsExactlyElementsOf(fromFiles);
            assertThat(files.readingCount(spelling)).isEqualTo(indexed.readingCount(spelling));
        }
        assertThat(files.listDevices()).isEqualTo(indexed.listDevices()).containsExactly(DEVICE_A);
    }

    @Test
    void pagesAgreeBetweenBackends() throws Exception {
        Instant start = Instant.parse("2026-04-03T00:00:00Z");
        for (int i = 0; i < 30; i++) {
            String device = i % 3 == 0 ? DEVICE_B : DEVICE_A;
            writeToBoth(reading(device, start.plus(Duration.ofMinutes(i * 90L))));
        }
        // same instant for both devices: tie broken by address
        writeToBoth(reading(DEVICE_A, start.plus(Duration.ofDays(5))));
        writeToBoth(reading(DEVICE_B, start.plus(Duration.ofDays(5))));

        for (IStorageBackend backend : List.<IStorageBackend>of(files, indexed)) {
            assertThat(backend.readingCount(null)).isEqualTo(32);
        }
        for (int offset = 0; offset < 32; offset += 7) {
            assertThat(indexed.readingsPage(ReadingFilter.ALL, offset, 7))
                    .isEqualTo(files.readingsPage(ReadingFilter.ALL, offset, 7));
        }
        ReadingFilter filter = new ReadingFilter(DEVICE_B, "client-1", start, start.plus(Duration.ofDays(1)));
        assertThat(indexed.readingsPage(filter, 0, 50)).isEqualTo(files.readingsPage(filter, 0, 50));
        assertThat(indexed.latestReadings(2)).isEqualTo(files.latestReadings(2))
                .extracting(Reading::deviceAddr).containsExactly(DEVICE_A, DEVICE_B);
    }
}
