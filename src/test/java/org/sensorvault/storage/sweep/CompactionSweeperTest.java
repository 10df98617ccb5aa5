package org.sensorvault.storage.sweep;

import static org.assertj.core.api.Assertions.assertThat;
import static org.sensorvault.storage.TestReadings.DEVICE_A;
import static org.sensorvault.storage.TestReadings.DEVICE_B;
import static org.sensorvault.storage.TestReadings.reading;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sensorvault.storage.api.CancellationToken;
import org.sensorvault.storage.api.Reading;
import org.sensorvault.storage.file.PartitionedFileStore;

import com.typesafe.config.ConfigFactory;

@Tag("integration")
class CompactionSweeperTest {

    private static final Clock MAY_15 = Clock.fixed(Instant.parse("2026-05-15T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private PartitionedFileStore open(boolean compression) {
        return new PartitionedFileStore("compaction-test", ConfigFactory.parseMap(Map.of(
                "rootDirectory", tempDir.toString(),
                "partitionInterval", "30d",
                "compression", Map.of("enabled", compression))), MAY_15);
    }

    @Test
    void compressesOnlyPartitionsOlderThanCurrent() throws Exception {
        try (PartitionedFileStore store = open(true)) {
            store.write(reading(DEVICE_A, "2026-03-10T08:00:00Z"));
            store.write(reading(DEVICE_B, "2026-03-11T08:00:00Z"));
            store.write(reading(DEVICE_A, "2026-04-10T08:00:00Z"));
            store.write(reading(DEVICE_A, "2026-05-10T08:00:00Z"));
            List<Reading> before = store.query(DEVICE_A, null, null);

            CompactionSweeper sweeper = new CompactionSweeper(store, MAY_15);
            SweepResult first = sweeper.sweep(CancellationToken.none());

            assertThat(first.affected()).isEqualTo(2);
            assertThat(Files.exists(tempDir.resolve("2026-03/readings_a4c13800000a.json.gz"))).isTrue();
            assertThat(Files.exists(tempDir.resolve("2026-03/readings_a4c13800000b.json.gz"))).isTrue();
            assertThat(Files.exists(tempDir.resolve("2026-04/readings_a4c13800000a.json.gz"))).isTrue();
            assertThat(Files.exists(tempDir.resolve("2026-05/readings_a4c13800000a.json"))).isTrue();
            assertThat(store.query(DEVICE_A, null, null)).isEqualTo(before);

            SweepResult second = sweeper.sweep(CancellationToken.none());
            assertThat(second.examined()).isEqualTo(2);
            assertThat(second.affected()).isZero();
        }
    }

    @Test
    void lateWriteIntoCompressedPartitionIsCompressedByNextSweep() throws Exception {
        try (PartitionedFileStore store = open(true)) {
            store.write(reading(DEVICE_A, "2026-03-10T08:00:00Z"));
            CompactionSweeper sweeper = new CompactionSweeper(store, MAY_15);
            assertThat(sweeper.sweep(CancellationToken.none()).affected()).isEqualTo(1);

            store.write(reading(DEVICE_A, "2026-03-11T08:00:00Z"));
            SweepResult again = sweeper.sweep(CancellationToken.none());

            assertThat(again.affected()).isEqualTo(1);
            assertThat(Files.exists(tempDir.resolve("2026-03/readings_a4c13800000a.1.json.gz"))).isTrue();
            assertThat(Files.exists(tempDir.resolve("2026-03/readings_a4c13800000a.1.json"))).isFalse();
            assertThat(store.query(DEVICE_A, null, null)).hasSize(2);
        }
    }

    @Test
    void disabledCompressionLeavesFilesAlone() throws Exception {
        try (PartitionedFileStore store = open(false)) {
            store.write(reading(DEVICE_A, "2026-03-10T08:00:00Z"));

            SweepResult result = new CompactionSweeper(store, MAY_15).sweep(CancellationToken.none());

            assertThat(result.affected()).isZero();
            assertThat(Files.exists(tempDir.resolve("2026-03/readings_a4c13800000a.json"))).isTrue();
        }
    }
}
