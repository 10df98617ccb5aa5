package org.sensorvault.storage.database;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.sensorvault.storage.TestReadings.DEVICE_A;
import static org.sensorvault.storage.TestReadings.DEVICE_B;
import static org.sensorvault.storage.TestReadings.reading;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.sensorvault.storage.api.DeviceStats;
import org.sensorvault.storage.api.HourlyAggregate;
import org.sensorvault.storage.api.Reading;
import org.sensorvault.storage.api.ReadingFilter;
import org.sensorvault.storage.api.ReadingPage;
import org.sensorvault.storage.api.StorageClosedException;

import com.typesafe.config.ConfigFactory;

@Tag("integration")
class H2ReadingStoreTest {

    private String jdbcUrl;
    private H2ReadingStore store;

    @BeforeEach
    void setUp() {
        jdbcUrl = "jdbc:h2:mem:readings-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        store = new H2ReadingStore("test-h2", ConfigFactory.parseMap(Map.of(
                "jdbcUrl", jdbcUrl,
                "maxPoolSize", 4,
                "minIdle", 1)));
    }

    @AfterEach
    void tearDown() throws Exception {
        store.close();
        try (Connection conn = DriverManager.getConnection(jdbcUrl, "sa", "");
             Statement stmt = conn.createStatement()) {
            stmt.execute("SHUTDOWN");
        }
    }

    @Test
    void writeAndQueryRoundTrip() throws Exception {
        Instant start = Instant.parse("2026-04-01T00:00:00.123456789Z");
        List<Reading> written = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            written.add(reading(DEVICE_A, start.plus(Duration.ofMinutes(i)), 18.0 + i));
        }
        for (int i = written.size() - 1; i >= 0; i--) {
            store.write(written.get(i));
        }
        store.write(reading(DEVICE_B, start));

        List<Reading> result = store.query(DEVICE_A, null, null);

        assertThat(result).containsExactlyElementsOf(written);
    }

    @Test
    void rangeBoundsAreInclusive() throws Exception {
        Instant t = Instant.parse("2026-04-10T10:00:00.000000500Z");
        store.write(reading(DEVICE_A, t));

        assertThat(store.query(DEVICE_A, t, t)).hasSize(1);
        assertThat(store.query(DEVICE_A, null, t.minusNanos(1))).isEmpty();
        assertThat(store.query(DEVICE_A, t.plusNanos(1), null)).isEmpty();
    }

    @Test
    void resubmittedReadingIsUpsertedNotDuplicated() throws Exception {
        Instant t = Instant.parse("2026-04-10T10:00:00Z");
        store.write(reading(DEVICE_A, t, 20.0));
        store.writeBatch(List.of(reading(DEVICE_A, t, 21.0), reading(DEVICE_A, t.plusSeconds(1), 22.0)));

        List<Reading> result = store.query(DEVICE_A, null, null);

        assertThat(result).hasSize(2);
        assertThat(result.get(0).tempC()).isEqualTo(21.0);
    }

    @Test
    void sameTimestampFromDifferentClientsIsKept() throws Exception {
        Instant t = Instant.parse("2026-04-10T10:00:00Z");
        store.write(Reading.measured(DEVICE_A, "s", t, 20.0, 40.0, 90, -60, "client-1"));
        store.write(Reading.measured(DEVICE_A, "s", t, 20.0, 40.0, 90, -65, "client-2"));

        assertThat(store.query(DEVICE_A, null, null)).hasSize(2);
    }

    @Test
    void statsUseSqlAggregates() throws Exception {
        store.write(reading(DEVICE_A, Instant.parse("2026-04-01T10:00:00Z"), 10.0));
        store.write(reading(DEVICE_A, Instant.parse("2026-04-01T12:00:00Z"), 30.0));
        store.write(Reading.measured(DEVICE_A, "s", Instant.parse("2026-04-01T11:00:00Z"), 20.0, 0.0, 60, -80, "c"));

        DeviceStats stats = store.stats(DEVICE_A);

        assertThat(stats.count()).isEqualTo(3);
        assertThat(stats.tempC().min()).isEqualTo(10.0);
        assertThat(stats.tempC().max()).isEqualTo(30.0);
        assertThat(stats.tempC().avg()).isCloseTo(20.0, within(1e-9));
        assertThat(stats.battery().min()).isEqualTo(60.0);
        assertThat(stats.rssi().avg()).isCloseTo(-73.333, within(0.001));
        assertThat(stats.dewPointC().avg()).isNotNaN();
        assertThat(stats.firstReading()).isEqualTo(Instant.parse("2026-04-01T10:00:00Z"));
        assertThat(stats.lastReading()).isEqualTo(Instant.parse("2026-04-01T12:00:00Z"));
    }

    @Test
    void undefinedDewPointSurvivesStorage() throws Exception {
        Reading dry = Reading.measured(DEVICE_A, "s", Instant.parse("2026-04-01T11:00:00Z"), 20.0, 0.0, 60, -80, "c");
        store.write(dry);

        assertThat(store.query(DEVICE_A, null, null)).containsExactly(dry);
    }

    @Test
    void unknownDeviceYieldsEmptyResults() throws Exception {
        assertThat(store.query(DEVICE_B, null, null)).isEmpty();
        assertThat(store.stats(DEVICE_B).isEmpty()).isTrue();
        assertThat(store.stats(DEVICE_B).firstReading()).isNull();
    }

    @Test
    void listsDevicesAndAggregatesHours() throws Exception {
        store.write(reading(DEVICE_B, Instant.parse("2026-04-01T10:15:00Z"), 10.0));
        store.write(reading(DEVICE_A, Instant.parse("2026-04-01T10:15:00Z"), 10.0));
        store.write(reading(DEVICE_A, Instant.parse("2026-04-01T10:45:00Z"), 20.0));
        store.write(reading(DEVICE_A, Instant.parse("2026-04-01T11:05:00Z"), 30.0));

        assertThat(store.listDevices()).containsExactly(DEVICE_A, DEVICE_B);

        List<HourlyAggregate> hours = store.hourlyAggregates(DEVICE_A, null, null);
        assertThat(hours).hasSize(2);
        assertThat(hours.get(0).count()).isEqualTo(2);
        assertThat(hours.get(0).tempC().avg()).isCloseTo(15.0, within(1e-9));
    }

    @Test
    void purgeDeletesOlderRows() throws Exception {
        store.write(reading(DEVICE_A, "2026-03-31T23:59:59Z"));
        store.write(reading(DEVICE_A, "2026-04-01T00:00:00Z"));

        assertThat(store.purgeBefore(Instant.parse("2026-04-01T00:00:00Z"))).isEqualTo(1);
        assertThat(store.query(DEVICE_A, null, null)).extracting(Reading::timestamp)
                .containsExactly(Instant.parse("2026-04-01T00:00:00Z"));
    }

    @Test
    void schemaHasExpectedIndexes() throws Exception {
        try (Connection conn = DriverManager.getConnection(jdbcUrl, "sa", "");
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT INDEX_NAME FROM INFORMATION_SCHEMA.INDEXES WHERE TABLE_NAME = 'READINGS'")) {
            List<String> indexes = new ArrayList<>();
            while (rs.next()) {
                indexes.add(rs.getString(1));
            }
            assertThat(indexes).contains("IDX_READINGS_DEVICE", "IDX_READINGS_TIMESTAMP",
                    "IDX_READINGS_DEVICE_TIMESTAMP", "IDX_READINGS_CLIENT", "UQ_READINGS_IDENTITY");
        }
    }

    @Test
    void concurrentWritersLoseNothing() throws Exception {
        Instant start = Instant.parse("2026-04-01T00:00:00Z");
        ExecutorService executor = Executors.newFixedThreadPool(10);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < 10; w++) {
                final int writer = w;
                futures.add(executor.submit(() -> {
                    go.await();
                    for (int i = 0; i < 100; i++) {
                        store.write(reading(DEVICE_A, start.plusMillis(writer * 1000L + i)));
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        List<Reading> result = store.query(DEVICE_A, null, null);
        assertThat(result).hasSize(1000);
        assertThat(result).isSortedAccordingTo((a, b) -> a.timestamp().compareTo(b.timestamp()));
        assertThat(store.readingCount(DEVICE_A)).isEqualTo(1000);
    }

    @Test
    void addressSpellingsReachTheSameDevice() throws Exception {
        store.write(reading("a4:c1:38:00:00:0a", "2026-04-03T00:00:00Z"));
        store.write(reading("A4C13800000A", "2026-04-04T00:00:00Z"));

        assertThat(store.query(DEVICE_A, null, null)).hasSize(2)
                .extracting(Reading::deviceAddr).containsOnly(DEVICE_A);
        assertThat(store.query("a4c13800000a", null, null)).hasSize(2);
        assertThat(store.stats("a4:c1:38:00:00:0a").count()).isEqualTo(2);
        assertThat(store.listDevices()).containsExactly(DEVICE_A);
        assertThatThrownBy(() -> store.write(reading("a4:c1:38:12:34", "2026-04-03T00:00:00Z")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pagesNewestFirstWithFilters() throws Exception {
        Instant start = Instant.parse("2026-04-03T00:00:00Z");
        for (int i = 0; i < 10; i++) {
            store.write(reading(DEVICE_A, start.plus(Duration.ofHours(i))));
        }
        store.write(Reading.measured(DEVICE_B, "other", start.plus(Duration.ofMinutes(30)), 20.0, 40.0, 90, -60,
                "client-2"));

        ReadingPage first = store.readingsPage(ReadingFilter.ALL, 0, 4);
        assertThat(first.total()).isEqualTo(11);
        assertThat(first.readings()).extracting(Reading::timestamp)
                .containsExactly(start.plus(Duration.ofHours(9)), start.plus(Duration.ofHours(8)),
                        start.plus(Duration.ofHours(7)), start.plus(Duration.ofHours(6)));
        ReadingPage last = store.readingsPage(ReadingFilter.ALL, 8, 4);
        assertThat(last.readings()).extracting(Reading::deviceAddr).containsExactly(DEVICE_A, DEVICE_B, DEVICE_A);
        assertThat(last.hasMore()).isFalse();

        ReadingPage client = store.readingsPage(new ReadingFilter(null, "client-2", null, null), 0, 10);
        assertThat(client.total()).isEqualTo(1);
        ReadingPage window = store.readingsPage(new ReadingFilter("a4c13800000a", null,
                start.plus(Duration.ofHours(2)), start.plus(Duration.ofHours(4))), 0, 2);
        assertThat(window.total()).isEqualTo(3);
        assertThat(window.readings()).hasSize(2);
        assertThat(window.hasMore()).isTrue();

        assertThat(store.latestReadings(1)).extracting(Reading::timestamp)
                .containsExactly(start.plus(Duration.ofHours(9)));
        assertThat(store.readingCount(null)).isEqualTo(11);
        assertThat(store.readingCount(DEVICE_B)).isEqualTo(1);
        assertThatThrownBy(() -> store.readingsPage(ReadingFilter.ALL, 0, -5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsInvalidInputAndUseAfterClose() throws Exception {
        assertThatThrownBy(() -> store.write(reading("not-a-mac", "2026-04-01T00:00:00Z")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.query(DEVICE_A, Instant.parse("2026-04-02T00:00:00Z"),
                Instant.parse("2026-04-01T00:00:00Z"))).isInstanceOf(IllegalArgumentException.class);

        store.close();
        assertThatThrownBy(() -> store.write(reading(DEVICE_A, "2026-04-01T00:00:00Z")))
                .isInstanceOf(StorageClosedException.class);
        assertThatThrownBy(() -> store.listDevices()).isInstanceOf(StorageClosedException.class);
    }
}
