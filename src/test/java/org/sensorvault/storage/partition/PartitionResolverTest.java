package org.sensorvault.storage.partition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class PartitionResolverTest {

    private final PartitionResolver daily = new PartitionResolver(Duration.ofHours(24));
    private final PartitionResolver weekly = new PartitionResolver(Duration.ofDays(7));
    private final PartitionResolver monthly = new PartitionResolver(Duration.ofDays(30));

    @Test
    void granularityFollowsInterval() {
        assertThat(new PartitionResolver(Duration.ofHours(1)).getGranularity()).isEqualTo(PartitionGranularity.DAILY);
        assertThat(daily.getGranularity()).isEqualTo(PartitionGranularity.DAILY);
        assertThat(new PartitionResolver(Duration.ofHours(25)).getGranularity()).isEqualTo(PartitionGranularity.WEEKLY);
        assertThat(weekly.getGranularity()).isEqualTo(PartitionGranularity.WEEKLY);
        assertThat(new PartitionResolver(Duration.ofDays(8)).getGranularity()).isEqualTo(PartitionGranularity.MONTHLY);
        assertThat(monthly.getGranularity()).isEqualTo(PartitionGranularity.MONTHLY);
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> new PartitionResolver(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PartitionResolver(Duration.ofHours(-1))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sameDayMapsToSameDailyPartition() {
        PartitionId morning = daily.resolve(Instant.parse("2026-03-14T00:00:00Z"));
        PartitionId night = daily.resolve(Instant.parse("2026-03-14T23:59:59.999999999Z"));
        PartitionId nextDay = daily.resolve(Instant.parse("2026-03-15T00:00:00.000000001Z"));

        assertThat(morning.name()).isEqualTo("2026-03-14");
        assertThat(night).isEqualTo(morning);
        assertThat(nextDay.name()).isEqualTo("2026-03-15");
        assertThat(nextDay.name()).isGreaterThan(morning.name());
        assertThat(morning.start()).isEqualTo(Instant.parse("2026-03-14T00:00:00Z"));
        assertThat(morning.end()).isEqualTo(Instant.parse("2026-03-15T00:00:00Z"));
    }

    @Test
    void weeklyPartitionsUseIsoWeekBasedYear() {
        // 2026-01-01 is a Thursday and belongs to ISO week 2026-W01, which starts on 2025-12-29
        PartitionId week = weekly.resolve(Instant.parse("2026-01-01T10:00:00Z"));
        assertThat(week.name()).isEqualTo("2026-W01");
        assertThat(week.start()).isEqualTo(Instant.parse("2025-12-29T00:00:00Z"));
        assertThat(week.end()).isEqualTo(Instant.parse("2026-01-05T00:00:00Z"));

        PartitionId sunday = weekly.resolve(Instant.parse("2026-01-04T23:59:59Z"));
        PartitionId monday = weekly.resolve(Instant.parse("2026-01-05T00:00:00Z"));
        assertThat(sunday).isEqualTo(week);
        assertThat(monday.name()).isEqualTo("2026-W02");
        assertThat(monday.name()).isGreaterThan(sunday.name());
    }

    @Test
    void monthlyPartitionsCoverCalendarMonths() {
        PartitionId feb = monthly.resolve(Instant.parse("2028-02-29T12:00:00Z"));
        assertThat(feb.name()).isEqualTo("2028-02");
        assertThat(feb.start()).isEqualTo(Instant.parse("2028-02-01T00:00:00Z"));
        assertThat(feb.end()).isEqualTo(Instant.parse("2028-03-01T00:00:00Z"));

        PartitionId march = monthly.resolve(Instant.parse("2028-03-01T00:00:00Z"));
        assertThat(march.name()).isEqualTo("2028-03");
        assertThat(march.name()).isGreaterThan(feb.name());
    }

    @Test
    void identifierOrderFollowsTimestampOrder() {
        Instant t = Instant.parse("2025-11-20T08:00:00Z");
        for (PartitionResolver resolver : new PartitionResolver[] {daily, weekly, monthly}) {
            PartitionId previous = resolver.resolve(t);
            for (int day = 1; day < 120; day++) {
                PartitionId current = resolver.resolve(t.plus(Duration.ofDays(day)));
                assertThat(current.name()).isGreaterThanOrEqualTo(previous.name());
                assertThat(current.start()).isAfterOrEqualTo(previous.start());
                previous = current;
            }
        }
    }

    @Test
    void parseRestoresRangeFromName() {
        assertThat(daily.parse("2026-03-14")).contains(daily.resolve(Instant.parse("2026-03-14T05:00:00Z")));
        assertThat(weekly.parse("2026-W01")).contains(weekly.resolve(Instant.parse("2026-01-01T10:00:00Z")));
        assertThat(monthly.parse("2026-05")).contains(monthly.resolve(Instant.parse("2026-05-20T00:00:00Z")));
        // any format is understood regardless of the configured interval
        assertThat(monthly.parse("2026-03-14")).map(PartitionId::granularity).contains(PartitionGranularity.DAILY);
    }

    @Test
    void parseRejectsForeignNames() {
        assertThat(daily.parse("lost+found")).isEmpty();
        assertThat(daily.parse("2026-02-30")).isEmpty();
        assertThat(daily.parse("2026-13")).isEmpty();
        assertThat(weekly.parse("2026-W54")).isEmpty();
        assertThat(weekly.parse("2026-W00")).isEmpty();
        assertThat(daily.parse(null)).isEmpty();
    }

    @Test
    void boundariesFollowConfiguredZone() {
        PartitionResolver berlin = new PartitionResolver(Duration.ofDays(1), ZoneId.of("Europe/Berlin"));
        // 23:30 UTC on March 14 is already March 15 in Berlin (UTC+1)
        PartitionId partition = berlin.resolve(Instant.parse("2026-03-14T23:30:00Z"));
        assertThat(partition.name()).isEqualTo("2026-03-15");
        assertThat(partition.start()).isEqualTo(Instant.parse("2026-03-14T23:00:00Z"));
    }

    @Test
    void overlapsUsesInclusiveQueryBounds() {
        PartitionId march = monthly.resolve(Instant.parse("2026-03-10T00:00:00Z"));
        assertThat(march.overlaps(null, null)).isTrue();
        assertThat(march.overlaps(Instant.parse("2026-04-01T00:00:00Z"), null)).isFalse();
        assertThat(march.overlaps(null, Instant.parse("2026-03-01T00:00:00Z"))).isTrue();
        assertThat(march.overlaps(null, Instant.parse("2026-02-28T23:59:59Z"))).isFalse();
        assertThat(march.contains(Instant.parse("2026-04-01T00:00:00Z"))).isFalse();
    }
}
