package org.sensorvault.storage.partition;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.IsoFields;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps timestamps to partition identifiers and identifiers back to time ranges.
 * <p>
 * Pure and thread-safe: the same {@code (interval, zone, t)} always yields the same identifier,
 * and identifier order follows timestamp order. Calendar boundaries are evaluated in the
 * configured zone (UTC by default).
 */
public final class PartitionResolver {

    private static final DateTimeFormatter DAILY_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter MONTHLY_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern DAILY_NAME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern WEEKLY_NAME = Pattern.compile("^(\\d{4})-W(\\d{2})$");
    private static final Pattern MONTHLY_NAME = Pattern.compile("^\\d{4}-\\d{2}$");

    private final PartitionGranularity granularity;
    private final ZoneId zone;

    public PartitionResolver(Duration interval) {
        this(interval, ZoneOffset.UTC);
    }

    public PartitionResolver(Duration interval, ZoneId zone) {
        this.granularity = PartitionGranularity.fromInterval(interval);
        this.zone = zone == null ? ZoneOffset.UTC : zone;
    }

    public PartitionGranularity getGranularity() {
        return granularity;
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * Returns the partition a timestamp belongs to.
     *
     * @param t the timestamp
     * @return partition identifier and range
     */
    public PartitionId resolve(Instant t) {
        LocalDate date = t.atZone(zone).toLocalDate();
        switch (granularity) {
            case DAILY:
                return daily(date);
            case WEEKLY:
                return weekly(date.with(DayOfWeek.MONDAY));
            case MONTHLY:
            default:
                return monthly(YearMonth.from(date));
        }
    }

    /**
     * Parses an identifier produced by {@link #resolve(Instant)} back into its range.
     * <p>
     * Any of the three formats is accepted regardless of the configured granularity, so
     * partitions written under an earlier interval setting remain manageable.
     *
     * @param name directory name
     * @return the partition, or empty if the name is not a partition identifier
     */
    public Optional<PartitionId> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            if (DAILY_NAME.matcher(name).matches()) {
                return Optional.of(daily(LocalDate.parse(name, DAILY_FORMAT)));
            }
            if (MONTHLY_NAME.matcher(name).matches()) {
                return Optional.of(monthly(YearMonth.parse(name, MONTHLY_FORMAT)));
            }
            Matcher weekly = WEEKLY_NAME.matcher(name);
            if (weekly.matches()) {
                int year = Integer.parseInt(weekly.group(1));
                int week = Integer.parseInt(weekly.group(2));
                LocalDate anchor = LocalDate.of(year, 1, 4);
                if (week < 1 || week > IsoFields.WEEK_OF_WEEK_BASED_YEAR.rangeRefinedBy(anchor).getMaximum()) {
                    return Optional.empty();
                }
                LocalDate monday = anchor.with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, week).with(DayOfWeek.MONDAY);
                return Optional.of(weekly(monday));
            }
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    private PartitionId daily(LocalDate date) {
        return new PartitionId(date.format(DAILY_FORMAT), PartitionGranularity.DAILY,
                startOf(date), startOf(date.plusDays(1)));
    }

    private PartitionId weekly(LocalDate monday) {
        int weekYear = monday.get(IsoFields.WEEK_BASED_YEAR);
        int week = monday.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        String name = String.format("%04d-W%02d", weekYear, week);
        return new PartitionId(name, PartitionGranularity.WEEKLY, startOf(monday), startOf(monday.plusWeeks(1)));
    }

    private PartitionId monthly(YearMonth month) {
        return new PartitionId(month.format(MONTHLY_FORMAT), PartitionGranularity.MONTHLY,
                startOf(month.atDay(1)), startOf(month.plusMonths(1).atDay(1)));
    }

    private Instant startOf(LocalDate date) {
        ZonedDateTime start = date.atStartOfDay(zone);
        return start.toInstant();
    }
}
