package org.sensorvault.cli.commands;

import java.io.PrintWriter;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.sensorvault.cli.CommandLineInterface;
import org.sensorvault.storage.StorageBackendFactory;
import org.sensorvault.storage.api.DeviceStats;
import org.sensorvault.storage.api.FieldStats;
import org.sensorvault.storage.api.HourlyAggregate;
import org.sensorvault.storage.api.IStorageBackend;
import org.sensorvault.storage.api.StorageException;
import org.sensorvault.storage.file.DeviceSegment;
import org.sensorvault.storage.file.PartitionedFileStore;
import org.sensorvault.storage.partition.PartitionId;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Prints the partitions of the file store, or statistics of one device from the configured
 * backend.
 */
@Command(
    name = "inspect",
    description = "List file-store partitions and devices, or show statistics of one device"
)
public class InspectCommand implements Callable<Integer> {

    @Option(names = {"-d", "--device"}, description = "Device address to show statistics for")
    private String device;

    @Option(names = {"--hourly"}, description = "With --device: print hourly temperature/humidity aggregates")
    private boolean hourly;

    @Option(names = {"--from"}, description = "With --hourly: lower bound (RFC 3339)")
    private Instant from;

    @Option(names = {"--to"}, description = "With --hourly: upper bound (RFC 3339)")
    private Instant to;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Config storage = parent.getConfig().getConfig("storage");

        try {
            if (device == null) {
                listPartitions(storage, out);
            } else {
                showDevice(storage, out);
            }
            return 0;
        } catch (StorageException | IllegalArgumentException e) {
            err.printf("Error: %s%n", e.getMessage());
            return 1;
        } finally {
            out.flush();
            err.flush();
        }
    }

    private void listPartitions(Config storage, PrintWriter out) throws StorageException {
        try (PartitionedFileStore store = StorageBackendFactory.createFileStore(storage, Clock.systemUTC())) {
            out.printf("File store: %s (%s partitions)%n", store.getRootDirectory(),
                    store.getResolver().getGranularity());
            List<PartitionId> partitions = store.listPartitions();
            if (partitions.isEmpty()) {
                out.println("  (no partitions)");
            }
            for (PartitionId partition : partitions) {
                List<DeviceSegment> segments = store.listSegments(partition);
                long devices = segments.stream().map(DeviceSegment::deviceId).distinct().count();
                out.printf("  %-12s %s .. %s  %d device(s), %d segment(s)%s%n",
                        partition.name(), partition.start(), partition.end(), devices, segments.size(),
                        store.isCompressed(partition) ? "  [compressed]" : "");
            }
            out.println("Devices:");
            for (String addr : store.listDevices()) {
                out.printf("  %s%n", addr);
            }
        }
    }

    private void showDevice(Config storage, PrintWriter out) throws StorageException {
        try (IStorageBackend backend = StorageBackendFactory.create(storage)) {
            if (hourly) {
                for (HourlyAggregate h : backend.hourlyAggregates(device, from, to)) {
                    out.printf("%s  n=%-5d temp %s  humidity %s%n", h.hour(), h.count(),
                            format(h.tempC()), format(h.humidity()));
                }
                return;
            }
            DeviceStats stats = backend.stats(device);
            out.printf("Device:      %s (%s)%n", device, backend.getName());
            out.printf("Readings:    %d%n", stats.count());
            if (stats.isEmpty()) {
                return;
            }
            out.printf("First/last:  %s .. %s%n", stats.firstReading(), stats.lastReading());
            out.printf("Temp (C):    %s%n", format(stats.tempC()));
            out.printf("Humidity:    %s%n", format(stats.humidity()));
            out.printf("Dew point:   %s%n", format(stats.dewPointC()));
            out.printf("Battery:     %s%n", format(stats.battery()));
            out.printf("RSSI:        %s%n", format(stats.rssi()));
        }
    }

    private static String format(FieldStats stats) {
        return String.format(Locale.ROOT, "min %.2f / avg %.2f / max %.2f", stats.min(), stats.avg(), stats.max());
    }
}
