package org.sensorvault.cli.commands;

import java.io.PrintWriter;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;

import org.sensorvault.cli.CommandLineInterface;
import org.sensorvault.storage.StorageBackendFactory;
import org.sensorvault.storage.api.CancellationToken;
import org.sensorvault.storage.api.IStorageBackend;
import org.sensorvault.storage.api.StorageException;
import org.sensorvault.storage.file.PartitionedFileStore;
import org.sensorvault.storage.sweep.CompactionSweeper;
import org.sensorvault.storage.sweep.RetentionSweeper;
import org.sensorvault.storage.sweep.SweepResult;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs retention and/or compaction once, in the foreground.
 */
@Command(
    name = "sweep",
    description = "Run retention and/or compaction once (default: both)"
)
public class SweepCommand implements Callable<Integer> {

    @Option(names = {"--retention"}, description = "Delete data older than the retention horizon")
    private boolean retention;

    @Option(names = {"--compaction"}, description = "Compress partitions older than the current one")
    private boolean compaction;

    @Option(
        names = {"--horizon"},
        description = "Retention horizon overriding storage.retention.horizon (ISO-8601, e.g. P90D)"
    )
    private Duration horizon;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Config storage = parent.getConfig().getConfig("storage");

        boolean both = !retention && !compaction;
        Clock clock = Clock.systemUTC();
        int exitCode = 0;

        if (both || retention) {
            Duration effective = horizon != null ? horizon : storage.getDuration("retention.horizon");
            try (IStorageBackend backend = StorageBackendFactory.create(storage)) {
                SweepResult result = new RetentionSweeper(backend, effective, clock).sweep(CancellationToken.none());
                out.printf("%s%n", effective.isZero() ? "retention: disabled (horizon 0)" : result);
                exitCode = result.failed() > 0 ? 1 : exitCode;
            } catch (StorageException e) {
                err.printf("Retention failed: %s%n", e.getMessage());
                exitCode = 1;
            }
        }

        if (both || compaction) {
            try (PartitionedFileStore store = StorageBackendFactory.createFileStore(storage, clock)) {
                SweepResult result = new CompactionSweeper(store, clock).sweep(CancellationToken.none());
                out.printf("%s%n", result);
                exitCode = result.failed() > 0 ? 1 : exitCode;
            } catch (StorageException e) {
                err.printf("Compaction failed: %s%n", e.getMessage());
                exitCode = 1;
            }
        }
        out.flush();
        err.flush();
        return exitCode;
    }
}
