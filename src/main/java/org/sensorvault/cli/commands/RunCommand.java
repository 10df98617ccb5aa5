package org.sensorvault.cli.commands;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.sensorvault.cli.CommandLineInterface;
import org.sensorvault.storage.StorageBackendFactory;
import org.sensorvault.storage.api.CancellationToken;
import org.sensorvault.storage.api.IStorageBackend;
import org.sensorvault.storage.database.H2ReadingStore;
import org.sensorvault.storage.file.PartitionedFileStore;
import org.sensorvault.storage.migration.MigrationCoordinator;
import org.sensorvault.storage.migration.MigrationReport;
import org.sensorvault.storage.sweep.CompactionSweeper;
import org.sensorvault.storage.sweep.ISweeper;
import org.sensorvault.storage.sweep.RetentionSweeper;
import org.sensorvault.storage.sweep.SweepScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

/**
 * Opens the configured backend and keeps it maintained until the process is stopped.
 * <p>
 * Runs the one-shot migration first when {@code storage.migration.enabled} is set, then starts
 * the retention and compaction sweeps.
 */
@Command(
    name = "run",
    description = "Open the configured storage backend and run periodic retention/compaction"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() throws Exception {
        Config storage = parent.getConfig().getConfig("storage");

        if (storage.getBoolean("migration.enabled")) {
            MigrationReport report = runStartupMigration(storage);
            if (!report.isSucceeded()) {
                log.error("Startup migration failed, not starting storage");
                return 1;
            }
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        try (IStorageBackend backend = StorageBackendFactory.create(storage);
             SweepScheduler scheduler = createScheduler(storage, backend)) {
            scheduler.start(Duration.ZERO);
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown, "sensorvault-shutdown"));
            log.info("Storage backend '{}' ready", backend.getName());
            shutdown.await();
            log.info("Shutting down storage backend '{}'", backend.getName());
        }
        return 0;
    }

    private MigrationReport runStartupMigration(Config storage) {
        log.info("Startup migration enabled, copying file store into indexed store");
        try (PartitionedFileStore source = StorageBackendFactory.createFileStore(storage, Clock.systemUTC());
             H2ReadingStore destination = StorageBackendFactory.createIndexedStore(storage)) {
            MigrationReport report = new MigrationCoordinator(source, destination, storage.getConfig("migration"))
                    .run(CancellationToken.none());
            log.info("Startup migration finished in state {} ({} reading(s) copied, {} mismatch(es))",
                    report.state(), report.readingsCopied(), report.mismatches().size());
            return report;
        }
    }

    private static SweepScheduler createScheduler(Config storage, IStorageBackend backend) {
        Clock clock = Clock.systemUTC();
        List<ISweeper> sweepers = new ArrayList<>();
        sweepers.add(new RetentionSweeper(backend, storage.getDuration("retention.horizon"), clock));
        if (backend instanceof PartitionedFileStore) {
            sweepers.add(new CompactionSweeper((PartitionedFileStore) backend, clock));
        }
        return new SweepScheduler(backend.getName(), sweepers, storage.getDuration("sweep.interval"));
    }
}
