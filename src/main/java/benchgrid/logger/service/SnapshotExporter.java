package benchgrid.logger.service;

import benchgrid.logger.model.ExportDocument;
import benchgrid.logger.model.LogSnapshot;
import benchgrid.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes full logger snapshots as JSON files named
 * {@code logger_data_<yyyyMMdd_HHmmss>.json}.
 */
public class SnapshotExporter {

    private static final Logger log = LoggerFactory.getLogger(SnapshotExporter.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final TimelineStore store;
    private final Path outputDir;
    private final Clock clock;

    public SnapshotExporter(TimelineStore store, Path outputDir) {
        this(store, outputDir, Clock.systemDefaultZone());
    }

    SnapshotExporter(TimelineStore store, Path outputDir, Clock clock) {
        this.store = store;
        this.outputDir = outputDir;
        this.clock = clock;
    }

    /**
     * Export to a timestamped file in the output directory.
     *
     * @return the written file
     */
    public Path export() throws IOException {
        LocalDateTime now = LocalDateTime.now(clock);
        return exportTo(outputDir.resolve("logger_data_" + FILE_STAMP.format(now) + ".json"));
    }

    /**
     * Export to a given file. The file is written next to the target and
     * moved into place so readers never see a partial document.
     */
    public Path exportTo(Path file) throws IOException {
        LogSnapshot snapshot = store.snapshot();
        ExportDocument doc = ExportDocument.of(snapshot,
                clock.millis() / 1000.0,
                LocalDateTime.now(clock).toString());

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Jsons.pretty().writeValue(tmp.toFile(), doc);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        log.info("Data exported to {} ({} events, {} tasks)", file, snapshot.events().size(), snapshot.tasks().size());
        return file;
    }

    public Path outputDir() {
        return outputDir;
    }
}
