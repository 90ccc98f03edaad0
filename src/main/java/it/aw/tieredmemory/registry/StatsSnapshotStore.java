package it.aw.tieredmemory.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.tieredmemory.model.MigrationReport;
import it.aw.tieredmemory.model.StatsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Persistenza JSON dello snapshot delle statistiche e dell'ultimo report di migrazione.
 * Il report viene scritto nella stessa directory dello snapshot.
 */
@Component
public class StatsSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(StatsSnapshotStore.class);
    static final String MIGRATION_REPORT_FILE = "migration_report.json";

    private final ObjectMapper objectMapper;
    private final Path statsFile;

    public StatsSnapshotStore(ObjectMapper objectMapper, @Value("${store.stats.file}") String statsFilePath) {
        this.objectMapper = objectMapper;
        this.statsFile = Paths.get(statsFilePath).toAbsolutePath();
    }

    /**
     * Legge lo snapshot salvato. Un file assente o illeggibile non blocca l'avvio:
     * le statistiche ripartono da zero.
     */
    public Optional<StatsSnapshot> load() {
        if (!Files.exists(statsFile)) {
            log.info("Snapshot statistiche {} non trovato, partenza da zero.", statsFile);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(statsFile.toFile(), StatsSnapshot.class));
        } catch (IOException e) {
            log.warn("Snapshot statistiche {} illeggibile, partenza da zero: {}", statsFile, e.getMessage());
            return Optional.empty();
        }
    }

    public synchronized void save(StatsSnapshot snapshot) throws IOException {
        Files.createDirectories(statsFile.getParent());
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(statsFile.toFile(), snapshot);
        log.debug("Snapshot statistiche salvato: {} ({} query)", statsFile, snapshot.totalQueries());
    }

    public synchronized Path saveMigrationReport(MigrationReport report) throws IOException {
        Path path = statsFile.getParent().resolve(MIGRATION_REPORT_FILE);
        Files.createDirectories(path.getParent());
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), report);
        return path;
    }

    public Path statsFile() {
        return statsFile;
    }
}
