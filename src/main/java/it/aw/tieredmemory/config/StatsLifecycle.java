package it.aw.tieredmemory.config;

import it.aw.tieredmemory.registry.StatsSnapshotStore;
import it.aw.tieredmemory.service.StatisticsTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.io.IOException;

/**
 * Ciclo di vita dello snapshot delle statistiche:
 *   - avvio:    carica lo snapshot su disco nel tracker
 *   - runtime:  {@link #flush()} invocato dal motore ogni N query
 *   - shutdown: salvataggio finale
 * Un errore di salvataggio viene loggato e non interrompe né le query né lo shutdown.
 */
@Component
public class StatsLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StatsLifecycle.class);

    private final StatisticsTracker tracker;
    private final StatsSnapshotStore snapshotStore;

    public StatsLifecycle(StatisticsTracker tracker, StatsSnapshotStore snapshotStore) {
        this.tracker = tracker;
        this.snapshotStore = snapshotStore;
    }

    @PostConstruct
    public void load() {
        snapshotStore.load().ifPresent(tracker::restore);
    }

    public void flush() {
        try {
            snapshotStore.save(tracker.snapshot());
        } catch (IOException e) {
            log.error("Impossibile salvare lo snapshot statistiche su {}: {}",
                    snapshotStore.statsFile(), e.getMessage());
        }
    }

    @PreDestroy
    public void save() {
        log.info("Shutdown: salvataggio statistiche su disco ({} query)...", tracker.totalQueries());
        flush();
    }
}
