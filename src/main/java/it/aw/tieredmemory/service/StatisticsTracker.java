package it.aw.tieredmemory.service;

import it.aw.tieredmemory.config.TieredMemoryProperties;
import it.aw.tieredmemory.model.Dashboard;
import it.aw.tieredmemory.model.QueryIntent;
import it.aw.tieredmemory.model.QueryMetrics;
import it.aw.tieredmemory.model.StatsSnapshot;
import it.aw.tieredmemory.model.TypeStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Statistiche aggregate di risparmio, condivise da tutte le query.
 * <p>
 * Unico stato mutabile condiviso del motore: ogni metodo pubblico è sincronizzato,
 * quindi una {@link #record} aggiorna contatori, media e history come un'unica unità.
 * Il saving rate medio è cumulativo (token risparmiati / token di baseline), quindi
 * pesato sulla dimensione delle query e non una media semplice dei rate.
 * <p>
 * Nessun I/O: caricamento e salvataggio dello snapshot sono gestiti da StatsLifecycle.
 */
@Component
public class StatisticsTracker {

    private static final Logger log = LoggerFactory.getLogger(StatisticsTracker.class);

    static final int RECENT_ENTRIES = 5;

    private final int historyCapacity;
    private final double costPerToken;
    private final TieredMemoryProperties properties;

    private long totalQueries;
    private double totalTokensReturned;
    private double totalBaselineTokens;
    private double totalTokensSaved;
    private double averageSavingRate;
    private final Map<QueryIntent, TypeStats> perType = new EnumMap<>(QueryIntent.class);
    private final Deque<QueryMetrics> history = new ArrayDeque<>();
    private LocalDateTime lastReset = LocalDateTime.now();

    public StatisticsTracker(TieredMemoryProperties properties) {
        this.properties = properties;
        this.historyCapacity = properties.historyCapacity();
        this.costPerToken = properties.costPerToken();
    }

    /** Registra una query. @return il numero totale di query dopo la registrazione */
    public synchronized long record(QueryMetrics metrics) {
        totalQueries++;
        totalTokensReturned += metrics.estimatedTokens();
        totalBaselineTokens += metrics.baselineTokens();
        totalTokensSaved += metrics.tokensSaved();
        averageSavingRate = totalBaselineTokens > 0 ? totalTokensSaved / totalBaselineTokens : 0.0;

        perType.merge(metrics.queryType(), TypeStats.empty().plus(metrics.savingRate()),
                (old, added) -> old.plus(metrics.savingRate()));

        history.addLast(metrics);
        while (history.size() > historyCapacity) {
            history.removeFirst();
        }
        return totalQueries;
    }

    public synchronized Dashboard dashboard() {
        List<QueryMetrics> all = new ArrayList<>(history);
        List<QueryMetrics> recent = all.subList(Math.max(0, all.size() - RECENT_ENTRIES), all.size());
        return new Dashboard(
                totalQueries,
                averageSavingRate,
                totalTokensSaved,
                totalTokensSaved * costPerToken,
                new EnumMap<>(perType),
                List.copyOf(recent),
                properties.mode());
    }

    public synchronized StatsSnapshot snapshot() {
        return new StatsSnapshot(totalQueries, totalTokensReturned, totalBaselineTokens,
                totalTokensSaved, averageSavingRate, perType, new ArrayList<>(history), lastReset);
    }

    /** Sostituisce lo stato corrente con quello dello snapshot (usato all'avvio). */
    public synchronized void restore(StatsSnapshot snapshot) {
        totalQueries = snapshot.totalQueries();
        totalTokensReturned = snapshot.totalTokensReturned();
        totalBaselineTokens = snapshot.totalBaselineTokens();
        totalTokensSaved = snapshot.totalTokensSaved();
        averageSavingRate = totalBaselineTokens > 0 ? totalTokensSaved / totalBaselineTokens : 0.0;
        perType.clear();
        perType.putAll(snapshot.perType());
        history.clear();
        List<QueryMetrics> restored = snapshot.history();
        history.addAll(restored.subList(Math.max(0, restored.size() - historyCapacity), restored.size()));
        lastReset = snapshot.lastReset() != null ? snapshot.lastReset() : LocalDateTime.now();
        log.info("Statistiche ripristinate: {} query, {} token risparmiati", totalQueries, totalTokensSaved);
    }

    /** Azzera tutti i contatori. Solo su richiesta esplicita dell'operatore. */
    public synchronized void reset() {
        log.warn("Reset statistiche richiesto: azzerate {} query registrate", totalQueries);
        totalQueries = 0;
        totalTokensReturned = 0;
        totalBaselineTokens = 0;
        totalTokensSaved = 0;
        averageSavingRate = 0;
        perType.clear();
        history.clear();
        lastReset = LocalDateTime.now();
    }

    public synchronized long totalQueries() {
        return totalQueries;
    }
}
