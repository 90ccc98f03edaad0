package it.aw.tieredmemory.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Stato aggregato del tracker in forma serializzabile (JSON via Jackson).
 * Caricato all'avvio, salvato periodicamente e allo shutdown.
 */
public record StatsSnapshot(
        long                        totalQueries,
        double                      totalTokensReturned,
        double                      totalBaselineTokens,
        double                      totalTokensSaved,
        double                      averageSavingRate,
        Map<QueryIntent, TypeStats> perType,
        List<QueryMetrics>          history,
        LocalDateTime               lastReset
) {
    public StatsSnapshot {
        perType = perType != null ? Map.copyOf(perType) : Map.of();
        history = history != null ? List.copyOf(history) : List.of();
    }

    public static StatsSnapshot empty() {
        return new StatsSnapshot(0, 0, 0, 0, 0, Map.of(), List.of(), LocalDateTime.now());
    }
}
