package it.aw.tieredmemory.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Metriche di una singola query, appese alla history del tracker.
 */
public record QueryMetrics(
        String        query,             // primi 50 caratteri
        QueryIntent   queryType,
        double        confidence,
        String        strategy,
        List<Tier>    tiers,             // livelli effettivamente caricati
        int           bytesReturned,
        double        estimatedTokens,
        double        baselineTokens,
        double        tokensSaved,
        double        savingRate,
        double        latencyMs,
        LocalDateTime timestamp
) {
    public static final int QUERY_PREVIEW_LENGTH = 50;

    public QueryMetrics {
        tiers = List.copyOf(tiers);
    }
}
