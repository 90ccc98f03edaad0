package it.aw.tieredmemory.model;

import java.util.List;
import java.util.Map;

/**
 * Vista di sintesi delle statistiche di risparmio, restituita da GET /api/memory/dashboard.
 */
public record Dashboard(
        long                        totalQueries,
        double                      averageSavingRate,   // cumulativo: saved / baseline
        double                      totalTokensSaved,
        double                      estimatedCostSaved,  // tokensSaved * costPerToken
        Map<QueryIntent, TypeStats> perType,
        List<QueryMetrics>          recent,              // ultime 5 query
        OperatingMode               mode
) {}
