package it.aw.tieredmemory.model;

/**
 * Risposta del motore a una query: contenuto, classificazione, selezione e metriche.
 */
public record QueryAnswer(
        String               content,
        String               documentKey,
        ClassificationResult classification,
        TierSelection        selection,
        QueryMetrics         metrics
) {}
