package it.aw.tieredmemory.model;

/**
 * Statistiche aggregate sul registry dei digest.
 */
public record RegistryStats(
        int    totalDocuments,
        long   totalOriginalChars,
        long   totalTier0Chars,
        long   totalTier1Chars,
        double tier0Ratio,
        double tier1Ratio,
        String storeType
) {}
