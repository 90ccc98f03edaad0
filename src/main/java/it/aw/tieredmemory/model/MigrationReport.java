package it.aw.tieredmemory.model;

import java.time.LocalDateTime;

/**
 * Report di una migrazione massiva di una directory di documenti nel tier store.
 * I rapporti di compressione e le stime token sono calcolati sui soli file migrati.
 */
public record MigrationReport(
        int           totalFiles,
        int           migratedFiles,
        int           failedFiles,
        long          totalOriginalChars,
        long          totalTier0Chars,
        long          totalTier1Chars,
        double        tier0Ratio,
        double        tier1Ratio,
        double        estimatedTokensOriginal,
        double        estimatedTokensTier1,
        LocalDateTime startedAt,
        LocalDateTime finishedAt
) {}
