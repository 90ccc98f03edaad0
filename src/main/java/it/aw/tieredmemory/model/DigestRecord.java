package it.aw.tieredmemory.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Documento registrato dopo l'ingestione: sorgente, dimensioni dei livelli ed
 * estratti del livello 1.
 * <p>
 * Restituito da POST /api/memory/documents/{key} e GET /api/memory/documents.
 */
public record DigestRecord(
        String        documentKey,
        String        source,             // path o nome file originale
        LocalDateTime ingestedAt,
        int           originalChars,
        int           tier0Chars,
        int           tier1Chars,
        List<String>  keyPoints,
        List<String>  sections,
        boolean       fullContentLinked   // true = link simbolico, false = copia fisica
) {
    public DigestRecord {
        keyPoints = keyPoints != null ? List.copyOf(keyPoints) : List.of();
        sections  = sections  != null ? List.copyOf(sections)  : List.of();
    }

    public double tier0Ratio() {
        return originalChars > 0 ? (double) tier0Chars / originalChars : 0.0;
    }

    public double tier1Ratio() {
        return originalChars > 0 ? (double) tier1Chars / originalChars : 0.0;
    }
}
