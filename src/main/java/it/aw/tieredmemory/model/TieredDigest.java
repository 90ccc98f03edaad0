package it.aw.tieredmemory.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Digest a tre livelli di un documento.
 * <p>
 * {@code full} è il testo sorgente stesso (nessuna trasformazione e nessuna copia):
 * il digest è derivato e può essere rigenerato in qualunque momento.
 */
public record TieredDigest(
        String   summary,    // L0
        Overview overview,   // L1
        @JsonIgnore String full   // L2
) {
    public String tierText(Tier tier) {
        return switch (tier) {
            case TIER0 -> summary;
            case TIER1 -> overview.text();
            case TIER2 -> full;
        };
    }

    public int originalChars() {
        return full.length();
    }
}
