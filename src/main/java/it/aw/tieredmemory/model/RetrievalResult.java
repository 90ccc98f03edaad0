package it.aw.tieredmemory.model;

import java.util.List;

/**
 * Contenuto concatenato dei livelli effettivamente trovati e relative metriche di costo.
 * <p>
 * {@code tiersLoaded} può essere un sottoinsieme della selezione: un livello
 * assente nello store viene saltato senza errore.
 */
public record RetrievalResult(
        String     documentKey,      // null se lo store è vuoto
        String     content,
        List<Tier> tiersLoaded,
        int        bytesReturned,
        double     estimatedTokens,
        double     baselineTokens,
        double     savingRate
) {
    public RetrievalResult {
        tiersLoaded = List.copyOf(tiersLoaded);
    }

    public double tokensSaved() {
        return baselineTokens - estimatedTokens;
    }
}
