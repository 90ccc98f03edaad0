package it.aw.tieredmemory.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Esito della classificazione di una query. Effimero, mai persistito.
 *
 * @param scores punteggio grezzo per intento (solo intenti con punteggio positivo,
 *               nell'ordine di dichiarazione delle regole)
 */
public record ClassificationResult(
        QueryIntent              primaryType,
        double                   confidence,
        Map<QueryIntent, Double> scores
) {
    public ClassificationResult {
        scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    /** true se almeno una keyword ha contribuito al risultato. */
    public boolean matched() {
        return !scores.isEmpty();
    }
}
