package it.aw.tieredmemory.service;

import it.aw.tieredmemory.config.TieredMemoryProperties;
import it.aw.tieredmemory.model.RetrievalResult;
import it.aw.tieredmemory.model.Tier;
import it.aw.tieredmemory.model.TierSelection;
import it.aw.tieredmemory.store.TierStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Carica dallo store i livelli selezionati e ne stima il costo in token.
 * <p>
 * I livelli sono concatenati in ordine crescente, ciascuno preceduto da
 * un'intestazione "--- Ln ---". Un livello mancante o vuoto viene saltato:
 * la risposta degrada a meno livelli senza errore.
 * <p>
 * Il costo di riferimento (baseline) è quello del solo livello 2; se manca,
 * si assume tre volte il costo della risposta.
 */
@Service
public class RetrievalOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RetrievalOrchestrator.class);

    static final int MISSING_BASELINE_MULTIPLIER = 3;

    private final TierStore store;
    private final double tokensPerByte;

    public RetrievalOrchestrator(TierStore store, TieredMemoryProperties properties) {
        this.store = store;
        this.tokensPerByte = properties.tokensPerByte();
    }

    /**
     * @param documentKey documento da interrogare; se null si usa il documento
     *                    modificato più di recente
     */
    public RetrievalResult retrieve(TierSelection selection, String documentKey) {
        String key = documentKey != null ? documentKey : store.latestDocument().orElse(null);
        if (key == null) {
            log.debug("TierStore vuoto: nessun contenuto da restituire");
            return new RetrievalResult(null, "", List.of(), 0, 0.0, 0.0, 0.0);
        }

        List<String> parts = new ArrayList<>();
        List<Tier> loaded = new ArrayList<>();
        String fullContent = null;
        for (Tier tier : selection.tiers()) {
            Optional<String> content = store.getTierContent(key, tier).filter(c -> !c.isEmpty());
            if (content.isEmpty()) {
                log.debug("Livello {} assente per '{}', saltato", tier.label(), key);
                continue;
            }
            if (tier == Tier.TIER2) fullContent = content.get();
            parts.add("--- " + tier.label() + " ---\n" + content.get());
            loaded.add(tier);
        }

        String content = String.join("\n\n", parts);
        int bytesReturned = content.length();
        double estimatedTokens = bytesReturned * tokensPerByte;

        if (fullContent == null && !selection.contains(Tier.TIER2)) {
            fullContent = store.getTierContent(key, Tier.TIER2).orElse("");
        }
        double baselineTokens = fullContent != null && !fullContent.isEmpty()
                ? fullContent.length() * tokensPerByte
                : estimatedTokens * MISSING_BASELINE_MULTIPLIER;
        double savingRate = baselineTokens > 0 ? 1.0 - estimatedTokens / baselineTokens : 0.0;

        return new RetrievalResult(key, content, loaded, bytesReturned,
                estimatedTokens, baselineTokens, savingRate);
    }
}
