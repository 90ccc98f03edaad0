package it.aw.tieredmemory.service;

import it.aw.tieredmemory.config.TieredMemoryProperties;
import it.aw.tieredmemory.model.OperatingMode;
import it.aw.tieredmemory.model.QueryIntent;
import it.aw.tieredmemory.model.TierSelection;
import org.springframework.stereotype.Service;

import java.util.Locale;

import static it.aw.tieredmemory.model.Tier.TIER0;
import static it.aw.tieredmemory.model.Tier.TIER1;
import static it.aw.tieredmemory.model.Tier.TIER2;

/**
 * Sceglie i livelli da caricare per una query. Funzione pura di
 * (intento, confidenza, modalità): l'unico altro input è la soglia di confidenza,
 * fissata in configurazione.
 * <p>
 * In modalità HYBRID una confidenza sotto soglia carica tutti e tre i livelli,
 * tranne per GENERAL, che indica l'assenza di qualunque keyword e non una
 * classificazione incerta: in quel caso si resta su L0 + L1.
 */
@Service
public class TierSelector {

    static final double ANALYTICAL_HIGH_CONFIDENCE = 0.7;

    private final double minConfidenceThreshold;

    public TierSelector(TieredMemoryProperties properties) {
        this.minConfidenceThreshold = properties.minConfidenceThreshold();
    }

    public TierSelection select(QueryIntent type, double confidence, OperatingMode mode) {
        return switch (mode) {
            case TRADITIONAL -> TierSelection.of("traditional", TIER2);
            case TIERED_ONLY -> TierSelection.of("tiered-only", TIER0, TIER1);
            case HYBRID      -> selectHybrid(type, confidence);
        };
    }

    private TierSelection selectHybrid(QueryIntent type, double confidence) {
        if (type == QueryIntent.GENERAL) {
            return TierSelection.of("hybrid-general", TIER0, TIER1);
        }
        if (confidence < minConfidenceThreshold) {
            return TierSelection.of("hybrid-low-confidence", TIER0, TIER1, TIER2);
        }
        String strategy = "hybrid-" + type.name().toLowerCase(Locale.ROOT).replace('_', '-');
        return switch (type) {
            case ADMINISTRATIVE -> TierSelection.of(strategy, TIER0);
            case FACTUAL, FACTUAL_DATE, FACTUAL_LIST -> TierSelection.of(strategy, TIER0, TIER1);
            case ANALYTICAL -> confidence > ANALYTICAL_HIGH_CONFIDENCE
                    ? TierSelection.of(strategy, TIER1, TIER2)
                    : TierSelection.of(strategy, TIER0, TIER1, TIER2);
            case CREATIVE -> TierSelection.of(strategy, TIER0, TIER1, TIER2);
            default -> TierSelection.of(strategy, TIER0, TIER1);
        };
    }
}
