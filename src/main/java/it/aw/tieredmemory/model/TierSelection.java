package it.aw.tieredmemory.model;

import java.util.EnumSet;
import java.util.List;

/**
 * Insieme ordinato (L0 → L2) e senza duplicati dei livelli scelti per una query,
 * con il nome della strategia che lo ha prodotto.
 */
public record TierSelection(List<Tier> tiers, String strategy) {

    public TierSelection {
        tiers = tiers.isEmpty() ? List.of() : List.copyOf(EnumSet.copyOf(tiers));
    }

    public static TierSelection of(String strategy, Tier first, Tier... rest) {
        return new TierSelection(List.copyOf(EnumSet.of(first, rest)), strategy);
    }

    public boolean contains(Tier tier) {
        return tiers.contains(tier);
    }
}
