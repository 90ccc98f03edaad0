package it.aw.tieredmemory.model;

/**
 * I tre livelli di dettaglio di un documento.
 * <p>
 * L'ordine di dichiarazione coincide con l'ordine di concatenazione in risposta
 * (dal più sintetico al completo). {@link #label()} è anche il nome della
 * directory usata dal tier store su filesystem.
 */
public enum Tier {

    TIER0("L0"),   // summary
    TIER1("L1"),   // overview
    TIER2("L2");   // contenuto completo

    private final String label;

    Tier(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
