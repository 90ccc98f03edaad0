package it.aw.tieredmemory.model;

/**
 * Politica di selezione dei livelli.
 * <ul>
 *   <li>TRADITIONAL: sempre e solo il contenuto completo (L2)</li>
 *   <li>TIERED_ONLY: sempre L0 + L1, indipendentemente dalla classificazione</li>
 *   <li>HYBRID: in base a intento e confidenza della query</li>
 * </ul>
 * Nel file di configurazione si scrive {@code traditional}, {@code tiered-only}, {@code hybrid}.
 */
public enum OperatingMode {
    TRADITIONAL("traditional"),
    TIERED_ONLY("tiered-only"),
    HYBRID("hybrid");

    private final String configValue;

    OperatingMode(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }
}
