package it.aw.tieredmemory.config;

import it.aw.tieredmemory.exception.MalformedConfigException;
import it.aw.tieredmemory.model.OperatingMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Parametri del motore a livelli, letti dal prefisso {@code tiered-memory}.
 * <p>
 * La validazione avviene nel costruttore compatto: un valore non valido in
 * application.properties fa fallire l'avvio del contesto Spring.
 */
@ConstructorBinding
@ConfigurationProperties(prefix = "tiered-memory")
public record TieredMemoryProperties(
        @DefaultValue("hybrid")   OperatingMode mode,
        @DefaultValue("100")      int           tier0MaxChars,
        @DefaultValue("500")      int           tier1MaxChars,
        @DefaultValue("0.6")      double        minConfidenceThreshold,
        @DefaultValue("0.25")     double        tokensPerByte,
        @DefaultValue("0.000001") double        costPerToken,
        @DefaultValue("50")       int           historyCapacity,
        @DefaultValue("10")       int           statsFlushInterval
) {

    public static final int    DEFAULT_TIER0_MAX_CHARS   = 100;
    public static final int    DEFAULT_TIER1_MAX_CHARS   = 500;
    public static final double DEFAULT_MIN_CONFIDENCE    = 0.6;
    public static final double DEFAULT_TOKENS_PER_BYTE   = 0.25;
    public static final double DEFAULT_COST_PER_TOKEN    = 0.000001;
    public static final int    DEFAULT_HISTORY_CAPACITY  = 50;
    public static final int    DEFAULT_FLUSH_INTERVAL    = 10;

    /** Costruttore compatto con validazione. */
    public TieredMemoryProperties {
        if (mode == null) {
            throw new MalformedConfigException("mode obbligatorio (traditional | tiered-only | hybrid)");
        }
        if (tier0MaxChars <= 0) {
            throw new MalformedConfigException("tier0MaxChars deve essere > 0 (ricevuto: " + tier0MaxChars + ")");
        }
        if (tier1MaxChars <= 0) {
            throw new MalformedConfigException("tier1MaxChars deve essere > 0 (ricevuto: " + tier1MaxChars + ")");
        }
        if (minConfidenceThreshold < 0.0 || minConfidenceThreshold > 1.0) {
            throw new MalformedConfigException(
                    "minConfidenceThreshold deve essere in [0,1] (ricevuto: " + minConfidenceThreshold + ")");
        }
        if (tokensPerByte <= 0.0) {
            throw new MalformedConfigException("tokensPerByte deve essere > 0 (ricevuto: " + tokensPerByte + ")");
        }
        if (costPerToken < 0.0) {
            throw new MalformedConfigException("costPerToken deve essere >= 0 (ricevuto: " + costPerToken + ")");
        }
        if (historyCapacity <= 0) {
            throw new MalformedConfigException("historyCapacity deve essere > 0 (ricevuto: " + historyCapacity + ")");
        }
        if (statsFlushInterval <= 0) {
            throw new MalformedConfigException(
                    "statsFlushInterval deve essere > 0 (ricevuto: " + statsFlushInterval + ")");
        }
    }

    public static TieredMemoryProperties defaults() {
        return withMode(OperatingMode.HYBRID);
    }

    public static TieredMemoryProperties withMode(OperatingMode mode) {
        return new TieredMemoryProperties(mode,
                DEFAULT_TIER0_MAX_CHARS, DEFAULT_TIER1_MAX_CHARS, DEFAULT_MIN_CONFIDENCE,
                DEFAULT_TOKENS_PER_BYTE, DEFAULT_COST_PER_TOKEN,
                DEFAULT_HISTORY_CAPACITY, DEFAULT_FLUSH_INTERVAL);
    }
}
