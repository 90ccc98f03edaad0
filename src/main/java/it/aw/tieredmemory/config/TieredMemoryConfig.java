package it.aw.tieredmemory.config;

import it.aw.tieredmemory.service.IntentRules;
import it.aw.tieredmemory.service.SummaryRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configura le tabelle di regole del motore e abilita {@link TieredMemoryProperties}.
 *
 * SummaryRules: pattern dei punti chiave per l'overview di livello 1.
 * IntentRules:  tabella ordinata intento → keyword per il classificatore.
 *               Per vocabolari diversi basta sostituire questo bean.
 */
@Configuration
@EnableConfigurationProperties(TieredMemoryProperties.class)
public class TieredMemoryConfig {

    private static final Logger log = LoggerFactory.getLogger(TieredMemoryConfig.class);

    @Bean
    public SummaryRules summaryRules() {
        return SummaryRules.defaults();
    }

    @Bean
    public IntentRules intentRules(TieredMemoryProperties properties) {
        IntentRules rules = IntentRules.defaults();
        log.info("Motore a livelli: modalità {}, soglia confidenza {}, {} regole di intento",
                properties.mode().configValue(), properties.minConfidenceThreshold(), rules.rules().size());
        return rules;
    }
}
