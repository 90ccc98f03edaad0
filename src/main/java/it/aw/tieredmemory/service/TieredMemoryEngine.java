package it.aw.tieredmemory.service;

import it.aw.tieredmemory.config.StatsLifecycle;
import it.aw.tieredmemory.config.TieredMemoryProperties;
import it.aw.tieredmemory.model.ClassificationResult;
import it.aw.tieredmemory.model.Dashboard;
import it.aw.tieredmemory.model.QueryAnswer;
import it.aw.tieredmemory.model.QueryMetrics;
import it.aw.tieredmemory.model.RetrievalResult;
import it.aw.tieredmemory.model.TierSelection;
import it.aw.tieredmemory.model.TieredDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Punto d'ingresso del motore: classificazione → selezione livelli → retrieval → statistiche.
 * <p>
 * Ogni {@code statsFlushInterval} query registrate lo snapshot delle statistiche
 * viene salvato su disco.
 */
@Service
public class TieredMemoryEngine {

    private static final Logger log = LoggerFactory.getLogger(TieredMemoryEngine.class);

    private final Summarizer summarizer;
    private final QueryClassifier classifier;
    private final TierSelector selector;
    private final RetrievalOrchestrator orchestrator;
    private final StatisticsTracker tracker;
    private final StatsLifecycle statsLifecycle;
    private final TieredMemoryProperties properties;

    public TieredMemoryEngine(Summarizer summarizer,
                              QueryClassifier classifier,
                              TierSelector selector,
                              RetrievalOrchestrator orchestrator,
                              StatisticsTracker tracker,
                              StatsLifecycle statsLifecycle,
                              TieredMemoryProperties properties) {
        this.summarizer = summarizer;
        this.classifier = classifier;
        this.selector = selector;
        this.orchestrator = orchestrator;
        this.tracker = tracker;
        this.statsLifecycle = statsLifecycle;
        this.properties = properties;
    }

    public TieredDigest summarize(String text) {
        return summarizer.summarize(text);
    }

    public ClassificationResult classify(String query) {
        return classifier.classify(query);
    }

    /** Risponde usando il documento modificato più di recente. */
    public QueryAnswer answer(String query) {
        return answer(query, null);
    }

    public QueryAnswer answer(String query, String documentKey) {
        String text = query != null ? query : "";
        long start = System.nanoTime();

        ClassificationResult classification = classifier.classify(text);
        TierSelection selection = selector.select(
                classification.primaryType(), classification.confidence(), properties.mode());
        RetrievalResult result = orchestrator.retrieve(selection, documentKey);

        double latencyMs = (System.nanoTime() - start) / 1_000_000.0;
        QueryMetrics metrics = new QueryMetrics(
                Summarizer.truncate(text, QueryMetrics.QUERY_PREVIEW_LENGTH),
                classification.primaryType(),
                classification.confidence(),
                selection.strategy(),
                result.tiersLoaded(),
                result.bytesReturned(),
                result.estimatedTokens(),
                result.baselineTokens(),
                result.tokensSaved(),
                result.savingRate(),
                latencyMs,
                LocalDateTime.now());

        long total = tracker.record(metrics);
        log.debug("Query [{}] {} (conf={}) → {} su '{}': {} token, risparmio {}",
                selection.strategy(), classification.primaryType(), classification.confidence(),
                result.tiersLoaded(), result.documentKey(),
                result.estimatedTokens(), result.savingRate());

        if (total % properties.statsFlushInterval() == 0) {
            log.debug("Flush periodico statistiche dopo {} query", total);
            statsLifecycle.flush();
        }
        return new QueryAnswer(result.content(), result.documentKey(), classification, selection, metrics);
    }

    public Dashboard dashboard() {
        return tracker.dashboard();
    }

    /** Azzera le statistiche e salva subito lo snapshot vuoto. */
    public void resetStatistics() {
        tracker.reset();
        statsLifecycle.flush();
    }
}
