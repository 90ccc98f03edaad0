package it.aw.tieredmemory.service;

import it.aw.tieredmemory.model.ClassificationResult;
import it.aw.tieredmemory.model.QueryIntent;
import it.aw.tieredmemory.service.IntentRules.IntentRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Classifica una query per intento con matching di sottostringhe case-insensitive
 * sulle keyword di {@link IntentRules}. Nessuna chiamata a modelli: è un'euristica
 * di routing, deterministica.
 * <p>
 * Ogni keyword trovata vale 1 punto; l'intento FACTUAL riceve 0.5 in più se la
 * query contiene un punto interrogativo. confidence = punteggio vincente / somma
 * dei punteggi. Senza alcuna corrispondenza il risultato è GENERAL con confidenza 0.5.
 */
@Service
public class QueryClassifier {

    private static final Logger log = LoggerFactory.getLogger(QueryClassifier.class);

    static final double QUESTION_BONUS = 0.5;
    static final double DEFAULT_CONFIDENCE = 0.5;

    private final IntentRules rules;

    public QueryClassifier(IntentRules rules) {
        this.rules = rules;
    }

    public ClassificationResult classify(String query) {
        String text = query != null ? query : "";
        String lower = text.toLowerCase(Locale.ROOT);
        boolean question = text.indexOf('?') >= 0 || text.indexOf('？') >= 0;

        Map<QueryIntent, Double> scores = new LinkedHashMap<>();
        for (IntentRule rule : rules.rules()) {
            double score = rule.keywords().stream().filter(lower::contains).count();
            if (rule.intent() == QueryIntent.FACTUAL && question) {
                score += QUESTION_BONUS;
            }
            if (score > 0) {
                scores.merge(rule.intent(), score, Double::sum);
            }
        }

        if (scores.isEmpty()) {
            log.debug("Query senza corrispondenze, classificata {}: '{}'", QueryIntent.GENERAL, text);
            return new ClassificationResult(QueryIntent.GENERAL, DEFAULT_CONFIDENCE, scores);
        }

        // Spareggio: vince il primo intento (in ordine di tabella) che raggiunge il massimo
        QueryIntent best = null;
        double bestScore = 0;
        double total = 0;
        for (Map.Entry<QueryIntent, Double> e : scores.entrySet()) {
            total += e.getValue();
            if (e.getValue() > bestScore) {
                best = e.getKey();
                bestScore = e.getValue();
            }
        }
        double confidence = bestScore / total;
        log.debug("Query classificata {} (confidenza {}, punteggi {}): '{}'", best, confidence, scores, text);
        return new ClassificationResult(best, confidence, scores);
    }
}
