package it.aw.tieredmemory.service;

import it.aw.tieredmemory.model.ClassificationResult;
import it.aw.tieredmemory.model.QueryIntent;
import it.aw.tieredmemory.service.IntentRules.IntentRule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryClassifierTest {

    private final QueryClassifier classifier = new QueryClassifier(IntentRules.defaults());

    @Test
    void statusCheckIsAdministrative() {
        ClassificationResult result = classifier.classify("检查状态");

        assertEquals(QueryIntent.ADMINISTRATIVE, result.primaryType());
        assertEquals(1.0, result.confidence(), 1e-9);
        assertEquals(2.0, result.scores().get(QueryIntent.ADMINISTRATIVE), 1e-9);
    }

    @Test
    void noKeywordGivesGeneral() {
        ClassificationResult result = classifier.classify("hello there");

        assertEquals(QueryIntent.GENERAL, result.primaryType());
        assertEquals(0.5, result.confidence(), 1e-9);
        assertFalse(result.matched());
    }

    @Test
    void questionMarkAloneIsFactual() {
        ClassificationResult result = classifier.classify("hello there?");

        assertEquals(QueryIntent.FACTUAL, result.primaryType());
        assertEquals(1.0, result.confidence(), 1e-9);
        assertEquals(0.5, result.scores().get(QueryIntent.FACTUAL), 1e-9);
    }

    @Test
    void fullWidthQuestionMarkBoostsFactual() {
        // 日期 → FACTUAL_DATE 1; 是什么 + ？ → FACTUAL 1.5
        ClassificationResult result = classifier.classify("今天的日期是什么？");

        assertEquals(QueryIntent.FACTUAL, result.primaryType());
        assertEquals(0.6, result.confidence(), 1e-9);
        assertEquals(List.of(QueryIntent.FACTUAL_DATE, QueryIntent.FACTUAL),
                List.copyOf(result.scores().keySet()));
    }

    @Test
    void tieGoesToFirstDeclaredIntent() {
        ClassificationResult result = classifier.classify("analysis and design");

        assertEquals(QueryIntent.ANALYTICAL, result.primaryType());
        assertEquals(0.5, result.confidence(), 1e-9);
        assertEquals(1.0, result.scores().get(QueryIntent.CREATIVE), 1e-9);
    }

    @Test
    void matchingIsCaseInsensitive() {
        ClassificationResult result = classifier.classify("STATUS REPORT");

        assertEquals(QueryIntent.ADMINISTRATIVE, result.primaryType());
        assertEquals(2.0, result.scores().get(QueryIntent.ADMINISTRATIVE), 1e-9);
    }

    @Test
    void classificationIsDeterministic() {
        String query = "why did the deadline slip and how to improve it?";

        assertEquals(classifier.classify(query), classifier.classify(query));
    }

    @Test
    void nullQueryIsGeneral() {
        assertEquals(QueryIntent.GENERAL, classifier.classify(null).primaryType());
    }

    @Test
    void customRuleTableIsUsed() {
        QueryClassifier custom = new QueryClassifier(new IntentRules(List.of(
                new IntentRule(QueryIntent.CREATIVE, List.of("Brainstorm")))));

        ClassificationResult result = custom.classify("brainstorm session for the launch");

        assertEquals(QueryIntent.CREATIVE, result.primaryType());
        assertEquals(QueryIntent.GENERAL, custom.classify("检查状态").primaryType());
    }
}
