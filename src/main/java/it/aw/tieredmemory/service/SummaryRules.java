package it.aw.tieredmemory.service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Regole che decidono se una riga è un punto chiave del livello 1.
 * <p>
 * I pattern sono valutati in ordine sulla riga già trimmata; basta una corrispondenza.
 * Tenuti come dato esplicito per poter iniettare set alternativi nei test.
 */
public record SummaryRules(List<Pattern> keyPointPatterns) {

    // Elenchi puntati e numerati
    private static final Pattern BULLET   = Pattern.compile("^[-*•]\\s*");
    private static final Pattern NUMBERED = Pattern.compile("^\\d+\\.\\s*");

    // Marcatori di importanza e di stato
    private static final Pattern IMPORTANCE_EN = Pattern.compile(
            "\\b(?:TODO|FIXME|IMPORTANT|NOTE|decision)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern IMPORTANCE_ZH = Pattern.compile("决策|重要");
    private static final Pattern STATUS_EN = Pattern.compile(
            "\\b(?:done|blocked|in progress)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern STATUS_ZH = Pattern.compile("完成|进行中|阻塞");

    // Heading markdown di qualsiasi livello
    private static final Pattern HEADING = Pattern.compile("^#+\\s+");

    public SummaryRules {
        keyPointPatterns = List.copyOf(keyPointPatterns);
    }

    public static SummaryRules defaults() {
        return new SummaryRules(List.of(
                BULLET, NUMBERED, IMPORTANCE_EN, IMPORTANCE_ZH, STATUS_EN, STATUS_ZH, HEADING));
    }

    public boolean isKeyPoint(String trimmedLine) {
        return keyPointPatterns.stream().anyMatch(p -> p.matcher(trimmedLine).find());
    }
}
