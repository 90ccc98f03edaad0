package it.aw.tieredmemory.service;

import it.aw.tieredmemory.config.TieredMemoryProperties;
import it.aw.tieredmemory.model.CompressionResult;
import it.aw.tieredmemory.model.Overview;
import it.aw.tieredmemory.model.Tier;
import it.aw.tieredmemory.model.TieredDigest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Riduce un testo libero ai livelli 0 (summary) e 1 (overview) con regole
 * deterministiche: nessun modello, solo scansione riga per riga.
 * <p>
 * Livello 0: titolo candidato + prima riga di contenuto significativa.
 * <p>
 * Livello 1: due passate indipendenti sulle righe trimmate
 * <ul>
 *   <li>punti chiave: righe di almeno 10 caratteri che soddisfano una delle {@link SummaryRules}</li>
 *   <li>sezioni: ogni "## " apre una sezione che raccoglie le righe successive
 *       fino al prossimo heading di qualsiasi livello</li>
 * </ul>
 * Se nessuna delle due produce qualcosa si ripiega sui primi paragrafi.
 * A parità di testo e configurazione l'output è sempre identico.
 */
@Service
public class Summarizer {

    private static final Pattern ANY_HEADING = Pattern.compile("^#+\\s+");
    private static final String TOP_HEADING = "# ";
    private static final String SUB_HEADING = "## ";
    private static final String ELLIPSIS = "...";

    // Livello 0
    private static final int TITLE_CANDIDATE_MAX   = 50;
    private static final int CONTENT_CANDIDATE_MIN = 20;
    private static final int CONTENT_CANDIDATE_CUT = 100;
    private static final int COMBINED_CONTENT_CUT  = 50;
    private static final int SINGLE_CANDIDATE_CUT  = 80;

    // Livello 1
    private static final int KEY_POINT_MIN_LENGTH  = 10;
    private static final int MAX_KEY_POINTS        = 5;
    private static final int SHOWN_KEY_POINTS      = 3;
    private static final int KEY_POINT_CUT         = 80;
    private static final int MAX_SECTIONS          = 4;
    private static final int SECTION_LINE_MIN      = 10;
    private static final int SECTION_LINE_CUT      = 100;
    private static final int SECTION_CUT           = 100;
    private static final int PARAGRAPH_MIN_LENGTH  = 20;
    private static final int MAX_PARAGRAPHS        = 2;
    private static final int PARAGRAPH_CUT         = 150;

    private final TieredMemoryProperties properties;
    private final SummaryRules rules;

    public Summarizer(TieredMemoryProperties properties, SummaryRules rules) {
        this.properties = properties;
        this.rules = rules;
    }

    /** Digest completo: L0 e L1 generati, L2 è il testo stesso. */
    public TieredDigest summarize(String text) {
        String source = text != null ? text : "";
        return new TieredDigest(generateTier0(source), generateTier1(source), source);
    }

    /**
     * Summary di livello 0, lungo al massimo {@code tier0MaxChars}.
     * Testo vuoto o di soli spazi produce stringa vuota.
     */
    public String generateTier0(String text) {
        if (text == null || text.isBlank()) return "";

        String title = null;
        boolean titleFromHeading = false;
        String content = null;

        for (String raw : text.strip().split("\n")) {
            String line = raw.strip();
            if (line.isEmpty()) continue;

            // Il primo heading di primo livello ha la precedenza su una riga corta
            if (line.startsWith(TOP_HEADING)) {
                if (!titleFromHeading) {
                    title = line.substring(TOP_HEADING.length()).strip();
                    titleFromHeading = true;
                }
            } else if (title == null && line.length() < TITLE_CANDIDATE_MAX) {
                title = line;
            }

            if (line.length() > CONTENT_CANDIDATE_MIN) {
                content = truncate(line, CONTENT_CANDIDATE_CUT);
                break;
            }
        }

        String summary;
        if (title != null && content != null) {
            summary = title + " | " + truncate(content, COMBINED_CONTENT_CUT) + ELLIPSIS;
        } else if (title != null) {
            summary = truncate(title, SINGLE_CANDIDATE_CUT) + ELLIPSIS;
        } else if (content != null) {
            summary = truncate(content, SINGLE_CANDIDATE_CUT) + ELLIPSIS;
        } else {
            summary = text.length() > SINGLE_CANDIDATE_CUT
                    ? truncate(text, SINGLE_CANDIDATE_CUT) + ELLIPSIS
                    : text;
        }
        return truncate(summary, properties.tier0MaxChars());
    }

    /**
     * Overview di livello 1, lunga al massimo {@code tier1MaxChars}.
     * Il testo mostra al più 3 punti chiave e 4 sezioni; l'{@link Overview}
     * restituita porta anche l'elenco completo dei punti estratti (fino a 5).
     */
    public Overview generateTier1(String text) {
        if (text == null || text.isBlank()) {
            return new Overview("", List.of(), List.of());
        }
        List<String> lines = text.strip().lines().map(String::strip).toList();
        List<String> keyPoints = extractKeyPoints(lines);
        List<String> sections = extractSections(lines);

        List<String> parts = new ArrayList<>();
        if (!keyPoints.isEmpty()) {
            parts.add("Key points:");
            for (int i = 0; i < Math.min(SHOWN_KEY_POINTS, keyPoints.size()); i++) {
                parts.add("  " + (i + 1) + ". " + truncate(keyPoints.get(i), KEY_POINT_CUT));
            }
        }
        if (!sections.isEmpty()) {
            parts.add("Sections:");
            for (String section : sections) {
                parts.add("  • " + truncate(section, SECTION_CUT));
            }
        }
        if (parts.isEmpty()) {
            List<String> paragraphs = Arrays.stream(text.split("\n\n"))
                    .map(String::strip)
                    .filter(p -> p.length() > PARAGRAPH_MIN_LENGTH)
                    .limit(MAX_PARAGRAPHS)
                    .toList();
            if (!paragraphs.isEmpty()) {
                parts.add("Main content:");
                for (String paragraph : paragraphs) {
                    parts.add("  • " + truncate(paragraph, PARAGRAPH_CUT) + ELLIPSIS);
                }
            }
        }

        String overview = truncate(String.join("\n", parts), properties.tier1MaxChars());
        return new Overview(overview, keyPoints, sections);
    }

    /** Comprime il testo al livello richiesto, con dimensioni e rapporto di compressione. */
    public CompressionResult compress(String text, Tier tier) {
        String source = text != null ? text : "";
        String content = switch (tier) {
            case TIER0 -> generateTier0(source);
            case TIER1 -> generateTier1(source).text();
            case TIER2 -> source;
        };
        return CompressionResult.of(tier, content, source.length());
    }

    private List<String> extractKeyPoints(List<String> lines) {
        List<String> keyPoints = new ArrayList<>(MAX_KEY_POINTS);
        for (String line : lines) {
            if (line.length() < KEY_POINT_MIN_LENGTH) continue;
            if (rules.isKeyPoint(line)) {
                keyPoints.add(line);
                if (keyPoints.size() >= MAX_KEY_POINTS) break;
            }
        }
        return keyPoints;
    }

    private List<String> extractSections(List<String> lines) {
        List<String> sections = new ArrayList<>(MAX_SECTIONS);
        StringBuilder current = null;
        for (String line : lines) {
            if (sections.size() >= MAX_SECTIONS) break;
            if (line.startsWith(SUB_HEADING)) {
                closeSection(current, sections);
                current = new StringBuilder(line.substring(SUB_HEADING.length()).strip()).append(": ");
            } else if (ANY_HEADING.matcher(line).find()) {
                // "# " e "### "+ chiudono la sezione corrente senza aprirne una nuova
                closeSection(current, sections);
                current = null;
            } else if (current != null && line.length() > SECTION_LINE_MIN) {
                current.append(truncate(line, SECTION_LINE_CUT)).append(ELLIPSIS).append(' ');
            }
        }
        if (sections.size() < MAX_SECTIONS) {
            closeSection(current, sections);
        }
        return sections;
    }

    private static void closeSection(StringBuilder current, List<String> sections) {
        if (current != null) {
            sections.add(current.toString().strip());
        }
    }

    /** Tronca a {@code max} caratteri senza spezzare una coppia surrogata. */
    static String truncate(String s, int max) {
        if (s.length() <= max) return s;
        int end = max;
        if (end > 1 && Character.isHighSurrogate(s.charAt(end - 1))) end--;
        return s.substring(0, end);
    }
}
