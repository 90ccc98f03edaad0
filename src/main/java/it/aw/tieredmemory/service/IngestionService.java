package it.aw.tieredmemory.service;

import it.aw.tieredmemory.config.TieredMemoryProperties;
import it.aw.tieredmemory.model.DigestRecord;
import it.aw.tieredmemory.model.MigrationReport;
import it.aw.tieredmemory.model.Tier;
import it.aw.tieredmemory.model.TieredDigest;
import it.aw.tieredmemory.registry.DigestRegistry;
import it.aw.tieredmemory.registry.StatsSnapshotStore;
import it.aw.tieredmemory.store.TierStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Gestisce l'ingestione dei documenti nel tier store.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Parse: PDF via PdfTextExtractor; .md/.txt come testo UTF-8</li>
 *   <li>Summarizer: genera L0 e L1</li>
 *   <li>Scrittura L0/L1 nello store</li>
 *   <li>L2: link al file sorgente (copia se il link non è possibile); per PDF e
 *       upload si scrive il testo estratto</li>
 *   <li>Registra il DigestRecord nel registry DuckDB</li>
 * </ol>
 * Re-ingerire la stessa chiave sovrascrive tutti i livelli. Se un passo dopo la
 * scrittura di L0/L1 fallisce, i livelli del documento vengono rimossi.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);
    private static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".md", ".txt", ".pdf");

    private final Summarizer summarizer;
    private final TierStore store;
    private final DigestRegistry registry;
    private final StatsSnapshotStore snapshotStore;
    private final double tokensPerByte;

    public IngestionService(Summarizer summarizer,
                            TierStore store,
                            DigestRegistry registry,
                            StatsSnapshotStore snapshotStore,
                            TieredMemoryProperties properties) {
        this.summarizer = summarizer;
        this.store = store;
        this.registry = registry;
        this.snapshotStore = snapshotStore;
        this.tokensPerByte = properties.tokensPerByte();
    }

    /** Ingerisce un file locale; per testo semplice L2 è un riferimento al file stesso. */
    public DigestRecord ingest(String documentKey, Path source) throws IOException {
        String filename = source.getFileName().toString();
        log.info("Inizio ingestione: {} (key={})", source, documentKey);

        if (PdfTextExtractor.isPdf(filename, null)) {
            String text;
            try (InputStream is = Files.newInputStream(source)) {
                text = PdfTextExtractor.extract(is).text();
            }
            TieredDigest digest = writeTiers(documentKey, text);
            try {
                store.putTierContent(documentKey, Tier.TIER2, text);
                return register(documentKey, source.toString(), digest, false);
            } catch (RuntimeException e) {
                throw discardPartial(documentKey, e);
            }
        }

        String text = Files.readString(source, StandardCharsets.UTF_8);
        TieredDigest digest = writeTiers(documentKey, text);
        try {
            boolean linked = store.linkFullContent(documentKey, source);
            return register(documentKey, source.toString(), digest, linked);
        } catch (RuntimeException e) {
            throw discardPartial(documentKey, e);
        }
    }

    /** Ingerisce un contenuto caricato via upload; L2 è sempre una copia. */
    public DigestRecord ingest(String documentKey, String filename, String contentType, byte[] content)
            throws IOException {
        String source = filename != null ? filename : "upload";
        log.info("Inizio ingestione upload: {} (key={}, {} byte)", source, documentKey, content.length);

        String text;
        if (PdfTextExtractor.isPdf(filename, contentType)) {
            try (InputStream is = new ByteArrayInputStream(content)) {
                text = PdfTextExtractor.extract(is).text();
            }
        } else {
            text = new String(content, StandardCharsets.UTF_8);
        }
        TieredDigest digest = writeTiers(documentKey, text);
        try {
            store.putTierContent(documentKey, Tier.TIER2, text);
            return register(documentKey, source, digest, false);
        } catch (RuntimeException e) {
            throw discardPartial(documentKey, e);
        }
    }

    /**
     * Migra tutti i documenti supportati di una directory (non ricorsivo), in ordine
     * di nome. La chiave di ogni documento è il nome file senza estensione.
     * Un file che fallisce viene loggato e conteggiato; la migrazione prosegue.
     */
    public MigrationReport migrateDirectory(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Directory non trovata: " + directory);
        }
        LocalDateTime startedAt = LocalDateTime.now();
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(Files::isRegularFile).filter(IngestionService::isSupported).sorted().toList();
        }
        log.info("Migrazione di {}: {} documenti trovati", directory, files.size());

        int migrated = 0;
        int failed = 0;
        long originalChars = 0;
        long tier0Chars = 0;
        long tier1Chars = 0;
        for (Path file : files) {
            try {
                DigestRecord record = ingest(stem(file), file);
                migrated++;
                originalChars += record.originalChars();
                tier0Chars += record.tier0Chars();
                tier1Chars += record.tier1Chars();
            } catch (IOException | RuntimeException e) {
                failed++;
                log.error("Migrazione fallita per {}: {}", file, e.getMessage(), e);
            }
        }

        MigrationReport report = new MigrationReport(
                files.size(), migrated, failed,
                originalChars, tier0Chars, tier1Chars,
                originalChars > 0 ? (double) tier0Chars / originalChars : 0.0,
                originalChars > 0 ? (double) tier1Chars / originalChars : 0.0,
                originalChars * tokensPerByte,
                tier1Chars * tokensPerByte,
                startedAt, LocalDateTime.now());
        try {
            Path path = snapshotStore.saveMigrationReport(report);
            log.info("Migrazione completata: {}/{} documenti, report in {}", migrated, files.size(), path);
        } catch (IOException e) {
            log.error("Migrazione completata ma report non salvato: {}", e.getMessage());
        }
        return report;
    }

    /** Rimuove un documento da store e registry. @return true se esisteva in almeno uno dei due */
    public boolean remove(String documentKey) {
        boolean fromStore = store.removeDocument(documentKey);
        boolean fromRegistry = registry.remove(documentKey);
        if (fromStore || fromRegistry) {
            log.info("Documento rimosso: {}", documentKey);
        }
        return fromStore || fromRegistry;
    }

    private TieredDigest writeTiers(String documentKey, String text) {
        TieredDigest digest = summarizer.summarize(text);
        try {
            store.putTierContent(documentKey, Tier.TIER0, digest.summary());
            store.putTierContent(documentKey, Tier.TIER1, digest.overview().text());
        } catch (RuntimeException e) {
            throw discardPartial(documentKey, e);
        }
        return digest;
    }

    /**
     * Rimuove i livelli già scritti di un'ingestione fallita, così lo store non
     * espone documenti senza L2 o senza riga nel registry.
     */
    private RuntimeException discardPartial(String documentKey, RuntimeException cause) {
        log.warn("Ingestione fallita per {}, rimozione dei livelli parziali: {}", documentKey, cause.getMessage());
        try {
            store.removeDocument(documentKey);
        } catch (RuntimeException cleanup) {
            cause.addSuppressed(cleanup);
        }
        return cause;
    }

    private DigestRecord register(String documentKey, String source, TieredDigest digest, boolean linked) {
        DigestRecord record = new DigestRecord(
                documentKey, source, LocalDateTime.now(),
                digest.originalChars(), digest.summary().length(), digest.overview().text().length(),
                digest.overview().keyPoints(), digest.overview().sections(), linked);
        registry.register(record);
        log.info("Ingestione completata: {}, {} → {}/{} caratteri (L2 {})",
                documentKey, record.originalChars(), record.tier0Chars(), record.tier1Chars(),
                linked ? "collegato" : "copiato");
        return record;
    }

    private static boolean isSupported(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return SUPPORTED_EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
