package it.aw.tieredmemory.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.tieredmemory.config.TieredMemoryProperties;
import it.aw.tieredmemory.exception.StorageUnavailableException;
import it.aw.tieredmemory.model.DigestRecord;
import it.aw.tieredmemory.model.MigrationReport;
import it.aw.tieredmemory.model.Tier;
import it.aw.tieredmemory.registry.DigestRegistry;
import it.aw.tieredmemory.registry.StatsSnapshotStore;
import it.aw.tieredmemory.store.FileSystemTierStore;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class IngestionServiceTest {

    private static final String NOTE = """
            # 2026-10-18
            ## Progress
            - done: migrated the registry to DuckDB
            - blocked: waiting for storage quota
            ## Decisions
            decision: keep the overview under 500 chars
            """;

    @TempDir
    Path tempDir;

    private FileSystemTierStore store;
    private DigestRegistry registry;
    private StatsSnapshotStore snapshotStore;
    private IngestionService service;

    @BeforeEach
    void setUp() {
        store = new FileSystemTierStore(tempDir.resolve("memory"));
        registry = mock(DigestRegistry.class);
        snapshotStore = new StatsSnapshotStore(new ObjectMapper().findAndRegisterModules(),
                tempDir.resolve("data/stats.json").toString());
        TieredMemoryProperties properties = TieredMemoryProperties.defaults();
        service = new IngestionService(new Summarizer(properties, SummaryRules.defaults()),
                store, registry, snapshotStore, properties);
    }

    @Test
    void ingestWritesAllTiersAndRegisters() throws IOException {
        Path source = Files.writeString(tempDir.resolve("2026-10-18.md"), NOTE);

        DigestRecord record = service.ingest("2026-10-18", source);

        assertTrue(store.getTierContent("2026-10-18", Tier.TIER0).orElseThrow().contains("2026-10-18"));
        assertTrue(store.getTierContent("2026-10-18", Tier.TIER1).orElseThrow().contains("Progress"));
        assertEquals(NOTE, store.getTierContent("2026-10-18", Tier.TIER2).orElseThrow());

        assertEquals(NOTE.length(), record.originalChars());
        assertTrue(record.tier0Chars() <= 100);
        assertEquals(2, record.sections().size());
        assertEquals(source.toString(), record.source());
        verify(registry).register(record);
    }

    @Test
    void linkedFullContentFollowsSource() throws IOException {
        Path source = Files.writeString(tempDir.resolve("note.md"), NOTE);

        DigestRecord record = service.ingest("note", source);

        if (record.fullContentLinked()) {
            assertTrue(Files.isSymbolicLink(tempDir.resolve("memory/L2/note.md")));
            Files.writeString(source, "updated");
            assertEquals("updated", store.getTierContent("note", Tier.TIER2).orElseThrow());
        } else {
            assertFalse(Files.isSymbolicLink(tempDir.resolve("memory/L2/note.md")));
        }
    }

    @Test
    void uploadIsCopiedToFullContent() throws IOException {
        DigestRecord record = service.ingest("upload", "upload.md", "text/markdown",
                NOTE.getBytes(StandardCharsets.UTF_8));

        assertFalse(record.fullContentLinked());
        assertEquals("upload.md", record.source());
        assertEquals(NOTE, store.getTierContent("upload", Tier.TIER2).orElseThrow());
    }

    @Test
    void pdfUploadIsExtracted() throws IOException {
        DigestRecord record = service.ingest("report", "report.pdf", "application/pdf",
                pdf("Quarterly report with the full migration status"));

        assertFalse(record.fullContentLinked());
        assertTrue(store.getTierContent("report", Tier.TIER2).orElseThrow().contains("Quarterly report"));
        assertTrue(store.getTierContent("report", Tier.TIER0).orElseThrow().startsWith("Quarterly report"));
    }

    @Test
    void reingestOverwritesTiers() throws IOException {
        service.ingest("doc", "doc.md", null, "# First\nfirst version of the text".getBytes(StandardCharsets.UTF_8));
        service.ingest("doc", "doc.md", null, "# Second\nsecond version of the text".getBytes(StandardCharsets.UTF_8));

        assertTrue(store.getTierContent("doc", Tier.TIER0).orElseThrow().startsWith("Second"));
        verify(registry, times(2)).register(any());
    }

    @Test
    void migrateDirectoryCountsFailuresAndWritesReport() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("notes"));
        Files.writeString(dir.resolve("a.md"), NOTE);
        Files.writeString(dir.resolve("b.txt"), "plain text note that is long enough to summarize");
        Files.writeString(dir.resolve("c.pdf"), "not really a pdf");
        Files.writeString(dir.resolve("ignored.json"), "{}");

        MigrationReport report = service.migrateDirectory(dir);

        assertEquals(3, report.totalFiles());
        assertEquals(2, report.migratedFiles());
        assertEquals(1, report.failedFiles());
        assertEquals(NOTE.length() + "plain text note that is long enough to summarize".length(),
                report.totalOriginalChars());
        assertEquals(report.totalOriginalChars() * 0.25, report.estimatedTokensOriginal(), 1e-9);
        assertTrue(report.tier1Ratio() > 0);
        assertFalse(report.finishedAt().isBefore(report.startedAt()));

        assertTrue(store.getTierContent("a", Tier.TIER0).isPresent());
        assertTrue(store.getTierContent("b", Tier.TIER1).isPresent());
        assertTrue(store.getTierContent("ignored", Tier.TIER0).isEmpty());
        assertTrue(Files.exists(tempDir.resolve("data/migration_report.json")));

        ArgumentCaptor<DigestRecord> captor = ArgumentCaptor.forClass(DigestRecord.class);
        verify(registry, times(2)).register(captor.capture());
        assertEquals("a", captor.getAllValues().get(0).documentKey());
        assertEquals("b", captor.getAllValues().get(1).documentKey());
    }

    @Test
    void migrateContinuesWhenRegistryFails() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("notes"));
        Files.writeString(dir.resolve("a.md"), NOTE);
        Files.writeString(dir.resolve("b.md"), NOTE);
        doThrow(new IllegalStateException("registry offline"))
                .when(registry).register(argThat(r -> r.documentKey().equals("a")));

        MigrationReport report = service.migrateDirectory(dir);

        assertEquals(1, report.failedFiles());
        assertEquals(1, report.migratedFiles());
        assertEquals(List.of("b"), store.listDocuments());
    }

    @Test
    void failedRegistrationRemovesWrittenTiers() throws IOException {
        Path source = Files.writeString(tempDir.resolve("2026-10-18.md"), NOTE);
        doThrow(new StorageUnavailableException("registry offline", new SQLException("closed")))
                .when(registry).register(any());

        assertThrows(StorageUnavailableException.class, () -> service.ingest("2026-10-18", source));

        for (Tier tier : Tier.values()) {
            assertTrue(store.getTierContent("2026-10-18", tier).isEmpty());
        }
        assertTrue(store.listDocuments().isEmpty());
        assertTrue(store.latestDocument().isEmpty());
        assertTrue(Files.exists(source));
    }

    @Test
    void failedUploadRegistrationRemovesWrittenTiers() {
        doThrow(new StorageUnavailableException("registry offline", new SQLException("closed")))
                .when(registry).register(any());

        assertThrows(StorageUnavailableException.class,
                () -> service.ingest("doc", "doc.md", null, NOTE.getBytes(StandardCharsets.UTF_8)));

        assertFalse(store.listDocuments().contains("doc"));
    }

    @Test
    void migrateRejectsMissingDirectory() {
        assertThrows(IllegalArgumentException.class,
                () -> service.migrateDirectory(tempDir.resolve("does-not-exist")));
    }

    @Test
    void removeDeletesFromStoreAndRegistry() throws IOException {
        service.ingest("doc", "doc.md", null, NOTE.getBytes(StandardCharsets.UTF_8));
        when(registry.remove("doc")).thenReturn(true);

        assertTrue(service.remove("doc"));
        assertTrue(store.getTierContent("doc", Tier.TIER0).isEmpty());
        assertFalse(service.remove("missing"));
    }

    private static byte[] pdf(String line) throws IOException {
        try (PDDocument doc = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDPage page = new PDPage();
            doc.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(doc, page)) {
                content.beginText();
                content.setFont(PDType1Font.HELVETICA, 12);
                content.newLineAtOffset(50, 700);
                content.showText(line);
                content.endText();
            }
            doc.save(out);
            return out.toByteArray();
        }
    }
}
