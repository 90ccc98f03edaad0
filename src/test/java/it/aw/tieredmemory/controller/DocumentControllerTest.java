package it.aw.tieredmemory.controller;

import it.aw.tieredmemory.exception.StorageUnavailableException;
import it.aw.tieredmemory.model.DigestRecord;
import it.aw.tieredmemory.model.MigrationReport;
import it.aw.tieredmemory.model.RegistryStats;
import it.aw.tieredmemory.registry.DigestRegistry;
import it.aw.tieredmemory.service.IngestionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DocumentController.class)
class DocumentControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    IngestionService ingestionService;

    @MockBean
    DigestRegistry registry;

    private static DigestRecord record(String key) {
        return new DigestRecord(key, key + ".md", LocalDateTime.of(2026, 10, 18, 9, 0),
                1000, 80, 400, List.of("- done: release"), List.of("Progress: release..."), false);
    }

    @Test
    void uploadIngestsUnderKey() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "note.md", "text/markdown",
                "# Note\n- done: release".getBytes());
        when(ingestionService.ingest(eq("note"), eq("note.md"), eq("text/markdown"), any(byte[].class)))
                .thenReturn(record("note"));

        mockMvc.perform(multipart("/api/memory/documents/note").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documentKey").value("note"))
                .andExpect(jsonPath("$.tier0Chars").value(80));
    }

    @Test
    void emptyUploadIsRejected() throws Exception {
        MockMultipartFile empty = new MockMultipartFile("file", "note.md", "text/markdown", new byte[0]);

        mockMvc.perform(multipart("/api/memory/documents/note").file(empty))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(ingestionService);
    }

    @Test
    void invalidKeyIsBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "x.md", "text/markdown", "text".getBytes());
        when(ingestionService.ingest(eq(".hidden"), any(), any(), any(byte[].class)))
                .thenThrow(new IllegalArgumentException("Chiave documento non valida: '.hidden'"));

        mockMvc.perform(multipart("/api/memory/documents/.hidden").file(file))
                .andExpect(status().isBadRequest());
    }

    @Test
    void migrateReturnsReport() throws Exception {
        MigrationReport report = new MigrationReport(3, 2, 1, 1000, 80, 400, 0.08, 0.4, 250.0, 100.0,
                LocalDateTime.of(2026, 10, 18, 9, 0), LocalDateTime.of(2026, 10, 18, 9, 1));
        when(ingestionService.migrateDirectory(Paths.get("/data/notes"))).thenReturn(report);

        mockMvc.perform(post("/api/memory/documents/migrate").param("dir", "/data/notes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.migratedFiles").value(2))
                .andExpect(jsonPath("$.failedFiles").value(1));
    }

    @Test
    void migrateIoFailureIsServerError() throws Exception {
        when(ingestionService.migrateDirectory(any())).thenThrow(new IOException("permesso negato"));

        mockMvc.perform(post("/api/memory/documents/migrate").param("dir", "/data/notes"))
                .andExpect(status().isInternalServerError());
    }

    @Test
    void listAndStats() throws Exception {
        when(registry.findAll()).thenReturn(List.of(record("b"), record("a")));
        when(registry.stats()).thenReturn(new RegistryStats(2, 2000, 160, 800, 0.08, 0.4, "DuckDB"));

        mockMvc.perform(get("/api/memory/documents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].documentKey").value("b"))
                .andExpect(jsonPath("$.length()").value(2));

        mockMvc.perform(get("/api/memory/documents/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.storeType").value("DuckDB"));
    }

    @Test
    void getDocumentOrNotFound() throws Exception {
        when(registry.findByKey("a")).thenReturn(Optional.of(record("a")));
        when(registry.findByKey("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/memory/documents/a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sections[0]").value("Progress: release..."));
        mockMvc.perform(get("/api/memory/documents/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void deleteDocument() throws Exception {
        when(ingestionService.remove("a")).thenReturn(true);

        mockMvc.perform(delete("/api/memory/documents/a")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/memory/documents/missing")).andExpect(status().isNotFound());
    }

    @Test
    void registryFailureIsServiceUnavailable() throws Exception {
        when(registry.findAll()).thenThrow(new StorageUnavailableException("Errore lettura registry", null));

        mockMvc.perform(get("/api/memory/documents"))
                .andExpect(status().isServiceUnavailable());
    }
}
