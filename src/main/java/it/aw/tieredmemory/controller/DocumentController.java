package it.aw.tieredmemory.controller;

import it.aw.tieredmemory.model.DigestRecord;
import it.aw.tieredmemory.model.MigrationReport;
import it.aw.tieredmemory.model.RegistryStats;
import it.aw.tieredmemory.registry.DigestRegistry;
import it.aw.tieredmemory.service.IngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;

/**
 * Gestisce i documenti del tier store: ingestione, migrazione di una directory,
 * consultazione e rimozione dei digest registrati.
 *
 * Endpoint disponibili:
 *   POST   /api/memory/documents/{key}          ingerisce un file (multipart "file")
 *   POST   /api/memory/documents/migrate?dir=   migra tutti i .md/.txt/.pdf di una directory
 *   GET    /api/memory/documents                lista dei digest, più recenti prima
 *   GET    /api/memory/documents/stats          totali e rapporti di compressione
 *   GET    /api/memory/documents/{key}          dettaglio di un digest
 *   DELETE /api/memory/documents/{key}          rimuove il documento da store e registry
 *
 * Nota: i path letterali /migrate e /stats hanno priorità su /{key} in Spring MVC.
 */
@RestController
@RequestMapping("/api/memory/documents")
public class DocumentController {

    private static final Logger log = LoggerFactory.getLogger(DocumentController.class);

    private final IngestionService ingestionService;
    private final DigestRegistry registry;

    public DocumentController(IngestionService ingestionService, DigestRegistry registry) {
        this.ingestionService = ingestionService;
        this.registry = registry;
    }

    // -------------------------------------------------------------------------
    // POST /api/memory/documents/{key}
    // -------------------------------------------------------------------------

    /**
     * Ingerisce un documento (PDF o testo). Re-ingerire la stessa chiave sovrascrive i livelli.
     *
     * Esempio:
     *   curl -X POST http://localhost:8889/api/memory/documents/2026-10-18 \
     *        -F "file=@2026-10-18.md"
     */
    @PostMapping("/{key}")
    public ResponseEntity<DigestRecord> ingest(@PathVariable String key,
                                               @RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        try {
            DigestRecord record = ingestionService.ingest(
                    key, file.getOriginalFilename(), file.getContentType(), file.getBytes());
            return ResponseEntity.ok(record);
        } catch (IOException e) {
            log.error("Errore durante l'ingestione: {} (key={})", file.getOriginalFilename(), key, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    // -------------------------------------------------------------------------
    // POST /api/memory/documents/migrate?dir=...
    // -------------------------------------------------------------------------

    /**
     * Migra una directory del server e restituisce il report, salvato anche accanto
     * allo snapshot delle statistiche. Una directory inesistente dà 400.
     *
     * Esempio:
     *   curl -X POST "http://localhost:8889/api/memory/documents/migrate?dir=/data/memory"
     */
    @PostMapping("/migrate")
    public ResponseEntity<MigrationReport> migrate(@RequestParam("dir") String directory) {
        if (directory.isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        try {
            return ResponseEntity.ok(ingestionService.migrateDirectory(Paths.get(directory)));
        } catch (IOException e) {
            log.error("Errore durante la migrazione di {}", directory, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    // -------------------------------------------------------------------------
    // GET /api/memory/documents
    // -------------------------------------------------------------------------

    /**
     * Restituisce tutti i digest registrati, dal più recente.
     *
     * Esempio:
     *   curl http://localhost:8889/api/memory/documents
     */
    @GetMapping
    public ResponseEntity<List<DigestRecord>> listDocuments() {
        return ResponseEntity.ok(registry.findAll());
    }

    // -------------------------------------------------------------------------
    // GET /api/memory/documents/stats
    // -------------------------------------------------------------------------

    /**
     * Numero di documenti, caratteri totali per livello e rapporti di compressione.
     *
     * Esempio:
     *   curl http://localhost:8889/api/memory/documents/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<RegistryStats> stats() {
        return ResponseEntity.ok(registry.stats());
    }

    // -------------------------------------------------------------------------
    // GET /api/memory/documents/{key}
    // -------------------------------------------------------------------------

    /**
     * Dettaglio di un digest: sorgente, dimensioni dei livelli, punti chiave e sezioni.
     * 404 se la chiave non è registrata.
     *
     * Esempio:
     *   curl http://localhost:8889/api/memory/documents/2026-10-18
     */
    @GetMapping("/{key}")
    public ResponseEntity<DigestRecord> getDocument(@PathVariable String key) {
        return registry.findByKey(key)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    // -------------------------------------------------------------------------
    // DELETE /api/memory/documents/{key}
    // -------------------------------------------------------------------------

    /**
     * Rimuove tutti i livelli del documento e la sua riga nel registry.
     * Il file sorgente collegato come L2 non viene toccato.
     *
     * Esempio:
     *   curl -X DELETE http://localhost:8889/api/memory/documents/2026-10-18
     */
    @DeleteMapping("/{key}")
    public ResponseEntity<Void> deleteDocument(@PathVariable String key) {
        boolean removed = ingestionService.remove(key);
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }
}
