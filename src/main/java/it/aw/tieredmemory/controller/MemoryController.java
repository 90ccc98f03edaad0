package it.aw.tieredmemory.controller;

import it.aw.tieredmemory.model.ClassificationResult;
import it.aw.tieredmemory.model.Dashboard;
import it.aw.tieredmemory.model.QueryAnswer;
import it.aw.tieredmemory.model.TieredDigest;
import it.aw.tieredmemory.service.TieredMemoryEngine;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Espone il motore a livelli: sintesi, classificazione, risposta alle query e statistiche.
 *
 * Endpoint disponibili:
 *   POST   /api/memory/summarize              genera L0 e L1 dal testo nel body
 *   GET    /api/memory/classify?q=            intento e confidenza di una query
 *   GET    /api/memory/answer?q=&document=    contenuto dei livelli selezionati
 *   GET    /api/memory/dashboard              statistiche di risparmio aggregate
 *   DELETE /api/memory/stats                  azzera le statistiche
 */
@RestController
@RequestMapping("/api/memory")
public class MemoryController {

    private final TieredMemoryEngine engine;

    public MemoryController(TieredMemoryEngine engine) {
        this.engine = engine;
    }

    // -------------------------------------------------------------------------
    // POST /api/memory/summarize
    // -------------------------------------------------------------------------

    /**
     * Genera L0 e L1 del testo nel body senza salvarli.
     *
     * Esempio:
     *   curl -X POST http://localhost:8889/api/memory/summarize \
     *        -H "Content-Type: text/plain" --data-binary @note.md
     */
    @PostMapping("/summarize")
    public ResponseEntity<TieredDigest> summarize(@RequestBody(required = false) String text) {
        if (text == null || text.isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(engine.summarize(text));
    }

    // -------------------------------------------------------------------------
    // GET /api/memory/classify?q=...
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl "http://localhost:8889/api/memory/classify?q=what+changed+today"
     */
    @GetMapping("/classify")
    public ResponseEntity<ClassificationResult> classify(@RequestParam("q") String query) {
        if (query.isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(engine.classify(query));
    }

    // -------------------------------------------------------------------------
    // GET /api/memory/answer?q=...&document=...
    // -------------------------------------------------------------------------

    /**
     * Senza {@code document} si interroga il documento modificato più di recente.
     *
     * Esempio:
     *   curl "http://localhost:8889/api/memory/answer?q=check+status&document=2026-10-18"
     */
    @GetMapping("/answer")
    public ResponseEntity<QueryAnswer> answer(
            @RequestParam("q") String query,
            @RequestParam(value = "document", required = false) String documentKey) {
        if (query.isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        String key = documentKey != null && !documentKey.isBlank() ? documentKey : null;
        return ResponseEntity.ok(engine.answer(query, key));
    }

    // -------------------------------------------------------------------------
    // GET /api/memory/dashboard
    // -------------------------------------------------------------------------

    /**
     * Totali, risparmio medio, statistiche per intento e ultime query.
     *
     * Esempio:
     *   curl http://localhost:8889/api/memory/dashboard
     */
    @GetMapping("/dashboard")
    public ResponseEntity<Dashboard> dashboard() {
        return ResponseEntity.ok(engine.dashboard());
    }

    // -------------------------------------------------------------------------
    // DELETE /api/memory/stats
    // -------------------------------------------------------------------------

    /**
     * Azzera le statistiche e salva subito lo snapshot vuoto.
     *
     * Esempio:
     *   curl -X DELETE http://localhost:8889/api/memory/stats
     */
    @DeleteMapping("/stats")
    public ResponseEntity<Void> resetStatistics() {
        engine.resetStatistics();
        return ResponseEntity.noContent().build();
    }
}
