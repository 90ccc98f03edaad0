package it.aw.tieredmemory;

import it.aw.tieredmemory.model.DigestRecord;
import it.aw.tieredmemory.model.QueryAnswer;
import it.aw.tieredmemory.model.QueryIntent;
import it.aw.tieredmemory.model.Tier;
import it.aw.tieredmemory.registry.DigestRegistry;
import it.aw.tieredmemory.service.IngestionService;
import it.aw.tieredmemory.service.TieredMemoryEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@DirtiesContext
class TieredMemoryApplicationTest {

    @TempDir
    static Path dataDir;

    @DynamicPropertySource
    static void storeProperties(DynamicPropertyRegistry registry) {
        registry.add("store.root", () -> dataDir.resolve("memory").toString());
        registry.add("store.registry.path", () -> dataDir.resolve("registry.duckdb").toString());
        registry.add("store.stats.file", () -> dataDir.resolve("stats.json").toString());
    }

    @Autowired
    IngestionService ingestionService;

    @Autowired
    TieredMemoryEngine engine;

    @Autowired
    DigestRegistry registry;

    @Test
    void ingestThenAnswerEndToEnd() throws Exception {
        Path note = Files.writeString(dataDir.resolve("2026-10-18.md"),
                "# Daily log\n## Progress\n- done: tier store on filesystem\n- blocked: review pending\n");

        DigestRecord record = ingestionService.ingest("2026-10-18", note);
        QueryAnswer answer = engine.answer("检查状态");

        assertEquals("2026-10-18", answer.documentKey());
        assertEquals(QueryIntent.ADMINISTRATIVE, answer.classification().primaryType());
        assertEquals(List.of(Tier.TIER0), answer.selection().tiers());
        assertTrue(answer.content().contains("Daily log"));
        assertEquals(record.tier0Chars(), registry.findByKey("2026-10-18").orElseThrow().tier0Chars());
        assertTrue(engine.dashboard().totalQueries() >= 1);
    }
}
