package it.aw.tieredmemory.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.tieredmemory.exception.StorageUnavailableException;
import it.aw.tieredmemory.model.DigestRecord;
import it.aw.tieredmemory.model.RegistryStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.*;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Registro dei documenti ingeriti, persistito nella tabella {@code digests}
 * di un file DuckDB.
 * <p>
 * Un'unica connessione JDBC è condivisa da tutte le operazioni; l'accesso
 * è sincronizzato perché DuckDBConnection non è thread-safe.
 * <p>
 * Migrazione schema: se all'avvio mancano colonne richieste o la chiave primaria
 * non è {@code document_key}, la tabella viene ricreata. I documenti vanno re-ingeriti.
 */
@Component
public class DigestRegistry {

    private static final Logger log = LoggerFactory.getLogger(DigestRegistry.class);

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS digests (
                document_key        VARCHAR   PRIMARY KEY,
                source              VARCHAR   NOT NULL,
                ingested_at         TIMESTAMP NOT NULL,
                original_chars      INTEGER   NOT NULL,
                tier0_chars         INTEGER   NOT NULL,
                tier1_chars         INTEGER   NOT NULL,
                key_points          VARCHAR   NOT NULL,
                sections            VARCHAR   NOT NULL,
                full_content_linked BOOLEAN   NOT NULL DEFAULT FALSE
            )
            """;

    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};

    private final String dbPath;
    private final ObjectMapper objectMapper;
    private Connection conn;

    public DigestRegistry(ObjectMapper objectMapper, @Value("${store.registry.path}") String dbPath) {
        this.objectMapper = objectMapper;
        this.dbPath = dbPath;
    }

    @PostConstruct
    void init() throws SQLException, IOException {
        Path path = Paths.get(dbPath);
        Files.createDirectories(path.toAbsolutePath().getParent());
        conn = DriverManager.getConnection("jdbc:duckdb:" + path.toAbsolutePath());
        migrateIfNeeded();
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE);
        }
        log.info("DigestRegistry: tabella 'digests' pronta su {}", path.toAbsolutePath());
    }

    /** Rileva schema obsoleto e ricrea la tabella se necessario. */
    private void migrateIfNeeded() throws SQLException {
        Set<String> required = Set.of("document_key", "tier0_chars", "tier1_chars", "full_content_linked");
        Set<String> existing = new HashSet<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT column_name FROM information_schema.columns WHERE table_name = 'digests'")) {
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) existing.add(rs.getString(1));
            }
        }
        boolean needsDrop = !existing.isEmpty() && !existing.containsAll(required);
        if (!needsDrop && !existing.isEmpty()) {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(
                         "SELECT COUNT(*) FROM duckdb_constraints() " +
                         "WHERE table_name = 'digests' AND constraint_type = 'PRIMARY KEY' " +
                         "AND list_contains(constraint_column_names, 'document_key')")) {
                if (rs.next() && rs.getInt(1) == 0) needsDrop = true;
            }
        }
        if (needsDrop) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("DROP TABLE IF EXISTS digests");
            }
            log.warn("DigestRegistry: schema obsoleto rilevato, tabella 'digests' ricreata. " +
                     "Re-ingerire i documenti esistenti.");
        }
    }

    @PreDestroy
    void close() {
        try {
            if (conn != null && !conn.isClosed()) conn.close();
        } catch (SQLException e) {
            log.warn("Errore chiusura connessione DuckDB registry: {}", e.getMessage());
        }
    }

    public synchronized void register(DigestRecord record) {
        String sql = """
                INSERT INTO digests
                    (document_key, source, ingested_at, original_chars, tier0_chars, tier1_chars,
                     key_points, sections, full_content_linked)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (document_key) DO UPDATE SET
                    source              = EXCLUDED.source,
                    ingested_at         = EXCLUDED.ingested_at,
                    original_chars      = EXCLUDED.original_chars,
                    tier0_chars         = EXCLUDED.tier0_chars,
                    tier1_chars         = EXCLUDED.tier1_chars,
                    key_points          = EXCLUDED.key_points,
                    sections            = EXCLUDED.sections,
                    full_content_linked = EXCLUDED.full_content_linked
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, record.documentKey());
            ps.setString(2, record.source());
            ps.setTimestamp(3, Timestamp.valueOf(record.ingestedAt()));
            ps.setInt(4, record.originalChars());
            ps.setInt(5, record.tier0Chars());
            ps.setInt(6, record.tier1Chars());
            ps.setString(7, objectMapper.writeValueAsString(record.keyPoints()));
            ps.setString(8, objectMapper.writeValueAsString(record.sections()));
            ps.setBoolean(9, record.fullContentLinked());
            ps.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            throw new StorageUnavailableException("Errore salvataggio digest nel registry", e);
        }
    }

    public synchronized Optional<DigestRecord> findByKey(String documentKey) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM digests WHERE document_key = ?")) {
            ps.setString(1, documentKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(toRecord(rs));
            }
        } catch (SQLException | IOException e) {
            throw new StorageUnavailableException("Errore lettura digest dal registry", e);
        }
        return Optional.empty();
    }

    public synchronized List<DigestRecord> findAll() {
        List<DigestRecord> result = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT * FROM digests ORDER BY ingested_at DESC, document_key")) {
            while (rs.next()) result.add(toRecord(rs));
        } catch (SQLException | IOException e) {
            throw new StorageUnavailableException("Errore lettura registry", e);
        }
        return result;
    }

    /** @return true se il documento era registrato */
    public synchronized boolean remove(String documentKey) {
        try (PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM digests WHERE document_key = ?")) {
            ps.setString(1, documentKey);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Errore rimozione digest dal registry", e);
        }
    }

    public synchronized int totalDocuments() {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM digests")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Errore conteggio documenti", e);
        }
    }

    public synchronized RegistryStats stats() {
        String sql = """
                SELECT COUNT(*),
                       COALESCE(SUM(original_chars), 0),
                       COALESCE(SUM(tier0_chars), 0),
                       COALESCE(SUM(tier1_chars), 0)
                FROM digests
                """;
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            int docs = rs.getInt(1);
            long original = rs.getLong(2);
            long tier0 = rs.getLong(3);
            long tier1 = rs.getLong(4);
            return new RegistryStats(docs, original, tier0, tier1,
                    original > 0 ? (double) tier0 / original : 0.0,
                    original > 0 ? (double) tier1 / original : 0.0,
                    "DuckDB");
        } catch (SQLException e) {
            throw new StorageUnavailableException("Errore calcolo statistiche registry", e);
        }
    }

    private DigestRecord toRecord(ResultSet rs) throws SQLException, IOException {
        return new DigestRecord(
                rs.getString("document_key"),
                rs.getString("source"),
                rs.getTimestamp("ingested_at").toLocalDateTime(),
                rs.getInt("original_chars"),
                rs.getInt("tier0_chars"),
                rs.getInt("tier1_chars"),
                objectMapper.readValue(rs.getString("key_points"), STRING_LIST_TYPE),
                objectMapper.readValue(rs.getString("sections"), STRING_LIST_TYPE),
                rs.getBoolean("full_content_linked")
        );
    }
}
