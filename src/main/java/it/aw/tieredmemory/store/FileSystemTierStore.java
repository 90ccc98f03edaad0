package it.aw.tieredmemory.store;

import it.aw.tieredmemory.exception.StorageUnavailableException;
import it.aw.tieredmemory.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Tier store su filesystem. Un file per documento e livello:
 * <pre>
 *   &lt;root&gt;/L0/&lt;key&gt;.md   summary
 *   &lt;root&gt;/L1/&lt;key&gt;.md   overview
 *   &lt;root&gt;/L2/&lt;key&gt;.md   contenuto completo (link simbolico al sorgente o copia)
 * </pre>
 * Per il livello 2 si prova prima un link simbolico; se il filesystem non lo
 * consente si ripiega su una copia fisica. Chi legge non vede differenze.
 */
@Component
public class FileSystemTierStore implements TierStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemTierStore.class);
    private static final String EXTENSION = ".md";

    private final Path root;

    @Autowired
    public FileSystemTierStore(@Value("${store.root}") String root) {
        this(Paths.get(root));
    }

    public FileSystemTierStore(Path root) {
        this.root = root.toAbsolutePath();
        log.info("TierStore su filesystem: {}", this.root);
    }

    @Override
    public Optional<String> getTierContent(String documentKey, Tier tier) {
        Path path = pathFor(documentKey, tier);
        // Files.exists segue i link: un link al sorgente rimosso conta come assente
        if (!Files.exists(path)) return Optional.empty();
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StorageUnavailableException(
                    "Impossibile leggere " + tier.label() + " di '" + documentKey + "' da " + path, e);
        }
    }

    @Override
    public void putTierContent(String documentKey, Tier tier, String text) {
        Path path = pathFor(documentKey, tier);
        try {
            Files.createDirectories(path.getParent());
            // Un link esistente va rimosso, altrimenti si scriverebbe nel file sorgente
            if (Files.isSymbolicLink(path)) Files.delete(path);
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageUnavailableException(
                    "Impossibile scrivere " + tier.label() + " di '" + documentKey + "' su " + path, e);
        }
    }

    @Override
    public boolean linkFullContent(String documentKey, Path source) {
        Path path = pathFor(documentKey, Tier.TIER2);
        try {
            Files.createDirectories(path.getParent());
            Files.deleteIfExists(path);
            try {
                Files.createSymbolicLink(path, source.toAbsolutePath());
                return true;
            } catch (IOException | UnsupportedOperationException e) {
                log.warn("Link simbolico non disponibile per '{}' ({}), copia del contenuto.",
                        documentKey, e.getMessage());
            }
            Files.copy(source, path, StandardCopyOption.REPLACE_EXISTING);
            return false;
        } catch (IOException e) {
            throw new StorageUnavailableException(
                    "Impossibile collegare il contenuto completo di '" + documentKey + "' da " + source, e);
        }
    }

    @Override
    public List<String> listDocuments() {
        Map<String, FileTime> lastModified = new HashMap<>();
        for (Tier tier : Tier.values()) {
            Path dir = root.resolve(tier.label());
            if (!Files.isDirectory(dir)) continue;
            try (Stream<Path> files = Files.list(dir)) {
                for (Path file : (Iterable<Path>) files::iterator) {
                    String name = file.getFileName().toString();
                    if (!name.endsWith(EXTENSION) || !Files.exists(file)) continue;
                    String key = name.substring(0, name.length() - EXTENSION.length());
                    FileTime time = Files.getLastModifiedTime(file);
                    lastModified.merge(key, time, (a, b) -> a.compareTo(b) >= 0 ? a : b);
                }
            } catch (IOException e) {
                throw new StorageUnavailableException("Impossibile elencare " + dir, e);
            }
        }
        return lastModified.entrySet().stream()
                .sorted(Map.Entry.<String, FileTime>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, FileTime>comparingByKey()))
                .map(Map.Entry::getKey)
                .toList();
    }

    @Override
    public boolean removeDocument(String documentKey) {
        boolean removed = false;
        for (Tier tier : Tier.values()) {
            Path path = pathFor(documentKey, tier);
            try {
                // deleteIfExists rimuove il link, non il sorgente
                removed |= Files.deleteIfExists(path);
            } catch (IOException e) {
                throw new StorageUnavailableException("Impossibile rimuovere " + path, e);
            }
        }
        return removed;
    }

    private Path pathFor(String documentKey, Tier tier) {
        if (documentKey == null || documentKey.isBlank()
                || documentKey.contains("/") || documentKey.contains("\\") || documentKey.startsWith(".")) {
            throw new IllegalArgumentException("Chiave documento non valida: '" + documentKey + "'");
        }
        return root.resolve(tier.label()).resolve(documentKey + EXTENSION);
    }
}
