package it.aw.tieredmemory.store;

import it.aw.tieredmemory.model.Tier;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Archivio dei livelli di ciascun documento. Le chiavi sono identificativi opachi
 * (es. una data o un nome file senza estensione).
 * <p>
 * Un livello assente si traduce in {@link Optional#empty()}, mai in un errore.
 * Gli errori di I/O sono riportati come
 * {@link it.aw.tieredmemory.exception.StorageUnavailableException}.
 */
public interface TierStore {

    Optional<String> getTierContent(String documentKey, Tier tier);

    void putTierContent(String documentKey, Tier tier, String text);

    /**
     * Rende disponibile il file sorgente come livello 2 senza copiarlo, se possibile.
     *
     * @return true se è stato creato un riferimento, false se si è ripiegato su una copia
     */
    boolean linkFullContent(String documentKey, Path source);

    /** Chiavi presenti in almeno un livello, dalla modificata più di recente. */
    List<String> listDocuments();

    /** Documento modificato più di recente, se lo store non è vuoto. */
    default Optional<String> latestDocument() {
        return listDocuments().stream().findFirst();
    }

    /** Rimuove tutti i livelli del documento. @return true se almeno un livello esisteva */
    boolean removeDocument(String documentKey);
}
