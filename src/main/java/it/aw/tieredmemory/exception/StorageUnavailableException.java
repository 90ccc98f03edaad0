package it.aw.tieredmemory.exception;

/**
 * Errore di lettura o scrittura nel tier store. Viene propagato al chiamante
 * senza retry; l'assenza di un livello non è un errore e non produce questa eccezione.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
