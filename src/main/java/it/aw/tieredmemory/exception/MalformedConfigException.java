package it.aw.tieredmemory.exception;

/**
 * Valore di configurazione non valido. Sollevata al caricamento della
 * configurazione, mai durante l'elaborazione di una query.
 */
public class MalformedConfigException extends IllegalArgumentException {

    public MalformedConfigException(String message) {
        super(message);
    }
}
