package it.aw.tieredmemory.model;

/**
 * Categoria di intento di una query, usata per scegliere i livelli da caricare.
 * GENERAL è la categoria di default quando nessuna keyword corrisponde.
 */
public enum QueryIntent {
    FACTUAL_DATE,
    ADMINISTRATIVE,
    ANALYTICAL,
    CREATIVE,
    FACTUAL_LIST,
    FACTUAL,
    GENERAL
}
