package it.aw.tieredmemory.model;

import java.util.List;

/**
 * Overview di livello 1: testo già formattato e troncato, più i punti chiave
 * e le etichette di sezione da cui è stato costruito (in ordine di documento).
 */
public record Overview(
        String       text,
        List<String> keyPoints,   // 0..5
        List<String> sections     // 0..4, formato "Titolo: corpo... "
) {
    public Overview {
        keyPoints = List.copyOf(keyPoints);
        sections  = List.copyOf(sections);
    }

    public boolean hasStructure() {
        return !keyPoints.isEmpty() || !sections.isEmpty();
    }
}
