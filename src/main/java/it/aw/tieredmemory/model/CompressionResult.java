package it.aw.tieredmemory.model;

/**
 * Risultato della compressione di un testo a un singolo livello.
 * compressionRatio = compressedSize / originalSize (0 per testo vuoto).
 */
public record CompressionResult(
        Tier   tier,
        String content,
        int    originalSize,
        int    compressedSize,
        double compressionRatio
) {
    public static CompressionResult of(Tier tier, String content, int originalSize) {
        double ratio = originalSize > 0 ? (double) content.length() / originalSize : 0.0;
        return new CompressionResult(tier, content, originalSize, content.length(), ratio);
    }
}
