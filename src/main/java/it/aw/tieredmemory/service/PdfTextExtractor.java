package it.aw.tieredmemory.service;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Estrae il layer testuale di un PDF via PDFBox, pagina per pagina.
 * <p>
 * Le pagine sono separate da una riga vuota, così il fallback a paragrafi del
 * livello 1 non fonde mai la fine di una pagina con l'inizio della successiva.
 */
public class PdfTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfTextExtractor.class);

    private PdfTextExtractor() {}

    /** Testo estratto e numero di pagine del documento. */
    public record PdfText(String text, int pages) {}

    /**
     * Esegue l'estrazione dall'input stream.
     * L'input stream NON viene chiuso dal metodo: la responsabilità è del chiamante.
     */
    public static PdfText extract(InputStream inputStream) throws IOException {
        try (PDDocument doc = PDDocument.load(inputStream)) {
            int totalPages = doc.getNumberOfPages();
            log.debug("PdfTextExtractor: {} pagine trovate", totalPages);

            PDFTextStripper stripper = new PDFTextStripper();
            StringBuilder sb = new StringBuilder();
            for (int p = 1; p <= totalPages; p++) {
                stripper.setStartPage(p);
                stripper.setEndPage(p);
                String page = stripper.getText(doc).strip();
                if (page.isEmpty()) continue;
                if (sb.length() > 0) sb.append("\n\n");
                sb.append(page);
            }
            return new PdfText(sb.toString(), totalPages);
        }
    }

    public static boolean isPdf(String filename, String contentType) {
        return "application/pdf".equals(contentType)
                || (filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".pdf"));
    }
}
