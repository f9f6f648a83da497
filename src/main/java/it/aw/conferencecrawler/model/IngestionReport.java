package it.aw.conferencecrawler.model;

import java.util.List;
import java.util.Map;

/**
 * Resoconto aggregato di un'ingestione.
 * <p>
 * Una URL è "succeeded" se la pagina è stata scaricata e processata, anche quando
 * alcuni dei suoi chunk non sono stati salvati (vedi {@code chunksFailed}).
 */
public record IngestionReport(
        int                 requested,
        List<String>        succeededUrls,
        Map<String, String> failedUrls,    // url -> messaggio d'errore
        int                 chunksStored,
        int                 chunksFailed
) {
    public int succeeded() {
        return succeededUrls.size();
    }

    public int failed() {
        return failedUrls.size();
    }
}
