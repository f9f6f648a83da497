package it.aw.conferencecrawler.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Unità di storage e di retrieval: un frammento di pagina arricchito.
 * <p>
 * La coppia {@code (url, chunkNumber)} identifica il chunk in modo univoco:
 * una nuova ingestione della stessa URL sovrascrive i chunk con lo stesso numero.
 * L'embedding ha sempre la dimensione configurata; se il calcolo fallisce
 * contiene un vettore di zeri.
 * <p>
 * {@code equals} e {@code hashCode} confrontano l'embedding per contenuto.
 */
public record Chunk(
        String              url,
        int                 chunkNumber,   // ordinale 0-based nella pagina
        String              title,
        String              summary,
        String              content,       // testo grezzo del frammento
        Map<String, Object> metadata,      // contiene sempre "source" e "crawled_at"
        float[]             embedding
) {

    public static final String SOURCE_KEY = "source";

    /** Valore di {@code metadata.source}, null se assente. */
    public String source() {
        Object source = metadata != null ? metadata.get(SOURCE_KEY) : null;
        return source != null ? source.toString() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Chunk other = (Chunk) o;
        return chunkNumber == other.chunkNumber
                && Objects.equals(url, other.url)
                && Objects.equals(title, other.title)
                && Objects.equals(summary, other.summary)
                && Objects.equals(content, other.content)
                && Objects.equals(metadata, other.metadata)
                && Arrays.equals(embedding, other.embedding);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(url, chunkNumber, title, summary, content, metadata)
                + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "Chunk[url=" + url + ", chunkNumber=" + chunkNumber + ", title=" + title
                + ", embedding=" + (embedding != null ? embedding.length + " dims" : "null") + "]";
    }
}
