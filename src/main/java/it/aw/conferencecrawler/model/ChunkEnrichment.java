package it.aw.conferencecrawler.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Output dell'arricchimento di un chunk: titolo, summary ed embedding.
 * Può contenere valori di fallback se le chiamate di inferenza sono fallite.
 */
public record ChunkEnrichment(String title, String summary, float[] embedding) {

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChunkEnrichment other = (ChunkEnrichment) o;
        return Objects.equals(title, other.title)
                && Objects.equals(summary, other.summary)
                && Arrays.equals(embedding, other.embedding);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(title, summary) + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "ChunkEnrichment[title=" + title + ", summary=" + summary
                + ", embedding=" + Arrays.toString(embedding) + "]";
    }
}
