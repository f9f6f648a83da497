package it.aw.conferencecrawler.service;

import it.aw.conferencecrawler.model.Chunk;
import it.aw.conferencecrawler.model.ChunkFilter;
import it.aw.conferencecrawler.store.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Operazioni di lettura usate dall'agente conversazionale: ricerca semantica,
 * elenco delle pagine ingestite e ricostruzione di una pagina dai suoi chunk.
 * <p>
 * Tutti i metodi restituiscono testo semplice e non propagano eccezioni: risultati
 * vuoti e URL sconosciute producono stringhe sentinella dedicate.
 */
@Service
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    public static final String NO_RESULTS = "No relevant documentation found.";
    public static final String NOT_FOUND_PREFIX = "No content found for URL: ";
    public static final String SEARCH_ERROR_PREFIX = "Error retrieving documentation: ";
    static final String QUERY_EMBEDDING_UNAVAILABLE = "query embedding unavailable";
    static final String SECTION_SEPARATOR = "\n\n---\n\n";
    static final String TITLE_SEPARATOR = " - ";

    private final ChunkEnricher enricher;
    private final SimilaritySearchService similaritySearch;
    private final ChunkStore store;
    private final ChunkFilter filter;
    private final int topK;

    public RetrievalService(ChunkEnricher enricher,
                            SimilaritySearchService similaritySearch,
                            ChunkStore store,
                            @Value("${crawler.source:sigchi__conference_events}") String source,
                            @Value("${retrieval.top-k:100}") int topK) {
        this.enricher = enricher;
        this.similaritySearch = similaritySearch;
        this.store = store;
        this.filter = ChunkFilter.source(source);
        this.topK = topK;
    }

    /**
     * Embedding della query, top-K chunk più simili del dataset, concatenati
     * come sezioni "# titolo + contenuto" separate da {@code ---}.
     */
    public String searchDocumentation(String query) {
        try {
            float[] queryEmbedding = enricher.embed(query);
            if (isZero(queryEmbedding)) {
                // embedding fallito: con tutti i punteggi a 0 il ranking sarebbe solo per URL
                log.warn("Embedding della query non disponibile, ricerca annullata: '{}'", query);
                return SEARCH_ERROR_PREFIX + QUERY_EMBEDDING_UNAVAILABLE;
            }
            List<Chunk> results = similaritySearch.search(queryEmbedding, topK, filter);
            if (results.isEmpty()) {
                return NO_RESULTS;
            }
            List<String> sections = new ArrayList<>(results.size());
            for (Chunk c : results) {
                sections.add("# " + c.title() + "\n\n" + c.content());
            }
            return String.join(SECTION_SEPARATOR, sections);
        } catch (Exception e) {
            log.error("Errore nella ricerca per '{}'", query, e);
            return SEARCH_ERROR_PREFIX + e.getMessage();
        }
    }

    /** URL distinte del dataset in ordine lessicografico; lista vuota in caso di errore. */
    public List<String> listPages() {
        try {
            return new ArrayList<>(store.listDistinctUrls(filter));
        } catch (Exception e) {
            log.error("Errore nella lettura delle pagine", e);
            return List.of();
        }
    }

    /**
     * Ricostruisce la pagina: titolo dal primo chunk (testo prima di " - ")
     * e contenuti dei chunk in ordine di {@code chunk_number}.
     */
    public String getPage(String url) {
        try {
            List<Chunk> chunks = store.getOrderedChunks(url, filter);
            if (chunks.isEmpty()) {
                return NOT_FOUND_PREFIX + url;
            }
            String title = chunks.get(0).title();
            int sep = title.indexOf(TITLE_SEPARATOR);
            String pageTitle = sep >= 0 ? title.substring(0, sep) : title;

            List<String> parts = new ArrayList<>(chunks.size() + 1);
            parts.add("# " + pageTitle + "\n");
            for (Chunk c : chunks) {
                parts.add(c.content());
            }
            return String.join("\n\n", parts);
        } catch (Exception e) {
            log.error("Errore nella lettura della pagina {}", url, e);
            return "Error retrieving page content: " + e.getMessage();
        }
    }

    private static boolean isZero(float[] v) {
        for (float f : v) {
            if (f != 0f) return false;
        }
        return true;
    }

    public ChunkFilter filter() {
        return filter;
    }
}
