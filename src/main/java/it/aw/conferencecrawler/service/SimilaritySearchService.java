package it.aw.conferencecrawler.service;

import it.aw.conferencecrawler.model.Chunk;
import it.aw.conferencecrawler.model.ChunkFilter;
import it.aw.conferencecrawler.model.ScoredChunk;
import it.aw.conferencecrawler.store.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ricerca top-K per similarità coseno sugli embedding del chunk store.
 * <p>
 * Il ranking è delegato a DuckDB: il filtro restringe i candidati, a parità di
 * punteggio l'ordine è {@code (url, chunk_number)} crescente, così due chiamate
 * identiche restituiscono sempre la stessa sequenza. I chunk con embedding nullo
 * hanno punteggio 0.
 */
@Service
public class SimilaritySearchService {

    private static final Logger log = LoggerFactory.getLogger(SimilaritySearchService.class);

    private final ChunkStore store;

    public SimilaritySearchService(ChunkStore store) {
        this.store = store;
    }

    /**
     * @return al più {@code topK} chunk, il più simile per primo; lista vuota se
     *         nessun chunk soddisfa il filtro
     */
    public List<Chunk> search(float[] queryEmbedding, int topK, ChunkFilter filter) {
        return searchScored(queryEmbedding, topK, filter).stream()
                .map(ScoredChunk::chunk)
                .collect(Collectors.toList());
    }

    public List<ScoredChunk> searchScored(float[] queryEmbedding, int topK, ChunkFilter filter) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK deve essere > 0 (ricevuto: " + topK + ")");
        }
        if (queryEmbedding == null) {
            throw new IllegalArgumentException("embedding della query mancante");
        }
        List<ScoredChunk> result = store.searchSimilar(queryEmbedding, topK, filter);
        log.debug("Ricerca su {}: {} risultati (topK={})", filter.source(), result.size(), topK);
        return result;
    }
}
