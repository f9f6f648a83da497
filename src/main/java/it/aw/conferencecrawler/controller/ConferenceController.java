package it.aw.conferencecrawler.controller;

import it.aw.conferencecrawler.model.IngestRequest;
import it.aw.conferencecrawler.model.IngestionReport;
import it.aw.conferencecrawler.model.StoreStats;
import it.aw.conferencecrawler.service.ChunkEnricher;
import it.aw.conferencecrawler.service.IngestionService;
import it.aw.conferencecrawler.service.RetrievalService;
import it.aw.conferencecrawler.store.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Espone ingestione, ricerca e lettura delle pagine di conferenze.
 *
 * Endpoint disponibili:
 *   POST   /api/conferences/ingest        : scarica e indicizza le URL indicate
 *   GET    /api/conferences/search?q=     : ricerca semantica (testo)
 *   GET    /api/conferences/pages         : URL ingestite, ordinate
 *   GET    /api/conferences/page?url=     : pagina ricostruita dai chunk (testo)
 *   DELETE /api/conferences/page?url=     : rimuove i chunk di una URL
 *   GET    /api/conferences/stats         : statistiche del chunk store
 *
 * La URL della pagina viaggia come query param e non come path variable
 * perché contiene slash.
 */
@RestController
@RequestMapping("/api/conferences")
public class ConferenceController {

    private static final Logger log = LoggerFactory.getLogger(ConferenceController.class);

    private final IngestionService ingestionService;
    private final RetrievalService retrievalService;
    private final ChunkStore store;
    private final ChunkEnricher enricher;

    @Value("${crawler.event-urls:}")
    private List<String> defaultUrls;

    @Value("${crawler.max-concurrent-fetches:5}")
    private int defaultMaxConcurrent;

    @Value("${inference.embedding.provider:openai}")
    private String embeddingProvider;

    public ConferenceController(IngestionService ingestionService,
                                RetrievalService retrievalService,
                                ChunkStore store,
                                ChunkEnricher enricher) {
        this.ingestionService = ingestionService;
        this.retrievalService = retrievalService;
        this.store = store;
        this.enricher = enricher;
    }

    // -------------------------------------------------------------------------
    // POST /api/conferences/ingest
    // -------------------------------------------------------------------------

    /**
     * Ingestisce le URL indicate; senza body usa crawler.event-urls.
     *
     * Esempio:
     *   curl -X POST http://localhost:8889/api/conferences/ingest \
     *        -H "Content-Type: application/json" \
     *        -d '{"urls": ["https://tei.acm.org/2025/"], "maxConcurrent": 3}'
     */
    @PostMapping("/ingest")
    public ResponseEntity<IngestionReport> ingest(@RequestBody(required = false) IngestRequest request) {
        List<String> urls = request != null && request.urls() != null && !request.urls().isEmpty()
                ? request.urls()
                : defaultUrls;
        int maxConcurrent = request != null && request.maxConcurrent() != null
                ? request.maxConcurrent()
                : defaultMaxConcurrent;
        try {
            return ResponseEntity.ok(ingestionService.ingest(sanitize(urls), maxConcurrent));
        } catch (IllegalArgumentException e) {
            log.warn("Richiesta di ingestione non valida: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }
    }

    // -------------------------------------------------------------------------
    // GET /api/conferences/search?q=...
    // -------------------------------------------------------------------------

    @GetMapping(value = "/search", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> search(@RequestParam("q") String query) {
        if (query.isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(retrievalService.searchDocumentation(query));
    }

    // -------------------------------------------------------------------------
    // GET /api/conferences/pages
    // -------------------------------------------------------------------------

    @GetMapping("/pages")
    public ResponseEntity<List<String>> listPages() {
        return ResponseEntity.ok(retrievalService.listPages());
    }

    // -------------------------------------------------------------------------
    // GET /api/conferences/page?url=...
    // -------------------------------------------------------------------------

    @GetMapping(value = "/page", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> getPage(@RequestParam("url") String url) {
        return ResponseEntity.ok(retrievalService.getPage(url));
    }

    // -------------------------------------------------------------------------
    // DELETE /api/conferences/page?url=...
    // -------------------------------------------------------------------------

    /**
     * Unica via di cancellazione: i chunk di URL non più elencate restano
     * nello store finché non vengono rimossi qui.
     */
    @DeleteMapping("/page")
    public ResponseEntity<Void> deletePage(@RequestParam("url") String url) {
        int removed = store.deleteByUrl(url, retrievalService.filter());
        log.info("Rimossi {} chunk per {}", removed, url);
        return removed > 0 ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    // -------------------------------------------------------------------------
    // GET /api/conferences/stats
    // -------------------------------------------------------------------------

    @GetMapping("/stats")
    public ResponseEntity<StoreStats> stats() {
        StoreStats stats = new StoreStats(
                store.listDistinctUrls(retrievalService.filter()).size(),
                store.countChunks(retrievalService.filter()),
                "DuckDB",
                embeddingProvider,
                enricher.dimension()
        );
        return ResponseEntity.ok(stats);
    }

    private static List<String> sanitize(List<String> urls) {
        if (urls == null) return List.of();
        return urls.stream()
                .filter(u -> u != null && !u.isBlank())
                .map(String::strip)
                .toList();
    }
}
