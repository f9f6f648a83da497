package it.aw.conferencecrawler.service;

import it.aw.conferencecrawler.model.Chunk;
import it.aw.conferencecrawler.model.ChunkEnrichment;
import it.aw.conferencecrawler.model.FetchResult;
import it.aw.conferencecrawler.model.IngestionReport;
import it.aw.conferencecrawler.store.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orchestra l'ingestione di un insieme di URL.
 * <p>
 * Pipeline per ogni URL:
 * <ol>
 *   <li>Fetch su {@code pageExecutor}: ammesso da un semaforo con
 *       {@code maxConcurrentFetches} permessi, acquisito prima della sottomissione
 *       e rilasciato appena il fetch termina</li>
 *   <li>Chunking: MarkdownChunker, sincrono; la numerazione 0..N-1 è fissata qui</li>
 *   <li>Enrichment + upsert: un task per chunk su {@code chunkExecutor}, senza limite
 *       di fan-out all'interno della pagina</li>
 * </ol>
 * Gli errori restano confinati nella loro unità: un chunk fallito non fa fallire
 * la pagina, una pagina fallita non fa fallire il batch. Al termine viene
 * restituito un {@link IngestionReport} aggregato.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final PageFetcher fetcher;
    private final ChunkEnricher enricher;
    private final ChunkStore store;
    private final ExecutorService pageExecutor;
    private final ExecutorService chunkExecutor;
    private final String source;
    private final int chunkSize;

    public IngestionService(PageFetcher fetcher,
                            ChunkEnricher enricher,
                            ChunkStore store,
                            @Qualifier("pageExecutor") ExecutorService pageExecutor,
                            @Qualifier("chunkExecutor") ExecutorService chunkExecutor,
                            @Value("${crawler.source:sigchi__conference_events}") String source,
                            @Value("${crawler.chunk-size:" + MarkdownChunker.DEFAULT_CHUNK_SIZE + "}") int chunkSize) {
        this.fetcher = fetcher;
        this.enricher = enricher;
        this.store = store;
        this.pageExecutor = pageExecutor;
        this.chunkExecutor = chunkExecutor;
        this.source = source;
        this.chunkSize = chunkSize;
    }

    /** Esito di una singola pagina. */
    record PageOutcome(String url, boolean fetched, String error, int stored, int failed) {}

    /**
     * Ingestisce le URL indicate e attende il completamento di tutte.
     *
     * @throws IllegalArgumentException se non ci sono URL o il limite di concorrenza non è positivo
     */
    public IngestionReport ingest(List<String> urls, int maxConcurrentFetches) {
        if (urls == null || urls.isEmpty()) {
            throw new IllegalArgumentException("Nessuna URL da ingestire");
        }
        if (maxConcurrentFetches <= 0) {
            throw new IllegalArgumentException(
                    "maxConcurrentFetches deve essere > 0 (ricevuto: " + maxConcurrentFetches + ")");
        }
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(urls));
        log.info("Inizio ingestione: {} URL, maxConcurrentFetches={}, source={}",
                distinct.size(), maxConcurrentFetches, source);

        Semaphore fetchGate = new Semaphore(maxConcurrentFetches, true);
        String crawledAt = Instant.now().toString();

        List<CompletableFuture<PageOutcome>> pages = new ArrayList<>(distinct.size());
        for (String url : distinct) {
            pages.add(submitPage(url, fetchGate, crawledAt));
        }
        CompletableFuture.allOf(pages.toArray(CompletableFuture[]::new)).join();

        List<String> succeeded = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        int stored = 0;
        int chunkFailures = 0;
        for (CompletableFuture<PageOutcome> f : pages) {
            PageOutcome o = f.join();
            if (o.fetched()) succeeded.add(o.url());
            else failed.put(o.url(), o.error());
            stored += o.stored();
            chunkFailures += o.failed();
        }

        IngestionReport report = new IngestionReport(distinct.size(), succeeded, failed, stored, chunkFailures);
        log.info("Ingestione completata: {} URL ok, {} URL fallite, {} chunk salvati, {} chunk falliti",
                report.succeeded(), report.failed(), stored, chunkFailures);
        return report;
    }

    /**
     * Il permesso viene acquisito dal thread chiamante prima di sottomettere il fetch:
     * su {@code pageExecutor} girano al più {@code maxConcurrentFetches} fetch e nessun
     * task resta parcheggiato in attesa del semaforo.
     */
    private CompletableFuture<PageOutcome> submitPage(String url, Semaphore fetchGate, String crawledAt) {
        try {
            fetchGate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletableFuture.completedFuture(
                    new PageOutcome(url, false, "interrotto in attesa del fetch", 0, 0));
        }
        CompletableFuture<FetchResult> fetched;
        try {
            fetched = CompletableFuture.supplyAsync(() -> fetchAndRelease(url, fetchGate), pageExecutor);
        } catch (RejectedExecutionException e) {
            fetchGate.release();
            return CompletableFuture.completedFuture(
                    new PageOutcome(url, false, "executor non disponibile", 0, 0));
        }
        return fetched
                .thenCompose(result -> {
                    if (!result.success()) {
                        log.warn("Fetch fallito: {} - {}", url, result.error());
                        return CompletableFuture.completedFuture(
                                new PageOutcome(url, false, result.error(), 0, 0));
                    }
                    log.info("Pagina scaricata: {}", url);
                    return processAndStore(url, result.markdown(), crawledAt);
                })
                .exceptionally(ex -> new PageOutcome(url, false, rootMessage(ex), 0, 0));
    }

    private FetchResult fetchAndRelease(String url, Semaphore fetchGate) {
        try {
            return fetcher.fetch(url);
        } finally {
            fetchGate.release();
        }
    }

    /**
     * Chunking sincrono seguito da enrichment + upsert in parallelo su tutti i chunk.
     * L'ordine di completamento è libero: l'ordine viene ricostruito in lettura
     * tramite {@code chunk_number}. Il future si completa quando tutti i chunk
     * sono stati salvati o scartati.
     */
    CompletableFuture<PageOutcome> processAndStore(String url, String markdown, String crawledAt) {
        List<String> chunks = MarkdownChunker.chunk(markdown, chunkSize);
        log.debug("{}: {} chunk", url, chunks.size());

        AtomicInteger stored = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        List<CompletableFuture<Void>> tasks = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            int chunkNumber = i;
            String content = chunks.get(i);
            tasks.add(CompletableFuture
                    .runAsync(() -> enrichAndStore(url, chunkNumber, content, crawledAt), chunkExecutor)
                    .handle((ok, ex) -> {
                        if (ex == null) {
                            stored.incrementAndGet();
                        } else {
                            failed.incrementAndGet();
                            log.error("Salvataggio chunk fallito: {}#{} - {}", url, chunkNumber, rootMessage(ex));
                        }
                        return null;
                    }));
        }
        return CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new))
                .thenApply(v -> new PageOutcome(url, true, null, stored.get(), failed.get()));
    }

    private void enrichAndStore(String url, int chunkNumber, String content, String crawledAt) {
        ChunkEnrichment enrichment = enricher.enrich(content, url);
        store.upsert(new Chunk(url, chunkNumber, enrichment.title(), enrichment.summary(), content,
                metadata(url, content, crawledAt), enrichment.embedding()));
    }

    private Map<String, Object> metadata(String url, String content, String crawledAt) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(Chunk.SOURCE_KEY, source);
        metadata.put("chunk_size", content.length());
        metadata.put("crawled_at", crawledAt);
        metadata.put("url_path", urlPath(url));
        return metadata;
    }

    static String urlPath(String url) {
        try {
            String path = URI.create(url).getPath();
            return path != null ? path : "";
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    private static String rootMessage(Throwable ex) {
        Throwable t = ex;
        while (t.getCause() != null && t.getCause() != t) t = t.getCause();
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    public String source() {
        return source;
    }
}
