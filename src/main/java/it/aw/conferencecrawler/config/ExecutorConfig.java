package it.aw.conferencecrawler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool di thread per l'ingestione.
 * <p>
 * pageExecutor:  solo i fetch. IngestionService acquisisce il permesso del semaforo
 *                prima di sottomettere, quindi i thread vivi restano nell'ordine
 *                di maxConcurrentFetches anche con migliaia di URL.
 * chunkExecutor: enrichment + upsert dei chunk, separato perché le chiamate di
 *                inferenza non occupino i thread dei fetch.
 * Entrambi sono cached pool: il lavoro è I/O-bound (rete, inferenza, DuckDB).
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "pageExecutor", destroyMethod = "shutdown")
    public ExecutorService pageExecutor() {
        return Executors.newCachedThreadPool(namedDaemon("ingest-page-"));
    }

    @Bean(name = "chunkExecutor", destroyMethod = "shutdown")
    public ExecutorService chunkExecutor() {
        return Executors.newCachedThreadPool(namedDaemon("ingest-chunk-"));
    }

    static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
