package it.aw.conferencecrawler.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.conferencecrawler.model.Chunk;
import it.aw.conferencecrawler.model.ChunkFilter;
import it.aw.conferencecrawler.model.ScoredChunk;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Archivio dei chunk, persistito nella tabella {@code site_pages} di un file DuckDB.
 * <p>
 * La chiave primaria è {@code (url, chunk_number)}: {@link #upsert(Chunk)} sovrascrive
 * il chunk esistente (last writer wins, nessun versioning). I metadati sono
 * serializzati in JSON; {@code source} è copiato dai metadati in una colonna
 * dedicata per filtrare con una semplice uguaglianza. L'embedding è una colonna
 * {@code FLOAT[]}: il ranking per similarità coseno avviene in DuckDB
 * ({@code list_cosine_similarity}), non in memoria.
 * <p>
 * Un'unica connessione JDBC è condivisa da tutte le operazioni; l'accesso
 * è sincronizzato perché DuckDBConnection non è thread-safe. Gli errori SQL
 * vengono propagati al chiamante come {@link RuntimeException}.
 */
@Component
public class ChunkStore {

    private static final Logger log = LoggerFactory.getLogger(ChunkStore.class);

    public static final String IN_MEMORY = ":memory:";

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS site_pages (
                url           VARCHAR   NOT NULL,
                chunk_number  INTEGER   NOT NULL,
                title         VARCHAR   NOT NULL,
                summary       VARCHAR   NOT NULL,
                content       VARCHAR   NOT NULL,
                source        VARCHAR   NOT NULL,
                metadata      VARCHAR   NOT NULL,
                embedding     FLOAT[]   NOT NULL,
                created_at    TIMESTAMP NOT NULL,
                PRIMARY KEY (url, chunk_number)
            )
            """;

    private static final String UPSERT = """
            INSERT INTO site_pages
                (url, chunk_number, title, summary, content, source, metadata, embedding, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, CAST(? AS FLOAT[]), ?)
            ON CONFLICT (url, chunk_number) DO UPDATE SET
                title      = EXCLUDED.title,
                summary    = EXCLUDED.summary,
                content    = EXCLUDED.content,
                source     = EXCLUDED.source,
                metadata   = EXCLUDED.metadata,
                embedding  = EXCLUDED.embedding,
                created_at = EXCLUDED.created_at
            """;

    private static final String COLUMNS =
            "url, chunk_number, title, summary, content, metadata, CAST(embedding AS VARCHAR) AS embedding_json";

    /*
     * Vettori di lunghezza diversa o di norma zero (embedding falliti) valgono 0.
     * A parità di punteggio l'ordine è (url, chunk_number).
     */
    private static final String SIMILARITY_SEARCH = "SELECT " + COLUMNS + """
            ,
                CASE WHEN ? AND len(embedding) = ? AND list_inner_product(embedding, embedding) > 0
                     THEN CAST(list_cosine_similarity(embedding, CAST(? AS FLOAT[])) AS DOUBLE)
                     ELSE CAST(0 AS DOUBLE)
                END AS score
            FROM site_pages
            WHERE source = ?
            ORDER BY score DESC, url, chunk_number
            LIMIT ?
            """;

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final String dbPath;
    private Connection conn;

    public ChunkStore(ObjectMapper objectMapper,
                      @Value("${store.duckdb.path:./data/conferences.duckdb}") String dbPath) {
        this.objectMapper = objectMapper;
        this.dbPath = dbPath;
    }

    @PostConstruct
    public void init() throws SQLException, IOException {
        String url;
        if (IN_MEMORY.equals(dbPath)) {
            url = "jdbc:duckdb:";
        } else {
            Path path = Paths.get(dbPath).toAbsolutePath();
            Files.createDirectories(path.getParent());
            url = "jdbc:duckdb:" + path;
        }
        conn = DriverManager.getConnection(url);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE);
        }
        log.info("ChunkStore: tabella 'site_pages' pronta su {}", dbPath);
    }

    @PreDestroy
    public void close() {
        try {
            if (conn != null && !conn.isClosed()) conn.close();
        } catch (SQLException e) {
            log.warn("Errore chiusura connessione DuckDB: {}", e.getMessage());
        }
    }

    /** Inserisce o sovrascrive il chunk identificato da {@code (url, chunkNumber)}. */
    public synchronized void upsert(Chunk chunk) {
        String source = chunk.source();
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("metadata.source mancante per " + chunk.url()
                    + "#" + chunk.chunkNumber());
        }
        try (PreparedStatement ps = conn.prepareStatement(UPSERT)) {
            ps.setString(1, chunk.url());
            ps.setInt(2, chunk.chunkNumber());
            ps.setString(3, chunk.title());
            ps.setString(4, chunk.summary());
            ps.setString(5, chunk.content());
            ps.setString(6, source);
            ps.setString(7, objectMapper.writeValueAsString(chunk.metadata()));
            ps.setString(8, objectMapper.writeValueAsString(chunk.embedding()));
            ps.setTimestamp(9, Timestamp.from(Instant.now()));
            ps.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            throw new RuntimeException("Errore salvataggio chunk " + chunk.url() + "#" + chunk.chunkNumber(), e);
        }
    }

    /** URL distinte del dataset, in ordine lessicografico. */
    public synchronized Set<String> listDistinctUrls(ChunkFilter filter) {
        Set<String> urls = new LinkedHashSet<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT DISTINCT url FROM site_pages WHERE source = ? ORDER BY url")) {
            ps.setString(1, filter.source());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) urls.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Errore lettura URL distinte", e);
        }
        return urls;
    }

    /** Tutti i chunk di una URL ordinati per {@code chunk_number}. */
    public synchronized List<Chunk> getOrderedChunks(String url, ChunkFilter filter) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT " + COLUMNS + " FROM site_pages WHERE url = ? AND source = ? ORDER BY chunk_number")) {
            ps.setString(1, url);
            ps.setString(2, filter.source());
            return readChunks(ps);
        } catch (SQLException | IOException e) {
            throw new RuntimeException("Errore lettura chunk di " + url, e);
        }
    }

    /**
     * I {@code topK} chunk del dataset più simili a {@code query}, il più simile per primo.
     * Con una query di norma zero tutti i punteggi valgono 0.
     */
    public synchronized List<ScoredChunk> searchSimilar(float[] query, int topK, ChunkFilter filter) {
        try (PreparedStatement ps = conn.prepareStatement(SIMILARITY_SEARCH)) {
            ps.setBoolean(1, hasNorm(query));
            ps.setInt(2, query.length);
            ps.setString(3, objectMapper.writeValueAsString(query));
            ps.setString(4, filter.source());
            ps.setInt(5, topK);
            List<ScoredChunk> result = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) result.add(new ScoredChunk(toChunk(rs), rs.getDouble("score")));
            }
            return result;
        } catch (SQLException | IOException e) {
            throw new RuntimeException("Errore ricerca per similarità sul dataset " + filter.source(), e);
        }
    }

    /**
     * Rimuove esplicitamente tutti i chunk di una URL.
     *
     * @return numero di chunk cancellati
     */
    public synchronized int deleteByUrl(String url, ChunkFilter filter) {
        try (PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM site_pages WHERE url = ? AND source = ?")) {
            ps.setString(1, url);
            ps.setString(2, filter.source());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Errore rimozione chunk di " + url, e);
        }
    }

    public synchronized int countChunks(ChunkFilter filter) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT COUNT(*) FROM site_pages WHERE source = ?")) {
            ps.setString(1, filter.source());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Errore conteggio chunk", e);
        }
    }

    private List<Chunk> readChunks(PreparedStatement ps) throws SQLException, IOException {
        List<Chunk> result = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) result.add(toChunk(rs));
        }
        return result;
    }

    private Chunk toChunk(ResultSet rs) throws SQLException, IOException {
        return new Chunk(
                rs.getString("url"),
                rs.getInt("chunk_number"),
                rs.getString("title"),
                rs.getString("summary"),
                rs.getString("content"),
                objectMapper.readValue(rs.getString("metadata"), METADATA_TYPE),
                objectMapper.readValue(rs.getString("embedding_json"), float[].class)
        );
    }

    private static boolean hasNorm(float[] v) {
        for (float f : v) {
            if (f != 0f) return true;
        }
        return false;
    }
}
