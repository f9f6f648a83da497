package it.aw.conferencecrawler.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.conferencecrawler.model.Chunk;
import it.aw.conferencecrawler.model.ChunkFilter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChunkStoreTest {

    private static final String SOURCE = "sigchi__conference_events";
    private static final ChunkFilter FILTER = ChunkFilter.source(SOURCE);

    private ChunkStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = new ChunkStore(new ObjectMapper(), ChunkStore.IN_MEMORY);
        store.init();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    static Chunk chunk(String url, int n, String content, String source) {
        return new Chunk(url, n, "Title " + n, "Summary " + n, content,
                Map.of("source", source, "crawled_at", "2025-01-01T00:00:00Z"),
                new float[]{n, 1f, 0.5f});
    }

    @Test
    @DisplayName("Chunks written out of order are read back ordered by chunk number")
    void orderedRead() {
        store.upsert(chunk("https://tei.acm.org/2025/", 2, "third", SOURCE));
        store.upsert(chunk("https://tei.acm.org/2025/", 0, "first", SOURCE));
        store.upsert(chunk("https://tei.acm.org/2025/", 1, "second", SOURCE));

        List<Chunk> chunks = store.getOrderedChunks("https://tei.acm.org/2025/", FILTER);

        assertEquals(List.of(0, 1, 2), chunks.stream().map(Chunk::chunkNumber).toList());
        assertEquals(List.of("first", "second", "third"), chunks.stream().map(Chunk::content).toList());
    }

    @Test
    @DisplayName("Upsert on an existing (url, chunk_number) overwrites in place")
    void upsertIsIdempotent() {
        String url = "https://chi2025.acm.org/";
        for (int i = 0; i < 3; i++) store.upsert(chunk(url, i, "v1-" + i, SOURCE));
        for (int i = 0; i < 3; i++) store.upsert(chunk(url, i, "v2-" + i, SOURCE));

        List<Chunk> chunks = store.getOrderedChunks(url, FILTER);
        assertEquals(3, chunks.size());
        assertEquals(3, store.countChunks(FILTER));
        assertEquals("v2-0", chunks.get(0).content());
    }

    @Test
    @DisplayName("Metadata and embedding survive storage")
    void roundTripsMetadataAndEmbedding() {
        store.upsert(chunk("https://a.org", 0, "c", SOURCE));

        Chunk read = store.getOrderedChunks("https://a.org", FILTER).get(0);
        assertEquals(SOURCE, read.source());
        assertEquals("2025-01-01T00:00:00Z", read.metadata().get("crawled_at"));
        assertArrayEquals(new float[]{0f, 1f, 0.5f}, read.embedding());
        assertEquals("Title 0", read.title());
        assertEquals("Summary 0", read.summary());
    }

    @Test
    @DisplayName("Distinct URLs are sorted, deduplicated and scoped by source")
    void distinctUrls() {
        store.upsert(chunk("https://b.org", 0, "x", SOURCE));
        store.upsert(chunk("https://b.org", 1, "y", SOURCE));
        store.upsert(chunk("https://a.org", 0, "z", SOURCE));
        store.upsert(chunk("https://c.org", 0, "w", "other_dataset"));

        Set<String> urls = store.listDistinctUrls(FILTER);

        assertEquals(List.of("https://a.org", "https://b.org"), List.copyOf(urls));
        assertEquals(List.of("https://c.org"), List.copyOf(store.listDistinctUrls(ChunkFilter.source("other_dataset"))));
    }

    @Test
    @DisplayName("Filter scopes ordered reads to one dataset")
    void filterScopesReads() {
        store.upsert(chunk("https://a.org", 0, "x", "other_dataset"));
        assertTrue(store.getOrderedChunks("https://a.org", FILTER).isEmpty());
        assertTrue(store.searchSimilar(new float[]{0f, 1f, 0.5f}, 10, FILTER).isEmpty());
    }

    @Test
    @DisplayName("Explicit purge removes every chunk of a URL")
    void deleteByUrl() {
        store.upsert(chunk("https://a.org", 0, "x", SOURCE));
        store.upsert(chunk("https://a.org", 1, "y", SOURCE));
        store.upsert(chunk("https://b.org", 0, "z", SOURCE));

        assertEquals(2, store.deleteByUrl("https://a.org", FILTER));
        assertEquals(0, store.deleteByUrl("https://a.org", FILTER));
        assertEquals(List.of("https://b.org"), List.copyOf(store.listDistinctUrls(FILTER)));
    }

    @Test
    @DisplayName("A chunk without metadata.source is rejected")
    void requiresSource() {
        Chunk noSource = new Chunk("https://a.org", 0, "t", "s", "c", Map.of(), new float[]{1f});
        assertThrows(IllegalArgumentException.class, () -> store.upsert(noSource));
    }

    @Test
    void blankFilterIsAUsageError() {
        assertThrows(IllegalArgumentException.class, () -> ChunkFilter.source(" "));
        assertThrows(IllegalArgumentException.class, () -> ChunkFilter.source(null));
    }
}
