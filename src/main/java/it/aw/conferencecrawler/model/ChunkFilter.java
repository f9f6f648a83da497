package it.aw.conferencecrawler.model;

/**
 * Filtro di uguaglianza sui metadati dei chunk.
 * Oggi contiene solo {@code source}: i campi aggiuntivi vanno in AND.
 */
public record ChunkFilter(String source) {

    public ChunkFilter {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Il filtro richiede un source non vuoto");
        }
    }

    public static ChunkFilter source(String source) {
        return new ChunkFilter(source);
    }
}
