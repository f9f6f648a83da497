package it.aw.conferencecrawler.model;

/**
 * Statistiche aggregate sul chunk store per il dataset configurato.
 */
public record StoreStats(
        int totalPages,
        int totalChunks,
        String storeType,
        String embeddingProvider,
        int embeddingDimension
) {}
