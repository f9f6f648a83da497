package it.aw.conferencecrawler.model;

/** Chunk restituito dalla ricerca insieme al suo punteggio di similarità coseno. */
public record ScoredChunk(Chunk chunk, double score) {}
