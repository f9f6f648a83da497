package it.aw.conferencecrawler.model;

import java.util.List;

/**
 * Body di POST /api/conferences/ingest. Entrambi i campi sono opzionali.
 */
public record IngestRequest(List<String> urls, Integer maxConcurrent) {}
