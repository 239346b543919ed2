package com.dapapers.ingest_service.enrich;

/**
 * arXiv paper whose citation count is still 0.
 *
 * @param documentId index document id, the update key
 * @param arxivId normalized arXiv id, the lookup key
 */
public record UnenrichedPaper(String documentId, String arxivId) {}
