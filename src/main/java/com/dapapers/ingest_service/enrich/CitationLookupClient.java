package com.dapapers.ingest_service.enrich;

import com.dapapers.ingest_service.client.ApiFetchException;
import java.util.List;
import java.util.Map;

/** Fetches citation counts of arXiv papers from an external registry. */
public interface CitationLookupClient {

  /** Largest number of ids accepted by one {@link #lookup} call. */
  int MAX_IDS = 50;

  /**
   * @param arxivIds normalized arXiv ids, at most {@link #MAX_IDS}
   * @return citation count per arXiv id; ids the registry does not know are absent
   */
  Map<String, Integer> lookup(List<String> arxivIds) throws ApiFetchException;
}
