package com.dapapers.ingest_service.analysis;

import com.dapapers.ingest_service.index.PaperFields;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.core.KeywordAnalyzer;
import org.apache.lucene.analysis.miscellaneous.PerFieldAnalyzerWrapper;
import org.springframework.stereotype.Component;

/**
 * Provides the {@link PerFieldAnalyzerWrapper} used by the paper index writer. Text fields get
 * {@link PaperTextAnalyzer}, author names {@link AuthorNameAnalyzer}; everything else is indexed as
 * a single keyword.
 */
@Slf4j
@Getter
@Component
public class AnalyzerManager {

  private final PerFieldAnalyzerWrapper perFieldAnalyzerWrapper;

  public AnalyzerManager(PaperTextAnalyzer textAnalyzer, AuthorNameAnalyzer authorNameAnalyzer) {
    Map<String, Analyzer> fieldAnalyzers =
        Map.of(
            PaperFields.TITLE, textAnalyzer,
            PaperFields.ABSTRACT, textAnalyzer,
            PaperFields.TLDR, textAnalyzer,
            PaperFields.VENUE_TEXT, textAnalyzer,
            PaperFields.JOURNAL, textAnalyzer,
            PaperFields.AUTHOR_NAMES, authorNameAnalyzer);
    this.perFieldAnalyzerWrapper = new PerFieldAnalyzerWrapper(new KeywordAnalyzer(), fieldAnalyzers);
    log.debug("{} fields with explicit analyzers", fieldAnalyzers.size());
  }
}
