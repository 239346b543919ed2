package com.dapapers.ingest_service.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.miscellaneous.ASCIIFoldingFilter;
import org.apache.lucene.analysis.snowball.SnowballFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.springframework.stereotype.Component;
import org.tartarus.snowball.ext.EnglishStemmer;

/**
 * Analyzer for free text of papers (title, abstract, TL;DR, venue text).
 *
 * <p>Pipeline: {@link StandardTokenizer}, {@link ASCIIFoldingFilter}, {@link LowerCaseFilter},
 * English {@link StopFilter}, Snowball English stemming.
 */
@Component
public final class PaperTextAnalyzer extends Analyzer {

  @Override
  protected TokenStreamComponents createComponents(String fieldName) {
    Tokenizer source = new StandardTokenizer();
    TokenStream filter = new ASCIIFoldingFilter(source);
    filter = new LowerCaseFilter(filter);
    filter = new StopFilter(filter, EnglishAnalyzer.ENGLISH_STOP_WORDS_SET);
    filter = new SnowballFilter(filter, new EnglishStemmer());
    return new TokenStreamComponents(source, filter);
  }

  @Override
  protected TokenStream normalize(String fieldName, TokenStream in) {
    return new LowerCaseFilter(new ASCIIFoldingFilter(in));
  }
}
