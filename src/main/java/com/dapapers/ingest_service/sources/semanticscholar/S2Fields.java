package com.dapapers.ingest_service.sources.semanticscholar;

/** {@code fields} parameter values of the Graph API. */
final class S2Fields {

  static final String SEARCH =
      "title,abstract,year,citationCount,referenceCount,influentialCitationCount,url,authors,"
          + "externalIds,openAccessPdf,publicationDate,corpusId,venue,journal,isOpenAccess,"
          + "s2FieldsOfStudy,publicationTypes";

  static final String ALL =
      "title,abstract,venue,year,referenceCount,citationCount,influentialCitationCount,"
          + "isOpenAccess,openAccessPdf,s2FieldsOfStudy,publicationTypes,publicationDate,journal,"
          + "authors,externalIds,url,corpusId,tldr";

  static final String API_KEY_HEADER = "x-api-key";

  private S2Fields() {}
}
