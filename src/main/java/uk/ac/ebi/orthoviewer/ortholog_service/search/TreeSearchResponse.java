package uk.ac.ebi.orthoviewer.ortholog_service.search;

import java.util.List;

/** Envelope returned by the tree search endpoint. */
public record TreeSearchResponse(
    boolean success,
    String query,
    String searchType,
    List<SearchResult> results,
    int totalResults,
    String message) {

  public static TreeSearchResponse of(SearchKind kind, String query, List<SearchResult> results) {
    return new TreeSearchResponse(
        true,
        query,
        kind.getValue(),
        results,
        results.size(),
        "Found " + results.size() + " results");
  }
}
