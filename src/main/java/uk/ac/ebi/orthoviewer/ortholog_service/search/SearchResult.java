package uk.ac.ebi.orthoviewer.ortholog_service.search;

import java.util.List;

/**
 * One matching node of a tree search.
 *
 * @param nodeName display name: a species name, or a description of an internal node
 * @param nodeType {@code leaf} or {@code internal}
 * @param distanceToRoot sum of branch lengths from the root to the node
 * @param supportValue support of an internal node, or null
 * @param speciesCount number of leaves under the node
 * @param geneCount gene count attributed to the node
 * @param cladeMembers full names of (some of) the leaves under the node
 */
public record SearchResult(
    String nodeName,
    String nodeType,
    double distanceToRoot,
    Double supportValue,
    int speciesCount,
    int geneCount,
    List<String> cladeMembers) {

  public SearchResult {
    cladeMembers = List.copyOf(cladeMembers);
  }
}
