package uk.ac.ebi.orthoviewer.ortholog_service.search;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.ac.ebi.orthoviewer.ortholog_service.Constants;
import uk.ac.ebi.orthoviewer.ortholog_service.config.OrthoDataConfig;
import uk.ac.ebi.orthoviewer.ortholog_service.orthogroup.OrthogroupRepository;
import uk.ac.ebi.orthoviewer.ortholog_service.tree.BoundTree;
import uk.ac.ebi.orthoviewer.ortholog_service.tree.Clade;
import uk.ac.ebi.orthoviewer.ortholog_service.tree.PhyloNode;
import uk.ac.ebi.orthoviewer.ortholog_service.tree.PhylogeneticTree;
import uk.ac.ebi.orthoviewer.ortholog_service.tree.PhylogeneticTreeService;

/**
 * Structural queries over the bound species tree.
 *
 * <p>All searches are read-only and never throw for a non-null query; a query without matches
 * yields an empty list. A {@code maxResults} of 0 or less means no limit.
 */
@Slf4j
@Service
public class TreeSearchEngine {

  private static final Splitter SPECIES_LIST_SPLITTER =
      Splitter.on(Constants.SPECIES_LIST_SEPARATOR).trimResults().omitEmptyStrings();

  private final PhylogeneticTreeService treeService;
  private final OrthogroupRepository orthogroupRepository;
  private final OrthoDataConfig config;

  public TreeSearchEngine(
      PhylogeneticTreeService treeService,
      OrthogroupRepository orthogroupRepository,
      OrthoDataConfig config) {
    this.treeService = treeService;
    this.orthogroupRepository = orthogroupRepository;
    this.config = config;
  }

  /**
   * Runs a search of the given kind. For {@link SearchKind#COMMON_ANCESTOR} the query is a
   * comma-separated list of species.
   */
  public List<SearchResult> search(SearchKind kind, String query, int maxResults) {
    String q = query == null ? "" : query;
    List<SearchResult> results =
        switch (kind) {
          case GENE -> searchByGene(q, maxResults);
          case SPECIES -> searchBySpecies(q, maxResults);
          case CLADE -> searchByClade(q, maxResults);
          case COMMON_ANCESTOR -> findCommonAncestor(SPECIES_LIST_SPLITTER.splitToList(q));
        };
    log.debug("{} search '{}' returned {} results", kind.getValue(), q, results.size());
    return results;
  }

  /**
   * Finds the tree leaves of the species that have genes in the orthogroup of a gene.
   *
   * <p>One leaf result per species, in table column order, with the gene count of that species
   * within the orthogroup.
   */
  public List<SearchResult> searchByGene(String geneId, int maxResults) {
    Optional<String> orthogroup = orthogroupRepository.findGeneOrthogroup(geneId);
    if (orthogroup.isEmpty()) {
      return List.of();
    }
    BoundTree bound = treeService.getBoundTree();
    Map<String, List<String>> genes = orthogroupRepository.getOrthogroupGenes(orthogroup.get());

    List<SearchResult> results = new ArrayList<>();
    for (Map.Entry<String, List<String>> entry : genes.entrySet()) {
      if (limitReached(results, maxResults)) {
        break;
      }
      bound
          .findLeaf(entry.getKey())
          .ifPresent(leaf -> results.add(leafResult(bound, leaf, entry.getValue().size())));
    }
    return results;
  }

  /**
   * Finds leaves whose code, full name or any word of the full name contains the query, ignoring
   * case. Results follow pre-order. An empty query matches every leaf.
   */
  public List<SearchResult> searchBySpecies(String query, int maxResults) {
    BoundTree bound = treeService.getBoundTree();
    String needle = query.toLowerCase(Locale.ROOT);

    List<SearchResult> results = new ArrayList<>();
    for (int leaf : bound.getTree().leafIndexes()) {
      if (limitReached(results, maxResults)) {
        break;
      }
      if (speciesMatches(bound.codeOf(leaf), bound.fullNameOf(leaf), needle)) {
        results.add(leafResult(bound, leaf, bound.genomeGeneCountOf(leaf)));
      }
    }
    return results;
  }

  private static boolean speciesMatches(String code, String fullName, String needle) {
    if (code.toLowerCase(Locale.ROOT).contains(needle)
        || fullName.toLowerCase(Locale.ROOT).contains(needle)) {
      return true;
    }
    for (String word : fullName.split("\\s+")) {
      if (word.toLowerCase(Locale.ROOT).contains(needle)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Finds internal nodes whose descendant species names, joined with spaces, contain the query
   * ignoring case. Nodes are visited in level order, so a limit keeps the clades nearest the
   * root. The member list of each result is truncated; its species count is not.
   */
  public List<SearchResult> searchByClade(String query, int maxResults) {
    BoundTree bound = treeService.getBoundTree();
    PhylogeneticTree tree = bound.getTree();
    String needle = query.toLowerCase(Locale.ROOT);

    List<SearchResult> results = new ArrayList<>();
    for (int node : tree.levelOrder()) {
      if (limitReached(results, maxResults)) {
        break;
      }
      if (tree.isLeaf(node)) {
        continue;
      }
      List<String> members = memberNames(bound, node);
      if (String.join(" ", members).toLowerCase(Locale.ROOT).contains(needle)) {
        results.add(
            new SearchResult(
                "Clade with " + members.size() + " species",
                Constants.NODE_TYPE_INTERNAL,
                tree.distanceToRoot(node),
                supportOf(tree.node(node)),
                members.size(),
                geneCountUnder(bound, node),
                members.stream().limit(config.getCladeMemberLimit()).toList()));
      }
    }
    return results;
  }

  /**
   * Finds the lowest common ancestor of a list of species.
   *
   * <p>Each name picks one leaf: the leaf whose code equals it ignoring case, otherwise the first
   * leaf in pre-order whose full name contains it ignoring case. Names matching no leaf are
   * dropped. Fewer than two picked leaves give an empty result.
   *
   * @param speciesNames species codes or (partial) names
   * @return a single result with the complete member list, or an empty list
   */
  public List<SearchResult> findCommonAncestor(List<String> speciesNames) {
    BoundTree bound = treeService.getBoundTree();
    PhylogeneticTree tree = bound.getTree();

    List<Integer> targets = new ArrayList<>();
    for (String name : speciesNames) {
      pickLeaf(bound, name).ifPresent(targets::add);
    }
    if (targets.size() < 2) {
      log.debug("Common ancestor of {} resolved only {} leaves", speciesNames, targets.size());
      return List.of();
    }

    int ancestor = tree.lowestCommonAncestor(targets);
    List<String> members = memberNames(bound, ancestor);
    return List.of(
        new SearchResult(
            "Common ancestor of " + String.join(", ", speciesNames),
            tree.isLeaf(ancestor) ? Constants.NODE_TYPE_LEAF : Constants.NODE_TYPE_INTERNAL,
            tree.distanceToRoot(ancestor),
            supportOf(tree.node(ancestor)),
            members.size(),
            geneCountUnder(bound, ancestor),
            members));
  }

  private static Optional<Integer> pickLeaf(BoundTree bound, String name) {
    List<Integer> leaves = bound.getTree().leafIndexes();
    for (int leaf : leaves) {
      if (bound.codeOf(leaf).equalsIgnoreCase(name)) {
        return Optional.of(leaf);
      }
    }
    String needle = name.toLowerCase(Locale.ROOT);
    for (int leaf : leaves) {
      if (bound.fullNameOf(leaf).toLowerCase(Locale.ROOT).contains(needle)) {
        return Optional.of(leaf);
      }
    }
    return Optional.empty();
  }

  private static SearchResult leafResult(BoundTree bound, int leaf, int geneCount) {
    String name = bound.fullNameOf(leaf);
    return new SearchResult(
        name,
        Constants.NODE_TYPE_LEAF,
        bound.getTree().distanceToRoot(leaf),
        null,
        1,
        geneCount,
        List.of(name));
  }

  private static List<String> memberNames(BoundTree bound, int node) {
    return bound.getTree().leavesUnder(node).stream().map(bound::fullNameOf).toList();
  }

  private static int geneCountUnder(BoundTree bound, int node) {
    return bound.getTree().leavesUnder(node).stream()
        .mapToInt(bound::genomeGeneCountOf)
        .sum();
  }

  private static Double supportOf(PhyloNode node) {
    return node instanceof Clade clade ? clade.support() : null;
  }

  private static boolean limitReached(List<SearchResult> results, int maxResults) {
    return maxResults > 0 && results.size() >= maxResults;
  }
}
