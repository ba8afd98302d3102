package uk.ac.ebi.orthoviewer.ortholog_service.tree;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed tree together with its leaf annotations.
 *
 * <p>Annotations are held in a side table keyed by leaf index, so the tree value stays untouched.
 * Instances are immutable and safe to share between threads.
 */
public final class BoundTree {

  private final PhylogeneticTree tree;
  private final Map<Integer, LeafAnnotation> annotations;
  private final Map<String, Integer> leafIndex;
  private final String newick;
  private final boolean degraded;

  public BoundTree(
      PhylogeneticTree tree,
      Map<Integer, LeafAnnotation> annotations,
      String newick,
      boolean degraded) {
    this.tree = tree;
    this.annotations = Map.copyOf(annotations);
    this.newick = newick;
    this.degraded = degraded;

    Map<String, Integer> byCode = new HashMap<>();
    for (int leaf : tree.leafIndexes()) {
      byCode.put(((Leaf) tree.node(leaf)).name(), leaf);
    }
    this.leafIndex = Collections.unmodifiableMap(byCode);
  }

  public PhylogeneticTree getTree() {
    return tree;
  }

  /** The Newick text the tree was parsed from. */
  public String getNewick() {
    return newick;
  }

  /** True if the configured tree could not be parsed and the fallback tree is in use. */
  public boolean isDegraded() {
    return degraded;
  }

  public LeafAnnotation annotation(int leaf) {
    LeafAnnotation annotation = annotations.get(leaf);
    if (annotation == null) {
      throw new IllegalArgumentException("Node " + leaf + " is not a bound leaf");
    }
    return annotation;
  }

  /** Species code of a leaf. */
  public String codeOf(int leaf) {
    return ((Leaf) tree.node(leaf)).name();
  }

  public String fullNameOf(int leaf) {
    return annotation(leaf).fullName();
  }

  public int genomeGeneCountOf(int leaf) {
    return annotation(leaf).genomeGeneCount();
  }

  /** Leaf for a normalized species code. */
  public Optional<Integer> findLeaf(String code) {
    return Optional.ofNullable(leafIndex.get(code));
  }

  /** Codes of leaves that have no column in the orthogroup table. */
  public List<String> unboundLeaves() {
    return tree.leafIndexes().stream()
        .filter(leaf -> !annotation(leaf).inTable())
        .map(this::codeOf)
        .toList();
  }
}
