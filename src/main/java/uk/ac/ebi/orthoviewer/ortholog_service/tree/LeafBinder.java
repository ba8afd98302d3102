package uk.ac.ebi.orthoviewer.ortholog_service.tree;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.orthoviewer.ortholog_service.orthogroup.OrthogroupTable;
import uk.ac.ebi.orthoviewer.ortholog_service.species.SpeciesIdentity;
import uk.ac.ebi.orthoviewer.ortholog_service.species.SpeciesResolver;

/** Attaches a species identity and genome-wide gene count to every leaf of a tree. */
@Slf4j
@Component
public class LeafBinder {

  private final SpeciesResolver speciesResolver;

  public LeafBinder(SpeciesResolver speciesResolver) {
    this.speciesResolver = speciesResolver;
  }

  /**
   * Binds the leaves of a tree.
   *
   * @param tree parsed tree
   * @param table orthogroup table providing the per-species gene totals
   * @param newick source text of the tree
   * @param degraded whether the tree is the fallback tree
   * @return the bound tree
   */
  public BoundTree bind(
      PhylogeneticTree tree, OrthogroupTable table, String newick, boolean degraded) {
    Set<String> columns = new HashSet<>(table.getSpeciesCodes());
    Map<Integer, LeafAnnotation> annotations = new HashMap<>();
    for (int leaf : tree.leafIndexes()) {
      String code = ((Leaf) tree.node(leaf)).name();
      SpeciesIdentity identity = speciesResolver.resolve(code);
      boolean inTable = columns.contains(code);
      if (!inTable) {
        log.debug("Tree leaf '{}' has no column in the orthogroup table", code);
      }
      annotations.put(leaf, new LeafAnnotation(identity, table.geneTotalOf(code), inTable));
    }
    return new BoundTree(tree, annotations, newick, degraded);
  }
}
