package uk.ac.ebi.orthoviewer.ortholog_service.tree;

import java.util.List;
import uk.ac.ebi.orthoviewer.ortholog_service.Constants;

/**
 * Structural summary of a tree.
 *
 * @param totalNodes number of nodes, leaves included
 * @param leafCount number of leaves
 * @param internalNodeCount number of clades
 * @param height largest distance from the root to a leaf
 * @param binary whether every clade has exactly two children
 * @param minBranchLength smallest branch length below the root
 * @param maxBranchLength largest branch length below the root
 * @param meanBranchLength mean branch length below the root
 * @param minSupport smallest support value, or null when no clade carries one
 * @param maxSupport largest support value, or null when no clade carries one
 * @param sampleLeafNames names of the first leaves in pre-order
 */
public record TreeStatistics(
    int totalNodes,
    int leafCount,
    int internalNodeCount,
    double height,
    boolean binary,
    double minBranchLength,
    double maxBranchLength,
    double meanBranchLength,
    Double minSupport,
    Double maxSupport,
    List<String> sampleLeafNames) {

  public static TreeStatistics of(PhylogeneticTree tree) {
    int leaves = tree.leafIndexes().size();
    double height = 0;
    boolean binary = true;
    double minLength = Double.MAX_VALUE;
    double maxLength = 0;
    double sumLength = 0;
    Double minSupport = null;
    Double maxSupport = null;

    for (int i = 0; i < tree.size(); i++) {
      PhyloNode node = tree.node(i);
      if (node instanceof Clade clade) {
        binary &= clade.children().size() == 2;
        if (clade.support() != null) {
          minSupport = minSupport == null ? clade.support() : Math.min(minSupport, clade.support());
          maxSupport = maxSupport == null ? clade.support() : Math.max(maxSupport, clade.support());
        }
      } else {
        height = Math.max(height, tree.distanceToRoot(i));
      }
      if (i > 0) {
        minLength = Math.min(minLength, node.branchLength());
        maxLength = Math.max(maxLength, node.branchLength());
        sumLength += node.branchLength();
      }
    }
    int branches = tree.size() - 1;
    List<String> sample =
        tree.leafIndexes().stream()
            .limit(Constants.STATISTICS_LEAF_NAMES)
            .map(leaf -> ((Leaf) tree.node(leaf)).name())
            .toList();
    return new TreeStatistics(
        tree.size(),
        leaves,
        tree.size() - leaves,
        height,
        binary,
        branches == 0 ? 0 : minLength,
        maxLength,
        branches == 0 ? 0 : sumLength / branches,
        minSupport,
        maxSupport,
        sample);
  }
}
