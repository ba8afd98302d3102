package uk.ac.ebi.orthoviewer.ortholog_service.tree;

/**
 * Leaf of a species tree.
 *
 * @param name species code, trimmed and unquoted
 * @param branchLength length of the branch to the parent
 */
public record Leaf(String name, double branchLength) implements PhyloNode {

  @Override
  public boolean isLeaf() {
    return true;
  }
}
