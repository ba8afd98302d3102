package uk.ac.ebi.orthoviewer.ortholog_service.tree;

import java.util.List;

/**
 * Internal node of a species tree.
 *
 * @param label non-numeric internal label, or null
 * @param support numeric internal label (bootstrap or similar), or null
 * @param branchLength length of the branch to the parent
 * @param children child nodes, at least one
 */
public record Clade(String label, Double support, double branchLength, List<PhyloNode> children)
    implements PhyloNode {

  public Clade {
    children = List.copyOf(children);
  }

  @Override
  public boolean isLeaf() {
    return false;
  }
}
