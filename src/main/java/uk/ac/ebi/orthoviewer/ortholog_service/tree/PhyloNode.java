package uk.ac.ebi.orthoviewer.ortholog_service.tree;

/** A node of a parsed phylogenetic tree: either a {@link Leaf} or an internal {@link Clade}. */
public interface PhyloNode {

  /** Length of the branch to the parent; 0 when the source gives none. */
  double branchLength();

  boolean isLeaf();
}
