package uk.ac.ebi.orthoviewer.ortholog_service.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, indexed view of a parsed tree.
 *
 * <p>Nodes are numbered in pre-order, the root being 0. The descendants of node {@code i} occupy
 * the contiguous range {@code (i, subtreeEnd(i))}, which makes subtree and leaf queries simple
 * range scans. Per-node data (parent, depth, distance to root) is kept in arrays indexed by that
 * number.
 */
public final class PhylogeneticTree {

  private final PhyloNode root;
  private final List<PhyloNode> nodes;
  private final int[] parent;
  private final int[] depth;
  private final int[] subtreeEnd;
  private final double[] distanceToRoot;
  private final List<Integer> leafIndexes;
  private final Map<String, Integer> leafByName;

  private PhylogeneticTree(PhyloNode root) {
    this.root = root;

    List<PhyloNode> order = new ArrayList<>();
    List<Integer> parents = new ArrayList<>();
    Deque<PhyloNode> stack = new ArrayDeque<>();
    Deque<Integer> parentStack = new ArrayDeque<>();
    stack.push(root);
    parentStack.push(-1);
    while (!stack.isEmpty()) {
      PhyloNode node = stack.pop();
      int parentIndex = parentStack.pop();
      int index = order.size();
      order.add(node);
      parents.add(parentIndex);
      if (node instanceof Clade clade) {
        List<PhyloNode> children = clade.children();
        for (int c = children.size() - 1; c >= 0; c--) {
          stack.push(children.get(c));
          parentStack.push(index);
        }
      }
    }

    int n = order.size();
    this.nodes = List.copyOf(order);
    this.parent = new int[n];
    this.depth = new int[n];
    this.subtreeEnd = new int[n];
    this.distanceToRoot = new double[n];
    List<Integer> leaves = new ArrayList<>();
    Map<String, Integer> byName = new HashMap<>();

    for (int i = 0; i < n; i++) {
      parent[i] = parents.get(i);
      if (parent[i] >= 0) {
        depth[i] = depth[parent[i]] + 1;
        distanceToRoot[i] = distanceToRoot[parent[i]] + nodes.get(i).branchLength();
      }
      if (nodes.get(i) instanceof Leaf leaf) {
        leaves.add(i);
        byName.put(leaf.name(), i);
      }
    }
    // Children always follow their parent, so a reverse pass sees every subtree complete.
    for (int i = n - 1; i >= 0; i--) {
      if (subtreeEnd[i] == 0) {
        subtreeEnd[i] = i + 1;
      }
      if (parent[i] >= 0) {
        subtreeEnd[parent[i]] = Math.max(subtreeEnd[parent[i]], subtreeEnd[i]);
      }
    }
    this.leafIndexes = Collections.unmodifiableList(leaves);
    this.leafByName = Map.copyOf(byName);
  }

  public static PhylogeneticTree of(PhyloNode root) {
    return new PhylogeneticTree(root);
  }

  public PhyloNode getRoot() {
    return root;
  }

  public int size() {
    return nodes.size();
  }

  public PhyloNode node(int index) {
    return nodes.get(index);
  }

  public boolean isLeaf(int index) {
    return nodes.get(index).isLeaf();
  }

  /** Parent index, or -1 for the root. */
  public int parentOf(int index) {
    return parent[index];
  }

  public int depthOf(int index) {
    return depth[index];
  }

  /**
   * Sum of branch lengths on the path from the root to this node. The root's own branch length is
   * not counted, so the root is at distance 0.
   */
  public double distanceToRoot(int index) {
    return distanceToRoot[index];
  }

  /** Exclusive end of the pre-order range holding this node and its descendants. */
  public int subtreeEnd(int index) {
    return subtreeEnd[index];
  }

  /** Indexes of the direct children of a node, left to right; empty for a leaf. */
  public List<Integer> childrenOf(int index) {
    List<Integer> children = new ArrayList<>();
    for (int c = index + 1; c < subtreeEnd[index]; c = subtreeEnd[c]) {
      children.add(c);
    }
    return children;
  }

  /** All node indexes in level order: the root, then its children, then their children. */
  public List<Integer> levelOrder() {
    List<Integer> order = new ArrayList<>(nodes.size());
    Deque<Integer> queue = new ArrayDeque<>();
    queue.add(0);
    while (!queue.isEmpty()) {
      int index = queue.poll();
      order.add(index);
      queue.addAll(childrenOf(index));
    }
    return order;
  }

  /** All leaf indexes in pre-order. */
  public List<Integer> leafIndexes() {
    return leafIndexes;
  }

  /** Leaf indexes under a node, in pre-order; a leaf yields itself. */
  public List<Integer> leavesUnder(int index) {
    List<Integer> result = new ArrayList<>();
    for (int i = index; i < subtreeEnd[index]; i++) {
      if (nodes.get(i).isLeaf()) {
        result.add(i);
      }
    }
    return result;
  }

  public int leafCountUnder(int index) {
    return leavesUnder(index).size();
  }

  /** Index of the leaf with this exact name. */
  public Optional<Integer> findLeaf(String name) {
    return Optional.ofNullable(leafByName.get(name));
  }

  /** True if {@code descendant} is {@code ancestor} or lies in its subtree. */
  public boolean isInSubtree(int ancestor, int descendant) {
    return descendant >= ancestor && descendant < subtreeEnd[ancestor];
  }

  /**
   * Lowest common ancestor of the given nodes.
   *
   * @param indexes at least one node index
   * @return the deepest node whose subtree contains all of them; the node itself for a single index
   */
  public int lowestCommonAncestor(Collection<Integer> indexes) {
    if (indexes.isEmpty()) {
      throw new IllegalArgumentException("At least one node is required");
    }
    int min = Integer.MAX_VALUE;
    int max = Integer.MIN_VALUE;
    for (int i : indexes) {
      min = Math.min(min, i);
      max = Math.max(max, i);
    }
    int ancestor = min;
    while (!isInSubtree(ancestor, max)) {
      ancestor = parent[ancestor];
    }
    return ancestor;
  }
}
