package uk.ac.ebi.orthoviewer.ortholog_service.tree;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.ac.ebi.orthoviewer.ortholog_service.config.OrthoDataConfig;
import uk.ac.ebi.orthoviewer.ortholog_service.orthogroup.OrthogroupRepository;
import uk.ac.ebi.orthoviewer.ortholog_service.parsing.ParsingException;
import uk.ac.ebi.orthoviewer.ortholog_service.util.DataFileReader;

/**
 * Loads the species tree once and keeps it bound to species identities and gene counts.
 *
 * <p>A missing tree file is fatal. A tree that cannot be parsed is replaced by the configured
 * fallback tree and the service reports itself as degraded until the next successful {@link
 * #reload()}.
 */
@Slf4j
@Service
public class PhylogeneticTreeService {

  private final OrthoDataConfig config;
  private final DataFileReader fileReader;
  private final NewickParser parser;
  private final LeafBinder binder;
  private final OrthogroupRepository orthogroupRepository;

  private volatile BoundTree boundTree;

  public PhylogeneticTreeService(
      OrthoDataConfig config,
      DataFileReader fileReader,
      NewickParser parser,
      LeafBinder binder,
      OrthogroupRepository orthogroupRepository) {
    this.config = config;
    this.fileReader = fileReader;
    this.parser = parser;
    this.binder = binder;
    this.orthogroupRepository = orthogroupRepository;
  }

  /**
   * Parses and binds the tree unless already done.
   *
   * @throws uk.ac.ebi.orthoviewer.ortholog_service.exceptions.DataNotFoundException if the tree
   *     file is missing
   */
  public void ensureLoaded() {
    current();
  }

  /** Reads the tree file again and rebinds its leaves against the current table and mapping. */
  public synchronized void reload() {
    log.info("Reloading species tree");
    boundTree = build();
  }

  public boolean isLoaded() {
    return boundTree != null;
  }

  public BoundTree getBoundTree() {
    return current();
  }

  /** Newick text of the tree in use; the fallback tree's text when degraded. */
  public String getRawNewick() {
    return current().getNewick();
  }

  public TreeStatistics statistics() {
    return TreeStatistics.of(current().getTree());
  }

  private BoundTree current() {
    BoundTree t = boundTree;
    if (t == null) {
      synchronized (this) {
        t = boundTree;
        if (t == null) {
          t = build();
          boundTree = t;
        }
      }
    }
    return t;
  }

  private BoundTree build() {
    long start = System.currentTimeMillis();
    String newick = fileReader.readAll(config.getTreeLocation()).trim();

    PhylogeneticTree tree;
    boolean degraded = false;
    try {
      tree = PhylogeneticTree.of(parser.parse(newick));
    } catch (ParsingException e) {
      log.warn(
          "Species tree at {} cannot be parsed ({}); running DEGRADED on fallback tree {}",
          config.getTreeLocation(),
          e.getMessage(),
          config.getFallbackNewick());
      newick = config.getFallbackNewick();
      tree = PhylogeneticTree.of(parser.parse(newick));
      degraded = true;
    }

    BoundTree bound = binder.bind(tree, orthogroupRepository.getTable(), newick, degraded);
    log.info(
        "Species tree ready: {} nodes, {} leaves, {} unbound, in {} ms",
        tree.size(),
        tree.leafIndexes().size(),
        bound.unboundLeaves().size(),
        System.currentTimeMillis() - start);
    return bound;
  }
}
