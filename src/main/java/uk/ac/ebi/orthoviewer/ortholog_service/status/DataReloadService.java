package uk.ac.ebi.orthoviewer.ortholog_service.status;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.ac.ebi.orthoviewer.ortholog_service.orthogroup.GeneIndex;
import uk.ac.ebi.orthoviewer.ortholog_service.orthogroup.OrthogroupRepository;
import uk.ac.ebi.orthoviewer.ortholog_service.orthogroup.OrthogroupTable;
import uk.ac.ebi.orthoviewer.ortholog_service.species.SpeciesIdentity;
import uk.ac.ebi.orthoviewer.ortholog_service.species.SpeciesResolver;
import uk.ac.ebi.orthoviewer.ortholog_service.tree.BoundTree;
import uk.ac.ebi.orthoviewer.ortholog_service.tree.PhylogeneticTreeService;

/**
 * Coordinates the data holders: loads and reloads them in dependency order and reports their
 * state.
 */
@Slf4j
@Service
public class DataReloadService {

  private final OrthogroupRepository orthogroupRepository;
  private final SpeciesResolver speciesResolver;
  private final PhylogeneticTreeService treeService;

  public DataReloadService(
      OrthogroupRepository orthogroupRepository,
      SpeciesResolver speciesResolver,
      PhylogeneticTreeService treeService) {
    this.orthogroupRepository = orthogroupRepository;
    this.speciesResolver = speciesResolver;
    this.treeService = treeService;
  }

  /** Loads every holder that is not loaded yet. */
  public void ensureAllLoaded() {
    orthogroupRepository.ensureLoaded();
    speciesResolver.ensureLoaded();
    treeService.ensureLoaded();
  }

  /**
   * Rebuilds the table and gene index, then the species mapping, then the bound tree.
   *
   * @return the state after reloading
   */
  public synchronized EngineStatus reloadAll() {
    long start = System.currentTimeMillis();
    orthogroupRepository.reload();
    speciesResolver.reload();
    treeService.reload();
    log.info("All data reloaded in {} ms", System.currentTimeMillis() - start);
    return status();
  }

  /** Current state. Holders that are not loaded are reported as such, not loaded by this call. */
  public EngineStatus status() {
    boolean tableLoaded = orthogroupRepository.isLoaded();
    OrthogroupTable table = tableLoaded ? orthogroupRepository.getTable() : OrthogroupTable.empty();
    GeneIndex index = tableLoaded ? orthogroupRepository.getGeneIndex() : null;

    boolean treeLoaded = treeService.isLoaded();
    BoundTree bound = treeLoaded ? treeService.getBoundTree() : null;

    return new EngineStatus(
        tableLoaded,
        table.size(),
        table.getSpeciesCodes().size(),
        index == null ? 0 : index.size(),
        index == null ? 0 : index.getConflictCount(),
        table.getSkippedRows(),
        speciesResolver.isLoaded(),
        treeLoaded,
        bound != null && bound.isDegraded(),
        bound == null ? 0 : bound.getTree().leafIndexes().size(),
        bound == null ? List.of() : bound.unboundLeaves());
  }

  /** Every species column of the table, in table order, with resolved names and gene totals. */
  public List<SpeciesSummary> listSpecies() {
    OrthogroupTable table = orthogroupRepository.getTable();
    return table.getSpeciesCodes().stream()
        .map(
            code -> {
              SpeciesIdentity identity = speciesResolver.resolve(code);
              return new SpeciesSummary(
                  code, identity.canonicalName(), identity.source(), table.geneTotalOf(code));
            })
        .toList();
  }
}
