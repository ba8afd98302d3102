package uk.ac.ebi.orthoviewer.ortholog_service.orthologue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.ac.ebi.orthoviewer.ortholog_service.orthogroup.OrthogroupRepository;
import uk.ac.ebi.orthoviewer.ortholog_service.species.SpeciesResolver;
import uk.ac.ebi.orthoviewer.ortholog_service.tree.PhylogeneticTreeService;

/**
 * Answers "all orthologues of a gene" from the orthogroup table, the species names and the tree.
 */
@Slf4j
@Service
public class OrthologueQueryService {

  private final OrthogroupRepository orthogroupRepository;
  private final SpeciesResolver speciesResolver;
  private final PhylogeneticTreeService treeService;

  public OrthologueQueryService(
      OrthogroupRepository orthogroupRepository,
      SpeciesResolver speciesResolver,
      PhylogeneticTreeService treeService) {
    this.orthogroupRepository = orthogroupRepository;
    this.speciesResolver = speciesResolver;
    this.treeService = treeService;
  }

  /**
   * Finds the orthologues of a gene.
   *
   * <p>A gene in no orthogroup gives an unsuccessful result, not an exception. Otherwise the result
   * lists every other gene of the orthogroup and a gene count for every species column of the
   * table, species without genes included.
   *
   * @param geneId gene identifier; surrounding whitespace is ignored
   * @return the search result
   */
  public OrthologueSearchResult searchOrthologues(String geneId) {
    long start = System.currentTimeMillis();
    String gene = geneId == null ? "" : geneId.trim();

    Optional<String> found = orthogroupRepository.findGeneOrthogroup(gene);
    if (found.isEmpty()) {
      log.info("Gene {} not found in any orthogroup", gene);
      return OrthologueSearchResult.notFound(gene);
    }
    String orthogroupId = found.get();
    Map<String, List<String>> genesBySpecies =
        orthogroupRepository.getOrthogroupGenes(orthogroupId);

    List<SpeciesCount> counts = new ArrayList<>();
    for (String code : orthogroupRepository.getAllSpeciesCodes()) {
      counts.add(
          new SpeciesCount(
              code,
              speciesResolver.resolveName(code),
              genesBySpecies.getOrDefault(code, List.of()).size()));
    }

    List<OrthologueRecord> orthologues = new ArrayList<>();
    genesBySpecies.forEach(
        (code, genes) -> {
          String name = speciesResolver.resolveName(code);
          for (String other : genes) {
            if (!other.equals(gene)) {
              orthologues.add(new OrthologueRecord(other, code, name, orthogroupId));
            }
          }
        });

    log.info(
        "Gene {} is in {}: {} orthologues over {} species, in {} ms",
        gene,
        orthogroupId,
        orthologues.size(),
        genesBySpecies.size(),
        System.currentTimeMillis() - start);
    return new OrthologueSearchResult(
        true,
        gene,
        orthogroupId,
        List.copyOf(orthologues),
        List.copyOf(counts),
        treeService.getRawNewick(),
        null);
  }

  /**
   * Species tree for an orthogroup with the species holding its genes.
   *
   * @param orthogroupId orthogroup identifier
   * @return the tree, or empty for an unknown orthogroup
   */
  public Optional<OrthogroupTreeResult> getOrthogroupTree(String orthogroupId) {
    if (orthogroupId == null
        || orthogroupRepository.getTable().findRow(orthogroupId.trim()).isEmpty()) {
      return Optional.empty();
    }
    Map<String, List<String>> genes = orthogroupRepository.getOrthogroupGenes(orthogroupId);
    return Optional.of(
        new OrthogroupTreeResult(
            orthogroupId.trim(), treeService.getRawNewick(), List.copyOf(genes.keySet())));
  }
}
