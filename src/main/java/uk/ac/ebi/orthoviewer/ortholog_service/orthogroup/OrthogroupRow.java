package uk.ac.ebi.orthoviewer.ortholog_service.orthogroup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One row of the orthogroup table.
 *
 * @param orthogroupId unique orthogroup identifier
 * @param perSpecies genes per species code, in table column order; a species without genes in this
 *     orthogroup maps to an empty list
 */
public record OrthogroupRow(String orthogroupId, Map<String, List<String>> perSpecies) {

  public OrthogroupRow {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    perSpecies.forEach((species, genes) -> copy.put(species, List.copyOf(genes)));
    perSpecies = Collections.unmodifiableMap(copy);
  }

  /** Genes of the given species in this orthogroup; empty if the species has none. */
  public List<String> genesOf(String speciesCode) {
    return perSpecies.getOrDefault(speciesCode, List.of());
  }

  /** Species that have at least one gene in this orthogroup, with their genes. */
  public Map<String, List<String>> nonEmptySpecies() {
    Map<String, List<String>> result = new LinkedHashMap<>();
    perSpecies.forEach(
        (species, genes) -> {
          if (!genes.isEmpty()) {
            result.put(species, genes);
          }
        });
    return result;
  }
}
