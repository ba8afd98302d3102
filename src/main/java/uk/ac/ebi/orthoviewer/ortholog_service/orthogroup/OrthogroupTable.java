package uk.ac.ebi.orthoviewer.ortholog_service.orthogroup;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;

/**
 * Immutable in-memory orthogroup table. Built once by {@link OrthogroupTableLoader}.
 *
 * <p>Besides the rows it keeps the species columns in table order and the genome-wide gene count of
 * every species, which the leaf binder needs once per load.
 */
@Getter
public class OrthogroupTable {

  private final List<String> speciesCodes;
  private final List<OrthogroupRow> rows;
  private final Map<String, Integer> speciesGeneTotals;
  private final int skippedRows;

  private final Map<String, OrthogroupRow> rowsById;

  public OrthogroupTable(List<String> speciesCodes, List<OrthogroupRow> rows, int skippedRows) {
    this.speciesCodes = List.copyOf(speciesCodes);
    this.rows = List.copyOf(rows);
    this.skippedRows = skippedRows;

    Map<String, OrthogroupRow> byId = new HashMap<>();
    Map<String, Integer> totals = new LinkedHashMap<>();
    speciesCodes.forEach(code -> totals.put(code, 0));
    for (OrthogroupRow row : rows) {
      byId.put(row.orthogroupId(), row);
      row.perSpecies().forEach((code, genes) -> totals.merge(code, genes.size(), Integer::sum));
    }
    this.rowsById = Map.copyOf(byId);
    this.speciesGeneTotals = Collections.unmodifiableMap(totals);
  }

  /** Empty table, used when the source has no header. */
  public static OrthogroupTable empty() {
    return new OrthogroupTable(List.of(), List.of(), 0);
  }

  public Optional<OrthogroupRow> findRow(String orthogroupId) {
    return Optional.ofNullable(rowsById.get(orthogroupId));
  }

  /** Genome-wide gene count of a species; 0 for a code that is not a table column. */
  public int geneTotalOf(String speciesCode) {
    return speciesGeneTotals.getOrDefault(speciesCode, 0);
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public int size() {
    return rows.size();
  }
}
