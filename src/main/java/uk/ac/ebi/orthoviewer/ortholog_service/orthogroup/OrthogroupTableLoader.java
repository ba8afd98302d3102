package uk.ac.ebi.orthoviewer.ortholog_service.orthogroup;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import uk.ac.ebi.orthoviewer.ortholog_service.Constants;
import uk.ac.ebi.orthoviewer.ortholog_service.config.OrthoDataConfig;
import uk.ac.ebi.orthoviewer.ortholog_service.exceptions.DataNotFoundException;
import uk.ac.ebi.orthoviewer.ortholog_service.parsing.ParsingException;
import uk.ac.ebi.orthoviewer.ortholog_service.util.DataFileReader;
import uk.ac.ebi.orthoviewer.ortholog_service.util.DelimitedLines;

/**
 * Component responsible for loading the orthogroup table.
 *
 * <p>The first line is the header: the orthogroup id column followed by one column per species
 * code. Every following line is one orthogroup; each species cell holds comma-separated gene
 * identifiers or is empty. Rows with the wrong number of columns, without an id, or repeating an
 * id already seen are skipped with a warning and loading continues.
 */
@Component
public class OrthogroupTableLoader {

  private static final Logger LOGGER = LogManager.getLogger(OrthogroupTableLoader.class);

  private final DataFileReader dataFileReader;
  private final OrthoDataConfig config;

  public OrthogroupTableLoader(DataFileReader dataFileReader, OrthoDataConfig config) {
    this.dataFileReader = dataFileReader;
    this.config = config;
  }

  /**
   * Loads the table from the configured location.
   *
   * @return the parsed table
   * @throws DataNotFoundException if the file is missing or cannot be read
   */
  public OrthogroupTable load() {
    String location = config.getOrthogroupsLocation();
    LOGGER.info("Loading orthogroup table from {}", location);
    long start = System.currentTimeMillis();
    try (BufferedReader reader = dataFileReader.open(location)) {
      OrthogroupTable table = parse(reader, config.getColumnDelimiter());
      LOGGER.info(
          "Orthogroup table loaded: {} orthogroups, {} species, {} rows skipped ({}ms)",
          table.size(),
          table.getSpeciesCodes().size(),
          table.getSkippedRows(),
          System.currentTimeMillis() - start);
      return table;
    } catch (IOException e) {
      throw new DataNotFoundException("Problem reading orthogroup table " + location, e);
    }
  }

  /**
   * Parses an orthogroup table.
   *
   * @param reader source of the table lines
   * @param delimiter column delimiter
   * @return the parsed table; empty when the source has no header
   * @throws IOException if reading fails
   */
  public OrthogroupTable parse(BufferedReader reader, String delimiter) throws IOException {
    String headerLine = reader.readLine();
    while (headerLine != null && headerLine.isBlank()) {
      headerLine = reader.readLine();
    }
    if (headerLine == null) {
      LOGGER.warn("Orthogroup table is empty");
      return OrthogroupTable.empty();
    }

    String[] header = DelimitedLines.split(stripBom(headerLine), delimiter);
    List<String> speciesCodes = Arrays.asList(header).subList(1, header.length);
    if (!header[0].isEmpty() && !Constants.ORTHOGROUP_COLUMN.equalsIgnoreCase(header[0])) {
      LOGGER.debug(
          "First column is named {} rather than {}", header[0], Constants.ORTHOGROUP_COLUMN);
    }

    List<OrthogroupRow> rows = new ArrayList<>();
    Set<String> seenIds = new HashSet<>();
    int skipped = 0;
    int lineNumber = 1;
    String line;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      try {
        OrthogroupRow row = parseRow(line, delimiter, speciesCodes);
        if (!seenIds.add(row.orthogroupId())) {
          throw new ParsingException("duplicate orthogroup id " + row.orthogroupId());
        }
        rows.add(row);
      } catch (ParsingException ex) {
        skipped++;
        LOGGER.warn("Skipping orthogroup table line {}: {}", lineNumber, ex.getMessage());
      }
    }
    return new OrthogroupTable(speciesCodes, rows, skipped);
  }

  /**
   * Parses one data line.
   *
   * @throws ParsingException if the column count does not match the header or the id is empty
   */
  OrthogroupRow parseRow(String line, String delimiter, List<String> speciesCodes) {
    String[] cells = DelimitedLines.split(line, delimiter);
    if (cells.length != speciesCodes.size() + 1) {
      throw new ParsingException(
          String.format("expected %d columns, found %d", speciesCodes.size() + 1, cells.length));
    }
    String orthogroupId = cells[0];
    if (orthogroupId.isEmpty()) {
      throw new ParsingException("missing orthogroup id");
    }
    Map<String, List<String>> perSpecies = new LinkedHashMap<>();
    for (int i = 0; i < speciesCodes.size(); i++) {
      perSpecies.put(speciesCodes.get(i), splitGenes(cells[i + 1]));
    }
    return new OrthogroupRow(orthogroupId, perSpecies);
  }

  /** Splits a cell into trimmed, non-empty gene identifiers. */
  static List<String> splitGenes(String cell) {
    if (cell == null || cell.isBlank()) {
      return List.of();
    }
    List<String> genes = new ArrayList<>();
    for (String gene : cell.split(Constants.GENE_SEPARATOR)) {
      String trimmed = gene.trim();
      if (!trimmed.isEmpty()) {
        genes.add(trimmed);
      }
    }
    return genes;
  }

  private static String stripBom(String line) {
    return line.startsWith("\uFEFF") ? line.substring(1) : line;
  }
}
