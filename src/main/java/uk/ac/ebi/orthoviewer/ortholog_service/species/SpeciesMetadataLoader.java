package uk.ac.ebi.orthoviewer.ortholog_service.species;

import java.io.BufferedReader;
import java.io.IOException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import uk.ac.ebi.orthoviewer.ortholog_service.config.OrthoDataConfig;
import uk.ac.ebi.orthoviewer.ortholog_service.util.DataFileReader;
import uk.ac.ebi.orthoviewer.ortholog_service.util.DelimitedLines;

/**
 * Component responsible for loading the species metadata table into a {@link SpeciesMapping}.
 *
 * <p>The file starts with {@link OrthoDataConfig#getMetadataHeaderLines()} description lines and a
 * header row, all skipped. In every data row column 0 is the full scientific name and column 1
 * the species code. Rows lacking either value are skipped with a warning.
 *
 * <p>A missing metadata file is not fatal: every code then resolves through the fallback names.
 */
@Component
public class SpeciesMetadataLoader {

  private static final Logger LOGGER = LogManager.getLogger(SpeciesMetadataLoader.class);

  private final DataFileReader dataFileReader;
  private final OrthoDataConfig config;
  private final FallbackNameGenerator generator;

  public SpeciesMetadataLoader(
      DataFileReader dataFileReader, OrthoDataConfig config, FallbackNameGenerator generator) {
    this.dataFileReader = dataFileReader;
    this.config = config;
    this.generator = generator;
  }

  /**
   * Loads the mapping from the configured location.
   *
   * @return the mapping; empty if the file is missing or unreadable
   */
  public SpeciesMapping load() {
    String location = config.getSpeciesMetadataLocation();
    if (!dataFileReader.exists(location)) {
      LOGGER.warn("Species metadata {} not found, all species names will be generated", location);
      return SpeciesMapping.builder(generator).build();
    }
    LOGGER.info("Loading species metadata from {}", location);
    try (BufferedReader reader = dataFileReader.open(location)) {
      SpeciesMapping mapping =
          parse(reader, config.getColumnDelimiter(), config.getMetadataHeaderLines());
      LOGGER.info("Species metadata loaded: {} species", mapping.getCodeToName().size());
      return mapping;
    } catch (IOException e) {
      LOGGER.error("Problem reading species metadata file:", e);
      return SpeciesMapping.builder(generator).build();
    }
  }

  /**
   * Parses a metadata table.
   *
   * @param reader source of the table lines
   * @param delimiter column delimiter
   * @param descriptionLines lines preceding the header row
   * @return the mapping
   * @throws IOException if reading fails
   */
  public SpeciesMapping parse(BufferedReader reader, String delimiter, int descriptionLines)
      throws IOException {
    SpeciesMapping.Builder builder = SpeciesMapping.builder(generator);
    // description lines plus the header row
    for (int i = 0; i <= descriptionLines; i++) {
      if (reader.readLine() == null) {
        return builder.build();
      }
    }
    String line;
    int lineNumber = descriptionLines + 1;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      String[] cells = DelimitedLines.split(line, delimiter);
      if (cells.length < 2 || cells[0].isEmpty() || cells[1].isEmpty()) {
        LOGGER.warn("Malformed line {} in species metadata file: {}", lineNumber, line);
        continue;
      }
      builder.add(cells[1], cells[0]);
    }
    return builder.build();
  }
}
