package uk.ac.ebi.orthoviewer.ortholog_service.config;

import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the orthology source files and search behaviour.
 *
 * <p>Values are loaded from {@code application.properties} (prefix {@code orthodata.*}). File
 * locations are Spring resource locations, so both {@code file:} and {@code classpath:} prefixes
 * are accepted.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "orthodata")
public class OrthoDataConfig {

  /** Location of the orthogroup table (orthogroup id column followed by one column per species). */
  private String orthogroupsLocation = "file:data/orthofinder/Orthogroups.tsv";

  /** Location of the species metadata table (full scientific name, species code, ...). */
  private String speciesMetadataLocation = "file:data/orthofinder/species_metadata.tsv";

  /** Location of the Newick species tree. */
  private String treeLocation = "file:data/orthofinder/SpeciesTree.nwk";

  /** Column delimiter shared by the orthogroup and metadata tables. */
  private String columnDelimiter = "\t";

  /** Description lines preceding the header row of the metadata table. */
  private int metadataHeaderLines = 2;

  /** Maximum number of clade members listed by a clade search result. */
  private int cladeMemberLimit = 10;

  /** Result limit used when a tree search does not specify one. */
  private int defaultMaxResults = 50;

  /** Whether all data is loaded as soon as the application is ready. */
  private boolean warmUpOnStartup = true;

  /** Tree used when the configured Newick source cannot be parsed. */
  private String fallbackNewick = "(A:1,B:1);";

  /** Browser origins allowed to call the {@code /api/**} endpoints. */
  private List<String> corsAllowedOrigins =
      List.of("http://localhost:5173", "http://localhost:3000", "http://localhost:4173");
}
