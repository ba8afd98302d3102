package uk.ac.ebi.orthoviewer.ortholog_service.rest;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
@Schema(description = "Structural search over the species tree")
public class TreeSearchRequest {
  @NotBlank
  @Schema(
      description = "Search kind",
      allowableValues = {"gene", "species", "clade", "common_ancestor"})
  private String searchType;

  @NotNull
  @Schema(
      description = "Gene id, species text, clade text, or comma-separated species list",
      example = "Arabidopsis")
  private String query = "";

  @Min(0) @Schema(description = "Result limit; 0 means unlimited. Defaults to the configured limit")
  private Integer maxResults;
}
