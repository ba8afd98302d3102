package uk.ac.ebi.orthoviewer.ortholog_service.rest;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@Schema(description = "Request to find the orthologues of a gene")
public class OrthologueSearchRequest {
  @NotBlank
  @Schema(description = "Gene identifier", example = "AT1G01010")
  private String geneId;
}
