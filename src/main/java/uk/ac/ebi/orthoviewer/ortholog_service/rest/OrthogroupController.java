package uk.ac.ebi.orthoviewer.ortholog_service.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.ac.ebi.orthoviewer.ortholog_service.orthogroup.OrthogroupRepository;
import uk.ac.ebi.orthoviewer.ortholog_service.orthologue.OrthologueQueryService;
import uk.ac.ebi.orthoviewer.ortholog_service.orthologue.OrthogroupTreeResult;

/** Gene and orthogroup lookups. */
@Slf4j
@RestController
@RequestMapping("/api")
@Tag(name = "Orthogroups", description = "Gene to orthogroup and orthogroup to genes lookups.")
public class OrthogroupController {

  private final OrthogroupRepository orthogroupRepository;
  private final OrthologueQueryService orthologueQueryService;

  public OrthogroupController(
      OrthogroupRepository orthogroupRepository, OrthologueQueryService orthologueQueryService) {
    this.orthogroupRepository = orthogroupRepository;
    this.orthologueQueryService = orthologueQueryService;
  }

  /**
   * Genes of an orthogroup by species. An unknown orthogroup yields an empty map.
   *
   * @param id orthogroup identifier
   */
  @GetMapping("/orthogroups/{id}/genes")
  @Operation(
      summary = "Genes of an orthogroup",
      description = "Species code to genes, species with an empty cell omitted.")
  public ResponseEntity<RestResponse<Map<String, List<String>>>> getOrthogroupGenes(
      @Parameter(description = "Orthogroup identifier", example = "OG0000001") @PathVariable
          String id) {
    Map<String, List<String>> genes = orthogroupRepository.getOrthogroupGenes(id);
    String message = String.format("Found genes for %d species", genes.size());
    return ResponseEntity.ok(RestResponse.success(message, genes));
  }

  @GetMapping("/orthogroups/{id}/tree")
  @Operation(summary = "Species tree of an orthogroup with the species holding its genes")
  @ApiResponses({
    @ApiResponse(
        responseCode = "200",
        description = "Tree returned",
        content =
            @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = RestResponse.class))),
    @ApiResponse(
        responseCode = "404",
        description = "Unknown orthogroup",
        content =
            @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = RestResponse.class)))
  })
  public ResponseEntity<RestResponse<OrthogroupTreeResult>> getOrthogroupTree(
      @Parameter(description = "Orthogroup identifier", example = "OG0000001") @PathVariable
          String id) {
    return orthologueQueryService
        .getOrthogroupTree(id)
        .map(tree -> ResponseEntity.ok(RestResponse.success("Orthogroup tree", tree)))
        .orElseGet(
            () ->
                ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(RestResponse.notFound("Orthogroup " + id + " not found", "id")));
  }

  @GetMapping("/genes/{geneId}/orthogroup")
  @Operation(summary = "Orthogroup containing a gene")
  @ApiResponses({
    @ApiResponse(
        responseCode = "200",
        description = "Orthogroup found",
        content =
            @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = RestResponse.class))),
    @ApiResponse(
        responseCode = "404",
        description = "Gene is in no orthogroup",
        content =
            @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = RestResponse.class)))
  })
  public ResponseEntity<RestResponse<String>> getGeneOrthogroup(
      @Parameter(description = "Gene identifier", example = "AT1G01010") @PathVariable
          String geneId) {
    log.debug("Orthogroup requested for gene: {}", geneId);
    return orthogroupRepository
        .findGeneOrthogroup(geneId)
        .map(og -> ResponseEntity.ok(RestResponse.success("Orthogroup found", og)))
        .orElseGet(
            () ->
                ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(
                        RestResponse.notFound(
                            "Gene " + geneId + " not found in any orthogroup", "geneId")));
  }
}
