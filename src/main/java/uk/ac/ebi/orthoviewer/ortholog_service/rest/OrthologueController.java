package uk.ac.ebi.orthoviewer.ortholog_service.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.ac.ebi.orthoviewer.ortholog_service.config.OrthoDataConfig;
import uk.ac.ebi.orthoviewer.ortholog_service.orthologue.OrthologueQueryService;
import uk.ac.ebi.orthoviewer.ortholog_service.orthologue.OrthologueSearchResult;
import uk.ac.ebi.orthoviewer.ortholog_service.search.SearchKind;
import uk.ac.ebi.orthoviewer.ortholog_service.search.SearchResult;
import uk.ac.ebi.orthoviewer.ortholog_service.search.TreeSearchEngine;
import uk.ac.ebi.orthoviewer.ortholog_service.search.TreeSearchResponse;
import uk.ac.ebi.orthoviewer.ortholog_service.status.DataReloadService;
import uk.ac.ebi.orthoviewer.ortholog_service.status.EngineStatus;
import uk.ac.ebi.orthoviewer.ortholog_service.tree.PhylogeneticTreeService;
import uk.ac.ebi.orthoviewer.ortholog_service.tree.TreeStatistics;

/**
 * REST controller for orthologue and species tree queries.
 *
 * <p>Orthologue and tree searches return their own result types, which carry a success flag. The
 * other endpoints return {@link RestResponse} envelopes.
 */
@Slf4j
@RestController
@RequestMapping("/api/orthologue")
@Tag(
    name = "Orthologues",
    description =
        """
        Find the orthologues of a gene and run structural searches over the species tree.
        """)
public class OrthologueController {

  private final OrthologueQueryService orthologueQueryService;
  private final TreeSearchEngine treeSearchEngine;
  private final PhylogeneticTreeService treeService;
  private final DataReloadService dataReloadService;
  private final OrthoDataConfig config;

  public OrthologueController(
      OrthologueQueryService orthologueQueryService,
      TreeSearchEngine treeSearchEngine,
      PhylogeneticTreeService treeService,
      DataReloadService dataReloadService,
      OrthoDataConfig config) {
    this.orthologueQueryService = orthologueQueryService;
    this.treeSearchEngine = treeSearchEngine;
    this.treeService = treeService;
    this.dataReloadService = dataReloadService;
    this.config = config;
  }

  /**
   * Finds all orthologues of a gene.
   *
   * @param request body holding the gene id
   * @return 200 with the result; {@code success=false} when the gene is in no orthogroup
   */
  @Operation(
      summary = "Search orthologues of a gene",
      description =
          """
          Returns every other gene of the gene's orthogroup, a gene count for every species
          (zero counts included) and the species tree in Newick format.""")
  @ApiResponses({
    @ApiResponse(
        responseCode = "200",
        description = "Search completed; check the success flag",
        content =
            @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = OrthologueSearchResult.class))),
    @ApiResponse(
        responseCode = "400",
        description = "Blank gene id",
        content =
            @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = RestResponse.class))),
    @ApiResponse(
        responseCode = "503",
        description = "Orthology data files unavailable",
        content =
            @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = RestResponse.class)))
  })
  @PostMapping("/search")
  public ResponseEntity<OrthologueSearchResult> searchOrthologues(
      @Valid @RequestBody OrthologueSearchRequest request) {
    log.info("Orthologue search requested for gene: {}", request.getGeneId());
    return ResponseEntity.ok(orthologueQueryService.searchOrthologues(request.getGeneId()));
  }

  /**
   * Structural search over the species tree.
   *
   * @param request search kind, query and optional limit
   * @return 200 with the matching nodes
   */
  @Operation(
      summary = "Search the species tree",
      description =
          """
          Search kinds: gene (leaves of the species holding the gene's orthogroup), species
          (leaves by code or name), clade (internal nodes by member names) and common_ancestor
          (lowest common ancestor of a comma-separated species list).""")
  @ApiResponses({
    @ApiResponse(
        responseCode = "200",
        description = "Search completed",
        content =
            @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = TreeSearchResponse.class))),
    @ApiResponse(
        responseCode = "400",
        description = "Unknown search kind or invalid request",
        content =
            @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = RestResponse.class)))
  })
  @PostMapping("/tree-search")
  public ResponseEntity<TreeSearchResponse> treeSearch(
      @Valid @RequestBody TreeSearchRequest request) {
    SearchKind kind = SearchKind.fromString(request.getSearchType());
    int maxResults =
        request.getMaxResults() == null ? config.getDefaultMaxResults() : request.getMaxResults();
    log.info("Tree search: {} for '{}'", kind.getValue(), request.getQuery());
    List<SearchResult> results = treeSearchEngine.search(kind, request.getQuery(), maxResults);
    return ResponseEntity.ok(TreeSearchResponse.of(kind, request.getQuery(), results));
  }

  @GetMapping("/tree")
  @Operation(summary = "Species tree in Newick format")
  public ResponseEntity<RestResponse<String>> getTree() {
    return ResponseEntity.ok(RestResponse.success("Species tree", treeService.getRawNewick()));
  }

  @GetMapping("/tree/statistics")
  @Operation(summary = "Structural statistics of the species tree")
  public ResponseEntity<RestResponse<TreeStatistics>> getTreeStatistics() {
    return ResponseEntity.ok(RestResponse.success("Tree statistics", treeService.statistics()));
  }

  @GetMapping("/status")
  @Operation(
      summary = "Engine status",
      description = "Reports what is loaded; does not trigger loading.")
  public ResponseEntity<RestResponse<EngineStatus>> getStatus() {
    EngineStatus status = dataReloadService.status();
    String message = status.treeDegraded() ? "Running on fallback tree" : "Engine status";
    return ResponseEntity.ok(RestResponse.success(message, status));
  }
}
