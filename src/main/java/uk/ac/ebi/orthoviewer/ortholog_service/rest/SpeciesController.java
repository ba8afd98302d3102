package uk.ac.ebi.orthoviewer.ortholog_service.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.ac.ebi.orthoviewer.ortholog_service.species.SpeciesIdentity;
import uk.ac.ebi.orthoviewer.ortholog_service.species.SpeciesResolver;
import uk.ac.ebi.orthoviewer.ortholog_service.status.DataReloadService;
import uk.ac.ebi.orthoviewer.ortholog_service.status.SpeciesSummary;

@RestController
@RequestMapping("/api/species")
@Tag(name = "Species", description = "Species of the orthogroup table and their names.")
public class SpeciesController {

  private final SpeciesResolver speciesResolver;
  private final DataReloadService dataReloadService;

  public SpeciesController(SpeciesResolver speciesResolver, DataReloadService dataReloadService) {
    this.speciesResolver = speciesResolver;
    this.dataReloadService = dataReloadService;
  }

  @GetMapping
  @Operation(summary = "List every species of the orthogroup table")
  public ResponseEntity<RestResponse<List<SpeciesSummary>>> listSpecies() {
    List<SpeciesSummary> species = dataReloadService.listSpecies();
    return ResponseEntity.ok(
        RestResponse.success(String.format("Found %d species", species.size()), species));
  }

  /** Always 200: any code resolves to a name, generated if need be. */
  @GetMapping("/{code}/name")
  @Operation(summary = "Resolve a species code to its name")
  public ResponseEntity<RestResponse<SpeciesIdentity>> resolveName(
      @Parameter(description = "Species code", example = "Ath") @PathVariable String code) {
    SpeciesIdentity identity = speciesResolver.resolve(code);
    return ResponseEntity.ok(RestResponse.success("Species resolved", identity));
  }
}
