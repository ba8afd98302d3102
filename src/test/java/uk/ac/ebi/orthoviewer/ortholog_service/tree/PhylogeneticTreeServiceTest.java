package uk.ac.ebi.orthoviewer.ortholog_service.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import uk.ac.ebi.orthoviewer.ortholog_service.config.OrthoDataConfig;
import uk.ac.ebi.orthoviewer.ortholog_service.exceptions.DataNotFoundException;
import uk.ac.ebi.orthoviewer.ortholog_service.orthogroup.OrthogroupRepository;
import uk.ac.ebi.orthoviewer.ortholog_service.orthogroup.OrthogroupRow;
import uk.ac.ebi.orthoviewer.ortholog_service.orthogroup.OrthogroupTable;
import uk.ac.ebi.orthoviewer.ortholog_service.species.FallbackNameGenerator;
import uk.ac.ebi.orthoviewer.ortholog_service.species.SpeciesMapping;
import uk.ac.ebi.orthoviewer.ortholog_service.species.SpeciesResolver;
import uk.ac.ebi.orthoviewer.ortholog_service.util.DataFileReader;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("PhylogeneticTreeService")
class PhylogeneticTreeServiceTest {

  @Mock private DataFileReader dataFileReader;
  @Mock private OrthogroupRepository orthogroupRepository;
  @Mock private SpeciesResolver speciesResolver;

  private OrthoDataConfig config;
  private PhylogeneticTreeService service;

  @BeforeEach
  void setUp() {
    config = new OrthoDataConfig();

    Map<String, List<String>> cells = new LinkedHashMap<>();
    cells.put("At", List.of("AT1", "AT2"));
    cells.put("Os", List.of("OS1"));
    OrthogroupTable table =
        new OrthogroupTable(List.of("At", "Os"), List.of(new OrthogroupRow("OG1", cells)), 0);
    when(orthogroupRepository.getTable()).thenReturn(table);

    SpeciesMapping mapping =
        SpeciesMapping.builder(new FallbackNameGenerator())
            .add("At", "Arabidopsis thaliana")
            .add("Os", "Oryza sativa")
            .build();
    when(speciesResolver.resolve(anyString()))
        .thenAnswer(invocation -> mapping.resolve(invocation.getArgument(0)));

    service =
        new PhylogeneticTreeService(
            config,
            dataFileReader,
            new NewickParser(),
            new LeafBinder(speciesResolver),
            orthogroupRepository);
  }

  @Test
  @DisplayName("should bind names and genome-wide gene counts to leaves")
  void shouldBindLeaves() {
    when(dataFileReader.readAll(config.getTreeLocation())).thenReturn("(At:1,('Os':1,Zm:1):1);\n");

    BoundTree bound = service.getBoundTree();

    assertThat(bound.isDegraded()).isFalse();
    int at = bound.findLeaf("At").orElseThrow();
    int os = bound.findLeaf("Os").orElseThrow();
    assertThat(bound.fullNameOf(at)).isEqualTo("Arabidopsis thaliana");
    assertThat(bound.genomeGeneCountOf(at)).isEqualTo(2);
    assertThat(bound.genomeGeneCountOf(os)).isEqualTo(1);
    assertThat(bound.fullNameOf(bound.findLeaf("Zm").orElseThrow())).isEqualTo("Zea sp. (Zm)");
    assertThat(bound.unboundLeaves()).containsExactly("Zm");
    assertThat(service.getRawNewick()).isEqualTo("(At:1,('Os':1,Zm:1):1);");
  }

  @Test
  @DisplayName("should substitute the fallback tree for an unparsable source")
  void shouldFallBackOnParseError() {
    when(dataFileReader.readAll(config.getTreeLocation())).thenReturn("(At,(Os;");

    BoundTree bound = service.getBoundTree();

    assertThat(bound.isDegraded()).isTrue();
    assertThat(bound.getTree().leafIndexes()).hasSize(2);
    assertThat(bound.findLeaf("A")).isPresent();
    assertThat(service.getRawNewick()).isEqualTo(config.getFallbackNewick());
  }

  @Test
  @DisplayName("should fail when the tree file is missing")
  void shouldFailOnMissingFile() {
    when(dataFileReader.readAll(config.getTreeLocation()))
        .thenThrow(new DataNotFoundException("Data file not found"));

    assertThatThrownBy(() -> service.getBoundTree()).isInstanceOf(DataNotFoundException.class);
    assertThat(service.isLoaded()).isFalse();
  }

  @Test
  @DisplayName("should parse once and again only on reload")
  void shouldParseOnceUntilReload() {
    when(dataFileReader.readAll(config.getTreeLocation())).thenReturn("(At,Os);");

    service.getBoundTree();
    service.getRawNewick();
    service.statistics();
    verify(dataFileReader, times(1)).readAll(config.getTreeLocation());

    service.reload();
    verify(dataFileReader, times(2)).readAll(config.getTreeLocation());
  }
}
