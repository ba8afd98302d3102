package uk.ac.ebi.orthoviewer.ortholog_service.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import uk.ac.ebi.orthoviewer.ortholog_service.config.OrthoDataConfig;
import uk.ac.ebi.orthoviewer.ortholog_service.orthogroup.OrthogroupRepository;
import uk.ac.ebi.orthoviewer.ortholog_service.species.FallbackNameGenerator;
import uk.ac.ebi.orthoviewer.ortholog_service.species.NameSource;
import uk.ac.ebi.orthoviewer.ortholog_service.species.SpeciesIdentity;
import uk.ac.ebi.orthoviewer.ortholog_service.tree.BoundTree;
import uk.ac.ebi.orthoviewer.ortholog_service.tree.Leaf;
import uk.ac.ebi.orthoviewer.ortholog_service.tree.LeafAnnotation;
import uk.ac.ebi.orthoviewer.ortholog_service.tree.NewickParser;
import uk.ac.ebi.orthoviewer.ortholog_service.tree.PhylogeneticTree;
import uk.ac.ebi.orthoviewer.ortholog_service.tree.PhylogeneticTreeService;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("TreeSearchEngine")
class TreeSearchEngineTest {

  private static final String PLANTS = "(At:0.5,((Os:0.2,Osj:0.1)95:0.3,Zm:0.4)80:0.2);";

  @Mock private PhylogeneticTreeService treeService;
  @Mock private OrthogroupRepository orthogroupRepository;

  private OrthoDataConfig config;
  private TreeSearchEngine engine;

  @BeforeEach
  void setUp() {
    config = new OrthoDataConfig();
    engine = new TreeSearchEngine(treeService, orthogroupRepository, config);
    useTree(
        PLANTS,
        Map.of(
            "At", "Arabidopsis thaliana",
            "Os", "Oryza sativa",
            "Osj", "Oryza sativa (variant Osj)",
            "Zm", "Zea mays"),
        Map.of("At", 3, "Os", 4, "Osj", 1, "Zm", 3));
  }

  private BoundTree useTree(
      String newick, Map<String, String> names, Map<String, Integer> geneTotals) {
    PhylogeneticTree tree = PhylogeneticTree.of(new NewickParser().parse(newick));
    FallbackNameGenerator generator = new FallbackNameGenerator();
    Map<Integer, LeafAnnotation> annotations = new HashMap<>();
    for (int leaf : tree.leafIndexes()) {
      String code = ((Leaf) tree.node(leaf)).name();
      SpeciesIdentity identity =
          names.containsKey(code)
              ? new SpeciesIdentity(code, names.get(code), NameSource.METADATA)
              : new SpeciesIdentity(code, generator.generate(code), NameSource.GENERATED);
      annotations.put(leaf, new LeafAnnotation(identity, geneTotals.getOrDefault(code, 0), true));
    }
    BoundTree bound = new BoundTree(tree, annotations, newick, false);
    when(treeService.getBoundTree()).thenReturn(bound);
    return bound;
  }

  @Nested
  @DisplayName("searchBySpecies()")
  class SearchBySpecies {

    @Test
    @DisplayName("should match every leaf for an empty query")
    void emptyQueryShouldMatchEveryLeaf() {
      List<SearchResult> results = engine.searchBySpecies("", 0);

      assertThat(results)
          .extracting(SearchResult::nodeName)
          .containsExactly(
              "Arabidopsis thaliana", "Oryza sativa", "Oryza sativa (variant Osj)", "Zea mays");
    }

    @Test
    @DisplayName("should match code, name and name words ignoring case, in pre-order")
    void shouldMatchIgnoringCase() {
      assertThat(engine.searchBySpecies("ORYZA", 0))
          .extracting(SearchResult::nodeName)
          .containsExactly("Oryza sativa", "Oryza sativa (variant Osj)");
      assertThat(engine.searchBySpecies("osj", 0))
          .extracting(SearchResult::nodeName)
          .containsExactly("Oryza sativa (variant Osj)");
    }

    @Test
    @DisplayName("should describe a leaf with its genome-wide gene count and distance")
    void shouldDescribeLeaf() {
      SearchResult result = engine.searchBySpecies("mays", 0).get(0);

      assertThat(result.nodeType()).isEqualTo("leaf");
      assertThat(result.speciesCount()).isEqualTo(1);
      assertThat(result.geneCount()).isEqualTo(3);
      assertThat(result.distanceToRoot()).isCloseTo(0.6, within(1e-9));
      assertThat(result.supportValue()).isNull();
      assertThat(result.cladeMembers()).containsExactly("Zea mays");
    }

    @Test
    @DisplayName("should stop at maxResults")
    void shouldStopAtMaxResults() {
      assertThat(engine.searchBySpecies("", 2)).hasSize(2);
    }

    @Test
    @DisplayName("should return nothing for an unmatched query")
    void shouldReturnEmptyOnMiss() {
      assertThat(engine.searchBySpecies("Quercus", 0)).isEmpty();
    }
  }

  @Nested
  @DisplayName("searchByClade()")
  class SearchByClade {

    @Test
    @DisplayName("should report the true species count of every matching clade")
    void speciesCountShouldMatchLeafCount() {
      List<SearchResult> results = engine.searchByClade("oryza", 0);

      assertThat(results).hasSize(3);
      PhylogeneticTree tree = treeService.getBoundTree().getTree();
      List<Integer> internal = tree.levelOrder().stream().filter(i -> !tree.isLeaf(i)).toList();
      for (int i = 0; i < results.size(); i++) {
        int expected = tree.leavesUnder(internal.get(i)).size();
        assertThat(results.get(i).speciesCount()).isEqualTo(expected);
      }
    }

    @Test
    @DisplayName("should sum genome-wide counts and carry support values")
    void shouldDescribeClade() {
      SearchResult cereals = engine.searchByClade("zea", 0).get(1);

      assertThat(cereals.nodeName()).isEqualTo("Clade with 3 species");
      assertThat(cereals.nodeType()).isEqualTo("internal");
      assertThat(cereals.geneCount()).isEqualTo(8);
      assertThat(cereals.supportValue()).isEqualTo(80.0);
      assertThat(cereals.distanceToRoot()).isCloseTo(0.2, within(1e-9));
      assertThat(cereals.cladeMembers())
          .containsExactly("Oryza sativa", "Oryza sativa (variant Osj)", "Zea mays");
    }

    @Test
    @DisplayName("should visit clades in level order before applying the limit")
    void shouldVisitCladesInLevelOrder() {
      useTree("(((A:1,B:1):1,C:1):1,(D:1,E:1):1);", Map.of(), Map.of());

      List<SearchResult> results = engine.searchByClade("", 3);

      assertEquals(3, results.size());
      assertEquals(5, results.get(0).speciesCount());
      assertEquals(3, results.get(1).speciesCount());
      assertEquals(
          List.of("Daucus sp. (D)", "Eucalyptus sp. (E)"), results.get(2).cladeMembers());
      assertEquals(1.0, results.get(2).distanceToRoot(), 1e-9);
    }

    @Test
    @DisplayName("should truncate members but not the species count")
    void shouldTruncateMembers() {
      config.setCladeMemberLimit(2);

      SearchResult root = engine.searchByClade("", 1).get(0);

      assertThat(root.speciesCount()).isEqualTo(4);
      assertThat(root.cladeMembers()).hasSize(2);
    }

    @Test
    @DisplayName("should ignore leaves")
    void shouldIgnoreLeaves() {
      assertThat(engine.searchByClade("thaliana", 0))
          .extracting(SearchResult::nodeType)
          .containsOnly("internal");
    }
  }

  @Nested
  @DisplayName("findCommonAncestor()")
  class FindCommonAncestor {

    @Test
    @DisplayName("should find the clade joining two sister species")
    void shouldFindSisterClade() {
      useTree("(A:1,(B:1,C:1):1);", Map.of(), Map.of());

      List<SearchResult> results = engine.findCommonAncestor(List.of("B", "C"));

      assertThat(results).hasSize(1);
      SearchResult ancestor = results.get(0);
      assertThat(ancestor.nodeType()).isEqualTo("internal");
      assertThat(ancestor.speciesCount()).isEqualTo(2);
      assertThat(ancestor.cladeMembers()).containsExactly("Brassica sp. (B)", "Citrus sp. (C)");
      assertThat(ancestor.nodeName()).isEqualTo("Common ancestor of B, C");
    }

    @Test
    @DisplayName("should match names by substring and list every member")
    void shouldMatchBySubstring() {
      config.setCladeMemberLimit(1);

      SearchResult ancestor = engine.findCommonAncestor(List.of("thaliana", "mays")).get(0);

      assertThat(ancestor.speciesCount()).isEqualTo(4);
      assertThat(ancestor.cladeMembers()).hasSize(4);
      assertThat(ancestor.distanceToRoot()).isZero();
    }

    @Test
    @DisplayName("should pick the first matching leaf for an ambiguous name")
    void shouldPickFirstMatch() {
      SearchResult ancestor = engine.findCommonAncestor(List.of("sativa", "Zm")).get(0);

      assertThat(ancestor.cladeMembers())
          .containsExactly("Oryza sativa", "Oryza sativa (variant Osj)", "Zea mays");
      assertThat(ancestor.supportValue()).isEqualTo(80.0);
    }

    @Test
    @DisplayName("should return the species' own leaf when both names resolve to it")
    void shouldReturnLeafForSameSpecies() {
      SearchResult ancestor = engine.findCommonAncestor(List.of("Os", "Oryza sativa")).get(0);

      assertThat(ancestor.nodeType()).isEqualTo("leaf");
      assertThat(ancestor.cladeMembers()).containsExactly("Oryza sativa");
    }

    @Test
    @DisplayName("should return nothing when fewer than two species resolve")
    void shouldRequireTwoLeaves() {
      assertThat(engine.findCommonAncestor(List.of("Zm", "Quercus"))).isEmpty();
      assertThat(engine.findCommonAncestor(List.of())).isEmpty();
    }
  }

  @Nested
  @DisplayName("searchByGene()")
  class SearchByGene {

    @BeforeEach
    void setUpGenes() {
      Map<String, List<String>> genes = new LinkedHashMap<>();
      genes.put("At", List.of("AT3"));
      genes.put("Os", List.of("OS2", "OS3"));
      genes.put("Xx", List.of("XX1"));
      when(orthogroupRepository.findGeneOrthogroup("OS2")).thenReturn(Optional.of("OG002"));
      when(orthogroupRepository.getOrthogroupGenes("OG002")).thenReturn(genes);
    }

    @Test
    @DisplayName("should return the leaves of species with genes, counted within the orthogroup")
    void shouldReturnLeavesOfOrthogroupSpecies() {
      List<SearchResult> results = engine.searchByGene("OS2", 0);

      assertThat(results)
          .extracting(SearchResult::nodeName)
          .containsExactly("Arabidopsis thaliana", "Oryza sativa");
      assertThat(results).extracting(SearchResult::geneCount).containsExactly(1, 2);
      assertThat(results.get(1).distanceToRoot()).isCloseTo(0.7, within(1e-9));
    }

    @Test
    @DisplayName("should truncate to maxResults")
    void shouldTruncate() {
      assertThat(engine.searchByGene("OS2", 1)).hasSize(1);
    }

    @Test
    @DisplayName("should return nothing for an unknown gene")
    void shouldReturnEmptyForUnknownGene() {
      when(orthogroupRepository.findGeneOrthogroup("NOPE")).thenReturn(Optional.empty());

      assertThat(engine.searchByGene("NOPE", 0)).isEmpty();
    }
  }

  @Test
  @DisplayName("search() should split a common ancestor query on commas")
  void searchShouldSplitCommonAncestorQuery() {
    List<SearchResult> results = engine.search(SearchKind.COMMON_ANCESTOR, " Os , ,Zm ", 50);

    assertThat(results).hasSize(1);
    assertThat(results.get(0).speciesCount()).isEqualTo(3);
  }

  @Test
  @DisplayName("search() should treat a null query as empty")
  void searchShouldTreatNullAsEmpty() {
    assertThat(engine.search(SearchKind.SPECIES, null, 0)).hasSize(4);
  }
}
