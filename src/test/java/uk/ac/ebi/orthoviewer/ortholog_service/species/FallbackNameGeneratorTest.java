package uk.ac.ebi.orthoviewer.ortholog_service.species;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FallbackNameGenerator")
class FallbackNameGeneratorTest {

  private final FallbackNameGenerator generator = new FallbackNameGenerator();

  @Test
  @DisplayName("should use the first genus hinted for the code's first letter")
  void shouldUseFirstGenusHint() {
    assertEquals("Arabidopsis sp. (Ath)", generator.generate("Ath"));
    assertEquals("Zea sp. (zm2)", generator.generate("zm2"));
    assertEquals("Wheat line sp. (Wx)", generator.generate("Wx"));
  }

  @Test
  @DisplayName("should fall back to a generic name for letters without hints")
  void shouldUseGenericName() {
    assertEquals("Species Xyz", generator.generate("Xyz"));
    assertEquals("Species 1abc", generator.generate("1abc"));
  }

  @Test
  @DisplayName("should name blank codes")
  void shouldNameBlankCodes() {
    assertEquals("Unknown species", generator.generate(null));
    assertEquals("Unknown species", generator.generate("  "));
  }

  @Test
  @DisplayName("should be deterministic")
  void shouldBeDeterministic() {
    assertEquals(generator.generate("Cs"), generator.generate("Cs"));
  }
}
