package uk.ac.ebi.orthoviewer.ortholog_service.species;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("SpeciesMapping")
class SpeciesMappingTest {

  private SpeciesMapping mapping;

  @BeforeEach
  void setUp() {
    mapping =
        SpeciesMapping.builder(new FallbackNameGenerator())
            .add("Ath", "Arabidopsis thaliana")
            .add("Os", "Oryza sativa")
            .add("Zm", "Zea mays")
            .build();
  }

  @Nested
  @DisplayName("enhance()")
  class Enhance {

    @Test
    @DisplayName("should name a close code after the metadata species it varies")
    void shouldSynthesizeVariant() {
      SpeciesMapping enhanced = mapping.enhance(List.of("Os", "Osj"));

      SpeciesIdentity identity = enhanced.resolve("Osj");
      assertThat(identity.canonicalName()).isEqualTo("Oryza sativa (variant Osj)");
      assertThat(identity.source()).isEqualTo(NameSource.VARIANT);
      assertThat(identity.isFallback()).isTrue();
    }

    @Test
    @DisplayName("should match the two-letter prefix ignoring case")
    void shouldMatchPrefixIgnoringCase() {
      SpeciesMapping enhanced = mapping.enhance(List.of("ZMB7"));

      assertThat(enhanced.resolve("ZMB7").canonicalName()).isEqualTo("Zea mays (variant ZMB7)");
    }

    @Test
    @DisplayName("should generate a name when lengths differ by more than two")
    void shouldGenerateWhenLengthDiffers() {
      SpeciesMapping enhanced = mapping.enhance(List.of("Osativa"));

      SpeciesIdentity identity = enhanced.resolve("Osativa");
      assertThat(identity.canonicalName()).isEqualTo("Oryza sp. (Osativa)");
      assertThat(identity.source()).isEqualTo(NameSource.GENERATED);
    }

    @Test
    @DisplayName("should not change the original mapping")
    void shouldLeaveOriginalUnchanged() {
      mapping.enhance(List.of("Osj"));

      assertThat(mapping.getEnhanced()).isEmpty();
    }
  }

  @Nested
  @DisplayName("resolve()")
  class Resolve {

    @Test
    @DisplayName("should prefer the exact metadata entry")
    void shouldResolveExactCode() {
      SpeciesIdentity identity = mapping.resolve("Os");

      assertThat(identity.canonicalName()).isEqualTo("Oryza sativa");
      assertThat(identity.source()).isEqualTo(NameSource.METADATA);
      assertThat(identity.isFallback()).isFalse();
    }

    @Test
    @DisplayName("should strip digits and brackets before matching")
    void shouldResolveCleanedCode() {
      assertThat(mapping.resolve("Zm(2)").canonicalName()).isEqualTo("Zea mays");
    }

    @Test
    @DisplayName("should fall back to the first metadata code prefixing the id")
    void shouldResolveByPrefix() {
      SpeciesIdentity identity = mapping.resolve("AthCol0");

      assertThat(identity.canonicalName()).isEqualTo("Arabidopsis thaliana");
      assertThat(identity.source()).isEqualTo(NameSource.PREFIX);
    }

    @Test
    @DisplayName("should generate a name for an unknown code")
    void shouldGenerateForUnknownCode() {
      assertThat(mapping.resolve("Qr").canonicalName()).isEqualTo("Quercus sp. (Qr)");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "???", "[]", "123", "Ωmega", "a very long code with spaces"})
    @DisplayName("should always return a non-empty name")
    void shouldBeTotal(String code) {
      assertThat(mapping.resolve(code).canonicalName()).isNotBlank();
      assertThat(mapping.enhance(List.of(code)).resolve(code).canonicalName()).isNotBlank();
    }

    @Test
    @DisplayName("should name a null code")
    void shouldNameNullCode() {
      assertThat(mapping.resolve(null).canonicalName()).isEqualTo("Unknown species");
    }
  }

  @Test
  @DisplayName("codeForName() should reverse the metadata entries")
  void shouldReverseLookup() {
    assertThat(mapping.codeForName("Zea mays")).contains("Zm");
    assertThat(mapping.codeForName("Zea")).isEmpty();
  }
}
