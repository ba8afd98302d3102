package uk.ac.ebi.orthoviewer.ortholog_service.species;

import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Synthesizes a species name for a code that has no metadata entry.
 *
 * <p>The genus hint table below is the only one in the application. A code whose first letter
 * (case-insensitive) has hints becomes {@code "<first genus> sp. (<code>)"}; any other code becomes
 * {@code "Species <code>"}. The first candidate is always used, so the result depends only on the
 * code.
 */
@Component
public class FallbackNameGenerator {

  static final Map<Character, List<String>> GENUS_HINTS =
      Map.ofEntries(
          Map.entry('A', List.of("Arabidopsis", "Aegilops", "Actinidia", "Amaranthus", "Acorus")),
          Map.entry('B', List.of("Brassica", "Beta", "Bambusa")),
          Map.entry(
              'C', List.of("Citrus", "Cannabis", "Cucumis", "Coffea", "Camelina", "Capsella")),
          Map.entry('D', List.of("Daucus")),
          Map.entry('E', List.of("Eucalyptus")),
          Map.entry('F', List.of("Fragaria")),
          Map.entry('G', List.of("Glycine", "Gossypium")),
          Map.entry('H', List.of("Helianthus", "Hordeum")),
          Map.entry('L', List.of("Lotus", "Lupinus", "Lactuca", "Linum")),
          Map.entry('M', List.of("Medicago", "Malus", "Musa", "Manihot")),
          Map.entry('N', List.of("Nicotiana", "Nelumbo")),
          Map.entry('O', List.of("Oryza", "Olea")),
          Map.entry('P', List.of("Populus", "Pisum", "Prunus", "Panicum", "Phaseolus")),
          Map.entry('Q', List.of("Quercus")),
          Map.entry('R', List.of("Ricinus")),
          Map.entry('S', List.of("Solanum", "Sorghum", "Setaria", "Sesamum")),
          Map.entry('T', List.of("Triticum", "Theobroma", "Trifolium")),
          Map.entry('V', List.of("Vigna", "Vitis")),
          Map.entry('W', List.of("Wheat line")),
          Map.entry('Z', List.of("Zea")));

  static final String UNKNOWN_SPECIES = "Unknown species";

  /**
   * Generates a name for the code.
   *
   * @param code species code; may be blank
   * @return a non-empty name
   */
  public String generate(String code) {
    if (code == null || code.isBlank()) {
      return UNKNOWN_SPECIES;
    }
    String trimmed = code.trim();
    List<String> genera = GENUS_HINTS.get(Character.toUpperCase(trimmed.charAt(0)));
    if (genera != null) {
      return genera.get(0) + " sp. (" + trimmed + ")";
    }
    return "Species " + trimmed;
  }
}
