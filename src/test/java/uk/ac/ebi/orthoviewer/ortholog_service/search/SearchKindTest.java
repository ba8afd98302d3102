package uk.ac.ebi.orthoviewer.ortholog_service.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.ac.ebi.orthoviewer.ortholog_service.exceptions.UnknownSearchKindException;

@DisplayName("SearchKind")
class SearchKindTest {

  @Test
  @DisplayName("should parse wire names ignoring case and dashes")
  void shouldParseWireNames() {
    assertEquals(SearchKind.GENE, SearchKind.fromString("gene"));
    assertEquals(SearchKind.SPECIES, SearchKind.fromString(" Species "));
    assertEquals(SearchKind.COMMON_ANCESTOR, SearchKind.fromString("common-ancestor"));
  }

  @Test
  @DisplayName("should reject unknown kinds")
  void shouldRejectUnknownKinds() {
    UnknownSearchKindException thrown =
        assertThrows(UnknownSearchKindException.class, () -> SearchKind.fromString("subtree"));
    assertEquals("Unknown search type: subtree", thrown.getMessage());
    assertThrows(UnknownSearchKindException.class, () -> SearchKind.fromString(null));
  }
}
