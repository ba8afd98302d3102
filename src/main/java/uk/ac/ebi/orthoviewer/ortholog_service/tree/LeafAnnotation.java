package uk.ac.ebi.orthoviewer.ortholog_service.tree;

import uk.ac.ebi.orthoviewer.ortholog_service.species.SpeciesIdentity;

/**
 * Data attached to a tree leaf at bind time.
 *
 * @param identity resolved species identity of the leaf's code
 * @param genomeGeneCount number of genes of this species over the whole orthogroup table
 * @param inTable whether the code is a species column of the orthogroup table
 */
public record LeafAnnotation(SpeciesIdentity identity, int genomeGeneCount, boolean inTable) {

  public String fullName() {
    return identity.canonicalName();
  }
}
