package uk.ac.ebi.orthoviewer.ortholog_service.species;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Immutable species code / name lookup. Built via {@link Builder} from the metadata table, then
 * extended by {@link #enhance(Collection)} with synthesized names for codes the metadata lacks.
 *
 * <p>{@link #resolve(String)} is total: every input yields a non-empty name.
 */
@Slf4j
@Getter
public class SpeciesMapping {

  private static final Pattern NON_CODE_CHARACTERS = Pattern.compile("[0-9()\\[\\]{}]");

  /** Metadata code to full name, in metadata file order. */
  private final Map<String, String> codeToName;

  /** Metadata full name to code. */
  private final Map<String, String> nameToCode;

  /** Synthesized identities for codes seen in the orthogroup table but absent from metadata. */
  private final Map<String, SpeciesIdentity> enhanced;

  private final FallbackNameGenerator generator;

  private SpeciesMapping(
      Map<String, String> codeToName,
      Map<String, String> nameToCode,
      Map<String, SpeciesIdentity> enhanced,
      FallbackNameGenerator generator) {
    this.codeToName = Collections.unmodifiableMap(new LinkedHashMap<>(codeToName));
    this.nameToCode = Collections.unmodifiableMap(new LinkedHashMap<>(nameToCode));
    this.enhanced = Collections.unmodifiableMap(new LinkedHashMap<>(enhanced));
    this.generator = generator;
  }

  public static Builder builder(FallbackNameGenerator generator) {
    return new Builder(generator);
  }

  /**
   * Returns a mapping that also knows every given code missing from the metadata.
   *
   * <p>For each missing code the first metadata code (in file order) sharing its first two
   * letters, case-insensitively, and differing in length by at most 2 gives the name {@code "<name>
   * (variant <code>)"}. Without such a code the fallback generator names it.
   *
   * @param codes codes seen in the orthogroup table
   * @return a new mapping; this one is unchanged
   */
  public SpeciesMapping enhance(Collection<String> codes) {
    Map<String, SpeciesIdentity> additions = new LinkedHashMap<>(enhanced);
    for (String code : codes) {
      if (code == null || code.isBlank() || codeToName.containsKey(code)) {
        continue;
      }
      additions.put(code, synthesize(code));
    }
    return new SpeciesMapping(codeToName, nameToCode, additions, generator);
  }

  private SpeciesIdentity synthesize(String missingCode) {
    Optional<String> variantOf = findVariantOf(missingCode);
    if (variantOf.isPresent()) {
      String name = codeToName.get(variantOf.get()) + " (variant " + missingCode + ")";
      log.debug("Partial match: '{}' -> '{}'", missingCode, name);
      return new SpeciesIdentity(missingCode, name, NameSource.VARIANT);
    }
    String name = generator.generate(missingCode);
    log.debug("Fallback name: '{}' -> '{}'", missingCode, name);
    return new SpeciesIdentity(missingCode, name, NameSource.GENERATED);
  }

  private Optional<String> findVariantOf(String missingCode) {
    if (missingCode.length() < 2) {
      return Optional.empty();
    }
    String prefix = missingCode.substring(0, 2);
    for (String mapped : codeToName.keySet()) {
      if (mapped.length() >= 2
          && mapped.substring(0, 2).equalsIgnoreCase(prefix)
          && Math.abs(mapped.length() - missingCode.length()) <= 2) {
        return Optional.of(mapped);
      }
    }
    return Optional.empty();
  }

  /**
   * Resolves a species code to its identity.
   *
   * <p>Order: exact metadata code, synthesized entry from {@link #enhance(Collection)}, exact
   * metadata code after removing digits and brackets, first metadata code the cleaned identifier
   * starts with, and finally a generated name.
   *
   * @param code any string
   * @return the identity; its name is never empty
   */
  public SpeciesIdentity resolve(String code) {
    if (code == null || code.isBlank()) {
      return new SpeciesIdentity(
          code == null ? "" : code, generator.generate(code), NameSource.GENERATED);
    }
    String trimmed = code.trim();
    String name = codeToName.get(trimmed);
    if (name != null) {
      return new SpeciesIdentity(trimmed, name, NameSource.METADATA);
    }
    SpeciesIdentity synthesized = enhanced.get(trimmed);
    if (synthesized != null) {
      return synthesized;
    }

    String cleaned = NON_CODE_CHARACTERS.matcher(trimmed).replaceAll("").trim();
    if (!cleaned.isEmpty()) {
      name = codeToName.get(cleaned);
      if (name != null) {
        return new SpeciesIdentity(trimmed, name, NameSource.METADATA);
      }
      for (Map.Entry<String, String> entry : codeToName.entrySet()) {
        if (!entry.getKey().isEmpty() && cleaned.startsWith(entry.getKey())) {
          log.debug("Prefix match: '{}' -> '{}'", trimmed, entry.getValue());
          return new SpeciesIdentity(trimmed, entry.getValue(), NameSource.PREFIX);
        }
      }
    }
    return new SpeciesIdentity(trimmed, generator.generate(trimmed), NameSource.GENERATED);
  }

  /** Code recorded in metadata for a full species name, compared exactly. */
  public Optional<String> codeForName(String fullName) {
    return Optional.ofNullable(nameToCode.get(fullName));
  }

  public boolean isEmpty() {
    return codeToName.isEmpty();
  }

  /** Fluent builder for incremental population while reading the metadata table. */
  public static class Builder {
    private final Map<String, String> codeToName = new LinkedHashMap<>();
    private final Map<String, String> nameToCode = new LinkedHashMap<>();
    private final FallbackNameGenerator generator;

    private Builder(FallbackNameGenerator generator) {
      this.generator = generator;
    }

    public Builder add(String code, String fullName) {
      codeToName.put(code, fullName);
      nameToCode.put(fullName, code);
      return this;
    }

    public SpeciesMapping build() {
      return new SpeciesMapping(codeToName, nameToCode, Map.of(), generator);
    }
  }
}
