package uk.ac.ebi.orthoviewer.ortholog_service.util;

import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/** Helpers for splitting delimited text lines into trimmed, unquoted cells. */
public final class DelimitedLines {

  private DelimitedLines() {
    throw new UnsupportedOperationException("Utility class cannot be instantiated");
  }

  /**
   * Splits a line on the delimiter, keeping trailing empty cells, and normalises every cell.
   *
   * @param line the raw line
   * @param delimiter literal delimiter
   * @return normalised cells; never null
   */
  public static String[] split(String line, String delimiter) {
    String[] cells = line.split(Pattern.quote(delimiter), -1);
    for (int i = 0; i < cells.length; i++) {
      cells[i] = clean(cells[i]);
    }
    return cells;
  }

  /**
   * Trims whitespace and strips one level of surrounding single or double quotes.
   *
   * @param value raw value, may be null
   * @return cleaned value; empty string for null
   */
  public static String clean(String value) {
    if (value == null) {
      return "";
    }
    String trimmed = value.trim();
    if (trimmed.length() >= 2
        && ((trimmed.startsWith("\"") && trimmed.endsWith("\""))
            || (trimmed.startsWith("'") && trimmed.endsWith("'")))) {
      trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
    }
    return StringUtils.defaultString(trimmed);
  }
}
