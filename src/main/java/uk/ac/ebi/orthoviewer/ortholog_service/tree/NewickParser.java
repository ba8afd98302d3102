package uk.ac.ebi.orthoviewer.ortholog_service.tree;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;
import uk.ac.ebi.orthoviewer.ortholog_service.parsing.ParsingException;

/**
 * Recursive-descent parser for Newick trees.
 *
 * <p>Supported: nested clades, quoted and unquoted labels ({@code ''} escapes a quote inside a
 * quoted label), branch lengths after {@code :}, bracketed comments, and a missing final {@code
 * ;}. A numeric internal label is read as the clade's support value, any other internal label as
 * its name. Leaf names must be present and unique.
 */
@Component
public class NewickParser {

  private static final String STRUCTURAL = "():,;[";

  /**
   * Parses a Newick string.
   *
   * @param newick the tree text
   * @return the root node
   * @throws ParsingException if the text is not a valid tree
   */
  public PhyloNode parse(String newick) {
    if (newick == null || newick.isBlank()) {
      throw new ParsingException("Empty Newick string");
    }
    return new Cursor(newick).parseTree();
  }

  private static final class Cursor {
    private final String text;
    private final Set<String> leafNames = new HashSet<>();
    private int pos;

    Cursor(String text) {
      this.text = text;
    }

    PhyloNode parseTree() {
      PhyloNode root = parseSubtree();
      skipIgnorable();
      if (pos < text.length() && text.charAt(pos) == ';') {
        pos++;
        skipIgnorable();
      }
      if (pos < text.length()) {
        throw error("Unexpected content after end of tree");
      }
      return root;
    }

    private PhyloNode parseSubtree() {
      skipIgnorable();
      if (peek() == '(') {
        pos++;
        List<PhyloNode> children = new ArrayList<>();
        children.add(parseSubtree());
        skipIgnorable();
        while (peek() == ',') {
          pos++;
          children.add(parseSubtree());
          skipIgnorable();
        }
        expect(')');
        String label = parseLabel();
        double length = parseBranchLength();
        Double support = null;
        if (label != null && isNumeric(label)) {
          support = Double.valueOf(label);
          label = null;
        }
        return new Clade(label, support, length, children);
      }

      String name = parseLabel();
      if (name == null || name.isEmpty()) {
        throw error("Leaf without a name");
      }
      if (!leafNames.add(name)) {
        throw error("Duplicate leaf name '" + name + "'");
      }
      return new Leaf(name, parseBranchLength());
    }

    private String parseLabel() {
      skipIgnorable();
      if (pos >= text.length()) {
        return null;
      }
      char c = text.charAt(pos);
      if (c == '\'' || c == '"') {
        return parseQuoted(c);
      }
      int start = pos;
      while (pos < text.length() && STRUCTURAL.indexOf(text.charAt(pos)) < 0) {
        pos++;
      }
      String label = text.substring(start, pos).trim();
      return label.isEmpty() ? null : label;
    }

    private String parseQuoted(char quote) {
      pos++;
      StringBuilder sb = new StringBuilder();
      while (pos < text.length()) {
        char c = text.charAt(pos++);
        if (c == quote) {
          if (pos < text.length() && text.charAt(pos) == quote) {
            sb.append(quote);
            pos++;
          } else {
            return sb.toString().trim();
          }
        } else {
          sb.append(c);
        }
      }
      throw error("Unterminated quoted label");
    }

    private double parseBranchLength() {
      skipIgnorable();
      if (peek() != ':') {
        return 0.0;
      }
      pos++;
      skipIgnorable();
      int start = pos;
      while (pos < text.length() && STRUCTURAL.indexOf(text.charAt(pos)) < 0) {
        pos++;
      }
      String value = text.substring(start, pos).trim();
      if (value.isEmpty()) {
        return 0.0;
      }
      try {
        return Double.parseDouble(value);
      } catch (NumberFormatException e) {
        throw error("Invalid branch length '" + value + "'");
      }
    }

    private void skipIgnorable() {
      while (pos < text.length()) {
        char c = text.charAt(pos);
        if (Character.isWhitespace(c)) {
          pos++;
        } else if (c == '[') {
          int end = text.indexOf(']', pos);
          if (end < 0) {
            throw error("Unterminated comment");
          }
          pos = end + 1;
        } else {
          return;
        }
      }
    }

    private char peek() {
      return pos < text.length() ? text.charAt(pos) : '\0';
    }

    private void expect(char expected) {
      if (peek() != expected) {
        throw error("Expected '" + expected + "'");
      }
      pos++;
    }

    private ParsingException error(String message) {
      return new ParsingException(message + " at position " + pos);
    }

    private static boolean isNumeric(String label) {
      try {
        Double.parseDouble(label);
        return true;
      } catch (NumberFormatException e) {
        return false;
      }
    }
  }
}
