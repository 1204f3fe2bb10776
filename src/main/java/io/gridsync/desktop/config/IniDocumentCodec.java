package io.gridsync.desktop.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes/encodes the grouped {@code [section]} / {@code option = value} text format used by
 * {@code preferences.ini}.
 *
 * <p>Section and option names are case-sensitive. Blank lines and lines starting with {@code #} or
 * {@code ;} are ignored. Both {@code =} and {@code :} separate an option from its value; the first
 * separator wins so values may contain either character. Options that appear before any section
 * header are dropped.
 */
public final class IniDocumentCodec {

  private IniDocumentCodec() {}

  public static Map<String, Map<String, String>> decode(List<String> lines) {
    Map<String, Map<String, String>> doc = new LinkedHashMap<>();
    if (lines == null) return doc;

    Map<String, String> current = null;
    for (String raw : lines) {
      if (raw == null) continue;
      String line = raw.strip();
      if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) continue;

      if (line.startsWith("[") && line.endsWith("]")) {
        String section = line.substring(1, line.length() - 1).strip();
        current = section.isEmpty() ? null : doc.computeIfAbsent(section, k -> new LinkedHashMap<>());
        continue;
      }
      if (current == null) continue;

      int sep = separatorIndex(line);
      if (sep <= 0) continue;
      String option = line.substring(0, sep).strip();
      String value = line.substring(sep + 1).strip();
      if (option.isEmpty()) continue;
      current.put(option, value);
    }
    return doc;
  }

  public static String encode(Map<String, Map<String, String>> doc) {
    StringBuilder sb = new StringBuilder();
    if (doc == null) return "";
    for (Map.Entry<String, Map<String, String>> section : doc.entrySet()) {
      if (sb.length() > 0) sb.append('\n');
      sb.append('[').append(section.getKey()).append("]\n");
      for (Map.Entry<String, String> option : section.getValue().entrySet()) {
        sb.append(option.getKey()).append(" = ").append(option.getValue()).append('\n');
      }
    }
    return sb.toString();
  }

  /**
   * Section and option names must be non-blank single-line tokens without brackets or separators,
   * and must not start with a comment marker.
   */
  static boolean isValidName(String name) {
    if (name == null || name.isBlank()) return false;
    if (!name.equals(name.strip())) return false;
    if (name.charAt(0) == '#' || name.charAt(0) == ';') return false;
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (c == '\n' || c == '\r' || c == '[' || c == ']' || c == '=' || c == ':') return false;
    }
    return true;
  }

  /** Values are single-line and carry no leading or trailing whitespace, which decoding strips. */
  static boolean isValidValue(String value) {
    if (value == null) return false;
    if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) return false;
    return value.equals(value.strip());
  }

  private static int separatorIndex(String line) {
    int eq = line.indexOf('=');
    int colon = line.indexOf(':');
    if (eq < 0) return colon;
    if (colon < 0) return eq;
    return Math.min(eq, colon);
  }
}
