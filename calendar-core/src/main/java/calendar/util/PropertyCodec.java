package calendar.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encodes calendar and object property maps as flat JSON objects of string values.
 *
 * <p>Used by stores that keep properties in a single text column. Nested values, numbers,
 * booleans and {@code null} are rejected on decode; key order is preserved.
 *
 * <pre>{@code
 * PropertyCodec.encode(Map.of("SUMMARY", "Standup"));   // {"SUMMARY":"Standup"}
 * PropertyCodec.decode("{\"SUMMARY\":\"Standup\"}");    // {SUMMARY=Standup}
 * }</pre>
 */
public final class PropertyCodec {

  private PropertyCodec() {
  }

  /**
   * @param properties the map to encode, may be {@code null}
   * @return a JSON object, {@code "{}"} for a null or empty map
   */
  public static String encode(Map<String, String> properties) {
    if (properties == null || properties.isEmpty()) {
      return "{}";
    }
    StringBuilder out = new StringBuilder(properties.size() * 16);
    out.append('{');
    String separator = "";
    for (Map.Entry<String, String> entry : properties.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        throw new IllegalArgumentException("properties cannot contain null keys or values");
      }
      out.append(separator);
      quote(out, entry.getKey());
      out.append(':');
      quote(out, entry.getValue());
      separator = ",";
    }
    return out.append('}').toString();
  }

  /**
   * @param json a JSON object of string values, may be {@code null} or blank
   * @return the decoded map in document order, never {@code null}
   * @throws IllegalArgumentException if {@code json} is not such an object
   */
  public static Map<String, String> decode(String json) {
    if (json == null || json.isBlank()) {
      return Collections.emptyMap();
    }
    return new Cursor(json).readObject();
  }

  private static void quote(StringBuilder out, String value) {
    out.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '"' || c == '\\') {
        out.append('\\').append(c);
      } else if (c == '\n') {
        out.append("\\n");
      } else if (c == '\r') {
        out.append("\\r");
      } else if (c == '\t') {
        out.append("\\t");
      } else if (c < 0x20) {
        out.append(String.format("\\u%04x", (int) c));
      } else {
        out.append(c);
      }
    }
    out.append('"');
  }

  private static final class Cursor {
    private final String text;
    private int pos;

    Cursor(String text) {
      this.text = text;
    }

    Map<String, String> readObject() {
      expect('{');
      Map<String, String> result = new LinkedHashMap<>();
      if (peek() == '}') {
        pos++;
        return finish(result);
      }
      while (true) {
        String key = readString();
        expect(':');
        result.put(key, readString());
        char next = next();
        if (next == '}') {
          return finish(result);
        }
        if (next != ',') {
          throw error("expected ',' or '}'");
        }
      }
    }

    private Map<String, String> finish(Map<String, String> result) {
      skipWhitespace();
      if (pos != text.length()) {
        throw error("trailing content");
      }
      return result;
    }

    private String readString() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (pos < text.length()) {
        char c = text.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= text.length()) {
          break;
        }
        char escaped = text.charAt(pos++);
        switch (escaped) {
          case '"', '\\', '/' -> sb.append(escaped);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> sb.append(readUnicode());
          default -> throw error("unsupported escape \\" + escaped);
        }
      }
      throw error("unterminated string");
    }

    private char readUnicode() {
      if (pos + 4 > text.length()) {
        throw error("truncated unicode escape");
      }
      String hex = text.substring(pos, pos + 4);
      pos += 4;
      try {
        return (char) Integer.parseInt(hex, 16);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid unicode escape \\u" + hex, e);
      }
    }

    private void expect(char expected) {
      if (next() != expected) {
        throw error("expected '" + expected + "'");
      }
    }

    private char next() {
      skipWhitespace();
      if (pos >= text.length()) {
        throw error("unexpected end of input");
      }
      return text.charAt(pos++);
    }

    private char peek() {
      skipWhitespace();
      return pos < text.length() ? text.charAt(pos) : 0;
    }

    private void skipWhitespace() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }

    private IllegalArgumentException error(String detail) {
      return new IllegalArgumentException("Invalid property JSON at offset " + pos + ": " + detail);
    }
  }
}
