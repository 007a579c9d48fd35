package cable.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in {@link JsonCodec} for flat string-to-string JSON objects.
 *
 * <p>Keys keep their insertion order. {@code null} values are written as JSON {@code null}
 * and skipped when reading, since metadata never holds null values.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return null;
    }
    StringBuilder out = new StringBuilder(16 + metadata.size() * 16);
    out.append('{');
    for (Map.Entry<String, String> entry : metadata.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("metadata cannot contain null keys");
      }
      if (out.length() > 1) {
        out.append(',');
      }
      writeString(out, entry.getKey());
      out.append(':');
      if (entry.getValue() == null) {
        out.append("null");
      } else {
        writeString(out, entry.getValue());
      }
    }
    return out.append('}').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return Collections.emptyMap();
    }
    return new Reader(json).readObject();
  }

  private static void writeString(StringBuilder out, String value) {
    out.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> out.append("\\\"");
        case '\\' -> out.append("\\\\");
        case '\b' -> out.append("\\b");
        case '\f' -> out.append("\\f");
        case '\n' -> out.append("\\n");
        case '\r' -> out.append("\\r");
        case '\t' -> out.append("\\t");
        default -> {
          if (c < 0x20) {
            out.append(String.format("\\u%04x", (int) c));
          } else {
            out.append(c);
          }
        }
      }
    }
    out.append('"');
  }

  /** Single-pass reader over one JSON object. */
  private static final class Reader {
    private final String text;
    private int pos;

    Reader(String text) {
      this.text = text;
    }

    Map<String, String> readObject() {
      skipWhitespace();
      expect('{');
      Map<String, String> result = new LinkedHashMap<>();
      skipWhitespace();
      if (peek() == '}') {
        pos++;
        return finish(result);
      }
      while (true) {
        skipWhitespace();
        if (peek() != '"') {
          throw new IllegalArgumentException("Expected string key at position " + pos);
        }
        pos++;
        String key = readString();
        skipWhitespace();
        expect(':');
        skipWhitespace();
        if (text.startsWith("null", pos)) {
          pos += 4;
        } else if (peek() == '"') {
          pos++;
          result.put(key, readString());
        } else {
          throw new IllegalArgumentException("Expected string value or null at position " + pos);
        }
        skipWhitespace();
        char next = peek();
        pos++;
        if (next == '}') {
          return finish(result);
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or '}' at position " + (pos - 1));
        }
      }
    }

    private Map<String, String> finish(Map<String, String> result) {
      skipWhitespace();
      if (pos != text.length()) {
        throw new IllegalArgumentException("Trailing characters after JSON object");
      }
      return result;
    }

    private String readString() {
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
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char esc = text.charAt(pos++);
        switch (esc) {
          case '"', '\\', '/' -> sb.append(esc);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> sb.append(readUnicode());
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + esc);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private char readUnicode() {
      if (pos + 4 > text.length()) {
        throw new IllegalArgumentException("Invalid unicode escape");
      }
      try {
        char decoded = (char) Integer.parseInt(text.substring(pos, pos + 4), 16);
        pos += 4;
        return decoded;
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid unicode escape", e);
      }
    }

    private void skipWhitespace() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }

    private char peek() {
      if (pos >= text.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      return text.charAt(pos);
    }

    private void expect(char expected) {
      if (peek() != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at position " + pos);
      }
      pos++;
    }
  }
}
