package cable.util;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultJsonCodecTest {

  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void emptyOrNullMetadataIsStoredAsNull() {
    assertNull(codec.toJson(null));
    assertNull(codec.toJson(Map.of()));
  }

  @Test
  void keepsInsertionOrder() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("trace", "abc");
    map.put("user", "42");

    assertEquals("{\"trace\":\"abc\",\"user\":\"42\"}", codec.toJson(map));
  }

  @Test
  void escapesQuotesBackslashesAndControlCharacters() {
    String json = codec.toJson(Map.of("msg", "say \"hi\"\n\\\u0001"));

    assertEquals("{\"msg\":\"say \\\"hi\\\"\\n\\\\\\u0001\"}", json);
    assertEquals("say \"hi\"\n\\\u0001", codec.parseObject(json).get("msg"));
  }

  @Test
  void rejectsNullKeys() {
    Map<String, String> map = new HashMap<>();
    map.put(null, "v");
    assertThrows(IllegalArgumentException.class, () -> codec.toJson(map));
  }

  @Test
  void parsesWhitespaceAndUnicodeEscapes() {
    Map<String, String> parsed = codec.parseObject(" { \"a\" : \"\\u00e9\" , \"b\":\"x\\/y\" } ");

    assertEquals(Map.of("a", "é", "b", "x/y"), parsed);
  }

  @Test
  void nullValuesAreSkipped() {
    assertEquals(Map.of("a", "1"), codec.parseObject("{\"a\":\"1\",\"b\":null}"));
  }

  @Test
  void blankOrNullInputIsEmpty() {
    assertTrue(codec.parseObject(null).isEmpty());
    assertTrue(codec.parseObject("  ").isEmpty());
    assertTrue(codec.parseObject("null").isEmpty());
    assertTrue(codec.parseObject("{}").isEmpty());
  }

  @Test
  void rejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":1}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"1\""));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"1\"} x"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[\"a\"]"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"\\q\"}"));
  }
}
