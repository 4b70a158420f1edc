package io.pulse.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonTest {

    @Test
    void writesFlatObjectWithEscapes() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("a", "1");
        map.put("msg", "Hello \"World\"\nNew\\Line\u0001");

        String json = Json.appendObject(new StringBuilder(), map).toString();

        assertEquals("{\"a\":\"1\",\"msg\":\"Hello \\\"World\\\"\\nNew\\\\Line\\u0001\"}", json);
    }

    @Test
    void writesNullValues() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("k", null);

        assertEquals("{\"k\":null}", Json.appendObject(new StringBuilder(), map).toString());
    }

    @Test
    void rejectsNullKeys() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(null, "v");

        assertThrows(IllegalArgumentException.class, () -> Json.appendObject(new StringBuilder(), map));
    }

    @Test
    void parsesSupportedValueKinds() {
        Map<String, Object> parsed = Json.parseObject(
                "{\"s\":\"x\\u0041\\t\",\"n\":-42,\"z\":null,\"o\":{\"k\":\"v\"},\"e\":{}}");

        assertEquals("xA\t", parsed.get("s"));
        assertEquals(-42L, parsed.get("n"));
        assertTrue(parsed.containsKey("z"));
        assertNull(parsed.get("z"));
        assertEquals(Map.of("k", "v"), parsed.get("o"));
        assertEquals(Map.of(), parsed.get("e"));
    }

    @Test
    void rejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> Json.parseObject(null));
        assertThrows(IllegalArgumentException.class, () -> Json.parseObject(""));
        assertThrows(IllegalArgumentException.class, () -> Json.parseObject("{"));
        assertThrows(IllegalArgumentException.class, () -> Json.parseObject("{\"a\"}"));
        assertThrows(IllegalArgumentException.class, () -> Json.parseObject("{\"a\":\"b\""));
        assertThrows(IllegalArgumentException.class, () -> Json.parseObject("{\"a\":true}"));
        assertThrows(IllegalArgumentException.class, () -> Json.parseObject("{\"a\":[1]}"));
        assertThrows(IllegalArgumentException.class, () -> Json.parseObject("{\"a\":\"\\q\"}"));
        assertThrows(IllegalArgumentException.class, () -> Json.parseObject("{\"a\":-}"));
        assertThrows(IllegalArgumentException.class, () -> Json.parseObject("{} {}"));
    }

    @Test
    void escapesSurrogatesSoUnpairedOnesRoundTrip() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("lone", "a\uD800b");
        map.put("pair", "\uD83D\uDE00");

        String json = Json.appendObject(new StringBuilder(), map).toString();

        assertEquals("{\"lone\":\"a\\ud800b\",\"pair\":\"\\ud83d\\ude00\"}", json);
        assertEquals(Map.of("lone", "a\uD800b", "pair", "\uD83D\uDE00"), Json.parseObject(json));
    }

    @Test
    void rejectsSignedOrNonAsciiHexInUnicodeEscape() {
        assertThrows(IllegalArgumentException.class, () -> Json.parseObject("{\"a\":\"\\u+041\"}"));
        assertThrows(IllegalArgumentException.class, () -> Json.parseObject("{\"a\":\"\\u-041\"}"));
        assertThrows(IllegalArgumentException.class, () -> Json.parseObject("{\"a\":\"\\u00g1\"}"));
        assertThrows(IllegalArgumentException.class, () -> Json.parseObject("{\"a\":\"\\u\uFF10041\"}"));
        assertEquals(Map.of("a", "\u00E9"), Json.parseObject("{\"a\":\"\\u00E9\"}"));
    }

    @Test
    void rejectsNonAsciiDigitsInNumbers() {
        assertThrows(IllegalArgumentException.class, () -> Json.parseObject("{\"n\":1\u0663}"));
        assertThrows(IllegalArgumentException.class, () -> Json.parseObject("{\"n\":-\u0661}"));
    }
}
