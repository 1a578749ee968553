package nl.bytesoflife.lanterncad.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonParserTest {

    private final JsonParser parser = new JsonParser();

    @Test
    @SuppressWarnings("unchecked")
    void parsesNestedObjects() {
        Map<String, Object> root = parser.parseObject("""
                {
                    "pl_params": {"Num_Cores_Ring": 5, "Taper_Slope": 14.9, "Angular_Sep": "360 / Num_Cores_Ring"},
                    "flags": [true, false, null],
                    "big": 12345678901
                }
                """);

        Map<String, Object> params = (Map<String, Object>) root.get("pl_params");
        assertEquals(5, params.get("Num_Cores_Ring"));
        assertEquals(14.9, params.get("Taper_Slope"));
        assertEquals("360 / Num_Cores_Ring", params.get("Angular_Sep"));
        assertEquals(List.of("Num_Cores_Ring", "Taper_Slope", "Angular_Sep"), List.copyOf(params.keySet()));
        assertEquals(3, ((List<Object>) root.get("flags")).size());
        assertEquals(12345678901L, root.get("big"));
    }

    @Test
    void parsesEscapes() {
        Map<String, Object> root = parser.parseObject("{\"a\": \"line\\nbreak \\u0041\"}");
        assertEquals("line\nbreak A", root.get("a"));
    }

    @Test
    void rejectsMalformedInput() {
        assertThrows(JsonParser.ParseException.class, () -> parser.parseObject("{\"a\": 1"));
        assertThrows(JsonParser.ParseException.class, () -> parser.parseObject("[1, 2]"));
        assertThrows(JsonParser.ParseException.class, () -> parser.parseObject("{\"a\": 1} extra"));
        assertThrows(JsonParser.ParseException.class, () -> parser.parseObject("{\"a\": --1}"));
        assertThrows(JsonParser.ParseException.class, () -> parser.parseObject("{\"a\": 01}"));
        assertThrows(JsonParser.ParseException.class, () -> parser.parseObject("{\"a\": [1,]}"));
        assertThrows(JsonParser.ParseException.class, () -> parser.parseObject("{\"a\": \"\\x\"}"));
        assertThrows(JsonParser.ParseException.class, () -> parser.parseObject("{a: 1}"));
    }

    @Test
    void errorsNameSourceLineAndColumn() {
        JsonParser.ParseException e = assertThrows(JsonParser.ParseException.class,
                () -> parser.parseObject("{\n  \"pl_params\": {\n    \"Taper_Length\": 8e\n  }\n}", "pl.json"));

        assertEquals("pl.json", e.getSource());
        assertEquals(3, e.getLine());
        assertEquals(22, e.getColumn());
        assertTrue(e.getMessage().startsWith("pl.json:3:22: "), e.getMessage());
    }

    @Test
    void rejectsDuplicateKeys() {
        JsonParser.ParseException e = assertThrows(JsonParser.ParseException.class,
                () -> parser.parseObject("{\"Taper_Slope\": 1,\n \"Taper_Slope\": 2}"));

        assertTrue(e.getMessage().contains("Duplicate key 'Taper_Slope'"), e.getMessage());
        assertEquals(2, e.getLine());
        assertEquals(2, e.getColumn());
    }

    @Test
    void integralNumbersStayIntegral() {
        Map<String, Object> root = parser.parseObject("{\"i\": -7, \"e\": 1e3, \"d\": 2.0, \"huge\": 12345678901234567890}");

        assertEquals(-7, root.get("i"));
        assertEquals(1000.0, root.get("e"));
        assertEquals(2.0, root.get("d"));
        assertEquals(1.2345678901234567e19, (Double) root.get("huge"), 1e4);
    }

    @Test
    void writerOutputParsesBack() {
        Map<String, Object> root = parser.parseObject("{\"g\": {\"n\": 5, \"s\": \"q\\\"uote\", \"e\": {}, \"l\": [1.5]}}");

        String json = new JsonWriter().write(root);

        assertEquals(root, parser.parseObject(json));
        assertTrue(json.startsWith("{\n    \"g\": {\n        \"n\": 5,"), json);
        assertTrue(json.endsWith("}\n"));
    }
}
