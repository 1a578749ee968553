package nl.bytesoflife.lanterncad.config;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Writes configuration trees as JSON indented by four spaces.
 */
public class JsonWriter {

    private static final String INDENT = "    ";

    public String write(Map<String, ?> root) {
        StringBuilder sb = new StringBuilder();
        writeValue(sb, root, 0);
        return sb.append('\n').toString();
    }

    private void writeValue(StringBuilder sb, Object value, int depth) {
        if (value instanceof Map<?, ?> map) {
            writeObject(sb, map, depth);
        } else if (value instanceof List<?> list) {
            writeArray(sb, list, depth);
        } else if (value instanceof String s) {
            writeString(sb, s);
        } else if (value == null) {
            sb.append("null");
        } else if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
            throw new ConfigException("Cannot write " + d + " as JSON");
        } else {
            sb.append(value);
        }
    }

    private void writeObject(StringBuilder sb, Map<?, ?> map, int depth) {
        if (map.isEmpty()) {
            sb.append("{}");
            return;
        }
        sb.append("{\n");
        Iterator<? extends Map.Entry<?, ?>> it = map.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<?, ?> entry = it.next();
            sb.append(INDENT.repeat(depth + 1));
            writeString(sb, String.valueOf(entry.getKey()));
            sb.append(": ");
            writeValue(sb, entry.getValue(), depth + 1);
            if (it.hasNext()) sb.append(',');
            sb.append('\n');
        }
        sb.append(INDENT.repeat(depth)).append('}');
    }

    private void writeArray(StringBuilder sb, List<?> list, int depth) {
        if (list.isEmpty()) {
            sb.append("[]");
            return;
        }
        sb.append("[\n");
        for (int i = 0; i < list.size(); i++) {
            sb.append(INDENT.repeat(depth + 1));
            writeValue(sb, list.get(i), depth + 1);
            if (i < list.size() - 1) sb.append(',');
            sb.append('\n');
        }
        sb.append(INDENT.repeat(depth)).append(']');
    }

    private void writeString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
