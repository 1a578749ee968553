package nl.bytesoflife.lanterncad.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads lantern configuration documents. The root must be an object; sections keep their
 * document order. Integral numbers come back as {@link Integer} (or {@link Long} past the
 * int range) so that overrides can keep a parameter integral, all other numbers as
 * {@link Double}. Duplicate keys within one object are rejected, since the later value
 * would silently win.
 * <p>
 * Errors name the source and the line and column of the offending character.
 */
public class JsonParser {

    private static final Pattern NUMBER = Pattern.compile("-?(0|[1-9]\\d*)(\\.\\d+)?([eE][-+]?\\d+)?");

    public Map<String, Object> parseObject(InputStream is, String source) throws IOException {
        return parseObject(new String(is.readAllBytes(), StandardCharsets.UTF_8), source);
    }

    public Map<String, Object> parseObject(String json) {
        return parseObject(json, "<string>");
    }

    public Map<String, Object> parseObject(String json, String source) {
        Document doc = new Document(json, source);
        doc.skipBlanks();
        if (doc.peek() != '{') {
            throw doc.error("Configuration must be a JSON object");
        }
        Map<String, Object> root = doc.object();
        doc.skipBlanks();
        if (!doc.atEnd()) {
            throw doc.error("Unexpected '" + doc.peek() + "' after the closing brace");
        }
        return root;
    }

    private static final class Document {
        private final String text;
        private final String source;
        private int index;

        Document(String text, String source) {
            this.text = text;
            this.source = source;
        }

        Object value() {
            skipBlanks();
            if (atEnd()) throw error("Unexpected end of input, expected a value");
            char c = text.charAt(index);
            if (c == '{') return object();
            if (c == '[') return array();
            if (c == '"') return string();
            if (c == '-' || Character.isDigit(c)) return number();
            if (text.startsWith("true", index)) return literal("true", Boolean.TRUE);
            if (text.startsWith("false", index)) return literal("false", Boolean.FALSE);
            if (text.startsWith("null", index)) return literal("null", null);
            throw error("Unexpected '" + c + "', expected a value");
        }

        Map<String, Object> object() {
            index++;
            Map<String, Object> map = new LinkedHashMap<>();
            skipBlanks();
            if (consume('}')) return map;
            do {
                skipBlanks();
                if (peek() != '"') throw error("Expected a quoted key");
                int keyStart = index;
                String key = string();
                skipBlanks();
                require(':');
                Object value = value();
                if (map.containsKey(key)) {
                    index = keyStart;
                    throw error("Duplicate key '" + key + "'");
                }
                map.put(key, value);
                skipBlanks();
            } while (consume(','));
            require('}');
            return map;
        }

        List<Object> array() {
            index++;
            List<Object> list = new ArrayList<>();
            skipBlanks();
            if (consume(']')) return list;
            do {
                list.add(value());
                skipBlanks();
            } while (consume(','));
            require(']');
            return list;
        }

        String string() {
            index++;
            StringBuilder sb = new StringBuilder();
            while (true) {
                if (atEnd()) throw error("Unterminated string");
                char c = text.charAt(index++);
                if (c == '"') return sb.toString();
                if (c < 0x20) {
                    index--;
                    throw error("Control character in string");
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (atEnd()) throw error("Unterminated escape");
                char esc = text.charAt(index++);
                switch (esc) {
                    case '"', '\\', '/' -> sb.append(esc);
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> sb.append(unicodeEscape());
                    default -> {
                        index--;
                        throw error("Invalid escape '\\" + esc + "'");
                    }
                }
            }
        }

        private char unicodeEscape() {
            int code = 0;
            for (int i = 0; i < 4; i++) {
                int digit = atEnd() ? -1 : Character.digit(text.charAt(index), 16);
                if (digit < 0) throw error("Expected four hex digits after \\u");
                code = code * 16 + digit;
                index++;
            }
            return (char) code;
        }

        Number number() {
            Matcher m = NUMBER.matcher(text).region(index, text.length());
            if (!m.lookingAt()) throw error("Malformed number");
            String literal = m.group();
            boolean integral = m.group(2) == null && m.group(3) == null;
            index = m.end();
            if (integral && literal.length() <= 18) {
                long value = Long.parseLong(literal);
                return value == (int) value ? Integer.valueOf((int) value) : Long.valueOf(value);
            }
            return Double.parseDouble(literal);
        }

        private Object literal(String word, Object value) {
            index += word.length();
            return value;
        }

        void skipBlanks() {
            while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
                index++;
            }
        }

        boolean atEnd() {
            return index >= text.length();
        }

        char peek() {
            if (atEnd()) throw error("Unexpected end of input");
            return text.charAt(index);
        }

        private boolean consume(char c) {
            if (!atEnd() && text.charAt(index) == c) {
                index++;
                return true;
            }
            return false;
        }

        private void require(char c) {
            skipBlanks();
            if (!consume(c)) {
                throw error(atEnd() ? "Unexpected end of input, expected '" + c + "'"
                        : "Expected '" + c + "' but found '" + text.charAt(index) + "'");
            }
        }

        ParseException error(String message) {
            int line = 1;
            int lineStart = 0;
            int end = Math.min(index, text.length());
            for (int i = 0; i < end; i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                    lineStart = i + 1;
                }
            }
            return new ParseException(message, source, line, end - lineStart + 1);
        }
    }

    public static class ParseException extends ConfigException {
        private final String source;
        private final int line;
        private final int column;

        public ParseException(String message, String source, int line, int column) {
            super(source + ":" + line + ":" + column + ": " + message);
            this.source = source;
            this.line = line;
            this.column = column;
        }

        public String getSource() { return source; }
        public int getLine() { return line; }
        public int getColumn() { return column; }
    }
}
