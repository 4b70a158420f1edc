package io.pulse.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Minimal JSON reader/writer with no external dependencies.
 *
 * <p>Supports exactly what the message codec and the log formatter need: objects whose
 * values are strings, integers, {@code null}, or nested objects of the same kind.
 * Arrays, booleans and fractional numbers are rejected.
 *
 * <p>Parse errors are reported as {@link IllegalArgumentException}.
 */
public final class Json {

    private Json() {
    }

    /**
     * Appends {@code value} as a quoted, escaped JSON string, or {@code null}.
     *
     * @param sb    the target
     * @param value the string to append
     * @return {@code sb}
     */
    public static StringBuilder appendString(StringBuilder sb, String value) {
        if (value == null) {
            return sb.append("null");
        }
        return sb.append('"').append(escape(value)).append('"');
    }

    /**
     * Appends a flat string map as a JSON object.
     *
     * @param sb  the target
     * @param map the map to append; null keys are rejected
     * @return {@code sb}
     */
    public static StringBuilder appendObject(StringBuilder sb, Map<String, String> map) {
        sb.append('{');
        boolean first = true;
        for (Map.Entry<String, String> entry : map.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("JSON object keys cannot be null");
            }
            if (!first) {
                sb.append(',');
            }
            first = false;
            appendString(sb, entry.getKey()).append(':');
            appendString(sb, entry.getValue());
        }
        return sb.append('}');
    }

    /**
     * Parses a JSON object. Values in the returned map are {@link String}, {@link Long},
     * nested {@code Map<String, Object>}, or {@code null}.
     *
     * @param json the JSON text
     * @return the parsed object, in document order
     * @throws IllegalArgumentException if the text is not exactly one valid JSON object
     */
    public static Map<String, Object> parseObject(String json) {
        if (json == null) {
            throw new IllegalArgumentException("JSON input is null");
        }
        Parser parser = new Parser(json);
        parser.skipWhitespace();
        Map<String, Object> result = parser.readObject();
        parser.skipWhitespace();
        if (parser.index < json.length()) {
            throw new IllegalArgumentException("Unexpected trailing content at index " + parser.index);
        }
        return result;
    }

    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\b':
                    sb.append("\\b");
                    break;
                case '\f':
                    sb.append("\\f");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (c < 0x20 || Character.isSurrogate(c)) {
                        // surrogates are escaped so unpaired ones survive UTF-8 encoding
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.toString();
    }

    private static final class Parser {
        private final String input;
        private int index;

        private Parser(String input) {
            this.input = input;
        }

        private Map<String, Object> readObject() {
            expect('{');
            Map<String, Object> result = new LinkedHashMap<>();
            skipWhitespace();
            if (peek() == '}') {
                index++;
                return result;
            }
            while (true) {
                skipWhitespace();
                if (peek() != '"') {
                    throw new IllegalArgumentException("Expected string key at index " + index);
                }
                index++;
                String key = readString();
                skipWhitespace();
                expect(':');
                skipWhitespace();
                if (result.containsKey(key)) {
                    throw new IllegalArgumentException("Duplicate key: " + key);
                }
                result.put(key, readValue());
                skipWhitespace();
                char next = peek();
                index++;
                if (next == '}') {
                    return result;
                }
                if (next != ',') {
                    throw new IllegalArgumentException("Expected ',' or '}' at index " + (index - 1));
                }
            }
        }

        private Object readValue() {
            char c = peek();
            if (c == '"') {
                index++;
                return readString();
            }
            if (c == '{') {
                return readObject();
            }
            if (c == '-' || (c >= '0' && c <= '9')) {
                return readLong();
            }
            if (input.startsWith("null", index)) {
                index += 4;
                return null;
            }
            throw new IllegalArgumentException("Unsupported value at index " + index);
        }

        private Long readLong() {
            int start = index;
            if (peek() == '-') {
                index++;
            }
            while (index < input.length() && isAsciiDigit(input.charAt(index))) {
                index++;
            }
            try {
                return Long.parseLong(input.substring(start, index));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid integer at index " + start, e);
            }
        }

        private String readString() {
            StringBuilder sb = new StringBuilder();
            while (index < input.length()) {
                char c = input.charAt(index);
                if (c == '"') {
                    index++;
                    return sb.toString();
                }
                if (c != '\\') {
                    sb.append(c);
                    index++;
                    continue;
                }
                if (index + 1 >= input.length()) {
                    throw new IllegalArgumentException("Invalid escape sequence");
                }
                char next = input.charAt(index + 1);
                switch (next) {
                    case '"':
                    case '\\':
                    case '/':
                        sb.append(next);
                        break;
                    case 'b':
                        sb.append('\b');
                        break;
                    case 'f':
                        sb.append('\f');
                        break;
                    case 'n':
                        sb.append('\n');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'u':
                        if (index + 5 >= input.length()) {
                            throw new IllegalArgumentException("Invalid unicode escape");
                        }
                        sb.append(readHexChar(index + 2));
                        index += 4;
                        break;
                    default:
                        throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
                }
                index += 2;
            }
            throw new IllegalArgumentException("Unterminated string");
        }

        private char readHexChar(int from) {
            int value = 0;
            for (int i = from; i < from + 4; i++) {
                char c = input.charAt(i);
                int digit;
                if (isAsciiDigit(c)) {
                    digit = c - '0';
                } else if (c >= 'a' && c <= 'f') {
                    digit = c - 'a' + 10;
                } else if (c >= 'A' && c <= 'F') {
                    digit = c - 'A' + 10;
                } else {
                    throw new IllegalArgumentException("Invalid unicode escape at index " + (from - 2));
                }
                value = (value << 4) | digit;
            }
            return (char) value;
        }

        private static boolean isAsciiDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private void expect(char expected) {
            if (peek() != expected) {
                throw new IllegalArgumentException("Expected '" + expected + "' at index " + index);
            }
            index++;
        }

        private char peek() {
            if (index >= input.length()) {
                throw new IllegalArgumentException("Unexpected end of JSON input");
            }
            return input.charAt(index);
        }

        private void skipWhitespace() {
            while (index < input.length()) {
                char c = input.charAt(index);
                if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
                    break;
                }
                index++;
            }
        }
    }
}
