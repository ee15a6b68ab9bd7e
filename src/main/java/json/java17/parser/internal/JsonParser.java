package json.java17.parser.internal;

import json.java17.parser.JsonArray;
import json.java17.parser.JsonBoolean;
import json.java17.parser.JsonNull;
import json.java17.parser.JsonNumber;
import json.java17.parser.JsonObject;
import json.java17.parser.JsonParseException;
import json.java17.parser.JsonString;
import json.java17.parser.JsonValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Strict recursive-descent parser for a single JSON document.
///
/// Each production consumes exactly one grammar rule, chosen by one code point
/// of lookahead. Nothing is ever re-read, and the first violation aborts the
/// whole parse with a {@link JsonParseException}. Errors are raised before the
/// offending character is consumed, so the reported position is the index of
/// that character.
///
/// A parser instance is single use and not thread safe. Independent parsers
/// share no mutable state.
public final class JsonParser {

    private static final Logger LOG = Logger.getLogger(JsonParser.class.getName());

    /// System property holding the default maximum nesting depth.
    public static final String MAX_DEPTH_PROPERTY = "json.java17.parser.maxDepth";

    /// Nesting depth used when the system property is absent or invalid.
    public static final int DEFAULT_MAX_DEPTH = 1000;

    private static final int CONFIGURED_MAX_DEPTH;

    static {
        final String propertyValue = System.getProperty(MAX_DEPTH_PROPERTY);
        int depth = DEFAULT_MAX_DEPTH;
        if (propertyValue != null) {
            try {
                depth = Integer.parseInt(propertyValue.trim());
                if (depth <= 0) {
                    LOG.warning(() -> "Non-positive " + MAX_DEPTH_PROPERTY + ": " + propertyValue
                            + ". Using default: " + DEFAULT_MAX_DEPTH);
                    depth = DEFAULT_MAX_DEPTH;
                }
            } catch (NumberFormatException ex) {
                LOG.warning(() -> "Invalid " + MAX_DEPTH_PROPERTY + ": " + propertyValue
                        + ". Using default: " + DEFAULT_MAX_DEPTH);
            }
        }
        final int chosen = depth;
        LOG.fine(() -> "JSON parser maximum nesting depth: " + chosen);
        CONFIGURED_MAX_DEPTH = chosen;
    }

    private final Cursor cursor;
    private final int maxDepth;
    private int depth;

    /// Creates a parser that uses the configured maximum nesting depth.
    /// @param text the complete JSON document
    public JsonParser(String text) {
        this(text, CONFIGURED_MAX_DEPTH);
    }

    /// Creates a parser with an explicit maximum nesting depth.
    /// @param text the complete JSON document
    /// @param maxDepth how many arrays and objects may enclose a value
    /// @throws IllegalArgumentException if `maxDepth` is not positive
    public JsonParser(String text, int maxDepth) {
        Objects.requireNonNull(text, "text must not be null");
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.cursor = new Cursor(text);
        this.maxDepth = maxDepth;
    }

    /// {@return the maximum nesting depth read from {@value #MAX_DEPTH_PROPERTY}}
    public static int configuredMaxDepth() {
        return CONFIGURED_MAX_DEPTH;
    }

    /// Parses the whole input as one JSON value followed only by whitespace.
    /// @return the parsed value
    /// @throws JsonParseException at the first grammar violation
    public JsonValue parseRoot() {
        final JsonValue value = parseValue();
        cursor.skipWhitespace();
        if (!cursor.isExhausted()) {
            throw error("Unexpected characters after JSON value");
        }
        return value;
    }

    private JsonValue parseValue() {
        cursor.skipWhitespace();
        final int c = cursor.peek();
        return switch (c) {
            case Cursor.EOF -> throw error("Unexpected end of input");
            case 'n' -> parseNull();
            case 't', 'f' -> parseBool();
            case '"' -> JsonString.of(parseString());
            case '[' -> parseArray();
            case '{' -> parseObject();
            case '-', '0', '1', '2', '3', '4', '5', '6', '7', '8', '9' -> parseNumber();
            default -> throw error("Unexpected character: " + Character.toString(c));
        };
    }

    private JsonValue parseNull() {
        expectKeyword("null");
        return JsonNull.of();
    }

    private JsonValue parseBool() {
        if (cursor.peek() == 't') {
            expectKeyword("true");
            return JsonBoolean.of(true);
        }
        expectKeyword("false");
        return JsonBoolean.of(false);
    }

    private void expectKeyword(String keyword) {
        for (int i = 0; i < keyword.length(); i++) {
            final char expected = keyword.charAt(i);
            final int actual = cursor.peek();
            if (actual == Cursor.EOF) {
                throw error("Expected '" + expected + "' but got end of input");
            }
            if (actual != expected) {
                throw error("Expected '" + expected + "' but got '" + Character.toString(actual) + "'");
            }
            cursor.advance();
        }
    }

    private String parseString() {
        cursor.advance(); // opening quote
        final var sb = new StringBuilder();
        while (true) {
            final int c = cursor.peek();
            if (c == Cursor.EOF) {
                throw error("Unterminated string");
            }
            cursor.advance();
            if (c == '"') {
                return sb.toString();
            }
            if (c == '\\') {
                sb.append(parseEscape());
            } else {
                sb.appendCodePoint(c);
            }
        }
    }

    private char parseEscape() {
        final int c = cursor.peek();
        if (c == 'u') {
            cursor.advance();
            return parseUnicodeEscape();
        }
        final char decoded = switch (c) {
            case Cursor.EOF -> throw error("Unterminated string");
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            case '"' -> '"';
            case '\\' -> '\\';
            case '/' -> '/';
            default -> throw error("Invalid escape: \\" + Character.toString(c));
        };
        cursor.advance();
        return decoded;
    }

    // One escape is one UTF-16 unit; a well-formed pair of escapes lands in the
    // StringBuilder as the matching supplementary character.
    private char parseUnicodeEscape() {
        int code = 0;
        for (int i = 0; i < 4; i++) {
            final int digit = hexValue(cursor.peek());
            if (digit < 0) {
                throw error("Invalid unicode escape");
            }
            cursor.advance();
            code = (code << 4) | digit;
        }
        return (char) code;
    }

    private static int hexValue(int c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    private JsonValue parseNumber() {
        final int start = cursor.position();
        final var lexeme = new StringBuilder();

        if (cursor.peek() == '-') {
            lexeme.append((char) cursor.advance());
        }

        if (cursor.peek() == '0') {
            lexeme.append((char) cursor.advance());
        } else if (isDigit(cursor.peek())) {
            appendDigits(lexeme);
        } else {
            throw error("Expected digit");
        }

        if (cursor.peek() == '.') {
            lexeme.append((char) cursor.advance());
            if (!isDigit(cursor.peek())) {
                throw error("Expected digit after decimal point");
            }
            appendDigits(lexeme);
        }

        if (cursor.peek() == 'e' || cursor.peek() == 'E') {
            lexeme.append((char) cursor.advance());
            if (cursor.peek() == '+' || cursor.peek() == '-') {
                lexeme.append((char) cursor.advance());
            }
            if (!isDigit(cursor.peek())) {
                throw error("Expected digit in exponent");
            }
            appendDigits(lexeme);
        }

        final double value;
        try {
            value = Double.parseDouble(lexeme.toString());
        } catch (NumberFormatException ex) {
            throw new JsonParseException("Invalid number", start);
        }
        if (!Double.isFinite(value)) {
            LOG.finer(() -> "Number literal overflows double: " + lexeme);
            throw new JsonParseException("Invalid number", start);
        }
        return JsonNumber.of(value);
    }

    private void appendDigits(StringBuilder lexeme) {
        while (isDigit(cursor.peek())) {
            lexeme.append((char) cursor.advance());
        }
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private JsonValue parseArray() {
        enterContainer();
        cursor.advance(); // [
        cursor.skipWhitespace();

        final List<JsonValue> elements = new ArrayList<>();
        if (cursor.peek() == ']') {
            cursor.advance();
            depth--;
            return new JsonArray(elements);
        }

        while (true) {
            elements.add(parseValue());
            cursor.skipWhitespace();
            switch (cursor.peek()) {
                case ',' -> {
                    cursor.advance();
                    cursor.skipWhitespace();
                }
                case ']' -> {
                    cursor.advance();
                    depth--;
                    LOG.finer(() -> "Parsed array of " + elements.size() + " elements");
                    return new JsonArray(elements);
                }
                case Cursor.EOF -> throw error("Unexpected end of input");
                default -> throw error("Expected ',' or ']'");
            }
        }
    }

    private JsonValue parseObject() {
        enterContainer();
        cursor.advance(); // {
        cursor.skipWhitespace();

        final Map<String, JsonValue> members = new LinkedHashMap<>();
        if (cursor.peek() == '}') {
            cursor.advance();
            depth--;
            return new JsonObject(members);
        }

        while (true) {
            cursor.skipWhitespace();
            if (cursor.peek() != '"') {
                throw error("Expected string key");
            }
            final String key = parseString();

            cursor.skipWhitespace();
            if (cursor.peek() != ':') {
                throw error("Expected ':'");
            }
            cursor.advance();

            final JsonValue previous = members.put(key, parseValue());
            if (previous != null) {
                LOG.finer(() -> "Duplicate member \"" + key + "\" replaces earlier value");
            }

            cursor.skipWhitespace();
            switch (cursor.peek()) {
                case ',' -> cursor.advance();
                case '}' -> {
                    cursor.advance();
                    depth--;
                    LOG.finer(() -> "Parsed object of " + members.size() + " members");
                    return new JsonObject(members);
                }
                case Cursor.EOF -> throw error("Unexpected end of input");
                default -> throw error("Expected ',' or '}'");
            }
        }
    }

    private void enterContainer() {
        if (depth == maxDepth) {
            throw error("Maximum nesting depth of " + maxDepth + " exceeded");
        }
        depth++;
    }

    private JsonParseException error(String reason) {
        return new JsonParseException(reason, cursor.position());
    }
}
