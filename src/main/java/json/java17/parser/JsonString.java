package json.java17.parser;

import java.util.Objects;

/// A JSON string after escape sequences have been decoded.
///
/// @param value the decoded text
public record JsonString(String value) implements JsonValue {

    public JsonString {
        Objects.requireNonNull(value, "value must not be null");
    }

    /// {@return a JSON string for the given text}
    public static JsonString of(String value) {
        return new JsonString(value);
    }

    @Override
    public String string() {
        return value;
    }
}
