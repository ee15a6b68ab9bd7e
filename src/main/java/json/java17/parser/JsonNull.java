package json.java17.parser;

/// The JSON `null` literal.
public record JsonNull() implements JsonValue {

    private static final JsonNull NULL = new JsonNull();

    /// {@return the shared `JsonNull` instance}
    public static JsonNull of() {
        return NULL;
    }
}
