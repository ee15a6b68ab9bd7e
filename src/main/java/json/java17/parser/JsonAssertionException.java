package json.java17.parser;

/// Signals that a {@link JsonValue} was accessed as a kind it is not, or that
/// a member or element it was asked for does not exist.
public class JsonAssertionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /// Creates a new assertion exception with the given message.
    public JsonAssertionException(String message) {
        super(message);
    }

    static JsonAssertionException typeMismatch(JsonValue actual, String expected) {
        return new JsonAssertionException("%s is not a %s."
                .formatted(actual.getClass().getSimpleName(), expected));
    }
}
