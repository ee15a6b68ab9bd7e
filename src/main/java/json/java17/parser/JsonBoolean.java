package json.java17.parser;

/// The JSON `true` and `false` literals.
public record JsonBoolean(boolean value) implements JsonValue {

    private static final JsonBoolean TRUE = new JsonBoolean(true);
    private static final JsonBoolean FALSE = new JsonBoolean(false);

    /// {@return the `JsonBoolean` for the given `boolean`}
    public static JsonBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public boolean bool() {
        return value;
    }
}
