package json.java17.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A JSON object: an unmodifiable mapping from member name to value.
///
/// Member names are unique. When a document repeats a name, the parser keeps
/// the value of the last occurrence. Members iterate in the order their names
/// first appeared. Equality ignores member order.
///
/// @param members the members of the object
public record JsonObject(Map<String, JsonValue> members) implements JsonValue {

    /// @throws NullPointerException if `members` is `null` or holds a `null`
    ///         name or value
    public JsonObject {
        final var copy = new LinkedHashMap<String, JsonValue>(members.size() * 2);
        members.forEach((name, value) -> copy.put(
                Objects.requireNonNull(name, "member name must not be null"),
                Objects.requireNonNull(value, "member value must not be null")));
        members = Collections.unmodifiableMap(copy);
    }

    /// {@return a `JsonObject` holding a copy of the given members}
    public static JsonObject of(Map<String, ? extends JsonValue> members) {
        return new JsonObject(Collections.unmodifiableMap(members));
    }
}
