package json.java17.parser;

import java.util.List;

/// A JSON array: an ordered, unmodifiable sequence of values.
///
/// ## Example Usage
/// ```java
/// JsonArray arr = (JsonArray) Json.parse("[1, true, \"x\"]");
/// for (JsonValue value : arr.elements()) {
///     if (value instanceof JsonNumber n) {
///         System.out.println("Number: " + n.toDouble());
///     }
/// }
/// ```
///
/// @param elements the elements in document order
public record JsonArray(List<JsonValue> elements) implements JsonValue {

    /// @throws NullPointerException if `elements` is `null` or contains `null`
    public JsonArray {
        elements = List.copyOf(elements);
    }

    /// {@return a `JsonArray` holding a copy of the given values}
    public static JsonArray of(List<? extends JsonValue> elements) {
        return new JsonArray(List.copyOf(elements));
    }
}
