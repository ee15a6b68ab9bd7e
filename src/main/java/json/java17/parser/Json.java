package json.java17.parser;

import json.java17.parser.internal.JsonParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// This class provides static methods for producing a {@link JsonValue} from
/// JSON text and for converting it to plain Java objects.
///
/// {@link #parse(String)} and {@link #parse(char[])} accept the RFC 8259 value
/// grammar without comments, trailing commas, `NaN` or `Infinity`. Parsing is
/// strict: the first violation throws a {@link JsonParseException} reporting
/// the character position at which parsing stopped.
///
/// ## Example Usage
/// ```java
/// JsonValue json = Json.parse("{\"name\":\"John\",\"age\":30}");
/// String name = json.get("name").string();
///
/// Map<String, Object> data = (Map<String, Object>) Json.toUntyped(json);
/// ```
///
/// @spec https://datatracker.ietf.org/doc/html/rfc8259 RFC 8259: The JavaScript
///       Object Notation (JSON) Data Interchange Format
public final class Json {

    private static final Logger LOG = Logger.getLogger(Json.class.getName());

    /// Parses and creates a `JsonValue` from the given JSON document.
    ///
    /// Whitespace may surround the value and any token inside it. If an object
    /// repeats a member name the last value wins. `JsonObject`s keep their
    /// members in the order the names first appeared in the document.
    ///
    /// ## Example
    /// ```java
    /// JsonValue value = Json.parse("{\"name\":\"Alice\",\"active\":true}");
    /// if (value instanceof JsonObject obj) {
    ///     boolean active = obj.get("active").bool();
    /// }
    /// ```
    ///
    /// @param in the input JSON document as `String`. Non-null.
    /// @throws JsonParseException if the input does not conform to the JSON grammar
    /// @throws NullPointerException if `in` is `null`
    /// @return the parsed `JsonValue`
    public static JsonValue parse(String in) {
        Objects.requireNonNull(in);
        LOG.fine(() -> "Parsing JSON document of " + in.length() + " chars");
        try {
            final JsonValue value = new JsonParser(in).parseRoot();
            LOG.finer(() -> "Parsed " + value.getClass().getSimpleName());
            return value;
        } catch (JsonParseException ex) {
            LOG.fine(() -> "Rejected JSON document: " + ex.getMessage());
            throw ex;
        }
    }

    /// Parses and creates a `JsonValue` from the given JSON document.
    ///
    /// @param in the input JSON document as `char[]`. Non-null.
    /// @throws JsonParseException if the input does not conform to the JSON grammar
    /// @throws NullPointerException if `in` is `null`
    /// @return the parsed `JsonValue`
    /// @see #parse(String)
    public static JsonValue parse(char[] in) {
        Objects.requireNonNull(in);
        return parse(new String(in));
    }

    /// {@return an `Object` created from the given `src` `JsonValue`}
    /// The mapping follows the table below.
    ///
    /// | JsonValue | Untyped Object |
    /// |-----------|----------------|
    /// | `JsonArray` | `List<Object>` (unmodifiable) |
    /// | `JsonBoolean` | `Boolean` |
    /// | `JsonNull` | `null` |
    /// | `JsonNumber` | `Double` |
    /// | `JsonObject` | `Map<String, Object>` (unmodifiable, member order kept) |
    /// | `JsonString` | `String` |
    ///
    /// @param src the `JsonValue` to convert to untyped. Non-null.
    /// @throws NullPointerException if `src` is `null`
    public static Object toUntyped(JsonValue src) {
        Objects.requireNonNull(src);
        if (src instanceof JsonObject jo) {
            // Collectors.toMap rejects null values
            final Map<String, Object> map = new LinkedHashMap<>();
            jo.members().forEach((name, value) -> map.put(name, toUntyped(value)));
            return Collections.unmodifiableMap(map);
        } else if (src instanceof JsonArray ja) {
            final List<Object> list = new ArrayList<>(ja.elements().size());
            for (JsonValue element : ja.elements()) {
                list.add(toUntyped(element));
            }
            return Collections.unmodifiableList(list);
        } else if (src instanceof JsonBoolean jb) {
            return jb.value();
        } else if (src instanceof JsonNumber jn) {
            return jn.value();
        } else if (src instanceof JsonString js) {
            return js.value();
        }
        return null;
    }

    // no instantiation is allowed for this class
    private Json() {}
}
