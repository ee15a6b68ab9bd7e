package json.java17.parser;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// The interface that represents a parsed JSON value.
///
/// Instances of `JsonValue` are immutable and thread safe. Arrays and objects
/// own their children exclusively, so a parsed document is always a tree.
///
/// A `JsonValue` can be produced by {@link Json#parse(String)}.
///
/// ## Navigation
/// ```java
/// var name = Json.parse(text).get("user").get("names").element(0).string();
/// ```
/// Each access method throws {@link JsonAssertionException} when the value is
/// not of the kind the method expects.
public sealed interface JsonValue
        permits JsonNull, JsonBoolean, JsonNumber, JsonString, JsonArray, JsonObject {

    /// {@return the `boolean` value represented by a `JsonBoolean`}
    default boolean bool() {
        throw JsonAssertionException.typeMismatch(this, "JsonBoolean");
    }

    /// {@return this `JsonValue` as a `double`}
    default double toDouble() {
        throw JsonAssertionException.typeMismatch(this, "JsonNumber");
    }

    /// {@return this `JsonValue` as a `long`} Only whole numbers within the
    /// range of `long` convert.
    default long toLong() {
        throw JsonAssertionException.typeMismatch(this, "JsonNumber");
    }

    /// {@return the `String` value represented by a `JsonString`}
    default String string() {
        throw JsonAssertionException.typeMismatch(this, "JsonString");
    }

    /// {@return the elements of a `JsonArray`}
    default List<JsonValue> elements() {
        throw JsonAssertionException.typeMismatch(this, "JsonArray");
    }

    /// {@return the members of a `JsonObject`}
    default Map<String, JsonValue> members() {
        throw JsonAssertionException.typeMismatch(this, "JsonObject");
    }

    /// {@return an `Optional` containing this `JsonValue` if it is not a
    /// `JsonNull`, otherwise an empty `Optional`}
    default Optional<JsonValue> valueOrNull() {
        return this instanceof JsonNull ? Optional.empty() : Optional.of(this);
    }

    /// {@return the `JsonValue` associated with the given member name of a `JsonObject`}
    ///
    /// @param name the member name
    /// @throws NullPointerException if the member name is `null`
    /// @throws JsonAssertionException if this `JsonValue` is not a `JsonObject` or
    ///         there is no association with the member name
    default JsonValue get(String name) {
        Objects.requireNonNull(name);
        final JsonValue member = members().get(name);
        if (member == null) {
            throw new JsonAssertionException(
                    "JsonObject member \"%s\" does not exist.".formatted(name));
        }
        return member;
    }

    /// {@return an `Optional` containing the `JsonValue` associated with the given
    /// member name of a `JsonObject`, otherwise an empty `Optional`}
    ///
    /// @param name the member name
    /// @throws NullPointerException if the member name is `null`
    /// @throws JsonAssertionException if this `JsonValue` is not a `JsonObject`
    default Optional<JsonValue> getOrAbsent(String name) {
        Objects.requireNonNull(name);
        return Optional.ofNullable(members().get(name));
    }

    /// {@return the `JsonValue` at the given index of a `JsonArray`}
    ///
    /// @param index the index of the array
    /// @throws JsonAssertionException if this `JsonValue` is not a `JsonArray`
    ///         or the given index is outside the bounds
    default JsonValue element(int index) {
        final List<JsonValue> elements = elements();
        if (index < 0 || index >= elements.size()) {
            throw new JsonAssertionException(
                    "JsonArray index %d out of bounds for length %d."
                            .formatted(index, elements.size()));
        }
        return elements.get(index);
    }
}
