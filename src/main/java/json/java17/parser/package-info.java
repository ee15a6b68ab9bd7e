/// Provides a strict parser from JSON text to an immutable tree of JSON values.
///
/// ## Parsing JSON documents
/// Parsing produces a `JsonValue` from JSON text via `Json.parse(String)` or
/// `Json.parse(char[])`. A successful parse indicates that the text adheres to
/// the RFC 8259 value grammar without comments, trailing commas, `NaN` or
/// `Infinity`. A failed parse throws `JsonParseException`, whose `position()`
/// is the number of characters consumed before the violation was detected.
///
/// ## Retrieving JSON values
/// Retrieving values from a JSON document involves two steps: first navigating
/// the document structure using access methods, and then converting the result
/// to the desired type using conversion methods. For example:
/// ```java
/// var name = doc.get("foo").get("bar").element(0).string();
/// ```
/// Alternatively `Json.toUntyped(JsonValue)` converts the whole tree to maps,
/// lists and boxed primitives.
///
/// @spec https://datatracker.ietf.org/doc/html/rfc8259 RFC 8259: The JavaScript
///      Object Notation (JSON) Data Interchange Format

package json.java17.parser;
