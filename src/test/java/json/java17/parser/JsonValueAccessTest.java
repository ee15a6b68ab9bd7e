package json.java17.parser;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonValueAccessTest extends JsonParserTestBase {

    private String identifyJsonValue(JsonValue jsonValue) {
        if (jsonValue instanceof JsonObject o) {
            return "Object with " + o.members().size() + " members";
        } else if (jsonValue instanceof JsonArray a) {
            return "Array with " + a.elements().size() + " elements";
        } else if (jsonValue instanceof JsonString s) {
            return "String with value: " + s.string();
        } else if (jsonValue instanceof JsonNumber n) {
            return "Number with value: " + n.toDouble();
        } else if (jsonValue instanceof JsonBoolean b) {
            return "Boolean with value: " + b.bool();
        }
        return "Null";
    }

    @Test
    void testEachKindIsRecognised() {
        final JsonValue doc = Json.parse("""
                {
                    "myObject": {},
                    "myArray": [1, 2],
                    "myString": "hello",
                    "myNumber": 123.45,
                    "myBoolean": true,
                    "myNull": null
                }
                """);

        assertThat(identifyJsonValue(doc.get("myObject"))).isEqualTo("Object with 0 members");
        assertThat(identifyJsonValue(doc.get("myArray"))).isEqualTo("Array with 2 elements");
        assertThat(identifyJsonValue(doc.get("myString"))).isEqualTo("String with value: hello");
        assertThat(identifyJsonValue(doc.get("myNumber"))).isEqualTo("Number with value: 123.45");
        assertThat(identifyJsonValue(doc.get("myBoolean"))).isEqualTo("Boolean with value: true");
        assertThat(identifyJsonValue(doc.get("myNull"))).isEqualTo("Null");
    }

    @Test
    void testWrongKindAccessThrows() {
        assertThatThrownBy(() -> Json.parse("1").string())
                .isInstanceOf(JsonAssertionException.class)
                .hasMessage("JsonNumber is not a JsonString.");
        assertThatThrownBy(() -> Json.parse("\"x\"").bool())
                .isInstanceOf(JsonAssertionException.class);
        assertThatThrownBy(() -> Json.parse("[]").get("a"))
                .isInstanceOf(JsonAssertionException.class)
                .hasMessage("JsonArray is not a JsonObject.");
        assertThatThrownBy(() -> Json.parse("{}").element(0))
                .isInstanceOf(JsonAssertionException.class);
        assertThatThrownBy(() -> JsonNull.of().toDouble())
                .isInstanceOf(JsonAssertionException.class);
    }

    @Test
    void testMissingMemberAndIndex() {
        final var doc = Json.parse("{\"a\": [10]}");
        assertThatThrownBy(() -> doc.get("b"))
                .isInstanceOf(JsonAssertionException.class)
                .hasMessage("JsonObject member \"b\" does not exist.");
        assertThat(doc.getOrAbsent("b")).isEmpty();
        assertThat(doc.getOrAbsent("a")).contains(new JsonArray(List.of(JsonNumber.of(10))));
        assertThatThrownBy(() -> doc.get("a").element(1))
                .isInstanceOf(JsonAssertionException.class)
                .hasMessage("JsonArray index 1 out of bounds for length 1.");
        assertThatThrownBy(() -> doc.get("a").element(-1))
                .isInstanceOf(JsonAssertionException.class);
    }

    @Test
    void testToLongRequiresWholeNumberInRange() {
        assertThat(Json.parse("-9007199254740992").toLong()).isEqualTo(-9007199254740992L);
        assertThatThrownBy(() -> Json.parse("1.5").toLong()).isInstanceOf(JsonAssertionException.class);
        assertThatThrownBy(() -> Json.parse("1e19").toLong()).isInstanceOf(JsonAssertionException.class);
    }

    @Test
    void testValuesAreImmutable() {
        final var doc = Json.parse("{\"a\": [1]}");
        assertThatThrownBy(() -> doc.members().put("b", JsonNull.of()))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> doc.get("a").elements().add(JsonNull.of()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testFactoriesCopyTheirInput() {
        final List<JsonValue> source = new ArrayList<>(List.of(JsonNumber.of(1)));
        final var array = JsonArray.of(source);
        source.add(JsonNumber.of(2));
        assertThat(array.elements()).hasSize(1);

        final Map<String, JsonValue> members = new LinkedHashMap<>();
        members.put("a", JsonBoolean.of(true));
        final var object = JsonObject.of(members);
        members.put("b", JsonBoolean.of(false));
        assertThat(object.members()).containsOnlyKeys("a");
    }

    @Test
    void testFactoriesRejectInvalidInput() {
        assertThatThrownBy(() -> JsonNumber.of(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JsonNumber.of(Double.POSITIVE_INFINITY)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JsonString.of(null)).isInstanceOf(NullPointerException.class);
        final List<JsonValue> withNull = new ArrayList<>();
        withNull.add(null);
        assertThatThrownBy(() -> JsonArray.of(withNull)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void testObjectEqualityIgnoresMemberOrder() {
        assertThat(Json.parse("{\"a\":1,\"b\":2}")).isEqualTo(Json.parse("{\"b\":2,\"a\":1}"));
        assertThat(Json.parse("[1,2]")).isNotEqualTo(Json.parse("[2,1]"));
    }

    @Test
    void testToUntyped() {
        final var doc = Json.parse("{\"active\":true,\"count\":42,\"tags\":[\"a\",null],\"name\":\"x\"}");
        final Object untyped = Json.toUntyped(doc);

        assertThat(untyped).isInstanceOf(Map.class);
        @SuppressWarnings("unchecked")
        final var map = (Map<String, Object>) untyped;
        assertThat(map).containsOnlyKeys("active", "count", "tags", "name");
        assertThat(map.keySet()).containsExactly("active", "count", "tags", "name");
        assertThat(map.get("active")).isEqualTo(Boolean.TRUE);
        assertThat(map.get("count")).isEqualTo(42.0);
        assertThat(map.get("tags")).isEqualTo(java.util.Arrays.asList("a", null));
        assertThat(map.get("name")).isEqualTo("x");
        assertThat(Json.toUntyped(JsonNull.of())).isNull();
    }
}
