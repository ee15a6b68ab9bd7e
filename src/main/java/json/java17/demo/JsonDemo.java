package json.java17.demo;

import json.java17.parser.Json;
import json.java17.parser.JsonParseException;

import java.util.List;

public class JsonDemo {

    static final List<String> EXAMPLES = List.of(
            "null",
            "true",
            "42",
            "3.14",
            "\"hello\"",
            "[1, 2, 3]",
            "{\"name\": \"Java\", \"version\": 17}",
            "{\"nested\": {\"array\": [1, true, null]}}",
            "[1,]",
            "undefined"
    );

    public static void main(String[] args) {
        System.out.println("=== JSON Parser Demo ===");
        System.out.println();
        for (String json : EXAMPLES) {
            System.out.println(describe(json));
            System.out.println();
        }
    }

    static String describe(String json) {
        try {
            return "Input:  " + json + "\nParsed: " + Json.parse(json);
        } catch (JsonParseException ex) {
            return "Input:  " + json + "\nError:  " + ex.getMessage();
        }
    }
}
