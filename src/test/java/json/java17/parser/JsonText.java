package json.java17.parser;

import java.util.Iterator;
import java.util.Map;
import java.util.function.Supplier;

/// Test-only renderer turning a value tree back into JSON text.
/// Output is pure ASCII: anything outside printable ASCII is written as a `\\u` escape.
final class JsonText {

    private JsonText() {}

    static String render(JsonValue value, Supplier<String> whitespace) {
        final var sb = new StringBuilder();
        sb.append(whitespace.get());
        write(sb, value, whitespace);
        sb.append(whitespace.get());
        return sb.toString();
    }

    private static void write(StringBuilder sb, JsonValue value, Supplier<String> ws) {
        if (value instanceof JsonNull) {
            sb.append("null");
        } else if (value instanceof JsonBoolean b) {
            sb.append(b.value());
        } else if (value instanceof JsonNumber n) {
            sb.append(Double.toString(n.value()));
        } else if (value instanceof JsonString s) {
            writeString(sb, s.value());
        } else if (value instanceof JsonArray a) {
            sb.append('[').append(ws.get());
            for (Iterator<JsonValue> it = a.elements().iterator(); it.hasNext(); ) {
                write(sb, it.next(), ws);
                sb.append(ws.get());
                if (it.hasNext()) {
                    sb.append(',').append(ws.get());
                }
            }
            sb.append(']');
        } else if (value instanceof JsonObject o) {
            sb.append('{').append(ws.get());
            for (Iterator<Map.Entry<String, JsonValue>> it = o.members().entrySet().iterator(); it.hasNext(); ) {
                final var member = it.next();
                writeString(sb, member.getKey());
                sb.append(ws.get()).append(':').append(ws.get());
                write(sb, member.getValue(), ws);
                sb.append(ws.get());
                if (it.hasNext()) {
                    sb.append(',').append(ws.get());
                }
            }
            sb.append('}');
        }
    }

    private static void writeString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> {
                    if (c < 0x20 || c > 0x7E) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
