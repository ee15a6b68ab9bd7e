package json.java17.parser.internal;

/// Forward-only scanner over the code points of a `String`.
///
/// The position counts code points, not UTF-16 units: a supplementary
/// character advances it once. There is no way to rewind.
final class Cursor {

    /// Returned by {@link #peek()} and {@link #advance()} once the input is exhausted.
    static final int EOF = -1;

    private final String text;
    private int index;
    private int position;

    Cursor(String text) {
        this.text = text;
    }

    /// {@return the next code point without consuming it, or {@link #EOF}}
    int peek() {
        return index < text.length() ? text.codePointAt(index) : EOF;
    }

    /// Consumes the next code point.
    /// @return the consumed code point, or {@link #EOF} when nothing is left
    int advance() {
        if (index >= text.length()) {
            return EOF;
        }
        final int c = text.codePointAt(index);
        index += Character.charCount(c);
        position++;
        return c;
    }

    /// Consumes a maximal run of whitespace.
    void skipWhitespace() {
        while (isWhitespace(peek())) {
            advance();
        }
    }

    /// {@return the number of code points consumed so far}
    int position() {
        return position;
    }

    boolean isExhausted() {
        return index >= text.length();
    }

    /// Unicode `White_Space` property.
    static boolean isWhitespace(int c) {
        return switch (c) {
            case '\t', '\n', 0x0B, '\f', '\r', ' ', 0x85, 0xA0, 0x1680,
                 0x2028, 0x2029, 0x202F, 0x205F, 0x3000 -> true;
            default -> c >= 0x2000 && c <= 0x200A;
        };
    }
}
