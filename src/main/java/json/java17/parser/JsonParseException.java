package json.java17.parser;

/// Exception thrown when text cannot be parsed as a JSON value.
///
/// The first grammar violation aborts the parse. The exception carries the
/// bare reason and the number of characters (Unicode code points) that had
/// been consumed when the violation was detected, which is also the index of
/// the offending character.
public class JsonParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String reason;
    private final int position;

    /// Creates a new parse exception.
    /// @param reason human-readable description of the violation
    /// @param position characters consumed before the violation was detected
    public JsonParseException(String reason, int position) {
        super("Parse error at position " + position + ": " + reason);
        this.reason = reason;
        this.position = position;
    }

    /// Returns the description of the violation without position information.
    public String reason() {
        return reason;
    }

    /// Returns the 0-based character position at which parsing stopped.
    public int position() {
        return position;
    }
}
