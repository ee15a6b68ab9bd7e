package json.java17.parser;

/// A JSON number held as an IEEE-754 `double`.
///
/// Parsed numbers are always finite: the number grammar has no `NaN` or
/// `Infinity` literal and a literal that overflows `double` is rejected.
///
/// @param value the finite numeric value
public record JsonNumber(double value) implements JsonValue {

    private static final double TWO_POW_63 = 0x1p63;

    /// @throws IllegalArgumentException if `value` is not finite
    public JsonNumber {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Not a valid JSON number: " + value);
        }
    }

    /// {@return a JSON number for the given `double`}
    /// @throws IllegalArgumentException if `value` is not finite
    public static JsonNumber of(double value) {
        return new JsonNumber(value);
    }

    @Override
    public double toDouble() {
        return value;
    }

    /// {@return the value as a `long`}
    /// @throws JsonAssertionException if the value has a fractional part or lies
    ///         outside the range of `long`
    @Override
    public long toLong() {
        if (value % 1 != 0 || value < -TWO_POW_63 || value >= TWO_POW_63) {
            throw new JsonAssertionException(
                    "JsonNumber %s cannot be represented as a long.".formatted(value));
        }
        return (long) value;
    }
}
