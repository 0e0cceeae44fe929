package db.poorly.catalog;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.regex.Pattern;

import db.poorly.error.DbException;

/**
 * A value tagged with its {@link DataType}.
 *
 * Payload representation per type:
 * INT    -> Long
 * FLOAT  -> Double
 * CHAR   -> Character (stored as a single byte, see ValueCodec)
 * STRING -> String
 * SERIAL -> Long holding an unsigned 32-bit value
 * EMAIL  -> String
 *
 * Equality is structural: same tag and equal payload.
 */
public final class TypedValue {
    private static final Pattern EMAIL = Pattern.compile(
        "^[\\w\\-.]+@([\\w-]+\\.)+[\\w\\-]{2,4}$", Pattern.UNICODE_CHARACTER_CLASS);

    private static final long SERIAL_MASK = 0xFFFFFFFFL;
    private static final char MAX_STORED_CHAR = 0x7F;

    private final DataType type;
    private final Object payload;

    private TypedValue(DataType type, Object payload) {
        this.type = type;
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public static TypedValue ofInt(long value) { return new TypedValue(DataType.INT, value); }
    public static TypedValue ofFloat(double value) { return new TypedValue(DataType.FLOAT, value); }
    public static TypedValue ofChar(char value) { return new TypedValue(DataType.CHAR, value); }
    public static TypedValue ofString(String value) { return new TypedValue(DataType.STRING, value); }
    public static TypedValue ofEmail(String value) { return new TypedValue(DataType.EMAIL, value); }

    /** Serial values are unsigned 32-bit; higher bits are dropped. */
    public static TypedValue ofSerial(long value) { return new TypedValue(DataType.SERIAL, value & SERIAL_MASK); }

    public DataType type() { return type; }

    public long asLong() {
        if (type != DataType.INT && type != DataType.SERIAL) throw wrongAccess(DataType.INT);
        return (Long) payload;
    }

    public double asDouble() {
        if (type != DataType.FLOAT) throw wrongAccess(DataType.FLOAT);
        return (Double) payload;
    }

    public char asChar() {
        if (type != DataType.CHAR) throw wrongAccess(DataType.CHAR);
        return (Character) payload;
    }

    /** String payload of STRING and EMAIL values. */
    public String asString() {
        if (type != DataType.STRING && type != DataType.EMAIL) throw wrongAccess(DataType.STRING);
        return (String) payload;
    }

    /** Payload rendered as plain text, e.g. for placeholder rows or printing. */
    public String text() {
        return String.valueOf(payload);
    }

    /**
     * Convert this value to {@code target}. Identity when the types already match; otherwise
     * only the conversions listed in the switch below succeed.
     */
    public TypedValue coerce(DataType target) {
        if (type == target) return this;
        TypedValue out = switch (type) {
            case INT -> switch (target) {
                case FLOAT -> ofFloat((double) asLong());
                case SERIAL -> ofSerial(asLong());
                default -> null;
            };
            case STRING -> switch (target) {
                case CHAR -> singleByteChar(asString());
                case EMAIL -> ofEmail(asString());
                case INT -> parseInt(asString());
                case FLOAT -> parseFloat(asString());
                default -> null;
            };
            case CHAR -> switch (target) {
                case STRING -> ofString(String.valueOf(asChar()));
                case INT -> parseInt(String.valueOf(asChar()));
                case FLOAT -> parseFloat(String.valueOf(asChar()));
                default -> null;
            };
            case EMAIL -> target == DataType.STRING ? ofString(asString()) : null;
            case SERIAL -> target == DataType.INT ? ofInt(asLong()) : null;
            case FLOAT -> null;
        };
        if (out == null) throw DbException.invalidValue(this, target);
        return out;
    }

    /** EMAIL values must look like an address; CHAR values must fit the one stored byte (ASCII). */
    public void validate() {
        switch (type) {
            case EMAIL -> {
                if (!EMAIL.matcher(asString()).matches()) throw DbException.invalidEmail();
            }
            case CHAR -> {
                if (asChar() > MAX_STORED_CHAR) throw DbException.invalidValue(this, DataType.CHAR);
            }
            default -> { }
        }
    }

    /**
     * Ordering used by join key comparison. Empty when the two values have different
     * types or a float comparison involves NaN.
     */
    public OptionalInt partialCompare(TypedValue other) {
        if (other == null || type != other.type) return OptionalInt.empty();
        return switch (type) {
            case INT, SERIAL -> OptionalInt.of(Long.compare(asLong(), other.asLong()));
            case FLOAT -> {
                double a = asDouble();
                double b = other.asDouble();
                if (Double.isNaN(a) || Double.isNaN(b)) yield OptionalInt.empty();
                yield OptionalInt.of(a < b ? -1 : (a > b ? 1 : 0));
            }
            case CHAR -> OptionalInt.of(Character.compare(asChar(), other.asChar()));
            case STRING, EMAIL -> OptionalInt.of(Integer.signum(asString().compareTo(other.asString())));
        };
    }

    private TypedValue singleByteChar(String s) {
        // one UTF-8 byte, i.e. a single ASCII character
        if (s.getBytes(StandardCharsets.UTF_8).length != 1) return null;
        return ofChar(s.charAt(0));
    }

    private TypedValue parseInt(String s) {
        try {
            return ofInt(Long.parseLong(s));
        } catch (NumberFormatException e) {
            throw DbException.invalidValue(this, DataType.INT);
        }
    }

    private TypedValue parseFloat(String s) {
        String lower = s.toLowerCase();
        switch (lower) {
            case "inf", "+inf", "infinity", "+infinity" -> { return ofFloat(Double.POSITIVE_INFINITY); }
            case "-inf", "-infinity" -> { return ofFloat(Double.NEGATIVE_INFINITY); }
            case "nan" -> { return ofFloat(Double.NaN); }
            default -> { }
        }
        // Double.parseDouble is laxer than plain decimal notation: no whitespace, type suffixes or hex
        if (s.isEmpty() || !s.equals(s.strip()) || lower.startsWith("0x") || lower.startsWith("-0x") || lower.startsWith("+0x")
                || "fFdD".indexOf(s.charAt(s.length() - 1)) >= 0 || lower.contains("infinity") || lower.contains("nan")) {
            throw DbException.invalidValue(this, DataType.FLOAT);
        }
        try {
            return ofFloat(Double.parseDouble(s));
        } catch (NumberFormatException e) {
            throw DbException.invalidValue(this, DataType.FLOAT);
        }
    }

    private IllegalStateException wrongAccess(DataType wanted) {
        return new IllegalStateException("Value " + this + " is not of type " + wanted.keyword());
    }

    /**
     * Same tag and equal payload. Floats compare with IEEE {@code ==}: 0.0 equals -0.0 and NaN
     * equals nothing, itself included.
     */
    @Override
    public boolean equals(Object o) {
        if (!(o instanceof TypedValue tv) || type != tv.type) return false;
        if (type == DataType.FLOAT) return asDouble() == tv.asDouble();
        return this == o || payload.equals(tv.payload);
    }

    @Override
    public int hashCode() {
        // -0.0 + 0.0 is 0.0, so both zeros hash alike
        Object h = type == DataType.FLOAT ? (Object) (asDouble() + 0.0) : payload;
        return type.hashCode() * 31 + h.hashCode();
    }

    // For debugging and error messages, e.g. String("abc") or Int(5)
    @Override
    public String toString() {
        String name = type.keyword().substring(0, 1).toUpperCase() + type.keyword().substring(1);
        return switch (type) {
            case STRING, EMAIL -> name + "(\"" + payload + "\")";
            case CHAR -> name + "('" + payload + "')";
            default -> name + "(" + payload + ")";
        };
    }
}
