package db.poorly.catalog;

import java.io.IOException;

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

/**
 * Untagged JSON form of a {@link TypedValue}: numbers stay numbers, everything else is a string.
 * Reading picks the first fitting type in declaration order: integral numbers become INT,
 * other numbers FLOAT, one-character strings CHAR and longer strings STRING. Column coercion
 * takes it from there.
 */
public class TypedValueAdapter extends TypeAdapter<TypedValue> {

    @Override
    public void write(JsonWriter out, TypedValue value) throws IOException {
        if (value == null) {
            out.nullValue();
            return;
        }
        switch (value.type()) {
            case INT, SERIAL -> out.value(value.asLong());
            case FLOAT -> {
                double d = value.asDouble();
                // JSON has no literal for these
                if (Double.isNaN(d) || Double.isInfinite(d)) out.value(Double.toString(d));
                else out.value(d);
            }
            case CHAR, STRING, EMAIL -> out.value(value.text());
        }
    }

    @Override
    public TypedValue read(JsonReader in) throws IOException {
        JsonToken token = in.peek();
        switch (token) {
            case NUMBER -> {
                String raw = in.nextString();
                if (raw.indexOf('.') < 0 && raw.indexOf('e') < 0 && raw.indexOf('E') < 0) {
                    try {
                        return TypedValue.ofInt(Long.parseLong(raw));
                    } catch (NumberFormatException e) {
                        // out of long range, fall through to float
                    }
                }
                return TypedValue.ofFloat(Double.parseDouble(raw));
            }
            case STRING -> {
                String s = in.nextString();
                return s.length() == 1 ? TypedValue.ofChar(s.charAt(0)) : TypedValue.ofString(s);
            }
            default -> throw new JsonParseException("Unsupported JSON value for a column: " + token + " at " + in.getPath());
        }
    }
}
