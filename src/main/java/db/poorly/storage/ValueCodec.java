package db.poorly.storage;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import db.poorly.catalog.Column;
import db.poorly.catalog.DataType;
import db.poorly.catalog.TypedValue;
import db.poorly.exec.ColumnSet;

/**
 * Binary encoding of values and rows. All numbers are little-endian.
 *
 * INT    8 bytes signed
 * FLOAT  8 bytes IEEE 754
 * CHAR   1 byte (low byte of the char; decoded as ISO-8859-1)
 * SERIAL 4 bytes unsigned
 * STRING, EMAIL  8-byte unsigned length + UTF-8 bytes
 *
 * Row = [1-byte tombstone][values in column order].
 */
public final class ValueCodec {
    public static final int SERIAL_BYTES = 4;
    private static final int LONG_BYTES = 8;
    private static final int LENGTH_PREFIX_BYTES = 8;

    public static final byte LIVE = 0;
    public static final byte TOMBSTONE = 1;

    private ValueCodec() {}

    public static int encodedSize(TypedValue value) {
        return switch (value.type()) {
            case INT, FLOAT -> LONG_BYTES;
            case CHAR -> 1;
            case SERIAL -> SERIAL_BYTES;
            case STRING, EMAIL -> LENGTH_PREFIX_BYTES + value.asString().getBytes(StandardCharsets.UTF_8).length;
        };
    }

    public static byte[] encode(TypedValue value) {
        ByteBuffer buffer = ByteBuffer.allocate(encodedSize(value)).order(ByteOrder.LITTLE_ENDIAN);
        write(buffer, value);
        return buffer.array();
    }

    public static void write(ByteBuffer buffer, TypedValue value) {
        switch (value.type()) {
            case INT -> buffer.putLong(value.asLong());
            case FLOAT -> buffer.putDouble(value.asDouble());
            case CHAR -> buffer.put((byte) value.asChar());
            case SERIAL -> buffer.putInt((int) value.asLong());
            case STRING, EMAIL -> {
                byte[] strBytes = value.asString().getBytes(StandardCharsets.UTF_8);
                buffer.putLong(strBytes.length);
                buffer.put(strBytes);
            }
        }
    }

    /** Decode one value of {@code type} from the front of {@code buffer}. */
    public static TypedValue decode(DataType type, ByteBuffer buffer) throws IOException {
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        return read(type, n -> {
            if (buffer.remaining() < n) throw new EOFException("Need " + n + " bytes, have " + buffer.remaining());
            ByteBuffer out = buffer.slice(buffer.position(), n).order(ByteOrder.LITTLE_ENDIAN);
            buffer.position(buffer.position() + n);
            return out;
        });
    }

    static TypedValue read(DataType type, ByteSource in) throws IOException {
        return switch (type) {
            case INT -> TypedValue.ofInt(in.take(LONG_BYTES).getLong());
            case FLOAT -> TypedValue.ofFloat(in.take(LONG_BYTES).getDouble());
            case CHAR -> TypedValue.ofChar((char) (in.take(1).get() & 0xFF));
            case SERIAL -> TypedValue.ofSerial(Integer.toUnsignedLong(in.take(SERIAL_BYTES).getInt()));
            case STRING -> TypedValue.ofString(readString(in));
            case EMAIL -> TypedValue.ofEmail(readString(in));
        };
    }

    private static String readString(ByteSource in) throws IOException {
        long len = in.take(LENGTH_PREFIX_BYTES).getLong();
        if (len < 0 || len > Integer.MAX_VALUE - LENGTH_PREFIX_BYTES) {
            throw new IOException("Invalid string length " + Long.toUnsignedString(len));
        }
        ByteBuffer bytes = in.take((int) len);
        byte[] out = new byte[(int) len];
        bytes.get(out);
        return decodeUtf8(out);
    }

    private static String decodeUtf8(byte[] bytes) throws IOException {
        try {
            return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new IOException("Invalid UTF-8 string", e);
        }
    }

    /** Serialize a full row. Every column must have a value in {@code row}. */
    public static byte[] encodeRow(List<Column> columns, ColumnSet row) {
        int size = 1;
        for (Column c : columns) size += encodedSize(row.get(c.name()));
        ByteBuffer buffer = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(LIVE);
        for (Column c : columns) write(buffer, row.get(c.name()));
        return buffer.array();
    }

    /** Supplies exactly n little-endian bytes or fails with EOFException. */
    @FunctionalInterface
    interface ByteSource {
        ByteBuffer take(int n) throws IOException;
    }
}
