package db.poorly.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

import org.junit.jupiter.api.Test;

import db.poorly.catalog.Column;
import db.poorly.catalog.DataType;
import db.poorly.catalog.TypedValue;
import db.poorly.exec.ColumnSet;

public class ValueCodecTest {

    private static TypedValue roundTrip(TypedValue v) throws IOException {
        byte[] bytes = ValueCodec.encode(v);
        assertEquals(ValueCodec.encodedSize(v), bytes.length);
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        TypedValue back = ValueCodec.decode(v.type(), buf);
        assertFalse(buf.hasRemaining());
        return back;
    }

    @Test
    void valuesSurviveEncoding() throws IOException {
        for (TypedValue v : List.of(
                TypedValue.ofInt(Long.MIN_VALUE), TypedValue.ofInt(Long.MAX_VALUE),
                TypedValue.ofFloat(-0.5), TypedValue.ofFloat(Double.NEGATIVE_INFINITY),
                TypedValue.ofChar('x'), TypedValue.ofSerial(0xFFFFFFFFL),
                TypedValue.ofString(""), TypedValue.ofString("żółw ✓"),
                TypedValue.ofEmail("a@b.cd"))) {
            assertEquals(v, roundTrip(v), v.toString());
        }
    }

    @Test
    void fixedLayoutIsLittleEndian() {
        assertArrayEquals(new byte[] {1, 0, 0, 0, 0, 0, 0, 0}, ValueCodec.encode(TypedValue.ofInt(1)));
        assertArrayEquals(new byte[] {2, 1, 0, 0}, ValueCodec.encode(TypedValue.ofSerial(258)));
        assertArrayEquals(new byte[] {'a'}, ValueCodec.encode(TypedValue.ofChar('a')));

        byte[] s = ValueCodec.encode(TypedValue.ofString("é"));
        assertEquals(10, s.length); // 8-byte length + 2 UTF-8 bytes
        assertEquals(2L, ByteBuffer.wrap(s).order(ByteOrder.LITTLE_ENDIAN).getLong());
    }

    @Test
    void charUsesTheLowByte() throws IOException {
        // values above 0x7F come back as ISO-8859-1
        assertEquals(TypedValue.ofChar('é'), roundTrip(TypedValue.ofChar('é')));
    }

    @Test
    void rowStartsWithLiveMarker() {
        List<Column> cols = List.of(new Column("a", DataType.INT), new Column("b", DataType.CHAR));
        byte[] row = ValueCodec.encodeRow(cols, ColumnSet.of("b", TypedValue.ofChar('z'), "a", TypedValue.ofInt(3)));
        assertArrayEquals(new byte[] {ValueCodec.LIVE, 3, 0, 0, 0, 0, 0, 0, 0, 'z'}, row);
    }

    @Test
    void shortInputFails() {
        ByteBuffer buf = ByteBuffer.wrap(new byte[] {5, 0, 0, 0, 0, 0, 0, 0, 'a', 'b'});
        assertThrows(EOFException.class, () -> ValueCodec.decode(DataType.STRING, buf));
        assertThrows(EOFException.class, () -> ValueCodec.decode(DataType.INT, ByteBuffer.wrap(new byte[3])));
    }

    @Test
    void invalidUtf8IsRejected() {
        ByteBuffer buf = ByteBuffer.wrap(new byte[] {1, 0, 0, 0, 0, 0, 0, 0, (byte) 0xFF});
        assertThrows(IOException.class, () -> ValueCodec.decode(DataType.STRING, buf));
    }
}
