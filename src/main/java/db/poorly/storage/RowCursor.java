package db.poorly.storage;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.util.List;

import db.poorly.catalog.Column;
import db.poorly.exec.ColumnSet;

/**
 * Forward iterator over the rows of a table file between two offsets, skipping tombstoned rows.
 *
 * Uses positional channel reads only, so several cursors can run over the same channel at once.
 * Writes made behind the cursor position (tombstones) or past {@code end} (appends) do not
 * disturb it.
 */
final class RowCursor implements ValueCodec.ByteSource {
    private static final int BUFFER_SIZE = 8192;

    private final FileChannel channel;
    private final List<Column> columns;
    private final long end;

    private long pos;
    private ByteBuffer buf;
    private long bufStart;

    RowCursor(FileChannel channel, List<Column> columns, long start, long end) {
        this.channel = channel;
        this.columns = columns;
        this.pos = start;
        this.end = end;
    }

    /** Next live row, or null at {@code end}. A row cut short by the end of data is an error. */
    StoredRow next() throws IOException {
        while (pos < end) {
            long offset = pos;
            byte tombstone = take(1).get();
            ColumnSet values = new ColumnSet();
            try {
                for (Column c : columns) {
                    values.put(c.name(), ValueCodec.read(c.type(), this));
                }
            } catch (EOFException e) {
                throw new EOFException("Truncated row at offset " + offset + ": " + e.getMessage());
            }
            if (tombstone == ValueCodec.LIVE) return new StoredRow(offset, values);
        }
        return null;
    }

    @Override
    public ByteBuffer take(int n) throws IOException {
        if (pos + n > end) throw new EOFException("Need " + n + " bytes at " + pos + ", data ends at " + end);
        if (buf == null || pos < bufStart || pos + n > bufStart + buf.limit()) fill(n);
        ByteBuffer out = buf.slice((int) (pos - bufStart), n).order(ByteOrder.LITTLE_ENDIAN);
        pos += n;
        return out;
    }

    private void fill(int n) throws IOException {
        int size = Math.max(BUFFER_SIZE, n);
        if (buf == null || buf.capacity() < size) buf = ByteBuffer.allocate(size);
        buf.clear();
        buf.limit((int) Math.min(size, end - pos));
        long at = pos;
        while (buf.hasRemaining()) {
            int read = channel.read(buf, at);
            if (read < 0) break;
            at += read;
        }
        buf.flip();
        bufStart = pos;
        if (buf.limit() < n) throw new EOFException("Unexpected end of file at " + at);
    }
}
