package db.poorly.storage;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.poorly.catalog.Column;
import db.poorly.catalog.DataType;
import db.poorly.catalog.TypedValue;
import db.poorly.error.DbException;
import db.poorly.exec.ColumnSet;
import db.poorly.exec.EqualityPredicate;
import db.poorly.exec.FilterOperator;
import db.poorly.exec.JoinKey;
import db.poorly.exec.JoinOperator;
import db.poorly.exec.Operator;
import db.poorly.exec.Predicate;
import db.poorly.exec.ProjectionOperator;

/**
 * One table backed by one file.
 *
 * Layout:
 * [0..3]  unsigned int  next serial value (little-endian)
 * [4.....] rows, appended front-to-back: [1-byte tombstone][values in column order]
 *
 * Rows are never rewritten in place. Delete sets the tombstone byte, update appends the new
 * image and tombstones the old one. Tombstoned rows stay in the file; nothing compacts them yet.
 *
 * Not thread-safe; see SharedTable.
 */
public class Table implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(Table.class);

    static final int HEADER_SIZE = ValueCodec.SERIAL_BYTES;

    private final String name;
    private final Path file;
    private final FileChannel channel;
    private List<Column> columns;
    private boolean[] serialColumns;
    private long serial; // unsigned 32-bit

    private Table(String name, Path file, FileChannel channel, List<Column> columns, long serial) {
        this.name = name;
        this.file = file;
        this.channel = channel;
        this.serial = serial;
        setColumns(columns);
    }

    /** Open or create the table file {@code dir/name}. */
    public static Table open(String name, List<Column> columns, Path dir) {
        log.info("Opening table `{}`", name);
        Path file = dir.resolve(name);
        FileChannel channel = null;
        try {
            channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
            long size = channel.size();
            long serial = 0;
            if (size == 0) {
                log.debug("Writing serial `{}` to table `{}`", serial, name);
                writeFully(channel, serialBytes(serial), 0);
            } else if (size < HEADER_SIZE) {
                throw new IOException("Table file " + file + " is shorter than its header");
            } else {
                serial = readSerial(channel);
                log.debug("Read serial `{}` from table `{}`", serial, name);
            }
            return new Table(name, file, channel, columns, serial);
        } catch (IOException e) {
            closeQuietly(channel, e);
            throw DbException.io(e);
        }
    }

    public String name() { return name; }
    public Path file() { return file; }
    public List<Column> columns() { return columns; }
    public long nextSerial() { return serial; }

    /** Replace the column list, e.g. after a rename. Types and order must be unchanged. */
    public void setColumns(List<Column> columns) {
        this.columns = List.copyOf(columns);
        this.serialColumns = new boolean[this.columns.size()];
        for (int i = 0; i < this.columns.size(); i++) {
            serialColumns[i] = this.columns.get(i).type() == DataType.SERIAL;
        }
    }

    /**
     * Insert one row. Non-serial columns must all be present; serial columns get the next
     * serial value. Returns the stored row.
     */
    public ColumnSet insert(ColumnSet values) {
        ColumnSet coerced = checkAndCoerce(values, TableMethod.INSERT);
        ColumnSet row = new ColumnSet();
        for (int i = 0; i < columns.size(); i++) {
            String column = columns.get(i).name();
            TypedValue v = serialColumns[i] ? TypedValue.ofSerial(serial) : coerced.get(column);
            if (v == null) throw DbException.incompleteData(column, name);
            row.put(column, v);
        }
        byte[] bytes = ValueCodec.encodeRow(columns, row);
        try {
            bumpSerial();
            append(bytes);
        } catch (IOException e) {
            throw DbException.io(e);
        }
        return row;
    }

    /** Live rows equal to {@code conditions}, projected to {@code columnNames} (empty = all). */
    public List<ColumnSet> select(List<String> columnNames, ColumnSet conditions) {
        ColumnSet conds = checkAndCoerce(conditions, TableMethod.SELECT);
        Operator plan = new ProjectionOperator(
            new FilterOperator(new SeqScanOperator(this), EqualityPredicate.exact(conds, name)),
            columnNames, name);
        return Operator.drain(plan);
    }

    /**
     * Apply {@code set} to every live row matching {@code conditions}. A changed row is appended
     * as a new row and the old one tombstoned; rows appended by this call are not revisited.
     * Every new image advances the serial counter as an insert does, but the row keeps its own
     * serial values. Returns the new images of changed rows.
     */
    public List<ColumnSet> update(ColumnSet set, ColumnSet conditions) {
        ColumnSet assignments = checkAndCoerce(set, TableMethod.UPDATE);
        ColumnSet conds = checkAndCoerce(conditions, TableMethod.NONE);
        Predicate matches = EqualityPredicate.exact(conds, name);
        List<ColumnSet> updated = new ArrayList<>();
        try {
            RowCursor cursor = new RowCursor(channel, columns, HEADER_SIZE, channel.size());
            StoredRow stored;
            while ((stored = cursor.next()) != null) {
                if (!matches.test(stored.values())) continue;
                ColumnSet row = stored.values().copy();
                boolean changed = false;
                for (Map.Entry<String, TypedValue> e : assignments.entries()) {
                    TypedValue old = row.put(e.getKey(), e.getValue());
                    changed |= !e.getValue().equals(old);
                }
                if (!changed) continue;
                // the new image is written like an insert: counter first, then the row
                bumpSerial();
                append(ValueCodec.encodeRow(columns, row));
                markDeleted(stored.offset());
                updated.add(row);
            }
        } catch (IOException e) {
            throw DbException.io(e);
        }
        return updated;
    }

    /** Tombstone every live row matching {@code conditions}; returns the removed rows. */
    public List<ColumnSet> delete(ColumnSet conditions) {
        ColumnSet conds = checkAndCoerce(conditions, TableMethod.DELETE);
        Predicate matches = EqualityPredicate.exact(conds, name);
        List<ColumnSet> deleted = new ArrayList<>();
        try {
            RowCursor cursor = cursor();
            StoredRow stored;
            while ((stored = cursor.next()) != null) {
                if (!matches.test(stored.values())) continue;
                markDeleted(stored.offset());
                deleted.add(stored.values());
            }
        } catch (IOException e) {
            throw DbException.io(e);
        }
        return deleted;
    }

    /**
     * Inner join of this table (left) with {@code other} (right). Columns of both sides are
     * named {@code <table>.<column>}; {@code conditions} and {@code columnNames} use those names.
     */
    public List<ColumnSet> join(Table other, List<String> columnNames, ColumnSet conditions, List<JoinKey> joinOn) {
        Operator joined = new JoinOperator(new SeqScanOperator(this, name), new SeqScanOperator(other, other.name), joinOn);
        Operator plan = new ProjectionOperator(
            new FilterOperator(joined, EqualityPredicate.coercing(conditions, name)),
            columnNames, name);
        return Operator.drain(plan);
    }

    /** Truncate the file. Removing the schema entry is the caller's business. */
    public void drop() {
        try {
            channel.truncate(0);
            serial = 0;
        } catch (IOException e) {
            throw DbException.io(e);
        }
    }

    @Override
    public void close() throws IOException {
        if (channel.isOpen()) {
            channel.force(true);
            channel.close();
        }
    }

    RowCursor cursor() {
        try {
            return new RowCursor(channel, columns, HEADER_SIZE, channel.size());
        } catch (IOException e) {
            throw DbException.io(e);
        }
    }

    /**
     * Match {@code values} against the declared columns: restriction check, coercion to the
     * column type and validation. Unknown columns fail with COLUMN_NOT_FOUND.
     */
    ColumnSet checkAndCoerce(ColumnSet values, TableMethod method) {
        ColumnSet remaining = values == null ? new ColumnSet() : values.copy();
        ColumnSet coerced = new ColumnSet();
        for (Column c : columns) {
            TypedValue v = remaining.remove(c.name());
            if (v == null) continue;
            if (method.forbids(c.type())) {
                throw DbException.invalidOperation("Cannot insert to or update serial column");
            }
            TypedValue typed = v.coerce(c.type());
            typed.validate();
            coerced.put(c.name(), typed);
        }
        if (!remaining.isEmpty()) {
            throw DbException.columnNotFound(remaining.columns().iterator().next(), name);
        }
        return coerced;
    }

    private void bumpSerial() throws IOException {
        serial = (serial + 1) & 0xFFFFFFFFL;
        log.debug("Writing serial `{}` to table `{}`", serial, name);
        writeFully(channel, serialBytes(serial), 0);
    }

    private void append(byte[] row) throws IOException {
        writeFully(channel, ByteBuffer.wrap(row), channel.size());
    }

    private void markDeleted(long offset) throws IOException {
        log.debug("Tombstoning row at {} in table `{}`", offset, name);
        writeFully(channel, ByteBuffer.wrap(new byte[] {ValueCodec.TOMBSTONE}), offset);
    }

    private static ByteBuffer serialBytes(long serial) {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt((int) serial);
        buf.flip();
        return buf;
    }

    private static long readSerial(FileChannel channel) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        while (buf.hasRemaining()) {
            if (channel.read(buf, buf.position()) < 0) throw new IOException("Unexpected end of table header");
        }
        buf.flip();
        return Integer.toUnsignedLong(buf.getInt());
    }

    private static void writeFully(FileChannel channel, ByteBuffer buf, long position) throws IOException {
        long at = position;
        while (buf.hasRemaining()) {
            at += channel.write(buf, at);
        }
    }

    private static void closeQuietly(FileChannel channel, IOException primary) {
        if (channel == null) return;
        try {
            channel.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }

    @Override
    public String toString() {
        return "Table{name='" + name + "', columns=" + columns + ", serial=" + serial + ", file='" + file + "'}";
    }
}
