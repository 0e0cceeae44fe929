package db.poorly.database;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import db.poorly.catalog.Column;
import db.poorly.error.DbException;
import db.poorly.exec.ColumnSet;
import db.poorly.exec.JoinKey;
import db.poorly.storage.Table;

/**
 * A {@link Table} guarded by a reader/writer lock. Selects and joins share the read lock,
 * everything that writes the file or changes the column list takes the write lock.
 *
 * Once dropped or closed the handle refuses further work with TABLE_NOT_FOUND, so callers
 * that fetched it before a concurrent drop fail cleanly.
 */
public final class SharedTable implements Closeable {
    private final Table table;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private boolean closed; // guarded by lock

    SharedTable(Table table) {
        this.table = table;
    }

    public String name() { return table.name(); }

    /** Stable identity used to order lock acquisition across tables. */
    String lockKey() { return table.file().toAbsolutePath().toString(); }

    public List<Column> columns() {
        return read(table::columns);
    }

    public ColumnSet insert(ColumnSet values) {
        return write(() -> table.insert(values));
    }

    public List<ColumnSet> select(List<String> columns, ColumnSet conditions) {
        return read(() -> table.select(columns, conditions));
    }

    public List<ColumnSet> update(ColumnSet set, ColumnSet conditions) {
        return write(() -> table.update(set, conditions));
    }

    public List<ColumnSet> delete(ColumnSet conditions) {
        return write(() -> table.delete(conditions));
    }

    /**
     * Join {@code left} with {@code right}. Read locks are taken in {@link #lockKey()} order, not
     * argument order, so two joins naming the same tables the other way round cannot deadlock.
     */
    public static List<ColumnSet> join(SharedTable left, SharedTable right, List<String> columns,
                                       ColumnSet conditions, List<JoinKey> joinOn) {
        if (left == right) {
            return left.read(() -> left.table.join(left.table, columns, conditions, joinOn));
        }
        boolean leftFirst = left.lockKey().compareTo(right.lockKey()) <= 0;
        SharedTable first = leftFirst ? left : right;
        SharedTable second = leftFirst ? right : left;
        return first.read(() -> second.read(() -> left.table.join(right.table, columns, conditions, joinOn)));
    }

    void refreshColumns(List<Column> columns) {
        write(() -> {
            table.setColumns(columns);
            return null;
        });
    }

    /** Truncate the backing file and release it. */
    void drop() {
        write(() -> {
            table.drop();
            closeTable();
            return null;
        });
    }

    @Override
    public void close() throws IOException {
        Lock w = lock.writeLock();
        w.lock();
        try {
            if (closed) return;
            closed = true;
            table.close();
        } finally {
            w.unlock();
        }
    }

    private void closeTable() {
        closed = true;
        try {
            table.close();
        } catch (IOException e) {
            throw DbException.io(e);
        }
    }

    private <T> T read(Supplier<T> action) {
        return locked(lock.readLock(), action);
    }

    private <T> T write(Supplier<T> action) {
        return locked(lock.writeLock(), action);
    }

    private <T> T locked(Lock l, Supplier<T> action) {
        l.lock();
        try {
            if (closed) throw DbException.tableNotFound(table.name());
            return action.get();
        } finally {
            l.unlock();
        }
    }
}
