package db.poorly.storage;

import java.io.IOException;
import java.util.Map;

import db.poorly.catalog.TypedValue;
import db.poorly.error.DbException;
import db.poorly.exec.ColumnSet;
import db.poorly.exec.Operator;

/**
 * Physical operator that performs a full table scan over live rows in file order.
 * With a prefix, every column is renamed to {@code <prefix>.<column>} (used by joins).
 */
public class SeqScanOperator implements Operator {
    private final Table table;
    private final String prefix;

    private RowCursor cursor;

    public SeqScanOperator(Table table) {
        this(table, null);
    }

    public SeqScanOperator(Table table, String prefix) {
        this.table = table;
        this.prefix = prefix;
    }

    @Override
    public void open() {
        cursor = table.cursor();
    }

    @Override
    public ColumnSet next() {
        if (cursor == null) return null;
        StoredRow row;
        try {
            row = cursor.next();
        } catch (IOException e) {
            throw DbException.io(e);
        }
        if (row == null) return null;
        if (prefix == null) return row.values();
        ColumnSet renamed = new ColumnSet();
        for (Map.Entry<String, TypedValue> e : row.values().entries()) {
            renamed.put(prefix + "." + e.getKey(), e.getValue());
        }
        return renamed;
    }

    @Override
    public void close() {
        cursor = null;
    }
}
