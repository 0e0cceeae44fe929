package db.poorly.exec;

import java.util.List;

import db.poorly.error.DbException;

/**
 * Projection operator: keeps the requested columns of child rows.
 * An empty column list keeps every column. Requesting a column the row does not have
 * fails with COLUMN_NOT_FOUND.
 */
public class ProjectionOperator implements Operator {
    private final Operator child;
    private final List<String> columnNames;
    private final String tableName; // for error messages

    public ProjectionOperator(Operator child, List<String> columnNames, String tableName) {
        this.child = child;
        this.columnNames = columnNames == null ? List.of() : List.copyOf(columnNames);
        this.tableName = tableName;
    }

    @Override
    public void open() { child.open(); }

    @Override
    public ColumnSet next() {
        ColumnSet r = child.next();
        if (r == null) return null;
        if (columnNames.isEmpty()) return r;
        for (String name : columnNames) {
            if (!r.containsKey(name)) throw DbException.columnNotFound(name, tableName);
        }
        ColumnSet projected = r.copy();
        projected.retainColumns(columnNames);
        return projected;
    }

    @Override
    public void close() { child.close(); }
}
