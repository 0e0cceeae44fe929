package db.poorly.query;

import java.util.List;

import db.poorly.exec.ColumnSet;

/**
 * Logical SELECT query representation.
 * columns: empty list means every column.
 * conditions: column = value tests, all of which must hold; empty matches every row.
 */
public record SelectQuery(String db, String from, List<String> columns, ColumnSet conditions) implements Query {
    public SelectQuery {
        columns = columns == null ? List.of() : List.copyOf(columns);
        conditions = conditions == null ? new ColumnSet() : conditions;
    }
}
