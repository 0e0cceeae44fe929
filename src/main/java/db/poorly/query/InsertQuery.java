package db.poorly.query;

import db.poorly.exec.ColumnSet;

/** Logical representation of an INSERT statement. */
public record InsertQuery(String db, String into, ColumnSet values) implements Query {
    public InsertQuery {
        if (values == null) throw new IllegalArgumentException("values required");
    }
}
