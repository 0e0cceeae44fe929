package db.poorly.query;

import db.poorly.exec.ColumnSet;

/** Logical representation of an UPDATE: assign {@code set} on rows matching {@code conditions}. */
public record UpdateQuery(String db, String table, ColumnSet set, ColumnSet conditions) implements Query {
    public UpdateQuery {
        if (set == null) throw new IllegalArgumentException("set required");
        conditions = conditions == null ? new ColumnSet() : conditions;
    }
}
