package db.poorly.query;

import db.poorly.exec.ColumnSet;

/** Logical representation of DELETE. Empty conditions remove every row. */
public record DeleteQuery(String db, String from, ColumnSet conditions) implements Query {
    public DeleteQuery {
        conditions = conditions == null ? new ColumnSet() : conditions;
    }
}
