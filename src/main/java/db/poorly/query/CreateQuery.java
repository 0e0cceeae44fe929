package db.poorly.query;

import java.util.List;

import db.poorly.catalog.Column;

public record CreateQuery(String db, String table, List<Column> columns) implements Query {
    public CreateQuery {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }
}
