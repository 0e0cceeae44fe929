package db.poorly.query;

public record ShowTablesQuery(String db) implements Query {}
