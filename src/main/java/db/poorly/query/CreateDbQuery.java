package db.poorly.query;

public record CreateDbQuery(String name) implements Query {}
