package db.poorly.query;

public record DropDbQuery(String name) implements Query {}
