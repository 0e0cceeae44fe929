package db.poorly.query;

public record DropQuery(String db, String table) implements Query {}
