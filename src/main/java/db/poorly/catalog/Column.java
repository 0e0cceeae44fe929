package db.poorly.catalog;

// Immutable data carrier for a table column.
public record Column(String name, DataType type) {
    public Column withName(String newName) { return new Column(newName, type); }
}
