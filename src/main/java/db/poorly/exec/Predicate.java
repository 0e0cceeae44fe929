package db.poorly.exec;

/**
 * Row test used by {@link FilterOperator} and by update/delete scans. May throw a
 * DbException when the row cannot be evaluated, e.g. a named column is absent.
 */
@FunctionalInterface
public interface Predicate {
    boolean test(ColumnSet row);
}
