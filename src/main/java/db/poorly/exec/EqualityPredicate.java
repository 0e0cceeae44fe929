package db.poorly.exec;

import java.util.Map;

import db.poorly.catalog.TypedValue;
import db.poorly.error.DbException;

/**
 * AND of column = value tests. An empty condition set matches every row.
 *
 * Every condition is evaluated (no short-circuit), so a condition naming a column the row
 * does not have always fails with COLUMN_NOT_FOUND, whatever the other conditions say.
 */
public class EqualityPredicate implements Predicate {
    private final ColumnSet expected;
    private final String tableName; // for error messages
    private final boolean coerceToRow;

    private EqualityPredicate(ColumnSet expected, String tableName, boolean coerceToRow) {
        this.expected = expected;
        this.tableName = tableName;
        this.coerceToRow = coerceToRow;
    }

    /** Conditions already coerced to the column types; compared as they are. */
    public static EqualityPredicate exact(ColumnSet conditions, String tableName) {
        return new EqualityPredicate(conditions, tableName, false);
    }

    /** Each condition value is coerced to the runtime type of the row's value before comparing. */
    public static EqualityPredicate coercing(ColumnSet conditions, String tableName) {
        return new EqualityPredicate(conditions, tableName, true);
    }

    @Override
    public boolean test(ColumnSet row) {
        boolean result = true;
        for (Map.Entry<String, TypedValue> e : expected.entries()) {
            TypedValue actual = row.get(e.getKey());
            if (actual == null) throw DbException.columnNotFound(e.getKey(), tableName);
            TypedValue want = coerceToRow ? e.getValue().coerce(actual.type()) : e.getValue();
            result &= actual.equals(want);
        }
        return result;
    }

    // For debugging
    @Override
    public String toString() { return "EQ" + expected; }
}
