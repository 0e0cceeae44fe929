package db.poorly.query;

import java.util.List;

import db.poorly.exec.ColumnSet;
import db.poorly.exec.JoinKey;

/**
 * Logical INNER JOIN of {@code table1} (left) and {@code table2} (right) of the same database.
 * Columns, conditions and join keys use {@code <table>.<column>} names. {@code joinOn} is
 * ordered: keys are compared in this order.
 */
public record JoinQuery(String db, String table1, String table2, List<String> columns,
                        ColumnSet conditions, List<JoinKey> joinOn) implements Query {
    public JoinQuery {
        columns = columns == null ? List.of() : List.copyOf(columns);
        conditions = conditions == null ? new ColumnSet() : conditions;
        joinOn = joinOn == null ? List.of() : List.copyOf(joinOn);
    }
}
