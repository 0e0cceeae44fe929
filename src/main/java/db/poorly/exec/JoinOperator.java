package db.poorly.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.poorly.catalog.TypedValue;

/**
 * Grouped INNER JOIN on a conjunction of equality pairs.
 *
 * The right side is materialized on open. For every left row, the right rows equal on all
 * {@link JoinKey}s form its group; a non-empty group yields a single row: the left row with
 * each right row of the group merged into it in scan order (later rows win on equal keys).
 * Left rows without a group produce nothing.
 *
 * Keys are compared in list order and the first unequal pair decides. A missing operand, or two
 * operands without an ordering (different types, NaN), counts as "less", so the pair never
 * matches; such comparisons are reported as warnings.
 */
public class JoinOperator implements Operator {
    private static final Logger log = LoggerFactory.getLogger(JoinOperator.class);

    private final Operator left;
    private final Operator right;
    private final List<JoinKey> keys;

    private List<ColumnSet> rightRows;
    private long incomparable;

    public JoinOperator(Operator left, Operator right, List<JoinKey> keys) {
        this.left = left;
        this.right = right;
        this.keys = List.copyOf(keys);
    }

    @Override
    public void open() {
        left.open();
        rightRows = new ArrayList<>();
        right.open();
        try {
            ColumnSet r;
            while ((r = right.next()) != null) rightRows.add(r);
        } finally {
            right.close(); // no longer needed
        }
        incomparable = 0;
    }

    @Override
    public ColumnSet next() {
        ColumnSet l;
        while ((l = left.next()) != null) {
            ColumnSet merged = null;
            for (ColumnSet r : rightRows) {
                if (compare(l, r) != 0) continue;
                if (merged == null) merged = l.copy();
                merged.putAll(r);
            }
            if (merged != null) return merged;
        }
        return null;
    }

    /** Negative, zero or positive like a comparator; unknown orderings come back as -1. */
    int compare(ColumnSet l, ColumnSet r) {
        for (JoinKey key : keys) {
            TypedValue v1 = l.get(key.leftColumn());
            TypedValue v2 = r.get(key.rightColumn());
            OptionalInt ord = v1 == null || v2 == null ? OptionalInt.empty() : v1.partialCompare(v2);
            if (ord.isEmpty()) {
                if (incomparable++ == 0) {
                    log.warn("Join key {} = {} not comparable ({} vs {}), treating as less",
                        key.leftColumn(), key.rightColumn(), v1, v2);
                }
                return -1;
            }
            if (ord.getAsInt() != 0) return ord.getAsInt();
        }
        return 0;
    }

    @Override
    public void close() {
        left.close();
        rightRows = null;
        if (incomparable > 1) {
            log.warn("Join had {} incomparable key comparisons in total", incomparable);
        }
    }
}
