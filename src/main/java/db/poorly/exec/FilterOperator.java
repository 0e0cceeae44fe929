package db.poorly.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Passes on the child rows accepted by a {@link Predicate}, in child order.
 */
public class FilterOperator implements Operator {
    private static final Logger log = LoggerFactory.getLogger(FilterOperator.class);

    private final Operator child;
    private final Predicate predicate;

    private long scanned;
    private long matched;

    public FilterOperator(Operator child, Predicate predicate) {
        this.child = child;
        this.predicate = predicate;
    }

    @Override
    public void open() {
        scanned = 0;
        matched = 0;
        child.open();
    }

    @Override
    public ColumnSet next() {
        ColumnSet row;
        while ((row = child.next()) != null) {
            scanned++;
            if (predicate.test(row)) {
                matched++;
                return row;
            }
        }
        return null;
    }

    @Override
    public void close() {
        child.close();
        log.debug("{} matched {} of {} rows", predicate, matched, scanned);
    }
}
