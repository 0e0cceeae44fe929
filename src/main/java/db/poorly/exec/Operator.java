package db.poorly.exec;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal physical operator interface
 */
public interface Operator {
    void open();
    ColumnSet next(); // returns next row or null when exhausted
    void close();

    /** Run the pipeline to completion and collect its rows. */
    static List<ColumnSet> drain(Operator op) {
        List<ColumnSet> out = new ArrayList<>();
        op.open();
        try {
            ColumnSet row;
            while ((row = op.next()) != null) out.add(row);
        } finally {
            op.close();
        }
        return out;
    }
}
