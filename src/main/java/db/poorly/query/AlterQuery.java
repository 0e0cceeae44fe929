package db.poorly.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Rename columns of {@code table}: old name -> new name. */
public record AlterQuery(String db, String table, Map<String, String> rename) implements Query {
    public AlterQuery {
        rename = rename == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rename));
    }
}
