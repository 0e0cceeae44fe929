package db.poorly.storage;

import db.poorly.catalog.DataType;

/**
 * Operation on whose behalf a column set is checked. Drives the per-column restrictions;
 * NONE skips them.
 */
public enum TableMethod {
    INSERT,
    UPDATE,
    SELECT,
    DELETE,
    NONE;

    /** Serial columns are engine-assigned: they cannot be inserted into or updated. */
    public boolean forbids(DataType type) {
        return type == DataType.SERIAL && (this == INSERT || this == UPDATE);
    }
}
