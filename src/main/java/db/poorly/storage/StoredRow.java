package db.poorly.storage;

import db.poorly.exec.ColumnSet;

/**
 * Simple carrier tying a live row to the file offset of its tombstone byte.
 */
public record StoredRow(long offset, ColumnSet values) {}
