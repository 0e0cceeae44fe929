package db.poorly.catalog;

import db.poorly.error.CorruptSchemaException;

/**
 * Storage kind recorded in the schema header. Only the native kind is created by this
 * engine; {@code sqlite} is recognised so such headers load and save unchanged.
 */
public enum SchemaKind {
    POORLY("poorly"),
    SQLITE("sqlite");

    private final String tag;

    SchemaKind(String tag) {
        this.tag = tag;
    }

    public String tag() { return tag; }

    static SchemaKind fromTag(String tag) {
        for (SchemaKind k : values()) {
            if (k.tag.equals(tag)) return k;
        }
        throw new CorruptSchemaException("Unknown schema kind: " + tag);
    }
}
