package db.poorly.exec;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import db.poorly.catalog.TypedValue;

/**
 * Column name to value mapping. The same shape is used for insert payloads, update
 * assignments, filter conditions and result rows. Equality ignores key order.
 */
public final class ColumnSet {
    private final Map<String, TypedValue> values;

    public ColumnSet() {
        this.values = new LinkedHashMap<>();
    }

    public ColumnSet(Map<String, TypedValue> values) {
        this.values = new LinkedHashMap<>(values);
    }

    public static ColumnSet of() { return new ColumnSet(); }

    public static ColumnSet of(String k1, TypedValue v1) {
        ColumnSet cs = new ColumnSet();
        cs.put(k1, v1);
        return cs;
    }

    public static ColumnSet of(String k1, TypedValue v1, String k2, TypedValue v2) {
        ColumnSet cs = of(k1, v1);
        cs.put(k2, v2);
        return cs;
    }

    public static ColumnSet of(String k1, TypedValue v1, String k2, TypedValue v2, String k3, TypedValue v3) {
        ColumnSet cs = of(k1, v1, k2, v2);
        cs.put(k3, v3);
        return cs;
    }

    /** Previous value for {@code column}, or null. */
    public TypedValue put(String column, TypedValue value) { return values.put(column, value); }

    public void putAll(ColumnSet other) { values.putAll(other.values); }

    public TypedValue get(String column) { return values.get(column); }

    public TypedValue remove(String column) { return values.remove(column); }

    public boolean containsKey(String column) { return values.containsKey(column); }

    public Set<String> columns() { return Collections.unmodifiableSet(values.keySet()); }

    public Set<Map.Entry<String, TypedValue>> entries() { return Collections.unmodifiableSet(values.entrySet()); }

    /** Keep only the given columns. */
    public void retainColumns(Collection<String> keep) { values.keySet().retainAll(keep); }

    public int size() { return values.size(); }

    public boolean isEmpty() { return values.isEmpty(); }

    public ColumnSet copy() { return new ColumnSet(values); }


    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnSet cs)) return false;
        return values.equals(cs.values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() { return values.toString(); }
}
