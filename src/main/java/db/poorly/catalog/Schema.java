package db.poorly.catalog;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import db.poorly.error.CorruptSchemaException;
import db.poorly.error.DbException;

/**
 * Table definitions of one database.
 *
 * File format (UTF-8 text):
 * <pre>
 * &lt;database-name&gt;:&lt;kind&gt;
 * &lt;table&gt;#&lt;col1&gt;:&lt;type1&gt;,&lt;col2&gt;:&lt;type2&gt;,...
 * </pre>
 * Columns of a table are sorted by name when the table is created and keep that order
 * afterwards; it is the physical order of values in a row.
 *
 * Not thread-safe, callers serialize access (see Database).
 */
public class Schema {
    private static final Logger log = LoggerFactory.getLogger(Schema.class);

    private final Map<String, List<Column>> tables = new LinkedHashMap<>();
    private final String name;
    private final SchemaKind kind;

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public Schema(String name, SchemaKind kind) {
        this.name = name;
        this.kind = kind;
    }

    public static Schema newPoorly(String name) { return new Schema(name, SchemaKind.POORLY); }

    public String name() { return name; }
    public SchemaKind kind() { return kind; }

    public boolean hasTable(String table) { return tables.containsKey(table); }

    /** Columns of {@code table} in physical order, or null when the table is not declared. */
    public List<Column> columns(String table) { return tables.get(table); }

    public Set<String> tableNames() { return Collections.unmodifiableSet(tables.keySet()); }

    public void createTable(String table, List<Column> columns) {
        validateName(table);
        if (columns == null || columns.isEmpty()) throw DbException.noColumns();
        if (tables.containsKey(table)) throw DbException.tableAlreadyExists(table);

        List<Column> sorted = new ArrayList<>(columns);
        sorted.sort(Comparator.comparing(Column::name).thenComparing(Column::type));
        for (int i = 0; i < sorted.size(); i++) {
            String column = sorted.get(i).name();
            validateName(column);
            if (i > 0 && column.equals(sorted.get(i - 1).name())) {
                throw DbException.columnAlreadyExists(column, table);
            }
        }
        tables.put(table, List.copyOf(sorted));
    }

    public void dropTable(String table) {
        if (tables.remove(table) == null) throw DbException.tableNotFound(table);
    }

    /**
     * Rename columns of {@code table}. Column order and types stay as they are.
     * Every key of {@code rename} must name an existing column.
     */
    public void alterTable(String table, Map<String, String> rename) {
        List<Column> current = tables.get(table);
        if (current == null) throw DbException.tableNotFound(table);

        Map<String, String> pending = new LinkedHashMap<>(rename);
        List<Column> renamed = new ArrayList<>(current.size());
        for (Column c : current) {
            String newName = c.name();
            if (pending.containsKey(c.name())) {
                validateName(pending.get(c.name()));
                newName = pending.remove(c.name());
            }
            for (Column done : renamed) {
                if (done.name().equals(newName)) throw DbException.columnAlreadyExists(newName, table);
            }
            renamed.add(c.withName(newName));
        }
        if (!pending.isEmpty()) {
            throw DbException.columnNotFound(pending.keySet().iterator().next(), table);
        }
        tables.put(table, List.copyOf(renamed));
    }

    /** JSON description: name, kind and a column-to-type map per table. */
    public String describe() {
        JsonObject root = new JsonObject();
        root.addProperty("name", name);
        root.addProperty("kind", kind.tag());
        JsonObject tablesJson = new JsonObject();
        for (Map.Entry<String, List<Column>> e : tables.entrySet()) {
            JsonObject cols = new JsonObject();
            for (Column c : e.getValue()) cols.addProperty(c.name(), c.type().keyword());
            tablesJson.add(e.getKey(), cols);
        }
        root.add("tables", tablesJson);
        return gson.toJson(root);
    }

    public static Schema load(Path file) {
        log.info("Loading schema from {}", file);
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String header = reader.readLine();
            if (header == null) throw new CorruptSchemaException("Schema file is empty: " + file);
            int sep = header.indexOf(':');
            if (sep < 0) throw new CorruptSchemaException("Schema header corrupted: " + header);
            Schema schema = new Schema(header.substring(0, sep), SchemaKind.fromTag(header.substring(sep + 1)));

            String line;
            while ((line = reader.readLine()) != null) {
                int hash = line.indexOf('#');
                if (hash < 0) throw new CorruptSchemaException("Schema line corrupted: " + line);
                String table = line.substring(0, hash);
                List<Column> cols = schema.tables.computeIfAbsent(table, k -> new ArrayList<>());
                for (String part : line.substring(hash + 1).split(",", -1)) {
                    int colon = part.indexOf(':');
                    if (colon < 0) throw new CorruptSchemaException("Schema column corrupted: " + line);
                    cols.add(new Column(part.substring(0, colon), parseType(part.substring(colon + 1))));
                }
            }
            schema.tables.replaceAll((t, cols) -> List.copyOf(cols));
            return schema;
        } catch (IOException e) {
            throw new CorruptSchemaException("Failed reading schema file: " + file, e);
        }
    }

    /** Write the schema to {@code file}, replacing it atomically. */
    public void save(Path file) throws IOException {
        log.info("Saving schema of {} to {}", name, file);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            writer.write(name + ":" + kind.tag());
            writer.write('\n');
            for (Map.Entry<String, List<Column>> e : tables.entrySet()) {
                StringBuilder sb = new StringBuilder(e.getKey()).append('#');
                List<Column> cols = e.getValue();
                for (int i = 0; i < cols.size(); i++) {
                    if (i > 0) sb.append(',');
                    sb.append(cols.get(i).name()).append(':').append(cols.get(i).type().keyword());
                }
                writer.write(sb.append('\n').toString());
            }
        }
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /** Table, column and database names: letters, digits and underscore, non-empty. */
    public static void validateName(String name) {
        if (name == null || name.isEmpty()) throw DbException.invalidName(String.valueOf(name));
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') throw DbException.invalidName(name);
        }
    }

    private static DataType parseType(String keyword) {
        try {
            return DataType.fromKeyword(keyword);
        } catch (DbException e) {
            throw new CorruptSchemaException("Unknown column type in schema: " + keyword, e);
        }
    }
}
