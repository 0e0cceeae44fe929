package db.poorly.database;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.poorly.catalog.Column;
import db.poorly.catalog.Schema;
import db.poorly.error.DbException;
import db.poorly.storage.Table;

/**
 * One named database: a directory holding the schema file and one file per table.
 *
 * Tables are opened on first use and stay open until the table is dropped or the database is
 * closed; the cache has no size bound. The schema is written after every change and again on
 * {@link #close()}.
 *
 * Methods are synchronized on the database; table work itself runs under the table's own lock
 * (see SharedTable), taken after the database monitor when both are needed.
 */
public class Database implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final String name;
    private final Path path;
    private final Path schemaFile;
    private final Schema schema;
    private final boolean reserved;
    private final Map<String, SharedTable> tables = new HashMap<>();
    private boolean closed; // dropped or closed

    private Database(String name, Path path, Path schemaFile, Schema schema, boolean reserved) {
        this.name = name;
        this.path = path;
        this.schemaFile = schemaFile;
        this.schema = schema;
        this.reserved = reserved;
    }

    /**
     * Open the existing database {@code root/name}. A reserved database refuses to be dropped.
     * An unreadable schema file fails with CorruptSchemaException.
     */
    public static Database open(String name, Path root, String schemaFileName, boolean reserved) {
        log.info("Opening database `{}`", name);
        Path path = root.resolve(name);
        if (!Files.isDirectory(path)) throw DbException.databaseNotFound(name);
        Path schemaFile = path.resolve(schemaFileName);
        Schema schema = Schema.load(schemaFile);
        log.info("Database `{}` loaded with {} table(s)", name, schema.tableNames().size());
        return new Database(name, path, schemaFile, schema, reserved);
    }

    /** Create the directory {@code root/name} with an empty schema. */
    public static void create(String name, Path root, String schemaFileName) {
        Path path = root.resolve(name);
        if (Files.exists(path)) throw DbException.databaseAlreadyExists(name);
        try {
            Files.createDirectories(path);
            Schema.newPoorly(name).save(path.resolve(schemaFileName));
        } catch (IOException e) {
            throw DbException.io(e);
        }
        log.info("Created database `{}` at {}", name, path);
    }

    public String name() { return name; }

    /** Handle for a declared table, opening its file on first use. */
    public synchronized SharedTable getTable(String tableName) {
        checkOpen();
        List<Column> columns = schema.columns(tableName);
        if (columns == null) throw DbException.tableNotFound(tableName);
        return tables.computeIfAbsent(tableName, t -> new SharedTable(Table.open(t, columns, path)));
    }

    public synchronized void createTable(String tableName, List<Column> columns) {
        checkOpen();
        schema.createTable(tableName, columns);
        flush();
    }

    /** Remove the table from the schema, then truncate its file and forget the handle. */
    public synchronized void dropTable(String tableName) {
        SharedTable table = getTable(tableName);
        schema.dropTable(tableName);
        flush();
        tables.remove(tableName);
        table.drop();
        log.info("Dropped table `{}` from `{}`", tableName, name);
    }

    public synchronized void alterTable(String tableName, Map<String, String> rename) {
        checkOpen();
        schema.alterTable(tableName, rename);
        flush();
        SharedTable open = tables.get(tableName);
        if (open != null) open.refreshColumns(schema.columns(tableName));
    }

    /** Declared table names, whether or not they have been opened. */
    public synchronized List<String> getTables() {
        checkOpen();
        return new ArrayList<>(schema.tableNames());
    }

    /** Schema as JSON. */
    public synchronized String describe() {
        checkOpen();
        return schema.describe();
    }

    /** Delete the database directory and everything in it. */
    public synchronized void drop() {
        checkOpen();
        if (reserved) throw DbException.cannotDropDefaultDb();
        closeTables();
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        } catch (IOException e) {
            throw DbException.io(e);
        }
        closed = true;
        log.info("Database `{}` dropped", name);
    }

    /** Persist the schema. */
    public synchronized void flush() {
        if (closed || !Files.isDirectory(path)) return;
        try {
            schema.save(schemaFile);
        } catch (IOException e) {
            throw DbException.io(e);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) return;
        try {
            if (Files.isDirectory(path)) schema.save(schemaFile);
        } finally {
            closed = true;
            closeTables();
        }
    }

    private void closeTables() {
        IOException failure = null;
        for (SharedTable t : tables.values()) {
            try {
                t.close();
            } catch (IOException e) {
                if (failure == null) failure = e;
                else failure.addSuppressed(e);
            }
        }
        tables.clear();
        if (failure != null) throw DbException.io(failure);
    }

    private void checkOpen() {
        if (closed) throw DbException.databaseNotFound(name);
    }
}
