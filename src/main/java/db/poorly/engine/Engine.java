package db.poorly.engine;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

import db.poorly.catalog.Schema;
import db.poorly.catalog.TypedValue;
import db.poorly.catalog.TypedValueAdapter;
import db.poorly.database.Database;
import db.poorly.database.SharedTable;
import db.poorly.error.DbException;
import db.poorly.exec.ColumnSet;
import db.poorly.query.AlterQuery;
import db.poorly.query.CreateDbQuery;
import db.poorly.query.CreateQuery;
import db.poorly.query.DeleteQuery;
import db.poorly.query.DropDbQuery;
import db.poorly.query.DropQuery;
import db.poorly.query.InsertQuery;
import db.poorly.query.JoinQuery;
import db.poorly.query.Query;
import db.poorly.query.SelectQuery;
import db.poorly.query.ShowTablesQuery;
import db.poorly.query.UpdateQuery;

/**
 * Entry point: owns the data directory and every database opened under it.
 *
 * Databases are opened on first reference and cached until dropped or until the engine is
 * closed. Lock order is engine cache, then database, then table.
 */
public class Engine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Engine.class);

    /** Placeholder value in the ShowTables row. */
    public static final String TABLE_MARKER = "table";

    private final EngineConfig config;
    private final Map<String, Database> databases = new HashMap<>();
    private boolean closed; // guarded by databases

    private Engine(EngineConfig config) {
        this.config = config;
    }

    /** Open an engine over {@code config.getDataDir()}, creating the directory if needed. */
    public static Engine open(EngineConfig config) {
        Path dir = config.getDataDir();
        if (Files.exists(dir) && !Files.isDirectory(dir)) {
            throw DbException.invalidOperation("Data directory " + dir + " is not a directory");
        }
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw DbException.io(e);
        }
        log.info("Engine opened with {}", config);
        return new Engine(config);
    }

    /** Make sure the default database exists. Safe to call any number of times. */
    public void init() {
        synchronized (databases) {
            String name = config.getDefaultDatabase();
            if (Files.isDirectory(config.getDataDir().resolve(name))) {
                log.debug("Default database `{}` already present", name);
                return;
            }
            Database.create(name, config.getDataDir(), config.getSchemaFileName());
            log.info("Initialized default database `{}`", name);
        }
    }

    /**
     * Run one query. Create, CreateDb, Drop, DropDb and Alter return no rows; Insert returns the
     * stored row; ShowTables returns one row keyed by table name (see {@link #listTables}).
     */
    public List<ColumnSet> execute(Query query) {
        log.debug("Executing {}", query);
        if (query instanceof SelectQuery q) {
            return table(q.db(), q.from()).select(q.columns(), q.conditions());
        } else if (query instanceof InsertQuery q) {
            return List.of(table(q.db(), q.into()).insert(q.values()));
        } else if (query instanceof UpdateQuery q) {
            return table(q.db(), q.table()).update(q.set(), q.conditions());
        } else if (query instanceof DeleteQuery q) {
            return table(q.db(), q.from()).delete(q.conditions());
        } else if (query instanceof JoinQuery q) {
            Database db = getDatabase(q.db());
            return SharedTable.join(db.getTable(q.table1()), db.getTable(q.table2()),
                q.columns(), q.conditions(), q.joinOn());
        } else if (query instanceof CreateQuery q) {
            getDatabase(q.db()).createTable(q.table(), q.columns());
            return List.of();
        } else if (query instanceof DropQuery q) {
            getDatabase(q.db()).dropTable(q.table());
            return List.of();
        } else if (query instanceof AlterQuery q) {
            getDatabase(q.db()).alterTable(q.table(), q.rename());
            return List.of();
        } else if (query instanceof CreateDbQuery q) {
            createDb(q.name());
            return List.of();
        } else if (query instanceof DropDbQuery q) {
            dropDb(q.name());
            return List.of();
        } else if (query instanceof ShowTablesQuery q) {
            ColumnSet row = new ColumnSet();
            for (String t : listTables(q.db())) row.put(t, TypedValue.ofString(TABLE_MARKER));
            return List.of(row);
        }
        throw DbException.invalidOperation("Unsupported query " + query);
    }

    public void createDb(String name) {
        Schema.validateName(name);
        synchronized (databases) {
            checkOpen();
            Database.create(name, config.getDataDir(), config.getSchemaFileName());
        }
    }

    /** Delete a database and its files. The default database cannot be dropped. */
    public void dropDb(String name) {
        synchronized (databases) {
            Database db = getDatabase(name);
            db.drop();
            databases.remove(name);
        }
    }

    public List<String> listTables(String db) {
        return getDatabase(db).getTables();
    }

    /** Schema of {@code db} as JSON. */
    public String describe(String db) {
        return getDatabase(db).describe();
    }

    /** Cached handle for {@code name}, opening it on first use. */
    public Database getDatabase(String name) {
        Schema.validateName(name);
        synchronized (databases) {
            checkOpen();
            Database db = databases.get(name);
            if (db == null) {
                boolean reserved = name.equals(config.getDefaultDatabase());
                db = Database.open(name, config.getDataDir(), config.getSchemaFileName(), reserved);
                databases.put(name, db);
            }
            return db;
        }
    }

    /** Write every open schema to disk. */
    public void flush() {
        synchronized (databases) {
            for (Database db : databases.values()) db.flush();
        }
    }

    /** Close every open database. The engine cannot be used afterwards. */
    @Override
    public void close() {
        synchronized (databases) {
            if (closed) return;
            closed = true;
            IOException failure = null;
            for (Database db : databases.values()) {
                try {
                    db.close();
                } catch (IOException e) {
                    if (failure == null) failure = e;
                    else failure.addSuppressed(e);
                }
            }
            databases.clear();
            log.info("Engine closed");
            if (failure != null) throw DbException.io(failure);
        }
    }

    private SharedTable table(String db, String table) {
        return getDatabase(db).getTable(table);
    }

    private void checkOpen() {
        if (closed) throw DbException.invalidOperation("Engine is closed");
    }

    /** Gson rendering rows as JSON objects of plain values. */
    public static Gson gson() {
        return new GsonBuilder()
            .registerTypeAdapter(TypedValue.class, new TypedValueAdapter())
            .registerTypeAdapter(ColumnSet.class, new ColumnSetAdapter())
            .create();
    }

    private static final class ColumnSetAdapter implements JsonSerializer<ColumnSet>, JsonDeserializer<ColumnSet> {
        @Override
        public JsonElement serialize(ColumnSet src, Type typeOfSrc, JsonSerializationContext ctx) {
            JsonObject obj = new JsonObject();
            for (Map.Entry<String, TypedValue> e : src.entries()) {
                obj.add(e.getKey(), ctx.serialize(e.getValue(), TypedValue.class));
            }
            return obj;
        }

        @Override
        public ColumnSet deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext ctx) {
            if (!json.isJsonObject()) throw new JsonParseException("Expected an object of column values, got " + json);
            ColumnSet row = new ColumnSet();
            for (Map.Entry<String, JsonElement> e : json.getAsJsonObject().entrySet()) {
                row.put(e.getKey(), ctx.deserialize(e.getValue(), TypedValue.class));
            }
            return row;
        }
    }
}
