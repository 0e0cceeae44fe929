package db.poorly.engine;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import db.poorly.catalog.Schema;
import db.poorly.error.DbException;

/**
 * Config passed to {@link Engine#open(EngineConfig)}.
 */
public final class EngineConfig {
    public static final String DEFAULT_DATABASE = "poorly";
    public static final String DEFAULT_SCHEMA_FILE = ".schema";

    private final Path dataDir;
    private final String defaultDatabase;
    private final String schemaFileName;

    private EngineConfig(Path dataDir, String defaultDatabase, String schemaFileName) {
        this.dataDir = dataDir;
        this.defaultDatabase = defaultDatabase;
        this.schemaFileName = schemaFileName;
    }

    public Path getDataDir() { return dataDir; }

    /** Name of the reserved database created by {@link Engine#init()}; it cannot be dropped. */
    public String getDefaultDatabase() { return defaultDatabase; }

    public String getSchemaFileName() { return schemaFileName; }

    public static EngineConfig forDataDir(Path dataDir) {
        return builder().setDataDir(dataDir).build();
    }

    public static Builder builder() { return new Builder(); }

    /**
     * Read a JSON config such as {@code {"dataDir": "/var/lib/poorly", "defaultDatabase": "poorly"}}.
     * Absent keys keep their defaults; a relative dataDir resolves against the file's folder.
     */
    public static EngineConfig load(Path file) {
        FileForm form;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            form = new Gson().fromJson(reader, FileForm.class);
        } catch (IOException e) {
            throw DbException.io(e);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed engine config " + file + ": " + e.getMessage(), e);
        }
        if (form == null || form.dataDir == null) {
            throw new IllegalArgumentException("Engine config " + file + " has no dataDir");
        }
        Path base = file.toAbsolutePath().getParent();
        Builder b = builder().setDataDir(base.resolve(Paths.get(form.dataDir)));
        if (form.defaultDatabase != null) b.setDefaultDatabase(form.defaultDatabase);
        if (form.schemaFileName != null) b.setSchemaFileName(form.schemaFileName);
        return b.build();
    }

    @Override
    public String toString() {
        return String.format("EngineConfig{dataDir: %s, defaultDatabase: %s, schemaFileName: %s}",
            dataDir, defaultDatabase, schemaFileName);
    }

    // JSON shape of the config file
    private static final class FileForm {
        String dataDir;
        String defaultDatabase;
        String schemaFileName;
    }

    public static final class Builder {
        private Path dataDir;
        private String defaultDatabase = DEFAULT_DATABASE;
        private String schemaFileName = DEFAULT_SCHEMA_FILE;

        private Builder() {}

        public Builder setDataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        public Builder setDefaultDatabase(String defaultDatabase) {
            this.defaultDatabase = defaultDatabase;
            return this;
        }

        public Builder setSchemaFileName(String schemaFileName) {
            this.schemaFileName = schemaFileName;
            return this;
        }

        /**
         * The default database must be a valid database name. The schema file name must be a plain
         * file name that no table can take, so it may not itself be a valid table name.
         */
        public EngineConfig build() {
            if (dataDir == null) throw new IllegalArgumentException("dataDir required");
            if (defaultDatabase == null || defaultDatabase.isBlank()) throw new IllegalArgumentException("defaultDatabase required");
            if (schemaFileName == null || schemaFileName.isBlank()) throw new IllegalArgumentException("schemaFileName required");
            try {
                Schema.validateName(defaultDatabase);
            } catch (DbException e) {
                throw new IllegalArgumentException("Invalid defaultDatabase `" + defaultDatabase + "`", e);
            }
            if (isValidName(schemaFileName)) {
                throw new IllegalArgumentException("schemaFileName `" + schemaFileName + "` could clash with a table file");
            }
            if (schemaFileName.equals(".") || schemaFileName.equals("..")
                    || schemaFileName.indexOf('/') >= 0 || schemaFileName.indexOf('\\') >= 0) {
                throw new IllegalArgumentException("schemaFileName `" + schemaFileName + "` is not a plain file name");
            }
            return new EngineConfig(dataDir, defaultDatabase, schemaFileName);
        }

        private static boolean isValidName(String name) {
            try {
                Schema.validateName(name);
                return true;
            } catch (DbException e) {
                return false;
            }
        }
    }
}
