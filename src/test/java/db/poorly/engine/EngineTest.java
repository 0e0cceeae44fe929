package db.poorly.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.poorly.catalog.Column;
import db.poorly.catalog.DataType;
import db.poorly.catalog.TypedValue;
import db.poorly.error.DbException;
import db.poorly.error.ErrorCategory;
import db.poorly.error.ErrorCode;
import db.poorly.exec.ColumnSet;
import db.poorly.exec.JoinKey;
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

public class EngineTest {
    private static final String DB = EngineConfig.DEFAULT_DATABASE;

    @TempDir
    Path dataDir;

    private Engine engine;

    @BeforeEach
    void setUp() {
        engine = Engine.open(EngineConfig.forDataDir(dataDir));
        engine.init();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private List<ColumnSet> run(Query q) {
        return engine.execute(q);
    }

    private DbException failure(Query q) {
        return assertThrows(DbException.class, () -> engine.execute(q));
    }

    private void createUsers() {
        run(new CreateQuery(DB, "users", List.of(
            new Column("id", DataType.SERIAL), new Column("name", DataType.STRING), new Column("mail", DataType.EMAIL))));
    }

    private static ColumnSet user(String name, String mail) {
        return ColumnSet.of("name", TypedValue.ofString(name), "mail", TypedValue.ofString(mail));
    }

    @Test
    void initIsIdempotent() {
        engine.init();
        engine.init();
        assertTrue(Files.isDirectory(dataDir.resolve(DB)));
        assertEquals(List.of(), engine.listTables(DB));
    }

    @Test
    void crudThroughExecute() {
        createUsers();
        List<ColumnSet> inserted = run(new InsertQuery(DB, "users", user("ann", "ann@mail.com")));
        assertEquals(1, inserted.size());
        assertEquals(TypedValue.ofSerial(0), inserted.get(0).get("id"));
        assertEquals(TypedValue.ofEmail("ann@mail.com"), inserted.get(0).get("mail"));
        run(new InsertQuery(DB, "users", user("bob", "bob@mail.com")));

        List<ColumnSet> all = run(new SelectQuery(DB, "users", List.of(), null));
        assertEquals(2, all.size());
        assertEquals(inserted.get(0), all.get(0));

        List<ColumnSet> updated = run(new UpdateQuery(DB, "users",
            ColumnSet.of("name", TypedValue.ofString("robert")), ColumnSet.of("name", TypedValue.ofString("bob"))));
        assertEquals(TypedValue.ofSerial(1), updated.get(0).get("id"));

        assertEquals(List.of(ColumnSet.of("name", TypedValue.ofString("robert"))),
            run(new SelectQuery(DB, "users", List.of("name"), ColumnSet.of("id", TypedValue.ofInt(1)))));

        assertEquals(1, run(new DeleteQuery(DB, "users", ColumnSet.of("name", TypedValue.ofString("ann")))).size());
        assertEquals(1, run(new SelectQuery(DB, "users", List.of(), null)).size());
    }

    @Test
    void schemaQueriesReturnNoRows() {
        assertEquals(List.of(), run(new CreateDbQuery("other")));
        assertEquals(List.of(), run(new CreateQuery("other", "t", List.of(new Column("a", DataType.INT)))));
        assertEquals(List.of(), run(new AlterQuery("other", "t", Map.of("a", "b"))));
        assertEquals(List.of(), run(new DropQuery("other", "t")));
        assertEquals(List.of(), run(new DropDbQuery("other")));
        assertFalse(Files.exists(dataDir.resolve("other")));
    }

    @Test
    void showTablesReturnsOneMarkerRow() {
        createUsers();
        run(new CreateQuery(DB, "items", List.of(new Column("price", DataType.FLOAT))));
        List<ColumnSet> rows = run(new ShowTablesQuery(DB));
        assertEquals(1, rows.size());
        assertEquals(ColumnSet.of("users", TypedValue.ofString("table"), "items", TypedValue.ofString("table")), rows.get(0));
        assertEquals(List.of("users", "items"), engine.listTables(DB));
    }

    @Test
    void joinAcrossTables() {
        run(new CreateQuery(DB, "join1", List.of(new Column("id", DataType.INT), new Column("email", DataType.EMAIL))));
        run(new CreateQuery(DB, "join2", List.of(new Column("id", DataType.INT), new Column("email", DataType.EMAIL))));
        run(new InsertQuery(DB, "join1", ColumnSet.of("id", TypedValue.ofInt(1), "email", TypedValue.ofString("test@gmail.com"))));
        run(new InsertQuery(DB, "join1", ColumnSet.of("id", TypedValue.ofInt(2), "email", TypedValue.ofString("test2@gmail.com"))));
        run(new InsertQuery(DB, "join2", ColumnSet.of("id", TypedValue.ofInt(1), "email", TypedValue.ofString("table2@gmail.com"))));
        run(new InsertQuery(DB, "join2", ColumnSet.of("id", TypedValue.ofInt(2), "email", TypedValue.ofString("table22@gmail.com"))));

        List<ColumnSet> rows = run(new JoinQuery(DB, "join1", "join2", List.of(),
            ColumnSet.of("join1.id", TypedValue.ofInt(1)), List.of(new JoinKey("join1.id", "join2.id"))));
        assertEquals(1, rows.size());
        assertEquals(TypedValue.ofEmail("table2@gmail.com"), rows.get(0).get("join2.email"));
        assertEquals(4, rows.get(0).size());

        assertEquals(ErrorCode.TABLE_NOT_FOUND, failure(new JoinQuery(DB, "join1", "ghost", null, null, null)).code());
    }

    @Test
    void errorsCarryCodesAndCategories() {
        createUsers();
        DbException e = failure(new SelectQuery(DB, "ghost", null, null));
        assertEquals(ErrorCode.TABLE_NOT_FOUND, e.code());
        assertEquals(404, e.httpStatus());

        e = failure(new SelectQuery("nodb", "users", null, null));
        assertEquals(ErrorCode.DATABASE_NOT_FOUND, e.code());

        e = failure(new CreateDbQuery(DB));
        assertEquals(ErrorCategory.ALREADY_EXISTS, e.category());
        assertEquals(409, e.httpStatus());

        e = failure(new InsertQuery(DB, "users", user("x", "not-an-email")));
        assertEquals(ErrorCode.INVALID_EMAIL, e.code());
        assertEquals(400, e.httpStatus());

        e = failure(new InsertQuery(DB, "users", ColumnSet.of("id", TypedValue.ofInt(3), "name", TypedValue.ofString("x"),
            "mail", TypedValue.ofString("x@y.zz"))));
        assertEquals(ErrorCode.INVALID_OPERATION, e.code());

        e = failure(new CreateQuery(DB, "empty", List.of()));
        assertEquals(ErrorCode.NO_COLUMNS, e.code());

        e = failure(new DropDbQuery(DB));
        assertEquals(ErrorCode.CANNOT_DROP_DEFAULT_DB, e.code());
        assertEquals(ErrorCategory.PROTECTED, e.category());
    }

    @Test
    void databaseNamesAreValidated() {
        assertEquals(ErrorCode.INVALID_NAME, failure(new CreateDbQuery("../escape")).code());
        assertEquals(ErrorCode.INVALID_NAME, failure(new ShowTablesQuery("")).code());
        assertFalse(Files.exists(dataDir.getParent().resolve("escape")));
    }

    @Test
    void droppedDatabaseCanBeRecreated() {
        run(new CreateDbQuery("tmp"));
        run(new CreateQuery("tmp", "t", List.of(new Column("a", DataType.INT))));
        run(new InsertQuery("tmp", "t", ColumnSet.of("a", TypedValue.ofInt(1))));
        run(new DropDbQuery("tmp"));
        assertEquals(ErrorCode.DATABASE_NOT_FOUND, failure(new ShowTablesQuery("tmp")).code());

        run(new CreateDbQuery("tmp"));
        assertEquals(List.of(), engine.listTables("tmp"));
    }

    @Test
    void dataSurvivesRestart() {
        createUsers();
        run(new InsertQuery(DB, "users", user("ann", "ann@mail.com")));
        engine.close();

        engine = Engine.open(EngineConfig.forDataDir(dataDir));
        engine.init();
        List<ColumnSet> rows = run(new SelectQuery(DB, "users", List.of("name"), null));
        assertEquals(List.of(ColumnSet.of("name", TypedValue.ofString("ann"))), rows);
        assertEquals(TypedValue.ofSerial(1), run(new InsertQuery(DB, "users", user("bob", "bob@mail.com"))).get(0).get("id"));
    }

    @Test
    void closedEngineRefusesWork() {
        engine.close();
        assertEquals(ErrorCode.INVALID_OPERATION, failure(new ShowTablesQuery(DB)).code());
    }

    @Test
    void describeShowsSchema() {
        createUsers();
        assertThat(engine.describe(DB)).contains("\"users\"").contains("\"mail\": \"email\"");
    }

    @Test
    void dataDirMustBeADirectory() throws IOException {
        Path file = Files.createFile(dataDir.resolve("plain-file"));
        assertThatThrownBy(() -> Engine.open(EngineConfig.forDataDir(file)))
            .isInstanceOf(DbException.class)
            .hasMessageContaining("is not a directory");
    }

    @Test
    void rowsRenderAsJson() {
        ColumnSet row = ColumnSet.of("id", TypedValue.ofSerial(3), "price", TypedValue.ofFloat(1.5), "name", TypedValue.ofString("ann"));
        String json = Engine.gson().toJson(row);
        assertEquals("{\"id\":3,\"price\":1.5,\"name\":\"ann\"}", json);

        ColumnSet back = Engine.gson().fromJson("{\"id\":3,\"price\":1.5,\"initial\":\"a\"}", ColumnSet.class);
        assertEquals(ColumnSet.of("id", TypedValue.ofInt(3), "price", TypedValue.ofFloat(1.5), "initial", TypedValue.ofChar('a')), back);
    }
}
