package db.poorly.query;

/**
 * A request to the engine. Front-ends (network, CLI) translate their input into one of
 * these and hand it to {@code Engine.execute}.
 */
public sealed interface Query
    permits SelectQuery, InsertQuery, UpdateQuery, DeleteQuery, CreateQuery, CreateDbQuery,
            DropQuery, DropDbQuery, AlterQuery, ShowTablesQuery, JoinQuery {
}
