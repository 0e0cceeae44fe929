package db.poorly.exec;

/**
 * One equality pair of a join: {@code leftColumn} of the left row must equal {@code rightColumn}
 * of the right row. Column names carry the table prefix, e.g. {@code users.id}.
 */
public record JoinKey(String leftColumn, String rightColumn) {}
