package db.poorly.error;

import java.io.IOException;

import db.poorly.catalog.DataType;
import db.poorly.catalog.TypedValue;

/**
 * Failure of a single engine operation. Carries an {@link ErrorCode} so callers can
 * branch on the kind of failure instead of parsing the message.
 */
public class DbException extends RuntimeException {
    private static final long serialVersionUID = 5183012946655723904L;

    private final ErrorCode code;

    public DbException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public DbException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() { return code; }

    public ErrorCategory category() { return code.category(); }

    public int httpStatus() { return code.category().httpStatus(); }

    public static DbException tableAlreadyExists(String table) {
        return new DbException(ErrorCode.TABLE_ALREADY_EXISTS, "Table " + table + " already exists");
    }

    public static DbException tableNotFound(String table) {
        return new DbException(ErrorCode.TABLE_NOT_FOUND, "Table " + table + " not found");
    }

    public static DbException databaseNotFound(String db) {
        return new DbException(ErrorCode.DATABASE_NOT_FOUND, "Database " + db + " not found");
    }

    public static DbException databaseAlreadyExists(String db) {
        return new DbException(ErrorCode.DATABASE_ALREADY_EXISTS, "Database " + db + " already exists");
    }

    public static DbException cannotDropDefaultDb() {
        return new DbException(ErrorCode.CANNOT_DROP_DEFAULT_DB, "Cannot drop default database");
    }

    public static DbException columnAlreadyExists(String column, String table) {
        return new DbException(ErrorCode.COLUMN_ALREADY_EXISTS, "Column " + column + " already exists in table " + table);
    }

    public static DbException noColumns() {
        return new DbException(ErrorCode.NO_COLUMNS, "Can't create a table without columns");
    }

    public static DbException columnNotFound(String column, String table) {
        return new DbException(ErrorCode.COLUMN_NOT_FOUND, "Column " + column + " not found in table " + table);
    }

    public static DbException invalidName(String name) {
        return new DbException(ErrorCode.INVALID_NAME, "Name " + name + " cannot be used for a table or a column");
    }

    public static DbException invalidEmail() {
        return new DbException(ErrorCode.INVALID_EMAIL, "Invalid email format");
    }

    public static DbException invalidValue(TypedValue value, DataType target) {
        return new DbException(ErrorCode.INVALID_VALUE, "Invalid value " + value + " for datatype " + target.keyword());
    }

    public static DbException incompleteData(String column, String table) {
        return new DbException(ErrorCode.INCOMPLETE_DATA, "Incomplete data - missing " + column + " for table " + table);
    }

    public static DbException invalidDataType(String name) {
        return new DbException(ErrorCode.INVALID_DATA_TYPE, "Invalid datatype: " + name);
    }

    public static DbException invalidOperation(String reason) {
        return new DbException(ErrorCode.INVALID_OPERATION, "Invalid operation: " + reason);
    }

    public static DbException io(IOException cause) {
        return new DbException(ErrorCode.IO_ERROR, "IO Error: " + cause.getMessage(), cause);
    }
}
