package db.poorly.error;

public enum ErrorCode {
    TABLE_ALREADY_EXISTS(ErrorCategory.ALREADY_EXISTS),
    TABLE_NOT_FOUND(ErrorCategory.NOT_FOUND),
    DATABASE_NOT_FOUND(ErrorCategory.NOT_FOUND),
    DATABASE_ALREADY_EXISTS(ErrorCategory.ALREADY_EXISTS),
    CANNOT_DROP_DEFAULT_DB(ErrorCategory.PROTECTED),
    COLUMN_ALREADY_EXISTS(ErrorCategory.ALREADY_EXISTS),
    NO_COLUMNS(ErrorCategory.VALIDATION),
    COLUMN_NOT_FOUND(ErrorCategory.NOT_FOUND),
    INVALID_NAME(ErrorCategory.VALIDATION),
    INVALID_EMAIL(ErrorCategory.VALIDATION),
    INVALID_VALUE(ErrorCategory.VALIDATION),
    INCOMPLETE_DATA(ErrorCategory.VALIDATION),
    INVALID_DATA_TYPE(ErrorCategory.VALIDATION),
    INVALID_OPERATION(ErrorCategory.VALIDATION),
    IO_ERROR(ErrorCategory.IO);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() { return category; }
}
