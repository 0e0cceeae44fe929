package db.poorly.error;

/**
 * Coarse error kinds. Transport layers map these to their own status codes;
 * {@link #httpStatus()} gives the HTTP flavour.
 */
public enum ErrorCategory {
    NOT_FOUND(404),
    ALREADY_EXISTS(409),
    VALIDATION(400),
    PROTECTED(400),
    IO(500);

    private final int httpStatus;

    ErrorCategory(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() { return httpStatus; }
}
