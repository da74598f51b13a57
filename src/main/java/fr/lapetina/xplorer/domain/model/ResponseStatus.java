package fr.lapetina.xplorer.domain.model;

/**
 * Response status, mapped one-to-one onto HTTP status codes.
 */
public enum ResponseStatus {
    OK(200),
    BAD_REQUEST(400),
    NOT_FOUND(404),
    INTERNAL_ERROR(500);

    private final int code;

    ResponseStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Resolves a numeric code. Codes outside the known set map to {@link #INTERNAL_ERROR}.
     */
    public static ResponseStatus fromCode(int code) {
        for (ResponseStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        return INTERNAL_ERROR;
    }
}
