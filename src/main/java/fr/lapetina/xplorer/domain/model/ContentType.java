package fr.lapetina.xplorer.domain.model;

import java.util.Locale;

/**
 * Content types an endpoint may answer with.
 */
public enum ContentType {
    JSON("application/json"),
    HTML("text/html"),
    TEXT("text/plain"),
    PNG("image/png"),
    JPEG("image/jpeg"),
    BINARY("application/octet-stream");

    private final String mimeType;

    ContentType(String mimeType) {
        this.mimeType = mimeType;
    }

    public String mimeType() {
        return mimeType;
    }

    /**
     * Resolves a MIME type, ignoring parameters such as {@code ; charset=utf-8}.
     * Unknown or missing types resolve to {@link #BINARY}.
     */
    public static ContentType fromMimeType(String value) {
        if (value == null) {
            return BINARY;
        }
        int separator = value.indexOf(';');
        String bare = (separator >= 0 ? value.substring(0, separator) : value)
                .trim()
                .toLowerCase(Locale.ROOT);
        for (ContentType type : values()) {
            if (type.mimeType.equals(bare)) {
                return type;
            }
        }
        return BINARY;
    }
}
