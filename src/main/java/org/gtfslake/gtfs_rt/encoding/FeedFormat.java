package org.gtfslake.gtfs_rt.encoding;

/**
 * Wire format of a feed response, selected by the {@code f} query parameter.
 *
 * <p>{@code f=json} selects {@link #JSON}. A missing parameter, or any other
 * value, selects {@link #BINARY}.</p>
 *
 * @since 1.0
 */
public enum FeedFormat {

    /** GTFS-RT protocol buffer encoding. */
    BINARY("pbf", "application/octet-stream"),

    /** Protocol buffer JSON mapping with the schema's field names. */
    JSON("json", "application/json");

    private final String key;
    private final String contentType;

    FeedFormat(String key, String contentType) {
        this.key = key;
        this.contentType = contentType;
    }

    /**
     * @return short name used in cache keys
     */
    public String getKey() {
        return key;
    }

    /**
     * @return value of the response {@code Content-Type} header
     */
    public String getContentType() {
        return contentType;
    }

    /**
     * Interprets the format selector of a request.
     *
     * @param selector value of the {@code f} query parameter, may be {@code null}
     * @return {@link #JSON} for exactly {@code "json"}, {@link #BINARY} otherwise
     */
    public static FeedFormat fromSelector(String selector) {
        if (JSON.key.equals(selector)) {
            return JSON;
        }
        return BINARY;
    }
}
