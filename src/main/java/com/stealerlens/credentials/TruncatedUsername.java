package com.stealerlens.credentials;

/**
 * Outcome of fitting a username into the storage column limit.
 */
public final class TruncatedUsername {

    public static final int DEFAULT_MAX_LENGTH = 500;

    private final String value;
    private final boolean truncated;
    private final int originalLength;

    private TruncatedUsername(String value, boolean truncated, int originalLength) {
        this.value = value;
        this.truncated = truncated;
        this.originalLength = originalLength;
    }

    public static TruncatedUsername of(String username) {
        return of(username, DEFAULT_MAX_LENGTH);
    }

    /**
     * The first {@code maxLength} characters of the username, or the username unchanged when it fits.
     * A null username becomes the empty string.
     */
    public static TruncatedUsername of(String username, int maxLength) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        if (username == null || username.isEmpty()) {
            return new TruncatedUsername("", false, 0);
        }
        int length = username.length();
        if (length <= maxLength) {
            return new TruncatedUsername(username, false, length);
        }
        return new TruncatedUsername(username.substring(0, maxLength), true, length);
    }

    public String getValue() {
        return value;
    }

    public boolean wasTruncated() {
        return truncated;
    }

    public int getOriginalLength() {
        return originalLength;
    }
}
