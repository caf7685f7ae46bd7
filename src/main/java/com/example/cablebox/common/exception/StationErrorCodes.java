package com.example.cablebox.common.exception;

/**
 * Error codes carried by {@link BusinessException} for station generation.
 */
public final class StationErrorCodes {

    /** Station missing, owned by another user, or disabled. */
    public static final String STATION_UNAVAILABLE = "STATION_UNAVAILABLE";

    /** Rules match no catalog rows, or a preview batch used every candidate. */
    public static final String STATION_NO_CANDIDATES = "STATION_NO_CANDIDATES";

    public static final String STATION_RULES_INVALID = "STATION_RULES_INVALID";

    public static final String STREAM_ACCOUNT_MISSING = "STREAM_ACCOUNT_MISSING";

    private StationErrorCodes() {
    }
}
