package com.hubzone.designations.importer.util;

public final class ImportErrorCodes {
    public static final String DATASET_UNAVAILABLE = "DATASET_UNAVAILABLE";
    public static final String EVALUATION_DATA_MISSING = "EVALUATION_DATA_MISSING";
    public static final String RECONCILIATION_CONFLICT = "RECONCILIATION_CONFLICT";
    public static final String PERSISTENCE_FAILURE = "PERSISTENCE_FAILURE";
    public static final String GEOSPATIAL_RESOLUTION_ERROR = "GEOSPATIAL_RESOLUTION_ERROR";
    public static final String MALFORMED_FEED_ROW = "MALFORMED_FEED_ROW";
    public static final String NOTIFICATION_HANDOFF_FAILED = "NOTIFICATION_HANDOFF_FAILED";
    public static final String ATTEMPT_FAILED = "ATTEMPT_FAILED";
    public static final String FEED_FALLBACK_USED = "FEED_FALLBACK_USED";
    public static final String ADMIN_NOTICE_FAILED = "ADMIN_NOTICE_FAILED";
    public static final String IMPORT_TIMEOUT = "IMPORT_TIMEOUT";
    public static final String IMPORT_CANCELLED = "IMPORT_CANCELLED";
    public static final String ABANDONED_ON_STARTUP = "ABANDONED_ON_STARTUP";
    public static final String LEASE_EXPIRED = "LEASE_EXPIRED";
    public static final String LEASE_LOST = "LEASE_LOST";
    public static final String UNKNOWN_STATE = "UNKNOWN_STATE";
    public static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";

    private ImportErrorCodes() {
    }
}
