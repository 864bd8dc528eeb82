package com.hubzone.designations.importer.error;

import com.hubzone.designations.importer.model.DatasetSource;
import com.hubzone.designations.importer.util.ImportErrorCodes;

public class DatasetUnavailableException extends ImportException {
    private final DatasetSource source;
    private final String stateFips;

    public DatasetUnavailableException(DatasetSource source, String stateFips, String reason) {
        this(source, stateFips, reason, null);
    }

    public DatasetUnavailableException(DatasetSource source, String stateFips, String reason, Throwable cause) {
        super(buildMessage(source, stateFips, reason), null, cause);
        this.source = source;
        this.stateFips = stateFips;
    }

    @Override
    public String code() {
        return ImportErrorCodes.DATASET_UNAVAILABLE;
    }

    public DatasetSource source() {
        return source;
    }

    public String stateFips() {
        return stateFips;
    }

    private static String buildMessage(DatasetSource source, String stateFips, String reason) {
        String scope = stateFips == null ? "national" : "state " + stateFips;
        return "Dataset " + source.id() + " (" + scope + ") unavailable: " + reason;
    }
}
