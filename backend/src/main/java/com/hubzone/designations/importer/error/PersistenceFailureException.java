package com.hubzone.designations.importer.error;

import com.hubzone.designations.importer.util.ImportErrorCodes;

public class PersistenceFailureException extends ImportException {
    public PersistenceFailureException(String message, Throwable cause) {
        super(message, null, cause);
    }

    @Override
    public String code() {
        return ImportErrorCodes.PERSISTENCE_FAILURE;
    }
}
